/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import org.docstore.aggregation.pipeline.stage.Stage;
import org.docstore.aggregation.pipeline.stage.StageKind;

/**
 * An ordered, immutable sequence of stages. The planner only reads pipelines; it never reorders or
 * rewrites them.
 */
@EqualsAndHashCode
public class Pipeline {

  private final List<Stage> stages;

  private Pipeline(List<Stage> stages) {
    this.stages = ImmutableList.copyOf(stages);
  }

  public static Pipeline of(Stage... stages) {
    return new Pipeline(List.of(stages));
  }

  public static Pipeline of(List<Stage> stages) {
    return new Pipeline(stages);
  }

  public List<Stage> getStages() {
    return stages;
  }

  public boolean isEmpty() {
    return stages.isEmpty();
  }

  public int size() {
    return stages.size();
  }

  /** Returns the final stage, or empty for an empty pipeline. */
  public Optional<Stage> getLastStage() {
    return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1));
  }

  /** Returns every stage except the last one. */
  public List<Stage> getStagesBeforeLast() {
    return stages.isEmpty() ? List.of() : stages.subList(0, stages.size() - 1);
  }

  /** Returns true if any stage is of the given kind. */
  public boolean contains(StageKind kind) {
    return stages.stream().anyMatch(stage -> stage.getKind() == kind);
  }

  @Override
  public String toString() {
    return "Pipeline" + stages;
  }
}
