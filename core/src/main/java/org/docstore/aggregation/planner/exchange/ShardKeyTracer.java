/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.docstore.aggregation.partition.PartitionKeyPattern;
import org.docstore.aggregation.pipeline.stage.GroupStage;
import org.docstore.aggregation.pipeline.stage.Stage;
import org.docstore.aggregation.pipeline.stage.StageKind;

/**
 * Walks a merge pipeline backwards from the write and follows each destination key field through
 * pure renames. The walk stops at the first merging group, which becomes the split point, or at
 * the front of the pipeline.
 *
 * <p>Tracing is all or nothing: if a single key field cannot be followed the pipeline gets no
 * exchange, because an unproven field may be an array or a computed value.
 */
@Log4j2
@RequiredArgsConstructor
public class ShardKeyTracer {

  private final FieldLineageExtractor lineageExtractor;

  public ShardKeyTracer() {
    this(new FieldLineageExtractor());
  }

  /**
   * Traces the destination key back to the split point.
   *
   * @param stages merge pipeline stages, without the final write
   * @param destinationKey physical key pattern of the destination collection
   * @return the split point, or empty if some key field cannot be traced
   */
  public Optional<SplitPoint> trace(List<Stage> stages, PartitionKeyPattern destinationKey) {
    List<String> pending = new ArrayList<>(destinationKey.fields());
    for (int i = stages.size() - 1; i >= 0; i--) {
      Stage stage = stages.get(i);
      boolean splitPoint = isMergingGroup(stage);
      FieldLineage lineage =
          splitPoint
              ? lineageExtractor.extractAtSplitPoint((GroupStage) stage)
              : lineageExtractor.extract(stage);
      for (int f = 0; f < pending.size(); f++) {
        Optional<String> resolved = lineage.resolve(pending.get(f));
        if (resolved.isEmpty()) {
          log.debug(
              "Cannot trace key field '{}' through stage {} ({})", pending.get(f), i, stage);
          return Optional.empty();
        }
        pending.set(f, resolved.get());
      }
      if (splitPoint) {
        log.debug("Split point at merging group, stage {}: key {}", i, pending);
        return Optional.of(new SplitPoint(i, new PartitionKeyPattern(pending)));
      }
    }
    log.debug("Split point at front of pipeline: key {}", pending);
    return Optional.of(new SplitPoint(0, new PartitionKeyPattern(pending)));
  }

  private static boolean isMergingGroup(Stage stage) {
    return stage.getKind() == StageKind.GROUP && ((GroupStage) stage).merging();
  }
}
