/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

/**
 * A stage the planner cannot analyse, such as {@code $unwind} or {@code $lookup}.
 *
 * @param name stage name
 */
public record OtherStage(String name) implements Stage {

  @Override
  public StageKind getKind() {
    return StageKind.OTHER;
  }

  @Override
  public String toString() {
    return name;
  }
}
