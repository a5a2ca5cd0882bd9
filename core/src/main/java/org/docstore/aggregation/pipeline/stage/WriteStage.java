/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

import java.util.Objects;
import org.docstore.aggregation.pipeline.Namespace;

/**
 * Writes every document to a destination collection. Must be the last stage of a pipeline.
 *
 * @param target destination namespace
 * @param mode write mode
 */
public record WriteStage(Namespace target, WriteMode mode) implements Stage {

  public WriteStage {
    Objects.requireNonNull(target, "Write target is required");
    Objects.requireNonNull(mode, "Write mode is required");
  }

  @Override
  public StageKind getKind() {
    return StageKind.WRITE;
  }

  @Override
  public String toString() {
    return "$out{to: " + target + ", mode: " + mode + "}";
  }
}
