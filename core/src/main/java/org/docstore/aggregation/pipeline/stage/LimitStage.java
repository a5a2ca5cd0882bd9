/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

import com.google.common.base.Preconditions;

/** Passes through at most {@code limit} documents. */
public record LimitStage(long limit) implements Stage {

  public LimitStage {
    Preconditions.checkArgument(limit > 0, "Limit must be positive but was %s", limit);
  }

  @Override
  public StageKind getKind() {
    return StageKind.LIMIT;
  }

  @Override
  public String toString() {
    return "$limit: " + limit;
  }
}
