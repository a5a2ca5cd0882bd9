/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

import com.google.common.base.Preconditions;

/** Drops the first {@code skip} documents. */
public record SkipStage(long skip) implements Stage {

  public SkipStage {
    Preconditions.checkArgument(skip >= 0, "Skip must not be negative but was %s", skip);
  }

  @Override
  public StageKind getKind() {
    return StageKind.SKIP;
  }

  @Override
  public String toString() {
    return "$skip: " + skip;
  }
}
