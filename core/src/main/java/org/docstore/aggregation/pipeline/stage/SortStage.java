/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

import java.util.List;

/**
 * Orders documents without modifying them.
 *
 * @param sortFields field paths in sort order
 */
public record SortStage(List<String> sortFields) implements Stage {

  public SortStage {
    sortFields = List.copyOf(sortFields);
  }

  @Override
  public StageKind getKind() {
    return StageKind.SORT;
  }

  @Override
  public String toString() {
    return "$sort: " + sortFields;
  }
}
