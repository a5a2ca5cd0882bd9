/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

/**
 * Filters documents by a predicate. Documents that pass are not modified.
 *
 * @param predicate textual form of the filter, used for display only
 */
public record MatchStage(String predicate) implements Stage {

  @Override
  public StageKind getKind() {
    return StageKind.MATCH;
  }

  @Override
  public String toString() {
    return "$match: " + predicate;
  }
}
