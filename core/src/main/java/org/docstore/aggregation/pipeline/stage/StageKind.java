/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

/** Closed set of stage kinds known to the exchange planner. */
public enum StageKind {
  GROUP,
  PROJECT,
  ADD_FIELDS,
  LIMIT,
  SKIP,
  MATCH,
  SORT,
  WRITE,
  /** Any stage the planner does not understand. */
  OTHER
}
