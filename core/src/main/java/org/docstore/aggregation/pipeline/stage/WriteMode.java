/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

/** How a {@link WriteStage} treats its destination collection. */
public enum WriteMode {
  /** Insert into the existing collection, keeping its partitioning. */
  INSERT_DOCUMENTS,

  /** Replace the collection with a freshly created, unpartitioned one. */
  REPLACE_COLLECTION
}
