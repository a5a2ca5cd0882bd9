/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.partition;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.Objects;

/**
 * A key range and the shard that owns it.
 *
 * @param range owned range
 * @param shardId owning shard
 */
public record PartitionChunk(KeyRange range, String shardId) {

  public PartitionChunk {
    Objects.requireNonNull(range, "range");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(shardId), "Chunk owner is required");
  }

  public KeyBound getMin() {
    return range.min();
  }

  public KeyBound getMax() {
    return range.max();
  }

  @Override
  public String toString() {
    return range + " -> " + shardId;
  }
}
