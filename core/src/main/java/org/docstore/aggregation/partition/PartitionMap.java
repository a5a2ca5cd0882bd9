/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.partition;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Point-in-time routing table of a partitioned collection: chunks sorted by range start that
 * together cover the key space from all-MinKey to all-MaxKey with no gaps or overlaps. Each chunk
 * is owned by exactly one shard.
 */
@Getter
@EqualsAndHashCode
public class PartitionMap {

  private final PartitionKeyPattern keyPattern;

  private final List<PartitionChunk> chunks;

  /**
   * Constructor.
   *
   * @param keyPattern physical key pattern of the collection
   * @param chunks chunks ordered by range start
   * @throws IllegalArgumentException if the chunks do not tile the key space
   */
  public PartitionMap(PartitionKeyPattern keyPattern, List<PartitionChunk> chunks) {
    Preconditions.checkArgument(!chunks.isEmpty(), "Partition map must have at least one chunk");
    for (PartitionChunk chunk : chunks) {
      Preconditions.checkArgument(
          chunk.getMin().matches(keyPattern),
          "Chunk %s does not match key pattern %s",
          chunk,
          keyPattern);
    }
    Preconditions.checkArgument(
        chunks.get(0).getMin().isAll(KeySentinel.MIN_KEY),
        "First chunk must start at MinKey but starts at %s",
        chunks.get(0).getMin());
    Preconditions.checkArgument(
        chunks.get(chunks.size() - 1).getMax().isAll(KeySentinel.MAX_KEY),
        "Last chunk must end at MaxKey but ends at %s",
        chunks.get(chunks.size() - 1).getMax());
    for (int i = 1; i < chunks.size(); i++) {
      Preconditions.checkArgument(
          chunks.get(i - 1).getMax().equals(chunks.get(i).getMin()),
          "Chunks %s and %s are not contiguous",
          chunks.get(i - 1),
          chunks.get(i));
    }
    this.keyPattern = keyPattern;
    this.chunks = ImmutableList.copyOf(chunks);
  }

  /** Returns the owning shards in order of their first chunk. */
  public Set<String> getShardIds() {
    Set<String> shardIds = new LinkedHashSet<>();
    chunks.forEach(chunk -> shardIds.add(chunk.shardId()));
    return shardIds;
  }

  @Override
  public String toString() {
    return "PartitionMap{key=" + keyPattern + ", chunks=" + chunks.size() + '}';
  }
}
