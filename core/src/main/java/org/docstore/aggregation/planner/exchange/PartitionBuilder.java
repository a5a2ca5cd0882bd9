/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.docstore.aggregation.common.utils.StringUtils;
import org.docstore.aggregation.partition.KeyRange;
import org.docstore.aggregation.partition.PartitionChunk;
import org.docstore.aggregation.partition.PartitionKeyPattern;
import org.docstore.aggregation.partition.PartitionMap;

/**
 * Translates the destination's chunk ranges into the field names of the split point. Boundary
 * values are copied unchanged: renaming a field does not move its value in the sort order.
 */
public class PartitionBuilder {

  /**
   * Groups translated ranges by owning shard. Shards appear in order of their first chunk and each
   * shard's ranges keep their order in the partition map.
   *
   * @param splitPointKey key pattern at the split point, positionally matching the destination key
   * @param partitionMap destination routing table
   * @return shard id to its translated ranges
   * @throws IllegalStateException if the split point key and the partition map disagree in arity
   */
  public Map<String, List<KeyRange>> build(
      PartitionKeyPattern splitPointKey, PartitionMap partitionMap) {
    if (splitPointKey.size() != partitionMap.getKeyPattern().size()) {
      throw new IllegalStateException(
          StringUtils.format(
              "Split point key %s does not match destination key %s",
              splitPointKey, partitionMap.getKeyPattern()));
    }
    Map<String, ImmutableList.Builder<KeyRange>> rangesByShard = new LinkedHashMap<>();
    for (PartitionChunk chunk : partitionMap.getChunks()) {
      rangesByShard
          .computeIfAbsent(chunk.shardId(), shard -> ImmutableList.builder())
          .add(chunk.range().withFieldNames(splitPointKey.fields()));
    }
    ImmutableMap.Builder<String, List<KeyRange>> partitions = ImmutableMap.builder();
    rangesByShard.forEach((shard, ranges) -> partitions.put(shard, ranges.build()));
    return partitions.build();
  }
}
