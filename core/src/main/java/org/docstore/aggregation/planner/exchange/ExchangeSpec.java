/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.docstore.aggregation.partition.KeyRange;
import org.docstore.aggregation.partition.PartitionKeyPattern;

/**
 * Describes the exchange to insert into a merge pipeline: partition documents by {@code
 * keyPattern} at stage {@code splitPointIndex} and send each one to the shard whose ranges contain
 * its key.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ExchangeSpec {

  private final ExchangePolicy policy;

  /** Key at the split point, in destination key order. */
  private final PartitionKeyPattern keyPattern;

  /** Shard id to its ranges over {@link #keyPattern}, in routing table order. */
  private final Map<String, List<KeyRange>> partitions;

  /** Index of the first merge stage that runs after the exchange. */
  private final int splitPointIndex;

  /** Bytes each consumer may buffer before the producer blocks. */
  private final int bufferSizeBytes;

  public ExchangeSpec(
      ExchangePolicy policy,
      PartitionKeyPattern keyPattern,
      Map<String, List<KeyRange>> partitions,
      int splitPointIndex,
      int bufferSizeBytes) {
    this.policy = policy;
    this.keyPattern = keyPattern;
    ImmutableMap.Builder<String, List<KeyRange>> copy = ImmutableMap.builder();
    partitions.forEach((shard, ranges) -> copy.put(shard, ImmutableList.copyOf(ranges)));
    this.partitions = copy.build();
    this.splitPointIndex = splitPointIndex;
    this.bufferSizeBytes = bufferSizeBytes;
  }

  /** One consumer per owning shard. */
  public int getConsumerCount() {
    return partitions.size();
  }

  /** Returns the ranges routed to a shard, or an empty list if it owns none. */
  public List<KeyRange> getRanges(String shardId) {
    return partitions.getOrDefault(shardId, List.of());
  }
}
