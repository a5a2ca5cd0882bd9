/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.catalog.model;

import com.google.common.base.Preconditions;
import java.util.Objects;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.docstore.aggregation.partition.PartitionKeyPattern;
import org.docstore.aggregation.partition.PartitionMap;

/** Catalog answer for one namespace. */
@Getter
@ToString
@EqualsAndHashCode
public class CollectionRoutingInfo {

  /** Where the namespace stands in the catalog. */
  public enum Status {
    DATABASE_NOT_FOUND,
    COLLECTION_NOT_FOUND,
    UNPARTITIONED,
    PARTITIONED
  }

  private final Status status;

  private final PartitionMap partitionMap;

  private CollectionRoutingInfo(Status status, PartitionMap partitionMap) {
    this.status = status;
    this.partitionMap = partitionMap;
  }

  public static CollectionRoutingInfo databaseNotFound() {
    return new CollectionRoutingInfo(Status.DATABASE_NOT_FOUND, null);
  }

  public static CollectionRoutingInfo collectionNotFound() {
    return new CollectionRoutingInfo(Status.COLLECTION_NOT_FOUND, null);
  }

  public static CollectionRoutingInfo unpartitioned() {
    return new CollectionRoutingInfo(Status.UNPARTITIONED, null);
  }

  public static CollectionRoutingInfo partitioned(PartitionMap partitionMap) {
    return new CollectionRoutingInfo(
        Status.PARTITIONED, Objects.requireNonNull(partitionMap, "partitionMap"));
  }

  public boolean exists() {
    return status == Status.UNPARTITIONED || status == Status.PARTITIONED;
  }

  public boolean isPartitioned() {
    return status == Status.PARTITIONED;
  }

  /** Physical key pattern of a partitioned collection. */
  public Optional<PartitionKeyPattern> getKeyPattern() {
    return Optional.ofNullable(partitionMap).map(PartitionMap::getKeyPattern);
  }

  /**
   * Returns the partition map of a partitioned collection.
   *
   * @throws IllegalStateException if the collection is not partitioned
   */
  public PartitionMap getPartitionMapOrThrow() {
    Preconditions.checkState(isPartitioned(), "Collection is not partitioned: %s", status);
    return partitionMap;
  }
}
