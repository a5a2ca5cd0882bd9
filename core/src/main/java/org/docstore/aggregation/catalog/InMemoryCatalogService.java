/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.catalog;

import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.log4j.Log4j2;
import org.docstore.aggregation.catalog.model.CollectionMetadata;
import org.docstore.aggregation.catalog.model.CollectionRoutingInfo;
import org.docstore.aggregation.partition.PartitionMap;
import org.docstore.aggregation.pipeline.Namespace;
import org.docstore.aggregation.planner.PlanningContext;

/**
 * {@link CatalogService} holding routing metadata in memory. Registering a collection implicitly
 * creates its database. Safe for concurrent readers and writers; every lookup returns the state
 * as of the moment it ran.
 */
@Log4j2
public class InMemoryCatalogService implements CatalogService {

  private final Map<String, Map<String, CollectionRoutingInfo>> databases =
      new ConcurrentHashMap<>();

  /**
   * Loads collections from a JSON document in the {@link CollectionMetadata} format.
   *
   * @param inputStream json input
   * @return catalog holding every described collection
   */
  public static InMemoryCatalogService fromInputStream(InputStream inputStream) {
    InMemoryCatalogService catalog = new InMemoryCatalogService();
    catalog.load(CollectionMetadata.fromInputStream(inputStream));
    return catalog;
  }

  /** Registers every collection of the list, replacing existing entries with the same name. */
  public void load(List<CollectionMetadata> collections) {
    for (CollectionMetadata metadata : collections) {
      if (metadata.isPartitioned()) {
        registerPartitionedCollection(metadata.toNamespace(), metadata.toPartitionMap());
      } else {
        registerUnpartitionedCollection(metadata.toNamespace());
      }
    }
  }

  public void createDatabase(String database) {
    databases.computeIfAbsent(database, db -> new ConcurrentHashMap<>());
  }

  public void registerUnpartitionedCollection(Namespace namespace) {
    register(namespace, CollectionRoutingInfo.unpartitioned());
  }

  public void registerPartitionedCollection(Namespace namespace, PartitionMap partitionMap) {
    register(namespace, CollectionRoutingInfo.partitioned(partitionMap));
  }

  public void dropCollection(Namespace namespace) {
    Map<String, CollectionRoutingInfo> collections = databases.get(namespace.getDatabase());
    if (collections != null) {
      collections.remove(namespace.getCollection());
    }
  }

  public void dropDatabase(String database) {
    databases.remove(database);
  }

  @Override
  public CollectionRoutingInfo getCollectionRoutingInfo(
      PlanningContext context, Namespace namespace) {
    context.checkForInterrupt();
    Map<String, CollectionRoutingInfo> collections = databases.get(namespace.getDatabase());
    if (collections == null) {
      return CollectionRoutingInfo.databaseNotFound();
    }
    return collections.getOrDefault(
        namespace.getCollection(), CollectionRoutingInfo.collectionNotFound());
  }

  private void register(Namespace namespace, CollectionRoutingInfo routingInfo) {
    databases
        .computeIfAbsent(namespace.getDatabase(), db -> new ConcurrentHashMap<>())
        .put(namespace.getCollection(), routingInfo);
    log.info("Registered collection {} as {}", namespace, routingInfo.getStatus());
  }
}
