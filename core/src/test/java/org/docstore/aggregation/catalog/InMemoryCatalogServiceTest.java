/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.docstore.aggregation.catalog.model.CollectionRoutingInfo;
import org.docstore.aggregation.catalog.model.CollectionRoutingInfo.Status;
import org.docstore.aggregation.exception.OperationCancelledException;
import org.docstore.aggregation.partition.KeyBound;
import org.docstore.aggregation.partition.KeyRange;
import org.docstore.aggregation.partition.KeySentinel;
import org.docstore.aggregation.partition.PartitionChunk;
import org.docstore.aggregation.partition.PartitionKeyPattern;
import org.docstore.aggregation.partition.PartitionMap;
import org.docstore.aggregation.pipeline.Namespace;
import org.docstore.aggregation.planner.PlanningContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class InMemoryCatalogServiceTest {

  private static final Namespace WORD_COUNTS = Namespace.parse("analytics.word_counts");

  private InMemoryCatalogService catalog;

  private PlanningContext context;

  @BeforeEach
  void setUp() {
    catalog =
        InMemoryCatalogService.fromInputStream(
            getClass().getClassLoader().getResourceAsStream("catalog/word_count_catalog.json"));
    context = PlanningContext.emptyPlanningContext();
  }

  @Test
  void lookup_reports_every_status() {
    assertEquals(Status.PARTITIONED, lookup("analytics.word_counts").getStatus());
    assertEquals(Status.UNPARTITIONED, lookup("staging.raw_words").getStatus());
    assertEquals(Status.COLLECTION_NOT_FOUND, lookup("analytics.missing").getStatus());
    assertEquals(Status.DATABASE_NOT_FOUND, lookup("nowhere.words").getStatus());
  }

  @Test
  void loaded_collection_carries_its_partition_map() {
    PartitionMap map = lookup("analytics.word_counts").getPartitionMapOrThrow();

    assertEquals(PartitionKeyPattern.of("word"), map.getKeyPattern());
    assertEquals(3, map.getChunks().size());
  }

  @Test
  void created_database_without_collections_exists() {
    catalog.createDatabase("fresh");

    assertEquals(Status.COLLECTION_NOT_FOUND, lookup("fresh.anything").getStatus());
  }

  @Test
  void registering_replaces_previous_routing() {
    PartitionMap singleChunk =
        new PartitionMap(
            PartitionKeyPattern.of("_id"),
            List.of(
                new PartitionChunk(
                    new KeyRange(
                        KeyBound.of("_id", KeySentinel.MIN_KEY),
                        KeyBound.of("_id", KeySentinel.MAX_KEY)),
                    "only")));
    catalog.registerPartitionedCollection(WORD_COUNTS, singleChunk);

    assertEquals(
        CollectionRoutingInfo.partitioned(singleChunk),
        catalog.getCollectionRoutingInfo(context, WORD_COUNTS));

    catalog.registerUnpartitionedCollection(WORD_COUNTS);
    assertEquals(Status.UNPARTITIONED, lookup("analytics.word_counts").getStatus());
  }

  @Test
  void dropped_collection_and_database_are_gone() {
    catalog.dropCollection(WORD_COUNTS);
    assertEquals(Status.COLLECTION_NOT_FOUND, lookup("analytics.word_counts").getStatus());

    catalog.dropDatabase("analytics");
    assertEquals(Status.DATABASE_NOT_FOUND, lookup("analytics.events.daily").getStatus());

    catalog.dropCollection(Namespace.parse("nowhere.words"));
  }

  @Test
  void killed_operation_cannot_read_the_catalog() {
    context.kill();

    assertThrows(
        OperationCancelledException.class,
        () -> catalog.getCollectionRoutingInfo(context, WORD_COUNTS));
  }

  private CollectionRoutingInfo lookup(String namespace) {
    return catalog.getCollectionRoutingInfo(context, Namespace.parse(namespace));
  }
}
