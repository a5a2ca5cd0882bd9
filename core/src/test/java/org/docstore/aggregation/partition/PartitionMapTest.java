/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.partition;

import static org.docstore.aggregation.partition.KeySentinel.MAX_KEY;
import static org.docstore.aggregation.partition.KeySentinel.MIN_KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PartitionMapTest {

  private static final PartitionKeyPattern KEY = PartitionKeyPattern.of("k");

  @Test
  void contiguous_chunks_covering_the_key_space_are_accepted() {
    PartitionMap map =
        new PartitionMap(
            KEY, List.of(chunk(MIN_KEY, 10, "s2"), chunk(10, 20, "s1"), chunk(20, MAX_KEY, "s2")));

    assertEquals(3, map.getChunks().size());
    assertEquals(List.of("s2", "s1"), List.copyOf(map.getShardIds()));
  }

  @Test
  void empty_map_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new PartitionMap(KEY, List.of()));
  }

  @Test
  void map_must_start_at_min_key() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class,
            () -> new PartitionMap(KEY, List.of(chunk(0, MAX_KEY, "s"))));
    assertTrue(exception.getMessage().startsWith("First chunk must start at MinKey"));
  }

  @Test
  void map_must_end_at_max_key() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new PartitionMap(KEY, List.of(chunk(MIN_KEY, 100, "s"))));
  }

  @Test
  void overlapping_chunks_are_rejected() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                new PartitionMap(
                    KEY, List.of(chunk(MIN_KEY, 10, "a"), chunk(5, MAX_KEY, "b"))));
    assertTrue(exception.getMessage().contains("are not contiguous"));
  }

  @Test
  void bound_shaped_unlike_the_pattern_is_rejected() {
    PartitionChunk other =
        new PartitionChunk(
            new KeyRange(KeyBound.of("other", MIN_KEY), KeyBound.of("other", MAX_KEY)), "s");

    assertThrows(IllegalArgumentException.class, () -> new PartitionMap(KEY, List.of(other)));
  }

  @Test
  void compound_bounds_must_be_all_min_and_all_max_at_the_ends() {
    PartitionKeyPattern compound = PartitionKeyPattern.of("a", "b");
    PartitionChunk partial =
        new PartitionChunk(
            new KeyRange(KeyBound.of("a", MIN_KEY, "b", 0), KeyBound.of("a", MAX_KEY, "b", MAX_KEY)),
            "s");

    assertThrows(
        IllegalArgumentException.class, () -> new PartitionMap(compound, List.of(partial)));
  }

  private static PartitionChunk chunk(Object min, Object max, String shard) {
    return new PartitionChunk(new KeyRange(KeyBound.of("k", min), KeyBound.of("k", max)), shard);
  }
}
