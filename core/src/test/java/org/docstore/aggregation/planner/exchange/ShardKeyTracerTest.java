/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import static org.docstore.aggregation.pipeline.expression.DSL.computed;
import static org.docstore.aggregation.pipeline.expression.DSL.document;
import static org.docstore.aggregation.pipeline.expression.DSL.field;
import static org.docstore.aggregation.pipeline.expression.DSL.literal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.docstore.aggregation.partition.PartitionKeyPattern;
import org.docstore.aggregation.pipeline.stage.AddFieldsStage;
import org.docstore.aggregation.pipeline.stage.GroupStage;
import org.docstore.aggregation.pipeline.stage.MatchStage;
import org.docstore.aggregation.pipeline.stage.OtherStage;
import org.docstore.aggregation.pipeline.stage.ProjectStage;
import org.docstore.aggregation.pipeline.stage.SortStage;
import org.docstore.aggregation.pipeline.stage.Stage;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ShardKeyTracerTest {

  private final ShardKeyTracer tracer = new ShardKeyTracer();

  @Test
  void empty_pipeline_splits_at_the_front_with_the_destination_key() {
    assertEquals(
        Optional.of(new SplitPoint(0, PartitionKeyPattern.of("a", "b"))),
        tracer.trace(List.of(), PartitionKeyPattern.of("a", "b")));
  }

  @Test
  void merging_group_is_the_split_point() {
    List<Stage> stages =
        List.of(
            new OtherStage("$unwind"),
            new GroupStage(field("x"), Map.of(), true),
            new MatchStage("{count: {$gt: 1}}"));

    assertEquals(
        Optional.of(new SplitPoint(1, PartitionKeyPattern.of("_id"))),
        tracer.trace(stages, PartitionKeyPattern.of("_id")));
  }

  @Test
  void stages_before_the_split_point_are_not_inspected() {
    List<Stage> stages =
        List.of(
            new ProjectStage(ImmutableMap.of("_id", computed("$toUpper", field("x"))), false),
            new GroupStage(field("word"), Map.of(), true));

    assertEquals(
        Optional.of(new SplitPoint(1, PartitionKeyPattern.of("_id"))),
        tracer.trace(stages, PartitionKeyPattern.of("_id")));
  }

  @Test
  void merging_group_with_constant_key_fails() {
    List<Stage> stages = List.of(new GroupStage(literal(null), Map.of(), true));

    assertFalse(tracer.trace(stages, PartitionKeyPattern.of("_id")).isPresent());
  }

  @Test
  void merging_group_with_document_key_resolves_sub_keys() {
    List<Stage> stages =
        List.of(
            new GroupStage(
                document("region", field("region"), "country", field("country")), Map.of(), true),
            new AddFieldsStage(ImmutableMap.of("country", field("_id.country"))));

    assertEquals(
        Optional.of(new SplitPoint(0, PartitionKeyPattern.of("_id.region"))),
        tracer.trace(stages, PartitionKeyPattern.of("_id.region")));
    assertFalse(tracer.trace(stages, PartitionKeyPattern.of("country")).isPresent());
  }

  @Test
  void non_merging_group_document_key_resolves_to_referenced_fields() {
    List<Stage> stages =
        List.of(
            new GroupStage(
                document("region", field("region"), "city", computed("$toLower", field("c"))),
                Map.of(),
                false));

    assertEquals(
        Optional.of(new SplitPoint(0, PartitionKeyPattern.of("region"))),
        tracer.trace(stages, PartitionKeyPattern.of("_id.region")));
    assertFalse(tracer.trace(stages, PartitionKeyPattern.of("_id.city")).isPresent());
    assertFalse(tracer.trace(stages, PartitionKeyPattern.of("_id")).isPresent());
  }

  @Test
  void tracing_continues_past_a_non_merging_group() {
    List<Stage> stages =
        List.of(
            new ProjectStage(ImmutableMap.of("x", field("raw")), true),
            new GroupStage(field("x"), Map.of(), false));

    assertEquals(
        Optional.of(new SplitPoint(0, PartitionKeyPattern.of("raw"))),
        tracer.trace(stages, PartitionKeyPattern.of("_id")));
  }

  @Test
  void renames_compose_through_a_chain() {
    List<Stage> stages =
        List.of(
            new GroupStage(field("x"), Map.of(), true),
            new ProjectStage(ImmutableMap.of("a", field("_id")), false),
            new AddFieldsStage(ImmutableMap.of("b", field("a"))),
            new SortStage(List.of("b")),
            new ProjectStage(ImmutableMap.of("key", field("b")), true));

    assertEquals(
        Optional.of(new SplitPoint(0, PartitionKeyPattern.of("_id"))),
        tracer.trace(stages, PartitionKeyPattern.of("key")));
  }

  @Test
  void fields_untouched_by_add_fields_pass_through() {
    List<Stage> stages = List.of(new AddFieldsStage(ImmutableMap.of("other", literal(1))));

    assertEquals(
        Optional.of(new SplitPoint(0, PartitionKeyPattern.of("k"))),
        tracer.trace(stages, PartitionKeyPattern.of("k")));
  }

  @Test
  void one_untraceable_field_fails_the_whole_key() {
    List<Stage> stages =
        List.of(
            new GroupStage(field("x"), ImmutableMap.of("n", computed("$sum", literal(1))), true),
            new ProjectStage(ImmutableMap.of("a", field("_id"), "b", field("n")), false));

    assertFalse(tracer.trace(stages, PartitionKeyPattern.of("a", "b")).isPresent());
  }

  @Test
  void opaque_stage_after_the_split_point_fails() {
    List<Stage> stages =
        List.of(new GroupStage(field("x"), Map.of(), true), new OtherStage("$unwind"));

    assertFalse(tracer.trace(stages, PartitionKeyPattern.of("_id")).isPresent());
  }

  @Test
  void project_dropping_the_key_field_fails() {
    List<Stage> stages =
        List.of(new ProjectStage(ImmutableMap.of("count", field("count")), true));

    assertFalse(tracer.trace(stages, PartitionKeyPattern.of("_id")).isPresent());
  }

  @Test
  void project_keeps_id_unless_excluded() {
    List<Stage> keepId = List.of(new ProjectStage(ImmutableMap.of("n", field("n")), false));

    assertEquals(
        Optional.of(new SplitPoint(0, PartitionKeyPattern.of("_id"))),
        tracer.trace(keepId, PartitionKeyPattern.of("_id")));
  }
}
