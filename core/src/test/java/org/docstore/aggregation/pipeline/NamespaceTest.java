/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class NamespaceTest {

  @Test
  void collection_name_keeps_everything_after_the_first_dot() {
    Namespace namespace = Namespace.parse("reports.daily.totals");

    assertEquals("reports", namespace.getDatabase());
    assertEquals("daily.totals", namespace.getCollection());
    assertEquals("reports.daily.totals", namespace.toString());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "nodot", ".coll", "db."})
  void invalid_namespaces_are_rejected(String namespace) {
    assertThrows(IllegalArgumentException.class, () -> Namespace.parse(namespace));
  }

  @Test
  void database_name_cannot_contain_a_dot() {
    assertThrows(IllegalArgumentException.class, () -> new Namespace("a.b", "c"));
  }
}
