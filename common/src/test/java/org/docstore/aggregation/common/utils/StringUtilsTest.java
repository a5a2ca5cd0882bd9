/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.common.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringUtilsTest {

  @Test
  void testFormat() {
    assertEquals("namespace db.coll", StringUtils.format("namespace %s.%s", "db", "coll"));
  }

  @Test
  void testIsDottedPath() {
    assertTrue(StringUtils.isDottedPath("_id.country"));
    assertFalse(StringUtils.isDottedPath("_id"));
    assertFalse(StringUtils.isDottedPath(""));
    assertFalse(StringUtils.isDottedPath(null));
  }

  @Test
  void testIsPathPrefixOf() {
    assertTrue(StringUtils.isPathPrefixOf("_id", "_id.country"));
    assertTrue(StringUtils.isPathPrefixOf("a.b", "a.b.c"));
    assertFalse(StringUtils.isPathPrefixOf("a", "ab"));
    assertFalse(StringUtils.isPathPrefixOf("a", "a"));
    assertFalse(StringUtils.isPathPrefixOf("a.b", "a"));
  }
}
