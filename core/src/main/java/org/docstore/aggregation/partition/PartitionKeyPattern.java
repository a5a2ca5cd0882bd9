/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.partition;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered field names a collection is partitioned on. A field may appear more than once, which
 * means the same value is used in several key positions.
 *
 * @param fields field names in key order
 */
public record PartitionKeyPattern(List<String> fields) {

  public PartitionKeyPattern {
    fields = List.copyOf(fields);
    Preconditions.checkArgument(!fields.isEmpty(), "Partition key pattern must not be empty");
    for (String field : fields) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(field), "Empty partition key field");
    }
  }

  public static PartitionKeyPattern of(String... fields) {
    return new PartitionKeyPattern(List.of(fields));
  }

  public int size() {
    return fields.size();
  }

  /** Returns true if some field name occurs in more than one position. */
  public boolean hasDuplicateFields() {
    return fields.stream().distinct().count() != fields.size();
  }

  @Override
  public String toString() {
    return fields.stream().map(f -> f + ": 1").collect(Collectors.joining(", ", "{", "}"));
  }
}
