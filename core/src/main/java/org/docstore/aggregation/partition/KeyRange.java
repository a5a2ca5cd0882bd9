/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.partition;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Objects;

/**
 * Half-open range {@code [min, max)} over a partition key.
 *
 * @param min inclusive lower bound
 * @param max exclusive upper bound
 */
public record KeyRange(KeyBound min, KeyBound max) {

  public KeyRange {
    Objects.requireNonNull(min, "min");
    Objects.requireNonNull(max, "max");
    Preconditions.checkArgument(
        min.getFieldNames().equals(max.getFieldNames()),
        "Range bounds must have the same fields: %s vs %s",
        min,
        max);
    Preconditions.checkArgument(!min.equals(max), "Empty range %s", min);
  }

  public List<String> getFieldNames() {
    return min.getFieldNames();
  }

  /** Returns the same range with its bound fields renamed by position. */
  public KeyRange withFieldNames(List<String> names) {
    return new KeyRange(min.withFieldNames(names), max.withFieldNames(names));
  }

  @Override
  public String toString() {
    return "[" + min + ", " + max + ")";
  }
}
