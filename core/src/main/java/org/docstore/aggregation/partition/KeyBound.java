/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.partition;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;

/**
 * One end of a key range: an ordered list of (field name, value) pairs. Field names may repeat.
 * Values are compared only for equality; their ordering is owned by the storage layer.
 */
@EqualsAndHashCode
public class KeyBound {

  /** A named key value. {@code value} may be a {@link KeySentinel}. */
  public record Field(String name, Object value) {

    public Field {
      Preconditions.checkArgument(name != null && !name.isEmpty(), "Key field name is required");
    }

    @Override
    public String toString() {
      return name + ": " + value;
    }
  }

  private final List<Field> fields;

  public KeyBound(List<Field> fields) {
    Preconditions.checkArgument(!fields.isEmpty(), "Key bound must have at least one field");
    this.fields = ImmutableList.copyOf(fields);
  }

  /**
   * Builds a bound from alternating field names and values.
   *
   * @param nameAndValues name1, value1, name2, value2, ...
   * @return key bound
   */
  public static KeyBound of(Object... nameAndValues) {
    Preconditions.checkArgument(nameAndValues.length % 2 == 0, "Expected name/value pairs");
    List<Field> fields = new ArrayList<>();
    for (int i = 0; i < nameAndValues.length; i += 2) {
      fields.add(new Field((String) nameAndValues[i], nameAndValues[i + 1]));
    }
    return new KeyBound(fields);
  }

  /** Bound with every field of the pattern set to the given sentinel. */
  public static KeyBound allOf(PartitionKeyPattern pattern, KeySentinel sentinel) {
    return new KeyBound(
        pattern.fields().stream().map(f -> new Field(f, sentinel)).collect(Collectors.toList()));
  }

  public List<Field> getFields() {
    return fields;
  }

  public int size() {
    return fields.size();
  }

  public List<String> getFieldNames() {
    return fields.stream().map(Field::name).collect(Collectors.toList());
  }

  public List<Object> getValues() {
    return fields.stream().map(Field::value).collect(Collectors.toList());
  }

  /** Returns true if this bound is shaped like the pattern: same names in the same order. */
  public boolean matches(PartitionKeyPattern pattern) {
    return getFieldNames().equals(pattern.fields());
  }

  public boolean isAll(KeySentinel sentinel) {
    return fields.stream().allMatch(f -> f.value() == sentinel);
  }

  /**
   * Returns a bound with the same values under new field names, matched by position.
   *
   * @param names replacement field names, one per position
   * @return renamed bound
   */
  public KeyBound withFieldNames(List<String> names) {
    Preconditions.checkArgument(
        names.size() == fields.size(),
        "Cannot rename a %s-field key bound with %s names",
        fields.size(),
        names.size());
    List<Field> renamed = new ArrayList<>(fields.size());
    for (int i = 0; i < fields.size(); i++) {
      renamed.add(new Field(names.get(i), fields.get(i).value()));
    }
    return new KeyBound(renamed);
  }

  @Override
  public String toString() {
    return fields.stream().map(Field::toString).collect(Collectors.joining(", ", "{", "}"));
  }
}
