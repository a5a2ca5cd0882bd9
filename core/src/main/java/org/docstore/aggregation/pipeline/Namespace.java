/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Fully qualified collection name, {@code <database>.<collection>}. */
@Getter
@EqualsAndHashCode
public class Namespace {

  private final String database;
  private final String collection;

  public Namespace(String database, String collection) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(database), "Database name is required");
    Preconditions.checkArgument(
        database.indexOf('.') < 0, "Database name [%s] must not contain '.'", database);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(collection), "Collection name is required");
    this.database = database;
    this.collection = collection;
  }

  /**
   * Parses {@code db.coll}. Everything after the first '.' belongs to the collection name.
   *
   * @param namespace dotted namespace string
   * @return parsed namespace
   */
  public static Namespace parse(String namespace) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "Namespace is required");
    int dot = namespace.indexOf('.');
    Preconditions.checkArgument(
        dot > 0 && dot < namespace.length() - 1, "Invalid namespace: %s", namespace);
    return new Namespace(namespace.substring(0, dot), namespace.substring(dot + 1));
  }

  @Override
  public String toString() {
    return database + "." + collection;
  }
}
