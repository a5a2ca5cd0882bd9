/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.exception;

import lombok.Getter;
import org.docstore.aggregation.common.utils.StringUtils;
import org.docstore.aggregation.pipeline.Namespace;

/**
 * Thrown when a namespace references a database that does not exist. A missing collection inside
 * an existing database is not reported this way.
 */
@Getter
public class NamespaceNotFoundException extends AggregationEngineException {

  private final Namespace namespace;

  public NamespaceNotFoundException(Namespace namespace) {
    super(StringUtils.format("Database %s does not exist", namespace.getDatabase()));
    this.namespace = namespace;
  }
}
