/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.expression;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/** Document whose named sub-fields are each computed by an expression. Field order is kept. */
public record DocumentExpression(Map<String, Expression> fields) implements Expression {

  public DocumentExpression {
    fields = ImmutableMap.copyOf(fields);
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.DOCUMENT;
  }

  public Optional<Expression> getField(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}
