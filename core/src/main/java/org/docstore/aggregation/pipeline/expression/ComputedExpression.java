/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.expression;

import java.util.List;

/** Opaque computation such as {@code {$concat: [...]}} or an accumulator. */
public record ComputedExpression(String operator, List<Expression> arguments)
    implements Expression {

  public ComputedExpression {
    arguments = List.copyOf(arguments);
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.COMPUTED;
  }

  @Override
  public String toString() {
    return "{" + operator + ": " + arguments + "}";
  }
}
