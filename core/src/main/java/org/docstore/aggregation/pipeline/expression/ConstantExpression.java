/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.expression;

/** Literal value. */
public record ConstantExpression(Object value) implements Expression {

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.CONSTANT;
  }

  @Override
  public String toString() {
    return "{$literal: " + value + "}";
  }
}
