/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.expression;

/**
 * An expression producing a field value inside a stage. Only the shape of the expression is
 * modelled; evaluation belongs to the execution engine.
 */
public interface Expression {

  ExpressionKind getKind();
}
