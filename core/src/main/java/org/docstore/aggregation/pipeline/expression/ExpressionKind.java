/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.expression;

/** Shapes of {@link Expression} that rename tracing distinguishes. */
public enum ExpressionKind {
  /** Reference to an input field path, e.g. {@code $x} or {@code $_id.country}. */
  FIELD_PATH,

  /** Literal value. */
  CONSTANT,

  /** Document built from named sub-expressions, e.g. {@code {region: $region}}. */
  DOCUMENT,

  /** Any other computation. Never treated as a rename. */
  COMPUTED
}
