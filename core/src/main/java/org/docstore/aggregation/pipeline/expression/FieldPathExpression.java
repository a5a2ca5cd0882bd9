/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.expression;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.docstore.aggregation.common.utils.StringUtils;

/** Reference to a field of the input document. The path may be dotted. */
public record FieldPathExpression(String path) implements Expression {

  public FieldPathExpression {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(path), "Field path is required");
    Preconditions.checkArgument(
        !path.startsWith("$"), "Field path [%s] must not carry the '$' prefix", path);
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.FIELD_PATH;
  }

  /** True when the path names a top-level field, which makes the reference a pure rename. */
  public boolean isTopLevelField() {
    return !StringUtils.isDottedPath(path);
  }

  @Override
  public String toString() {
    return "$" + path;
  }
}
