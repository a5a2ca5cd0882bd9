/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.docstore.aggregation.pipeline.expression.Expression;

/**
 * Sets the listed fields on each document and leaves every other field untouched.
 *
 * @param fields output field to expression
 */
public record AddFieldsStage(Map<String, Expression> fields) implements Stage {

  public AddFieldsStage {
    fields = ImmutableMap.copyOf(fields);
  }

  @Override
  public StageKind getKind() {
    return StageKind.ADD_FIELDS;
  }

  @Override
  public String toString() {
    return "$addFields" + fields;
  }
}
