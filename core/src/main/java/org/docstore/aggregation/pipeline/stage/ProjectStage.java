/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.docstore.aggregation.pipeline.expression.Expression;

/**
 * Reshapes each document into exactly the listed fields. {@code _id} is kept unless {@code
 * excludeId} is set. Including a field unchanged is expressed as a reference to itself.
 *
 * @param fields output field to expression, in output order
 * @param excludeId true to drop {@code _id} when it is not listed
 */
public record ProjectStage(Map<String, Expression> fields, boolean excludeId) implements Stage {

  public ProjectStage {
    fields = ImmutableMap.copyOf(fields);
  }

  @Override
  public StageKind getKind() {
    return StageKind.PROJECT;
  }

  @Override
  public String toString() {
    return "$project" + fields + (excludeId ? "{_id: 0}" : "");
  }
}
