/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import org.docstore.aggregation.common.utils.StringUtils;
import org.docstore.aggregation.pipeline.expression.Expression;

/**
 * Groups documents by {@code key} and writes the key to the output field {@code _id}. A merging
 * group combines partial groups that the shards already computed; its input documents carry the
 * partial group key under {@code _id}.
 *
 * @param key group key expression
 * @param accumulators accumulator output field to accumulator expression
 * @param merging true if this group merges per-shard partial results
 */
public record GroupStage(Expression key, Map<String, Expression> accumulators, boolean merging)
    implements Stage {

  public static final String ID_FIELD = "_id";

  public GroupStage {
    Objects.requireNonNull(key, "Group key is required");
    accumulators = ImmutableMap.copyOf(accumulators);
    for (String name : accumulators.keySet()) {
      Preconditions.checkArgument(
          !ID_FIELD.equals(name), "Accumulator may not be named %s", ID_FIELD);
      Preconditions.checkArgument(
          !StringUtils.isDottedPath(name), "Accumulator name [%s] must not be dotted", name);
    }
  }

  @Override
  public StageKind getKind() {
    return StageKind.GROUP;
  }

  @Override
  public String toString() {
    return "$group{_id: " + key + ", " + accumulators + (merging ? ", $doingMerge" : "") + "}";
  }
}
