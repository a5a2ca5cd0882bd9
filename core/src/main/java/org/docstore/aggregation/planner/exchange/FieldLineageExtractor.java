/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import static org.docstore.aggregation.pipeline.stage.GroupStage.ID_FIELD;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.docstore.aggregation.common.utils.StringUtils;
import org.docstore.aggregation.pipeline.expression.DocumentExpression;
import org.docstore.aggregation.pipeline.expression.Expression;
import org.docstore.aggregation.pipeline.expression.ExpressionKind;
import org.docstore.aggregation.pipeline.expression.FieldPathExpression;
import org.docstore.aggregation.pipeline.stage.AddFieldsStage;
import org.docstore.aggregation.pipeline.stage.GroupStage;
import org.docstore.aggregation.pipeline.stage.ProjectStage;
import org.docstore.aggregation.pipeline.stage.Stage;

/**
 * Derives the {@link FieldLineage} of each stage kind. Only a reference to a top-level input field
 * counts as a rename: a dotted reference could traverse an array and yield several values.
 */
public class FieldLineageExtractor {

  /**
   * Returns the lineage of a stage that is walked through, i.e. not the split point.
   *
   * @param stage pipeline stage
   * @return lineage of the stage
   */
  public FieldLineage extract(Stage stage) {
    switch (stage.getKind()) {
      case PROJECT:
        return projectLineage((ProjectStage) stage);
      case ADD_FIELDS:
        return addFieldsLineage((AddFieldsStage) stage);
      case GROUP:
        return groupLineage((GroupStage) stage, false);
      case MATCH:
      case SORT:
      case LIMIT:
      case SKIP:
        return FieldLineage.identity();
      default:
        return FieldLineage.opaque();
    }
  }

  /**
   * Returns the lineage of a merging group seen as the split point. The documents entering a
   * merging group are partial groups that already hold the group key under {@code _id}, so a key
   * path resolves to itself when the key is built from plain field references.
   *
   * @param group merging group
   * @return lineage mapping key paths to themselves
   */
  public FieldLineage extractAtSplitPoint(GroupStage group) {
    return groupLineage(group, true);
  }

  /**
   * Lineage of a group's outputs. Every key path built from a plain field reference is mapped
   * either to the referenced input field or, at the split point, to itself.
   */
  private FieldLineage groupLineage(GroupStage group, boolean atSplitPoint) {
    Map<String, String> renames = new LinkedHashMap<>();
    Set<String> modified = new LinkedHashSet<>(group.accumulators().keySet());
    Expression key = group.key();
    if (isRename(key)) {
      renames.put(ID_FIELD, atSplitPoint ? ID_FIELD : ((FieldPathExpression) key).path());
    } else if (key.getKind() == ExpressionKind.DOCUMENT) {
      ((DocumentExpression) key)
          .fields()
          .forEach(
              (name, subKey) -> {
                String path = ID_FIELD + "." + name;
                if (isRename(subKey)) {
                  renames.put(path, atSplitPoint ? path : ((FieldPathExpression) subKey).path());
                } else {
                  modified.add(path);
                }
              });
    } else {
      modified.add(ID_FIELD);
    }
    return new FieldLineage(FieldLineage.Kind.DROPS_UNLISTED, renames, modified);
  }

  private FieldLineage projectLineage(ProjectStage project) {
    Map<String, String> renames = new LinkedHashMap<>();
    Set<String> modified = new LinkedHashSet<>();
    collect(project.fields(), renames, modified);
    boolean idMentioned =
        project.fields().keySet().stream()
            .anyMatch(f -> f.equals(ID_FIELD) || StringUtils.isPathPrefixOf(ID_FIELD, f));
    if (!project.excludeId() && !idMentioned) {
      renames.put(ID_FIELD, ID_FIELD);
    }
    return new FieldLineage(FieldLineage.Kind.DROPS_UNLISTED, renames, modified);
  }

  private FieldLineage addFieldsLineage(AddFieldsStage addFields) {
    Map<String, String> renames = new LinkedHashMap<>();
    Set<String> modified = new LinkedHashSet<>();
    collect(addFields.fields(), renames, modified);
    return new FieldLineage(FieldLineage.Kind.PRESERVES_UNLISTED, renames, modified);
  }

  private void collect(
      Map<String, Expression> fields, Map<String, String> renames, Set<String> modified) {
    fields.forEach(
        (output, expression) -> {
          if (!StringUtils.isDottedPath(output) && isRename(expression)) {
            renames.put(output, ((FieldPathExpression) expression).path());
          } else {
            modified.add(output);
          }
        });
  }

  private static boolean isRename(Expression expression) {
    return expression.getKind() == ExpressionKind.FIELD_PATH
        && ((FieldPathExpression) expression).isTopLevelField();
  }
}
