/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import static org.docstore.aggregation.common.utils.StringUtils.isPathPrefixOf;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * What one stage does to field paths, as far as rename tracing cares: which output paths are
 * pure renames of an input field, which output paths are modified in any other way, and what
 * happens to paths the stage does not mention.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FieldLineage {

  /** Fate of paths a stage does not mention. */
  public enum Kind {
    /** Unmentioned paths pass through unchanged. */
    PRESERVES_UNLISTED,

    /** Unmentioned paths do not exist in the output. */
    DROPS_UNLISTED,

    /** The stage cannot be analysed; nothing is known about any path. */
    OPAQUE
  }

  private static final FieldLineage IDENTITY =
      new FieldLineage(Kind.PRESERVES_UNLISTED, Map.of(), Set.of());

  private static final FieldLineage OPAQUE =
      new FieldLineage(Kind.OPAQUE, Map.of(), Set.of());

  private final Kind kind;

  /** Output path to the input field it holds unchanged. */
  private final Map<String, String> renames;

  /** Output paths computed by anything other than a pure rename. */
  private final Set<String> modifiedPaths;

  public FieldLineage(Kind kind, Map<String, String> renames, Set<String> modifiedPaths) {
    this.kind = kind;
    this.renames = ImmutableMap.copyOf(renames);
    this.modifiedPaths = ImmutableSet.copyOf(modifiedPaths);
  }

  public static FieldLineage identity() {
    return IDENTITY;
  }

  public static FieldLineage opaque() {
    return OPAQUE;
  }

  /**
   * Resolves an output path to the input path holding the same value.
   *
   * @param path path as seen after this stage
   * @return the path as seen before this stage, or empty if the value cannot be proven to be
   *     carried over unchanged
   */
  public Optional<String> resolve(String path) {
    if (kind == Kind.OPAQUE) {
      return Optional.empty();
    }
    String source = renames.get(path);
    if (source != null) {
      return Optional.of(source);
    }
    if (touches(modifiedPaths, path) || touches(renames.keySet(), path)) {
      return Optional.empty();
    }
    return kind == Kind.PRESERVES_UNLISTED ? Optional.of(path) : Optional.empty();
  }

  private static boolean touches(Set<String> outputs, String path) {
    for (String output : outputs) {
      if (output.equals(path) || isPathPrefixOf(output, path) || isPathPrefixOf(path, output)) {
        return true;
      }
    }
    return false;
  }
}
