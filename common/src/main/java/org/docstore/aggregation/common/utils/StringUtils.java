/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.common.utils;

import com.google.common.base.Strings;
import java.util.Locale;
import lombok.experimental.UtilityClass;

@UtilityClass
public class StringUtils {

  /**
   * Format string with {@link Locale#ROOT}.
   *
   * @param format format string
   * @param args arguments referenced by the format string
   * @return formatted string
   */
  public static String format(final String format, Object... args) {
    return String.format(Locale.ROOT, format, args);
  }

  /**
   * Returns true if the given path refers to a nested field, i.e. contains a '.' separator.
   *
   * @param path field path
   * @return true for a dotted path
   */
  public static boolean isDottedPath(String path) {
    return !Strings.isNullOrEmpty(path) && path.indexOf('.') >= 0;
  }

  /**
   * Returns true if {@code prefix} is a strict path prefix of {@code path}. "a" is a prefix of
   * "a.b" but not of "ab".
   *
   * @param prefix candidate parent path
   * @param path candidate child path
   * @return true if prefix is a parent of path
   */
  public static boolean isPathPrefixOf(String prefix, String path) {
    return path.length() > prefix.length()
        && path.startsWith(prefix)
        && path.charAt(prefix.length()) == '.';
  }
}
