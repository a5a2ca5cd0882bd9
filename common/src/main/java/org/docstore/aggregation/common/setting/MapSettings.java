/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.common.setting;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * {@link Settings} backed by an in-memory map. Keys that were never set resolve to the default
 * declared on {@link Settings.Key}.
 */
public class MapSettings extends Settings {

  private final Map<Key, Object> values;

  public MapSettings() {
    this(Map.of());
  }

  public MapSettings(Map<Key, Object> values) {
    this.values = values.isEmpty() ? new EnumMap<>(Key.class) : new EnumMap<>(values);
  }

  /**
   * Builds settings from string properties keyed by {@link Key#getKeyValue()}. Unknown keys are
   * rejected.
   *
   * @param properties setting properties
   * @return settings holding the parsed values
   */
  public static MapSettings fromProperties(Properties properties) {
    Map<Key, Object> parsed = new EnumMap<>(Key.class);
    for (String name : properties.stringPropertyNames()) {
      Key key =
          Key.of(name)
              .orElseThrow(() -> new IllegalArgumentException("Unknown setting: " + name));
      parsed.put(key, parse(key, properties.getProperty(name).trim()));
    }
    return new MapSettings(parsed);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.getOrDefault(key, key.getDefaultValue());
  }

  @Override
  public List<?> getSettings() {
    List<Object> settings = new ArrayList<>();
    for (Key key : Key.values()) {
      settings.add(key.getKeyValue() + "=" + getSettingValue(key));
    }
    return settings;
  }

  private static Object parse(Key key, String raw) {
    Object defaultValue = key.getDefaultValue();
    if (defaultValue instanceof Boolean) {
      Preconditions.checkArgument(
          "true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw),
          "Setting %s expects a boolean but was [%s]",
          key.getKeyValue(),
          raw);
      return Boolean.parseBoolean(raw);
    }
    if (defaultValue instanceof Integer) {
      try {
        return Integer.parseInt(raw);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Setting " + key.getKeyValue() + " expects an integer but was [" + raw + "]", e);
      }
    }
    return raw;
  }
}
