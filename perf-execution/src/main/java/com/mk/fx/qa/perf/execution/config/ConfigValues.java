package com.mk.fx.qa.perf.execution.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Deep-freezing helpers for the untyped parts of a configuration document. */
public final class ConfigValues {

  private ConfigValues() {
    // Utility class, no instantiation
  }

  /**
   * Returns an unmodifiable deep copy of mappings and sequences, preserving key order. Scalars are
   * returned as-is.
   */
  public static Object freeze(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freezeMap(map);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(freeze(item));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  public static <V> Map<String, V> freezeMap(Map<?, ?> map) {
    if (map == null || map.isEmpty()) {
      return Map.of();
    }
    Map<String, V> copy = new LinkedHashMap<>();
    map.forEach((key, value) -> copy.put(String.valueOf(key), (V) freeze(value)));
    return Collections.unmodifiableMap(copy);
  }

  public static <T> List<T> freezeList(List<T> list) {
    if (list == null || list.isEmpty()) {
      return List.of();
    }
    return Collections.unmodifiableList(new ArrayList<>(list));
  }
}
