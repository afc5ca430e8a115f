package com.mk.fx.qa.perf.execution.template;

import com.mk.fx.qa.perf.execution.config.ConfigValues;
import com.mk.fx.qa.perf.execution.config.TestConfig;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The four name tables a template may reference, searched in precedence order: variables,
 * generators, datasets, ranges. The first table containing a name wins.
 */
public record LookupTables(
    Map<String, Object> variables,
    Map<String, Object> generators,
    Map<String, Object> datasets,
    Map<String, Object> ranges) {

  /** Table a name was found in. */
  public enum Table {
    VARIABLES,
    GENERATORS,
    DATASETS,
    RANGES
  }

  /**
   * A successful lookup. {@code value} may be {@code null} when the document maps the name to an
   * empty value.
   */
  public record Match(String name, Table table, Object value) {}

  public LookupTables {
    variables = ConfigValues.freezeMap(variables);
    generators = ConfigValues.freezeMap(generators);
    datasets = ConfigValues.freezeMap(datasets);
    ranges = ConfigValues.freezeMap(ranges);
  }

  public static LookupTables from(TestConfig config) {
    return new LookupTables(config.variables(), config.generators(), config.datasets(), config.ranges());
  }

  public static LookupTables empty() {
    return new LookupTables(Map.of(), Map.of(), Map.of(), Map.of());
  }

  /**
   * Finds a name across the tables. When no table has the name itself, a dotted name such as
   * {@code price_range.min} navigates into the mapping (or list index) under its first segment.
   */
  public Optional<Match> find(String name) {
    if (name == null || name.isEmpty()) {
      return Optional.empty();
    }
    var direct = findDirect(name);
    if (direct.isPresent() || name.indexOf('.') < 0) {
      return direct;
    }
    String[] segments = name.split("\\.");
    var head = findDirect(segments[0]);
    if (head.isEmpty()) {
      return Optional.empty();
    }
    Object current = head.get().value();
    for (int i = 1; i < segments.length; i++) {
      var next = child(current, segments[i]);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      current = next.get();
    }
    return Optional.of(new Match(name, head.get().table(), current));
  }

  private Optional<Match> findDirect(String name) {
    if (variables.containsKey(name)) return Optional.of(new Match(name, Table.VARIABLES, variables.get(name)));
    if (generators.containsKey(name)) return Optional.of(new Match(name, Table.GENERATORS, generators.get(name)));
    if (datasets.containsKey(name)) return Optional.of(new Match(name, Table.DATASETS, datasets.get(name)));
    if (ranges.containsKey(name)) return Optional.of(new Match(name, Table.RANGES, ranges.get(name)));
    return Optional.empty();
  }

  private static Optional<Object> child(Object container, String segment) {
    if (container instanceof Map<?, ?> map && map.containsKey(segment)) {
      return Optional.ofNullable(map.get(segment));
    }
    if (container instanceof List<?> list && segment.chars().allMatch(Character::isDigit) && !segment.isEmpty()) {
      int index = Integer.parseInt(segment);
      if (index < list.size()) {
        return Optional.ofNullable(list.get(index));
      }
    }
    return Optional.empty();
  }
}
