package com.mk.fx.qa.perf.execution.template;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link ValueProvider}s from {@code generators} definitions and {@code ranges} entries of
 * the configuration document.
 *
 * <p>Supported generator types: {@code choice}, {@code randint}, {@code randfloat}, {@code string},
 * {@code email}, {@code boolean}, {@code timestamp}, {@code uuid}, {@code lorem},
 * {@code weighted_choice} and {@code range}.
 */
public final class GeneratorFactory {

  static final String DEFAULT_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
  static final int DEFAULT_STRING_LENGTH = 10;
  static final int DEFAULT_LOREM_WORDS = 10;
  static final int DECIMAL_SCALE = 2;

  private GeneratorFactory() {
    // Utility class, no instantiation
  }

  /** True when the mapping carries a {@code type} key and therefore describes a generator. */
  public static boolean isDefinition(Map<?, ?> value) {
    return value.get("type") instanceof String;
  }

  /**
   * Creates the provider described by a generator definition.
   *
   * @throws IllegalArgumentException if the type is unknown or its parameters are invalid
   */
  public static ValueProvider fromDefinition(String name, Map<?, ?> definition, Clock clock) {
    var type = String.valueOf(definition.get("type")).trim().toLowerCase(Locale.ROOT);
    return switch (type) {
      case "choice" -> new ValueProvider.Choice(requireList(name, definition, "values"));
      case "randint", "int", "integer" -> integerRange(name, definition);
      case "randfloat", "float", "decimal" -> new ValueProvider.DecimalRange(
          requireNumber(name, definition, "min"), requireNumber(name, definition, "max"), DECIMAL_SCALE);
      case "range" -> rangeFrom(name, definition);
      case "string" -> new ValueProvider.RandomString(
          intOr(name, definition, "length", DEFAULT_STRING_LENGTH),
          definition.get("chars") != null ? String.valueOf(definition.get("chars")) : DEFAULT_ALPHABET);
      case "email" -> new ValueProvider.Email();
      case "boolean", "bool" -> new ValueProvider.Choice(List.of(Boolean.TRUE, Boolean.FALSE));
      case "timestamp", "now" -> new ValueProvider.Timestamp(clock);
      case "uuid" -> new ValueProvider.Uuid();
      case "lorem" -> new ValueProvider.Lorem(intOr(name, definition, "words", DEFAULT_LOREM_WORDS));
      case "weighted_choice" -> weightedChoice(name, definition);
      default -> throw new IllegalArgumentException(
          "Unknown generator type '" + type + "' for generator '" + name + "'");
    };
  }

  /**
   * Creates a provider for a {@code ranges} entry: a mapping with {@code min}, {@code max} and an
   * optional {@code step}, or a two-element list. Decimal bounds give a decimal range.
   *
   * @throws IllegalArgumentException if the bounds are missing or not numeric
   */
  public static ValueProvider rangeFrom(String name, Object entry) {
    BigDecimal min;
    BigDecimal max;
    Object step = null;
    if (entry instanceof Map<?, ?> map) {
      min = requireNumber(name, map, "min");
      max = requireNumber(name, map, "max");
      step = map.get("step");
    } else if (entry instanceof List<?> list && list.size() == 2) {
      min = toNumber(name, "min", list.get(0));
      max = toNumber(name, "max", list.get(1));
    } else {
      throw new IllegalArgumentException("Range '" + name + "' needs min and max bounds");
    }
    if (isIntegral(min) && isIntegral(max)) {
      long stepValue = 1;
      if (step != null) {
        var stepNumber = toNumber(name, "step", step);
        if (!isIntegral(stepNumber)) {
          throw new IllegalArgumentException("Range '" + name + "' step must be a whole number, got " + step);
        }
        stepValue = toLong(name, "step", stepNumber);
      }
      return new ValueProvider.IntegerRange(toLong(name, "min", min), toLong(name, "max", max), stepValue);
    }
    return new ValueProvider.DecimalRange(min, max, DECIMAL_SCALE);
  }

  private static ValueProvider integerRange(String name, Map<?, ?> definition) {
    var min = requireNumber(name, definition, "min");
    var max = requireNumber(name, definition, "max");
    long step =
        definition.get("step") == null ? 1 : toLong(name, "step", toNumber(name, "step", definition.get("step")));
    return new ValueProvider.IntegerRange(toLong(name, "min", min), toLong(name, "max", max), step);
  }

  private static ValueProvider weightedChoice(String name, Map<?, ?> definition) {
    List<Object> values = new ArrayList<>();
    List<Double> weights = new ArrayList<>();
    for (Object choice : requireList(name, definition, "choices")) {
      if (!(choice instanceof Map<?, ?> option) || !option.containsKey("value")) {
        throw new IllegalArgumentException(
            "Generator '" + name + "' choices must be mappings with value and weight");
      }
      values.add(option.get("value"));
      weights.add(option.get("weight") == null ? 1.0 : toNumber(name, "weight", option.get("weight")).doubleValue());
    }
    return new ValueProvider.WeightedChoice(values, weights);
  }

  private static List<Object> requireList(String name, Map<?, ?> definition, String key) {
    if (definition.get(key) instanceof List<?> list && !list.isEmpty()) {
      return new ArrayList<>(list);
    }
    throw new IllegalArgumentException("Generator '" + name + "' requires a non-empty '" + key + "' list");
  }

  private static BigDecimal requireNumber(String name, Map<?, ?> definition, String key) {
    if (!definition.containsKey(key) || definition.get(key) == null) {
      throw new IllegalArgumentException("'" + name + "' requires '" + key + "'");
    }
    return toNumber(name, key, definition.get(key));
  }

  private static int intOr(String name, Map<?, ?> definition, String key, int fallback) {
    Object value = definition.get(key);
    return value == null ? fallback : toNumber(name, key, value).intValue();
  }

  static BigDecimal toNumber(String name, String key, Object value) {
    try {
      return new BigDecimal(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + name + "." + key + "' is not a number: " + value, e);
    }
  }

  private static long toLong(String name, String key, BigDecimal value) {
    try {
      return value.setScale(0, RoundingMode.DOWN).longValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("'" + name + "." + key + "' is outside the 64-bit integer range: " + value, e);
    }
  }

  private static boolean isIntegral(BigDecimal value) {
    return value.stripTrailingZeros().scale() <= 0 && !value.toPlainString().contains(".");
  }
}
