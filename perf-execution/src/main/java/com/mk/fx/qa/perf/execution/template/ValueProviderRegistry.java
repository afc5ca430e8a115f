package com.mk.fx.qa.perf.execution.template;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.random.RandomGenerator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps template strings to {@link ValueProvider}s.
 *
 * <p>A whole-string tag ({@code $uuid}, {@code $now}, {@code $email}, {@code $lorem{N}},
 * {@code $random{...}}, {@code $range{...}}) selects a provider. Any other {@code $}-prefixed
 * string is a literal passthrough, as are integer bounds outside the {@code long} range and
 * {@code $lorem} counts above 10000. Strings that do not start with {@code $}, or that start with
 * {@code ${}, are not tags. Parsed providers are cached per template string, so a template is
 * parsed once and invoked many times. Instances are safe to share between workers.
 */
public class ValueProviderRegistry {

  private static final Pattern TAG = Pattern.compile("^\\$(\\w+)(?:\\{([^{}]*)\\})?$");
  private static final Pattern INLINE_TAG = Pattern.compile("\\$(\\w+)(?:\\{([^{}]*)\\})?");
  private static final Pattern NUMBER = Pattern.compile("^[-+]?\\d+(\\.\\d+)?$");

  private static final int DECIMAL_SCALE = 2;
  private static final BigDecimal MAX_LOREM_WORDS = BigDecimal.valueOf(10_000);
  private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

  private final LookupTables tables;
  private final Clock clock;
  private final Map<String, ValueProvider> templates = new ConcurrentHashMap<>();
  private final Map<String, Optional<ValueProvider>> inlineTags = new ConcurrentHashMap<>();
  private final Map<String, ValueProvider> generators = new ConcurrentHashMap<>();

  public ValueProviderRegistry(LookupTables tables, Clock clock) {
    this.tables = tables;
    this.clock = clock;
  }

  public ValueProviderRegistry(LookupTables tables) {
    this(tables, Clock.systemUTC());
  }

  /**
   * Returns the provider for a template value.
   *
   * @param value any configured value
   * @return empty for non-strings, strings without a leading {@code $} and {@code ${...}}
   *     references; otherwise the cached provider, a literal passthrough for unknown tags
   */
  public Optional<ValueProvider> lookup(Object value) {
    if (!(value instanceof String template) || !template.startsWith("$") || template.startsWith("${")) {
      return Optional.empty();
    }
    return Optional.of(templates.computeIfAbsent(template, this::parseWholeString));
  }

  /**
   * Expands every known tag embedded in a longer string, e.g. {@code "Product $random{1,9}"}.
   * Unknown tags stay as written.
   */
  public String expandInline(String text, RandomGenerator random) {
    if (text.indexOf('$') < 0) {
      return text;
    }
    Matcher matcher = INLINE_TAG.matcher(text);
    var sb = new StringBuilder();
    boolean changed = false;
    while (matcher.find()) {
      var provider = inlineTags.computeIfAbsent(matcher.group(), tag -> parseTag(matcher.group(1), matcher.group(2)));
      if (provider.isPresent()) {
        matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(provider.get().provide(random))));
        changed = true;
      } else {
        matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
      }
    }
    if (!changed) {
      return text;
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  /**
   * Provider for a named {@code generators} definition, created on first use.
   *
   * @throws IllegalArgumentException if the definition is invalid
   */
  public ValueProvider generator(String name, Map<?, ?> definition) {
    return generators.computeIfAbsent(name, n -> GeneratorFactory.fromDefinition(n, definition, clock));
  }

  private ValueProvider parseWholeString(String template) {
    Matcher matcher = TAG.matcher(template);
    if (!matcher.matches()) {
      return new ValueProvider.Literal(template);
    }
    return parseTag(matcher.group(1), matcher.group(2)).orElseGet(() -> new ValueProvider.Literal(template));
  }

  private Optional<ValueProvider> parseTag(String tag, String args) {
    return switch (tag) {
      case "uuid" -> args == null ? Optional.of(new ValueProvider.Uuid()) : Optional.empty();
      case "now" -> args == null ? Optional.of(new ValueProvider.Timestamp(clock)) : Optional.empty();
      case "email" -> args == null ? Optional.of(new ValueProvider.Email()) : Optional.empty();
      case "lorem" -> lorem(args);
      case "random" -> random(args);
      case "range" -> range(args);
      default -> Optional.empty();
    };
  }

  private Optional<ValueProvider> lorem(String args) {
    if (args == null || !args.trim().matches("\\d+")) {
      return Optional.empty();
    }
    var words = new BigDecimal(args.trim());
    if (words.compareTo(MAX_LOREM_WORDS) > 0) {
      return Optional.empty();
    }
    return Optional.of(new ValueProvider.Lorem(words.intValueExact()));
  }

  private Optional<ValueProvider> random(String args) {
    List<String> tokens = tokens(args);
    if (tokens.isEmpty()) {
      return Optional.empty();
    }
    if (isNumericPair(tokens)) {
      return numericRange(tokens);
    }
    if (tokens.size() == 1) {
      var named = named(tokens.get(0));
      if (named.isPresent()) {
        return named;
      }
    }
    return Optional.of(new ValueProvider.Choice(new ArrayList<>(tokens)));
  }

  private Optional<ValueProvider> range(String args) {
    List<String> tokens = tokens(args);
    if (tokens.size() == 1) {
      String name = tokens.get(0);
      if (!tables.ranges().containsKey(name)) {
        return Optional.empty();
      }
      return Optional.of(GeneratorFactory.rangeFrom(name, tables.ranges().get(name)));
    }
    return numericRange(tokens);
  }

  private static boolean isNumericPair(List<String> tokens) {
    return tokens.size() == 2 && tokens.stream().allMatch(t -> NUMBER.matcher(t).matches());
  }

  // integer bounds outside the long range select no provider
  private Optional<ValueProvider> numericRange(List<String> tokens) {
    if (!isNumericPair(tokens)) {
      return Optional.empty();
    }
    var low = new BigDecimal(tokens.get(0));
    var high = new BigDecimal(tokens.get(1));
    if (tokens.get(0).contains(".") || tokens.get(1).contains(".")) {
      return Optional.of(new ValueProvider.DecimalRange(low, high, DECIMAL_SCALE));
    }
    if (!fitsLong(low) || !fitsLong(high)) {
      return Optional.empty();
    }
    return Optional.of(new ValueProvider.IntegerRange(low.longValueExact(), high.longValueExact()));
  }

  private static boolean fitsLong(BigDecimal value) {
    return value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0;
  }

  // single-token $random{name}: dataset, generator definition or range
  private Optional<ValueProvider> named(String name) {
    var match = tables.find(name);
    if (match.isEmpty()) {
      return Optional.empty();
    }
    Object value = match.get().value();
    return switch (match.get().table()) {
      case DATASETS -> value instanceof List<?> list && !list.isEmpty()
          ? Optional.of(new ValueProvider.Choice(new ArrayList<>(list)))
          : Optional.empty();
      case GENERATORS -> value instanceof Map<?, ?> definition && GeneratorFactory.isDefinition(definition)
          ? Optional.of(generator(name, definition))
          : Optional.empty();
      case RANGES -> Optional.of(GeneratorFactory.rangeFrom(name, value));
      case VARIABLES -> value instanceof List<?> list && !list.isEmpty()
          ? Optional.of(new ValueProvider.Choice(new ArrayList<>(list)))
          : Optional.empty();
    };
  }

  private static List<String> tokens(String args) {
    if (args == null || args.isBlank()) {
      return List.of();
    }
    return Arrays.stream(args.split(",")).map(String::trim).filter(t -> !t.isEmpty()).toList();
  }
}
