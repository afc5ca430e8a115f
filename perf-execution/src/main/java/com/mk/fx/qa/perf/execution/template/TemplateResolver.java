package com.mk.fx.qa.perf.execution.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves raw templates into concrete request values. The input is never mutated: mappings and
 * sequences are rebuilt with the same keys and order, and every dynamic tag yields a fresh value
 * per occurrence.
 *
 * <p>A resolver holds the random handle of one worker and must not be shared between threads.
 */
public class TemplateResolver {

  private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^{}]+)}");

  private final ValueProviderRegistry registry;
  private final LookupTables tables;
  private final RandomGenerator random;

  public TemplateResolver(ValueProviderRegistry registry, LookupTables tables, RandomGenerator random) {
    this.registry = registry;
    this.tables = tables;
    this.random = random;
  }

  public Object resolve(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> resolved = new LinkedHashMap<>();
      map.forEach((k, v) -> resolved.put(k, resolve(v)));
      return resolved;
    }
    if (value instanceof List<?> list) {
      List<Object> resolved = new ArrayList<>(list.size());
      list.forEach(item -> resolved.add(resolve(item)));
      return resolved;
    }
    if (value instanceof String text) {
      var provider = registry.lookup(text);
      if (provider.isPresent()) {
        return provider.get().provide(random);
      }
      return substitute(text);
    }
    return value;
  }

  /** Resolves a value that must end up as text, such as a path or header. */
  public String resolveText(Object value) {
    Object resolved = resolve(value);
    return resolved == null ? "" : String.valueOf(resolved);
  }

  private Object substitute(String text) {
    String expanded = registry.expandInline(text, random);
    Matcher matcher = VARIABLE.matcher(expanded);
    if (matcher.matches()) {
      var match = tables.find(matcher.group(1).trim());
      return match.isPresent() ? valueOf(match.get()) : expanded;
    }
    matcher.reset();
    var sb = new StringBuilder();
    while (matcher.find()) {
      var match = tables.find(matcher.group(1).trim());
      String replacement = match.isPresent() ? textOf(valueOf(match.get())) : matcher.group();
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  private Object valueOf(LookupTables.Match match) {
    Object value = match.value();
    if (match.table() == LookupTables.Table.GENERATORS
        && value instanceof Map<?, ?> definition
        && GeneratorFactory.isDefinition(definition)) {
      return registry.generator(match.name(), definition).provide(random);
    }
    return value;
  }

  private static String textOf(Object value) {
    return value == null ? "" : String.valueOf(value);
  }
}
