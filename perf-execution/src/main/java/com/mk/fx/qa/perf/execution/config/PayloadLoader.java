package com.mk.fx.qa.perf.execution.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Replaces {@code @path} body references with the referenced file's content. JSON and YAML files
 * are parsed into structured data, anything else is returned as text. Relative paths resolve
 * against the configuration file's directory. Loaded payloads are cached and frozen, so one file
 * read serves every request of every run.
 */
@Slf4j
public class PayloadLoader {

  public static final String FILE_MARKER = "@";

  private final Path baseDirectory;
  private final ObjectMapper jsonMapper;
  private final ObjectMapper yamlMapper;
  private final Map<Path, Object> cache = new ConcurrentHashMap<>();

  public PayloadLoader(Path baseDirectory, ObjectMapper jsonMapper, ObjectMapper yamlMapper) {
    this.baseDirectory = baseDirectory != null ? baseDirectory : Path.of("");
    this.jsonMapper = jsonMapper;
    this.yamlMapper = yamlMapper;
  }

  /**
   * Returns the raw body template for a configured {@code data} value.
   *
   * @throws UncheckedIOException if a referenced file cannot be read or parsed
   */
  public Object load(Object data) {
    if (data instanceof String reference && reference.startsWith(FILE_MARKER) && reference.length() > 1) {
      var path = baseDirectory.resolve(reference.substring(1).trim()).normalize();
      return cache.computeIfAbsent(path, this::read);
    }
    return data;
  }

  private Object read(Path path) {
    try {
      var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
      Object payload;
      if (name.endsWith(".json")) {
        payload = jsonMapper.readValue(path.toFile(), Object.class);
      } else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
        payload = yamlMapper.readValue(path.toFile(), Object.class);
      } else {
        payload = Files.readString(path, StandardCharsets.UTF_8);
      }
      log.debug("Loaded request payload from {}", path);
      return ConfigValues.freeze(payload);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot load request payload " + path + ": " + e.getMessage(), e);
    }
  }
}
