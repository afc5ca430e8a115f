package com.mk.fx.qa.perf.execution.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.perf.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.perf.execution.template.GeneratorFactory;
import com.mk.fx.qa.perf.rest.HttpMethod;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Reads a {@link TestConfig} from a YAML or JSON document and checks the settings the runner cannot
 * work without. Every failure surfaces as a {@link ConfigurationException}.
 */
@Slf4j
@Component
public class TestConfigLoader {

  private final ObjectMapper jsonMapper;
  private final ObjectMapper yamlMapper;

  public TestConfigLoader(
      ObjectMapper jsonMapper, @Qualifier(ObjectMapperConfig.YAML_MAPPER) ObjectMapper yamlMapper) {
    this.jsonMapper = jsonMapper;
    this.yamlMapper = yamlMapper;
  }

  public TestConfig load(Path path) {
    if (path == null || !Files.isRegularFile(path)) {
      throw new ConfigurationException("Configuration file not found: " + path);
    }
    var mapper = isJson(path) ? jsonMapper : yamlMapper;
    TestConfig config;
    try (var reader = Files.newBufferedReader(path)) {
      config = mapper.readValue(reader, TestConfig.class);
    } catch (JsonProcessingException e) {
      throw new ConfigurationException(
          "Malformed configuration " + path + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read configuration " + path + ": " + e.getMessage(), e);
    }
    if (config == null) {
      throw new ConfigurationException("Configuration file is empty: " + path);
    }
    validate(config);
    log.info(
        "Loaded configuration {} - baseUrl={}, endpoints={}, workers={}, requestsPerEndpoint={}, runs={}",
        path,
        config.baseUrl(),
        config.endpoints().size(),
        config.numWorkers(),
        config.requestsPerEndpoint(),
        config.numTestRuns());
    return config;
  }

  /**
   * Checks required fields and value ranges.
   *
   * @throws ConfigurationException describing the first problem found
   */
  public void validate(TestConfig config) {
    if (config.baseUrl() == null || config.baseUrl().isBlank()) {
      throw new ConfigurationException("base_url is required");
    }
    if (config.endpoints().isEmpty()) {
      throw new ConfigurationException("endpoints must contain at least one endpoint");
    }
    requirePositive("num_workers", config.numWorkers());
    requirePositive("requests_per_endpoint", config.requestsPerEndpoint());
    requirePositive("num_test_runs", config.numTestRuns());
    requirePositive("timeout", config.timeoutSeconds());
    requirePositive("connect_timeout", config.connectTimeoutSeconds());

    for (int i = 0; i < config.endpoints().size(); i++) {
      var endpoint = config.endpoints().get(i);
      var label = "endpoints[" + i + "]";
      if (endpoint == null) {
        throw new ConfigurationException(label + " is empty");
      }
      if (endpoint.path() == null || endpoint.path().isBlank()) {
        throw new ConfigurationException(label + ".path is required");
      }
      try {
        HttpMethod.from(endpoint.method());
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException(label + ": " + e.getMessage(), e);
      }
      if (endpoint.delayMs() != null && endpoint.delayMs() < 0) {
        throw new ConfigurationException(label + ".delay must not be negative");
      }
      if (endpoint.timeoutSeconds() != null) {
        requirePositive(label + ".timeout", endpoint.timeoutSeconds());
      }
    }

    for (Map.Entry<String, Object> generator : config.generators().entrySet()) {
      if (generator.getValue() instanceof Map<?, ?> definition
          && GeneratorFactory.isDefinition(definition)) {
        try {
          GeneratorFactory.fromDefinition(generator.getKey(), definition, Clock.systemUTC());
        } catch (IllegalArgumentException e) {
          throw new ConfigurationException("generators." + generator.getKey() + ": " + e.getMessage(), e);
        }
      }
    }

    for (Map.Entry<String, Object> range : config.ranges().entrySet()) {
      try {
        GeneratorFactory.rangeFrom(range.getKey(), range.getValue());
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("ranges." + range.getKey() + ": " + e.getMessage(), e);
      }
    }
  }

  /** Payload loader resolving {@code @path} bodies against the configuration file's directory. */
  public PayloadLoader payloadLoaderFor(Path configPath) {
    var parent = configPath.toAbsolutePath().getParent();
    return new PayloadLoader(parent, jsonMapper, yamlMapper);
  }

  private static void requirePositive(String field, Integer value) {
    if (value == null || value < 1) {
      throw new ConfigurationException(field + " must be a positive number, got " + value);
    }
  }

  private static boolean isJson(Path path) {
    return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
  }
}
