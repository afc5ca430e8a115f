package com.mk.fx.qa.perf.execution.config;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.perf.execution.cfg.ObjectMapperConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestConfigLoaderTest {

  private static final ObjectMapperConfig MAPPERS = new ObjectMapperConfig();

  @TempDir Path dir;

  private final TestConfigLoader loader =
      new TestConfigLoader(MAPPERS.objectMapper(), MAPPERS.yamlObjectMapper());

  private Path write(String name, String content) throws IOException {
    var path = dir.resolve(name);
    Files.writeString(path, content);
    return path;
  }

  @Test
  void load_yaml_appliesDefaultsAndKeepsEndpointOrder() throws IOException {
    var path =
        write(
            "config.yaml",
            "base_url: http://localhost:8080\n"
                + "endpoints:\n"
                + "  - name: first\n"
                + "    path: /a\n"
                + "  - name: second\n"
                + "    method: post\n"
                + "    path: /b\n"
                + "    delay: 25\n"
                + "    json_content: false\n"
                + "    data: {x: 1}\n"
                + "log:\n"
                + "  level: INFO\n");

    var config = loader.load(path);

    assertEquals("http://localhost:8080", config.baseUrl());
    assertEquals(10, config.numWorkers());
    assertEquals(100, config.requestsPerEndpoint());
    assertEquals(5, config.numTestRuns());
    assertEquals(30, config.timeoutSeconds());
    assertEquals(5, config.connectTimeoutSeconds());
    assertNull(config.seed());
    assertEquals("reports", config.report().outputDir());
    assertEquals(List.of("first", "second"), config.endpoints().stream().map(EndpointSpec::name).toList());

    var second = config.endpoints().get(1);
    assertEquals("POST", second.method());
    assertEquals(25L, second.delayMs());
    assertFalse(second.jsonContent());
    assertEquals(Map.of("x", 1), second.data());
    assertTrue(config.endpoints().get(0).jsonContent());
    assertEquals("GET", config.endpoints().get(0).method());
  }

  @Test
  void load_json_readsLookupTablesAndScenarios() throws IOException {
    var path =
        write(
            "config.json",
            "{\n"
                + "  // comments are allowed\n"
                + "  \"base_url\": \"http://api\",\n"
                + "  \"num_workers\": 2,\n"
                + "  \"seed\": 99,\n"
                + "  \"variables\": {\"item_id\": 7},\n"
                + "  \"datasets\": {\"colors\": [\"red\", \"blue\"]},\n"
                + "  \"ranges\": {\"age\": {\"min\": 1, \"max\": 9}},\n"
                + "  \"endpoints\": [{\"name\": \"items\", \"path\": \"/items\"}],\n"
                + "  \"scenarios\": {\"smoke\": {\"num_workers\": 1, \"endpoints\": [\"items\"]}},\n"
                + "}\n");

    var config = loader.load(path);

    assertEquals(2, config.numWorkers());
    assertEquals(99L, config.seed());
    assertEquals(7, config.variables().get("item_id"));
    assertEquals(List.of("red", "blue"), config.datasets().get("colors"));
    assertEquals(1, config.scenarios().get("smoke").numWorkers());
    assertThrows(UnsupportedOperationException.class, () -> config.variables().put("x", 1));
  }

  @Test
  void load_missingFile_isConfigurationError() {
    var ex = assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("absent.yaml")));
    assertTrue(ex.getMessage().contains("not found"));
  }

  @Test
  void load_malformedDocument_isConfigurationError() throws IOException {
    var path = write("broken.yaml", "base_url: [unclosed\n");
    assertThrows(ConfigurationException.class, () -> loader.load(path));
  }

  @Test
  void load_emptyDocument_isConfigurationError() throws IOException {
    var path = write("empty.yaml", "");
    assertThrows(ConfigurationException.class, () -> loader.load(path));
  }

  @Test
  void validate_rejectsMissingRequiredFields() throws IOException {
    assertMessage(write("a.yaml", "endpoints:\n  - path: /a\n"), "base_url");
    assertMessage(write("b.yaml", "base_url: http://x\n"), "endpoints");
    assertMessage(write("c.yaml", "base_url: http://x\nendpoints:\n  - method: GET\n"), "path");
    assertMessage(
        write("d.yaml", "base_url: http://x\nnum_workers: 0\nendpoints:\n  - path: /a\n"), "num_workers");
    assertMessage(
        write("e.yaml", "base_url: http://x\nendpoints:\n  - path: /a\n    method: FETCH\n"), "FETCH");
    assertMessage(
        write("f.yaml", "base_url: http://x\nendpoints:\n  - path: /a\n    delay: -1\n"), "delay");
  }

  @Test
  void validate_rejectsBadGeneratorAndRangeDefinitions() throws IOException {
    assertMessage(
        write(
            "g.yaml",
            "base_url: http://x\nendpoints:\n  - path: /a\ngenerators:\n  g:\n    type: nonsense\n"),
        "generators.g");
    assertMessage(
        write("r.yaml", "base_url: http://x\nendpoints:\n  - path: /a\nranges:\n  r:\n    min: 1\n"),
        "ranges.r");
  }

  @Test
  void payloadLoaderFor_resolvesRelativeToConfigDirectory() throws IOException {
    var path = write("config.yaml", "base_url: http://x\nendpoints:\n  - path: /a\n");
    write("body.json", "{\"name\": \"widget\"}");

    var payloads = loader.payloadLoaderFor(path);

    assertEquals(Map.of("name", "widget"), payloads.load("@body.json"));
  }

  private void assertMessage(Path path, String fragment) {
    var ex = assertThrows(ConfigurationException.class, () -> loader.load(path));
    assertTrue(ex.getMessage().contains(fragment), () -> "expected '" + fragment + "' in: " + ex.getMessage());
  }
}
