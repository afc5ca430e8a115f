package com.mk.fx.qa.perf.execution.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TestConfigTest {

  private static EndpointSpec endpoint(String name) {
    return EndpointSpec.builder().name(name).path("/" + name).build();
  }

  private static TestConfig config() {
    return TestConfig.builder()
        .baseUrl("http://api")
        .endpoints(List.of(endpoint("a"), endpoint("b"), endpoint("c")))
        .numWorkers(8)
        .requestsPerEndpoint(50)
        .numTestRuns(3)
        .scenarios(
            Map.of(
                "smoke", new ScenarioSpec(1, 5, 1, List.of("c", "a")),
                "wide", new ScenarioSpec(20, null, null, null),
                "broken", new ScenarioSpec(null, null, null, List.of("zzz"))))
        .build();
  }

  @Test
  void withScenario_overridesVolumeAndSelectsEndpointsInScenarioOrder() {
    var smoke = config().withScenario("smoke");

    assertEquals(1, smoke.numWorkers());
    assertEquals(5, smoke.requestsPerEndpoint());
    assertEquals(1, smoke.numTestRuns());
    assertEquals(List.of("c", "a"), smoke.endpoints().stream().map(EndpointSpec::name).toList());
  }

  @Test
  void withScenario_keepsUnsetValues() {
    var wide = config().withScenario("wide");

    assertEquals(20, wide.numWorkers());
    assertEquals(50, wide.requestsPerEndpoint());
    assertEquals(3, wide.numTestRuns());
    assertEquals(3, wide.endpoints().size());
  }

  @Test
  void withScenario_unknownNames_areConfigurationErrors() {
    var config = config();
    assertThrows(ConfigurationException.class, () -> config.withScenario("missing"));
    var ex = assertThrows(ConfigurationException.class, () -> config.withScenario("broken"));
    assertTrue(ex.getMessage().contains("zzz"));
  }

  @Test
  void endpointDefaults_andDisplayName() {
    var spec = EndpointSpec.builder().path("/x").method(" patch ").build();
    assertEquals("PATCH", spec.method());
    assertTrue(spec.jsonContent());
    assertFalse(spec.hasDelay());
    assertEquals("PATCH /x", spec.displayName());
    assertTrue(spec.headers().isEmpty());
  }
}
