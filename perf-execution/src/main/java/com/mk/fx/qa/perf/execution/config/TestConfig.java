package com.mk.fx.qa.perf.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Immutable test configuration, loaded once per process and shared read-only by every worker.
 * Nested maps and lists are deep-frozen on construction; absent settings take their defaults.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestConfig(
    @JsonProperty("base_url") String baseUrl,
    @JsonProperty("endpoints") List<EndpointSpec> endpoints,
    @JsonProperty("num_workers") Integer numWorkers,
    @JsonProperty("requests_per_endpoint") Integer requestsPerEndpoint,
    @JsonProperty("num_test_runs") Integer numTestRuns,
    @JsonProperty("default_headers") Map<String, String> defaultHeaders,
    @JsonProperty("variables") Map<String, Object> variables,
    @JsonProperty("generators") Map<String, Object> generators,
    @JsonProperty("datasets") Map<String, Object> datasets,
    @JsonProperty("ranges") Map<String, Object> ranges,
    @JsonProperty("timeout") Integer timeoutSeconds,
    @JsonProperty("connect_timeout") Integer connectTimeoutSeconds,
    @JsonProperty("seed") Long seed,
    @JsonProperty("scenarios") Map<String, ScenarioSpec> scenarios,
    @JsonProperty("report") ReportSpec report) {

  public static final int DEFAULT_WORKERS = 10;
  public static final int DEFAULT_REQUESTS_PER_ENDPOINT = 100;
  public static final int DEFAULT_TEST_RUNS = 5;
  public static final int DEFAULT_TIMEOUT_SECONDS = 30;
  public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 5;

  public TestConfig {
    endpoints = ConfigValues.freezeList(endpoints);
    numWorkers = numWorkers != null ? numWorkers : DEFAULT_WORKERS;
    requestsPerEndpoint =
        requestsPerEndpoint != null ? requestsPerEndpoint : DEFAULT_REQUESTS_PER_ENDPOINT;
    numTestRuns = numTestRuns != null ? numTestRuns : DEFAULT_TEST_RUNS;
    defaultHeaders = ConfigValues.freezeMap(defaultHeaders);
    variables = ConfigValues.freezeMap(variables);
    generators = ConfigValues.freezeMap(generators);
    datasets = ConfigValues.freezeMap(datasets);
    ranges = ConfigValues.freezeMap(ranges);
    timeoutSeconds = timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
    connectTimeoutSeconds =
        connectTimeoutSeconds != null ? connectTimeoutSeconds : DEFAULT_CONNECT_TIMEOUT_SECONDS;
    scenarios = ConfigValues.freezeMap(scenarios);
    report = report != null ? report : ReportSpec.defaults();
  }

  /**
   * Returns a copy with the named scenario's overrides applied.
   *
   * @param scenarioName key under {@code scenarios}
   * @return the overridden configuration
   * @throws ConfigurationException if the scenario or one of its endpoint names is unknown
   */
  public TestConfig withScenario(String scenarioName) {
    ScenarioSpec scenario = scenarios.get(scenarioName);
    if (scenario == null) {
      throw new ConfigurationException(
          "Unknown scenario '" + scenarioName + "', available: " + scenarios.keySet());
    }
    var builder = toBuilder();
    if (scenario.numWorkers() != null) builder.numWorkers(scenario.numWorkers());
    if (scenario.requestsPerEndpoint() != null)
      builder.requestsPerEndpoint(scenario.requestsPerEndpoint());
    if (scenario.numTestRuns() != null) builder.numTestRuns(scenario.numTestRuns());
    if (!scenario.endpoints().isEmpty()) {
      List<EndpointSpec> selected = new ArrayList<>();
      for (String name : scenario.endpoints()) {
        EndpointSpec match =
            endpoints.stream()
                .filter(e -> name.equals(e.name()))
                .findFirst()
                .orElseThrow(
                    () ->
                        new ConfigurationException(
                            "Scenario '" + scenarioName + "' references unknown endpoint '" + name + "'"));
        selected.add(match);
      }
      builder.endpoints(selected);
    }
    return builder.build();
  }

  public TestConfig withSeed(Long newSeed) {
    return toBuilder().seed(newSeed).build();
  }
}
