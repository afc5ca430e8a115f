package com.mk.fx.qa.perf.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Named override of the run volume. Any component left {@code null} keeps the top-level value; a
 * non-empty {@code endpoints} list restricts the run to those endpoint names.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScenarioSpec(
    @JsonProperty("num_workers") Integer numWorkers,
    @JsonProperty("requests_per_endpoint") Integer requestsPerEndpoint,
    @JsonProperty("num_test_runs") Integer numTestRuns,
    @JsonProperty("endpoints") List<String> endpoints) {

  public ScenarioSpec {
    endpoints = ConfigValues.freezeList(endpoints);
  }
}
