package com.mk.fx.qa.perf.execution.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics combined over several runs. The latency distribution is recomputed over every run's
 * samples, not averaged from per-run figures.
 */
public record AggregateStatistics(
    int runCount,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double successRate,
    LatencyStats latency,
    List<ErrorRecord> errors,
    long totalErrors,
    Map<String, Long> errorBreakdown,
    List<String> failedEndpoints,
    List<RunSummary> runs,
    boolean noSuccessfulRequests) {

  public AggregateStatistics {
    errors = List.copyOf(errors);
    errorBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(errorBreakdown));
    failedEndpoints = List.copyOf(failedEndpoints);
    runs = List.copyOf(runs);
  }

  public AggregateStatistics withErrors(List<ErrorRecord> replacement) {
    return new AggregateStatistics(
        runCount,
        totalRequests,
        successfulRequests,
        failedRequests,
        successRate,
        latency,
        replacement,
        totalErrors,
        errorBreakdown,
        failedEndpoints,
        runs,
        noSuccessfulRequests);
  }
}
