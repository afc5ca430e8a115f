package com.mk.fx.qa.perf.execution.metrics;

import com.mk.fx.qa.perf.execution.executors.ErrorClassifier;
import com.mk.fx.qa.perf.execution.executors.RequestOutcome;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only summary of one run. Latency figures cover successful requests only; when there are
 * none they are zero and {@code noSuccessfulRequests} is set.
 *
 * @param runIndex 1-based run number
 * @param totalRequests outcomes collected
 * @param successfulRequests successful outcomes
 * @param failedRequests failed outcomes
 * @param successRate percentage of successful outcomes, 0 when nothing ran
 * @param latency distribution over successful outcomes
 * @param latencySamples successful latencies in collection order
 * @param errors first {@value #MAX_ERROR_RECORDS} failures
 * @param totalErrors number of failures
 * @param errorBreakdown failures per category
 * @param failedEndpoints endpoints whose task failed and were excluded
 * @param noSuccessfulRequests {@code true} when no request succeeded
 * @param startedAt run start
 * @param finishedAt run end
 */
public record RunStatistics(
    int runIndex,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double successRate,
    LatencyStats latency,
    List<Double> latencySamples,
    List<ErrorRecord> errors,
    long totalErrors,
    Map<String, Long> errorBreakdown,
    List<String> failedEndpoints,
    boolean noSuccessfulRequests,
    Instant startedAt,
    Instant finishedAt) {

  public static final int MAX_ERROR_RECORDS = 100;

  public RunStatistics {
    latencySamples = List.copyOf(latencySamples);
    errors = List.copyOf(errors);
    errorBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(errorBreakdown));
    failedEndpoints = List.copyOf(failedEndpoints);
  }

  public static RunStatistics from(
      int runIndex,
      List<RequestOutcome> outcomes,
      List<String> failedEndpoints,
      Instant startedAt,
      Instant finishedAt) {
    List<Double> latencies = new ArrayList<>();
    List<ErrorRecord> errors = new ArrayList<>();
    Map<String, Long> breakdown = new LinkedHashMap<>();
    long failed = 0;
    for (RequestOutcome outcome : outcomes) {
      if (outcome.success()) {
        latencies.add(outcome.responseTimeMs());
        continue;
      }
      failed++;
      var type = outcome.errorType() != null ? outcome.errorType() : ErrorClassifier.UNKNOWN;
      breakdown.merge(type, 1L, Long::sum);
      if (errors.size() < MAX_ERROR_RECORDS) {
        errors.add(ErrorRecord.from(outcome));
      }
    }
    long total = outcomes.size();
    long successful = latencies.size();
    return new RunStatistics(
        runIndex,
        total,
        successful,
        failed,
        rate(successful, total),
        LatencyStats.of(latencies),
        latencies,
        errors,
        failed,
        breakdown,
        failedEndpoints,
        successful == 0,
        startedAt,
        finishedAt);
  }

  static double rate(long successful, long total) {
    return total == 0 ? 0.0 : successful * 100.0 / total;
  }

  public Duration duration() {
    if (startedAt == null || finishedAt == null) {
      return Duration.ZERO;
    }
    return Duration.between(startedAt, finishedAt);
  }

  /** Requests per second over the run's wall-clock duration. */
  public double achievedRps() {
    long millis = duration().toMillis();
    return millis <= 0 ? 0.0 : totalRequests * 1000.0 / millis;
  }

  public RunStatistics withErrors(List<ErrorRecord> replacement) {
    return new RunStatistics(
        runIndex,
        totalRequests,
        successfulRequests,
        failedRequests,
        successRate,
        latency,
        latencySamples,
        replacement,
        totalErrors,
        errorBreakdown,
        failedEndpoints,
        noSuccessfulRequests,
        startedAt,
        finishedAt);
  }
}
