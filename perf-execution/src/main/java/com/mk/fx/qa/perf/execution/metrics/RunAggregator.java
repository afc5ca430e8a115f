package com.mk.fx.qa.perf.execution.metrics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Combines per-run statistics into {@link AggregateStatistics}. */
public final class RunAggregator {

  public static final int ERROR_PREVIEW = 10;

  private RunAggregator() {
    throw new UnsupportedOperationException("RunAggregator cannot be instantiated");
  }

  /**
   * Aggregates runs in the given order.
   *
   * @param runs per-run statistics, in run order
   * @return combined statistics; all zero for an empty list
   */
  public static AggregateStatistics aggregate(List<RunStatistics> runs) {
    long total = 0;
    long successful = 0;
    long failed = 0;
    long totalErrors = 0;
    List<Double> latencies = new ArrayList<>();
    List<ErrorRecord> errors = new ArrayList<>();
    Map<String, Long> breakdown = new LinkedHashMap<>();
    Set<String> failedEndpoints = new LinkedHashSet<>();
    List<RunSummary> summaries = new ArrayList<>();

    for (RunStatistics run : runs) {
      total += run.totalRequests();
      successful += run.successfulRequests();
      failed += run.failedRequests();
      totalErrors += run.totalErrors();
      latencies.addAll(run.latencySamples());
      for (ErrorRecord error : run.errors()) {
        if (errors.size() >= ERROR_PREVIEW) break;
        errors.add(error);
      }
      run.errorBreakdown().forEach((type, count) -> breakdown.merge(type, count, Long::sum));
      failedEndpoints.addAll(run.failedEndpoints());
      summaries.add(RunSummary.of(run));
    }

    return new AggregateStatistics(
        runs.size(),
        total,
        successful,
        failed,
        RunStatistics.rate(successful, total),
        LatencyStats.of(latencies),
        errors,
        totalErrors,
        breakdown,
        new ArrayList<>(failedEndpoints),
        summaries,
        successful == 0);
  }
}
