package com.mk.fx.qa.perf.execution.metrics;

/** Per-run line of the aggregate trend table. */
public record RunSummary(
    int runIndex,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double successRate,
    double avgLatencyMs,
    boolean noSuccessfulRequests) {

  public static RunSummary of(RunStatistics run) {
    return new RunSummary(
        run.runIndex(),
        run.totalRequests(),
        run.successfulRequests(),
        run.failedRequests(),
        run.successRate(),
        run.latency().avgMs(),
        run.noSuccessfulRequests());
  }
}
