package com.mk.fx.qa.perf.execution.service;

import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.metrics.AggregateStatistics;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes the console progress summary through the application log. */
@Slf4j
@Component
public class LoggingProgressListener implements ProgressListener {

  @Override
  public void onTestStarted(TestConfig config) {
    log.info(
        "Running performance tests against {} with {} workers: {} endpoints x {} requests, {} runs",
        config.baseUrl(),
        config.numWorkers(),
        config.endpoints().size(),
        config.requestsPerEndpoint(),
        config.numTestRuns());
  }

  @Override
  public void onRunStarted(int runIndex, int totalRuns) {
    log.info("--- Test Run {}/{} ---", runIndex, totalRuns);
  }

  @Override
  public void onRunCompleted(RunStatistics run) {
    log.info(
        "Test Run {} Summary: total={} successful={} failed={} successRate={}% avgResponseTime={} ms",
        run.runIndex(),
        run.totalRequests(),
        run.successfulRequests(),
        run.failedRequests(),
        format(run.successRate()),
        format(run.latency().avgMs()));
    if (run.noSuccessfulRequests()) {
      log.warn("Test Run {}: no successful requests", run.runIndex());
    }
    if (!run.failedEndpoints().isEmpty()) {
      log.warn("Test Run {}: endpoints excluded after task failure: {}", run.runIndex(), run.failedEndpoints());
    }
  }

  @Override
  public void onTestCompleted(AggregateStatistics aggregate, List<RunStatistics> runs) {
    log.info(
        "All {} runs completed: total={} successful={} failed={} successRate={}% "
            + "avg={} ms min={} ms max={} ms p95={} ms",
        aggregate.runCount(),
        aggregate.totalRequests(),
        aggregate.successfulRequests(),
        aggregate.failedRequests(),
        format(aggregate.successRate()),
        format(aggregate.latency().avgMs()),
        format(aggregate.latency().minMs()),
        format(aggregate.latency().maxMs()),
        format(aggregate.latency().p95Ms()));
    if (aggregate.noSuccessfulRequests()) {
      log.warn("No successful requests across {} runs", aggregate.runCount());
    }
  }

  static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
