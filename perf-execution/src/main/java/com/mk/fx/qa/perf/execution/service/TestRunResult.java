package com.mk.fx.qa.perf.execution.service;

import com.mk.fx.qa.perf.execution.metrics.AggregateStatistics;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import java.time.Instant;
import java.util.List;

/** Everything a completed test produced: each run in order plus the aggregate. */
public record TestRunResult(
    List<RunStatistics> runs, AggregateStatistics aggregate, Instant startedAt, Instant finishedAt) {

  public TestRunResult {
    runs = List.copyOf(runs);
  }
}
