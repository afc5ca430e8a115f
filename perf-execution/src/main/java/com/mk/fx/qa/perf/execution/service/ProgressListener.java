package com.mk.fx.qa.perf.execution.service;

import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.metrics.AggregateStatistics;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import java.util.List;

/** Callbacks fired by {@link PerformanceTestService} as a test progresses. */
public interface ProgressListener {

  ProgressListener NONE = new ProgressListener() {};

  default void onTestStarted(TestConfig config) {}

  default void onRunStarted(int runIndex, int totalRuns) {}

  default void onRunCompleted(RunStatistics run) {}

  default void onTestCompleted(AggregateStatistics aggregate, List<RunStatistics> runs) {}

  /** Forwards every callback to the given listeners in order. */
  static ProgressListener composite(ProgressListener... listeners) {
    var delegates = List.of(listeners);
    return new ProgressListener() {
      @Override
      public void onTestStarted(TestConfig config) {
        delegates.forEach(l -> l.onTestStarted(config));
      }

      @Override
      public void onRunStarted(int runIndex, int totalRuns) {
        delegates.forEach(l -> l.onRunStarted(runIndex, totalRuns));
      }

      @Override
      public void onRunCompleted(RunStatistics run) {
        delegates.forEach(l -> l.onRunCompleted(run));
      }

      @Override
      public void onTestCompleted(AggregateStatistics aggregate, List<RunStatistics> runs) {
        delegates.forEach(l -> l.onTestCompleted(aggregate, runs));
      }
    };
  }
}
