package com.mk.fx.qa.perf.execution.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.perf.execution.config.PayloadLoader;
import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.executors.EndpointRunner;
import com.mk.fx.qa.perf.execution.executors.RequestExecutor;
import com.mk.fx.qa.perf.execution.executors.RequestFactory;
import com.mk.fx.qa.perf.execution.executors.TestOrchestrator;
import com.mk.fx.qa.perf.execution.metrics.RunAggregator;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import com.mk.fx.qa.perf.execution.template.LookupTables;
import com.mk.fx.qa.perf.execution.template.ValueProviderRegistry;
import com.mk.fx.qa.perf.rest.HttpTransport;
import com.mk.fx.qa.perf.rest.LoadHttpClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a whole test: {@code num_test_runs} passes over every endpoint, followed by aggregation.
 *
 * <p>One HTTP transport and one provider registry are built per test and shared by every run.
 * Randomness comes from a master generator, seeded when the configuration sets {@code seed}, that
 * is split once per run.
 */
@Slf4j
@Service
public class PerformanceTestService {

  private final Clock clock;
  private final Function<TestConfig, HttpTransport> transportFactory;

  public PerformanceTestService() {
    this(
        Clock.systemUTC(),
        config ->
            new LoadHttpClient(
                config.connectTimeoutSeconds(), config.timeoutSeconds(), config.defaultHeaders()));
  }

  @VisibleForTesting
  PerformanceTestService(Clock clock, Function<TestConfig, HttpTransport> transportFactory) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
  }

  /**
   * Executes every run of the test.
   *
   * @param config validated configuration
   * @param payloadLoader resolver for {@code @path} bodies
   * @param listener progress callbacks, invoked on the calling thread
   * @return per-run statistics and their aggregate
   */
  public TestRunResult runAll(TestConfig config, PayloadLoader payloadLoader, ProgressListener listener) {
    Objects.requireNonNull(config, "config");
    var progress = listener != null ? listener : ProgressListener.NONE;
    var startedAt = clock.instant();

    var tables = LookupTables.from(config);
    var registry = new ValueProviderRegistry(tables, clock);
    var executor = new RequestExecutor(transportFactory.apply(config));
    var runner =
        new EndpointRunner(new RequestFactory(config, payloadLoader), executor, config.requestsPerEndpoint());
    var orchestrator = new TestOrchestrator(config, runner, registry, tables, clock);
    var master = config.seed() != null ? new SplittableRandom(config.seed()) : new SplittableRandom();

    if (config.seed() != null) {
      log.info("Using random seed {}", config.seed());
    }
    progress.onTestStarted(config);

    List<RunStatistics> runs = new ArrayList<>();
    for (int runIndex = 1; runIndex <= config.numTestRuns(); runIndex++) {
      progress.onRunStarted(runIndex, config.numTestRuns());
      var run = orchestrator.runOnce(runIndex, master.split());
      runs.add(run);
      progress.onRunCompleted(run);
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Interrupted after run {}/{}, skipping remaining runs", runIndex, config.numTestRuns());
        break;
      }
    }

    var aggregate = RunAggregator.aggregate(runs);
    progress.onTestCompleted(aggregate, runs);
    return new TestRunResult(runs, aggregate, startedAt, clock.instant());
  }
}
