package com.mk.fx.qa.perf.execution.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.perf.execution.config.EndpointSpec;
import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import com.mk.fx.qa.perf.execution.template.LookupTables;
import com.mk.fx.qa.perf.execution.template.TemplateResolver;
import com.mk.fx.qa.perf.execution.template.ValueProviderRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one pass over every endpoint. Each endpoint is one task on a fixed pool of at most
 * {@code num_workers} threads; extra tasks queue until a thread frees up. Results are collected in
 * completion order. A task that fails is logged and excluded without affecting its siblings.
 *
 * <p>Each task resolves templates with its own random generator, split from the run's master in
 * submission order, so a seeded master reproduces every generated value.
 */
@Slf4j
public class TestOrchestrator {

  private static final long TERMINATION_TIMEOUT_SECONDS = 30;

  private final TestConfig config;
  private final EndpointRunner endpointRunner;
  private final ValueProviderRegistry registry;
  private final LookupTables tables;
  private final Clock clock;

  public TestOrchestrator(
      TestConfig config,
      EndpointRunner endpointRunner,
      ValueProviderRegistry registry,
      LookupTables tables,
      Clock clock) {
    this.config = config;
    this.endpointRunner = endpointRunner;
    this.registry = registry;
    this.tables = tables;
    this.clock = clock;
  }

  /**
   * Executes one run.
   *
   * @param runIndex 1-based run number, used for thread names and logs
   * @param random master generator for this run
   * @return statistics over the outcomes of every endpoint task that completed
   */
  public RunStatistics runOnce(int runIndex, SplittableRandom random) {
    var startedAt = clock.instant();
    List<EndpointSpec> endpoints = config.endpoints();
    int workers = Math.max(1, Math.min(config.numWorkers(), endpoints.size()));

    var threadCounter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("perf-run-" + runIndex + "-worker-" + threadCounter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };

    var executor = newFixedThreadPool(workers, threadFactory);
    var completion = new ExecutorCompletionService<List<RequestOutcome>>(executor);
    Map<Future<List<RequestOutcome>>, EndpointSpec> submitted = new HashMap<>();
    List<RequestOutcome> outcomes = new ArrayList<>();
    List<String> failedEndpoints = new ArrayList<>();

    log.info("Run {} starting {} endpoint tasks on {} workers", runIndex, endpoints.size(), workers);
    try {
      for (EndpointSpec endpoint : endpoints) {
        var resolver = new TemplateResolver(registry, tables, random.split());
        submitted.put(completion.submit(() -> endpointRunner.run(endpoint, resolver)), endpoint);
      }

      for (int i = 0; i < submitted.size(); i++) {
        Future<List<RequestOutcome>> future = completion.take();
        var endpoint = submitted.get(future);
        try {
          outcomes.addAll(future.get());
        } catch (ExecutionException e) {
          var cause = e.getCause() != null ? e.getCause() : e;
          log.error(
              "Run {} endpoint {} failed and is excluded from results: {}",
              runIndex,
              endpoint.displayName(),
              cause.getMessage(),
              cause);
          failedEndpoints.add(endpoint.displayName());
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Run {} interrupted, reporting {} collected outcomes", runIndex, outcomes.size());
    } finally {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Run {} workers did not terminate within {}s", runIndex, TERMINATION_TIMEOUT_SECONDS);
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    var statistics = RunStatistics.from(runIndex, outcomes, failedEndpoints, startedAt, clock.instant());
    log.info(
        "Run {} completed: {} requests, {} successful, {} failed",
        runIndex,
        statistics.totalRequests(),
        statistics.successfulRequests(),
        statistics.failedRequests());
    return statistics;
  }
}
