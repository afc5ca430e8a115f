package com.mk.fx.qa.perf.execution.cli;

import com.mk.fx.qa.perf.execution.cfg.PerfRunnerCfg;
import com.mk.fx.qa.perf.execution.config.ConfigurationException;
import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.config.TestConfigLoader;
import com.mk.fx.qa.perf.execution.report.ReportService;
import com.mk.fx.qa.perf.execution.service.LoggingProgressListener;
import com.mk.fx.qa.perf.execution.service.PerformanceTestService;
import com.mk.fx.qa.perf.execution.service.ProgressListener;
import java.nio.file.Path;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: loads the configuration, runs every test run, writes the reports and sets
 * the process exit code. Exit code is 0 when the test completes, even if every request failed, and
 * 1 on a configuration error or any unexpected failure.
 */
@Slf4j
@Component
public class PerfTestCommand implements ApplicationRunner, ExitCodeGenerator {

  static final String CONFIG_OPTION = "config";
  static final String OUTPUT_OPTION = "output";
  static final String SCENARIO_OPTION = "scenario";
  static final String SEED_OPTION = "seed";

  private final PerfRunnerCfg properties;
  private final TestConfigLoader configLoader;
  private final PerformanceTestService testService;
  private final ReportService reportService;
  private final LoggingProgressListener progressListener;

  @Getter private int exitCode;

  public PerfTestCommand(
      PerfRunnerCfg properties,
      TestConfigLoader configLoader,
      PerformanceTestService testService,
      ReportService reportService,
      LoggingProgressListener progressListener) {
    this.properties = properties;
    this.configLoader = configLoader;
    this.testService = testService;
    this.reportService = reportService;
    this.progressListener = progressListener;
  }

  @Override
  public void run(ApplicationArguments args) {
    exitCode = execute(args);
  }

  int execute(ApplicationArguments args) {
    try {
      var configPath = Path.of(option(args, CONFIG_OPTION, properties.getConfig()));
      var config = configLoader.load(configPath);

      var scenario = option(args, SCENARIO_OPTION, properties.getScenario());
      if (scenario != null && !scenario.isBlank()) {
        config = config.withScenario(scenario);
        configLoader.validate(config);
        log.info("Applied scenario {}", scenario);
      } else {
        scenario = null;
      }

      var seed = option(args, SEED_OPTION, properties.getSeed() != null ? properties.getSeed().toString() : null);
      if (seed != null && !seed.isBlank()) {
        config = config.withSeed(parseSeed(seed));
      }

      var outputDir = outputDir(option(args, OUTPUT_OPTION, null), config);

      var reports = reportService.listener(config, outputDir, scenario);
      var result =
          testService.runAll(
              config, configLoader.payloadLoaderFor(configPath), ProgressListener.composite(progressListener, reports));
      log.info(
          "Performance test finished: {} runs, {} requests, {} reports written to {}",
          result.runs().size(),
          result.aggregate().totalRequests(),
          reports.writtenReports().size(),
          reports.context().outputDir().toAbsolutePath());
      return 0;
    } catch (ConfigurationException e) {
      log.error("Configuration error: {}", e.getMessage());
      return 1;
    } catch (RuntimeException e) {
      log.error("Performance test failed: {}", e.getMessage(), e);
      return 1;
    }
  }

  /** {@code --output}, then {@code perf.runner.output-dir}, then {@code report.output_dir}. */
  Path outputDir(String outputOption, TestConfig config) {
    if (outputOption != null && !outputOption.isBlank()) {
      return Path.of(outputOption);
    }
    var fromProperties = properties.getOutputDir();
    if (fromProperties != null && !fromProperties.isBlank()) {
      return Path.of(fromProperties);
    }
    return Path.of(config.report().outputDir());
  }

  private static long parseSeed(String seed) {
    try {
      return Long.parseLong(seed.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("--seed must be a whole number, got " + seed, e);
    }
  }

  private static String option(ApplicationArguments args, String name, String fallback) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return fallback;
    }
    return values.get(values.size() - 1);
  }
}
