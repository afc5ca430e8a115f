package com.mk.fx.qa.perf.execution.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.perf.execution.config.ReportSpec;
import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.metrics.AggregateStatistics;
import com.mk.fx.qa.perf.execution.metrics.ErrorRecord;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import com.mk.fx.qa.perf.execution.service.ProgressListener;
import com.mk.fx.qa.perf.execution.utils.LoadUtils;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes the HTML and JSON reports of a test. A report that cannot be written is logged and
 * skipped; the other reports and the test results are unaffected.
 */
@Slf4j
@Component
public class ReportService {

  private static final DateTimeFormatter DEFAULT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final List<ReportGenerator> generators;
  private final Clock clock;

  @Autowired
  public ReportService(ObjectMapper objectMapper) {
    this(List.of(new HtmlReportGenerator(), new JsonReportGenerator(objectMapper)), Clock.systemDefaultZone());
  }

  public ReportService(List<ReportGenerator> generators, Clock clock) {
    this.generators = List.copyOf(generators);
    this.clock = clock;
  }

  /**
   * Creates the listener that writes reports while a test runs.
   *
   * @param config the configuration under test
   * @param outputDir directory override, {@code null} to use {@code report.output_dir}
   * @param scenario selected scenario name, or {@code null}
   */
  public ReportingListener listener(TestConfig config, Path outputDir, String scenario) {
    ReportSpec spec = config.report();
    var dir = outputDir != null ? outputDir : Path.of(spec.outputDir());
    var now = clock.instant();
    var timestamp = timestampFormatter(spec.timestampFormat()).format(now.atZone(clock.getZone()));
    var context =
        new ReportContext(dir, timestamp, now, config.baseUrl(), scenario, ReportEnvironment.current());
    return new ReportingListener(context, spec.includeRequestDetails());
  }

  private static DateTimeFormatter timestampFormatter(String pattern) {
    try {
      return LoadUtils.formatter(pattern);
    } catch (IllegalArgumentException e) {
      log.warn("Invalid report timestamp format '{}', using yyyyMMdd_HHmmss: {}", pattern, e.getMessage());
      return DEFAULT_TIMESTAMP;
    }
  }

  /** Progress listener that renders each run and the final summary. */
  public final class ReportingListener implements ProgressListener {

    private final ReportContext context;
    private final boolean includeRequestDetails;
    private final List<Path> written = new ArrayList<>();

    ReportingListener(ReportContext context, boolean includeRequestDetails) {
      this.context = context;
      this.includeRequestDetails = includeRequestDetails;
    }

    @Override
    public void onRunCompleted(RunStatistics run) {
      var view = includeRequestDetails ? run : run.withErrors(stripped(run.errors()));
      for (ReportGenerator generator : generators) {
        try {
          generator.writeRun(view, context).ifPresent(this::recordWritten);
        } catch (Exception e) {
          log.error(
              "Failed to write {} report for run {}: {}",
              generator.getClass().getSimpleName(),
              run.runIndex(),
              e.getMessage(),
              e);
        }
      }
    }

    @Override
    public void onTestCompleted(AggregateStatistics aggregate, List<RunStatistics> runs) {
      var view = includeRequestDetails ? aggregate : aggregate.withErrors(stripped(aggregate.errors()));
      for (ReportGenerator generator : generators) {
        try {
          recordWritten(generator.writeSummary(view, context));
        } catch (Exception e) {
          log.error(
              "Failed to write {} summary report: {}",
              generator.getClass().getSimpleName(),
              e.getMessage(),
              e);
        }
      }
    }

    public ReportContext context() {
      return context;
    }

    /** Files written so far, in write order. */
    public List<Path> writtenReports() {
      return Collections.unmodifiableList(written);
    }

    private void recordWritten(Path path) {
      written.add(path);
      log.info("Report generated: {}", path.toAbsolutePath());
    }

    private List<ErrorRecord> stripped(List<ErrorRecord> errors) {
      return errors.stream().map(ErrorRecord::withoutRequestData).toList();
    }
  }
}
