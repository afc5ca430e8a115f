package com.mk.fx.qa.perf.execution.report;

import com.mk.fx.qa.perf.execution.metrics.AggregateStatistics;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/** Renders statistics to a report file. */
public interface ReportGenerator {

  /**
   * Writes the report for a single run.
   *
   * @return the written file, or empty when this format has no per-run report
   * @throws IOException if the file cannot be written
   */
  Optional<Path> writeRun(RunStatistics run, ReportContext context) throws IOException;

  /**
   * Writes the report over all runs.
   *
   * @return the written file
   * @throws IOException if the file cannot be written
   */
  Path writeSummary(AggregateStatistics aggregate, ReportContext context) throws IOException;
}
