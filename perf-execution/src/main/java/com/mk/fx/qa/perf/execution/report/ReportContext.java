package com.mk.fx.qa.perf.execution.report;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Shared settings for every report of one test.
 *
 * @param outputDir directory reports are written to
 * @param timestamp formatted start time used in file names
 * @param generatedAt instant shown in the report header
 * @param baseUrl target of the test
 * @param scenario selected scenario, {@code null} when none
 * @param environment host and user
 */
public record ReportContext(
    Path outputDir,
    String timestamp,
    Instant generatedAt,
    String baseUrl,
    String scenario,
    ReportEnvironment environment) {

  public Path runFile(int runIndex, String extension) {
    return outputDir.resolve("performance_report_" + timestamp + "_run" + runIndex + "." + extension);
  }

  public Path summaryFile(String extension) {
    return outputDir.resolve("performance_report_" + timestamp + "_summary." + extension);
  }
}
