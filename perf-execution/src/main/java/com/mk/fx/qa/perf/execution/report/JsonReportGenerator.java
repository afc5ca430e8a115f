package com.mk.fx.qa.perf.execution.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.perf.execution.metrics.AggregateStatistics;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Machine-readable summary of a test, written once after all runs. */
public class JsonReportGenerator implements ReportGenerator {

  private final ObjectMapper objectMapper;

  public JsonReportGenerator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<Path> writeRun(RunStatistics run, ReportContext context) {
    return Optional.empty();
  }

  @Override
  public Path writeSummary(AggregateStatistics aggregate, ReportContext context) throws IOException {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("generatedAt", context.generatedAt());
    document.put("baseUrl", context.baseUrl());
    document.put("scenario", context.scenario());
    document.put("environment", context.environment());
    document.put("statistics", aggregate);

    var target = context.summaryFile("json");
    Files.createDirectories(target.toAbsolutePath().getParent());
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
    return target;
  }
}
