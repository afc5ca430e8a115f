package com.mk.fx.qa.perf.execution.report;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import com.mk.fx.qa.perf.execution.metrics.AggregateStatistics;
import com.mk.fx.qa.perf.execution.metrics.ErrorRecord;
import com.mk.fx.qa.perf.execution.metrics.LatencyStats;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import com.mk.fx.qa.perf.execution.metrics.RunSummary;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Human-readable HTML report, one per run plus a summary with the per-run trend. */
public class HtmlReportGenerator implements ReportGenerator {

  static final int ERROR_ROWS = 10;
  static final int MAX_ERROR_LENGTH = 100;
  static final String NO_SUCCESS_WARNING = "No successful requests to calculate response times";

  private static final Escaper HTML = HtmlEscapers.htmlEscaper();

  private static final String STYLE =
      "body { font-family: Arial, sans-serif; margin: 20px; }\n"
          + ".summary { background: #f5f5f5; padding: 15px; border-radius: 5px; margin-bottom: 20px; }\n"
          + ".metric { margin: 10px 0; }\n"
          + ".success { color: green; }\n"
          + ".error { color: red; }\n"
          + ".warning { color: orange; font-weight: bold; }\n"
          + "table { width: 100%; border-collapse: collapse; margin-top: 20px; }\n"
          + "th, td { border: 1px solid #ddd; padding: 8px; text-align: left; }\n"
          + "th { background-color: #f2f2f2; }\n"
          + "tr:nth-child(even) { background-color: #f9f9f9; }\n"
          + "pre { background: #f5f5f5; padding: 10px; border-radius: 4px; overflow-x: auto; }\n"
          + ".tips { margin-top: 20px; padding: 15px; background-color: #fff3cd; border-left: 5px solid #ffc107; }\n";

  @Override
  public Optional<Path> writeRun(RunStatistics run, ReportContext context) throws IOException {
    var html = new StringBuilder();
    open(html, "Performance Test Report - Run " + run.runIndex(), context);
    summary(
        html,
        run.totalRequests(),
        run.successfulRequests(),
        run.failedRequests(),
        run.successRate(),
        run.latency(),
        run.achievedRps());
    failedEndpoints(html, run.failedEndpoints());
    errors(html, run.errors(), run.totalErrors(), run.errorBreakdown());
    debuggingTips(html, run.totalRequests(), run.successfulRequests());
    html.append("</body></html>\n");
    return Optional.of(write(context.runFile(run.runIndex(), "html"), html));
  }

  @Override
  public Path writeSummary(AggregateStatistics aggregate, ReportContext context) throws IOException {
    var html = new StringBuilder();
    open(html, "Performance Test Report - Summary of " + aggregate.runCount() + " runs", context);
    summary(
        html,
        aggregate.totalRequests(),
        aggregate.successfulRequests(),
        aggregate.failedRequests(),
        aggregate.successRate(),
        aggregate.latency(),
        -1);
    failedEndpoints(html, aggregate.failedEndpoints());
    errors(html, aggregate.errors(), aggregate.totalErrors(), aggregate.errorBreakdown());
    debuggingTips(html, aggregate.totalRequests(), aggregate.successfulRequests());
    runTrend(html, aggregate.runs());
    html.append("</body></html>\n");
    return write(context.summaryFile("html"), html);
  }

  private static void open(StringBuilder html, String title, ReportContext context) {
    html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n<title>")
        .append(escape(title))
        .append("</title>\n<style>\n")
        .append(STYLE)
        .append("</style>\n</head>\n<body>\n<h1>")
        .append(escape(title))
        .append("</h1>\n<p>Target: ")
        .append(escape(context.baseUrl()));
    if (context.scenario() != null) {
      html.append(" | Scenario: ").append(escape(context.scenario()));
    }
    html.append(" | Generated: ")
        .append(escape(String.valueOf(context.generatedAt())))
        .append(" | Host: ")
        .append(escape(context.environment().host()))
        .append(" | Triggered by: ")
        .append(escape(context.environment().triggeredBy()))
        .append("</p>\n");
  }

  private static void summary(
      StringBuilder html,
      long total,
      long successful,
      long failed,
      double successRate,
      LatencyStats latency,
      double rps) {
    html.append("<div class=\"summary\">\n<h2>Summary</h2>\n");
    metric(html, "", "Total Requests: " + total);
    metric(html, successful > 0 ? "success" : "error", "Successful: " + successful);
    metric(html, failed > 0 ? "error" : "", "Failed: " + failed);
    metric(html, "", "Success Rate: " + format(successRate) + "%");
    if (rps >= 0) {
      metric(html, "", "Throughput: " + format(rps) + " req/s");
    }
    if (successful > 0) {
      metric(html, "", "Average Response Time: " + format(latency.avgMs()) + " ms");
      metric(html, "", "Min Response Time: " + format(latency.minMs()) + " ms");
      metric(html, "", "Max Response Time: " + format(latency.maxMs()) + " ms");
      metric(html, "", "P50 / P95 / P99: " + format(latency.p50Ms()) + " / " + format(latency.p95Ms())
          + " / " + format(latency.p99Ms()) + " ms");
    } else {
      metric(html, "warning", NO_SUCCESS_WARNING);
    }
    html.append("</div>\n");
  }

  private static void failedEndpoints(StringBuilder html, List<String> endpoints) {
    if (endpoints.isEmpty()) {
      return;
    }
    html.append("<h2>Excluded Endpoints</h2>\n<p class=\"error\">These endpoint tasks failed and are not counted: ")
        .append(escape(String.join(", ", endpoints)))
        .append("</p>\n");
  }

  private static void errors(
      StringBuilder html, List<ErrorRecord> errors, long totalErrors, Map<String, Long> breakdown) {
    if (errors.isEmpty()) {
      return;
    }
    html.append("<h2>Error Details</h2>\n");
    if (!breakdown.isEmpty()) {
      html.append("<table><tr><th>Error Type</th><th>Count</th></tr>\n");
      breakdown.forEach(
          (type, count) ->
              html.append("<tr><td>").append(escape(type)).append("</td><td>").append(count).append("</td></tr>\n"));
      html.append("</table>\n");
    }
    html.append("<p>First few errors encountered:</p>\n")
        .append("<table><tr><th>#</th><th>Endpoint</th><th>Status Code</th><th>Error</th></tr>\n");
    int shown = Math.min(ERROR_ROWS, errors.size());
    for (int i = 0; i < shown; i++) {
      var error = errors.get(i);
      html.append("<tr><td>")
          .append(i + 1)
          .append("</td><td>")
          .append(escape(error.method() + " " + error.url()))
          .append("</td><td>")
          .append(error.statusCode() != null ? error.statusCode() : "N/A")
          .append("</td><td><pre>")
          .append(escape(truncate(error.error())));
      if (error.requestData() != null) {
        html.append("\n\nRequest data: ").append(escape(truncate(String.valueOf(error.requestData()))));
      }
      html.append("</pre></td></tr>\n");
    }
    if (totalErrors > shown) {
      html.append("<tr><td colspan='4'>... and ")
          .append(totalErrors - shown)
          .append(" more errors</td></tr>\n");
    }
    html.append("</table>\n");
  }

  private static void debuggingTips(StringBuilder html, long total, long successful) {
    if (successful != 0 || total == 0) {
      return;
    }
    html.append("<div class=\"tips\">\n<h3>Debugging Tips</h3>\n<ul>\n")
        .append("<li>Check if the API server is running and accessible</li>\n")
        .append("<li>Verify the base URL in the configuration</li>\n")
        .append("<li>Check if authentication is required and credentials are correct</li>\n")
        .append("<li>Inspect the error messages above for more details</li>\n")
        .append("<li>Try testing the endpoints manually with a tool like curl or Postman</li>\n")
        .append("</ul>\n</div>\n");
  }

  private static void runTrend(StringBuilder html, List<RunSummary> runs) {
    html.append("<h2>Runs</h2>\n<table><tr><th>Run</th><th>Total</th><th>Successful</th>")
        .append("<th>Failed</th><th>Success Rate</th><th>Avg Response Time</th></tr>\n");
    for (RunSummary run : runs) {
      html.append("<tr><td>")
          .append(run.runIndex())
          .append("</td><td>")
          .append(run.totalRequests())
          .append("</td><td>")
          .append(run.successfulRequests())
          .append("</td><td>")
          .append(run.failedRequests())
          .append("</td><td>")
          .append(format(run.successRate()))
          .append("%</td><td>")
          .append(run.noSuccessfulRequests() ? "N/A" : format(run.avgLatencyMs()) + " ms")
          .append("</td></tr>\n");
    }
    html.append("</table>\n");
  }

  private static void metric(StringBuilder html, String cssClass, String text) {
    html.append("<div class=\"metric");
    if (!cssClass.isEmpty()) {
      html.append(' ').append(cssClass);
    }
    html.append("\">").append(escape(text)).append("</div>\n");
  }

  static String truncate(String message) {
    if (message == null) {
      return "No error details available";
    }
    return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) + "..." : message;
  }

  private static String escape(String text) {
    return text == null ? "" : HTML.escape(text);
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  private static Path write(Path target, StringBuilder html) throws IOException {
    Files.createDirectories(target.toAbsolutePath().getParent());
    Files.writeString(target, html, StandardCharsets.UTF_8);
    return target;
  }
}
