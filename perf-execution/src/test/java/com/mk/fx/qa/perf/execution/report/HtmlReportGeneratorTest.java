package com.mk.fx.qa.perf.execution.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.perf.execution.executors.RequestOutcome;
import com.mk.fx.qa.perf.execution.metrics.RunAggregator;
import com.mk.fx.qa.perf.execution.metrics.RunStatistics;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HtmlReportGeneratorTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path dir;

  private final HtmlReportGenerator generator = new HtmlReportGenerator();

  private ReportContext context() {
    return new ReportContext(
        dir, "20240501_100000", START, "http://api", "smoke", new ReportEnvironment("ci-host", "jenkins"));
  }

  private static RequestOutcome ok(double ms) {
    return new RequestOutcome("users", "http://api/users", "GET", true, 200, ms, null, null, null);
  }

  private static RequestOutcome refused(int n) {
    return new RequestOutcome(
        "orders",
        "http://api/orders/" + n,
        "POST",
        false,
        null,
        1.0,
        "Connection refused <" + n + ">",
        "CONNECTION_REFUSED",
        "{\"id\":" + n + "}");
  }

  @Test
  void runReport_isNamedByTimestampAndRun_andShowsSummary() throws Exception {
    var run = RunStatistics.from(2, List.of(ok(10), ok(30)), List.of(), START, START.plusSeconds(1));

    var path = generator.writeRun(run, context()).orElseThrow();

    assertEquals(dir.resolve("performance_report_20240501_100000_run2.html"), path);
    var html = Files.readString(path);
    assertThat(html)
        .contains("Performance Test Report - Run 2")
        .contains("Total Requests: 2")
        .contains("Average Response Time: 20.00 ms")
        .contains("Scenario: smoke")
        .contains("Host: ci-host")
        .doesNotContain(HtmlReportGenerator.NO_SUCCESS_WARNING)
        .doesNotContain("Debugging Tips");
  }

  @Test
  void allFailures_showWarningTipsAndFirstTenErrors() throws Exception {
    List<RequestOutcome> outcomes = new ArrayList<>();
    for (int i = 0; i < 15; i++) {
      outcomes.add(refused(i));
    }
    var run = RunStatistics.from(1, outcomes, List.of("broken"), START, START);

    var html = Files.readString(generator.writeRun(run, context()).orElseThrow());

    assertThat(html)
        .contains(HtmlReportGenerator.NO_SUCCESS_WARNING)
        .contains("Debugging Tips")
        .contains("CONNECTION_REFUSED")
        .contains("... and 5 more errors")
        .contains("Excluded Endpoints")
        .contains("broken")
        .contains("Connection refused &lt;9&gt;")
        .doesNotContain("Connection refused &lt;10&gt;")
        .contains("Request data: {&quot;id&quot;:0}")
        .contains("N/A");
  }

  @Test
  void summaryReport_listsEveryRun() throws Exception {
    var first = RunStatistics.from(1, List.of(ok(10)), List.of(), START, START);
    var second = RunStatistics.from(2, List.of(refused(1)), List.of(), START, START);
    var aggregate = RunAggregator.aggregate(List.of(first, second));

    var path = generator.writeSummary(aggregate, context());

    assertEquals(dir.resolve("performance_report_20240501_100000_summary.html"), path);
    var html = Files.readString(path);
    assertThat(html)
        .contains("Summary of 2 runs")
        .contains("Success Rate: 50.00%")
        .contains("<h2>Runs</h2>")
        .contains("0.00%</td><td>N/A</td>");
  }

  @Test
  void truncate_capsLongMessages() {
    var longMessage = "x".repeat(150);

    assertEquals("x".repeat(100) + "...", HtmlReportGenerator.truncate(longMessage));
    assertEquals("short", HtmlReportGenerator.truncate("short"));
    assertEquals("No error details available", HtmlReportGenerator.truncate(null));
  }
}
