package com.mk.fx.qa.perf.execution.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.perf.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.perf.execution.cfg.PerfRunnerCfg;
import com.mk.fx.qa.perf.execution.config.ReportSpec;
import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.config.TestConfigLoader;
import com.mk.fx.qa.perf.execution.report.ReportService;
import com.mk.fx.qa.perf.execution.service.LoggingProgressListener;
import com.mk.fx.qa.perf.execution.service.PerformanceTestService;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

class PerfTestCommandTest {

  private static final ObjectMapperConfig MAPPERS = new ObjectMapperConfig();

  @TempDir Path dir;

  private HttpServer server;
  private boolean serverRunning;
  private final AtomicInteger hits = new AtomicInteger();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          hits.incrementAndGet();
          exchange.getRequestBody().readAllBytes();
          var body = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(200, body.length);
          exchange.getResponseBody().write(body);
          exchange.close();
        });
    server.start();
    serverRunning = true;
  }

  @AfterEach
  void stopServer() {
    if (serverRunning) {
      server.stop(0);
      serverRunning = false;
    }
  }

  private PerfTestCommand command(PerfRunnerCfg properties) {
    var mapper = MAPPERS.objectMapper();
    return new PerfTestCommand(
        properties,
        new TestConfigLoader(mapper, MAPPERS.yamlObjectMapper()),
        new PerformanceTestService(),
        new ReportService(mapper),
        new LoggingProgressListener());
  }

  private Path writeConfig() throws IOException {
    var yaml =
        """
        base_url: http://127.0.0.1:%d
        num_workers: 2
        requests_per_endpoint: 3
        num_test_runs: 2
        variables:
          user_id: 7
        endpoints:
          - name: user
            path: /users/${user_id}
          - name: create
            method: post
            path: /orders
            data:
              qty: $random{1,5}
        scenarios:
          smoke:
            num_test_runs: 1
            requests_per_endpoint: 1
            endpoints: [user]
          broken:
            endpoints: [nope]
        """
            .formatted(server.getAddress().getPort());
    var path = dir.resolve("config.yaml");
    Files.writeString(path, yaml);
    return path;
  }

  private static DefaultApplicationArguments args(String... args) {
    return new DefaultApplicationArguments(args);
  }

  private static long filesIn(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files.count();
    }
  }

  @Test
  void validConfig_runsTest_andWritesReports() throws Exception {
    var config = writeConfig();
    var output = dir.resolve("out");

    int code = command(new PerfRunnerCfg()).execute(args("--config=" + config, "--output=" + output));

    assertEquals(0, code);
    assertEquals(12, hits.get());
    // two run reports plus HTML and JSON summaries
    assertEquals(4, filesIn(output));
    try (Stream<Path> files = Files.list(output)) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .anyMatch(name -> name.endsWith("_summary.json"))
          .anyMatch(name -> name.endsWith("_run2.html"));
    }
  }

  @Test
  void scenario_overridesCountsAndEndpoints() throws Exception {
    var config = writeConfig();
    var output = dir.resolve("smoke");

    int code =
        command(new PerfRunnerCfg())
            .execute(args("--config=" + config, "--output=" + output, "--scenario=smoke", "--seed=11"));

    assertEquals(0, code);
    assertEquals(1, hits.get());
    assertEquals(3, filesIn(output));
  }

  @Test
  void missingConfig_exitsWithOne() {
    var properties = new PerfRunnerCfg();
    properties.setConfig(dir.resolve("absent.yaml").toString());

    assertEquals(1, command(properties).execute(args()));
    assertEquals(0, hits.get());
  }

  @Test
  void unknownScenario_exitsWithOne() throws Exception {
    var config = writeConfig();

    assertEquals(1, command(new PerfRunnerCfg()).execute(args("--config=" + config, "--scenario=missing")));
    assertEquals(1, command(new PerfRunnerCfg()).execute(args("--config=" + config, "--scenario=broken")));
    assertEquals(0, hits.get());
  }

  @Test
  void invalidSeed_exitsWithOne() throws Exception {
    var config = writeConfig();

    assertEquals(1, command(new PerfRunnerCfg()).execute(args("--config=" + config, "--seed=abc")));
  }

  @Test
  void unreachableServer_stillCompletes() throws Exception {
    var config = writeConfig();
    stopServer();
    var output = dir.resolve("down");

    var command = command(new PerfRunnerCfg());
    command.run(args("--config=" + config, "--output=" + output));

    assertEquals(0, command.getExitCode());
    Path summary;
    try (Stream<Path> files = Files.list(output)) {
      summary =
          files.filter(p -> p.getFileName().toString().endsWith("_summary.html")).findFirst().orElseThrow();
    }
    assertThat(Files.readString(summary)).contains("No successful requests to calculate response times");
  }

  @Test
  void outputDir_propertyMatchingDocumentDefault_stillWinsOverDocument() {
    var properties = new PerfRunnerCfg();
    properties.setOutputDir("reports");
    var config = TestConfig.builder().baseUrl("http://localhost").report(new ReportSpec("fromdoc", null, null)).build();

    assertEquals(Path.of("reports"), command(properties).outputDir(null, config));
    assertEquals(Path.of("cli"), command(properties).outputDir("cli", config));
  }

  @Test
  void outputDir_withoutOptionOrProperty_usesDocument() {
    var config = TestConfig.builder().baseUrl("http://localhost").report(new ReportSpec("fromdoc", null, null)).build();

    assertEquals(Path.of("fromdoc"), command(new PerfRunnerCfg()).outputDir(null, config));
    assertEquals(Path.of("fromdoc"), command(new PerfRunnerCfg()).outputDir(" ", config));
    assertEquals(
        Path.of(ReportSpec.DEFAULT_OUTPUT_DIR),
        command(new PerfRunnerCfg()).outputDir(null, TestConfig.builder().baseUrl("http://localhost").build()));
  }
}
