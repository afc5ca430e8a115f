package com.mk.fx.qa.perf.execution.report;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.stream.Stream;

/**
 * Where and by whom a report was produced.
 *
 * @param host machine the test ran on
 * @param triggeredBy user who started the test
 */
public record ReportEnvironment(String host, String triggeredBy) {

  static final String UNKNOWN = "unknown";

  public static ReportEnvironment current() {
    return new ReportEnvironment(resolveHost(), resolveTriggeredBy());
  }

  /** {@code HOSTNAME} or {@code COMPUTERNAME}, then the local address lookup. */
  static String resolveHost() {
    var fromEnv = firstPresent(System.getenv("HOSTNAME"), System.getenv("COMPUTERNAME"));
    if (fromEnv != null) {
      return fromEnv;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return UNKNOWN;
    }
  }

  /** {@code TRIGGERED_BY}, then the JVM user. */
  static String resolveTriggeredBy() {
    var user = firstPresent(System.getenv("TRIGGERED_BY"), System.getProperty("user.name"));
    return user != null ? user : UNKNOWN;
  }

  private static String firstPresent(String... candidates) {
    return Stream.of(candidates).filter(c -> c != null && !c.isBlank()).findFirst().orElse(null);
  }
}
