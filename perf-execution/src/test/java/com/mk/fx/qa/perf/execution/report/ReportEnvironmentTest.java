package com.mk.fx.qa.perf.execution.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ReportEnvironmentTest {

  @Test
  void current_resolvesHostAndUser() {
    var environment = ReportEnvironment.current();

    assertThat(environment.host()).isNotBlank();
    assertThat(environment.triggeredBy()).isNotBlank();
  }

  @Test
  void triggeredBy_prefersEnvironmentOverJvmUser() {
    var fromEnv = System.getenv("TRIGGERED_BY");
    var jvmUser = System.getProperty("user.name");
    String expected;
    if (fromEnv != null && !fromEnv.isBlank()) {
      expected = fromEnv;
    } else if (jvmUser != null && !jvmUser.isBlank()) {
      expected = jvmUser;
    } else {
      expected = ReportEnvironment.UNKNOWN;
    }

    assertEquals(expected, ReportEnvironment.resolveTriggeredBy());
  }

  @Test
  void host_prefersHostnameVariable() {
    var fromEnv = System.getenv("HOSTNAME");

    if (fromEnv != null && !fromEnv.isBlank()) {
      assertEquals(fromEnv, ReportEnvironment.resolveHost());
    } else {
      assertThat(ReportEnvironment.resolveHost()).isNotBlank();
    }
  }
}
