package com.mk.fx.qa.perf.execution.cfg;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults for a test invocation, overridable with the {@code --config}, {@code --output},
 * {@code --scenario} and {@code --seed} command-line options.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "perf.runner")
public class PerfRunnerCfg {

  @NotBlank private String config = "config.yaml";

  /** Report directory; when unset the document's {@code report.output_dir} applies. */
  private String outputDir;

  /** Scenario to apply, none when blank. */
  private String scenario;

  /** Seed for every random value, random when unset. */
  private Long seed;
}
