package com.mk.fx.qa.perf.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Report output settings.
 *
 * @param outputDir directory the report files are written to
 * @param includeRequestDetails whether failed request payloads appear in reports
 * @param timestampFormat file-name timestamp, a {@code DateTimeFormatter} pattern or strftime-style
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportSpec(
    @JsonProperty("output_dir") String outputDir,
    @JsonProperty("include_request_details") Boolean includeRequestDetails,
    @JsonProperty("timestamp_format") String timestampFormat) {

  public static final String DEFAULT_OUTPUT_DIR = "reports";
  public static final String DEFAULT_TIMESTAMP_FORMAT = "yyyyMMdd_HHmmss";

  public ReportSpec {
    outputDir = outputDir == null || outputDir.isBlank() ? DEFAULT_OUTPUT_DIR : outputDir;
    includeRequestDetails = includeRequestDetails == null || includeRequestDetails;
    timestampFormat =
        timestampFormat == null || timestampFormat.isBlank() ? DEFAULT_TIMESTAMP_FORMAT : timestampFormat;
  }

  public static ReportSpec defaults() {
    return new ReportSpec(null, null, null);
  }
}
