package com.mk.fx.qa.perf.execution.metrics;

import com.mk.fx.qa.perf.execution.executors.RequestOutcome;

/** One failed request as shown in reports. */
public record ErrorRecord(
    String endpointName,
    String url,
    String method,
    Integer statusCode,
    String errorType,
    String error,
    Object requestData) {

  public static ErrorRecord from(RequestOutcome outcome) {
    return new ErrorRecord(
        outcome.endpointName(),
        outcome.url(),
        outcome.method(),
        outcome.statusCode(),
        outcome.errorType(),
        outcome.error(),
        outcome.requestData());
  }

  public ErrorRecord withoutRequestData() {
    return requestData == null
        ? this
        : new ErrorRecord(endpointName, url, method, statusCode, errorType, error, null);
  }
}
