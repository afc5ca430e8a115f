package com.mk.fx.qa.perf.execution.executors;

/**
 * Result of one dispatched request.
 *
 * @param endpointName display name of the endpoint
 * @param url request URL
 * @param method HTTP method name
 * @param success {@code true} when a response below 400 was received
 * @param statusCode HTTP status when a response was received
 * @param responseTimeMs elapsed time from dispatch to full response receipt
 * @param error human-readable failure description, {@code null} on success
 * @param errorType classified failure category, {@code null} on success
 * @param requestData body that was attempted, kept only on failure
 */
public record RequestOutcome(
    String endpointName,
    String url,
    String method,
    boolean success,
    Integer statusCode,
    double responseTimeMs,
    String error,
    String errorType,
    Object requestData) {

  public static RequestOutcome success(PreparedRequest request, int statusCode, double responseTimeMs) {
    return new RequestOutcome(
        request.endpointName(),
        request.url(),
        request.method().name(),
        true,
        statusCode,
        responseTimeMs,
        null,
        null,
        null);
  }

  public static RequestOutcome failure(
      PreparedRequest request, Integer statusCode, double responseTimeMs, String error, String errorType) {
    return new RequestOutcome(
        request.endpointName(),
        request.url(),
        request.method().name(),
        false,
        statusCode,
        responseTimeMs,
        error,
        errorType,
        request.body());
  }
}
