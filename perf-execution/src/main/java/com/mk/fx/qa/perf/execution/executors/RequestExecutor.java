package com.mk.fx.qa.perf.execution.executors;

import com.mk.fx.qa.perf.rest.HttpTransport;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends exactly one request and always returns an outcome; failures never propagate past this
 * class. Timing covers dispatch to full response receipt, including connection setup.
 */
@Slf4j
public class RequestExecutor {

  private final HttpTransport transport;

  public RequestExecutor(HttpTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  public RequestOutcome execute(PreparedRequest request) {
    var startTime = System.nanoTime();
    try {
      var response = transport.execute(request.toRequest());
      var elapsed = elapsedMs(startTime);
      var status = response.getStatusCode();
      if (!response.isSuccessful()) {
        log.debug("{} {} failed with status {} in {} ms", request.method(), request.url(), status, elapsed);
        return RequestOutcome.failure(
            request,
            status,
            elapsed,
            ErrorClassifier.httpError(status, request.url()),
            ErrorClassifier.httpCategory(status));
      }
      log.debug("{} {} returned {} in {} ms", request.method(), request.url(), status, elapsed);
      return RequestOutcome.success(request, status, elapsed);
    } catch (RuntimeException e) {
      var elapsed = elapsedMs(startTime);
      log.debug("{} {} failed after {} ms: {}", request.method(), request.url(), elapsed, e.getMessage());
      return RequestOutcome.failure(
          request, null, elapsed, ErrorClassifier.describe(e), ErrorClassifier.classify(e));
    }
  }

  private static double elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }
}
