package com.mk.fx.qa.perf.execution.executors;

import com.mk.fx.qa.perf.execution.config.EndpointSpec;
import com.mk.fx.qa.perf.execution.template.TemplateResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the configured number of requests against one endpoint, strictly one after another,
 * pausing for the endpoint's delay between requests.
 */
@Slf4j
public class EndpointRunner {

  private final RequestFactory requestFactory;
  private final RequestExecutor requestExecutor;
  private final int requestsPerEndpoint;

  public EndpointRunner(RequestFactory requestFactory, RequestExecutor requestExecutor, int requestsPerEndpoint) {
    this.requestFactory = requestFactory;
    this.requestExecutor = requestExecutor;
    this.requestsPerEndpoint = Math.max(0, requestsPerEndpoint);
  }

  /**
   * Runs the endpoint. Outcomes keep request order. If the calling thread is interrupted during a
   * delay, the interrupt flag is restored and the outcomes gathered so far are returned.
   *
   * @throws RuntimeException if a request cannot be prepared, e.g. a missing payload file
   */
  public List<RequestOutcome> run(EndpointSpec endpoint, TemplateResolver resolver) {
    List<RequestOutcome> outcomes = new ArrayList<>(requestsPerEndpoint);
    log.debug("Endpoint {} starting {} requests", endpoint.displayName(), requestsPerEndpoint);
    for (int i = 0; i < requestsPerEndpoint; i++) {
      var request = requestFactory.prepare(endpoint, resolver);
      outcomes.add(requestExecutor.execute(request));

      if (endpoint.hasDelay()) {
        try {
          TimeUnit.MILLISECONDS.sleep(endpoint.delayMs());
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          log.info(
              "Endpoint {} interrupted after {}/{} requests",
              endpoint.displayName(),
              outcomes.size(),
              requestsPerEndpoint);
          return outcomes;
        }
      }
    }
    return outcomes;
  }
}
