package com.mk.fx.qa.perf.execution.executors;

import com.mk.fx.qa.perf.execution.config.EndpointSpec;
import com.mk.fx.qa.perf.execution.config.PayloadLoader;
import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.template.TemplateResolver;
import com.mk.fx.qa.perf.execution.utils.LoadUtils;
import com.mk.fx.qa.perf.rest.BodyEncoding;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns an endpoint's raw templates into a {@link PreparedRequest}. Path, query parameters,
 * headers and body are resolved anew on every call, so each request may carry different dynamic
 * values.
 */
public class RequestFactory {

  private final TestConfig config;
  private final PayloadLoader payloadLoader;

  public RequestFactory(TestConfig config, PayloadLoader payloadLoader) {
    this.config = config;
    this.payloadLoader = payloadLoader;
  }

  /**
   * Prepares one request.
   *
   * @throws java.io.UncheckedIOException if a referenced payload file cannot be loaded
   * @throws IllegalArgumentException if the endpoint method is not supported
   */
  public PreparedRequest prepare(EndpointSpec endpoint, TemplateResolver resolver) {
    var method = endpoint.httpMethod();
    var url = LoadUtils.joinUrl(config.baseUrl(), resolver.resolveText(endpoint.path()));

    Map<String, String> query = new LinkedHashMap<>();
    endpoint.params().forEach((name, value) -> query.put(name, resolver.resolveText(value)));

    Map<String, String> headers = new LinkedHashMap<>();
    endpoint.headers().forEach((name, value) -> headers.put(name, resolver.resolveText(value)));

    Object body = null;
    if (method.carriesBody() && endpoint.data() != null) {
      var resolved = resolver.resolve(payloadLoader.load(endpoint.data()));
      if (!isEmpty(resolved)) {
        body = resolved;
      }
    }

    return new PreparedRequest(
        endpoint.displayName(),
        method,
        url,
        query,
        headers,
        body,
        endpoint.jsonContent() ? BodyEncoding.JSON : BodyEncoding.FORM,
        endpoint.timeoutSeconds());
  }

  private static boolean isEmpty(Object value) {
    if (value == null) return true;
    if (value instanceof String s) return s.isEmpty();
    if (value instanceof Map<?, ?> m) return m.isEmpty();
    if (value instanceof Collection<?> c) return c.isEmpty();
    return false;
  }
}
