package com.mk.fx.qa.perf.execution.executors;

import com.mk.fx.qa.perf.rest.BodyEncoding;
import com.mk.fx.qa.perf.rest.HttpMethod;
import com.mk.fx.qa.perf.rest.Request;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fully resolved request, ready to send.
 *
 * @param endpointName display name of the endpoint that produced it
 * @param method HTTP method
 * @param url absolute URL without query string
 * @param query resolved query parameters
 * @param headers resolved per-request headers
 * @param body resolved body, {@code null} when none is sent
 * @param encoding body encoding
 * @param timeoutSeconds request timeout override, {@code null} for the client default
 */
public record PreparedRequest(
    String endpointName,
    HttpMethod method,
    String url,
    Map<String, String> query,
    Map<String, String> headers,
    Object body,
    BodyEncoding encoding,
    Integer timeoutSeconds) {

  public PreparedRequest {
    query = query == null ? Map.of() : new LinkedHashMap<>(query);
    headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
    encoding = encoding == null ? BodyEncoding.JSON : encoding;
  }

  public boolean hasBody() {
    return body != null;
  }

  public Request toRequest() {
    var request = new Request();
    request.setMethod(method);
    request.setUrl(url);
    request.setQuery(query);
    request.setHeaders(headers);
    request.setBody(body);
    request.setEncoding(encoding);
    request.setTimeout(timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds));
    return request;
  }
}
