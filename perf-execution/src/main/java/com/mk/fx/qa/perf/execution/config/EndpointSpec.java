package com.mk.fx.qa.perf.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.perf.rest.HttpMethod;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;

/**
 * One endpoint under test. The path, query parameters, headers and body are raw templates that
 * are resolved again for every request.
 *
 * @param name display name, also used to select endpoints in scenarios
 * @param description free text shown nowhere but kept for readers of the document
 * @param method HTTP method, upper-cased, {@code GET} when absent
 * @param path path appended to the base URL
 * @param data raw body template: scalar, mapping, sequence or {@code @file} reference
 * @param delayMs pause after each request in milliseconds
 * @param jsonContent {@code true} to send the body as JSON, {@code false} for form encoding
 * @param headers per-endpoint header templates, overriding the default headers
 * @param params query parameter templates
 * @param timeoutSeconds request timeout override
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointSpec(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("method") String method,
    @JsonProperty("path") String path,
    @JsonProperty("data") Object data,
    @JsonProperty("delay") Long delayMs,
    @JsonProperty("json_content") Boolean jsonContent,
    @JsonProperty("headers") Map<String, Object> headers,
    @JsonProperty("params") Map<String, Object> params,
    @JsonProperty("timeout") Integer timeoutSeconds) {

  public EndpointSpec {
    method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
    jsonContent = jsonContent == null || jsonContent;
    data = ConfigValues.freeze(data);
    headers = ConfigValues.freezeMap(headers);
    params = ConfigValues.freezeMap(params);
  }

  public HttpMethod httpMethod() {
    return HttpMethod.from(method);
  }

  public boolean hasDelay() {
    return delayMs != null && delayMs > 0;
  }

  /** Name when configured, otherwise {@code METHOD path}. */
  public String displayName() {
    return name != null && !name.isBlank() ? name : method + " " + path;
  }
}
