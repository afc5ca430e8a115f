package com.mk.fx.qa.perf.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}. A single instance owns one connection
 * pool and is shared by all workers of a run; the underlying client is thread-safe. This
 * implementation does not include retry logic.
 */
@Slf4j
public class LoadHttpClient implements HttpTransport {

    /** Default request timeout in seconds. */
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    /** Default connection timeout in seconds. */
    public static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 5;

    /** Headers the JDK client manages itself and refuses to accept from callers. */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private static final String CONTENT_TYPE = "Content-Type";

    private final HttpClient httpClient;

    /** Sent with every request unless the request sets the same header. */
    private final Map<String, String> headers;

    /** Timeout applied when a request does not carry its own. */
    private final Duration requestTimeout;

    /**
     * Constructs a client with the default timeouts and no global headers.
     */
    public LoadHttpClient() {
        this(DEFAULT_CONNECTION_TIMEOUT_SECONDS, DEFAULT_REQUEST_TIMEOUT_SECONDS, Map.of());
    }

    /**
     * Constructs a client with the given timeouts.
     *
     * @param connTimeOutSeconds TCP connect timeout
     * @param requestTimeoutSeconds timeout for requests without their own
     * @param headers default headers, may be {@code null}
     */
    public LoadHttpClient(int connTimeOutSeconds, int requestTimeoutSeconds, Map<String, String> headers) {
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(connTimeOutSeconds))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "LoadHttpClient initialised - Connection timeout: {}s, Request timeout: {}s, Global headers: {}",
                connTimeOutSeconds,
                requestTimeoutSeconds,
                this.headers.keySet());
    }

    /**
     * Executes a synchronous request. Any status code counts as a response; only failures to
     * obtain one are raised.
     *
     * @param request the request to execute
     * @return the response data
     * @throws HttpTransportException if the request cannot be built or sent
     */
    @Override
    public RestResponseData execute(Request request) {
        Objects.requireNonNull(request, "Request cannot be null");

        var httpRequest = buildHttpRequest(request);
        var startTime = System.nanoTime();
        try {
            log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            var duration = (System.nanoTime() - startTime) / 1_000_000;

            log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
            return buildResponseData(response, duration);

        } catch (HttpTimeoutException e) {
            var timeout = httpRequest.timeout().orElse(requestTimeout);
            throw new HttpTransportException(
                    "Request timed out after " + timeout.toMillis() + "ms: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpTransportException("Request interrupted", e);
        } catch (IOException e) {
            throw new HttpTransportException(describe(e), e);
        }
    }

    /**
     * Translates a {@link Request}. Default headers are merged under the request's own headers and
     * the body is written per {@link BodyEncoding}.
     *
     * @throws HttpTransportException if the URL is invalid or the body cannot be serialised
     */
    private HttpRequest buildHttpRequest(Request request) {
        if (request.getMethod() == null) {
            throw new HttpTransportException("Request method is required", null);
        }
        try {
            var url = appendQuery(request.getUrl(), request.getQuery());
            var requestBuilder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(request.getTimeout() != null ? request.getTimeout() : requestTimeout);

            var merged = new LinkedHashMap<>(headers);
            if (request.getHeaders() != null) {
                // request-specific headers override
                request.getHeaders().forEach((name, value) -> {
                    merged.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
                    merged.put(name, value);
                });
            }
            merged.forEach((name, value) -> {
                if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    log.warn("Ignoring restricted header {}", name);
                } else if (value != null) {
                    requestBuilder.setHeader(name, value);
                }
            });

            var method = request.getMethod().name();
            if (request.getBody() != null) {
                var encoding = request.getEncoding() != null ? request.getEncoding() : BodyEncoding.JSON;
                var payload = encodeBody(request.getBody(), encoding);
                if (!hasHeader(merged, CONTENT_TYPE)) {
                    requestBuilder.header(CONTENT_TYPE, contentType(request.getBody(), encoding));
                }
                requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(payload));
            } else {
                requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
            }

            return requestBuilder.build();

        } catch (IllegalArgumentException e) {
            throw new HttpTransportException("Error building HTTP request: " + e.getMessage(), e);
        }
    }

    private String encodeBody(Object body, BodyEncoding encoding) {
        if (encoding == BodyEncoding.FORM) {
            if (body instanceof Map<?, ?> form) {
                return form.entrySet().stream()
                        .filter(e -> e.getKey() != null)
                        .map(e -> encode(String.valueOf(e.getKey())) + "="
                                + encode(e.getValue() == null ? "" : String.valueOf(e.getValue())))
                        .collect(Collectors.joining("&"));
            }
            return String.valueOf(body);
        }
        try {
            return JsonUtil.toJson(body);
        } catch (JsonProcessingException e) {
            throw new HttpTransportException("Failed to serialize request body: " + e.getMessage(), e);
        }
    }

    private String contentType(Object body, BodyEncoding encoding) {
        if (encoding == BodyEncoding.JSON) {
            return "application/json";
        }
        return body instanceof Map<?, ?> ? "application/x-www-form-urlencoded" : "text/plain; charset=UTF-8";
    }

    /** Copies status, joined header values and body; the client saw {@code durationMs}. */
    private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
        var result = new RestResponseData();
        result.setStatusCode(response.statusCode());
        result.setHeaders(
                response.headers().map().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
        result.setBody(response.body());
        result.setResponseTimeMs(durationMs);
        return result;
    }

    private String appendQuery(String url, Map<String, String> query) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be empty");
        }
        if (query == null || query.isEmpty()) {
            return url;
        }
        var queryStr = query.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        if (queryStr.isEmpty()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + queryStr;
    }

    private String encode(String value) {
        return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : "";
    }

    private static boolean hasHeader(Map<String, String> headers, String name) {
        return headers.keySet().stream().anyMatch(name::equalsIgnoreCase);
    }

    private static String describe(IOException e) {
        var message = e.getMessage();
        if (message == null || message.isBlank()) {
            Throwable root = e;
            while (root.getCause() != null) {
                root = root.getCause();
            }
            message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        }
        return "Error executing request: " + message;
    }
}
