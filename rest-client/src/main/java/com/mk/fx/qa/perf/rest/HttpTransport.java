package com.mk.fx.qa.perf.rest;

/**
 * Sends a single HTTP request and returns the complete response.
 *
 * <p>Implementations must be safe for concurrent use: one transport instance is shared by every
 * worker of a test run.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Executes the request synchronously.
     *
     * @param request the request to send
     * @return the received response, whatever its status code
     * @throws HttpTransportException if no response could be obtained
     */
    RestResponseData execute(Request request);
}
