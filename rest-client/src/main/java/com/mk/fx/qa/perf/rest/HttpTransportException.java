package com.mk.fx.qa.perf.rest;

/** Raised when a request cannot be built or no HTTP response is received. */
public class HttpTransportException extends RuntimeException {

    public HttpTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
