package com.mk.fx.qa.perf.rest;

import java.util.Locale;

/** HTTP verbs supported by the load client. */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS;

    /**
     * Returns true for methods whose configured payload is sent as a request body.
     *
     * @return {@code true} for POST, PUT and PATCH
     */
    public boolean carriesBody() {
        return this == POST || this == PUT || this == PATCH;
    }

    /**
     * Parses a method name case-insensitively, defaulting to GET when blank.
     *
     * @param value the raw method name
     * @return the matching method
     * @throws IllegalArgumentException if the name is not a supported HTTP method
     */
    public static HttpMethod from(String value) {
        if (value == null || value.isBlank()) {
            return GET;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + value, ex);
        }
    }
}
