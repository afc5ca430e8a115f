package com.mk.fx.qa.perf.rest;

/** How a request payload is written onto the wire. */
public enum BodyEncoding {
    /** Payload serialised as JSON with {@code application/json}. */
    JSON,
    /** Mappings sent as {@code application/x-www-form-urlencoded}, anything else as raw text. */
    FORM
}
