package com.mk.fx.qa.perf.execution.config;

/**
 * Raised when the test configuration cannot be loaded or is missing required settings. Always
 * fatal: no request is sent once this is thrown.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
