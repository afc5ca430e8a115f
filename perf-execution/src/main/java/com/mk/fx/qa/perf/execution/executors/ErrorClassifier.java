package com.mk.fx.qa.perf.execution.executors;

/** Maps request failures onto the categories used in error breakdowns. */
public final class ErrorClassifier {

  public static final String UNKNOWN = "UNKNOWN";

  private ErrorClassifier() {
    throw new UnsupportedOperationException("ErrorClassifier cannot be instantiated");
  }

  /** Category of a transport failure, derived from its root cause. */
  public static String classify(Throwable t) {
    if (t == null) return UNKNOWN;
    var clsName = rootCause(t).getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException", "UnresolvedAddressException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "HttpTimeoutException", "HttpConnectTimeoutException" -> "HTTP_TIMEOUT";
      case "IllegalArgumentException" -> "INVALID_REQUEST";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }

  /** Category of an error status, e.g. {@code HTTP_404}. */
  public static String httpCategory(int statusCode) {
    return "HTTP_" + statusCode;
  }

  /** Error text for an error status, e.g. {@code 404 Client Error for url: http://host/x}. */
  public static String httpError(int statusCode, String url) {
    var kind = statusCode >= 500 ? "Server Error" : "Client Error";
    return statusCode + " " + kind + " for url: " + url;
  }

  /** Failure message, falling back to the root cause and finally its type. */
  public static String describe(Throwable t) {
    if (t == null) return UNKNOWN;
    String msg = t.getMessage();
    if (msg == null || msg.isBlank()) {
      Throwable root = rootCause(t);
      msg = root.getMessage();
      if (msg == null || msg.isBlank()) {
        msg = root.getClass().getSimpleName() + " occurred";
      }
    }
    return msg;
  }

  private static Throwable rootCause(Throwable t) {
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    return rootCause;
  }
}
