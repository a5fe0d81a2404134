package io.antecedent.ownership.ports;

/**
 * Failure reported by a {@link ResourceBackend} or {@link SchemaDiscovery} call.
 * <p>
 * Carries the HTTP-style status code (0 when no response was received), the machine readable
 * status reason and, when the backend suggested one, the delay before retrying.
 */
public class BackendException extends RuntimeException {

  public static final int NO_RESPONSE = 0;

  private final int statusCode;
  private final String reason;
  private final Integer retryAfterSeconds;

  public BackendException(int statusCode, String reason, String message) {
    this(statusCode, reason, null, message, null);
  }

  public BackendException(int statusCode, String reason, Integer retryAfterSeconds, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.reason = reason == null ? "" : reason;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public static BackendException notFound(String message) {
    return new BackendException(404, "NotFound", message);
  }

  public int statusCode() {
    return statusCode;
  }

  public String reason() {
    return reason;
  }

  public Integer retryAfterSeconds() {
    return retryAfterSeconds;
  }

  public boolean isNotFound() {
    return statusCode == 404 || "NotFound".equals(reason);
  }
}
