package io.antecedent.ownership.retry;

import io.antecedent.ownership.ports.BackendException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies backend failures that are safe to retry.
 * <p>
 * Transient: connection reset, internal server error, timeouts, rate limiting, and any response
 * carrying a suggested retry delay. Everything else, not-found included, is terminal.
 */
public final class TransientErrors {

  private static final int TOO_MANY_REQUESTS = 429;
  private static final int INTERNAL_SERVER_ERROR = 500;
  private static final int GATEWAY_TIMEOUT = 504;

  private static final Set<String> TRANSIENT_REASONS =
      Set.of("InternalError", "Timeout", "ServerTimeout", "TooManyRequests");

  private TransientErrors() {
  }

  public static boolean isTransient(Throwable throwable) {
    for (Throwable t = throwable; t != null; t = t.getCause()) {
      if (t instanceof BackendException backend && isTransientResponse(backend)) {
        return true;
      }
      if (t instanceof SocketTimeoutException) {
        return true;
      }
      if (t instanceof SocketException && messageContains(t, "connection reset")) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }

  private static boolean isTransientResponse(BackendException e) {
    int code = e.statusCode();
    if (code == INTERNAL_SERVER_ERROR || code == GATEWAY_TIMEOUT || code == TOO_MANY_REQUESTS) {
      return true;
    }
    if (TRANSIENT_REASONS.contains(e.reason())) {
      return true;
    }
    Integer retryAfter = e.retryAfterSeconds();
    return retryAfter != null && retryAfter > 0;
  }

  private static boolean messageContains(Throwable t, String needle) {
    String message = t.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains(needle);
  }
}
