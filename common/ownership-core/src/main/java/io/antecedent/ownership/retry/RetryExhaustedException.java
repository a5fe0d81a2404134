package io.antecedent.ownership.retry;

/**
 * Raised by {@link BoundedRetry} when every attempt failed transiently or the schedule ran out of time.
 * The cause is the last error the operation produced.
 */
public class RetryExhaustedException extends RuntimeException {

  private final int attempts;

  public RetryExhaustedException(String message, RuntimeException lastError, int attempts) {
    super(message, lastError);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }

  public RuntimeException lastError() {
    return (RuntimeException) getCause();
  }
}
