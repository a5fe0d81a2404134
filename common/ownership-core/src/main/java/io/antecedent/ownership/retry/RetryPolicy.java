package io.antecedent.ownership.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff schedule.
 *
 * @param initialInterval delay before the second attempt
 * @param factor          multiplier applied to the delay after every attempt
 * @param jitter          fraction of random delay added on top of each interval, {@code 0} disables it
 * @param maxAttempts     total number of attempts, including the first
 * @param maxElapsed      wall clock ceiling across all attempts and sleeps; {@link Duration#ZERO} means none
 */
public record RetryPolicy(Duration initialInterval, double factor, double jitter, int maxAttempts, Duration maxElapsed) {

  /**
   * Schedule used for live object fetches: 10ms, 50ms, 250ms between four attempts.
   */
  public static final RetryPolicy DEFAULT =
      new RetryPolicy(Duration.ofMillis(10), 5.0, 0.1, 4, Duration.ofSeconds(30));

  public RetryPolicy {
    Objects.requireNonNull(initialInterval, "initialInterval");
    Objects.requireNonNull(maxElapsed, "maxElapsed");
    if (initialInterval.isNegative()) {
      throw new IllegalArgumentException("initialInterval must not be negative");
    }
    if (factor < 1.0) {
      throw new IllegalArgumentException("factor must be at least 1.0, but was " + factor);
    }
    if (jitter < 0.0) {
      throw new IllegalArgumentException("jitter must not be negative, but was " + jitter);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, but was " + maxAttempts);
    }
    if (maxElapsed.isNegative()) {
      throw new IllegalArgumentException("maxElapsed must not be negative");
    }
  }

  public static RetryPolicy noRetry() {
    return new RetryPolicy(Duration.ZERO, 1.0, 0.0, 1, Duration.ZERO);
  }

  /**
   * Delay to wait after the given failed attempt (1-based), before jitter.
   */
  public Duration intervalAfter(int attempt) {
    double millis = initialInterval.toMillis() * Math.pow(factor, Math.max(0, attempt - 1));
    if (Double.isInfinite(millis) || millis > Long.MAX_VALUE) {
      return Duration.ofMillis(Long.MAX_VALUE);
    }
    return Duration.ofMillis((long) millis);
  }

  public boolean hasElapsedCeiling() {
    return !maxElapsed.isZero();
  }
}
