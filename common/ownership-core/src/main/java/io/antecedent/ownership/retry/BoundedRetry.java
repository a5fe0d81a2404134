package io.antecedent.ownership.retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation under a {@link RetryPolicy}, retrying only the failures a classifier marks as transient.
 * <p>
 * Terminal failures are rethrown unchanged on the attempt that produced them. When the attempts
 * or the elapsed ceiling run out, the last failure is surfaced as the cause of a
 * {@link RetryExhaustedException}. Sleeps block the calling thread.
 */
public final class BoundedRetry {

  private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

  private final Sleeper sleeper;
  private final Clock clock;
  private final DoubleSupplier random;

  public BoundedRetry() {
    this(Sleeper.threadSleep(), Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
  }

  public BoundedRetry(Sleeper sleeper, Clock clock, DoubleSupplier random) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
  }

  public <T> T call(Supplier<T> operation, Predicate<Throwable> isTransient, RetryPolicy policy) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(isTransient, "isTransient");
    Objects.requireNonNull(policy, "policy");

    long start = clock.millis();
    RuntimeException last = null;
    for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
      try {
        return operation.get();
      } catch (RuntimeException e) {
        if (!isTransient.test(e)) {
          throw e;
        }
        last = e;
        if (attempt == policy.maxAttempts()) {
          break;
        }
        Duration delay = delayAfter(policy, attempt);
        long elapsed = Math.max(0L, clock.millis() - start);
        if (policy.hasElapsedCeiling() && elapsed + delay.toMillis() > policy.maxElapsed().toMillis()) {
          throw new RetryExhaustedException(
              "Gave up after " + attempt + " attempt(s): retry window of " + policy.maxElapsed() + " exceeded",
              e, attempt);
        }
        log.debug("Attempt {} of {} failed transiently, retrying in {} ms: {}",
            attempt, policy.maxAttempts(), delay.toMillis(), e.getMessage());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          RetryExhaustedException interrupted =
              new RetryExhaustedException("Interrupted while waiting to retry after attempt " + attempt, e, attempt);
          interrupted.addSuppressed(ie);
          throw interrupted;
        }
      }
    }
    throw new RetryExhaustedException(
        "Gave up after " + policy.maxAttempts() + " attempt(s)", last, policy.maxAttempts());
  }

  private Duration delayAfter(RetryPolicy policy, int attempt) {
    Duration base = policy.intervalAfter(attempt);
    if (policy.jitter() <= 0.0) {
      return base;
    }
    long extra = (long) (base.toMillis() * policy.jitter() * random.getAsDouble());
    return base.plusMillis(Math.max(0L, extra));
  }
}
