package io.antecedent.ownership.retry;

import java.time.Duration;

/**
 * Blocking pause between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleep() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
