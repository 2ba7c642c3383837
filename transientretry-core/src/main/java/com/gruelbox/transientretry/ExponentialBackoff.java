package com.gruelbox.transientretry;

import java.time.Duration;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Doubles the interval after every failure, up to a cap. Used by {@link ExponentialRetryPolicy}.
 */
@Value
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ExponentialBackoff implements Backoff {

  Duration initialInterval;
  Duration maxInterval;

  /**
   * @param initialInterval The first interval. If longer than {@code maxInterval}, it is reduced
   *     to {@code maxInterval}.
   * @param maxInterval The longest interval.
   * @return The backoff.
   */
  public static ExponentialBackoff exponential(Duration initialInterval, Duration maxInterval) {
    if (initialInterval.compareTo(maxInterval) > 0) {
      initialInterval = maxInterval;
    }
    return new ExponentialBackoff(initialInterval, maxInterval);
  }

  @Override
  public Duration firstInterval() {
    return initialInterval;
  }

  @Override
  public Duration nextInterval(Duration current) {
    // current * 2 >= max, written so it can't overflow
    if (current.compareTo(maxInterval.minus(current)) >= 0) {
      return maxInterval;
    }
    return current.multipliedBy(2);
  }
}
