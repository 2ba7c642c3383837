package com.gruelbox.transientretry.spi;

import java.time.Duration;
import java.time.Instant;

/**
 * Deadline arithmetic shared by all retry policies. A retry run computes its deadline once, on
 * entry, and then clamps every wait against it so that no wait extends past it.
 */
public final class Deadlines {

  private Deadlines() {}

  /**
   * Converts a relative timeout into an absolute deadline.
   *
   * @param now The current instant.
   * @param timeout The timeout. May be null, meaning no timeout.
   * @return {@code now + timeout}, or {@link Instant#MAX} if there is no timeout, the timeout is
   *     negative, or adding it would pass {@link Instant#MAX}.
   */
  public static Instant computeDeadline(Instant now, Duration timeout) {
    if (timeout == null || timeout.isNegative()) {
      return Instant.MAX;
    }
    if (timeout.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
      return Instant.MAX;
    }
    return now.plus(timeout);
  }

  /**
   * Shortens a proposed delay so that waiting for it won't pass the deadline.
   *
   * <p>A result of {@link Duration#ZERO} means that the deadline has been reached and the caller
   * should stop retrying immediately.
   *
   * @param delay The proposed delay. Must not be negative.
   * @param deadline The deadline, as returned by {@link #computeDeadline(Instant, Duration)}.
   * @param now The current instant.
   * @return The delay to actually wait, never negative.
   * @throws IllegalArgumentException If {@code delay} is null or negative.
   */
  public static Duration adjustDelay(Duration delay, Instant deadline, Instant now) {
    if (delay == null || delay.isNegative()) {
      throw new IllegalArgumentException("delay may not be negative: " + delay);
    }
    Duration remaining = Duration.between(now, deadline);
    if (delay.compareTo(remaining) > 0) {
      delay = remaining;
    }
    if (delay.isNegative() || delay.isZero()) {
      return Duration.ZERO;
    }
    return delay;
  }
}
