package com.gruelbox.transientretry;

import java.time.Duration;

/**
 * The shape of the waits between attempts: how long to wait after the first failure and how that
 * wait evolves after each further failure. Implementations are immutable; each retry run keeps
 * its own working copy of the current interval.
 */
public interface Backoff {

  /**
   * @return The wait after the first failed attempt, before any deadline is applied.
   */
  Duration firstInterval();

  /**
   * @param current The interval just waited.
   * @return The interval to wait after the next failure.
   */
  Duration nextInterval(Duration current);
}
