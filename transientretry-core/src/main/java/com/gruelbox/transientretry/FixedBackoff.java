package com.gruelbox.transientretry;

import java.time.Duration;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/** Waits the same interval after every failure. Used by {@link LinearRetryPolicy}. */
@Value
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class FixedBackoff implements Backoff {

  Duration interval;

  public static FixedBackoff withInterval(Duration interval) {
    return new FixedBackoff(interval);
  }

  @Override
  public Duration firstInterval() {
    return interval;
  }

  @Override
  public Duration nextInterval(Duration current) {
    return interval;
  }
}
