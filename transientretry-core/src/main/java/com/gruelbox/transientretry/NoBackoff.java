package com.gruelbox.transientretry;

import java.time.Duration;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Never waits. Used by {@link NoRetryPolicy}, which never gets as far as waiting anyway. */
@ToString
@EqualsAndHashCode
public final class NoBackoff implements Backoff {

  @Override
  public Duration firstInterval() {
    return Duration.ZERO;
  }

  @Override
  public Duration nextInterval(Duration current) {
    return Duration.ZERO;
  }
}
