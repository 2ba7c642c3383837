package com.gruelbox.transientretry;

import java.time.Clock;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.event.Level;

/**
 * A {@link RetryPolicy} which makes a single attempt and never retries. Useful where an API
 * demands a policy but the caller wants none. Failures are never classified or logged.
 *
 * <p>Immutable; {@link #INSTANCE} can be shared freely.
 */
public final class NoRetryPolicy extends AbstractRetryPolicy {

  /** A shared instance. */
  public static final NoRetryPolicy INSTANCE = new NoRetryPolicy();

  private static final NoBackoff BACKOFF = new NoBackoff();

  public NoRetryPolicy() {
    super(
        1,
        null,
        TransientDetector.always(),
        null,
        Level.WARN,
        Clock::systemUTC,
        ForkJoinPool.commonPool());
  }

  @Override
  public NoBackoff getBackoff() {
    return BACKOFF;
  }

  /**
   * @param transientDetector Ignored.
   * @return This policy, which has no use for a detector.
   */
  @Override
  public NoRetryPolicy withTransientDetector(TransientDetector transientDetector) {
    return this;
  }

  @Override
  public String toString() {
    return "NoRetryPolicy";
  }
}
