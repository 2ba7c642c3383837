package com.gruelbox.transientretry;

import com.gruelbox.transientretry.spi.Deadlines;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The state of a single invocation of a {@link RetryPolicy}: the attempt count, the deadline and
 * the current backoff interval. Shared by the blocking and non-blocking invocation methods, which
 * differ only in how they run an attempt and how they wait.
 *
 * <p>Not thread safe. The non-blocking methods hand a run from thread to thread, but only ever
 * through future completion, so access is sequential.
 */
final class RetryRun {

  enum Decision {
    /** Wait {@link #getDelay()}, then try again. */
    RETRY,
    /** Stop and pass the failure to the caller unchanged. */
    RETHROW,
    /** Stop with an {@link OperationCancelledException}. */
    CANCEL
  }

  private final int maxAttempts;
  private final TransientDetector transientDetector;
  private final Backoff backoff;
  private final Clock clock;
  private final CancellationToken cancellationToken;
  private final Instant deadline;

  private Duration interval;
  private Duration delay = Duration.ZERO;
  private int attempts;

  RetryRun(
      int maxAttempts,
      Duration timeout,
      TransientDetector transientDetector,
      Backoff backoff,
      Clock clock,
      CancellationToken cancellationToken) {
    this.maxAttempts = maxAttempts;
    this.transientDetector = transientDetector;
    this.backoff = backoff;
    this.clock = clock;
    this.cancellationToken = cancellationToken;
    this.deadline = Deadlines.computeDeadline(clock.instant(), timeout);
    this.interval = backoff.firstInterval();
  }

  boolean isCancelled() {
    return cancellationToken.isCancellationRequested();
  }

  /**
   * Decides what to do about a failed attempt, counting it against the attempt limit.
   *
   * @param failure The failure.
   * @return The decision. On {@link Decision#RETRY}, {@link #getDelay()} holds the wait.
   */
  Decision evaluate(Throwable failure) {
    if (isCancelled()) {
      return Decision.CANCEL;
    }
    if (failure instanceof Error) {
      return Decision.RETHROW;
    }
    delay = Deadlines.adjustDelay(interval, deadline, clock.instant());
    attempts++;
    if (attempts >= maxAttempts || delay.isZero() || !transientDetector.isTransient(failure)) {
      return Decision.RETHROW;
    }
    return Decision.RETRY;
  }

  /** Moves to the next backoff interval. Called once the wait after a retried failure is over. */
  void advance() {
    interval = backoff.nextInterval(interval);
  }

  Duration getDelay() {
    return delay;
  }

  Duration getInterval() {
    return interval;
  }

  int getAttempts() {
    return attempts;
  }

  Instant getDeadline() {
    return deadline;
  }

  CancellationToken getCancellationToken() {
    return cancellationToken;
  }
}
