package com.gruelbox.transientretry;

import com.gruelbox.transientretry.spi.Utils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates and controls a {@link CancellationToken}. Cancellation is either requested directly with
 * {@link #cancel()} or on a timer with {@link #cancelAfter(Duration)}. Thread safe.
 */
@Slf4j
public final class CancellationTokenSource {

  private final CountDownLatch cancelled = new CountDownLatch(1);
  private final List<Runnable> callbacks = new ArrayList<>();
  private final CancellationToken token = new Token();

  /**
   * @return The token controlled by this source.
   */
  public CancellationToken getToken() {
    return token;
  }

  public boolean isCancellationRequested() {
    return cancelled.getCount() == 0;
  }

  /**
   * Requests cancellation, waking any thread blocked in {@link CancellationToken#await(Duration)}
   * and running any registered callbacks. Subsequent calls have no effect.
   */
  public void cancel() {
    List<Runnable> toRun;
    synchronized (callbacks) {
      if (isCancellationRequested()) {
        return;
      }
      cancelled.countDown();
      toRun = new ArrayList<>(callbacks);
      callbacks.clear();
    }
    log.debug("Cancellation requested, running {} callbacks", toRun.size());
    toRun.forEach(callback -> Utils.safelyRun("running cancellation callback", callback::run));
  }

  /**
   * Schedules a call to {@link #cancel()}.
   *
   * @param delay How long to wait before cancelling.
   */
  public void cancelAfter(Duration delay) {
    if (delay.isNegative() || delay.isZero()) {
      cancel();
      return;
    }
    CompletableFuture.delayedExecutor(Utils.toNanosSaturated(delay), TimeUnit.NANOSECONDS)
        .execute(this::cancel);
  }

  @Override
  public String toString() {
    return "CancellationTokenSource(cancelled=" + isCancellationRequested() + ")";
  }

  private final class Token implements CancellationToken {

    @Override
    public boolean isCancellationRequested() {
      return CancellationTokenSource.this.isCancellationRequested();
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
      return cancelled.await(Utils.toNanosSaturated(timeout), TimeUnit.NANOSECONDS);
    }

    @Override
    public Registration onCancellation(Runnable callback) {
      synchronized (callbacks) {
        if (!CancellationTokenSource.this.isCancellationRequested()) {
          callbacks.add(callback);
          return () -> {
            synchronized (callbacks) {
              callbacks.remove(callback);
            }
          };
        }
      }
      callback.run();
      return () -> {};
    }

    @Override
    public String toString() {
      return CancellationTokenSource.this.toString();
    }
  }
}
