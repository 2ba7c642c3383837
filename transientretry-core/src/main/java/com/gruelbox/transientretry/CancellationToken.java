package com.gruelbox.transientretry;

import com.gruelbox.transientretry.spi.Utils;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A signal, observed by a {@link RetryPolicy}, which requests that an operation stop being
 * retried. Obtain one from a {@link CancellationTokenSource}, or use {@link #NONE}.
 *
 * <p>A policy checks the token before every attempt, immediately after every failure and
 * throughout every wait between attempts. Once cancellation is observed, the policy ends the run
 * with an {@link OperationCancelledException}, even if the pending failure was transient.
 */
public interface CancellationToken {

  /** A token which is never cancelled. */
  CancellationToken NONE =
      new CancellationToken() {
        @Override
        public boolean isCancellationRequested() {
          return false;
        }

        @Override
        public boolean await(Duration timeout) throws InterruptedException {
          TimeUnit.NANOSECONDS.sleep(Utils.toNanosSaturated(timeout));
          return false;
        }

        @Override
        public Registration onCancellation(Runnable callback) {
          return () -> {};
        }

        @Override
        public String toString() {
          return "CancellationToken.NONE";
        }
      };

  /**
   * @return True once cancellation has been requested. Never reverts to false.
   */
  boolean isCancellationRequested();

  /**
   * @throws OperationCancelledException If cancellation has been requested.
   */
  default void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new OperationCancelledException();
    }
  }

  /**
   * Blocks until either cancellation is requested or the timeout elapses.
   *
   * @param timeout The maximum time to block.
   * @return True if cancellation was requested, false if the timeout elapsed first.
   * @throws InterruptedException If the calling thread is interrupted while blocked.
   */
  boolean await(Duration timeout) throws InterruptedException;

  /**
   * Registers a callback to run when cancellation is requested, in the thread requesting it. If
   * cancellation has already been requested, the callback runs immediately in the calling thread.
   *
   * @param callback The callback.
   * @return A registration which, when closed, removes the callback if it has not yet run.
   */
  Registration onCancellation(Runnable callback);

  /** Returned by {@link #onCancellation(Runnable)}. */
  @FunctionalInterface
  interface Registration extends AutoCloseable {

    @Override
    void close();
  }
}
