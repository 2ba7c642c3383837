package com.gruelbox.transientretry;

/**
 * A synchronous operation with no result, which may fail with any {@link Exception}. Supplied to
 * {@link RetryPolicy#run(ThrowingRunnable)}.
 */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Exception;
}
