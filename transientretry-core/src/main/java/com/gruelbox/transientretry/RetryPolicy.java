package com.gruelbox.transientretry;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Retries operations which fail due to transient errors. What counts as transient, how long to
 * wait between attempts and when to give up are decided by the implementation and its
 * configuration.
 *
 * <p>A policy is built once and then reused for any number of operations, including concurrently.
 * Each invocation is independent: it has its own attempt count and its own deadline, computed
 * from {@link #getTimeout()} when the invocation starts.
 *
 * <p>Every invocation ends in one of three ways:
 *
 * <ul>
 *   <li>the operation's result;
 *   <li>the operation's own failure, unwrapped and unmodified, when the failure isn't transient or
 *       when attempts or time have run out;
 *   <li>an {@link OperationCancelledException} when the {@link CancellationToken} is cancelled,
 *       which takes priority over any pending failure.
 * </ul>
 *
 * <p>Usage:
 *
 * <pre>RetryPolicy policy = ExponentialRetryPolicy.builder()
 *     .transientExceptionType(SocketTimeoutException.class)
 *     .maxAttempts(4)
 *     .build();
 * String body = policy.call(() -&gt; client.fetch(url));</pre>
 */
public interface RetryPolicy {

  /** The attempt limit used when none is configured and there is no timeout. */
  int DEFAULT_MAX_ATTEMPTS = 5;

  /** The logger name under which retried transient failures are logged by default. */
  String DEFAULT_CATEGORY_NAME = "transient-errors";

  /**
   * @return A builder for a {@link LinearRetryPolicy}.
   */
  static LinearRetryPolicy.LinearRetryPolicyBuilder linear() {
    return LinearRetryPolicy.builder();
  }

  /**
   * @return A builder for an {@link ExponentialRetryPolicy}.
   */
  static ExponentialRetryPolicy.ExponentialRetryPolicyBuilder exponential() {
    return ExponentialRetryPolicy.builder();
  }

  /**
   * @return A policy which makes a single attempt.
   */
  static RetryPolicy none() {
    return NoRetryPolicy.INSTANCE;
  }

  /**
   * @return The maximum number of attempts per invocation. {@link Integer#MAX_VALUE} means the
   *     number of attempts is limited only by {@link #getTimeout()}.
   */
  int getMaxAttempts();

  /**
   * @return The maximum time an invocation keeps retrying, or null if only {@link
   *     #getMaxAttempts()} applies.
   */
  Duration getTimeout();

  /**
   * Copies this policy with a different {@link TransientDetector}. Transient listeners are not
   * copied.
   *
   * @param transientDetector The replacement detector. If null, this policy is returned as is.
   * @return The copy.
   */
  RetryPolicy withTransientDetector(TransientDetector transientDetector);

  /**
   * Runs a synchronous operation, retrying transient failures. Waits block the calling thread.
   *
   * @param action The operation.
   * @param cancellationToken Checked before and after each attempt and during each wait.
   * @throws OperationCancelledException If cancelled, or if the thread is interrupted while
   *     waiting.
   * @throws Exception The operation's final failure.
   */
  void run(ThrowingRunnable action, CancellationToken cancellationToken) throws Exception;

  /**
   * As {@link #run(ThrowingRunnable, CancellationToken)} with {@link CancellationToken#NONE}.
   *
   * @param action The operation.
   * @throws Exception The operation's final failure.
   */
  default void run(ThrowingRunnable action) throws Exception {
    run(action, CancellationToken.NONE);
  }

  /**
   * Runs a synchronous operation which returns a result, retrying transient failures. Waits block
   * the calling thread.
   *
   * @param action The operation.
   * @param cancellationToken Checked before and after each attempt and during each wait.
   * @param <T> The result type.
   * @return The result of the first successful attempt.
   * @throws OperationCancelledException If cancelled, or if the thread is interrupted while
   *     waiting.
   * @throws Exception The operation's final failure.
   */
  <T> T call(Callable<T> action, CancellationToken cancellationToken) throws Exception;

  /**
   * As {@link #call(Callable, CancellationToken)} with {@link CancellationToken#NONE}.
   *
   * @param action The operation.
   * @param <T> The result type.
   * @return The result of the first successful attempt.
   * @throws Exception The operation's final failure.
   */
  default <T> T call(Callable<T> action) throws Exception {
    return call(action, CancellationToken.NONE);
  }

  /**
   * Runs an asynchronous operation, retrying transient failures. No thread is blocked while
   * waiting between attempts.
   *
   * <p>The operation is started by calling {@code action}; it succeeds or fails with the stage
   * returned. If {@code action} throws, or returns null, the attempt counts as failed.
   *
   * @param action Starts the operation.
   * @param cancellationToken Checked before and after each attempt, and ends any wait early.
   * @return A future which completes when the operation succeeds, or completes exceptionally with
   *     the operation's final failure or an {@link OperationCancelledException}. Cancelling the
   *     future stops any further attempts.
   */
  CompletableFuture<Void> runAsync(
      Callable<? extends CompletionStage<?>> action, CancellationToken cancellationToken);

  /**
   * As {@link #runAsync(Callable, CancellationToken)} with {@link CancellationToken#NONE}.
   *
   * @param action Starts the operation.
   * @return A future for the outcome.
   */
  default CompletableFuture<Void> runAsync(Callable<? extends CompletionStage<?>> action) {
    return runAsync(action, CancellationToken.NONE);
  }

  /**
   * Runs an asynchronous operation which returns a result, retrying transient failures. See
   * {@link #runAsync(Callable, CancellationToken)}.
   *
   * @param action Starts the operation.
   * @param cancellationToken Checked before and after each attempt, and ends any wait early.
   * @param <T> The result type.
   * @return A future for the result of the first successful attempt.
   */
  <T> CompletableFuture<T> callAsync(
      Callable<? extends CompletionStage<T>> action, CancellationToken cancellationToken);

  /**
   * As {@link #callAsync(Callable, CancellationToken)} with {@link CancellationToken#NONE}.
   *
   * @param action Starts the operation.
   * @param <T> The result type.
   * @return A future for the result of the first successful attempt.
   */
  default <T> CompletableFuture<T> callAsync(Callable<? extends CompletionStage<T>> action) {
    return callAsync(action, CancellationToken.NONE);
  }

  /**
   * Adds a listener for retried transient failures. While any listeners are registered, the
   * policy only logs a transient failure itself if none of them marks it handled.
   *
   * <p>Safe to call at any time, including while invocations are running; each notification
   * uses the listeners registered when it started.
   *
   * @param listener The listener.
   */
  void addTransientListener(TransientListener listener);

  /**
   * @param listener A listener previously added with {@link
   *     #addTransientListener(TransientListener)}.
   */
  void removeTransientListener(TransientListener listener);
}
