package com.gruelbox.transientretry;

import static com.gruelbox.transientretry.spi.Utils.logAtLevel;

import com.gruelbox.transientretry.spi.Utils;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

/**
 * Base class for the supplied {@link RetryPolicy} implementations. Holds the configuration common
 * to all of them and runs the retry loop, leaving subclasses to supply the {@link Backoff} that
 * shapes the waits.
 */
@Slf4j
public abstract class AbstractRetryPolicy implements RetryPolicy, Validatable {

  /** MDC key set to {@code "true"} while a retried transient failure is being logged. */
  public static final String TRANSIENT_MDC_KEY = "transient";

  private final int maxAttempts;
  private final Duration timeout;
  private final TransientDetector transientDetector;
  private final String categoryName;
  private final Logger transientLogger;
  private final Level logLevelTransientFailure;
  private final Supplier<Clock> clockProvider;
  private final Executor asyncExecutor;
  private final List<TransientListener> listeners = new CopyOnWriteArrayList<>();

  protected AbstractRetryPolicy(AbstractRetryPolicyBuilder<?, ?> builder) {
    this(
        builder.resolveMaxAttempts(),
        builder.timeout,
        builder.resolveTransientDetector(),
        builder.categoryNameSet ? builder.categoryName : DEFAULT_CATEGORY_NAME,
        Utils.firstNonNull(builder.logLevelTransientFailure, () -> Level.WARN),
        builder.clockProvider == null ? Clock::systemUTC : builder.clockProvider,
        Utils.firstNonNull(builder.asyncExecutor, ForkJoinPool::commonPool));
  }

  /**
   * Copies all the configuration of {@code other} except its detector and its listeners.
   *
   * @param other The policy to copy.
   * @param transientDetector The detector for the copy.
   */
  protected AbstractRetryPolicy(AbstractRetryPolicy other, TransientDetector transientDetector) {
    this(
        other.maxAttempts,
        other.timeout,
        transientDetector,
        other.categoryName,
        other.logLevelTransientFailure,
        other.clockProvider,
        other.asyncExecutor);
  }

  AbstractRetryPolicy(
      int maxAttempts,
      Duration timeout,
      TransientDetector transientDetector,
      String categoryName,
      Level logLevelTransientFailure,
      Supplier<Clock> clockProvider,
      Executor asyncExecutor) {
    this.maxAttempts = maxAttempts;
    this.timeout = timeout;
    this.transientDetector = transientDetector;
    this.categoryName = categoryName;
    this.transientLogger =
        categoryName == null || categoryName.isEmpty()
            ? null
            : LoggerFactory.getLogger(categoryName);
    this.logLevelTransientFailure = logLevelTransientFailure;
    this.clockProvider = clockProvider;
    this.asyncExecutor = asyncExecutor;
  }

  /**
   * @return The backoff shaping the waits between attempts.
   */
  public abstract Backoff getBackoff();

  @Override
  public int getMaxAttempts() {
    return maxAttempts;
  }

  @Override
  public Duration getTimeout() {
    return timeout;
  }

  /**
   * @return The logger name used for retried transient failures, or null if they are not logged.
   */
  public String getCategoryName() {
    return categoryName;
  }

  protected TransientDetector getTransientDetector() {
    return transientDetector;
  }

  @Override
  public void validate(Validator validator) {
    validator.min("maxAttempts", maxAttempts, 0);
    validator.notNull("transientDetector", transientDetector);
    validator.notNull("logLevelTransientFailure", logLevelTransientFailure);
    validator.notNull("clockProvider", clockProvider);
    validator.notNull("asyncExecutor", asyncExecutor);
  }

  @Override
  public <T> T call(Callable<T> action, CancellationToken cancellationToken) throws Exception {
    Objects.requireNonNull(action, "action");
    RetryRun run = newRun(cancellationToken);
    while (true) {
      cancellationToken.throwIfCancellationRequested();
      try {
        return action.call();
      } catch (Exception e) {
        switch (run.evaluate(e)) {
          case CANCEL:
            throw new OperationCancelledException();
          case RETHROW:
            throw e;
          default:
            notifyTransient(e);
            sleep(run.getDelay(), cancellationToken);
            run.advance();
            break;
        }
      }
    }
  }

  @Override
  public void run(ThrowingRunnable action, CancellationToken cancellationToken) throws Exception {
    Objects.requireNonNull(action, "action");
    call(
        () -> {
          action.run();
          return null;
        },
        cancellationToken);
  }

  @Override
  public <T> CompletableFuture<T> callAsync(
      Callable<? extends CompletionStage<T>> action, CancellationToken cancellationToken) {
    Objects.requireNonNull(action, "action");
    RetryRun run = newRun(cancellationToken);
    CompletableFuture<T> result = new CompletableFuture<>();
    attemptAsync(action, run, result);
    return result;
  }

  @Override
  public CompletableFuture<Void> runAsync(
      Callable<? extends CompletionStage<?>> action, CancellationToken cancellationToken) {
    Objects.requireNonNull(action, "action");
    return callAsync(() -> action.call().thenApply(ignored -> (Void) null), cancellationToken);
  }

  @Override
  public void addTransientListener(TransientListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public void removeTransientListener(TransientListener listener) {
    listeners.remove(listener);
  }

  /**
   * Reports a failure which is about to be retried: first to the listeners, in order, until one
   * marks it handled, then, if none did, to the transient logger.
   *
   * @param failure The transient failure.
   */
  protected void notifyTransient(Throwable failure) {
    if (!listeners.isEmpty()) {
      TransientEvent event = new TransientEvent(failure);
      for (TransientListener listener : listeners) {
        Utils.safelyRun("notifying transient listener", () -> listener.onTransient(event));
        if (event.isHandled()) {
          return;
        }
      }
    }
    if (transientLogger == null) {
      return;
    }
    try (MDC.MDCCloseable ignored = MDC.putCloseable(TRANSIENT_MDC_KEY, "true")) {
      logAtLevel(
          transientLogger, logLevelTransientFailure, "Transient: {}", failure.getMessage(), failure);
    }
  }

  private RetryRun newRun(CancellationToken cancellationToken) {
    Objects.requireNonNull(cancellationToken, "cancellationToken");
    return new RetryRun(
        maxAttempts,
        timeout,
        transientDetector,
        getBackoff(),
        clockProvider.get(),
        cancellationToken);
  }

  private static void sleep(Duration delay, CancellationToken cancellationToken) {
    try {
      if (cancellationToken.await(delay)) {
        throw new OperationCancelledException();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException(e);
    }
  }

  private <T> void attemptAsync(
      Callable<? extends CompletionStage<T>> action, RetryRun run, CompletableFuture<T> result) {
    if (result.isDone()) {
      log.debug("Abandoning retries; result already completed");
      return;
    }
    if (run.isCancelled()) {
      result.completeExceptionally(new OperationCancelledException());
      return;
    }
    CompletionStage<T> stage;
    try {
      stage = Objects.requireNonNull(action.call(), "Operation returned a null stage");
    } catch (Throwable t) {
      stage = CompletableFuture.failedFuture(t);
    }
    stage.whenComplete(
        (value, failure) -> {
          if (failure == null) {
            result.complete(value);
            return;
          }
          try {
            onAsyncFailure(action, run, result, failure);
          } catch (Throwable t) {
            result.completeExceptionally(t);
          }
        });
  }

  private <T> void onAsyncFailure(
      Callable<? extends CompletionStage<T>> action,
      RetryRun run,
      CompletableFuture<T> result,
      Throwable failure) {
    switch (run.evaluate(failure)) {
      case CANCEL:
        result.completeExceptionally(new OperationCancelledException());
        break;
      case RETHROW:
        result.completeExceptionally(failure);
        break;
      default:
        notifyTransient(failure);
        delay(run.getDelay(), run.getCancellationToken())
            .whenCompleteAsync(
                (ignored, cancelled) -> {
                  if (cancelled != null) {
                    result.completeExceptionally(new OperationCancelledException());
                    return;
                  }
                  run.advance();
                  attemptAsync(action, run, result);
                },
                asyncExecutor);
        break;
    }
  }

  /**
   * Completes normally after {@code delay}, or exceptionally as soon as the token is cancelled.
   * Completing early cancels the pending timeout.
   */
  private static CompletableFuture<Void> delay(
      Duration delay, CancellationToken cancellationToken) {
    CompletableFuture<Void> future = new CompletableFuture<>();
    CancellationToken.Registration registration =
        cancellationToken.onCancellation(
            () -> future.completeExceptionally(new OperationCancelledException()));
    future.completeOnTimeout(null, Utils.toNanosSaturated(delay), TimeUnit.NANOSECONDS);
    return future.whenComplete((ignored, cancelled) -> registration.close());
  }

  /**
   * Configuration shared by all policy builders.
   *
   * @param <B> The concrete builder type.
   * @param <P> The policy type built.
   */
  @ToString
  public abstract static class AbstractRetryPolicyBuilder<
          B extends AbstractRetryPolicyBuilder<B, P>, P extends AbstractRetryPolicy>
      implements Validatable {

    protected TransientDetector transientDetector;
    protected boolean transientExceptionTypeSet;
    protected Class<? extends Throwable> transientExceptionType;
    protected Integer maxAttempts;
    protected Duration timeout;
    protected String categoryName;
    protected boolean categoryNameSet;
    protected Level logLevelTransientFailure;
    protected Supplier<Clock> clockProvider;
    protected Executor asyncExecutor;

    protected AbstractRetryPolicyBuilder() {}

    protected abstract B self();

    /**
     * @param transientDetector Decides which failures are retried. Defaults to {@link
     *     TransientDetector#always()}. Replaces any earlier detector or exception type(s).
     * @return Builder.
     */
    public B transientDetector(TransientDetector transientDetector) {
      this.transientDetector = transientDetector;
      this.transientExceptionTypeSet = false;
      this.transientExceptionType = null;
      return self();
    }

    /**
     * @param transientExceptionType Retries failures of exactly this class. See {@link
     *     TransientDetector#matching(Class)}. Replaces any earlier detector or exception type(s).
     *     May not be null.
     * @return Builder.
     */
    public B transientExceptionType(Class<? extends Throwable> transientExceptionType) {
      this.transientDetector = null;
      this.transientExceptionTypeSet = true;
      this.transientExceptionType = transientExceptionType;
      return self();
    }

    /**
     * @param transientExceptionTypes Retries failures of exactly any of these classes. See {@link
     *     TransientDetector#matchingAny(Collection)}. Replaces any earlier detector or exception
     *     type(s). If null or empty, nothing is retried.
     * @return Builder.
     */
    public B transientExceptionTypes(
        Collection<? extends Class<? extends Throwable>> transientExceptionTypes) {
      return transientDetector(TransientDetector.matchingAny(transientExceptionTypes));
    }

    /**
     * @param transientExceptionTypes See {@link #transientExceptionTypes(Collection)}.
     * @return Builder.
     */
    @SafeVarargs
    public final B transientExceptionTypes(Class<? extends Throwable>... transientExceptionTypes) {
      return transientExceptionTypes(
          transientExceptionTypes == null ? null : Arrays.asList(transientExceptionTypes));
    }

    /**
     * @param maxAttempts The maximum number of attempts per invocation, including the first. A
     *     negative value means "use the default": {@value RetryPolicy#DEFAULT_MAX_ATTEMPTS} if no
     *     {@link #timeout(Duration)} is set, otherwise unlimited, so that the timeout alone ends
     *     retries. When both are set, whichever is reached first applies.
     * @return Builder.
     */
    public B maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return self();
    }

    /**
     * @param timeout The maximum time an invocation may keep retrying, measured from its start.
     *     Waits are shortened so as not to pass it. Null (the default) or negative means no
     *     timeout.
     * @return Builder.
     */
    public B timeout(Duration timeout) {
      this.timeout = timeout;
      return self();
    }

    /**
     * @param categoryName The name of the logger used for retried transient failures. Defaults to
     *     {@value RetryPolicy#DEFAULT_CATEGORY_NAME}. Null or empty disables this logging.
     * @return Builder.
     */
    public B categoryName(String categoryName) {
      this.categoryName = categoryName;
      this.categoryNameSet = true;
      return self();
    }

    /**
     * @param logLevelTransientFailure The level at which retried transient failures are logged.
     *     Defaults to {@code WARN}.
     * @return Builder.
     */
    public B logLevelTransientFailure(Level logLevelTransientFailure) {
      this.logLevelTransientFailure = logLevelTransientFailure;
      return self();
    }

    /**
     * @param clockProvider Provides the clock used to compute and enforce the timeout. Defaults to
     *     the UTC system clock. Waits themselves are always real time.
     * @return Builder.
     */
    public B clockProvider(Supplier<Clock> clockProvider) {
      this.clockProvider = clockProvider;
      return self();
    }

    /**
     * @param asyncExecutor The executor on which asynchronous invocations resume after a wait.
     *     Defaults to {@link ForkJoinPool#commonPool()}.
     * @return Builder.
     */
    public B asyncExecutor(Executor asyncExecutor) {
      this.asyncExecutor = asyncExecutor;
      return self();
    }

    /**
     * @return The policy.
     * @throws IllegalArgumentException If the configuration is invalid.
     */
    public P build() {
      Validator validator = new Validator();
      validator.validate(this);
      P policy = newPolicy();
      validator.validate(policy);
      return policy;
    }

    protected abstract P newPolicy();

    @Override
    public void validate(Validator validator) {
      if (transientExceptionTypeSet) {
        validator.notNull("transientExceptionType", transientExceptionType);
      }
    }

    int resolveMaxAttempts() {
      if (maxAttempts != null && maxAttempts >= 0) {
        return maxAttempts;
      }
      return timeout == null ? DEFAULT_MAX_ATTEMPTS : Integer.MAX_VALUE;
    }

    TransientDetector resolveTransientDetector() {
      if (transientExceptionTypeSet) {
        return TransientDetector.matching(transientExceptionType);
      }
      return Utils.firstNonNull(transientDetector, TransientDetector::always);
    }
  }
}
