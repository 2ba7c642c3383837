package com.gruelbox.transientretry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides whether a failure raised by an operation is transient, and therefore worth retrying.
 *
 * <p>Implementations must be stateless, or at least thread safe, since a single detector is shared
 * by every invocation of a {@link RetryPolicy}, which may be concurrent.
 */
@FunctionalInterface
public interface TransientDetector {

  /**
   * @param failure The failure raised by the operation.
   * @return True if the operation should be retried (subject to the policy's limits).
   */
  boolean isTransient(Throwable failure);

  /**
   * @return A detector which treats every failure as transient. Used when a policy is built
   *     without one.
   */
  static TransientDetector always() {
    return failure -> true;
  }

  /**
   * A detector which treats failures of exactly the given class as transient. Subclasses do not
   * match. See {@link #matches(Throwable, Class)} for the handling of asynchronous wrappers.
   *
   * @param exceptionType The failure class.
   * @return The detector.
   */
  static TransientDetector matching(Class<? extends Throwable> exceptionType) {
    return failure -> matches(failure, exceptionType);
  }

  /**
   * A detector which treats a failure as transient if it {@link #matches(Throwable, Class)} any
   * of the given classes, checked in order.
   *
   * @param exceptionTypes The failure classes. If null or empty, nothing is transient.
   * @return The detector.
   */
  @SafeVarargs
  static TransientDetector matchingAny(Class<? extends Throwable>... exceptionTypes) {
    return matchingAny(exceptionTypes == null ? null : Arrays.asList(exceptionTypes));
  }

  /**
   * @see #matchingAny(Class[])
   */
  static TransientDetector matchingAny(
      Collection<? extends Class<? extends Throwable>> exceptionTypes) {
    if (exceptionTypes == null || exceptionTypes.isEmpty()) {
      return failure -> false;
    }
    List<Class<? extends Throwable>> types = new ArrayList<>(exceptionTypes);
    return failure -> {
      for (Class<? extends Throwable> type : types) {
        if (matches(failure, type)) {
          return true;
        }
      }
      return false;
    };
  }

  /**
   * Checks whether a failure is of exactly the given class.
   *
   * <p>Asynchronous APIs commonly report a failure wrapped in a {@link CompletionException} or
   * {@link ExecutionException}. If {@code failure} is such a wrapper with exactly one cause (a
   * cause and no suppressed failures), the cause is checked instead. Only one level is unwrapped.
   *
   * @param failure The failure.
   * @param exceptionType The class to match.
   * @return True on a match. False if either argument is null.
   */
  static boolean matches(Throwable failure, Class<? extends Throwable> exceptionType) {
    if (failure == null || exceptionType == null) {
      return false;
    }
    if (failure.getClass() == exceptionType) {
      return true;
    }
    if (!(failure instanceof CompletionException) && !(failure instanceof ExecutionException)) {
      return false;
    }
    if (failure.getSuppressed().length != 0) {
      return false;
    }
    Throwable cause = failure.getCause();
    return cause != null && cause.getClass() == exceptionType;
  }

  /**
   * @param other Another detector.
   * @return A detector which treats a failure as transient if either this or {@code other} does,
   *     consulting this one first.
   */
  default TransientDetector or(TransientDetector other) {
    return failure -> isTransient(failure) || other.isTransient(failure);
  }
}
