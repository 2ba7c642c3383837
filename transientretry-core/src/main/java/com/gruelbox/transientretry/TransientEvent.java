package com.gruelbox.transientretry;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Passed to each {@link TransientListener} when a {@link RetryPolicy} is about to retry after a
 * transient failure. Setting {@link #setHandled(boolean) handled} stops later listeners from
 * seeing the event and suppresses the policy's own logging of the failure.
 */
@ToString
public final class TransientEvent {

  /**
   * @return The transient failure.
   */
  @SuppressWarnings("JavaDoc")
  @Getter
  private final Throwable failure;

  /**
   * @param handled True if the failure has been dealt with and needs no further reporting.
   * @return True if the failure has been dealt with and needs no further reporting.
   */
  @SuppressWarnings("JavaDoc")
  @Getter
  @Setter
  private volatile boolean handled;

  TransientEvent(Throwable failure) {
    this.failure = failure;
  }
}
