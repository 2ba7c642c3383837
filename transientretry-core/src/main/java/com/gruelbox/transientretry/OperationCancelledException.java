package com.gruelbox.transientretry;

import java.util.concurrent.CancellationException;

/**
 * Thrown, or used to complete a future exceptionally, when a retry run ends because its {@link
 * CancellationToken} was cancelled (or, for the blocking methods, because the waiting thread was
 * interrupted). Distinct from any failure raised by the operation itself.
 */
public class OperationCancelledException extends CancellationException {

  public OperationCancelledException() {
    super("Operation cancelled");
  }

  public OperationCancelledException(Throwable cause) {
    this();
    initCause(cause);
  }
}
