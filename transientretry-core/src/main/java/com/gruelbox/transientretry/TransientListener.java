package com.gruelbox.transientretry;

/**
 * Observes the transient failures a {@link RetryPolicy} retries. Register with {@link
 * RetryPolicy#addTransientListener(TransientListener)}.
 *
 * <p>Listeners are called in registration order, in the thread running the retry, after the
 * decision to retry has been made and before the policy waits. They cannot change that decision.
 * A listener which throws is logged and skipped, as if it had not handled the event.
 *
 * <p>The final failure of an invocation, once retries are exhausted, is never reported here; it
 * is thrown to the caller.
 */
@FunctionalInterface
public interface TransientListener {

  /**
   * @param event The transient failure. Call {@link TransientEvent#setHandled(boolean)} to stop
   *     further listeners and default logging.
   */
  void onTransient(TransientEvent event);
}
