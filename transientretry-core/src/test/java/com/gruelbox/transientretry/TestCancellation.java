package com.gruelbox.transientretry;

import static java.util.concurrent.CompletableFuture.failedFuture;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TestCancellation {

  private final LinearRetryPolicy slowPolicy =
      RetryPolicy.linear()
          .maxAttempts(10)
          .retryInterval(Duration.ofSeconds(30))
          .categoryName(null)
          .build();

  @Test
  void testSourceCancelsOnce() {
    CancellationTokenSource source = new CancellationTokenSource();
    AtomicInteger callbacks = new AtomicInteger();
    source.getToken().onCancellation(callbacks::incrementAndGet);
    assertFalse(source.getToken().isCancellationRequested());

    source.cancel();
    source.cancel();

    assertTrue(source.isCancellationRequested());
    assertTrue(source.getToken().isCancellationRequested());
    assertThat(callbacks.get(), equalTo(1));
    assertThrows(
        OperationCancelledException.class, () -> source.getToken().throwIfCancellationRequested());
  }

  @Test
  void testCallbackAfterCancellationRunsImmediately() {
    CancellationTokenSource source = new CancellationTokenSource();
    source.cancel();
    AtomicInteger callbacks = new AtomicInteger();
    source.getToken().onCancellation(callbacks::incrementAndGet);
    assertThat(callbacks.get(), equalTo(1));
  }

  @Test
  void testClosedRegistrationNotRun() {
    CancellationTokenSource source = new CancellationTokenSource();
    AtomicInteger callbacks = new AtomicInteger();
    source.getToken().onCancellation(callbacks::incrementAndGet).close();
    source.cancel();
    assertThat(callbacks.get(), equalTo(0));
  }

  @Test
  void testFailingCallbackDoesNotStopOthers() {
    CancellationTokenSource source = new CancellationTokenSource();
    AtomicInteger callbacks = new AtomicInteger();
    source
        .getToken()
        .onCancellation(
            () -> {
              throw new IllegalStateException("callback failed");
            });
    source.getToken().onCancellation(callbacks::incrementAndGet);
    source.cancel();
    assertThat(callbacks.get(), equalTo(1));
  }

  @Test
  void testCancelAfter() throws InterruptedException {
    CancellationTokenSource immediate = new CancellationTokenSource();
    immediate.cancelAfter(Duration.ZERO);
    assertTrue(immediate.isCancellationRequested());

    CancellationTokenSource delayed = new CancellationTokenSource();
    delayed.cancelAfter(Duration.ofMillis(50));
    assertTrue(delayed.getToken().await(Duration.ofSeconds(5)));
  }

  @Test
  void testNoneNeverCancels() throws InterruptedException {
    assertFalse(CancellationToken.NONE.isCancellationRequested());
    assertFalse(CancellationToken.NONE.await(Duration.ofMillis(5)));
    CancellationToken.NONE.throwIfCancellationRequested();
  }

  @Test
  void testOperationCancelledIsACancellation() {
    assertThat(new OperationCancelledException(), instanceOf(CancellationException.class));
  }

  @Test
  void testAlreadyCancelledNeverAttempts() {
    CancellationTokenSource source = new CancellationTokenSource();
    source.cancel();
    AtomicInteger attempts = new AtomicInteger();
    assertThrows(
        OperationCancelledException.class,
        () -> slowPolicy.run(attempts::incrementAndGet, source.getToken()));
    assertThat(attempts.get(), equalTo(0));
  }

  @Test
  void testCancelDuringAttemptWinsOverFailure() {
    CancellationTokenSource source = new CancellationTokenSource();
    AtomicInteger attempts = new AtomicInteger();
    assertThrows(
        OperationCancelledException.class,
        () ->
            slowPolicy.run(
                () -> {
                  attempts.incrementAndGet();
                  source.cancel();
                  throw new IOException();
                },
                source.getToken()));
    assertThat(attempts.get(), equalTo(1));
  }

  @Test
  void testCancelDuringWait() {
    CancellationTokenSource source = new CancellationTokenSource();
    AtomicInteger attempts = new AtomicInteger();
    source.cancelAfter(Duration.ofMillis(100));
    long start = System.nanoTime();
    assertThrows(
        OperationCancelledException.class,
        () ->
            slowPolicy.run(
                () -> {
                  attempts.incrementAndGet();
                  throw new IOException();
                },
                source.getToken()));
    assertThat((System.nanoTime() - start) / 1_000_000, lessThan(10_000L));
    assertThat(attempts.get(), equalTo(1));
  }

  @Test
  void testInterruptDuringWait() {
    AtomicInteger attempts = new AtomicInteger();
    Thread.currentThread().interrupt();
    try {
      OperationCancelledException e =
          assertThrows(
              OperationCancelledException.class,
              () ->
                  slowPolicy.run(
                      () -> {
                        attempts.incrementAndGet();
                        throw new IOException();
                      }));
      assertThat(e.getCause(), instanceOf(InterruptedException.class));
      assertThat(attempts.get(), equalTo(1));
    } finally {
      assertTrue(Thread.interrupted());
    }
  }

  @Test
  void testAsyncCancelDuringWait() {
    CancellationTokenSource source = new CancellationTokenSource();
    AtomicInteger attempts = new AtomicInteger();
    CompletableFuture<Void> result =
        slowPolicy.runAsync(
            () -> {
              attempts.incrementAndGet();
              return failedFuture(new IOException());
            },
            source.getToken());
    assertFalse(result.isDone());
    source.cancel();
    assertThrows(OperationCancelledException.class, () -> result.get(5, TimeUnit.SECONDS));
    assertThat(attempts.get(), equalTo(1));
  }

  @Test
  void testAsyncCancelDuringAttemptWinsOverError() {
    CancellationTokenSource source = new CancellationTokenSource();
    CompletableFuture<Void> result =
        slowPolicy.runAsync(
            () -> {
              source.cancel();
              return failedFuture(new AssertionError("broken"));
            },
            source.getToken());
    assertThrows(OperationCancelledException.class, () -> result.get(5, TimeUnit.SECONDS));
  }

  @Test
  void testAsyncAlreadyCancelled() {
    CancellationTokenSource source = new CancellationTokenSource();
    source.cancel();
    AtomicInteger attempts = new AtomicInteger();
    CompletableFuture<Void> result =
        slowPolicy.runAsync(
            () -> {
              attempts.incrementAndGet();
              return failedFuture(new IOException());
            },
            source.getToken());
    assertTrue(result.isCompletedExceptionally());
    assertThrows(OperationCancelledException.class, result::join);
    assertThat(attempts.get(), equalTo(0));
  }
}
