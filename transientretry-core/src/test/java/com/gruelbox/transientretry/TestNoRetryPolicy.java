package com.gruelbox.transientretry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TestNoRetryPolicy {

  @Test
  void testShared() {
    assertThat(RetryPolicy.none(), sameInstance(NoRetryPolicy.INSTANCE));
    assertThat(NoRetryPolicy.INSTANCE.getMaxAttempts(), equalTo(1));
    assertThat(NoRetryPolicy.INSTANCE.getTimeout(), nullValue());
    assertThat(NoRetryPolicy.INSTANCE.getCategoryName(), nullValue());
    assertThat(NoRetryPolicy.INSTANCE.getBackoff().firstInterval(), equalTo(Duration.ZERO));
  }

  @Test
  void testWithTransientDetectorIsIgnored() {
    NoRetryPolicy policy = new NoRetryPolicy();
    assertThat(policy.withTransientDetector(TransientDetector.always()), sameInstance(policy));
    assertThat(policy.withTransientDetector(null), sameInstance(policy));
  }

  @Test
  void testSingleAttempt() {
    AtomicInteger attempts = new AtomicInteger();
    IOException failure = new IOException();
    IOException thrown =
        assertThrows(
            IOException.class,
            () ->
                RetryPolicy.none()
                    .run(
                        () -> {
                          attempts.incrementAndGet();
                          throw failure;
                        }));
    assertThat(thrown, sameInstance(failure));
    assertThat(attempts.get(), equalTo(1));
  }

  @Test
  void testResult() throws Exception {
    assertThat(RetryPolicy.none().call(() -> "ok"), equalTo("ok"));
  }

  @Test
  void testSingleAsyncAttempt() {
    AtomicInteger attempts = new AtomicInteger();
    IOException failure = new IOException();
    CompletableFuture<Void> future =
        RetryPolicy.none()
            .runAsync(
                () -> {
                  attempts.incrementAndGet();
                  return CompletableFuture.failedFuture(failure);
                });
    ExecutionException e =
        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    assertThat(e.getCause(), sameInstance(failure));
    assertThat(attempts.get(), equalTo(1));
  }

  @Test
  void testListenersNotNotified() {
    NoRetryPolicy policy = new NoRetryPolicy();
    AtomicInteger notified = new AtomicInteger();
    policy.addTransientListener(event -> notified.incrementAndGet());
    assertThrows(
        IOException.class,
        () ->
            policy.run(
                () -> {
                  throw new IOException();
                }));
    assertThat(notified.get(), equalTo(0));
    assertThat(policy.getBackoff(), instanceOf(NoBackoff.class));
  }
}
