package org.tesseracthub.currency.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SingleFlight Unit Tests")
class SingleFlightTest {

  private final SingleFlight<String, Integer> singleFlight = new SingleFlight<>();

  @Test
  void execute_ConcurrentCallsForSameKey_RunWorkOnce() throws Exception {
    // Arrange
    var executions = new AtomicInteger();
    var release = new CountDownLatch(1);
    var callers = 8;
    var executor = Executors.newFixedThreadPool(callers);

    try {
      // Act
      var futures = new ArrayList<Future<Integer>>();
      for (int i = 0; i < callers; i++) {
        futures.add(
            executor.submit(
                () ->
                    singleFlight.execute(
                        "EUR/USD",
                        () -> {
                          executions.incrementAndGet();
                          await(release);
                          return 42;
                        })));
      }

      waitUntilInFlight();
      // give the remaining callers time to join the in-flight call
      Thread.sleep(200);
      release.countDown();

      // Assert
      for (var future : futures) {
        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(42);
      }
      assertThat(executions.get()).isEqualTo(1);
      assertThat(singleFlight.inFlightCount()).isZero();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void execute_WhenWorkFails_WaitersReceiveSameException() throws Exception {
    // Arrange
    var release = new CountDownLatch(1);
    var failure = new IllegalStateException("provider down");
    var executor = Executors.newFixedThreadPool(2);

    try {
      var leader =
          executor.submit(
              () ->
                  singleFlight.execute(
                      "EUR/USD",
                      () -> {
                        await(release);
                        throw failure;
                      }));
      waitUntilInFlight();
      var follower = executor.submit(() -> singleFlight.execute("EUR/USD", () -> 1));
      Thread.sleep(200);

      // Act
      release.countDown();

      // Assert
      assertThatThrownBy(() -> leader.get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCause(failure);
      assertThatThrownBy(() -> follower.get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCause(failure);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void execute_AfterCompletion_RunsWorkAgain() {
    var executions = new AtomicInteger();

    singleFlight.execute("EUR/USD", executions::incrementAndGet);
    singleFlight.execute("EUR/USD", executions::incrementAndGet);

    assertThat(executions.get()).isEqualTo(2);
    assertThat(singleFlight.inFlightCount()).isZero();
  }

  @Test
  void execute_DifferentKeys_DoNotShareResults() {
    assertThat(singleFlight.execute("EUR/USD", () -> 1)).isEqualTo(1);
    assertThat(singleFlight.execute("EUR/JPY", () -> 2)).isEqualTo(2);
  }

  private void waitUntilInFlight() throws InterruptedException {
    var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (singleFlight.inFlightCount() == 0 && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
