package io.github.panghy.birpc.core;

import io.github.panghy.birpc.rpc.error.RpcException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CancellationToken.
 */
public class CancellationTokenTest {

  @Test
  public void testNewTokenIsNotCancelled() {
    CancellationToken token = new CancellationToken();
    assertFalse(token.isCancelled());
    assertDoesNotThrow(token::throwIfCancelled);
  }

  @Test
  public void testCancelIsOneShot() {
    CancellationToken token = new CancellationToken();
    assertTrue(token.cancel());
    assertTrue(token.isCancelled());
    assertFalse(token.cancel());
    assertTrue(token.isCancelled());
  }

  @Test
  public void testThrowIfCancelled() {
    CancellationToken token = new CancellationToken();
    token.cancel();
    CallCancelledException e = assertThrows(CallCancelledException.class, token::throwIfCancelled);
    assertEquals("Call was cancelled", e.getMessage());
    assertEquals(RpcException.ErrorCode.CANCELLED, e.getErrorCode());
  }

  @Test
  public void testHandlerRunsExactlyOnce() {
    CancellationToken token = new CancellationToken();
    AtomicInteger runs = new AtomicInteger();
    token.onCancel(runs::incrementAndGet);
    assertEquals(0, runs.get());

    token.cancel();
    token.cancel();
    assertEquals(1, runs.get());
  }

  @Test
  public void testHandlerAddedAfterCancelRunsImmediately() {
    CancellationToken token = new CancellationToken();
    token.cancel();

    AtomicInteger runs = new AtomicInteger();
    token.onCancel(runs::incrementAndGet);
    assertEquals(1, runs.get());
  }

  @Test
  public void testNullHandlerRejected() {
    CancellationToken token = new CancellationToken();
    assertThrows(IllegalArgumentException.class, () -> token.onCancel(null));
  }

  @Test
  public void testFailingHandlerDoesNotStopOthers() {
    CancellationToken token = new CancellationToken();
    AtomicInteger runs = new AtomicInteger();
    token.onCancel(() -> {
      throw new IllegalStateException("handler failed");
    });
    token.onCancel(runs::incrementAndGet);

    assertTrue(token.cancel());
    assertEquals(1, runs.get());
  }

  @Test
  public void testAwaitTimesOut() throws InterruptedException {
    CancellationToken token = new CancellationToken();
    assertFalse(token.await(10, TimeUnit.MILLISECONDS));
  }

  @Test
  public void testAwaitWakesUpOnCancel() throws Exception {
    CancellationToken token = new CancellationToken();
    CountDownLatch waiting = new CountDownLatch(1);
    Thread canceller = new Thread(() -> {
      try {
        waiting.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      token.cancel();
    });
    canceller.start();

    waiting.countDown();
    assertTrue(token.await(5, TimeUnit.SECONDS));
    canceller.join();
  }

  @Test
  public void testConcurrentCancelRunsHandlersOnce() throws Exception {
    CancellationToken token = new CancellationToken();
    AtomicInteger runs = new AtomicInteger();
    for (int i = 0; i < 10; i++) {
      token.onCancel(runs::incrementAndGet);
    }

    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger winners = new AtomicInteger();
    Thread[] threads = new Thread[4];
    for (int i = 0; i < threads.length; i++) {
      threads[i] = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        if (token.cancel()) {
          winners.incrementAndGet();
        }
      });
      threads[i].start();
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join();
    }

    assertEquals(1, winners.get());
    assertEquals(10, runs.get());
  }
}
