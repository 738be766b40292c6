package io.github.panghy.birpc.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for PendingRequests.
 */
public class PendingRequestsTest {

  private PendingRequests pending;

  @BeforeEach
  public void setUp() {
    pending = new PendingRequests();
  }

  @Test
  public void testStartRegistersLiveToken() {
    CancellationToken token = pending.start(1);
    assertNotNull(token);
    assertFalse(token.isCancelled());
    assertTrue(pending.isPending(1));
    assertEquals(1, pending.size());
  }

  @Test
  public void testCancelCancelsAndRemoves() {
    CancellationToken token = pending.start(1);
    pending.cancel(1);
    assertTrue(token.isCancelled());
    assertFalse(pending.isPending(1));
    assertEquals(0, pending.size());
  }

  @Test
  public void testCancelUnknownSeqIsNoOp() {
    CancellationToken token = pending.start(1);
    pending.cancel(2);
    assertFalse(token.isCancelled());
    assertEquals(1, pending.size());
  }

  @Test
  public void testCancelTwiceIsNoOp() {
    CancellationToken token = pending.start(1);
    pending.cancel(1);
    pending.cancel(1);
    assertTrue(token.isCancelled());
    assertEquals(0, pending.size());
  }

  @Test
  public void testStartOfPendingSeqReturnsLiveToken() {
    CancellationToken first = pending.start(7);
    CancellationToken second = pending.start(7);
    assertSame(first, second);
    assertEquals(1, pending.size());
  }

  @Test
  public void testStartAfterCancelGivesFreshToken() {
    CancellationToken first = pending.start(7);
    pending.cancel(7);
    CancellationToken second = pending.start(7);
    assertNotSame(first, second);
    assertFalse(second.isCancelled());
  }

  @Test
  public void testCancelAll() {
    CancellationToken a = pending.start(1);
    CancellationToken b = pending.start(2);
    CancellationToken c = pending.start(3);

    assertEquals(3, pending.cancelAll());
    assertTrue(a.isCancelled());
    assertTrue(b.isCancelled());
    assertTrue(c.isCancelled());
    assertEquals(0, pending.size());
    assertEquals(0, pending.cancelAll());
  }
}
