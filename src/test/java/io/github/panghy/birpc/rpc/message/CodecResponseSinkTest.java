package io.github.panghy.birpc.rpc.message;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Tests for CodecResponseSink and the message records.
 */
public class CodecResponseSinkTest {

  private final ServerCodec codec = mock(ServerCodec.class);
  private final ReentrantLock lock = new ReentrantLock();
  private final CodecResponseSink sink = new CodecResponseSink();

  @Test
  public void testSuccessWritesReply() throws IOException {
    Object reply = 5;
    sink.sendResponse(lock, new Request("Arith.add", 3), reply, codec, "");
    verify(codec).writeResponse(new Response("Arith.add", 3, ""), reply);
  }

  @Test
  public void testErrorWritesPlaceholderBody() throws IOException {
    sink.sendResponse(lock, new Request("Arith.divide", 4), 99, codec, "divide by zero");
    verify(codec).writeResponse(new Response("Arith.divide", 4, "divide by zero"),
        CodecResponseSink.INVALID_REQUEST);
  }

  @Test
  public void testWriteHappensUnderLock() throws IOException {
    AtomicBoolean held = new AtomicBoolean();
    doAnswer(invocation -> {
      held.set(lock.isHeldByCurrentThread());
      return null;
    }).when(codec).writeResponse(any(), any());

    sink.sendResponse(lock, new Request("Arith.add", 1), 1, codec, "");

    assertTrue(held.get());
    assertFalse(lock.isLocked());
  }

  @Test
  public void testWriteFailureIsCountedNotThrown() throws IOException {
    doThrow(new IOException("connection reset")).when(codec).writeResponse(any(), eq(7));

    sink.sendResponse(lock, new Request("Arith.add", 1), 7, codec, "");

    assertEquals(1, sink.getWriteFailures());
    assertFalse(lock.isLocked());
  }

  @Test
  public void testReleaseRequest() {
    sink.releaseRequest(new Request("Arith.add", 1));
    assertEquals(0, sink.getWriteFailures());
  }

  @Test
  public void testResponseIsError() {
    assertFalse(new Response("Arith.add", 1, "").isError());
    assertTrue(new Response("Arith.add", 1, "boom").isError());
  }

  @Test
  public void testMessagesRejectNullAddress() {
    assertThrows(NullPointerException.class, () -> new Request(null, 1));
    assertThrows(NullPointerException.class, () -> new Response(null, 1, ""));
    assertThrows(NullPointerException.class, () -> new Response("Arith.add", 1, null));
  }

  @Test
  public void testPlaceholderIsEmpty() {
    assertTrue(CodecResponseSink.INVALID_REQUEST.isEmpty());
    assertSame(CodecResponseSink.INVALID_REQUEST, CodecResponseSink.INVALID_REQUEST);
  }
}
