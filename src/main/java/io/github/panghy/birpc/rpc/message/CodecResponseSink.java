package io.github.panghy.birpc.rpc.message;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.debug;
import static io.github.panghy.birpc.util.LoggingUtil.warn;

/**
 * {@link ResponseSink} that writes responses straight through a {@link ServerCodec}.
 *
 * <p>A failed call is answered with {@link #INVALID_REQUEST} as its body instead of
 * the reply, so a half-written reply never reaches the caller. Write failures are
 * logged and counted; the connection itself is the transport's concern.</p>
 */
public class CodecResponseSink implements ResponseSink {

  private static final Logger LOGGER = Logger.getLogger(CodecResponseSink.class.getName());

  /**
   * Body sent in place of the reply when a call failed. Encodes as an empty object.
   */
  public static final Map<String, Object> INVALID_REQUEST = Collections.emptyMap();

  private final AtomicLong writeFailures = new AtomicLong();

  @Override
  public void sendResponse(Lock sendLock, Request request, Object reply, ServerCodec codec, String errorMessage) {
    Response response = new Response(request.serviceMethod(), request.seq(), errorMessage);
    Object body = response.isError() ? INVALID_REQUEST : reply;
    sendLock.lock();
    try {
      codec.writeResponse(response, body);
    } catch (IOException e) {
      writeFailures.incrementAndGet();
      warn(LOGGER, "rpc: writing response for seq=" + request.seq() + " failed", e);
    } finally {
      sendLock.unlock();
    }
  }

  @Override
  public void releaseRequest(Request request) {
    debug(LOGGER, () -> "Released request seq=" + request.seq());
  }

  /**
   * @return The number of responses that could not be written
   */
  public long getWriteFailures() {
    return writeFailures.get();
  }
}
