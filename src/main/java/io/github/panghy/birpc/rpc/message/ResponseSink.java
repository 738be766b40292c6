package io.github.panghy.birpc.rpc.message;

import java.util.concurrent.locks.Lock;

/**
 * Where the dispatcher delivers the outcome of a transport-driven call.
 *
 * <p>Both methods are called exactly once per dispatched request, after the method
 * has returned or failed, and in this order.</p>
 */
public interface ResponseSink {

  /**
   * Writes the response to a request.
   *
   * @param sendLock     The lock serializing writes to the transport; must be held while writing
   * @param request      The request being answered
   * @param reply        The reply value, forwarded even when the call failed
   * @param codec        The codec of the connection
   * @param errorMessage The error message, empty if the call succeeded
   */
  void sendResponse(Lock sendLock, Request request, Object reply, ServerCodec codec, String errorMessage);

  /**
   * Releases whatever the transport keeps per request.
   *
   * @param request The request that has been answered
   */
  void releaseRequest(Request request);
}
