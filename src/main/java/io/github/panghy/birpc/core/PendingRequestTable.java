package io.github.panghy.birpc.core;

/**
 * Maps the sequence numbers of in-flight requests to their cancellation tokens.
 *
 * <p>The dispatcher calls {@link #start(long)} before it invokes a method and
 * {@link #cancel(long)} after the method returns, from whatever thread the call
 * runs on, without any locking of its own. Implementations must therefore be safe
 * for concurrent use.</p>
 *
 * @see PendingRequests
 */
public interface PendingRequestTable {

  /**
   * Registers a sequence number and returns the token for its call.
   * Starting a sequence number that is still pending returns the live token.
   *
   * @param seq The sequence number of the request
   * @return The cancellation token for the request
   */
  CancellationToken start(long seq);

  /**
   * Cancels the token registered for a sequence number and forgets it.
   * Unknown or already cancelled sequence numbers are ignored.
   *
   * @param seq The sequence number of the request
   */
  void cancel(long seq);
}
