package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;

/**
 * The reverse channel to the peer that issued the current call.
 *
 * <p>Every service method receives the connector of its caller as its second
 * parameter and may use it to call services exposed by that peer while it is still
 * handling the request. The dispatcher never looks at the connector; it only passes
 * it through.</p>
 */
public interface ClientConnector {

  /**
   * Calls a method exposed by the peer and waits for its reply.
   *
   * @param token         Token observed by the remote call
   * @param serviceMethod The {@code service.method} address on the peer
   * @param args          The argument of the call
   * @param reply         The reply holder the result is written into
   * @throws Exception if the call fails on either side
   */
  void call(CancellationToken token, String serviceMethod, Object args, Object reply) throws Exception;
}
