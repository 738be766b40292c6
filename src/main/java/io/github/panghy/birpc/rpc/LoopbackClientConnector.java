package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;

/**
 * A {@link ClientConnector} to a peer living in the same process.
 *
 * <p>Connectors come in pairs created by {@link #connect(ServiceRegistry, ServiceRegistry)}.
 * A call goes straight to the peer's {@link ServiceRegistry} on the calling thread,
 * without encoding, and carries the opposite connector as its client, so the peer can
 * call back into the local services while it handles the call.</p>
 *
 * <pre>{@code
 * ClientConnector toServer = LoopbackClientConnector.connect(clientServices, serverServices);
 * toServer.call(new CancellationToken(), "Math.add", new AddArgs(2, 3), reply);
 * }</pre>
 */
public class LoopbackClientConnector implements ClientConnector {

  private final ServiceRegistry peer;
  // The connector the peer uses to call back; set once by connect()
  private LoopbackClientConnector reverse;

  private LoopbackClientConnector(ServiceRegistry peer) {
    this.peer = peer;
  }

  /**
   * Connects two in-process peers.
   *
   * @param local The services of the calling side
   * @param peer  The services of the called side
   * @return The connector the local side uses to call the peer
   */
  public static LoopbackClientConnector connect(ServiceRegistry local, ServiceRegistry peer) {
    LoopbackClientConnector toPeer = new LoopbackClientConnector(peer);
    LoopbackClientConnector toLocal = new LoopbackClientConnector(local);
    toPeer.reverse = toLocal;
    toLocal.reverse = toPeer;
    return toPeer;
  }

  @Override
  public void call(CancellationToken token, String serviceMethod, Object args, Object reply) throws Exception {
    peer.call(token, reverse, serviceMethod, args, reply);
  }

  /**
   * @return The connector the peer uses to call back into the local side
   */
  public LoopbackClientConnector reverse() {
    return reverse;
  }
}
