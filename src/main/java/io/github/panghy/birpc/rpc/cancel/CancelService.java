package io.github.panghy.birpc.rpc.cancel;

import io.github.panghy.birpc.core.CancellationToken;
import io.github.panghy.birpc.core.PendingRequestTable;
import io.github.panghy.birpc.rpc.ClientConnector;
import io.github.panghy.birpc.rpc.Ref;

import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.debug;

/**
 * The reserved control service that lets a peer cancel one of its own in-flight
 * calls.
 *
 * <p>A cancellation request is an ordinary call to {@link #CANCEL} carrying the
 * sequence number of the call to cancel. Because the service is registered under
 * the reserved {@link #NAME}, the dispatcher injects the connection's pending
 * request table into the {@link CancelArgs} before the call runs, and the method
 * cancels the token registered for that sequence number. The cancelled call notices
 * the next time it checks its token.</p>
 *
 * <pre>{@code
 * // on the calling peer, while call 42 is still running
 * connector.call(token, CancelService.CANCEL, new CancelArgs(42), new Ref<String>());
 * }</pre>
 */
public final class CancelService {

  private static final Logger LOGGER = Logger.getLogger(CancelService.class.getName());

  /**
   * Reserved service name.
   */
  public static final String NAME = "_birpc_";

  /**
   * Address of the cancel method.
   */
  public static final String CANCEL = NAME + ".cancel";

  /**
   * Reply of a successful cancel request.
   */
  public static final String OK = "OK";

  /**
   * Cancels the call with the sequence number in {@code args}. Unknown or finished
   * sequence numbers are ignored.
   *
   * @throws IllegalStateException if no pending table was injected, i.e. the method was
   *                               not reached through a dispatcher
   */
  public void cancel(CancellationToken token, ClientConnector client, CancelArgs args, Ref<String> reply) {
    PendingRequestTable pending = args.getPendingTable();
    if (pending == null) {
      throw new IllegalStateException("rpc: " + CANCEL + " needs the pending request table of a dispatcher");
    }
    debug(LOGGER, () -> "Cancel requested for seq=" + args.getSeq());
    pending.cancel(args.getSeq());
    reply.set(OK);
  }
}
