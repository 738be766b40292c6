package io.github.panghy.birpc.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.debug;
import static io.github.panghy.birpc.util.LoggingUtil.warn;

/**
 * In-memory {@link PendingRequestTable} backed by a {@link ConcurrentHashMap}.
 * One instance is meant to be shared by every call arriving on the same connection.
 */
public class PendingRequests implements PendingRequestTable {

  private static final Logger LOGGER = Logger.getLogger(PendingRequests.class.getName());

  // Maps sequence numbers to the tokens of calls that are still running
  private final Map<Long, CancellationToken> pending = new ConcurrentHashMap<>();

  @Override
  public CancellationToken start(long seq) {
    CancellationToken token = new CancellationToken();
    CancellationToken existing = pending.putIfAbsent(seq, token);
    if (existing != null) {
      warn(LOGGER, "Sequence number " + seq + " is already pending, reusing its token");
      return existing;
    }
    debug(LOGGER, () -> "Started request seq=" + seq);
    return token;
  }

  @Override
  public void cancel(long seq) {
    CancellationToken token = pending.remove(seq);
    if (token != null) {
      debug(LOGGER, () -> "Cancelling request seq=" + seq);
      token.cancel();
    }
  }

  /**
   * @param seq The sequence number of the request
   * @return true if the sequence number has been started and not yet cancelled
   */
  public boolean isPending(long seq) {
    return pending.containsKey(seq);
  }

  /**
   * @return The number of requests currently pending
   */
  public int size() {
    return pending.size();
  }

  /**
   * Cancels every pending request, typically because the connection closed.
   *
   * @return The number of requests that were cancelled
   */
  public int cancelAll() {
    List<Long> seqs = new ArrayList<>(pending.keySet());
    int count = 0;
    for (Long seq : seqs) {
      CancellationToken token = pending.remove(seq);
      if (token != null && token.cancel()) {
        count++;
      }
    }
    return count;
  }
}
