package io.github.panghy.birpc.rpc.cancel;

import io.github.panghy.birpc.core.PendingRequestTable;

/**
 * Implemented by arguments that need the live pending request table.
 *
 * <p>The dispatcher hands the table only to arguments of calls addressed to the
 * reserved {@link CancelService}; implementing this interface on any other argument
 * type has no effect.</p>
 */
public interface PendingTableAware {

  /**
   * Receives the pending request table of the connection the call arrived on.
   *
   * @param pending The pending request table
   */
  void setPendingTable(PendingRequestTable pending);
}
