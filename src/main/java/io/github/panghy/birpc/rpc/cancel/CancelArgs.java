package io.github.panghy.birpc.rpc.cancel;

import io.github.panghy.birpc.core.PendingRequestTable;

/**
 * Argument of {@link CancelService#cancel}: the sequence number of the call to cancel.
 * Only {@code seq} travels on the wire; the pending table is injected by the
 * dispatcher.
 */
public class CancelArgs implements PendingTableAware {

  private long seq;
  private transient PendingRequestTable pending;

  public CancelArgs() {
  }

  public CancelArgs(long seq) {
    this.seq = seq;
  }

  public long getSeq() {
    return seq;
  }

  public void setSeq(long seq) {
    this.seq = seq;
  }

  @Override
  public void setPendingTable(PendingRequestTable pending) {
    this.pending = pending;
  }

  PendingRequestTable getPendingTable() {
    return pending;
  }

  @Override
  public String toString() {
    return "CancelArgs{seq=" + seq + '}';
  }
}
