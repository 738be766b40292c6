package io.github.panghy.birpc.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.warn;

/**
 * The cancellable lifetime of a single in-flight call.
 *
 * <p>A token is handed to every service method as its first parameter. For calls
 * arriving from a transport the token is created by
 * {@link PendingRequestTable#start(long)} when dispatch begins and cancelled when
 * dispatch ends, so a method that outlives its call always observes cancellation.
 * A peer can cancel the token earlier through the cancel service.</p>
 *
 * <p>Cancellation is cooperative. Nothing interrupts the method: it has to poll
 * {@link #isCancelled()}, call {@link #throwIfCancelled()} at convenient points,
 * block in {@link #await(long, TimeUnit)} or register a handler with
 * {@link #onCancel(Runnable)}.</p>
 *
 * <p>Cancellation happens at most once. Calling {@link #cancel()} again is a no-op
 * and registered handlers run exactly once.</p>
 */
public final class CancellationToken {

  private static final Logger LOGGER = Logger.getLogger(CancellationToken.class.getName());

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final CountDownLatch cancelledLatch = new CountDownLatch(1);
  private final List<Runnable> handlers = new CopyOnWriteArrayList<>();

  /**
   * Creates a new, not yet cancelled token.
   */
  public CancellationToken() {
  }

  /**
   * Cancels this token. The first call flips the state and runs every registered
   * handler on the calling thread; later calls do nothing.
   *
   * @return true if this call cancelled the token, false if it was already cancelled
   */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    cancelledLatch.countDown();
    for (Runnable handler : handlers) {
      // Whoever removes a handler runs it, see onCancel
      if (handlers.remove(handler)) {
        runHandler(handler);
      }
    }
    return true;
  }

  /**
   * @return true once the token has been cancelled
   */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Throws if the token has been cancelled.
   *
   * @throws CallCancelledException if the token has been cancelled
   */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new CallCancelledException("Call was cancelled");
    }
  }

  /**
   * Registers a handler to run when the token is cancelled. If the token is
   * already cancelled the handler runs immediately on the calling thread.
   *
   * @param handler The handler to run on cancellation
   */
  public void onCancel(Runnable handler) {
    if (handler == null) {
      throw new IllegalArgumentException("Cancel handler cannot be null");
    }
    handlers.add(handler);
    // cancel() may have taken its snapshot before the add
    if (cancelled.get() && handlers.remove(handler)) {
      runHandler(handler);
    }
  }

  /**
   * Blocks until the token is cancelled or the timeout elapses.
   *
   * @param timeout The maximum time to wait
   * @param unit    The unit of the timeout
   * @return true if the token was cancelled, false if the timeout elapsed first
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    return cancelledLatch.await(timeout, unit);
  }

  private static void runHandler(Runnable handler) {
    try {
      handler.run();
    } catch (RuntimeException e) {
      warn(LOGGER, "Cancel handler failed", e);
    }
  }

  @Override
  public String toString() {
    return "CancellationToken{cancelled=" + cancelled.get() + '}';
  }
}
