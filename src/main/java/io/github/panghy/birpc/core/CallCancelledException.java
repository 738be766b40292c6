package io.github.panghy.birpc.core;

import io.github.panghy.birpc.rpc.error.RpcException;

/**
 * Thrown by {@link CancellationToken#throwIfCancelled()} once the call the token
 * belongs to has been cancelled. Service methods normally let it propagate so the
 * call ends early; the caller then sees its message as the call's error.
 *
 * <p>Carries {@link RpcException.ErrorCode#CANCELLED}.</p>
 */
public class CallCancelledException extends RpcException {

  /**
   * Creates a new cancellation exception with the specified message.
   *
   * @param message The detail message explaining the cancellation
   */
  public CallCancelledException(String message) {
    super(ErrorCode.CANCELLED, message);
  }

  /**
   * Creates a new cancellation exception with the specified message and cause.
   *
   * @param message The detail message explaining the cancellation
   * @param cause   The underlying cause of the cancellation
   */
  public CallCancelledException(String message, Throwable cause) {
    super(ErrorCode.CANCELLED, message, cause);
  }
}
