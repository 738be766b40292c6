package io.github.panghy.birpc.rpc.error;

/**
 * Base exception for errors raised by the birpc core.
 *
 * <p>RpcException is the root of a small hierarchy: registration failures
 * ({@link RpcRegistrationException}), unresolvable call addresses
 * ({@link RpcAddressException}) and cancelled calls. It carries an error code so
 * callers can react to a class of failure without matching on messages.</p>
 *
 * <p>Errors raised by service methods themselves are never wrapped in an
 * RpcException: direct calls rethrow them unchanged and transport-driven calls turn
 * them into the error string of the response.</p>
 */
public class RpcException extends RuntimeException {

  /**
   * Enumeration of error codes for RPC exceptions.
   */
  public enum ErrorCode {
    /**
     * Unknown or unspecified error.
     */
    UNKNOWN(1000),

    /**
     * A receiver could not be registered as a service.
     */
    REGISTRATION_ERROR(1001),

    /**
     * A service.method address is malformed or does not resolve.
     */
    ADDRESS_ERROR(1002),

    /**
     * A service method failed.
     */
    INVOCATION_ERROR(1003),

    /**
     * The call was cancelled.
     */
    CANCELLED(1004),

    /**
     * The dispatcher itself failed while running a call.
     */
    INTERNAL_ERROR(1005);

    private final int code;

    ErrorCode(int code) {
      this.code = code;
    }

    /**
     * Gets the numeric code for this error.
     *
     * @return The error code
     */
    public int getCode() {
      return code;
    }

    /**
     * Gets an ErrorCode from its numeric value.
     *
     * @param code The numeric error code
     * @return The corresponding ErrorCode, or UNKNOWN if not found
     */
    public static ErrorCode fromCode(int code) {
      for (ErrorCode errorCode : values()) {
        if (errorCode.code == code) {
          return errorCode;
        }
      }
      return UNKNOWN;
    }
  }

  private final ErrorCode errorCode;

  /**
   * Creates a new RPC exception with the specified error code.
   *
   * @param errorCode The error code
   */
  public RpcException(ErrorCode errorCode) {
    super("RPC error: " + errorCode);
    this.errorCode = errorCode;
  }

  /**
   * Creates a new RPC exception with the specified error code and message.
   *
   * @param errorCode The error code
   * @param message   The error message
   */
  public RpcException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  /**
   * Creates a new RPC exception with the specified error code, message, and cause.
   *
   * @param errorCode The error code
   * @param message   The error message
   * @param cause     The underlying cause
   */
  public RpcException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /**
   * Gets the error code for this exception.
   *
   * @return The error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the numeric value of the error code.
   *
   * @return The numeric error code
   */
  public int getErrorCodeValue() {
    return errorCode.getCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" +
        "errorCode=" + errorCode +
        ", message='" + getMessage() + '\'' +
        '}';
  }
}
