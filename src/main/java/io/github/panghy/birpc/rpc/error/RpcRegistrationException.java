package io.github.panghy.birpc.rpc.error;

/**
 * Exception thrown when a receiver cannot be registered as a service.
 * Registration failures are terminal for that attempt; the caller decides whether
 * to abort startup or skip the service.
 */
public class RpcRegistrationException extends RpcException {

  /**
   * Why a registration was refused.
   */
  public enum Reason {
    /**
     * The resolved service name is empty.
     */
    NO_SERVICE_NAME,

    /**
     * The receiver's type is not public and no explicit name was given.
     */
    TYPE_NOT_EXPORTED,

    /**
     * No method of the receiver matches the calling convention.
     */
    NO_SUITABLE_METHODS,

    /**
     * A service with the same name is already registered.
     */
    DUPLICATE_SERVICE
  }

  private final Reason reason;
  private final String serviceName;
  private final boolean hint;

  /**
   * Creates a new registration exception.
   *
   * @param reason      Why the registration was refused
   * @param serviceName The resolved service name, may be empty
   * @param message     The error message
   */
  public RpcRegistrationException(Reason reason, String serviceName, String message) {
    this(reason, serviceName, message, false);
  }

  /**
   * Creates a new registration exception.
   *
   * @param reason      Why the registration was refused
   * @param serviceName The resolved service name, may be empty
   * @param message     The error message
   * @param hint        Whether the message carries a hint about how the receiver was passed
   */
  public RpcRegistrationException(Reason reason, String serviceName, String message, boolean hint) {
    super(ErrorCode.REGISTRATION_ERROR, message);
    this.reason = reason;
    this.serviceName = serviceName;
    this.hint = hint;
  }

  public Reason getReason() {
    return reason;
  }

  public String getServiceName() {
    return serviceName;
  }

  /**
   * @return true if the methods would have matched had the receiver been passed as
   * an instance rather than as its {@link Class}
   */
  public boolean hasHint() {
    return hint;
  }
}
