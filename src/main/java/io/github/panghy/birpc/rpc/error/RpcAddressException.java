package io.github.panghy.birpc.rpc.error;

/**
 * Exception thrown when a {@code service.method} address cannot be resolved.
 */
public class RpcAddressException extends RpcException {

  /**
   * Why an address did not resolve.
   */
  public enum Reason {
    /**
     * The address has no dot separating service and method.
     */
    ILL_FORMED,

    /**
     * No service is registered under the address prefix.
     */
    UNKNOWN_SERVICE,

    /**
     * The service has no method with the address suffix.
     */
    UNKNOWN_METHOD
  }

  private final Reason reason;
  private final String address;

  /**
   * Creates a new address exception.
   *
   * @param reason  Why the address did not resolve
   * @param address The address as received
   * @param message The error message
   */
  public RpcAddressException(Reason reason, String address, String message) {
    super(ErrorCode.ADDRESS_ERROR, message);
    this.reason = reason;
    this.address = address;
  }

  public Reason getReason() {
    return reason;
  }

  public String getAddress() {
    return address;
  }

  public static RpcAddressException illFormed(String address) {
    return new RpcAddressException(Reason.ILL_FORMED, address,
        "rpc: service/method request ill-formed: " + address);
  }

  public static RpcAddressException unknownService(String address) {
    return new RpcAddressException(Reason.UNKNOWN_SERVICE, address,
        "rpc: can't find service " + address);
  }

  public static RpcAddressException unknownMethod(String address) {
    return new RpcAddressException(Reason.UNKNOWN_METHOD, address,
        "rpc: can't find method " + address);
  }
}
