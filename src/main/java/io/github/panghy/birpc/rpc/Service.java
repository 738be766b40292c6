package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;
import io.github.panghy.birpc.rpc.cancel.CancelService;
import io.github.panghy.birpc.rpc.error.RpcAddressException;
import io.github.panghy.birpc.rpc.error.RpcException;
import io.github.panghy.birpc.rpc.error.RpcRegistrationException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.debug;

/**
 * A receiver registered under a name, together with its callable methods.
 *
 * <p>Services are created once, usually at startup, with
 * {@link #register(Object, String, boolean)} and are immutable afterwards. Methods
 * are addressed as {@code "ServiceName.methodName"}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * public class Math {
 *   public void add(CancellationToken token, ClientConnector client,
 *                   AddArgs args, Ref<Integer> reply) {
 *     reply.set(args.getA() + args.getB());
 *   }
 * }
 *
 * Service service = Service.register(new Math(), "", false);
 * Ref<Integer> reply = new Ref<>();
 * service.call(new CancellationToken(), client, "Math.add", new AddArgs(2, 3), reply);
 * // reply.get() == 5
 * }</pre>
 */
public final class Service {

  private static final Logger LOGGER = Logger.getLogger(Service.class.getName());

  private final String name;
  private final Object receiver;
  private final Map<String, MethodDescriptor> methods;

  private Service(String name, Object receiver, Map<String, MethodDescriptor> methods) {
    this.name = name;
    this.receiver = receiver;
    this.methods = methods;
  }

  /**
   * Registers a receiver using the default configuration.
   *
   * @see #register(Object, String, boolean, RpcConfiguration)
   */
  public static Service register(Object receiver, String name, boolean useName) {
    return register(receiver, name, useName, RpcConfiguration.defaultConfig());
  }

  /**
   * Registers a receiver as a service.
   *
   * <p>The service is named after the receiver's simple class name unless
   * {@code useName} is set, in which case {@code name} is used verbatim. Only a
   * public class may be registered under its own name.</p>
   *
   * @param receiver The object whose methods are exposed
   * @param name     The explicit service name, used only if {@code useName} is true
   * @param useName  Whether to use {@code name} instead of the class name
   * @param config   The configuration controlling diagnostics
   * @return The registered service
   * @throws RpcRegistrationException if the name is empty, the type is not public and no
   *                                  explicit name was given, or no method is callable
   */
  public static Service register(Object receiver, String name, boolean useName, RpcConfiguration config) {
    Objects.requireNonNull(receiver, "Receiver cannot be null");
    Class<?> type = receiver.getClass();
    String serviceName = useName ? name : type.getSimpleName();
    if (serviceName == null || serviceName.isEmpty()) {
      throw new RpcRegistrationException(RpcRegistrationException.Reason.NO_SERVICE_NAME, "",
          "rpc.Register: no service name for type " + type.getName());
    }
    if (!useName && !CallingConvention.isExported(type)) {
      throw new RpcRegistrationException(RpcRegistrationException.Reason.TYPE_NOT_EXPORTED, serviceName,
          "rpc.Register: type " + serviceName + " is not exported");
    }

    Map<String, MethodDescriptor> methods =
        MethodCatalog.suitableMethods(type, config.isReportMethodExclusions());
    if (methods.isEmpty()) {
      // A Class passed in place of an instance of it would expose nothing
      if (receiver instanceof Class<?> represented
          && !MethodCatalog.suitableMethods(represented, false).isEmpty()) {
        throw new RpcRegistrationException(RpcRegistrationException.Reason.NO_SUITABLE_METHODS, serviceName,
            "rpc.Register: type " + serviceName + " has no public methods of suitable type"
                + " (hint: pass an instance of " + represented.getSimpleName() + ", not its Class)",
            true);
      }
      throw new RpcRegistrationException(RpcRegistrationException.Reason.NO_SUITABLE_METHODS, serviceName,
          "rpc.Register: type " + serviceName + " has no public methods of suitable type");
    }
    debug(LOGGER, () -> "Registered service " + serviceName + " with methods " + methods.keySet());
    return new Service(serviceName, receiver, methods);
  }

  /**
   * Resolves a {@code service.method} address against this service.
   *
   * @param address The address, split at its last dot
   * @return The method the address names
   * @throws RpcAddressException if the address is ill-formed, names another service or
   *                             names a method this service does not have
   */
  public MethodDescriptor resolve(String address) {
    int dot = address.lastIndexOf('.');
    if (dot < 0) {
      throw RpcAddressException.illFormed(address);
    }
    if (!name.equals(address.substring(0, dot))) {
      throw RpcAddressException.unknownService(address);
    }
    MethodDescriptor method = methods.get(address.substring(dot + 1));
    if (method == null) {
      throw RpcAddressException.unknownMethod(address);
    }
    return method;
  }

  /**
   * Calls a method synchronously on the calling thread.
   *
   * <p>The caller owns every argument, including the token: nothing is registered
   * in a pending request table. Whatever the method throws is rethrown unchanged.</p>
   *
   * @param token    The cancellation token the method observes
   * @param client   The connector back to the calling peer
   * @param address  The {@code service.method} address
   * @param argument The argument, a {@link Ref} if the method declares one
   * @param reply    The reply holder
   * @throws RpcAddressException if the address does not resolve
   * @throws Exception           whatever the method throws
   */
  public void call(CancellationToken token, ClientConnector client, String address,
                   Object argument, Object reply) throws Exception {
    MethodDescriptor method = resolve(address);
    try {
      method.invoke(receiver, token, client, argument, reply);
    } catch (Exception | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new RpcException(RpcException.ErrorCode.INVOCATION_ERROR,
          "rpc: " + address + " failed: " + t, t);
    }
  }

  public String getName() {
    return name;
  }

  public Object getReceiver() {
    return receiver;
  }

  /**
   * @return The callable methods keyed by name, unmodifiable
   */
  public Map<String, MethodDescriptor> getMethods() {
    return methods;
  }

  public Optional<MethodDescriptor> getMethod(String methodName) {
    return Optional.ofNullable(methods.get(methodName));
  }

  /**
   * @return true if this is the reserved cancel service, whose calls get access to
   * the pending request table
   */
  public boolean isCancelService() {
    return CancelService.NAME.equals(name);
  }

  @Override
  public String toString() {
    return "Service{name='" + name + "', methods=" + methods.keySet() + '}';
  }
}
