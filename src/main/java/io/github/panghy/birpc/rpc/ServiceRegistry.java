package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;
import io.github.panghy.birpc.rpc.cancel.CancelService;
import io.github.panghy.birpc.rpc.error.RpcAddressException;
import io.github.panghy.birpc.rpc.error.RpcRegistrationException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.info;

/**
 * The services one peer exposes, keyed by name.
 *
 * <p>Every registry starts out with the reserved {@link CancelService}, which also
 * keeps its name from being taken by an application service.</p>
 */
public class ServiceRegistry {

  private static final Logger LOGGER = Logger.getLogger(ServiceRegistry.class.getName());

  /**
   * A resolved address.
   *
   * @param service The service the address names
   * @param method  The method the address names
   */
  public record Target(Service service, MethodDescriptor method) {
  }

  private final RpcConfiguration config;
  private final Map<String, Service> services = new ConcurrentHashMap<>();

  /**
   * Creates a registry with the default configuration.
   */
  public ServiceRegistry() {
    this(RpcConfiguration.defaultConfig());
  }

  /**
   * Creates a registry.
   *
   * @param config The configuration used for every registration
   */
  public ServiceRegistry(RpcConfiguration config) {
    this.config = config;
    add(Service.register(new CancelService(), CancelService.NAME, true, config));
  }

  /**
   * Registers a receiver under its simple class name.
   *
   * @param receiver The receiver
   * @return The registered service
   * @throws RpcRegistrationException if the receiver cannot be registered or the name is taken
   */
  public Service register(Object receiver) {
    return add(Service.register(receiver, "", false, config));
  }

  /**
   * Registers a receiver under an explicit name.
   *
   * @param name     The service name
   * @param receiver The receiver
   * @return The registered service
   * @throws RpcRegistrationException if the receiver cannot be registered or the name is taken
   */
  public Service registerName(String name, Object receiver) {
    return add(Service.register(receiver, name, true, config));
  }

  private Service add(Service service) {
    Service existing = services.putIfAbsent(service.getName(), service);
    if (existing != null) {
      throw new RpcRegistrationException(RpcRegistrationException.Reason.DUPLICATE_SERVICE, service.getName(),
          "rpc: service already defined: " + service.getName());
    }
    info(LOGGER, "Registered service " + service.getName());
    return service;
  }

  public Optional<Service> getService(String name) {
    return Optional.ofNullable(services.get(name));
  }

  /**
   * @return Every registered service, including the cancel service
   */
  public Collection<Service> getServices() {
    return Collections.unmodifiableCollection(services.values());
  }

  /**
   * Resolves a {@code service.method} address.
   *
   * @param address The address
   * @return The service and method it names
   * @throws RpcAddressException if the address is ill-formed or does not resolve
   */
  public Target resolve(String address) {
    int dot = address.lastIndexOf('.');
    if (dot < 0) {
      throw RpcAddressException.illFormed(address);
    }
    Service service = services.get(address.substring(0, dot));
    if (service == null) {
      throw RpcAddressException.unknownService(address);
    }
    return new Target(service, service.resolve(address));
  }

  /**
   * Calls a method of a registered service synchronously.
   *
   * @see Service#call(CancellationToken, ClientConnector, String, Object, Object)
   */
  public void call(CancellationToken token, ClientConnector client, String address,
                   Object argument, Object reply) throws Exception {
    resolve(address).service().call(token, client, address, argument, reply);
  }
}
