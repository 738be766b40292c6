package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.warn;

/**
 * Picks the methods of a receiver type that match the {@link CallingConvention}.
 *
 * <p>Methods that do not match are left out of the catalog without failing the
 * registration. When reporting is enabled every exclusion is logged at WARNING with
 * the reason, which is usually the fastest way to find out why a method cannot be
 * called.</p>
 */
public final class MethodCatalog {

  private static final Logger LOGGER = Logger.getLogger(MethodCatalog.class.getName());

  // Every invoker is adapted to this type so call sites can use invokeExact
  static final MethodType INVOKER_TYPE = MethodType.methodType(void.class,
      Object.class, CancellationToken.class, ClientConnector.class, Object.class, Object.class);

  // Overloads are resolved deterministically: by name, then by signature
  private static final Comparator<Method> METHOD_ORDER =
      Comparator.comparing(Method::getName).thenComparing(Method::toGenericString);

  private MethodCatalog() {
  }

  /**
   * Returns the callable methods of a type keyed by method name.
   *
   * @param type      The receiver type to inspect
   * @param reportErr Whether to log every excluded method
   * @return An unmodifiable map from method name to descriptor, possibly empty
   */
  public static Map<String, MethodDescriptor> suitableMethods(Class<?> type, boolean reportErr) {
    Method[] candidates = type.getMethods();
    Arrays.sort(candidates, METHOD_ORDER);

    Map<String, MethodDescriptor> methods = new LinkedHashMap<>();
    for (Method method : candidates) {
      if (!isOwnMethod(method)) {
        continue;
      }
      String name = method.getName();
      Optional<String> reason = exclusionReason(method);
      if (reason.isEmpty() && methods.containsKey(name)) {
        reason = Optional.of("method \"" + name + "\" overloads a method that is already registered");
      }
      if (reason.isPresent()) {
        if (reportErr) {
          warn(LOGGER, "rpc.Register: " + reason.get());
        }
        continue;
      }
      Optional<MethodDescriptor> descriptor = describe(method, reportErr);
      descriptor.ifPresent(d -> methods.put(name, d));
    }
    return Collections.unmodifiableMap(methods);
  }

  /**
   * Checks a single method against the calling convention.
   *
   * @param method The method to check
   * @return The reason the method is excluded, or empty if it is callable
   */
  static Optional<String> exclusionReason(Method method) {
    String name = method.getName();
    if (Modifier.isStatic(method.getModifiers())) {
      return Optional.of("method \"" + name + "\" is static");
    }
    if (method.getParameterCount() != CallingConvention.PARAMETER_COUNT) {
      // The receiver counts as the first input parameter
      return Optional.of("method \"" + name + "\" has " + (method.getParameterCount() + 1)
          + " input parameters; needs exactly five");
    }
    Class<?>[] params = method.getParameterTypes();
    Type[] genericParams = method.getGenericParameterTypes();
    if (params[0] != CallingConvention.CANCELLATION_TOKEN) {
      return Optional.of("first argument of method \"" + name + "\" is " + params[0].getName()
          + ", must be " + CallingConvention.CANCELLATION_TOKEN.getName());
    }
    if (params[1] != CallingConvention.CLIENT_CONNECTOR) {
      return Optional.of("second argument of method \"" + name + "\" is " + params[1].getName()
          + ", must be " + CallingConvention.CLIENT_CONNECTOR.getName());
    }
    if (!CallingConvention.isExportedOrBuiltin(genericParams[2])) {
      return Optional.of("argument type of method \"" + name + "\" is not exported: "
          + genericParams[2].getTypeName());
    }
    if (!CallingConvention.isReference(genericParams[3])) {
      return Optional.of("reply type of method \"" + name + "\" is not a Ref: "
          + genericParams[3].getTypeName());
    }
    if (!CallingConvention.isExportedOrBuiltin(genericParams[3])) {
      return Optional.of("reply type of method \"" + name + "\" is not exported: "
          + genericParams[3].getTypeName());
    }
    Type replyType = CallingConvention.referencedType(genericParams[3]);
    if (!ValueFactory.canCreateEmpty(replyType)) {
      return Optional.of("reply type of method \"" + name + "\" is a container that cannot be created empty: "
          + replyType.getTypeName());
    }
    if (method.getReturnType() != CallingConvention.RETURN_TYPE) {
      return Optional.of("return type of method \"" + name + "\" is "
          + method.getGenericReturnType().getTypeName() + ", must be void");
    }
    return Optional.empty();
  }

  /**
   * Methods inherited from Object, bridges and compiler-generated methods are not
   * part of a receiver's own method set and are skipped without a diagnostic.
   */
  private static boolean isOwnMethod(Method method) {
    return method.getDeclaringClass() != Object.class
        && !method.isBridge()
        && !method.isSynthetic();
  }

  private static Optional<MethodDescriptor> describe(Method method, boolean reportErr) {
    MethodHandle invoker;
    try {
      // Public methods of non-public classes need the access check suppressed
      method.trySetAccessible();
      invoker = MethodHandles.lookup().unreflect(method).asType(INVOKER_TYPE);
    } catch (IllegalAccessException e) {
      if (reportErr) {
        warn(LOGGER, "rpc.Register: method \"" + method.getName() + "\" is not accessible", e);
      }
      return Optional.empty();
    }

    Type[] genericParams = method.getGenericParameterTypes();
    Type argument = genericParams[2];
    boolean argumentReference = CallingConvention.isReference(argument);
    Type argumentType = argumentReference ? CallingConvention.referencedType(argument) : argument;
    Type replyType = CallingConvention.referencedType(genericParams[3]);
    return Optional.of(new MethodDescriptor(method.getName(), method, invoker,
        argumentType, argumentReference, replyType));
  }
}
