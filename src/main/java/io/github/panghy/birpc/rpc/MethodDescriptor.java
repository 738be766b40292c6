package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Method;
import java.lang.reflect.Type;

/**
 * A validated, callable service method.
 *
 * <p>Descriptors are built once by {@link MethodCatalog} when a service is
 * registered and never change afterwards. The invocation handle is typed to the
 * calling convention at that point, so a call is a lookup followed by a direct
 * handle invocation rather than a reflective call.</p>
 */
public final class MethodDescriptor {

  private final String name;
  private final Method method;
  // (Object receiver, CancellationToken, ClientConnector, Object argument, Object reply)void
  private final MethodHandle invoker;
  private final Type argumentType;
  private final boolean argumentReference;
  private final Type replyType;

  MethodDescriptor(String name, Method method, MethodHandle invoker,
                   Type argumentType, boolean argumentReference, Type replyType) {
    this.name = name;
    this.method = method;
    this.invoker = invoker;
    this.argumentType = argumentType;
    this.argumentReference = argumentReference;
    this.replyType = replyType;
  }

  /**
   * Invokes the method on a receiver.
   *
   * @param receiver The service receiver
   * @param token    The cancellation token of the call
   * @param client   The connector back to the calling peer
   * @param argument The argument, a {@link Ref} if the argument is pointer-shaped
   * @param reply    The reply {@link Ref}
   * @throws Throwable whatever the method throws, unwrapped
   */
  public void invoke(Object receiver, CancellationToken token, ClientConnector client,
                     Object argument, Object reply) throws Throwable {
    invoker.invokeExact(receiver, token, client, argument, reply);
  }

  public String getName() {
    return name;
  }

  public Method getMethod() {
    return method;
  }

  /**
   * Gets the type of the value the decoder produces for the argument. For an
   * argument declared as {@code Ref<A>} this is {@code A}.
   *
   * @return The argument value type
   */
  public Type getArgumentType() {
    return argumentType;
  }

  /**
   * @return true if the argument is declared as a {@link Ref} and is passed as the holder
   * itself, false if the method receives the bare value
   */
  public boolean isArgumentReference() {
    return argumentReference;
  }

  /**
   * Gets the type held by the reply {@link Ref}.
   *
   * @return The reply value type
   */
  public Type getReplyType() {
    return replyType;
  }

  @Override
  public String toString() {
    return "MethodDescriptor{" +
        "name='" + name + '\'' +
        ", argumentType=" + argumentType.getTypeName() +
        ", argumentReference=" + argumentReference +
        ", replyType=" + replyType.getTypeName() +
        '}';
  }
}
