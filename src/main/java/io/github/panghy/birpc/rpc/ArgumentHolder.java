package io.github.panghy.birpc.rpc;

/**
 * A freshly allocated argument for one request.
 *
 * <p>The decoder always writes into {@link #ref()}, whatever the argument's declared
 * shape. {@link #invocationValue()} then gives what the method expects: the bare value
 * for a value-shaped argument, the holder itself for a {@code Ref<A>} argument.</p>
 *
 * @param ref         The holder the decoder fills
 * @param valueShaped true if the method takes the bare value rather than the holder
 */
public record ArgumentHolder(Ref<Object> ref, boolean valueShaped) {

  /**
   * @return The object to pass as the method's argument parameter
   */
  public Object invocationValue() {
    return valueShaped ? ref.get() : ref;
  }
}
