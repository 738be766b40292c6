package io.github.panghy.birpc.rpc;

import java.util.Objects;

/**
 * A mutable cell holding a single value.
 *
 * <p>Service methods receive their reply as a {@code Ref} and write the result into
 * it; an argument declared as {@code Ref<A>} is filled in place by the decoder
 * instead of being handed over as a finished value.</p>
 *
 * <pre>{@code
 * public void add(CancellationToken token, ClientConnector client,
 *                 AddArgs args, Ref<Integer> reply) {
 *   reply.set(args.getA() + args.getB());
 * }
 * }</pre>
 *
 * @param <T> The type of the value held
 */
public final class Ref<T> {

  private volatile T value;

  /**
   * Creates an empty ref holding {@code null}.
   */
  public Ref() {
  }

  /**
   * Creates a ref holding the given value.
   *
   * @param value The initial value
   */
  public Ref(T value) {
    this.value = value;
  }

  public static <T> Ref<T> of(T value) {
    return new Ref<>(value);
  }

  public T get() {
    return value;
  }

  public void set(T value) {
    this.value = value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Ref<?> other)) {
      return false;
    }
    return Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return "Ref[" + value + "]";
  }
}
