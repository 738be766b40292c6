package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;

/**
 * The shape every callable service method has to match.
 *
 * <pre>{@code
 * public void name(CancellationToken token, ClientConnector client, A argument, Ref<R> reply)
 *     throws SomeException
 * }</pre>
 *
 * <p>{@code A} is any public or primitive type, optionally wrapped in a {@link Ref}
 * so the decoder fills it in place. {@code R} is any public or primitive type. The
 * method reports failure by throwing; a normal return is success.</p>
 *
 * <p>The constants below are compared by identity: a parameter declared as a
 * subtype of {@link CancellationToken} or {@link ClientConnector} does not match.</p>
 */
public final class CallingConvention {

  /**
   * Declared type of the first parameter.
   */
  public static final Class<?> CANCELLATION_TOKEN = CancellationToken.class;

  /**
   * Declared type of the second parameter.
   */
  public static final Class<?> CLIENT_CONNECTOR = ClientConnector.class;

  /**
   * Raw type of the reply parameter, and of a pointer-shaped argument.
   */
  public static final Class<?> REFERENCE = Ref.class;

  /**
   * Declared return type. Failures are thrown.
   */
  public static final Class<?> RETURN_TYPE = void.class;

  /**
   * Number of declared parameters. Together with the receiver this makes five.
   */
  public static final int PARAMETER_COUNT = 4;

  private CallingConvention() {
  }

  /**
   * Checks whether a type can be seen by decoders outside this library: primitives,
   * and classes that are public together with every class enclosing them. Arrays and
   * {@link Ref} are looked through; type variables and wildcards are judged by their
   * first upper bound.
   *
   * @param type The type to check
   * @return true if the type is public or primitive
   */
  public static boolean isExportedOrBuiltin(Type type) {
    if (type instanceof Class<?> c) {
      while (c.isArray()) {
        c = c.getComponentType();
      }
      return c.isPrimitive() || isExported(c);
    }
    if (type instanceof ParameterizedType p) {
      if (p.getRawType() == REFERENCE) {
        return isExportedOrBuiltin(p.getActualTypeArguments()[0]);
      }
      return isExportedOrBuiltin(p.getRawType());
    }
    if (type instanceof GenericArrayType g) {
      return isExportedOrBuiltin(g.getGenericComponentType());
    }
    if (type instanceof TypeVariable<?> v) {
      return isExportedOrBuiltin(v.getBounds()[0]);
    }
    if (type instanceof WildcardType w) {
      return isExportedOrBuiltin(w.getUpperBounds()[0]);
    }
    return false;
  }

  /**
   * @param type A class
   * @return true if the class and all of its enclosing classes are public
   */
  public static boolean isExported(Class<?> type) {
    for (Class<?> c = type; c != null; c = c.getEnclosingClass()) {
      if (!Modifier.isPublic(c.getModifiers())) {
        return false;
      }
    }
    return true;
  }

  /**
   * @param type A type as found in a method signature
   * @return true if the type is {@link Ref}, raw or parameterized
   */
  static boolean isReference(Type type) {
    return rawClass(type) == REFERENCE;
  }

  /**
   * Gets the type a {@link Ref} holds. A raw {@code Ref} holds {@code Object}.
   */
  static Type referencedType(Type refType) {
    if (refType instanceof ParameterizedType p) {
      return p.getActualTypeArguments()[0];
    }
    return Object.class;
  }

  /**
   * Erases a generic type to the class a value of it is an instance of.
   */
  static Class<?> rawClass(Type type) {
    if (type instanceof Class<?> c) {
      return c;
    }
    if (type instanceof ParameterizedType p) {
      return (Class<?>) p.getRawType();
    }
    if (type instanceof GenericArrayType g) {
      return rawClass(g.getGenericComponentType()).arrayType();
    }
    if (type instanceof TypeVariable<?> v) {
      return rawClass(v.getBounds()[0]);
    }
    if (type instanceof WildcardType w) {
      return rawClass(w.getUpperBounds()[0]);
    }
    return Object.class;
  }
}
