package io.github.panghy.birpc.rpc;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.warn;

/**
 * Allocates zero-valued argument and reply holders for a {@link MethodDescriptor}.
 *
 * <p>Zero values are {@code 0}/{@code false} for primitives and their boxes,
 * {@code ""} for strings, a new instance for classes with a no-arg constructor and
 * {@code null} otherwise. Replies of map, collection or array type start out as an
 * empty container so the method and the decoder can add to them without a null
 * check.</p>
 */
public final class ValueFactory {

  private static final Logger LOGGER = Logger.getLogger(ValueFactory.class.getName());

  private static final Map<Class<?>, Object> PRIMITIVE_ZEROS = Map.ofEntries(
      Map.entry(boolean.class, false), Map.entry(Boolean.class, false),
      Map.entry(char.class, '\0'), Map.entry(Character.class, '\0'),
      Map.entry(byte.class, (byte) 0), Map.entry(Byte.class, (byte) 0),
      Map.entry(short.class, (short) 0), Map.entry(Short.class, (short) 0),
      Map.entry(int.class, 0), Map.entry(Integer.class, 0),
      Map.entry(long.class, 0L), Map.entry(Long.class, 0L),
      Map.entry(float.class, 0f), Map.entry(Float.class, 0f),
      Map.entry(double.class, 0d), Map.entry(Double.class, 0d));

  private ValueFactory() {
  }

  /**
   * Allocates the argument holder for a request to the given method.
   *
   * @param method The method the request targets
   * @return A holder containing the zero value of the argument type
   */
  public static ArgumentHolder makeArgument(MethodDescriptor method) {
    Ref<Object> ref = new Ref<>(zeroValue(method.getArgumentType()));
    return new ArgumentHolder(ref, !method.isArgumentReference());
  }

  /**
   * Allocates the reply holder for a request to the given method.
   *
   * @param method The method the request targets
   * @return A {@link Ref} holding the zero reply value, or an empty container
   */
  public static Ref<Object> makeReply(MethodDescriptor method) {
    Type replyType = method.getReplyType();
    Object container = emptyContainer(replyType);
    return new Ref<>(container != null ? container : zeroValue(replyType));
  }

  /**
   * Gets the zero value of a type.
   *
   * @param type The type
   * @return The zero value, {@code null} if the type has none
   */
  static Object zeroValue(Type type) {
    Class<?> raw = CallingConvention.rawClass(type);
    Object primitive = PRIMITIVE_ZEROS.get(raw);
    if (primitive != null) {
      return primitive;
    }
    if (raw == String.class) {
      return "";
    }
    if (raw == CallingConvention.REFERENCE) {
      return new Ref<>(zeroValue(CallingConvention.referencedType(type)));
    }
    return newInstance(raw);
  }

  /**
   * Checks that a reply of the given type can start out as an empty container.
   * Types that are not maps or collections always pass.
   */
  static boolean canCreateEmpty(Type type) {
    Class<?> raw = CallingConvention.rawClass(type);
    if (!Map.class.isAssignableFrom(raw) && !Collection.class.isAssignableFrom(raw)) {
      return true;
    }
    return emptyContainer(type) != null;
  }

  /**
   * Creates an empty container for map, collection and array types. Interfaces get
   * their usual general-purpose implementation. Enum keyed containers take their
   * key type from the type arguments.
   *
   * @return The empty container, {@code null} if the type is not a container or
   * cannot be created empty
   */
  static Object emptyContainer(Type type) {
    Class<?> raw = CallingConvention.rawClass(type);
    if (raw.isArray()) {
      return Array.newInstance(raw.getComponentType(), 0);
    }
    if (Map.class.isAssignableFrom(raw)) {
      if (raw == EnumMap.class) {
        Class<?> keyType = enumArgument(type);
        return keyType == null ? null : newEnumMap(keyType);
      }
      if (!isAbstract(raw)) {
        return newInstance(raw);
      }
      if (raw.isAssignableFrom(HashMap.class)) {
        return new HashMap<>();
      }
      if (raw.isAssignableFrom(TreeMap.class)) {
        return new TreeMap<>();
      }
      if (raw.isAssignableFrom(ConcurrentHashMap.class)) {
        return new ConcurrentHashMap<>();
      }
      if (raw.isAssignableFrom(ConcurrentSkipListMap.class)) {
        return new ConcurrentSkipListMap<>();
      }
      return null;
    }
    if (Collection.class.isAssignableFrom(raw)) {
      if (raw == EnumSet.class) {
        Class<?> elementType = enumArgument(type);
        return elementType == null ? null : newEnumSet(elementType);
      }
      if (!isAbstract(raw)) {
        return newInstance(raw);
      }
      if (raw.isAssignableFrom(ArrayList.class)) {
        return new ArrayList<>();
      }
      if (raw.isAssignableFrom(HashSet.class)) {
        return new HashSet<>();
      }
      if (raw.isAssignableFrom(TreeSet.class)) {
        return new TreeSet<>();
      }
      if (raw.isAssignableFrom(ArrayDeque.class)) {
        return new ArrayDeque<>();
      }
      if (raw.isAssignableFrom(LinkedBlockingDeque.class)) {
        return new LinkedBlockingDeque<>();
      }
      return null;
    }
    return null;
  }

  /**
   * @return The first type argument if it is an enum, {@code null} for a raw type
   */
  private static Class<?> enumArgument(Type type) {
    if (!(type instanceof ParameterizedType p)) {
      return null;
    }
    Class<?> argument = CallingConvention.rawClass(p.getActualTypeArguments()[0]);
    return argument.isEnum() ? argument : null;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Object newEnumMap(Class<?> keyType) {
    return new EnumMap(keyType);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Object newEnumSet(Class<?> elementType) {
    return EnumSet.noneOf((Class) elementType);
  }

  private static boolean isAbstract(Class<?> raw) {
    return raw.isInterface() || Modifier.isAbstract(raw.getModifiers());
  }

  private static Object newInstance(Class<?> raw) {
    if (raw == Object.class || raw.isPrimitive() || raw.isArray() || raw.isEnum() || raw.isRecord()
        || isAbstract(raw)) {
      return null;
    }
    Constructor<?> constructor = null;
    for (Constructor<?> candidate : raw.getDeclaredConstructors()) {
      if (candidate.getParameterCount() == 0) {
        constructor = candidate;
        break;
      }
    }
    if (constructor == null || !constructor.trySetAccessible()) {
      return null;
    }
    try {
      return constructor.newInstance();
    } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
      warn(LOGGER, "Could not create a zero value of " + raw.getName(), e);
      return null;
    }
  }
}
