package com.github.statekeeper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.github.statekeeper.StateKeeperException.Code;

/**
 * Structural deep copy over the value types a snapshot is allowed to hold.
 *
 * Supported: null, strings, boxed primitives, BigDecimal/BigInteger, enums, UUIDs, java.util.Date,
 * everything under java.time, lists, sets, maps, arrays and any {@link Copyable}. Lists, sets and
 * maps come back as ArrayList, LinkedHashSet and LinkedHashMap respectively, preserving
 * iteration order.
 *
 * Anything else, and any reference cycle, fails with {@link Code#UNSERIALIZABLE_STATE}. Shared
 * references that are not cyclic are copied once per occurrence.
 */
public final class StateCloner {
  private static final Set<Class<?>> immutableTypes = new HashSet<>(Arrays.asList(String.class,
      Boolean.class, Character.class, Byte.class, Short.class, Integer.class, Long.class,
      Float.class, Double.class, BigDecimal.class, BigInteger.class, UUID.class));

  public static <T> T deepCopy(final T value) throws StateKeeperException {
    final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
    return (T) copy(value, inProgress, "$");
  }

  private static Object copy(final Object value, final Set<Object> inProgress, final String path)
      throws StateKeeperException {
    if (value == null || isImmutable(value)) {
      return value;
    }
    if (value instanceof Date) {
      // clone() keeps subclasses such as java.sql.Timestamp intact
      return ((Date) value).clone();
    }
    if (!inProgress.add(value)) {
      throw new StateKeeperException(Code.UNSERIALIZABLE_STATE,
          "Reference cycle detected at " + path);
    }
    try {
      if (value instanceof Copyable) {
        return ((Copyable<?>) value).copy();
      }
      if (value instanceof List) {
        final List<?> source = (List<?>) value;
        final List<Object> target = new ArrayList<>(source.size());
        int index = 0;
        for (final Object element : source) {
          target.add(copy(element, inProgress, path + "[" + index++ + "]"));
        }
        return target;
      }
      if (value instanceof Set) {
        final Set<Object> target = new LinkedHashSet<>();
        for (final Object element : (Set<?>) value) {
          target.add(copy(element, inProgress, path + "{}"));
        }
        return target;
      }
      if (value instanceof Map) {
        final Map<Object, Object> target = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
          final String entryPath = path + "." + entry.getKey();
          target.put(copy(entry.getKey(), inProgress, entryPath),
              copy(entry.getValue(), inProgress, entryPath));
        }
        return target;
      }
      if (value.getClass().isArray()) {
        return copyArray(value, inProgress, path);
      }
      throw new StateKeeperException(Code.UNSERIALIZABLE_STATE,
          "Unsupported state type " + value.getClass().getName() + " at " + path);
    } finally {
      inProgress.remove(value);
    }
  }

  private static Object copyArray(final Object array, final Set<Object> inProgress,
      final String path) throws StateKeeperException {
    if (array instanceof Object[]) {
      // clone() keeps the runtime component type, elements are then replaced by their copies
      final Object[] target = ((Object[]) array).clone();
      for (int index = 0; index < target.length; index++) {
        final String elementPath = path + "[" + index + "]";
        final Object element = copy(target[index], inProgress, elementPath);
        try {
          target[index] = element;
        } catch (ArrayStoreException storeProblem) {
          throw new StateKeeperException(Code.UNSERIALIZABLE_STATE, "Copy of "
              + element.getClass().getName() + " does not fit the array at " + elementPath);
        }
      }
      return target;
    }
    if (array instanceof int[]) {
      return ((int[]) array).clone();
    }
    if (array instanceof long[]) {
      return ((long[]) array).clone();
    }
    if (array instanceof double[]) {
      return ((double[]) array).clone();
    }
    if (array instanceof float[]) {
      return ((float[]) array).clone();
    }
    if (array instanceof short[]) {
      return ((short[]) array).clone();
    }
    if (array instanceof byte[]) {
      return ((byte[]) array).clone();
    }
    if (array instanceof char[]) {
      return ((char[]) array).clone();
    }
    return ((boolean[]) array).clone();
  }

  private static boolean isImmutable(final Object value) {
    if (immutableTypes.contains(value.getClass()) || value instanceof Enum) {
      return true;
    }
    // every value class under java.time is immutable
    return value.getClass().getName().startsWith("java.time.");
  }

  private StateCloner() {}
}
