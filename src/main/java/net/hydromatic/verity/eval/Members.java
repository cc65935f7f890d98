/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.verity.eval;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.verity.eval.EvalException.Kind.ATTRIBUTE_ERROR;
import static net.hydromatic.verity.eval.EvalException.Kind.TYPE_ERROR;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.verity.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves attributes and methods of host objects, using reflection.
 *
 * <p>Attribute "y" of object "a" is, in order of preference:
 *
 * <ol>
 *   <li>the result of {@link Dynamic#getAttribute(String) a.getAttribute("y")}
 *       if "a" implements {@link Dynamic};
 *   <li>the value of a public field "y";
 *   <li>the result of calling a public zero-argument method "y()", as
 *       declared by a record;
 *   <li>the result of calling a bean getter "getY()" or "isY()";
 *   <li>the public method or methods called "y", as a {@link BoundMethod}.
 * </ol>
 *
 * <p>If none of these exist and the name is in snake_case, such as
 * "is_absolute", the search is repeated with the lowerCamel form of the name,
 * "isAbsolute".
 */
public class Members {
  private static final Object NOT_FOUND = new Object();

  private Members() {}

  /** Returns the value of an attribute of an object. Throws
   * "AttributeError" if there is no such attribute. */
  public static Object getAttribute(Pos pos, Object o, String name) {
    Object value = attribute(pos, o, name);
    if (value == NOT_FOUND && name.indexOf('_') > 0) {
      value = attribute(pos, o, toCamel(name));
    }
    if (value == NOT_FOUND) {
      throw noAttribute(pos, o, name);
    }
    return value;
  }

  /**
   * Returns a method of an object, for use as the target of a call.
   *
   * <p>Unlike {@link #getAttribute}, does not call zero-argument methods or
   * getters; so {@code a.is_empty()} calls {@code a.isEmpty()} once, and the
   * callee {@code a.is_empty} evaluates to a {@link BoundMethod}. If the
   * object has no public method of that name, falls back to
   * {@link #getAttribute}.
   */
  public static Object getMethod(Pos pos, Object o, String name) {
    if (!(o instanceof Dynamic)) {
      BoundMethod method = boundMethod(o, name);
      if (method == null && name.indexOf('_') > 0) {
        method = boundMethod(o, toCamel(name));
      }
      if (method != null) {
        return method;
      }
    }
    return getAttribute(pos, o, name);
  }

  private static String toCamel(String name) {
    return CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name);
  }

  private static EvalException noAttribute(Pos pos, Object o, String name) {
    if (o instanceof Dynamic) {
      return new EvalException(ATTRIBUTE_ERROR,
          ((Dynamic) o).noAttributeMessage(name), pos);
    }
    return new EvalException(ATTRIBUTE_ERROR,
        "'" + Values.typeName(o) + "' object has no attribute '" + name + "'",
        pos);
  }

  private static Object attribute(Pos pos, Object o, String name) {
    if (o instanceof Dynamic) {
      final Object value = ((Dynamic) o).getAttribute(name);
      return value == null ? NOT_FOUND : Values.ofHost(value);
    }
    if (o instanceof Nil) {
      return NOT_FOUND;
    }
    final Class<?> clazz = o.getClass();
    for (Field field : clazz.getFields()) {
      if (field.getName().equals(name)
          && !Modifier.isStatic(field.getModifiers())
          && accessible(field)) {
        try {
          return Values.ofHost(field.get(o));
        } catch (IllegalAccessException e) {
          throw new EvalException(e, pos);
        }
      }
    }
    for (String getter : getterNames(name)) {
      final Method method = zeroArgMethod(clazz, getter);
      if (method != null) {
        return invoke(pos, method, o, ImmutableList.of());
      }
    }
    final BoundMethod method = boundMethod(o, name);
    return method == null ? NOT_FOUND : method;
  }

  private static List<String> getterNames(String name) {
    final String capitalized =
        Character.toUpperCase(name.charAt(0)) + name.substring(1);
    return ImmutableList.of(name, "get" + capitalized, "is" + capitalized);
  }

  private static @Nullable Method zeroArgMethod(Class<?> clazz, String name) {
    for (Method method : clazz.getMethods()) {
      if (method.getName().equals(name)
          && method.getParameterCount() == 0
          && method.getReturnType() != void.class
          && !Modifier.isStatic(method.getModifiers())
          && method.getDeclaringClass() != Object.class) {
        final Method m = accessibleMethod(method);
        if (m != null) {
          return m;
        }
      }
    }
    return null;
  }

  private static @Nullable BoundMethod boundMethod(Object o, String name) {
    final List<Method> methods = new ArrayList<>();
    for (Method method : o.getClass().getMethods()) {
      if (method.getName().equals(name)
          && !Modifier.isStatic(method.getModifiers())
          && !method.isVarArgs()) {
        final Method m = accessibleMethod(method);
        if (m != null) {
          methods.add(m);
        }
      }
    }
    if (methods.isEmpty()) {
      return null;
    }
    return new BoundMethod(o, name, ImmutableList.copyOf(methods));
  }

  private static boolean accessible(Field field) {
    return Modifier.isPublic(field.getDeclaringClass().getModifiers())
        || field.trySetAccessible();
  }

  /** Returns a version of a method that can be invoked: the method itself
   * if its class is public, or the same method declared by a public
   * supertype. Returns null if there is none. */
  private static @Nullable Method accessibleMethod(Method method) {
    final Class<?> declaringClass = method.getDeclaringClass();
    if (Modifier.isPublic(declaringClass.getModifiers())) {
      return method;
    }
    final Method m =
        publicSupertypeMethod(declaringClass, method.getName(),
            method.getParameterTypes());
    if (m != null) {
      return m;
    }
    return method.trySetAccessible() ? method : null;
  }

  private static @Nullable Method publicSupertypeMethod(Class<?> clazz,
      String name, Class<?>[] parameterTypes) {
    for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
      if (c != clazz && Modifier.isPublic(c.getModifiers())) {
        try {
          return c.getMethod(name, parameterTypes);
        } catch (NoSuchMethodException e) {
          // not declared by this class; try its interfaces
        }
      }
      for (Class<?> i : c.getInterfaces()) {
        final Method m = publicSupertypeMethod(i, name, parameterTypes);
        if (m != null) {
          return m;
        }
        if (Modifier.isPublic(i.getModifiers())) {
          try {
            return i.getMethod(name, parameterTypes);
          } catch (NoSuchMethodException e) {
            // try the next interface
          }
        }
      }
    }
    return null;
  }

  /** Invokes a method, converting its result to a value. Unchecked
   * exceptions thrown by the method propagate unchanged; checked
   * exceptions are wrapped in {@link EvalException}. */
  static Object invoke(Pos pos, Method method, Object receiver,
      List<Object> args) {
    try {
      return Values.ofHost(method.invoke(receiver, args.toArray()));
    } catch (IllegalAccessException e) {
      throw new EvalException(e, pos);
    } catch (InvocationTargetException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new EvalException((Exception) requireNonNull(cause), pos);
    }
  }

  /** Converts a value to the type of a method parameter, or returns
   * {@link #NOT_FOUND} if it cannot be converted. */
  private static @Nullable Object coerce(Object value, Class<?> type) {
    if (value == Nil.INSTANCE) {
      return type.isPrimitive() ? NOT_FOUND : null;
    }
    if (type.isInstance(value)) {
      return value;
    }
    if (Values.isIntegral(value) && !(value instanceof Boolean)) {
      final long v = ((Number) value).longValue();
      if (type == int.class || type == Integer.class) {
        return v == (int) v ? (Object) (int) v : NOT_FOUND;
      }
      if (type == long.class || type == Long.class) {
        return v;
      }
      if (type == short.class || type == Short.class) {
        return v == (short) v ? (Object) (short) v : NOT_FOUND;
      }
      if (type == byte.class || type == Byte.class) {
        return v == (byte) v ? (Object) (byte) v : NOT_FOUND;
      }
    }
    if (value instanceof Number && !(value instanceof Boolean)) {
      if (type == double.class || type == Double.class) {
        return ((Number) value).doubleValue();
      }
      if (type == float.class || type == Float.class) {
        return ((Number) value).floatValue();
      }
    }
    if (value instanceof Boolean && type == boolean.class) {
      return value;
    }
    if (value instanceof String
        && ((String) value).length() == 1
        && (type == char.class || type == Character.class)) {
      return ((String) value).charAt(0);
    }
    return NOT_FOUND;
  }

  /** Method of a host object, bound to that object, so that it can be
   * called later. */
  public static class BoundMethod implements Applicable {
    public final Object receiver;
    public final String name;
    /** Public methods with this name; overloads are chosen by the number and
     * types of the arguments. */
    private final List<Method> methods;

    BoundMethod(Object receiver, String name, List<Method> methods) {
      this.receiver = requireNonNull(receiver);
      this.name = requireNonNull(name);
      this.methods = ImmutableList.copyOf(methods);
    }

    @Override public Object apply(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      if (!keywords.isEmpty()) {
        throw new EvalException(TYPE_ERROR,
            name + "() takes no keyword arguments", pos);
      }
      for (Method method : methods) {
        final Class<?>[] parameterTypes = method.getParameterTypes();
        if (parameterTypes.length != args.size()) {
          continue;
        }
        final List<Object> coercedArgs = new ArrayList<>();
        for (int i = 0; i < parameterTypes.length; i++) {
          final Object arg = coerce(args.get(i), parameterTypes[i]);
          if (arg == NOT_FOUND) {
            break;
          }
          coercedArgs.add(arg);
        }
        if (coercedArgs.size() == parameterTypes.length) {
          return invoke(pos, method, receiver, coercedArgs);
        }
      }
      throw new EvalException(TYPE_ERROR,
          "no method " + name + " of '" + Values.typeName(receiver)
              + "' accepts arguments " + Printer.UNLIMITED.repr(args), pos);
    }
  }
}

// End Members.java
