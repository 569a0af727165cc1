/*
 * Copyright 2025 The Komrad Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.komrad.impl;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Method;

/** Static helpers for the MethodHandles and VarHandles used by the runtime. */
final class Handle {

  /** The type of every intrinsic's MethodHandle. */
  static final MethodType INTRINSIC_TYPE = MethodType.methodType(Value.class, IntrinsicCall.class);

  private Handle() {}

  /**
   * Returns a MethodHandle of type {@link #INTRINSIC_TYPE} for {@code m}, which must be a static
   * method taking an IntrinsicCall and returning a Value. Non-public methods are made accessible.
   */
  static MethodHandle forIntrinsic(Method m) {
    m.setAccessible(true);
    try {
      return MethodHandles.lookup().unreflect(m).asType(INTRINSIC_TYPE);
    } catch (IllegalAccessException e) {
      throw new LinkageError("Can't access " + describe(m), e);
    }
  }

  /**
   * Returns a VarHandle for the named field of {@code owner}. {@code lookup} must have private
   * access to {@code owner}; callers pass their own {@code MethodHandles.lookup()}.
   */
  static VarHandle forVar(MethodHandles.Lookup lookup, Class<?> owner, String name, Class<?> type) {
    try {
      return lookup.findVarHandle(owner, name, type);
    } catch (NoSuchFieldException | IllegalAccessException e) {
      throw new LinkageError(
          "No " + type.getSimpleName() + " field " + simpleName(owner) + "." + name, e);
    }
  }

  /** Returns {@code Class.method}, for error messages. */
  static String describe(Method m) {
    return simpleName(m.getDeclaringClass()) + "." + m.getName();
  }

  /** Returns the name of {@code c} without its package or any enclosing classes. */
  static String simpleName(Class<?> c) {
    String name = c.getName();
    return name.substring(Math.max(name.lastIndexOf('.'), name.lastIndexOf('$')) + 1);
  }
}
