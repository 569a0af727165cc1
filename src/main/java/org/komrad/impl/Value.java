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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All objects that represent Komrad-language values implement Value.
 *
 * <p>Values are immutable once constructed, so they may be passed between agents freely; the only
 * mutable state in a running program is the field scope of each agent instance.
 *
 * <p>{@code equals()} and {@code hashCode()} implement Komrad value equality (except that an int
 * is never {@code equals()} to a float; the {@code ==} operator compares numbers by value), so
 * Values may be used as mapping keys.
 */
public interface Value {

  /** Every Value has a BaseType. */
  BaseType baseType();

  /**
   * Returns the form of this Value written by {@code Io println}. Strings are written without
   * quotes and escapes; all other Values use {@code toString()}.
   */
  default String display() {
    return toString();
  }

  /** Komrad's {@code ==}: like {@code equals()}, but ints and floats compare numerically. */
  static boolean equal(Value a, Value b) {
    if (a instanceof FloatValue || b instanceof FloatValue) {
      Double x = Operators.toDouble(a);
      Double y = Operators.toDouble(b);
      if (x != null && y != null) {
        return x.doubleValue() == y.doubleValue();
      }
    }
    return a.equals(b);
  }

  /**
   * Converts a Java object to the corresponding Value: Values are returned unchanged; Integer and
   * Long become ints; Float and Double become floats; Strings, Booleans and null are converted
   * directly; Lists and Maps are converted recursively.
   */
  static Value of(Object x) {
    if (x == null) {
      return NoneValue.NONE;
    } else if (x instanceof Value v) {
      return v;
    } else if (x instanceof Long || x instanceof Integer) {
      return new IntValue(((Number) x).longValue());
    } else if (x instanceof Double || x instanceof Float) {
      return new FloatValue(((Number) x).doubleValue());
    } else if (x instanceof String s) {
      return new StringValue(s);
    } else if (x instanceof Boolean b) {
      return BoolValue.of(b);
    } else if (x instanceof List<?> list) {
      return new ListValue(list.stream().map(Value::of).collect(ImmutableList.toImmutableList()));
    } else if (x instanceof Map<?, ?> map) {
      Map<Value, Value> entries = new LinkedHashMap<>();
      map.forEach((k, v) -> entries.put(of(k), of(v)));
      return MappingValue.of(entries);
    }
    throw new IllegalArgumentException("No Komrad value for " + x.getClass().getName());
  }
}
