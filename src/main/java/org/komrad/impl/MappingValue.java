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
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An immutable, insertion-ordered mapping from Values to Values. Updates return a new mapping;
 * replacing the value of an existing key keeps the key's position.
 */
public record MappingValue(ImmutableMap<Value, Value> entries) implements Value {

  public static final MappingValue EMPTY = new MappingValue(ImmutableMap.of());

  public static MappingValue of(Map<Value, Value> entries) {
    return entries.isEmpty() ? EMPTY : new MappingValue(ImmutableMap.copyOf(entries));
  }

  public int size() {
    return entries.size();
  }

  public @Nullable Value get(Value key) {
    return entries.get(key);
  }

  public boolean containsKey(Value key) {
    return entries.containsKey(key);
  }

  /** Returns a mapping with {@code key} bound to {@code value}. */
  public MappingValue with(Value key, Value value) {
    Map<Value, Value> copy = new LinkedHashMap<>(entries);
    copy.put(key, value);
    return new MappingValue(ImmutableMap.copyOf(copy));
  }

  /** Returns a mapping without {@code key}; returns this mapping if the key is not present. */
  public MappingValue without(Value key) {
    if (!entries.containsKey(key)) {
      return this;
    }
    Map<Value, Value> copy = new LinkedHashMap<>(entries);
    copy.remove(key);
    return of(copy);
  }

  public ListValue keys() {
    return new ListValue(entries.keySet().asList());
  }

  public ListValue values() {
    return new ListValue(ImmutableList.copyOf(entries.values()));
  }

  @Override
  public BaseType baseType() {
    return BaseType.MAPPING;
  }

  @Override
  public String display() {
    return render(true);
  }

  @Override
  public String toString() {
    return render(false);
  }

  private String render(boolean display) {
    if (entries.isEmpty()) {
      return "[:]";
    }
    StringBuilder sb = new StringBuilder("[");
    entries.forEach(
        (k, v) -> {
          if (sb.length() > 1) {
            sb.append(", ");
          }
          sb.append(display ? k.display() : k.toString())
              .append(": ")
              .append(display ? v.display() : v.toString());
        });
    return sb.append("]").toString();
  }
}
