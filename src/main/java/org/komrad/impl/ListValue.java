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
import org.komrad.util.StringUtil;

/** An immutable list of Values. */
public record ListValue(ImmutableList<Value> elements) implements Value {

  public static final ListValue EMPTY = new ListValue(ImmutableList.of());

  public static ListValue of(Value... elements) {
    return new ListValue(ImmutableList.copyOf(elements));
  }

  public int size() {
    return elements.size();
  }

  public Value get(int i) {
    return elements.get(i);
  }

  /** Returns a new list with {@code v} appended. */
  public ListValue append(Value v) {
    return new ListValue(
        ImmutableList.<Value>builderWithExpectedSize(elements.size() + 1)
            .addAll(elements)
            .add(v)
            .build());
  }

  public ListValue concat(ListValue other) {
    if (other.elements.isEmpty()) {
      return this;
    } else if (elements.isEmpty()) {
      return other;
    }
    return new ListValue(
        ImmutableList.<Value>builderWithExpectedSize(elements.size() + other.elements.size())
            .addAll(elements)
            .addAll(other.elements)
            .build());
  }

  @Override
  public BaseType baseType() {
    return BaseType.LIST;
  }

  @Override
  public String display() {
    return StringUtil.joinElements("[", "]", ", ", elements.size(), i -> elements.get(i).display());
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("[", "]", ", ", elements.size(), elements::get);
  }
}
