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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.komrad.util.StringUtil;

/** The terms of a single message; matched against handler patterns of the same arity. */
public record Message(ImmutableList<Value> terms) {

  public Message {
    Preconditions.checkArgument(!terms.isEmpty(), "Messages must have at least one term");
  }

  public static Message of(Value... terms) {
    return new Message(ImmutableList.copyOf(terms));
  }

  /** Returns a message whose first term is the given word. */
  public static Message of(String selector, Value... rest) {
    return new Message(
        ImmutableList.<Value>builderWithExpectedSize(rest.length + 1)
            .add(new WordValue(selector))
            .add(rest)
            .build());
  }

  public int size() {
    return terms.size();
  }

  public Value term(int i) {
    return terms.get(i);
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("[", "]", " ", terms.size(), terms::get);
  }
}
