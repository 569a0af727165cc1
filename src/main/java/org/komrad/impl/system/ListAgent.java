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

package org.komrad.impl.system;

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.IntValue;
import org.komrad.impl.IntrinsicCall;
import org.komrad.impl.ListValue;
import org.komrad.impl.NoneValue;
import org.komrad.impl.StringValue;
import org.komrad.impl.SystemAgent.Intrinsic;
import org.komrad.impl.Value;

/** {@code List}: operations on lists. Lists are immutable; {@code append} returns a new list. */
public final class ListAgent {

  private ListAgent() {}

  @Intrinsic("new")
  static Value newList(IntrinsicCall call) {
    return ListValue.EMPTY;
  }

  @Intrinsic("length _xs")
  static Value length(IntrinsicCall call) throws EvalError {
    return IntValue.of(call.list("xs").size());
  }

  /** Returns the element at the given zero-based index. */
  @Intrinsic("get _xs _i")
  static Value get(IntrinsicCall call) throws EvalError {
    ListValue xs = call.list("xs");
    long i = call.integer("i");
    if (i < 0 || i >= xs.size()) {
      throw call.failure("index %s out of range for a list of length %s", i, xs.size());
    }
    return xs.get((int) i);
  }

  @Intrinsic("append _xs _v")
  static Value append(IntrinsicCall call) throws EvalError {
    return call.list("xs").append(call.arg("v"));
  }

  /** Returns the first element, or {@code none} if the list is empty. */
  @Intrinsic("first _xs")
  static Value first(IntrinsicCall call) throws EvalError {
    ListValue xs = call.list("xs");
    return (xs.size() == 0) ? NoneValue.NONE : xs.get(0);
  }

  /** Returns all but the first element; the rest of an empty list is empty. */
  @Intrinsic("rest _xs")
  static Value rest(IntrinsicCall call) throws EvalError {
    ImmutableList<Value> elements = call.list("xs").elements();
    return elements.isEmpty()
        ? ListValue.EMPTY
        : new ListValue(elements.subList(1, elements.size()));
  }

  /** Joins the display forms of the elements with the given separator. */
  @Intrinsic("join _xs _sep")
  static Value join(IntrinsicCall call) throws EvalError {
    String separator = call.string("sep");
    return new StringValue(
        call.list("xs").elements().stream()
            .map(Value::display)
            .collect(Collectors.joining(separator)));
  }

  /** Returns the ints from 0 to n-1. */
  @Intrinsic("range _n")
  static Value range(IntrinsicCall call) throws EvalError {
    long n = call.integer("n");
    if (n > Integer.MAX_VALUE) {
      throw call.failure("%s is too large", n);
    }
    return new ListValue(
        LongStream.range(0, n).mapToObj(IntValue::of).collect(ImmutableList.toImmutableList()));
  }

  @Intrinsic("contains _xs _v")
  static Value contains(IntrinsicCall call) throws EvalError {
    Value v = call.arg("v");
    return BoolValue.of(call.list("xs").elements().stream().anyMatch(x -> Value.equal(x, v)));
  }
}
