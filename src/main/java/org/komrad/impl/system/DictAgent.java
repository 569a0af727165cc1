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

import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.IntValue;
import org.komrad.impl.IntrinsicCall;
import org.komrad.impl.MappingValue;
import org.komrad.impl.NoneValue;
import org.komrad.impl.StringValue;
import org.komrad.impl.SystemAgent.Intrinsic;
import org.komrad.impl.Value;
import org.komrad.impl.WordValue;

/**
 * {@code Dict}: operations on mappings. Mappings are immutable, so {@code set} and {@code remove}
 * return a new mapping.
 *
 * <p>A word used as a key is treated as the string with the same text, so that {@code Dict get m
 * name} finds the entry written as {@code [name: ...]}.
 */
public final class DictAgent {

  private DictAgent() {}

  private static Value key(IntrinsicCall call) {
    Value k = call.arg("k");
    return (k instanceof WordValue w) ? new StringValue(w.text()) : k;
  }

  @Intrinsic("new")
  static Value newMapping(IntrinsicCall call) {
    return MappingValue.EMPTY;
  }

  @Intrinsic("get _m _k")
  static Value get(IntrinsicCall call) throws EvalError {
    Value v = call.mapping("m").get(key(call));
    return (v != null) ? v : NoneValue.NONE;
  }

  @Intrinsic("get _m _k _default")
  static Value getOrDefault(IntrinsicCall call) throws EvalError {
    Value v = call.mapping("m").get(key(call));
    return (v != null) ? v : call.arg("default");
  }

  @Intrinsic("set _m _k _v")
  static Value set(IntrinsicCall call) throws EvalError {
    return call.mapping("m").with(key(call), call.arg("v"));
  }

  @Intrinsic("remove _m _k")
  static Value remove(IntrinsicCall call) throws EvalError {
    return call.mapping("m").without(key(call));
  }

  @Intrinsic("has _m _k")
  static Value has(IntrinsicCall call) throws EvalError {
    return BoolValue.of(call.mapping("m").containsKey(key(call)));
  }

  @Intrinsic("keys _m")
  static Value keys(IntrinsicCall call) throws EvalError {
    return call.mapping("m").keys();
  }

  @Intrinsic("values _m")
  static Value values(IntrinsicCall call) throws EvalError {
    return call.mapping("m").values();
  }

  @Intrinsic("size _m")
  static Value size(IntrinsicCall call) throws EvalError {
    return IntValue.of(call.mapping("m").size());
  }
}
