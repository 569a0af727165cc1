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

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;
import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.FloatValue;
import org.komrad.impl.IntValue;
import org.komrad.impl.IntrinsicCall;
import org.komrad.impl.StringValue;
import org.komrad.impl.SystemAgent.Intrinsic;
import org.komrad.impl.Value;

/** {@code Number}: parsing, classifying and rounding numbers. */
public final class NumberAgent {

  private NumberAgent() {}

  /** Parses an int if possible, otherwise a float. */
  @Intrinsic("parse _s")
  static Value parse(IntrinsicCall call) throws EvalError {
    String s = call.string("s").trim();
    Long asLong = Longs.tryParse(s);
    if (asLong != null) {
      return IntValue.of(asLong);
    }
    Double asDouble = Doubles.tryParse(s);
    if (asDouble != null) {
      return new FloatValue(asDouble);
    }
    throw call.failure("%s is not a number", call.arg("s"));
  }

  @Intrinsic("is-int _v")
  static Value isInt(IntrinsicCall call) {
    return BoolValue.of(call.arg("v") instanceof IntValue);
  }

  @Intrinsic("is-float _v")
  static Value isFloat(IntrinsicCall call) {
    return BoolValue.of(call.arg("v") instanceof FloatValue);
  }

  @Intrinsic("is-number _v")
  static Value isNumber(IntrinsicCall call) {
    Value v = call.arg("v");
    return BoolValue.of(v instanceof IntValue || v instanceof FloatValue);
  }

  @Intrinsic("to-string _n")
  static Value asString(IntrinsicCall call) throws EvalError {
    return new StringValue(number(call, "n").toString());
  }

  @Intrinsic("abs _n")
  static Value abs(IntrinsicCall call) throws EvalError {
    Value n = number(call, "n");
    if (n instanceof IntValue i) {
      try {
        return IntValue.of(Math.absExact(i.value()));
      } catch (ArithmeticException e) {
        throw call.failure(e);
      }
    }
    return new FloatValue(Math.abs(((FloatValue) n).value()));
  }

  /** Returns the largest int not greater than {@code n}. */
  @Intrinsic("floor _n")
  static Value floor(IntrinsicCall call) throws EvalError {
    Value n = number(call, "n");
    if (n instanceof IntValue) {
      return n;
    }
    double d = Math.floor(((FloatValue) n).value());
    if (!(d >= Long.MIN_VALUE && d < 0x1p63)) {
      throw call.failure("%s is out of range", n);
    }
    return IntValue.of((long) d);
  }

  @Intrinsic("max _a _b")
  static Value max(IntrinsicCall call) throws EvalError {
    return choose(call, true);
  }

  @Intrinsic("min _a _b")
  static Value min(IntrinsicCall call) throws EvalError {
    return choose(call, false);
  }

  private static Value choose(IntrinsicCall call, boolean max) throws EvalError {
    Value a = number(call, "a");
    Value b = number(call, "b");
    if (a instanceof IntValue x && b instanceof IntValue y) {
      return (max == (x.value() >= y.value())) ? a : b;
    }
    double x = call.number("a");
    double y = call.number("b");
    return new FloatValue(max ? Math.max(x, y) : Math.min(x, y));
  }

  /** Returns the named argument after checking that it is an int or a float. */
  private static Value number(IntrinsicCall call, String name) throws EvalError {
    Value v = call.arg(name);
    if (v instanceof IntValue || v instanceof FloatValue) {
      return v;
    }
    throw call.typeMismatch(name, "a number");
  }
}
