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
import org.komrad.impl.IntrinsicCall;
import org.komrad.impl.NoneValue;
import org.komrad.impl.SystemAgent.Intrinsic;
import org.komrad.impl.Value;

/** {@code Assert}: fails with ASSERTION_FAILED unless a condition holds. */
public final class AssertAgent {

  private AssertAgent() {}

  @Intrinsic("true _v")
  static Value isTrue(IntrinsicCall call) throws EvalError {
    Value v = call.arg("v");
    if (v != BoolValue.TRUE) {
      throw new EvalError(EvalError.Kind.ASSERTION_FAILED, "Expected true, got %s", v);
    }
    return NoneValue.NONE;
  }

  /** Compares with the same rules as {@code ==}. */
  @Intrinsic("equal _a _b")
  static Value equal(IntrinsicCall call) throws EvalError {
    Value a = call.arg("a");
    Value b = call.arg("b");
    if (!Value.equal(a, b)) {
      throw new EvalError(EvalError.Kind.ASSERTION_FAILED, "Expected %s to equal %s", a, b);
    }
    return NoneValue.NONE;
  }
}
