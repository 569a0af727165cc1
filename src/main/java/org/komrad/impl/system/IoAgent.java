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

import org.komrad.impl.IntrinsicCall;
import org.komrad.impl.NoneValue;
import org.komrad.impl.SystemAgent.Intrinsic;
import org.komrad.impl.Value;

/** {@code Io}: writes the display form of values to the VirtualMachine's output stream. */
public final class IoAgent {

  private IoAgent() {}

  @Intrinsic("println _v")
  static Value println(IntrinsicCall call) {
    call.options().out.println(call.arg("v").display());
    return NoneValue.NONE;
  }

  @Intrinsic("println")
  static Value newline(IntrinsicCall call) {
    call.options().out.println();
    return NoneValue.NONE;
  }

  @Intrinsic("print _v")
  static Value print(IntrinsicCall call) {
    call.options().out.print(call.arg("v").display());
    return NoneValue.NONE;
  }
}
