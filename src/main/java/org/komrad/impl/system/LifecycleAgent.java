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

import org.komrad.impl.AgentRef;
import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.IntrinsicCall;
import org.komrad.impl.MappingValue;
import org.komrad.impl.NoneValue;
import org.komrad.impl.StringValue;
import org.komrad.impl.SystemAgent;
import org.komrad.impl.SystemAgent.Intrinsic;
import org.komrad.impl.Value;

/**
 * {@code Agent}: creates, inspects and stops agents. {@code Agent new Name config} is the
 * dynamic form of {@code spawn Name config}, for when the definition's name is computed.
 */
public final class LifecycleAgent {

  private LifecycleAgent() {}

  /** System agents are shared by every agent and can't be stopped. */
  @Intrinsic("stop _a")
  static Value stop(IntrinsicCall call) throws EvalError {
    AgentRef target = call.agent("a");
    if (target.actor() instanceof SystemAgent) {
      throw call.typeMismatch("a", "an agent other than a system agent");
    }
    call.vm().stop(target);
    return NoneValue.NONE;
  }

  @Intrinsic("is-alive _a")
  static Value isAlive(IntrinsicCall call) throws EvalError {
    return BoolValue.of(call.agent("a").actor().isAlive());
  }

  /** Returns the name of the definition the agent was created from. */
  @Intrinsic("name _a")
  static Value name(IntrinsicCall call) throws EvalError {
    return new StringValue(call.agent("a").typeName());
  }

  @Intrinsic("new _name")
  static Value spawn(IntrinsicCall call) throws EvalError {
    return call.spawn(call.text("name"), MappingValue.EMPTY);
  }

  @Intrinsic("new _name _config")
  static Value spawnWithConfig(IntrinsicCall call) throws EvalError {
    return call.spawn(call.text("name"), call.mapping("config"));
  }
}
