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

/** A reference to an agent. Two references are equal only if they refer to the same agent. */
public record AgentRef(Actor actor) implements Value {

  public String typeName() {
    return actor.typeName();
  }

  @Override
  public BaseType baseType() {
    return BaseType.AGENT;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof AgentRef ref && ref.actor == actor;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(actor);
  }

  @Override
  public String toString() {
    return actor.toString();
  }
}
