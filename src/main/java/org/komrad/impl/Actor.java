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

import org.komrad.util.StringUtil;

/**
 * Something that can be the target of an {@link AgentRef}: either an {@link AgentInstance}, which
 * processes its messages asynchronously, or a {@link NativeAgent}, which handles them on the
 * sender's thread.
 */
public abstract class Actor {

  final VirtualMachine vm;
  private final AgentRef ref;

  Actor(VirtualMachine vm) {
    this.vm = vm;
    this.ref = new AgentRef(this);
  }

  /** The name of the definition or native agent this was created from. */
  public abstract String typeName();

  /** False once this actor has been stopped; sends to it are then delivery errors. */
  public abstract boolean isAlive();

  /** Stops this actor. Has no effect if it was already stopped. */
  public abstract void stop();

  public final AgentRef ref() {
    return ref;
  }

  /**
   * Returns a short, persistent, usually unique identifier for this actor (suitable for output but
   * not as a map key).
   */
  public String id() {
    return StringUtil.id(this);
  }

  @Override
  public String toString() {
    return typeName() + "@" + id();
  }
}
