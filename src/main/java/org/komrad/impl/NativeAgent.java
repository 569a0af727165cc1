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

/**
 * An agent implemented in Java. Unlike an {@link AgentInstance}, a NativeAgent has no mailbox: each
 * message is handled synchronously on the sender's thread and the result is returned to the
 * sender, so implementations must be safe for concurrent use.
 *
 * <p>Embedders make native agents available to Komrad code by registering a {@link Factory} with
 * {@link VirtualMachine#registerNative}; {@code spawn Name} then calls the factory.
 */
public abstract class NativeAgent extends Actor {

  /** Creates a NativeAgent in response to {@code spawn}. */
  @FunctionalInterface
  public interface Factory {
    /**
     * Returns a new agent.
     *
     * @param config the configuration given to {@code spawn}, or an empty mapping
     */
    NativeAgent create(VirtualMachine vm, MappingValue config) throws EvalError;
  }

  private final String name;
  private volatile boolean stopped;

  protected NativeAgent(VirtualMachine vm, String name) {
    super(vm);
    this.name = name;
  }

  /**
   * Handles {@code message} and returns the result. Messages this agent does not understand should
   * be reported with {@link VirtualMachine#reportUnhandled} rather than thrown.
   */
  public abstract Value receive(Message message) throws EvalError;

  /** The VirtualMachine this agent belongs to. */
  protected final VirtualMachine vm() {
    return vm;
  }

  @Override
  public String typeName() {
    return name;
  }

  @Override
  public boolean isAlive() {
    return !stopped;
  }

  @Override
  public void stop() {
    stopped = true;
  }
}
