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

/**
 * The argument passed to an {@link SystemAgent.Intrinsic} method: the message being handled, the
 * values bound by the matching pattern's holes, and access to the VirtualMachine.
 *
 * <p>The typed accessors throw a {@code TYPE_MISMATCH} EvalError if the bound value does not have
 * the expected type.
 */
public final class IntrinsicCall {

  private final SystemAgent agent;
  private final Message message;
  private final Scope bindings;

  IntrinsicCall(SystemAgent agent, Message message, Scope bindings) {
    this.agent = agent;
    this.message = message;
    this.bindings = bindings;
  }

  public VirtualMachine vm() {
    return agent.vm;
  }

  public RuntimeOptions options() {
    return agent.vm.options;
  }

  public Message message() {
    return message;
  }

  /** Returns the value bound to the hole {@code _name}. */
  public Value arg(String name) {
    Value v = bindings.lookup(name);
    Preconditions.checkArgument(v != null, "No hole named %s in %s", name, message);
    return v;
  }

  public String string(String name) throws EvalError {
    if (arg(name) instanceof StringValue s) {
      return s.value;
    }
    throw typeMismatch(name, "a string");
  }

  /** Returns the text of a string or word argument. */
  public String text(String name) throws EvalError {
    Value v = arg(name);
    if (v instanceof StringValue s) {
      return s.value;
    } else if (v instanceof WordValue w) {
      return w.text();
    }
    throw typeMismatch(name, "a string or word");
  }

  public long integer(String name) throws EvalError {
    if (arg(name) instanceof IntValue i) {
      return i.value();
    }
    throw typeMismatch(name, "an integer");
  }

  /** Returns an int or float argument as a double. */
  public double number(String name) throws EvalError {
    Value v = arg(name);
    if (v instanceof IntValue i) {
      return i.value();
    } else if (v instanceof FloatValue f) {
      return f.value();
    }
    throw typeMismatch(name, "a number");
  }

  public boolean bool(String name) throws EvalError {
    if (arg(name) instanceof BoolValue b) {
      return b.asBoolean();
    }
    throw typeMismatch(name, "a boolean");
  }

  public ListValue list(String name) throws EvalError {
    if (arg(name) instanceof ListValue list) {
      return list;
    }
    throw typeMismatch(name, "a list");
  }

  public MappingValue mapping(String name) throws EvalError {
    if (arg(name) instanceof MappingValue mapping) {
      return mapping;
    }
    throw typeMismatch(name, "a mapping");
  }

  public AgentRef agent(String name) throws EvalError {
    if (arg(name) instanceof AgentRef ref) {
      return ref;
    }
    throw typeMismatch(name, "an agent");
  }

  /**
   * Spawns the named agent on behalf of the Komrad code that sent this message, so that the new
   * agent's initializers count toward the sender's nesting depth.
   */
  public AgentRef spawn(String name, MappingValue config) throws EvalError {
    return agent.vm.spawnAgent(
        name, VirtualMachine.configEntries(config), agent.vm.nativeCaller.get());
  }

  /** Returns an EvalError describing an argument with the wrong type. */
  public EvalError typeMismatch(String name, String expected) {
    return new EvalError(
        EvalError.Kind.TYPE_MISMATCH,
        "%s %s: expected %s for _%s, got %s",
        agent.typeName(),
        message.term(0),
        expected,
        name,
        arg(name));
  }

  /** Returns an EvalError with kind INTRINSIC_FAILURE caused by {@code cause}. */
  public EvalError failure(Throwable cause) {
    return new EvalError(
        EvalError.Kind.INTRINSIC_FAILURE,
        agent.typeName() + " " + message.term(0) + ": " + cause.getMessage(),
        cause);
  }

  /** Returns an EvalError with kind INTRINSIC_FAILURE. */
  public EvalError failure(String format, Object... args) {
    return new EvalError(
        EvalError.Kind.INTRINSIC_FAILURE,
        agent.typeName() + " " + message.term(0) + ": " + format,
        args);
  }
}
