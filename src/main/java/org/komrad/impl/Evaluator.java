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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.komrad.ast.Expr;
import org.komrad.ast.Statement;

/**
 * Evaluates expressions and statement sequences against a Scope, on behalf of the agent identified
 * by an {@link Activation}.
 *
 * <p>Names are resolved through the scope chain, then {@code self}, then the VirtualMachine's
 * system agents. An unbound name in the target position of a send makes the send a synchronous
 * self-send, and in a term position evaluates to a word; anywhere else it is an error.
 */
final class Evaluator {

  private final VirtualMachine vm;

  Evaluator(VirtualMachine vm) {
    this.vm = vm;
  }

  /**
   * Runs {@code statements} in order and returns the value of the last one ({@code none} if there
   * are none). An EvalError stops the sequence and is annotated with the failing statement's
   * location.
   */
  Value run(List<Statement> statements, Scope scope, Activation activation) throws EvalError {
    Value result = NoneValue.NONE;
    for (Statement statement : statements) {
      try {
        result = statement(statement.expr(), scope, activation);
      } catch (EvalError e) {
        throw e.atLocation(statement.location());
      }
    }
    return result;
  }

  /** A bare unbound name used as a statement is a self-send with no further terms. */
  private Value statement(Expr expr, Scope scope, Activation activation) throws EvalError {
    if (expr instanceof Expr.Variable v && resolve(v.name(), scope, activation) == null) {
      return selfSend(Message.of(v.name()), activation);
    }
    return evaluate(expr, scope, activation);
  }

  Value evaluate(Expr expr, Scope scope, Activation activation) throws EvalError {
    if (expr instanceof Expr.Literal lit) {
      return literalValue(lit);
    } else if (expr instanceof Expr.Variable v) {
      Value result = resolve(v.name(), scope, activation);
      if (result == null) {
        throw new EvalError(EvalError.Kind.UNRESOLVED_VARIABLE, "%s is not defined", v.name());
      }
      return result;
    } else if (expr instanceof Expr.Send send) {
      return send(send, scope, activation);
    } else if (expr instanceof Expr.BlockExpr block) {
      return new BlockValue(block, scope);
    } else if (expr instanceof Expr.ListExpr list) {
      ImmutableList.Builder<Value> elements =
          ImmutableList.builderWithExpectedSize(list.elements().size());
      for (Expr element : list.elements()) {
        elements.add(evaluate(element, scope, activation));
      }
      return new ListValue(elements.build());
    } else if (expr instanceof Expr.MappingExpr mapping) {
      Map<Value, Value> entries = new LinkedHashMap<>();
      for (Expr.MappingExpr.Entry entry : mapping.entries()) {
        Value key = evaluate(entry.key(), scope, activation);
        entries.put(key, evaluate(entry.value(), scope, activation));
      }
      return MappingValue.of(entries);
    } else if (expr instanceof Expr.Binary binary) {
      return binary(binary, scope, activation);
    } else if (expr instanceof Expr.Unary unary) {
      return Operators.unary(unary.op(), evaluate(unary.operand(), scope, activation));
    } else if (expr instanceof Expr.Spawn spawn) {
      return spawn(spawn, scope, activation);
    } else if (expr instanceof Expr.Expand expand) {
      return expand(evaluate(expand.block(), scope, activation), activation);
    } else if (expr instanceof Expr.EmbeddedText text) {
      return new StringValue(text.text());
    } else if (expr instanceof Expr.Assignment assignment) {
      Value value = evaluate(assignment.value(), scope, activation);
      scope.assign(assignment.name(), value);
      return value;
    } else if (expr instanceof Expr.FieldDecl field) {
      Value value = evaluate(field.value(), scope, activation);
      checkFieldType(field.name(), field.typeName(), value);
      scope.assign(field.name(), value);
      return value;
    }
    // Handler and agent declarations only have an effect when a program is loaded.
    assert expr instanceof Expr.HandlerDecl || expr instanceof Expr.AgentDecl;
    return NoneValue.NONE;
  }

  /** Returns the value of {@code name}, or null if it is unbound. */
  @Nullable Value resolve(String name, Scope scope, Activation activation) {
    Value result = scope.lookup(name);
    if (result != null) {
      return result;
    } else if (name.equals("self")) {
      return activation.self().ref();
    }
    return vm.systemAgent(name);
  }

  /** Evaluates a send term; unbound names become words. */
  private Value term(Expr expr, Scope scope, Activation activation) throws EvalError {
    if (expr instanceof Expr.Variable v) {
      Value result = resolve(v.name(), scope, activation);
      return (result != null) ? result : new WordValue(v.name());
    }
    return evaluate(expr, scope, activation);
  }

  private Value send(Expr.Send send, Scope scope, Activation activation) throws EvalError {
    ImmutableList<Expr> terms = send.terms();
    if (send.target() instanceof Expr.Variable v && resolve(v.name(), scope, activation) == null) {
      ImmutableList.Builder<Value> values = ImmutableList.builderWithExpectedSize(terms.size() + 1);
      values.add(new WordValue(v.name()));
      for (Expr term : terms) {
        values.add(term(term, scope, activation));
      }
      return selfSend(new Message(values.build()), activation);
    }
    Value target = evaluate(send.target(), scope, activation);
    ImmutableList.Builder<Value> values = ImmutableList.builderWithExpectedSize(terms.size());
    for (Expr term : terms) {
      values.add(term(term, scope, activation));
    }
    return deliver(target, new Message(values.build()), activation);
  }

  /**
   * Sends {@code message} to {@code target}. Agent instances enqueue the message and the result is
   * {@code none}; native agents handle it immediately and return their result.
   */
  private Value deliver(Value target, Message message, Activation activation) throws EvalError {
    if (!(target instanceof AgentRef ref)) {
      throw new EvalError(
          EvalError.Kind.NO_HANDLER, "Can't send %s to %s, which is not an agent", message, target);
    }
    Actor actor = ref.actor();
    if (actor instanceof NativeAgent nativeAgent && nativeAgent.isAlive()) {
      Activation previous = vm.nativeCaller.get();
      vm.nativeCaller.set(activation);
      try {
        return nativeAgent.receive(message);
      } finally {
        vm.nativeCaller.set(previous);
      }
    } else if (!(actor instanceof AgentInstance instance && instance.enqueue(message))) {
      vm.report(
          Diagnostic.Kind.DELIVERY_ERROR,
          activation.self(),
          actor + " has been stopped; dropped " + message,
          null);
    }
    return NoneValue.NONE;
  }

  /**
   * Handles {@code message} synchronously with the current agent's handlers, falling back to the
   * handlers of its module, and returns the value of the handler body.
   */
  private Value selfSend(Message message, Activation activation) throws EvalError {
    Activation nested = nest(activation);
    AgentInstance self = activation.self();
    PatternMatcher.Match match =
        vm.matcher.select(self.definition.handlers(), message, self.fields, nested);
    if (match == null && self.moduleHandlers != self.definition.handlers()) {
      match = vm.matcher.select(self.moduleHandlers, message, self.fields, nested);
    }
    if (match == null) {
      vm.reportUnhandled(self, message);
      return NoneValue.NONE;
    }
    return run(match.handler().body(), match.bindings(), nested);
  }

  /**
   * Runs a block's statements. The block's creator runs them in the scope the block captured; any
   * other agent runs them over its own fields, with a copy of the captured bindings, so that only
   * the expanding agent's fields are changed.
   */
  Value expand(Value value, Activation activation) throws EvalError {
    if (!(value instanceof BlockValue block)) {
      throw new EvalError(
          EvalError.Kind.TYPE_MISMATCH, "Can't expand %s, which is not a block", value);
    }
    Activation nested = nest(activation);
    Scope fields = activation.self().fields;
    Scope env = block.env();
    if (env.fieldScope() != fields) {
      env = env.captureOver(fields);
    }
    return run(block.block().body(), env, nested);
  }

  private Activation nest(Activation activation) throws EvalError {
    if (activation.depth() >= vm.options.maxCallDepth) {
      throw new EvalError(
          EvalError.Kind.CALL_DEPTH, "Nesting exceeded %s levels", vm.options.maxCallDepth);
    }
    return activation.deeper();
  }

  private Value binary(Expr.Binary binary, Scope scope, Activation activation) throws EvalError {
    Expr.BinaryOp op = binary.op();
    Value left = evaluate(binary.left(), scope, activation);
    if (op == Expr.BinaryOp.AND || op == Expr.BinaryOp.OR) {
      boolean b = Operators.asBoolean(op.symbol, left);
      // "false && x" and "true || x" don't evaluate x
      if (b == (op == Expr.BinaryOp.OR)) {
        return BoolValue.of(b);
      }
      Value right = evaluate(binary.right(), scope, activation);
      return BoolValue.of(Operators.asBoolean(op.symbol, right));
    }
    return Operators.binary(op, left, evaluate(binary.right(), scope, activation));
  }

  private Value spawn(Expr.Spawn spawn, Scope scope, Activation activation) throws EvalError {
    ImmutableMap<String, Value> config;
    if (spawn.config() != null) {
      config = VirtualMachine.configEntries(evaluate(spawn.config(), scope, activation));
    } else {
      ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
      for (Expr.Assignment field : spawn.fields()) {
        builder.put(field.name(), evaluate(field.value(), scope, activation));
      }
      config = builder.buildKeepingLast();
    }
    return vm.spawnAgent(spawn.agentName(), config, activation);
  }

  static void checkFieldType(String name, String typeName, Value value) throws EvalError {
    if (!BaseType.matches(typeName, value)) {
      throw new EvalError(
          EvalError.Kind.TYPE_MISMATCH, "%s should be %s, got %s", name, typeName, value);
    }
  }

  static Value literalValue(Expr.Literal literal) {
    return Value.of(literal.value());
  }
}
