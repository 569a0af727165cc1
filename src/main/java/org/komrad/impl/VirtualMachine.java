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

import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.komrad.ast.AgentDefinition;
import org.komrad.ast.Expr;
import org.komrad.ast.Location;
import org.komrad.ast.Program;
import org.komrad.ast.Statement;
import org.komrad.compiler.ParseError;
import org.komrad.compiler.Parser;
import org.komrad.impl.system.AssertAgent;
import org.komrad.impl.system.DictAgent;
import org.komrad.impl.system.FsAgent;
import org.komrad.impl.system.IoAgent;
import org.komrad.impl.system.JsonAgent;
import org.komrad.impl.system.LifecycleAgent;
import org.komrad.impl.system.ListAgent;
import org.komrad.impl.system.NumberAgent;

/**
 * A VirtualMachine loads Komrad programs and runs their agents.
 *
 * <p>Each VirtualMachine has its own registry of agent definitions, its own system agents and
 * native agent factories, and its own ActivityTracker; agents run on the executor given by its
 * RuntimeOptions.
 *
 * <p>A typical embedding:
 *
 * <pre>{@code
 * try (VirtualMachine vm = new VirtualMachine()) {
 *   vm.load(source, "counter.kom");
 *   vm.awaitQuiescence(10, TimeUnit.SECONDS);
 * }
 * }</pre>
 */
public final class VirtualMachine implements AutoCloseable {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  final RuntimeOptions options;
  final ActivityTracker tracker = new ActivityTracker();
  final Evaluator evaluator = new Evaluator(this);
  final PatternMatcher matcher = new PatternMatcher(evaluator);

  /** While a NativeAgent handles a send from Komrad code, the sender's activation. */
  final ThreadLocal<Activation> nativeCaller = new ThreadLocal<>();

  /** An agent definition and the handlers of the module that declared it. */
  private record Registered(
      AgentDefinition definition, ImmutableList<Expr.HandlerDecl> moduleHandlers) {}

  private final Map<String, Registered> definitions = new ConcurrentHashMap<>();
  private final Map<String, NativeAgent.Factory> natives = new ConcurrentHashMap<>();
  private final ImmutableMap<String, SystemAgent> systemAgents;

  public VirtualMachine() {
    this(RuntimeOptions.defaults());
  }

  public VirtualMachine(RuntimeOptions options) {
    this.options = options;
    this.systemAgents =
        ImmutableList.of(
                new SystemAgent(this, "Io", IoAgent.class),
                new SystemAgent(this, "Fs", FsAgent.class),
                new SystemAgent(this, "Number", NumberAgent.class),
                new SystemAgent(this, "Json", JsonAgent.class),
                new SystemAgent(this, "Dict", DictAgent.class),
                new SystemAgent(this, "List", ListAgent.class),
                new SystemAgent(this, "Assert", AssertAgent.class),
                new SystemAgent(this, "Agent", LifecycleAgent.class))
            .stream()
            .collect(toImmutableMap(SystemAgent::typeName, a -> a));
  }

  public RuntimeOptions options() {
    return options;
  }

  public ActivityTracker tracker() {
    return tracker;
  }

  /** Parses {@code source} and loads it with {@link #load(Program)}. */
  @CanIgnoreReturnValue
  public AgentRef load(String source, String name) throws ParseError {
    Program program;
    try {
      program = Parser.parse(source, name);
    } catch (ParseError e) {
      logger.atWarning().log("Failed to parse %s: %s", name, e.getMessage());
      throw e;
    }
    return load(program);
  }

  /**
   * Registers the program's agent definitions, then creates an agent for the program itself (its
   * "module") whose handlers are the program's top-level handlers. The program's other top-level
   * statements run as the module's initializers, on the calling thread; if one of them fails the
   * rest are skipped and the failure is reported. Finally, if the module has a handler for {@code
   * [main]}, that message is sent to it.
   *
   * <p>Returns a reference to the module.
   */
  @CanIgnoreReturnValue
  public AgentRef load(Program program) {
    ImmutableList<Expr.HandlerDecl> moduleHandlers = program.handlers();
    for (AgentDefinition definition : program.agents()) {
      logger.atFine().log("Registering agent %s from %s", definition.name(), program.name());
      definitions.put(definition.name(), new Registered(definition, moduleHandlers));
    }
    ImmutableList<Statement> body = program.body();
    AgentDefinition moduleDefinition =
        new AgentDefinition(
            program.name(),
            body,
            moduleHandlers,
            body.stream()
                .filter(s -> s.expr() instanceof Expr.FieldDecl)
                .map(s -> (Expr.FieldDecl) s.expr())
                .collect(
                    toImmutableMap(
                        Expr.FieldDecl::name, Expr.FieldDecl::typeName, (t1, t2) -> t2)),
            body.isEmpty() ? Location.NONE : body.get(0).location());
    AgentInstance module = new AgentInstance(this, moduleDefinition, moduleHandlers);
    tracker.recordSpawn();
    try {
      evaluator.run(body, module.fields, new Activation(module, 0));
    } catch (EvalError e) {
      report(Diagnostic.Kind.EVAL_ERROR, module, e.describe(), e.location());
    }
    module.start();
    if (moduleHandlers.stream()
        .anyMatch(h -> h.pattern().arity() == 1 && h.pattern().startsWith("main"))) {
      module.enqueue(Message.of("main"));
    }
    return module.ref();
  }

  /**
   * Creates an agent from the definition or native factory with the given name. The definition's
   * initializers run first, then each entry of {@code config} replaces the corresponding field.
   */
  @CanIgnoreReturnValue
  public AgentRef spawn(String name, Map<String, ?> config) throws EvalError {
    ImmutableMap.Builder<String, Value> values = ImmutableMap.builder();
    config.forEach((k, v) -> values.put(k, Value.of(v)));
    return spawnAgent(name, values.buildOrThrow(), null);
  }

  /**
   * Like {@link #spawn(String, Map)}, with the configuration given as a mapping whose keys are
   * strings or words.
   */
  @CanIgnoreReturnValue
  public AgentRef spawn(String name, MappingValue config) throws EvalError {
    return spawnAgent(name, configEntries(config), null);
  }

  /**
   * Creates an agent. If {@code spawner} is non-null the new instance's initializers run one level
   * deeper than it, so that agents spawning each other from their initializers fail with {@code
   * CALL_DEPTH} rather than exhausting the stack.
   */
  AgentRef spawnAgent(
      String name, ImmutableMap<String, Value> config, @Nullable Activation spawner)
      throws EvalError {
    int depth = (spawner == null) ? 0 : spawner.depth() + 1;
    if (depth > options.maxCallDepth) {
      throw new EvalError(
          EvalError.Kind.CALL_DEPTH, "Nesting exceeded %s levels", options.maxCallDepth);
    }
    Registered registered = definitions.get(name);
    if (registered == null) {
      NativeAgent.Factory factory = natives.get(name);
      if (factory == null) {
        throw new EvalError(EvalError.Kind.UNKNOWN_AGENT, "No agent named %s", name);
      }
      NativeAgent agent = factory.create(this, asMapping(config));
      tracker.recordSpawn();
      logger.atFine().log("Spawned native %s", agent);
      return agent.ref();
    }
    AgentDefinition definition = registered.definition;
    AgentInstance instance = new AgentInstance(this, definition, registered.moduleHandlers);
    tracker.recordSpawn();
    try {
      evaluator.run(definition.initializers(), instance.fields, new Activation(instance, depth));
      for (Map.Entry<String, Value> entry : config.entrySet()) {
        String type = definition.fieldType(entry.getKey());
        if (type != null) {
          Evaluator.checkFieldType(entry.getKey(), type, entry.getValue());
        }
        instance.fields.bind(entry.getKey(), entry.getValue());
      }
    } catch (EvalError e) {
      // Discard anything the initializers sent to the new instance.
      instance.stop();
      instance.start();
      throw e;
    }
    instance.start();
    logger.atFine().log("Spawned %s", instance);
    return instance.ref();
  }

  /**
   * Converts a spawn configuration (a mapping whose keys are strings or words) to a map from field
   * names to values.
   */
  static ImmutableMap<String, Value> configEntries(Value config) throws EvalError {
    if (!(config instanceof MappingValue mapping)) {
      throw new EvalError(
          EvalError.Kind.TYPE_MISMATCH, "Agent configuration should be a mapping, got %s", config);
    }
    ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
    for (Map.Entry<Value, Value> entry : mapping.entries().entrySet()) {
      Value key = entry.getKey();
      if (key instanceof StringValue s) {
        builder.put(s.value, entry.getValue());
      } else if (key instanceof WordValue w) {
        builder.put(w.text(), entry.getValue());
      } else {
        throw new EvalError(
            EvalError.Kind.TYPE_MISMATCH, "Field names should be strings, got %s", key);
      }
    }
    return builder.buildKeepingLast();
  }

  private static MappingValue asMapping(ImmutableMap<String, Value> config) {
    Map<Value, Value> entries = new LinkedHashMap<>();
    config.forEach((k, v) -> entries.put(new StringValue(k), v));
    return MappingValue.of(entries);
  }

  /**
   * Makes agents created by {@code factory} available to {@code spawn name}. Agent definitions
   * with the same name take precedence.
   */
  public void registerNative(String name, NativeAgent.Factory factory) {
    Preconditions.checkArgument(
        natives.putIfAbsent(name, factory) == null, "Duplicate native agent %s", name);
  }

  /** Returns the system agent with the given name, or null. */
  public @Nullable AgentRef systemAgent(String name) {
    SystemAgent agent = systemAgents.get(name);
    return (agent == null) ? null : agent.ref();
  }

  /**
   * Sends {@code message} to {@code target}. Messages to an agent instance are queued; a native
   * agent handles the message before this method returns, and any error it reports becomes a
   * diagnostic.
   *
   * <p>Messages sent from one thread to one agent instance are handled in the order they were sent.
   *
   * @throws DeliveryError if {@code target} has been stopped
   */
  public void send(AgentRef target, Message message) throws DeliveryError {
    Actor actor = target.actor();
    Preconditions.checkArgument(actor.vm == this, "%s belongs to another VirtualMachine", target);
    if (actor instanceof NativeAgent nativeAgent && nativeAgent.isAlive()) {
      try {
        nativeAgent.receive(message);
      } catch (EvalError e) {
        report(Diagnostic.Kind.EVAL_ERROR, nativeAgent, e.describe(), e.location());
      }
    } else if (!(actor instanceof AgentInstance instance && instance.enqueue(message))) {
      tracker.recordUndeliverable();
      throw new DeliveryError(target, message);
    }
  }

  /** Equivalent to {@code send(target, Message.of(terms))}. */
  public void send(AgentRef target, Value... terms) throws DeliveryError {
    send(target, Message.of(terms));
  }

  /**
   * Stops the given agent; messages already queued for it are discarded. System agents are shared
   * by every agent of this VirtualMachine and cannot be stopped.
   */
  public void stop(AgentRef target) {
    Preconditions.checkArgument(
        !(target.actor() instanceof SystemAgent), "Can't stop system agent %s", target);
    target.actor().stop();
  }

  /** Returns a snapshot of the fields of an agent instance, sorted by name. */
  public ImmutableSortedMap<String, Value> fields(AgentRef target) {
    Preconditions.checkArgument(
        target.actor() instanceof AgentInstance, "%s is a native agent", target);
    return ((AgentInstance) target.actor()).fields.snapshot();
  }

  /**
   * Waits until every message that has been queued has been handled (or dropped). Returns false if
   * the timeout expired first.
   */
  public boolean awaitQuiescence(long timeout, TimeUnit unit) throws InterruptedException {
    return tracker.awaitQuiescence(timeout, unit);
  }

  /** Reports an UNHANDLED_MESSAGE diagnostic for a message {@code agent} had no handler for. */
  public void reportUnhandled(Actor agent, Message message) {
    report(Diagnostic.Kind.UNHANDLED_MESSAGE, agent, "No handler for " + message, null);
  }

  void report(Diagnostic.Kind kind, Actor agent, String text, @Nullable Location location) {
    Diagnostic diagnostic = new Diagnostic(kind, agent.toString(), text, location);
    logger.atWarning().log("%s", diagnostic);
    tracker.recordDiagnostic(diagnostic);
    options.sink.report(diagnostic);
  }

  /** Shuts down the executor if it was created for this VirtualMachine's options. */
  @Override
  public void close() {
    options.shutdownExecutor();
  }
}
