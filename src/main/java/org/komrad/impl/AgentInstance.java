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
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.Keep;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.komrad.ast.AgentDefinition;
import org.komrad.ast.Expr;

/**
 * An AgentInstance is a running agent created from an {@link AgentDefinition}. It owns a field
 * scope, an unbounded FIFO mailbox, and a single logical thread of control: at most one drain task
 * for it is queued or running on the VirtualMachine's executor at any time, and that task
 * processes messages one at a time, each to completion.
 *
 * <p>The {@code scheduled} flag is true while a drain task is queued or running. Whoever flips it
 * from false to true must submit the task; the task clears it when it finishes and then checks the
 * mailbox again, since a message may have arrived after the task's last poll. A new instance
 * starts with the flag set, so that messages sent to it while its initializers are running wait
 * until {@link #start} is called.
 */
final class AgentInstance extends Actor {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  final AgentDefinition definition;

  /**
   * The handlers of the module that declared this agent's definition; tried after the agent's own
   * handlers for self-sends.
   */
  final ImmutableList<Expr.HandlerDecl> moduleHandlers;

  final Scope fields = Scope.newFieldScope();

  private final ConcurrentLinkedQueue<Message> mailbox = new ConcurrentLinkedQueue<>();

  @Keep private boolean scheduled = true;

  private volatile boolean stopped;

  private static final VarHandle SCHEDULED =
      Handle.forVar(MethodHandles.lookup(), AgentInstance.class, "scheduled", boolean.class);

  AgentInstance(
      VirtualMachine vm,
      AgentDefinition definition,
      ImmutableList<Expr.HandlerDecl> moduleHandlers) {
    super(vm);
    this.definition = definition;
    this.moduleHandlers = moduleHandlers;
  }

  @Override
  public String typeName() {
    return definition.name();
  }

  @Override
  public boolean isAlive() {
    return !stopped;
  }

  /**
   * Adds {@code message} to the mailbox and schedules a drain if none is pending. Returns false
   * (and does nothing) if this instance has been stopped.
   */
  boolean enqueue(Message message) {
    if (stopped) {
      return false;
    }
    vm.tracker.recordEnqueued();
    mailbox.add(message);
    scheduleIfNeeded();
    return true;
  }

  /** Called once, after the initializers have run; until then queued messages just wait. */
  void start() {
    SCHEDULED.setRelease(this, false);
    scheduleIfNeeded();
  }

  /**
   * Marks this instance stopped and discards its queued messages. A handler that is already
   * running completes normally.
   */
  @Override
  public void stop() {
    if (stopped) {
      return;
    }
    stopped = true;
    logger.atFine().log("%s stopped", this);
    for (Message m = mailbox.poll(); m != null; m = mailbox.poll()) {
      vm.tracker.recordDropped();
    }
  }

  private void scheduleIfNeeded() {
    if (!mailbox.isEmpty() && SCHEDULED.compareAndSet(this, false, true)) {
      vm.options.executor.execute(this::drain);
    }
  }

  /** Processes up to {@code drainBatch} messages, then gives up the thread. */
  private void drain() {
    try {
      for (int i = 0; i < vm.options.drainBatch; i++) {
        Message message = mailbox.poll();
        if (message == null) {
          break;
        } else if (stopped) {
          vm.tracker.recordDropped();
        } else {
          try {
            process(message);
          } finally {
            vm.tracker.recordFinished();
          }
        }
      }
    } finally {
      SCHEDULED.setRelease(this, false);
      scheduleIfNeeded();
    }
  }

  /** Runs the first handler whose pattern matches {@code message}. */
  private void process(Message message) {
    logger.atFine().log("%s handling %s", this, message);
    Activation activation = new Activation(this, 0);
    try {
      PatternMatcher.Match match =
          vm.matcher.select(definition.handlers(), message, fields, activation);
      if (match == null) {
        vm.reportUnhandled(this, message);
        return;
      }
      vm.evaluator.run(match.handler().body(), match.bindings(), activation);
      vm.tracker.recordHandled();
    } catch (EvalError e) {
      vm.report(Diagnostic.Kind.EVAL_ERROR, this, e.describe(), e.location());
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("%s failed handling %s", this, message);
      vm.tracker.recordFailure();
    }
  }
}
