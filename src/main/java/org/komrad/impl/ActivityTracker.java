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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * An ActivityTracker counts what the agents of a VirtualMachine have done, keeps the diagnostics
 * they reported, and tracks the number of messages that have been enqueued but not yet finished
 * so that callers can wait for the computation to go quiet.
 *
 * <p>Every message that is enqueued is eventually finished exactly once: by being handled, by
 * failing to match a handler, by its handler failing, or by being dropped because its target was
 * stopped.
 */
public final class ActivityTracker {

  /** The number of agent instances (including modules and native agents) that were created. */
  @GuardedBy("this")
  private long spawned;

  /** The number of messages that were enqueued. */
  @GuardedBy("this")
  private long delivered;

  /** The number of enqueued messages whose handler ran to completion. */
  @GuardedBy("this")
  private long handled;

  /** The number of UNHANDLED_MESSAGE diagnostics. */
  @GuardedBy("this")
  private long unhandled;

  /** The number of EVAL_ERROR diagnostics plus unexpected exceptions. */
  @GuardedBy("this")
  private long failed;

  /** The number of enqueued messages that were discarded because their target was stopped. */
  @GuardedBy("this")
  private long dropped;

  /** The number of sends to a stopped agent. */
  @GuardedBy("this")
  private long undeliverable;

  /** Enqueued messages that have not yet been finished. */
  @GuardedBy("this")
  private int inFlight;

  @GuardedBy("this")
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  synchronized void recordSpawn() {
    spawned++;
  }

  synchronized void recordEnqueued() {
    delivered++;
    inFlight++;
  }

  synchronized void recordHandled() {
    handled++;
  }

  synchronized void recordFailure() {
    failed++;
  }

  synchronized void recordUndeliverable() {
    undeliverable++;
  }

  synchronized void recordDropped() {
    dropped++;
    recordFinished();
  }

  /** Called once for each enqueued message, after it has been processed or dropped. */
  synchronized void recordFinished() {
    Preconditions.checkState(inFlight > 0);
    if (--inFlight == 0) {
      notifyAll();
    }
  }

  synchronized void recordDiagnostic(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
    switch (diagnostic.kind()) {
      case EVAL_ERROR -> failed++;
      case UNHANDLED_MESSAGE -> unhandled++;
      case DELIVERY_ERROR -> undeliverable++;
      case PARSE_ERROR -> {}
    }
  }

  /** Returns the diagnostics reported since the last call, in the order they were reported. */
  public synchronized ImmutableList<Diagnostic> takeDiagnostics() {
    ImmutableList<Diagnostic> result = ImmutableList.copyOf(diagnostics);
    diagnostics.clear();
    return result;
  }

  /**
   * Waits until no enqueued message is waiting or running. Returns false if the timeout expired
   * first.
   */
  public synchronized boolean awaitQuiescence(long timeout, TimeUnit unit)
      throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    while (inFlight != 0) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return false;
      }
      TimeUnit.NANOSECONDS.timedWait(this, remaining);
    }
    return true;
  }

  public synchronized boolean isQuiescent() {
    return inFlight == 0;
  }

  public synchronized long spawned() {
    return spawned;
  }

  public synchronized long delivered() {
    return delivered;
  }

  public synchronized long handled() {
    return handled;
  }

  public synchronized long unhandled() {
    return unhandled;
  }

  public synchronized long failed() {
    return failed;
  }

  public synchronized long dropped() {
    return dropped;
  }

  public synchronized long undeliverable() {
    return undeliverable;
  }

  @Override
  public synchronized String toString() {
    return String.format(
        "spawned=%d delivered=%d handled=%d unhandled=%d failed=%d dropped=%d undeliverable=%d",
        spawned, delivered, handled, unhandled, failed, dropped, undeliverable);
  }
}
