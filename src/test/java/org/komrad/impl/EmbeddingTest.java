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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.komrad.testing.TestMonitor;

/** Tests of the VirtualMachine methods an embedding Java program uses. */
@RunWith(JUnit4.class)
public class EmbeddingTest {

  private static final String AGENTS =
      """
      agent Counter {
        count: Int = 0
        step = 1
        [inc] { count = count + step }
        [add _(n: Int)] { count = count + n }
      }

      agent Log {
        items = []
        [log _x] { items = List append items x }
      }
      """;

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private final TestMonitor monitor = new TestMonitor();
  private final List<VirtualMachine> vms = new ArrayList<>();

  private VirtualMachine newVm(RuntimeOptions.Builder builder) throws Exception {
    builder.setOut(new PrintStream(output, true, UTF_8)).setSink(monitor);
    VirtualMachine vm = new VirtualMachine(builder.build());
    vms.add(vm);
    vm.load(AGENTS, "agents.kom");
    return vm;
  }

  private VirtualMachine newVm() throws Exception {
    return newVm(RuntimeOptions.builder());
  }

  @After
  public void closeVms() {
    vms.forEach(VirtualMachine::close);
  }

  @Test
  public void spawnAndSend() throws Exception {
    VirtualMachine vm = newVm();
    AgentRef counter = vm.spawn("Counter", ImmutableMap.of("step", 5));
    vm.send(counter, new WordValue("inc"));
    vm.send(counter, Message.of("add", IntValue.of(2)));
    assertThat(vm.awaitQuiescence(5, TimeUnit.SECONDS)).isTrue();
    assertThat(vm.fields(counter))
        .containsExactly("count", IntValue.of(7), "step", IntValue.of(5))
        .inOrder();
    assertThat(monitor.diagnostics()).isEmpty();
  }

  @Test
  public void messagesFromOneSenderAreHandledInOrder() throws Exception {
    VirtualMachine vm = newVm();
    AgentRef log = vm.spawn("Log", ImmutableMap.of());
    ImmutableList.Builder<Value> sent = ImmutableList.builder();
    for (int i = 0; i < 200; i++) {
      vm.send(log, Message.of("log", IntValue.of(i)));
      sent.add(IntValue.of(i));
    }
    assertThat(vm.awaitQuiescence(5, TimeUnit.SECONDS)).isTrue();
    assertThat(vm.fields(log).get("items")).isEqualTo(new ListValue(sent.build()));
    assertThat(vm.tracker().handled()).isEqualTo(200);
  }

  @Test
  public void typedHoleRejectsOtherTypes() throws Exception {
    VirtualMachine vm = newVm();
    AgentRef counter = vm.spawn("Counter", ImmutableMap.of());
    vm.send(counter, Message.of("add", new StringValue("two")));
    assertThat(vm.awaitQuiescence(5, TimeUnit.SECONDS)).isTrue();
    assertThat(monitor.ofKind(Diagnostic.Kind.UNHANDLED_MESSAGE)).hasSize(1);
    assertThat(vm.fields(counter).get("count")).isEqualTo(IntValue.ZERO);
    assertThat(vm.tracker().unhandled()).isEqualTo(1);
  }

  @Test
  public void spawnUnknownAgent() throws Exception {
    VirtualMachine vm = newVm();
    EvalError e = assertThrows(EvalError.class, () -> vm.spawn("Nobody", ImmutableMap.of()));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.UNKNOWN_AGENT);
    assertThat(e).hasMessageThat().isEqualTo("No agent named Nobody");
  }

  @Test
  public void spawnChecksFieldTypes() throws Exception {
    VirtualMachine vm = newVm();
    EvalError e =
        assertThrows(EvalError.class, () -> vm.spawn("Counter", ImmutableMap.of("count", "many")));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.TYPE_MISMATCH);
    assertThat(e).hasMessageThat().isEqualTo("count should be Int, got \"many\"");
  }

  @Test
  public void spawnWithMappingConfig() throws Exception {
    VirtualMachine vm = newVm();
    MappingValue config =
        MappingValue.of(ImmutableMap.<Value, Value>of(new WordValue("step"), IntValue.of(3)));
    AgentRef counter = vm.spawn("Counter", config);
    assertThat(vm.fields(counter).get("step")).isEqualTo(IntValue.of(3));
  }

  @Test
  public void sendToStoppedAgent() throws Exception {
    VirtualMachine vm = newVm();
    AgentRef counter = vm.spawn("Counter", ImmutableMap.of());
    vm.stop(counter);
    assertThat(counter.actor().isAlive()).isFalse();
    Message inc = Message.of("inc");
    DeliveryError e = assertThrows(DeliveryError.class, () -> vm.send(counter, inc));
    assertThat(e.target()).isSameInstanceAs(counter);
    assertThat(e.undelivered()).isEqualTo(inc);
    assertThat(vm.tracker().undeliverable()).isEqualTo(1);
  }

  @Test
  public void stopDiscardsQueuedMessages() throws Exception {
    List<Runnable> pending = new ArrayList<>();
    VirtualMachine vm = newVm(RuntimeOptions.builder().setExecutor(pending::add));
    AgentRef counter = vm.spawn("Counter", ImmutableMap.of());
    for (int i = 0; i < 3; i++) {
      vm.send(counter, new WordValue("inc"));
    }
    // Only the first message schedules a drain.
    assertThat(pending).hasSize(1);
    assertThat(vm.tracker().isQuiescent()).isFalse();
    vm.stop(counter);
    pending.forEach(Runnable::run);
    assertThat(vm.tracker().isQuiescent()).isTrue();
    assertThat(vm.tracker().dropped()).isEqualTo(3);
    assertThat(vm.tracker().handled()).isEqualTo(0);
    assertThat(vm.fields(counter).get("count")).isEqualTo(IntValue.ZERO);
  }

  @Test
  public void drainBatchYieldsTheThread() throws Exception {
    List<Runnable> pending = new ArrayList<>();
    VirtualMachine vm =
        newVm(RuntimeOptions.builder().setExecutor(pending::add).setDrainBatch(2));
    AgentRef counter = vm.spawn("Counter", ImmutableMap.of());
    for (int i = 0; i < 5; i++) {
      vm.send(counter, new WordValue("inc"));
    }
    int drains = 0;
    while (!pending.isEmpty()) {
      pending.remove(0).run();
      drains++;
    }
    assertThat(drains).isEqualTo(3);
    assertThat(vm.fields(counter).get("count")).isEqualTo(IntValue.of(5));
  }

  @Test
  public void loadReturnsTheModule() throws Exception {
    VirtualMachine vm = newVm();
    AgentRef module = vm.load("x = 1\ny = x + 1\n", "module.kom");
    assertThat(module.typeName()).isEqualTo("module.kom");
    assertThat(vm.fields(module)).containsExactly("x", IntValue.ONE, "y", IntValue.of(2));
  }

  @Test
  public void sendToSystemAgent() throws Exception {
    VirtualMachine vm = newVm();
    AgentRef io = vm.systemAgent("Io");
    assertThat(io).isNotNull();
    vm.send(io, Message.of("println", new StringValue("hello")));
    assertThat(output.toString(UTF_8)).isEqualTo("hello\n");
    assertThat(vm.systemAgent("Nobody")).isNull();
  }

  @Test
  public void refsBelongToOneVm() throws Exception {
    VirtualMachine vm1 = newVm();
    VirtualMachine vm2 = newVm();
    AgentRef counter = vm1.spawn("Counter", ImmutableMap.of());
    assertThrows(IllegalArgumentException.class, () -> vm2.send(counter, Message.of("inc")));
  }

  /** A native agent that prefixes the last term of each message it receives. */
  private static final class Echo extends NativeAgent {
    private final String prefix;

    Echo(VirtualMachine vm, MappingValue config) {
      super(vm, "Echo");
      Value prefix = config.get(new StringValue("prefix"));
      this.prefix = (prefix == null) ? "" : prefix.display();
    }

    @Override
    public Value receive(Message message) {
      return new StringValue(prefix + message.term(message.size() - 1).display());
    }
  }

  @Test
  public void nativeAgent() throws Exception {
    VirtualMachine vm = newVm();
    vm.registerNative("Echo", Echo::new);
    assertThrows(IllegalArgumentException.class, () -> vm.registerNative("Echo", Echo::new));
    vm.load(
        """
        [main] {
          e = spawn Echo { prefix = "> " }
          Io println (e say "hi")
          Agent stop e
          e say "again"
        }
        """,
        "echo.kom");
    assertThat(vm.awaitQuiescence(5, TimeUnit.SECONDS)).isTrue();
    assertThat(output.toString(UTF_8)).isEqualTo("> hi\n");
    assertThat(monitor.ofKind(Diagnostic.Kind.DELIVERY_ERROR)).hasSize(1);
  }
}
