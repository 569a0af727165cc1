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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Map;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.komrad.impl.AgentRef;
import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.FloatValue;
import org.komrad.impl.IntValue;
import org.komrad.impl.ListValue;
import org.komrad.impl.Message;
import org.komrad.impl.NativeAgent;
import org.komrad.impl.NoneValue;
import org.komrad.impl.RuntimeOptions;
import org.komrad.impl.StringValue;
import org.komrad.impl.Value;
import org.komrad.impl.VirtualMachine;
import org.komrad.impl.WordValue;

/** Tests for the Io, Agent and Assert system agents. */
@RunWith(JUnit4.class)
public class CoreAgentsTest {

  private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  private VirtualMachine vm;

  @Before
  public void setUp() throws Exception {
    PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    vm = new VirtualMachine(RuntimeOptions.builder().setOut(out).build());
    vm.load("agent Counter { count = 0\n [inc] { count = count + 1 } }", "core");
  }

  @After
  public void close() {
    vm.close();
  }

  private Value send(String agent, String selector, Value... rest) throws EvalError {
    return ((NativeAgent) vm.systemAgent(agent).actor()).receive(Message.of(selector, rest));
  }

  private String output() {
    return bytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void io() throws EvalError {
    send("Io", "print", new StringValue("a "));
    send("Io", "println", ListValue.of(new StringValue("b"), IntValue.ONE));
    send("Io", "println");
    assertThat(output()).isEqualTo("a [b, 1]" + System.lineSeparator() + System.lineSeparator());
  }

  @Test
  public void spawnAndStop() throws Exception {
    Value v = send("Agent", "new", new WordValue("Counter"));
    assertThat(v).isInstanceOf(AgentRef.class);
    AgentRef counter = (AgentRef) v;
    assertThat(send("Agent", "name", counter)).isEqualTo(new StringValue("Counter"));
    assertThat(send("Agent", "is-alive", counter)).isEqualTo(BoolValue.TRUE);
    vm.send(counter, new WordValue("inc"));
    assertThat(vm.awaitQuiescence(5, TimeUnit.SECONDS)).isTrue();
    assertThat(vm.fields(counter)).containsEntry("count", IntValue.ONE);
    assertThat(send("Agent", "stop", counter)).isEqualTo(NoneValue.NONE);
    assertThat(send("Agent", "is-alive", counter)).isEqualTo(BoolValue.FALSE);
  }

  @Test
  public void spawnWithConfig() throws Exception {
    AgentRef counter =
        (AgentRef)
            send(
                "Agent",
                "new",
                new StringValue("Counter"),
                Value.of(Map.of("count", 41)));
    assertThat(vm.fields(counter)).containsEntry("count", IntValue.of(41));
  }

  @Test
  public void systemAgentsCannotBeStopped() throws EvalError {
    AgentRef io = vm.systemAgent("Io");
    EvalError e = assertThrows(EvalError.class, () -> send("Agent", "stop", io));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.TYPE_MISMATCH);
    assertThat(send("Agent", "is-alive", io)).isEqualTo(BoolValue.TRUE);
    assertThrows(IllegalArgumentException.class, () -> vm.stop(io));
    assertThat(io.actor().isAlive()).isTrue();
  }

  @Test
  public void spawnRequiresAnAgentName() {
    EvalError e = assertThrows(EvalError.class, () -> send("Agent", "new", IntValue.ONE));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.TYPE_MISMATCH);
    assertThat(assertThrows(EvalError.class, () -> send("Agent", "stop", IntValue.ONE)).kind())
        .isEqualTo(EvalError.Kind.TYPE_MISMATCH);
  }

  @Test
  public void assertions() throws EvalError {
    assertThat(send("Assert", "true", BoolValue.TRUE)).isEqualTo(NoneValue.NONE);
    assertThat(send("Assert", "equal", IntValue.ONE, new FloatValue(1)))
        .isEqualTo(NoneValue.NONE);
    EvalError e = assertThrows(EvalError.class, () -> send("Assert", "true", IntValue.ONE));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.ASSERTION_FAILED);
    assertThat(e).hasMessageThat().isEqualTo("Expected true, got 1");
    e = assertThrows(EvalError.class, () -> send("Assert", "equal", IntValue.ONE, IntValue.ZERO));
    assertThat(e).hasMessageThat().isEqualTo("Expected 1 to equal 0");
    assertThat(vm.tracker().unhandled()).isEqualTo(0);
  }
}
