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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.komrad.impl.EvalError;
import org.komrad.impl.FloatValue;
import org.komrad.impl.IntValue;
import org.komrad.impl.ListValue;
import org.komrad.impl.MappingValue;
import org.komrad.impl.Message;
import org.komrad.impl.NativeAgent;
import org.komrad.impl.StringValue;
import org.komrad.impl.Value;
import org.komrad.impl.VirtualMachine;
import org.komrad.impl.WordValue;

@RunWith(JUnit4.class)
public class JsonAgentTest {

  private final VirtualMachine vm = new VirtualMachine();

  @After
  public void close() {
    vm.close();
  }

  private Value json(String selector, Value arg) throws EvalError {
    return ((NativeAgent) vm.systemAgent("Json").actor()).receive(Message.of(selector, arg));
  }

  @Test
  public void encode() throws EvalError {
    Value value =
        Value.of(
            ImmutableMap.of(
                "a", ImmutableList.of(1, 2.5, true),
                "b", "x"));
    assertThat(json("encode", value))
        .isEqualTo(new StringValue("{\"a\":[1,2.5,true],\"b\":\"x\"}"));
    MappingValue wordKeys =
        MappingValue.of(ImmutableMap.<Value, Value>of(new WordValue("k"), new WordValue("v")));
    assertThat(json("encode", wordKeys)).isEqualTo(new StringValue("{\"k\":\"v\"}"));
  }

  @Test
  public void decode() throws EvalError {
    Value decoded = json("decode", new StringValue("{\"a\": [1, 2.5, null], \"b\": {}}"));
    assertThat(decoded.toString()).isEqualTo("[\"a\": [1, 2.5, none], \"b\": [:]]");
    assertThat(json("decode", new StringValue("12345678901234567890")))
        .isEqualTo(new FloatValue(1.2345678901234567E19));
    assertThat(json("decode", new StringValue("[]"))).isEqualTo(ListValue.EMPTY);
    assertThat(json("decode", new StringValue("-7"))).isEqualTo(IntValue.of(-7));
  }

  @Test
  public void invalidJson() {
    EvalError e =
        assertThrows(EvalError.class, () -> json("decode", new StringValue("{\"a\": ")));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.INTRINSIC_FAILURE);
    assertThat(e).hasMessageThat().startsWith("Json decode: invalid JSON (");
  }

  @Test
  public void agentsCannotBeEncoded() {
    EvalError e = assertThrows(EvalError.class, () -> json("encode", vm.systemAgent("Io")));
    assertThat(e).hasMessageThat().startsWith("Json encode: can't encode Io@");
  }
}
