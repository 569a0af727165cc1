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

import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.FloatValue;
import org.komrad.impl.IntValue;
import org.komrad.impl.Message;
import org.komrad.impl.NativeAgent;
import org.komrad.impl.StringValue;
import org.komrad.impl.Value;
import org.komrad.impl.VirtualMachine;

@RunWith(JUnit4.class)
public class NumberAgentTest {

  private final VirtualMachine vm = new VirtualMachine();

  @After
  public void close() {
    vm.close();
  }

  private Value number(String selector, Value... rest) throws EvalError {
    return ((NativeAgent) vm.systemAgent("Number").actor()).receive(Message.of(selector, rest));
  }

  @Test
  public void parse() throws EvalError {
    assertThat(number("parse", new StringValue("42"))).isEqualTo(IntValue.of(42));
    assertThat(number("parse", new StringValue(" 2.5 "))).isEqualTo(new FloatValue(2.5));
    EvalError e =
        assertThrows(EvalError.class, () -> number("parse", new StringValue("forty-two")));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.INTRINSIC_FAILURE);
    assertThat(e).hasMessageThat().isEqualTo("Number parse: \"forty-two\" is not a number");
  }

  @Test
  public void classify() throws EvalError {
    assertThat(number("is-int", IntValue.ONE)).isEqualTo(BoolValue.TRUE);
    assertThat(number("is-int", new FloatValue(1))).isEqualTo(BoolValue.FALSE);
    assertThat(number("is-float", new FloatValue(1))).isEqualTo(BoolValue.TRUE);
    assertThat(number("is-number", new StringValue("1"))).isEqualTo(BoolValue.FALSE);
  }

  @Test
  public void arithmetic() throws EvalError {
    assertThat(number("to-string", IntValue.of(3))).isEqualTo(new StringValue("3"));
    assertThat(number("abs", IntValue.of(-3))).isEqualTo(IntValue.of(3));
    assertThat(number("abs", new FloatValue(-0.5))).isEqualTo(new FloatValue(0.5));
    assertThat(number("floor", new FloatValue(2.7))).isEqualTo(IntValue.of(2));
    assertThat(number("floor", new FloatValue(-2.5))).isEqualTo(IntValue.of(-3));
    assertThat(number("max", IntValue.of(3), IntValue.of(2))).isEqualTo(IntValue.of(3));
    assertThat(number("max", IntValue.ONE, new FloatValue(2.5))).isEqualTo(new FloatValue(2.5));
    assertThat(number("min", IntValue.ONE, new FloatValue(2.5))).isEqualTo(new FloatValue(1));
  }

  @Test
  public void errors() {
    assertThat(
            assertThrows(EvalError.class, () -> number("abs", IntValue.of(Long.MIN_VALUE))).kind())
        .isEqualTo(EvalError.Kind.INTRINSIC_FAILURE);
    assertThat(assertThrows(EvalError.class, () -> number("floor", new FloatValue(1e30))).kind())
        .isEqualTo(EvalError.Kind.INTRINSIC_FAILURE);
    assertThat(assertThrows(EvalError.class, () -> number("abs", new StringValue("1"))).kind())
        .isEqualTo(EvalError.Kind.TYPE_MISMATCH);
  }
}
