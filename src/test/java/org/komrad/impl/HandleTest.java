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
import static org.junit.Assert.assertThrows;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HandleTest {

  public static class Holder {
    public int counter;

    private static Value first(IntrinsicCall call) {
      return call.message().term(0);
    }
  }

  @Test
  public void forIntrinsic() throws Throwable {
    MethodHandle mh =
        Handle.forIntrinsic(Holder.class.getDeclaredMethod("first", IntrinsicCall.class));
    assertThat(mh.type()).isEqualTo(Handle.INTRINSIC_TYPE);
  }

  @Test
  public void forVar() {
    VarHandle vh = Handle.forVar(MethodHandles.lookup(), Holder.class, "counter", int.class);
    Holder holder = new Holder();
    assertThat(vh.compareAndSet(holder, 0, 3)).isTrue();
    assertThat(vh.compareAndSet(holder, 0, 4)).isFalse();
    assertThat(holder.counter).isEqualTo(3);
  }

  @Test
  public void forVarMissingField() {
    LinkageError e =
        assertThrows(
            LinkageError.class,
            () -> Handle.forVar(MethodHandles.lookup(), Holder.class, "missing", int.class));
    assertThat(e).hasMessageThat().isEqualTo("No int field Holder.missing");
  }

  @Test
  public void names() throws Exception {
    assertThat(Handle.simpleName(Holder.class)).isEqualTo("Holder");
    assertThat(Handle.simpleName(HandleTest.class)).isEqualTo("HandleTest");
    assertThat(Handle.describe(Holder.class.getDeclaredMethod("first", IntrinsicCall.class)))
        .isEqualTo("Holder.first");
  }
}
