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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.ListValue;
import org.komrad.impl.Message;
import org.komrad.impl.NativeAgent;
import org.komrad.impl.NoneValue;
import org.komrad.impl.RuntimeOptions;
import org.komrad.impl.StringValue;
import org.komrad.impl.Value;
import org.komrad.impl.VirtualMachine;

@RunWith(JUnit4.class)
public class FsAgentTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private Path root;
  private VirtualMachine vm;

  @Before
  public void setUp() throws IOException {
    root = tmp.newFolder("root").toPath();
    vm = new VirtualMachine(RuntimeOptions.builder().setFsRoot(root).build());
  }

  @After
  public void close() {
    vm.close();
  }

  private Value fs(String selector, Value... rest) throws EvalError {
    return ((NativeAgent) vm.systemAgent("Fs").actor()).receive(Message.of(selector, rest));
  }

  private static StringValue str(String s) {
    return new StringValue(s);
  }

  @Test
  public void writeThenRead() throws Exception {
    assertThat(fs("exists", str("notes.txt"))).isEqualTo(BoolValue.FALSE);
    assertThat(fs("write", str("notes.txt"), str("one\ntwo\n"))).isEqualTo(NoneValue.NONE);
    assertThat(Files.readString(root.resolve("notes.txt"))).isEqualTo("one\ntwo\n");
    assertThat(fs("exists", str("notes.txt"))).isEqualTo(BoolValue.TRUE);
    assertThat(fs("read-all", str("notes.txt"))).isEqualTo(str("one\ntwo\n"));
    assertThat(fs("read-lines", str("notes.txt"))).isEqualTo(ListValue.of(str("one"), str("two")));
  }

  @Test
  public void listDir() throws Exception {
    Files.createDirectory(root.resolve("d"));
    Files.writeString(root.resolve("d/b"), "");
    Files.writeString(root.resolve("d/a"), "");
    assertThat(fs("list-dir", str("d"))).isEqualTo(ListValue.of(str("a"), str("b")));
  }

  @Test
  public void missingFile() {
    EvalError e = assertThrows(EvalError.class, () -> fs("read-all", str("missing")));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.INTRINSIC_FAILURE);
    assertThat(e).hasMessageThat().startsWith("Fs read-all: ");
  }

  @Test
  public void pathsStayUnderRoot() {
    EvalError e = assertThrows(EvalError.class, () -> fs("exists", str("../elsewhere")));
    assertThat(e.kind()).isEqualTo(EvalError.Kind.INTRINSIC_FAILURE);
    assertThat(e).hasMessageThat().contains("is outside");
  }
}
