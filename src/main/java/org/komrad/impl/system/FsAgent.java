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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.IntrinsicCall;
import org.komrad.impl.ListValue;
import org.komrad.impl.NoneValue;
import org.komrad.impl.StringValue;
import org.komrad.impl.SystemAgent.Intrinsic;
import org.komrad.impl.Value;

/**
 * {@code Fs}: reads and writes files. Paths are strings, resolved against the configured root
 * directory; paths that resolve outside the root are rejected.
 */
public final class FsAgent {

  private FsAgent() {}

  private static Path resolve(IntrinsicCall call, String name) throws EvalError {
    Path root = call.options().fsRoot.toAbsolutePath().normalize();
    Path path = root.resolve(call.string(name)).normalize();
    if (!path.startsWith(root)) {
      throw call.failure("%s is outside %s", path, root);
    }
    return path;
  }

  @Intrinsic("read-all _p")
  static Value readAll(IntrinsicCall call) throws EvalError {
    try {
      return new StringValue(Files.readString(resolve(call, "p")));
    } catch (IOException e) {
      throw call.failure(e);
    }
  }

  @Intrinsic("read-lines _p")
  static Value readLines(IntrinsicCall call) throws EvalError {
    try {
      return new ListValue(
          Files.readAllLines(resolve(call, "p")).stream()
              .map(StringValue::new)
              .collect(ImmutableList.toImmutableList()));
    } catch (IOException e) {
      throw call.failure(e);
    }
  }

  @Intrinsic("write _p _text")
  static Value write(IntrinsicCall call) throws EvalError {
    try {
      Files.writeString(resolve(call, "p"), call.string("text"));
    } catch (IOException e) {
      throw call.failure(e);
    }
    return NoneValue.NONE;
  }

  @Intrinsic("exists _p")
  static Value exists(IntrinsicCall call) throws EvalError {
    return BoolValue.of(Files.exists(resolve(call, "p")));
  }

  /** Returns the names of the directory's entries, sorted. */
  @Intrinsic("list-dir _p")
  static Value listDir(IntrinsicCall call) throws EvalError {
    try (Stream<Path> entries = Files.list(resolve(call, "p"))) {
      return new ListValue(
          entries
              .map(p -> p.getFileName().toString())
              .sorted()
              .map(StringValue::new)
              .collect(ImmutableList.toImmutableList()));
    } catch (IOException e) {
      throw call.failure(e);
    }
  }
}
