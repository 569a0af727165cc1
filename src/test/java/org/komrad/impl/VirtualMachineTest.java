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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.komrad.compiler.ParseError;
import org.komrad.testing.TestMonitor;
import org.komrad.testing.TestdataScanner;
import org.komrad.testing.TestdataScanner.TestProgram;

/** Loads and runs the Komrad programs in each of the .kom files in the testdata directory. */
@RunWith(TestParameterInjector.class)
public class VirtualMachineTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/komrad/impl/testdata");

  /**
   * Each program is followed by a comment that begins "{@code /* RUN}" and has three sections,
   * separated by lines containing just "---":
   *
   * <ul>
   *   <li>the output written by {@code Io};
   *   <li>the diagnostics reported while the program ran, one per line, sorted (a parse error is
   *       listed as "PARSE_ERROR: " followed by its message);
   *   <li>the VirtualMachine's ActivityTracker once all agents are idle.
   * </ul>
   *
   * Agent ids in diagnostics are replaced by "xxxx".
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* RUN\n(.*?)\\*/\\n*", Pattern.DOTALL);

  private static final Pattern SEPARATOR = Pattern.compile("(?m)^---$");

  @Test
  public void runOne(
      @TestParameter(valuesProvider = AllProgramsProvider.class) TestProgram testProgram)
      throws InterruptedException {
    checkNotNull(testProgram.comment(), "No RUN comment found");
    String[] expected = SEPARATOR.split(testProgram.comment(), -1);
    assertWithMessage("Bad RUN comment").that(expected).hasLength(3);
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    TestMonitor monitor = new TestMonitor();
    RuntimeOptions options =
        RuntimeOptions.builder()
            .setOut(new PrintStream(output, true, UTF_8))
            .setSink(monitor)
            .setMaxCallDepth(RuntimeOptions.DEFAULT_MAX_CALL_DEPTH)
            .build();
    String parseError = null;
    try (VirtualMachine vm = new VirtualMachine(options)) {
      try {
        vm.load(testProgram.code(), "test");
      } catch (ParseError e) {
        parseError = "PARSE_ERROR: " + e.getMessage();
      }
      assertWithMessage("Agents still busy: %s", vm.tracker())
          .that(vm.awaitQuiescence(5, TimeUnit.SECONDS))
          .isTrue();
      String diagnostics =
          monitor.diagnostics().stream()
              .map(d -> cleanIds(d.toString()))
              .sorted()
              .collect(Collectors.joining("\n"));
      if (parseError != null) {
        diagnostics = parseError;
      }
      System.out.println(output.toString(UTF_8));
      assertWithMessage("Output doesn't match")
          .that(cleanLines(output.toString(UTF_8)))
          .isEqualTo(cleanLines(expected[0]));
      assertWithMessage("Diagnostics don't match")
          .that(diagnostics)
          .isEqualTo(cleanLines(expected[1]));
      assertThat(vm.tracker().toString()).isEqualTo(cleanLines(expected[2]));
    }
  }

  public static final class AllProgramsProvider extends TestdataScanner {
    public AllProgramsProvider() {
      super(TESTDATA, COMMENT_PATTERN);
    }
  }

  /**
   * Removes all whitespace at the beginning and end of lines in the given output, and removes all
   * completely blank lines.
   */
  private static String cleanLines(String output) {
    return output.replaceAll(" *\n[ \n]*", "\n").trim();
  }

  /** Replaces the unpredictable hex id following an agent's name with "xxxx". */
  private static String cleanIds(String output) {
    return output.replaceAll("@[0-9a-f]+\\b", "@xxxx");
  }
}
