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

package org.komrad.testing;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameterValuesProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * A {@link TestParameterValuesProvider} that provides one {@link TestProgram} for each Komrad
 * program in a directory of {@code .kom} files.
 *
 * <p>A file may hold several programs. Each is followed by a comment matching {@code endComment}
 * whose first group describes the expected results; blank lines and comments before a program are
 * skipped.
 *
 * <p>The system property {@code runOnly} (a regex matched against the program name) and {@code
 * runOnlyComment} (a regex matched against the start of the expectation comment) restrict which
 * programs are provided.
 */
public abstract class TestdataScanner extends TestParameterValuesProvider {

  private final Path dir;
  private final Pattern endComment;

  protected TestdataScanner(Path dir, Pattern endComment) {
    this.dir = dir;
    this.endComment = endComment;
  }

  /**
   * A Komrad program from a testdata file.
   *
   * @param name the file name followed by "+" and the line number (zero-based) where the program
   *     starts
   * @param comment the expectations, or null if no end comment followed the program
   */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public final String toString() {
      return name();
    }
  }

  /** Matches blank lines and comments at the start of a program. */
  private static final Pattern LEADING_COMMENTS_PATTERN =
      Pattern.compile("(?:[ \\t]*(?:\\n|//[^\\n]*|/\\*(?! RUN).*?\\*/))+", Pattern.DOTALL);

  @Override
  public final ImmutableList<TestProgram> provideValues(Context context) {
    Pattern runOnly = Pattern.compile(System.getProperty("runOnly", ".*"));
    String roc = System.getProperty("runOnlyComment");
    Pattern runOnlyComment = (roc == null) ? null : Pattern.compile(".*" + roc);
    Predicate<TestProgram> selected =
        program ->
            runOnly.matcher(program.name()).matches()
                && (program.comment() == null
                    || runOnlyComment == null
                    || runOnlyComment.matcher(program.comment()).lookingAt());
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .sorted()
          .flatMap(file -> programsInFile(file).stream().filter(selected))
          .collect(toImmutableList());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private ImmutableList<TestProgram> programsInFile(Path path) {
    String fileName = path.getFileName().toString();
    if (!fileName.endsWith(".kom")) {
      return ImmutableList.of();
    }
    try {
      return split(fileName, Files.readString(path), endComment);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Splits the contents of a testdata file into programs. Each program runs from the first line
   * that is not blank or a comment up to the next match of {@code endComment}.
   */
  public static ImmutableList<TestProgram> split(
      String fileName, String source, Pattern endComment) {
    ImmutableList.Builder<TestProgram> programs = ImmutableList.builder();
    Matcher leading = LEADING_COMMENTS_PATTERN.matcher(source);
    Matcher end = endComment.matcher(source);
    int pos = 0;
    int line = 0;
    for (; ; ) {
      leading.region(pos, source.length());
      if (leading.lookingAt()) {
        line += countNewLines(leading.group());
        pos = leading.end();
      }
      if (pos == source.length()) {
        return programs.build();
      }
      String name = fileName + "+" + line;
      if (!end.find(pos)) {
        // A null comment makes the test fail, pointing at the program that lacks one.
        programs.add(new TestProgram(name, source.substring(pos), null));
        return programs.build();
      }
      programs.add(new TestProgram(name, source.substring(pos, end.start()), end.group(1)));
      line += countNewLines(source.substring(pos, end.end()));
      pos = end.end();
    }
  }

  private static int countNewLines(String s) {
    return (int) s.chars().filter(c -> c == '\n').count();
  }
}
