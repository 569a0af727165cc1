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

package org.komrad.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StringUtilTest {

  @Test
  public void escape() {
    assertThat(StringUtil.escape("plain")).isEqualTo("\"plain\"");
    assertThat(StringUtil.escape("say \"hi\"\n")).isEqualTo("\"say \\\"hi\\\"\\n\"");
    assertThat(StringUtil.escape("a\\b\tc")).isEqualTo("\"a\\\\b\\tc\"");
  }

  @Test
  public void unescape() {
    assertThat(StringUtil.unescape("no escapes")).isEqualTo("no escapes");
    assertThat(StringUtil.unescape("a\\nb\\t\\\"c\\\"")).isEqualTo("a\nb\t\"c\"");
    assertThat(StringUtil.unescape("\\u00e9t\\u00e9")).isEqualTo("été");
    assertThat(StringUtil.unescape("\\`\\`\\`")).isEqualTo("```");
  }

  @Test
  public void unescapeErrors() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("bad\\"));
    assertThat(e).hasMessageThat().isEqualTo("Unterminated escape sequence");
    e = assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("\\x41"));
    assertThat(e).hasMessageThat().isEqualTo("Invalid escape \\x");
    e = assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("\\u12"));
    assertThat(e).hasMessageThat().isEqualTo("Incomplete \\u escape");
  }

  @Test
  public void joinElements() {
    String[] words = {"a", "b", "c"};
    assertThat(StringUtil.joinElements("[", "]", 3, i -> words[i])).isEqualTo("[a, b, c]");
    assertThat(StringUtil.joinElements("(", ")", " ", 2, i -> i * 10)).isEqualTo("(0 10)");
    assertThat(StringUtil.joinElements("[", "]", 0, i -> words[i])).isEqualTo("[]");
  }

  @Test
  public void id() {
    Object x = new Object();
    assertThat(StringUtil.id(x)).isEqualTo(StringUtil.id(x));
    assertThat(StringUtil.id(x)).matches("[0-9a-f]{1,4}");
  }
}
