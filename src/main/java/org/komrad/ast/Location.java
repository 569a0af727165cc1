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

package org.komrad.ast;

/**
 * A position in a source unit. {@code offset} counts chars from the start of the source; {@code
 * line} and {@code column} are 1-based.
 */
public record Location(String source, int offset, int line, int column) {

  /** Used for code that was not parsed from a source unit (e.g. intrinsic patterns). */
  public static final Location NONE = new Location("(none)", 0, 0, 0);

  @Override
  public String toString() {
    return source + ":" + line + ":" + column;
  }
}
