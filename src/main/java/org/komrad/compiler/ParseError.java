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

package org.komrad.compiler;

import org.komrad.ast.Location;

/**
 * Thrown when source text is not a well-formed Komrad program. Parsing stops at the first error, so
 * there is never more than one ParseError for a source unit.
 */
public class ParseError extends Exception {

  private final Location location;
  private final String expected;
  private final String found;

  public ParseError(Location location, String expected, String found) {
    super(String.format("%s: expected %s but found %s", location, expected, found));
    this.location = location;
    this.expected = expected;
    this.found = found;
  }

  public Location location() {
    return location;
  }

  public int offset() {
    return location.offset();
  }

  public int line() {
    return location.line();
  }

  public int column() {
    return location.column();
  }

  /** A description of what would have been accepted at this point. */
  public String expected() {
    return expected;
  }

  /** A description of what was actually found. */
  public String found() {
    return found;
  }
}
