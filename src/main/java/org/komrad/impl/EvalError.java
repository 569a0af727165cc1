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

import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.komrad.ast.Location;

/**
 * Thrown when evaluation of an expression fails. An EvalError aborts the statement sequence that
 * was running; if that was a handler body, only the current message is abandoned.
 */
public class EvalError extends Exception {

  public enum Kind {
    UNRESOLVED_VARIABLE,
    ARITY_MISMATCH,
    TYPE_MISMATCH,
    DIVISION_BY_ZERO,
    NO_HANDLER,
    UNKNOWN_AGENT,
    CALL_DEPTH,
    ASSERTION_FAILED,
    INTRINSIC_FAILURE
  }

  private final Kind kind;

  /** The statement that was being executed; set by the innermost statement sequence. */
  private @Nullable Location location;

  public EvalError(Kind kind, String format, Object... args) {
    super(Strings.lenientFormat(format, args));
    this.kind = kind;
  }

  public EvalError(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  public @Nullable Location location() {
    return location;
  }

  /** Sets this error's location if it doesn't already have one. */
  @CanIgnoreReturnValue
  public EvalError atLocation(Location location) {
    if (this.location == null) {
      this.location = location;
    }
    return this;
  }

  /** Returns the kind and message, e.g. {@code "TYPE_MISMATCH: Cannot expand 3"}. */
  public String describe() {
    return kind + ": " + getMessage();
  }

  @Override
  public String toString() {
    return (location == null) ? describe() : location + ": " + describe();
  }
}
