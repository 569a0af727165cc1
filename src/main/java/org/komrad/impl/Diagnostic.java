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

import org.jspecify.annotations.Nullable;
import org.komrad.ast.Location;

/**
 * A problem reported while a program runs. None of these stop the runtime; the agent that
 * reported one goes on to its next message.
 *
 * @param agent the agent that was running (or, for delivery errors, sending) when the problem
 *     occurred, as {@code Name@id}
 */
public record Diagnostic(Kind kind, String agent, String text, @Nullable Location location) {

  public enum Kind {
    PARSE_ERROR,
    EVAL_ERROR,
    UNHANDLED_MESSAGE,
    DELIVERY_ERROR
  }

  @Override
  public String toString() {
    String where = (location == null) ? "" : " at " + location;
    return kind + " in " + agent + where + ": " + text;
  }
}
