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

/**
 * The agent on whose behalf the Evaluator is running, and how many nested self-sends and block
 * expansions led to the current point.
 */
record Activation(AgentInstance self, int depth) {

  Activation deeper() {
    return new Activation(self, depth + 1);
  }
}
