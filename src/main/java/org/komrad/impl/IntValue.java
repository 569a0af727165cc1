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

/** A 64-bit integer. */
public record IntValue(long value) implements Value {

  public static final IntValue ZERO = new IntValue(0);
  public static final IntValue ONE = new IntValue(1);

  public static IntValue of(long value) {
    return (value == 0) ? ZERO : (value == 1) ? ONE : new IntValue(value);
  }

  @Override
  public BaseType baseType() {
    return BaseType.INT;
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
