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

/** The two boolean values. */
public enum BoolValue implements Value {
  FALSE,
  TRUE;

  public static BoolValue of(boolean b) {
    return b ? TRUE : FALSE;
  }

  public boolean asBoolean() {
    return this == TRUE;
  }

  @Override
  public BaseType baseType() {
    return BaseType.BOOLEAN;
  }

  @Override
  public String toString() {
    return (this == TRUE) ? "true" : "false";
  }
}
