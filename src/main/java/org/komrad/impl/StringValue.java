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

import com.google.common.base.Preconditions;
import org.komrad.util.StringUtil;

/** An implementation of Value for strings, including the text of embedded blocks. */
public final class StringValue implements Value {

  public static final StringValue EMPTY = new StringValue("");

  public final String value;

  public StringValue(String value) {
    this.value = Preconditions.checkNotNull(value);
  }

  @Override
  public BaseType baseType() {
    return BaseType.STRING;
  }

  @Override
  public String display() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof StringValue sv && value.equals(sv.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return StringUtil.escape(value);
  }
}
