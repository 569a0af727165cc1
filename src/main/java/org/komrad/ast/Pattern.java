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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.komrad.util.StringUtil;

/**
 * The left-hand side of a handler: a fixed-length sequence of terms. A Pattern can only match a
 * message with exactly {@link #arity} terms.
 */
public record Pattern(ImmutableList<PatternTerm> terms) {

  public Pattern {
    Preconditions.checkArgument(!terms.isEmpty(), "Patterns must have at least one term");
  }

  public static Pattern of(PatternTerm... terms) {
    return new Pattern(ImmutableList.copyOf(terms));
  }

  public int arity() {
    return terms.size();
  }

  public PatternTerm term(int i) {
    return terms.get(i);
  }

  /**
   * Returns true if the first term is the given word; used to find handlers for well-known
   * selectors such as {@code main}.
   */
  public boolean startsWith(String word) {
    return terms.get(0) instanceof PatternTerm.Word w && w.text().equals(word);
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("[", "]", " ", terms.size(), terms::get);
  }
}
