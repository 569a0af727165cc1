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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSortedMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ScopeTest {

  @Test
  public void lookupSearchesOutward() {
    Scope fields = Scope.newFieldScope();
    fields.bind("x", IntValue.ONE);
    fields.bind("y", IntValue.ONE);
    Scope inner = fields.newChild();
    inner.bind("y", IntValue.of(2));
    Scope innermost = inner.newChild();
    assertThat(innermost.lookup("x")).isEqualTo(IntValue.ONE);
    assertThat(innermost.lookup("y")).isEqualTo(IntValue.of(2));
    assertThat(fields.lookup("y")).isEqualTo(IntValue.ONE);
    assertThat(innermost.lookup("z")).isNull();
  }

  @Test
  public void assignWritesTheFieldScope() {
    Scope fields = Scope.newFieldScope();
    Scope inner = fields.newChild().newChild();
    inner.assign("count", IntValue.of(5));
    assertThat(fields.lookup("count")).isEqualTo(IntValue.of(5));
    assertThat(inner.fieldScope()).isSameInstanceAs(fields);
    assertThat(fields.isFieldScope()).isTrue();
    assertThat(inner.isFieldScope()).isFalse();
  }

  @Test
  public void snapshotIsSortedAndDetached() {
    Scope fields = Scope.newFieldScope();
    fields.bind("b", IntValue.of(2));
    fields.bind("a", IntValue.ONE);
    Scope inner = fields.newChild();
    inner.bind("local", IntValue.ZERO);
    ImmutableSortedMap<String, Value> snapshot = inner.snapshot();
    fields.bind("c", IntValue.of(3));
    assertThat(snapshot.keySet()).containsExactly("a", "b").inOrder();
  }

  @Test
  public void capturedTierWritesTheNewFields() {
    Scope creator = Scope.newFieldScope();
    creator.bind("mine", IntValue.ZERO);
    Scope handler = creator.newChild();
    handler.bind("n", IntValue.of(7));
    Scope other = Scope.newFieldScope();
    other.bind("theirs", IntValue.ONE);

    Scope captured = handler.captureOver(other);
    assertThat(captured.fieldScope()).isSameInstanceAs(other);
    assertThat(captured.lookup("mine")).isEqualTo(IntValue.ZERO);
    assertThat(captured.lookup("n")).isEqualTo(IntValue.of(7));
    assertThat(captured.lookup("theirs")).isEqualTo(IntValue.ONE);

    captured.assign("mine", IntValue.of(99));
    assertThat(captured.lookup("mine")).isEqualTo(IntValue.of(99));
    assertThat(other.lookup("mine")).isEqualTo(IntValue.of(99));
    assertThat(creator.lookup("mine")).isEqualTo(IntValue.ZERO);
    assertThat(handler.lookup("n")).isEqualTo(IntValue.of(7));
  }

  @Test
  public void bindRejectsNull() {
    Scope fields = Scope.newFieldScope();
    assertThrows(NullPointerException.class, () -> fields.bind("x", null));
  }
}
