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
import com.google.common.collect.ImmutableSortedMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;

/**
 * A Scope is one tier of a lexical environment. Lookups search from the innermost tier outward;
 * the outermost tier holds the fields of an agent instance and is the only one that assignments
 * write to.
 *
 * <p>Field tiers are written only by the agent that owns them, but use a ConcurrentHashMap since
 * other threads read them: {@link VirtualMachine#fields}, and a block expanded by an agent other
 * than its creator, which runs in a captured tier (see {@link #captureOver}) over the expanding
 * agent's fields. Inner tiers hold the bindings made by pattern matching; they are populated before
 * the handler body runs and only read afterwards.
 */
public final class Scope {

  private final @Nullable Scope parent;
  private final Map<String, Value> bindings;

  /** True for a tier created by {@link #captureOver}; assignments remove its bindings. */
  private final boolean captured;

  private Scope(@Nullable Scope parent, Map<String, Value> bindings, boolean captured) {
    this.parent = parent;
    this.bindings = bindings;
    this.captured = captured;
  }

  /** Returns a new, empty field scope. */
  public static Scope newFieldScope() {
    return new Scope(null, new ConcurrentHashMap<>(), false);
  }

  /** Returns a new, empty scope nested inside this one. */
  public Scope newChild() {
    return new Scope(this, new HashMap<>(), false);
  }

  /**
   * Returns a new scope over {@code fields} holding a copy of everything visible from this scope,
   * with inner bindings shadowing outer ones. Assigning to a name removes it from the copy, so that
   * later lookups see the new field value.
   */
  public Scope captureOver(Scope fields) {
    Preconditions.checkArgument(fields.isFieldScope());
    Map<String, Value> copy = new HashMap<>();
    for (Scope s = this; s != null; s = s.parent) {
      s.bindings.forEach(copy::putIfAbsent);
    }
    return new Scope(fields, copy, true);
  }

  public boolean isFieldScope() {
    return parent == null;
  }

  /** Returns the value bound to {@code name} in this scope or any enclosing scope, or null. */
  public @Nullable Value lookup(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Value v = s.bindings.get(name);
      if (v != null) {
        return v;
      }
    }
    return null;
  }

  /** Binds {@code name} in this tier, shadowing any binding in an enclosing scope. */
  public void bind(String name, Value value) {
    Preconditions.checkNotNull(value);
    bindings.put(name, value);
  }

  /** Creates or replaces the binding of {@code name} in the field scope. */
  public void assign(String name, Value value) {
    Scope s = this;
    for (; s.parent != null; s = s.parent) {
      if (s.captured) {
        s.bindings.remove(name);
      }
    }
    s.bind(name, value);
  }

  /** Returns the outermost tier of this scope. */
  public Scope fieldScope() {
    Scope s = this;
    while (s.parent != null) {
      s = s.parent;
    }
    return s;
  }

  /** Returns a copy of the bindings in the field scope, sorted by name. */
  public ImmutableSortedMap<String, Value> snapshot() {
    return ImmutableSortedMap.copyOf(fieldScope().bindings);
  }

  @Override
  public String toString() {
    return (parent == null) ? "fields" + snapshot() : bindings + " < " + parent;
  }
}
