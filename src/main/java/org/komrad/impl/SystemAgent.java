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
import com.google.common.collect.ImmutableList;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.invoke.MethodHandle;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import org.komrad.ast.Pattern;
import org.komrad.ast.PatternTerm;
import org.komrad.compiler.ParseError;
import org.komrad.compiler.Parser;

/**
 * A NativeAgent whose handlers are the static methods of a class that are annotated with {@link
 * Intrinsic}. Messages are matched against the intrinsics' patterns with the same PatternMatcher
 * used for agent handlers. Since {@code getDeclaredMethods()} returns methods in no particular
 * order, the patterns of one class's intrinsics must not overlap.
 */
public final class SystemAgent extends NativeAgent {

  /**
   * Declares a static method to be the handler for messages matching the given pattern. The
   * pattern is written without brackets, e.g. {@code @Intrinsic("get _m _k _default")}, and may
   * only contain words, literals, value holes, typed holes and discards.
   *
   * <p>The method must have the signature {@code static Value name(IntrinsicCall call)}, optionally
   * throwing EvalError; it retrieves the values bound by the pattern's holes from {@code call}.
   */
  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.METHOD)
  public @interface Intrinsic {
    String value();
  }

  private record IntrinsicMethod(Pattern pattern, MethodHandle handle, String where) {}

  private final ImmutableList<IntrinsicMethod> intrinsics;

  SystemAgent(VirtualMachine vm, String name, Class<?> klass) {
    super(vm, name);
    this.intrinsics = scan(klass);
    Preconditions.checkArgument(!intrinsics.isEmpty(), "No intrinsics in %s", klass.getName());
  }

  /** Returns an IntrinsicMethod for each annotated method of {@code klass}, sorted by name. */
  private static ImmutableList<IntrinsicMethod> scan(Class<?> klass) {
    return Arrays.stream(klass.getDeclaredMethods())
        .filter(m -> m.isAnnotationPresent(Intrinsic.class))
        .sorted(Comparator.comparing(Method::getName))
        .map(SystemAgent::prepare)
        .collect(ImmutableList.toImmutableList());
  }

  private static IntrinsicMethod prepare(Method m) {
    String where = Handle.describe(m);
    Preconditions.checkArgument(
        Modifier.isStatic(m.getModifiers()), "Should be static (%s)", where);
    Preconditions.checkArgument(
        m.getReturnType() == Value.class, "Return type should be Value (%s)", where);
    Preconditions.checkArgument(
        Arrays.equals(m.getParameterTypes(), new Class<?>[] {IntrinsicCall.class}),
        "Should take a single IntrinsicCall (%s)",
        where);
    Pattern pattern;
    try {
      pattern = Parser.parsePattern(m.getAnnotation(Intrinsic.class).value());
    } catch (ParseError e) {
      throw new IllegalArgumentException("Bad pattern (" + where + ")", e);
    }
    Preconditions.checkArgument(
        pattern.terms().stream().noneMatch(t -> t instanceof PatternTerm.PredicateHole),
        "Predicate holes are not supported (%s)",
        where);
    return new IntrinsicMethod(pattern, Handle.forIntrinsic(m), where);
  }

  @Override
  public Value receive(Message message) throws EvalError {
    Scope root = Scope.newFieldScope();
    for (IntrinsicMethod intrinsic : intrinsics) {
      Scope bindings = vm.matcher.match(intrinsic.pattern, message, root, null);
      if (bindings != null) {
        return invoke(intrinsic, new IntrinsicCall(this, message, bindings));
      }
    }
    vm.reportUnhandled(this, message);
    return NoneValue.NONE;
  }

  private static Value invoke(IntrinsicMethod intrinsic, IntrinsicCall call) throws EvalError {
    try {
      return (Value) intrinsic.handle.invokeExact(call);
    } catch (EvalError | RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new AssertionError("Unexpected exception from " + intrinsic.where, t);
    }
  }
}
