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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import org.jspecify.annotations.Nullable;

/**
 * Settings for a VirtualMachine. Any setting not given to the Builder is taken from a system
 * property if one is set, otherwise from a default:
 *
 * <ul>
 *   <li>{@code komrad.threads}: if set, agents run on a dedicated ForkJoinPool with this
 *       parallelism (shut down by {@link VirtualMachine#close}) instead of the common pool;
 *   <li>{@code komrad.maxCallDepth}: the maximum nesting of self-sends and block expansions
 *       (default 200);
 *   <li>{@code komrad.drainBatch}: the maximum number of messages an agent processes before
 *       yielding its thread (default 64).
 * </ul>
 */
public final class RuntimeOptions {

  public static final int DEFAULT_MAX_CALL_DEPTH = 200;
  public static final int DEFAULT_DRAIN_BATCH = 64;

  /** Where {@code Io} writes. */
  public final PrintStream out;

  /** The directory that {@code Fs} paths are resolved against. */
  public final Path fsRoot;

  public final Executor executor;

  /** True if the executor was created for these options and should be shut down with the VM. */
  final boolean ownsExecutor;

  public final int maxCallDepth;

  public final int drainBatch;

  public final DiagnosticSink sink;

  private RuntimeOptions(Builder builder) {
    this.out = (builder.out != null) ? builder.out : System.out;
    this.fsRoot = (builder.fsRoot != null) ? builder.fsRoot : Path.of("").toAbsolutePath();
    this.maxCallDepth =
        (builder.maxCallDepth != null)
            ? builder.maxCallDepth
            : Integer.getInteger("komrad.maxCallDepth", DEFAULT_MAX_CALL_DEPTH);
    this.drainBatch =
        (builder.drainBatch != null)
            ? builder.drainBatch
            : Integer.getInteger("komrad.drainBatch", DEFAULT_DRAIN_BATCH);
    this.sink = (builder.sink != null) ? builder.sink : DiagnosticSink.NONE;
    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownsExecutor = false;
    } else {
      Integer threads = Integer.getInteger("komrad.threads");
      if (threads != null) {
        Preconditions.checkArgument(threads > 0, "komrad.threads must be positive");
        this.executor = new ForkJoinPool(threads);
        this.ownsExecutor = true;
      } else {
        this.executor = ForkJoinPool.commonPool();
        this.ownsExecutor = false;
      }
    }
    Preconditions.checkArgument(maxCallDepth > 0, "maxCallDepth must be positive");
    Preconditions.checkArgument(drainBatch > 0, "drainBatch must be positive");
  }

  /** Returns options with every setting taken from system properties or defaults. */
  public static RuntimeOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  void shutdownExecutor() {
    if (ownsExecutor) {
      ((ExecutorService) executor).shutdown();
    }
  }

  public static final class Builder {
    private @Nullable PrintStream out;
    private @Nullable Path fsRoot;
    private @Nullable Executor executor;
    private @Nullable Integer maxCallDepth;
    private @Nullable Integer drainBatch;
    private @Nullable DiagnosticSink sink;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setOut(PrintStream out) {
      this.out = Preconditions.checkNotNull(out);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setFsRoot(Path fsRoot) {
      this.fsRoot = Preconditions.checkNotNull(fsRoot);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setExecutor(Executor executor) {
      this.executor = Preconditions.checkNotNull(executor);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxCallDepth(int maxCallDepth) {
      this.maxCallDepth = maxCallDepth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDrainBatch(int drainBatch) {
      this.drainBatch = drainBatch;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSink(DiagnosticSink sink) {
      this.sink = Preconditions.checkNotNull(sink);
      return this;
    }

    public RuntimeOptions build() {
      return new RuntimeOptions(this);
    }
  }
}
