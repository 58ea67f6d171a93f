/*
 * Copyright 2025 The Retrospect Authors
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

package org.retrohdl.transforms;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Settings for {@link ExpandWhensPass}. Instances are immutable; use {@link #builder}. */
public final class ExpandWhensOptions {

  public static final ExpandWhensOptions DEFAULT = builder().build();

  /**
   * If true, every undriven sink in a module is reported; otherwise checking a module stops at the
   * first one.
   */
  public final boolean exhaustiveDiagnostics;

  /** The number of modules of a circuit that may be processed concurrently. */
  public final int parallelism;

  /** If true, each module is logged (at debug level) before and after expansion. */
  public final boolean verbose;

  private ExpandWhensOptions(Builder builder) {
    this.exhaustiveDiagnostics = builder.exhaustiveDiagnostics;
    this.parallelism = builder.parallelism;
    this.verbose = builder.verbose;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options read from the system properties {@code expandWhens.exhaustive}, {@code
   * expandWhens.parallelism} and {@code expandWhens.verbose}, with defaults for any that are unset.
   */
  public static ExpandWhensOptions fromSystemProperties() {
    return builder()
        .setExhaustiveDiagnostics(
            Boolean.parseBoolean(System.getProperty("expandWhens.exhaustive", "false")))
        .setParallelism(Integer.parseInt(System.getProperty("expandWhens.parallelism", "1")))
        .setVerbose(Boolean.parseBoolean(System.getProperty("expandWhens.verbose", "false")))
        .build();
  }

  @Override
  public String toString() {
    return String.format(
        "ExpandWhensOptions(exhaustive=%s, parallelism=%s, verbose=%s)",
        exhaustiveDiagnostics, parallelism, verbose);
  }

  /** A Builder is used to construct ExpandWhensOptions. */
  public static class Builder {
    private boolean exhaustiveDiagnostics;
    private int parallelism = 1;
    private boolean verbose;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setExhaustiveDiagnostics(boolean exhaustiveDiagnostics) {
      this.exhaustiveDiagnostics = exhaustiveDiagnostics;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setParallelism(int parallelism) {
      Preconditions.checkArgument(
          parallelism >= 1, "parallelism must be positive: %s", parallelism);
      this.parallelism = parallelism;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setVerbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public ExpandWhensOptions build() {
      return new ExpandWhensOptions(this);
    }
  }
}
