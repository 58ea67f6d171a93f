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

package org.retrohdl.ir;

import org.jspecify.annotations.Nullable;

/**
 * A Value is an SSA value in a module body: either a module port ({@link PortValue}) or a result
 * of an operation ({@link OpResult}). Values are compared by identity.
 */
public abstract class Value {
  private final HwType type;

  Value(HwType type) {
    this.type = type;
  }

  public final HwType type() {
    return type;
  }

  /** Returns the operation that produced this value, or null if it is a port. */
  public abstract @Nullable Operation definingOp();

  /**
   * Returns the user-visible name of this value (e.g. the name of the port, wire or register), or
   * null if it has none.
   */
  public abstract @Nullable String name();

  /** Returns the location where this value was declared. */
  public abstract Location location();
}
