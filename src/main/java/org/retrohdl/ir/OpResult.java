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

/** One of the results of an {@link Operation}. */
public final class OpResult extends Value {
  private final Operation owner;
  public final int index;
  private final @Nullable String name;

  OpResult(Operation owner, int index, HwType type, @Nullable String name) {
    super(type);
    this.owner = owner;
    this.index = index;
    this.name = name;
  }

  @Override
  public Operation definingOp() {
    return owner;
  }

  @Override
  public @Nullable String name() {
    return name;
  }

  @Override
  public Location location() {
    return owner.location();
  }

  @Override
  public String toString() {
    return (name != null) ? name : owner.opName() + "#" + index;
  }
}
