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

/** A module port, visible in the module body as a value. */
public final class PortValue extends Value {
  public final int index;
  private final String name;
  public final Direction direction;
  private final Location location;

  PortValue(int index, String name, Direction direction, HwType type, Location location) {
    super(type);
    this.index = index;
    this.name = name;
    this.direction = direction;
    this.location = location;
  }

  @Override
  public @Nullable Operation definingOp() {
    return null;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Location location() {
    return location;
  }

  @Override
  public String toString() {
    return name;
  }
}
