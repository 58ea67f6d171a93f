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

import java.util.Objects;

/** The name, direction and type of a port of a module, instance or memory. */
public record PortInfo(String name, Direction direction, HwType type, Location location) {
  public PortInfo {
    Objects.requireNonNull(name);
    Objects.requireNonNull(direction);
    Objects.requireNonNull(type);
    Objects.requireNonNull(location);
  }

  public static PortInfo in(String name, HwType type) {
    return new PortInfo(name, Direction.IN, type, Location.unknown());
  }

  public static PortInfo out(String name, HwType type) {
    return new PortInfo(name, Direction.OUT, type, Location.unknown());
  }
}
