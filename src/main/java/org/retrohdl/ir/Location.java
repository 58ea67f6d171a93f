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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The source position an IR entity was derived from. A Location is either unknown, a single
 * file/line/column position, or a fused combination of several positions (used for operations
 * synthesized from more than one source statement).
 *
 * <p>Locations are immutable and compare by value.
 */
public final class Location {

  private static final Location UNKNOWN = new Location(null, 0, 0, ImmutableList.of());

  /** Null for unknown and fused locations. */
  private final String file;

  private final int line;
  private final int column;

  /** Non-empty only for fused locations. */
  private final ImmutableList<Location> parts;

  private Location(String file, int line, int column, ImmutableList<Location> parts) {
    this.file = file;
    this.line = line;
    this.column = column;
    this.parts = parts;
  }

  public static Location unknown() {
    return UNKNOWN;
  }

  public static Location of(String file, int line, int column) {
    return new Location(Objects.requireNonNull(file), line, column, ImmutableList.of());
  }

  /**
   * Returns a location combining the given ones. Unknown locations are dropped, nested fused
   * locations are flattened and duplicates removed; if at most one distinct location remains it is
   * returned directly.
   */
  public static Location fused(Location... locations) {
    Set<Location> distinct = new LinkedHashSet<>();
    for (Location loc : locations) {
      if (loc.isFused()) {
        distinct.addAll(loc.parts);
      } else if (loc != UNKNOWN) {
        distinct.add(loc);
      }
    }
    if (distinct.isEmpty()) {
      return UNKNOWN;
    } else if (distinct.size() == 1) {
      return distinct.iterator().next();
    }
    return new Location(null, 0, 0, ImmutableList.copyOf(distinct));
  }

  public boolean isUnknown() {
    return this == UNKNOWN;
  }

  public boolean isFused() {
    return !parts.isEmpty();
  }

  /** The locations combined by a fused location; empty otherwise. */
  public ImmutableList<Location> parts() {
    return parts;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Location other)) {
      return false;
    }
    return line == other.line
        && column == other.column
        && Objects.equals(file, other.file)
        && parts.equals(other.parts);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column, parts);
  }

  @Override
  public String toString() {
    if (isUnknown()) {
      return "loc(unknown)";
    } else if (isFused()) {
      return "loc(fused" + parts + ")";
    }
    return String.format("%s:%d:%d", file, line, column);
  }
}
