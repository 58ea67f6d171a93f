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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.retrohdl.ir.ConnectBase;
import org.retrohdl.ir.FieldRef;

/**
 * One scope of a {@link ScopedDriverMap}: maps each tracked field to the connect that currently
 * drives it, or to null if the field has been declared but not yet driven.
 *
 * <p>Iteration is in insertion order, so everything derived from a DriverMap is deterministic.
 */
final class DriverMap {
  private final LinkedHashMap<FieldRef, @Nullable ConnectBase> drivers = new LinkedHashMap<>();

  /** True if {@code field} is tracked in this scope, even if it has no driver yet. */
  boolean containsKey(FieldRef field) {
    return drivers.containsKey(field);
  }

  /**
   * Returns the driver of {@code field}, or null if it is either not tracked here or not yet
   * driven; use {@link #containsKey} to distinguish.
   */
  @Nullable ConnectBase get(FieldRef field) {
    return drivers.get(field);
  }

  /** Sets the driver of {@code field} and returns the previous one (null if there was none). */
  @Nullable ConnectBase put(FieldRef field, @Nullable ConnectBase connect) {
    return drivers.put(field, connect);
  }

  /** Stops tracking {@code field} in this scope. */
  void remove(FieldRef field) {
    drivers.remove(field);
  }

  /** Returns a snapshot of this scope's fields in insertion order. */
  ImmutableList<FieldRef> fields() {
    return ImmutableList.copyOf(drivers.keySet());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<FieldRef, ConnectBase> entry : drivers.entrySet()) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(entry.getKey()).append(entry.getValue() == null ? ": undriven" : ": driven");
    }
    return sb.append('}').toString();
  }
}
