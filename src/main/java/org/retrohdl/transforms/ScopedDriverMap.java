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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.retrohdl.ir.FieldRef;

/**
 * A stack of {@link DriverMap}s, one for the module body and one for each enclosing branch of a
 * when that is currently being processed.
 *
 * <p>Lookups search from the innermost scope outward; new entries are only ever added to the
 * innermost scope. Unlike a conventional scoped symbol table, popping a scope hands its contents
 * back to the caller, since merging the branches of a when needs them.
 */
final class ScopedDriverMap {
  private final List<DriverMap> stack = new ArrayList<>();

  /** Creates a ScopedDriverMap with a single (module) scope. */
  ScopedDriverMap() {
    pushScope();
  }

  void pushScope() {
    stack.add(new DriverMap());
  }

  /** Removes and returns the innermost scope; the module scope can never be popped. */
  DriverMap popScope() {
    Preconditions.checkState(stack.size() > 1, "Cannot pop the last scope");
    return stack.remove(stack.size() - 1);
  }

  /** Returns the innermost scope. */
  DriverMap lastScope() {
    return stack.get(stack.size() - 1);
  }

  /** Returns the innermost scope that tracks {@code field}, or null if none does. */
  @Nullable DriverMap scopeOf(FieldRef field) {
    for (int i = stack.size() - 1; i >= 0; i--) {
      DriverMap scope = stack.get(i);
      if (scope.containsKey(field)) {
        return scope;
      }
    }
    return null;
  }

  /**
   * Starts tracking {@code field} in the innermost scope as a field that must be driven. Has no
   * effect if it is already tracked there.
   */
  void declare(FieldRef field) {
    DriverMap scope = lastScope();
    if (!scope.containsKey(field)) {
      scope.put(field, null);
    }
  }
}
