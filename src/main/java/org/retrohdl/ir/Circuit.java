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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** A named collection of modules. */
public final class Circuit {
  public final String name;
  private final List<FModule> modules = new ArrayList<>();

  public Circuit(String name) {
    this.name = name;
  }

  public void addModule(FModule module) {
    Preconditions.checkArgument(
        modules.stream().noneMatch(m -> m.name.equals(module.name)),
        "duplicate module %s",
        module.name);
    modules.add(module);
  }

  /** Returns the modules in the order they were added. */
  public ImmutableList<FModule> modules() {
    return ImmutableList.copyOf(modules);
  }

  public FModule module(String moduleName) {
    return modules.stream()
        .filter(m -> m.name.equals(moduleName))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No module " + moduleName));
  }
}
