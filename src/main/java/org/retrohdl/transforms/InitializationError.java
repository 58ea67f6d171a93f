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

import org.retrohdl.ir.Location;

/**
 * Reports a sink that is not driven on every path through a module. The module's IR has already
 * been transformed by the time this is thrown.
 */
public class InitializationError extends RuntimeException {
  public final String moduleName;
  public final String fieldName;
  public final Location location;

  public InitializationError(String moduleName, String fieldName, Location location) {
    super(String.format("sink \"%s\" not fully initialized", fieldName));
    this.moduleName = moduleName;
    this.fieldName = fieldName;
    this.location = location;
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s (in module %s)", location, super.getMessage(), moduleName);
  }
}
