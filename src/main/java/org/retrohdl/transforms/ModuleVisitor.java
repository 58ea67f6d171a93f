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
import org.retrohdl.ir.ConnectBase;
import org.retrohdl.ir.Direction;
import org.retrohdl.ir.FModule;
import org.retrohdl.ir.FieldRef;
import org.retrohdl.ir.Flow;
import org.retrohdl.ir.Location;
import org.retrohdl.ir.Operation;
import org.retrohdl.ir.PortValue;
import org.retrohdl.ir.WhenOp;

/**
 * Expands all the WhenOps in a module body and then checks that every sink in the module is
 * driven. A ModuleVisitor should only be used for a single module.
 */
final class ModuleVisitor extends LastConnectResolver {

  private FModule module;

  ModuleVisitor() {
    super(new ScopedDriverMap());
  }

  /**
   * Expands every WhenOp in {@code module}. Returns true if the IR was changed. Call {@link
   * #checkInitialization} afterwards to detect sinks that are not driven on every path.
   */
  boolean run(FModule module) {
    assert this.module == null;
    this.module = module;
    // Track any outputs of the module for initialization coverage.
    for (PortValue port : module.ports()) {
      declareSinks(port, (port.direction == Direction.IN) ? Flow.SOURCE : Flow.SINK);
    }
    boolean anythingChanged = false;
    for (Operation op : module.body()) {
      // Evaluate accept() first; it must be called for every op.
      anythingChanged = op.accept(this) | anythingChanged;
    }
    return anythingChanged;
  }

  @Override
  public Boolean visit(WhenOp op) {
    processWhenOp(op, null);
    return true;
  }

  /**
   * Throws an InitializationError for the first sink (in declaration order) that has no driver.
   * Should only be called after {@link #run}.
   */
  void checkInitialization() {
    for (FieldRef dest : driverMap.lastScope().fields()) {
      if (driverMap.lastScope().get(dest) == null) {
        throw uninitialized(dest);
      }
    }
  }

  /** Returns an InitializationError for every sink without a driver, in declaration order. */
  ImmutableList<InitializationError> findUninitialized() {
    ImmutableList.Builder<InitializationError> errors = ImmutableList.builder();
    DriverMap scope = driverMap.lastScope();
    for (FieldRef dest : scope.fields()) {
      ConnectBase connect = scope.get(dest);
      if (connect == null) {
        errors.add(uninitialized(dest));
      }
    }
    return errors.build();
  }

  private InitializationError uninitialized(FieldRef dest) {
    Location location = dest.value().location();
    if (location.isUnknown()) {
      location = module.location;
    }
    return new InitializationError(module.name, dest.fieldName(), location);
  }
}
