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

/**
 * Declares a register with a reset: while {@link #reset} is asserted the register takes {@link
 * #resetValue}, otherwise it behaves like a {@link RegOp}.
 */
public final class RegResetOp extends DeclOp {

  RegResetOp(
      Location location, String name, HwType type, Value clock, Value reset, Value resetValue) {
    super(location, name, clock, reset, resetValue);
    addResult(type, name);
  }

  public Value clock() {
    return operand(0);
  }

  public Value reset() {
    return operand(1);
  }

  public Value resetValue() {
    return operand(2);
  }

  public OpResult result() {
    return result(0);
  }

  @Override
  public String opName() {
    return "regreset";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
