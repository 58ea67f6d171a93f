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

/** Declares a register clocked by its single operand. A register holds its value by default. */
public final class RegOp extends DeclOp {

  RegOp(Location location, String name, HwType type, Value clock) {
    super(location, name, clock);
    addResult(type, name);
  }

  public Value clock() {
    return operand(0);
  }

  public OpResult result() {
    return result(0);
  }

  @Override
  public String opName() {
    return "reg";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
