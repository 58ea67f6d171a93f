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
import org.retrohdl.ir.HwType.GroundType;

/** Bitwise and of two unsigned values; the result is as wide as the wider operand. */
public final class AndPrimOp extends Operation {

  AndPrimOp(Location location, Value lhs, Value rhs) {
    super(location, lhs, rhs);
    addResult(HwType.uint(Math.max(width(lhs), width(rhs))), null);
  }

  static int width(Value v) {
    Preconditions.checkArgument(v.type().isGround(), "expected a ground type, got %s", v.type());
    return ((GroundType) v.type()).width;
  }

  public Value lhs() {
    return operand(0);
  }

  public Value rhs() {
    return operand(1);
  }

  public OpResult result() {
    return result(0);
  }

  @Override
  public String opName() {
    return "and";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
