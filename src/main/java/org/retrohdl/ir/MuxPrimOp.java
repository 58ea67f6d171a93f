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

/** Selects {@link #high} if the one-bit selector is set, otherwise {@link #low}. */
public final class MuxPrimOp extends Operation {

  MuxPrimOp(Location location, Value sel, Value high, Value low) {
    super(location, sel, high, low);
    addResult(resultType(high.type(), low.type()), null);
  }

  /** Ground operands of the same kind may differ in width; the result takes the wider one. */
  private static HwType resultType(HwType high, HwType low) {
    if (high.equals(low)) {
      return high;
    }
    Preconditions.checkArgument(
        high instanceof GroundType h && low instanceof GroundType l && h.kind == l.kind,
        "mux of %s and %s",
        high,
        low);
    return (((GroundType) high).width >= ((GroundType) low).width) ? high : low;
  }

  public Value sel() {
    return operand(0);
  }

  public Value high() {
    return operand(1);
  }

  public Value low() {
    return operand(2);
  }

  public OpResult result() {
    return result(0);
  }

  @Override
  public String opName() {
    return "mux";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
