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

import java.util.List;

/** Prints a formatted message during simulation on each clock edge at which the condition holds. */
public final class PrintFOp extends Operation {
  public final String format;

  PrintFOp(Location location, Value clock, Value cond, String format, Value... args) {
    super(location, concat(clock, cond, args));
    this.format = format;
  }

  private static Value[] concat(Value clock, Value cond, Value[] args) {
    Value[] operands = new Value[args.length + 2];
    operands[0] = clock;
    operands[1] = cond;
    System.arraycopy(args, 0, operands, 2, args.length);
    return operands;
  }

  public Value clock() {
    return operand(0);
  }

  public Value cond() {
    return operand(1);
  }

  public void setCond(Value cond) {
    setOperand(1, cond);
  }

  /** The values substituted into {@link #format}. */
  public List<Value> args() {
    return operands().subList(2, numOperands());
  }

  @Override
  public String opName() {
    return "printf";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
