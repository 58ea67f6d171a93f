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

/** Ends simulation with {@link #exitCode} on the first clock edge at which the condition holds. */
public final class StopOp extends Operation {
  public final int exitCode;

  StopOp(Location location, Value clock, Value cond, int exitCode) {
    super(location, clock, cond);
    this.exitCode = exitCode;
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

  @Override
  public String opName() {
    return "stop";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
