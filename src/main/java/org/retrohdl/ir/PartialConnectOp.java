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
 * The legacy connect that only drives the fields the source and destination have in common. It
 * must be lowered to {@link ConnectOp}s before when-expansion.
 */
public final class PartialConnectOp extends Operation {

  PartialConnectOp(Location location, Value dest, Value src) {
    super(location, dest, src);
  }

  public Value dest() {
    return operand(0);
  }

  public Value src() {
    return operand(1);
  }

  @Override
  public String opName() {
    return "partialconnect";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
