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
 * A don't-care value: any bit pattern is acceptable wherever it is used. Connecting an invalid
 * value to a sink counts as initializing it.
 */
public final class InvalidValueOp extends Operation {

  InvalidValueOp(Location location, HwType type) {
    super(location);
    addResult(type, null);
  }

  public OpResult result() {
    return result(0);
  }

  /** Returns true if {@code value} was produced by an InvalidValueOp. */
  public static boolean isInvalid(Value value) {
    return value.definingOp() instanceof InvalidValueOp;
  }

  @Override
  public String opName() {
    return "invalidvalue";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
