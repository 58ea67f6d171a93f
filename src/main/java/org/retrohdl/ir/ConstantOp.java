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

/** A literal integer value of a ground type. */
public final class ConstantOp extends Operation {
  public final long value;

  ConstantOp(Location location, HwType type, long value) {
    super(location);
    Preconditions.checkArgument(type.isGround(), "constant of non-ground type %s", type);
    this.value = value;
    addResult(type, null);
  }

  public OpResult result() {
    return result(0);
  }

  @Override
  public String opName() {
    return "constant";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
