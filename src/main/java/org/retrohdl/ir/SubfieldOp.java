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
import org.retrohdl.ir.HwType.BundleType;

/** Selects one element of a bundle-typed value. */
public final class SubfieldOp extends Operation {
  public final int fieldIndex;

  SubfieldOp(Location location, Value input, int fieldIndex) {
    super(location, input);
    Preconditions.checkArgument(
        input.type() instanceof BundleType, "subfield of non-bundle %s", input.type());
    BundleType bundle = (BundleType) input.type();
    Preconditions.checkElementIndex(fieldIndex, bundle.numChildren());
    this.fieldIndex = fieldIndex;
    addResult(bundle.childType(fieldIndex), null);
  }

  public Value input() {
    return operand(0);
  }

  public OpResult result() {
    return result(0);
  }

  /** The name of the selected element. */
  public String fieldName() {
    return ((BundleType) input().type()).elements.get(fieldIndex).name();
  }

  @Override
  public String opName() {
    return "subfield";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
