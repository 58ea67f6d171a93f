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
import org.jspecify.annotations.Nullable;

/**
 * A structured conditional: the statements of {@link #thenBlock} take effect when the one-bit
 * condition is set, and those of the optional {@link #elseBlock} when it is clear.
 */
public final class WhenOp extends Operation {
  private final Block thenBlock;
  private final @Nullable Block elseBlock;

  WhenOp(Location location, Value condition, boolean withElse) {
    super(location, condition);
    Preconditions.checkArgument(
        condition.type().equals(HwType.BOOL), "when condition has type %s", condition.type());
    this.thenBlock = new Block(this);
    this.elseBlock = withElse ? new Block(this) : null;
  }

  public Value condition() {
    return operand(0);
  }

  public Block thenBlock() {
    return thenBlock;
  }

  public boolean hasElse() {
    return elseBlock != null;
  }

  /** Should only be called if {@link #hasElse} is true. */
  public Block elseBlock() {
    Preconditions.checkState(elseBlock != null, "when has no else block");
    return elseBlock;
  }

  /** Erases this WhenOp together with any Operations still in its blocks. */
  @Override
  public void erase() {
    thenBlock.eraseAll();
    if (elseBlock != null) {
      elseBlock.eraseAll();
    }
    super.erase();
  }

  @Override
  public String opName() {
    return "when";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
