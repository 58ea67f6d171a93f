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

package org.retrohdl.transforms;

import org.retrohdl.ir.AssertOp;
import org.retrohdl.ir.AssumeOp;
import org.retrohdl.ir.Block;
import org.retrohdl.ir.CoverOp;
import org.retrohdl.ir.OpBuilder;
import org.retrohdl.ir.Operation;
import org.retrohdl.ir.PrintFOp;
import org.retrohdl.ir.StopOp;
import org.retrohdl.ir.Value;
import org.retrohdl.ir.WhenOp;

/**
 * Processes one block of a WhenOp. In addition to what {@link LastConnectResolver} does, the
 * verification and simulation statements in the block are made conditional on the path to it.
 */
final class WhenOpVisitor extends LastConnectResolver {

  /** The conjunction of the conditions of every WhenOp enclosing the block. */
  private final Value condition;

  WhenOpVisitor(ScopedDriverMap driverMap, Value condition) {
    super(driverMap);
    this.condition = condition;
  }

  /** Processes each statement in {@code block}, expanding any nested WhenOps. */
  void process(Block block) {
    for (Operation op : block) {
      op.accept(this);
    }
  }

  /** Returns the conjunction of the path condition and {@code value}, built before {@code op}. */
  private Value andWithCondition(Operation op, Value value) {
    return OpBuilder.before(op).setLocation(condition.location()).and(condition, value);
  }

  @Override
  public Boolean visit(AssertOp op) {
    op.setEnable(andWithCondition(op, op.enable()));
    return true;
  }

  @Override
  public Boolean visit(AssumeOp op) {
    op.setEnable(andWithCondition(op, op.enable()));
    return true;
  }

  @Override
  public Boolean visit(CoverOp op) {
    op.setEnable(andWithCondition(op, op.enable()));
    return true;
  }

  @Override
  public Boolean visit(PrintFOp op) {
    op.setCond(andWithCondition(op, op.cond()));
    return true;
  }

  @Override
  public Boolean visit(StopOp op) {
    op.setCond(andWithCondition(op, op.cond()));
    return true;
  }

  @Override
  public Boolean visit(WhenOp op) {
    processWhenOp(op, condition);
    return true;
  }
}
