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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An Operation is a single declaration, expression or statement in a module body. Each Operation
 * has a fixed number of operands (which may be replaced, but not added or removed) and zero or more
 * results.
 *
 * <p>Operations are linked into at most one {@link Block} at a time. Once {@link #erase erased} an
 * Operation may not be reinserted; holding a reference to an erased Operation is harmless, and
 * {@link #isErased} can be used to detect it.
 *
 * <p>The set of Operation subclasses is closed; code that needs to handle each kind should use an
 * {@link OpVisitor}.
 */
public abstract class Operation {
  private final Location location;
  private final List<Value> operands;
  private final List<OpResult> results = new ArrayList<>(1);

  /** The Block containing this Operation, or null if it is detached. */
  Block parent;

  /** The neighbouring Operations in {@link #parent}. */
  Operation prev;

  Operation next;

  private boolean erased;

  protected Operation(Location location, Value... operands) {
    this.location = location;
    this.operands = new ArrayList<>(Arrays.asList(operands));
    for (Value v : operands) {
      Preconditions.checkNotNull(v);
    }
  }

  /** Adds a result; should only be called from subclass constructors. */
  protected final OpResult addResult(HwType type, @Nullable String name) {
    OpResult result = new OpResult(this, results.size(), type, name);
    results.add(result);
    return result;
  }

  /** A short name for this kind of operation, used when printing. */
  public abstract String opName();

  /** Calls the {@code visitor} method corresponding to this Operation's kind. */
  public abstract <R> R accept(OpVisitor<R> visitor);

  public final Location location() {
    return location;
  }

  public final int numOperands() {
    return operands.size();
  }

  public final Value operand(int index) {
    return operands.get(index);
  }

  public final List<Value> operands() {
    return Collections.unmodifiableList(operands);
  }

  /** Replaces the operand at {@code index}. */
  public final void setOperand(int index, Value value) {
    Preconditions.checkState(!erased);
    operands.set(index, Preconditions.checkNotNull(value));
  }

  public final int numResults() {
    return results.size();
  }

  public final OpResult result(int index) {
    return results.get(index);
  }

  public final List<OpResult> results() {
    return Collections.unmodifiableList(results);
  }

  /** Returns the Block containing this Operation, or null if it is detached or erased. */
  public final @Nullable Block block() {
    return parent;
  }

  /** Returns the Operation following this one in its Block, or null if it is the last. */
  public final @Nullable Operation nextOp() {
    return next;
  }

  /** Returns the Operation preceding this one in its Block, or null if it is the first. */
  public final @Nullable Operation prevOp() {
    return prev;
  }

  public final boolean isErased() {
    return erased;
  }

  /** Removes this Operation from its Block (if any) and marks it erased. */
  public void erase() {
    Preconditions.checkState(!erased, "%s was already erased", this);
    if (parent != null) {
      parent.unlink(this);
    }
    erased = true;
  }

  @Override
  public String toString() {
    return opName() + "@" + location;
  }
}
