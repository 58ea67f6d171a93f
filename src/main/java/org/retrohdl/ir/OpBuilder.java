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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.retrohdl.ir.HwType.BundleType;

/**
 * An OpBuilder creates Operations and inserts them at its insertion point. Successive insertions
 * are placed in order, each after the previous one.
 *
 * <p>Each created Operation is given the builder's current location (initially unknown), which can
 * be changed with {@link #setLocation}.
 */
public final class OpBuilder {
  private final Block block;

  /** New Operations are inserted before this one; if null, at the end of {@link #block}. */
  private final @Nullable Operation before;

  private Location location = Location.unknown();

  private OpBuilder(Block block, @Nullable Operation before) {
    this.block = block;
    this.before = before;
  }

  /** Returns a builder that appends to {@code block}. */
  public static OpBuilder atEnd(Block block) {
    return new OpBuilder(block, null);
  }

  /** Returns a builder that inserts immediately before {@code op}. */
  public static OpBuilder before(Operation op) {
    Preconditions.checkArgument(op.block() != null, "%s is not in a block", op);
    return new OpBuilder(op.block(), op);
  }

  /** Returns a builder that inserts immediately after {@code op}. */
  public static OpBuilder after(Operation op) {
    Preconditions.checkArgument(op.block() != null, "%s is not in a block", op);
    return new OpBuilder(op.block(), op.nextOp());
  }

  /** Sets the location given to subsequently created Operations. */
  @CanIgnoreReturnValue
  public OpBuilder setLocation(Location location) {
    this.location = Preconditions.checkNotNull(location);
    return this;
  }

  public Location location() {
    return location;
  }

  /** Inserts a detached Operation at the insertion point. */
  @CanIgnoreReturnValue
  public <T extends Operation> T insert(T op) {
    if (before == null) {
      block.append(op);
    } else {
      block.insertBefore(before, op);
    }
    return op;
  }

  // Declarations

  @CanIgnoreReturnValue
  public WireOp wire(String name, HwType type) {
    return insert(new WireOp(location, name, type));
  }

  @CanIgnoreReturnValue
  public RegOp reg(String name, HwType type, Value clock) {
    return insert(new RegOp(location, name, type, clock));
  }

  @CanIgnoreReturnValue
  public RegResetOp regReset(
      String name, HwType type, Value clock, Value reset, Value resetValue) {
    return insert(new RegResetOp(location, name, type, clock, reset, resetValue));
  }

  @CanIgnoreReturnValue
  public NodeOp node(String name, Value input) {
    return insert(new NodeOp(location, name, input));
  }

  @CanIgnoreReturnValue
  public InstanceOp instance(String name, String moduleName, PortInfo... ports) {
    return insert(new InstanceOp(location, name, moduleName, ImmutableList.copyOf(ports)));
  }

  /** Declares a memory with one result per entry of {@code ports}, in iteration order. */
  @CanIgnoreReturnValue
  public MemOp mem(String name, int depth, ImmutableMap<String, HwType> ports) {
    return insert(
        new MemOp(
            location,
            name,
            depth,
            ImmutableList.copyOf(ports.keySet()),
            ImmutableList.copyOf(ports.values())));
  }

  // Expressions

  public Value constant(HwType type, long value) {
    return insert(new ConstantOp(location, type, value)).result();
  }

  public Value invalid(HwType type) {
    return insert(new InvalidValueOp(location, type)).result();
  }

  public Value subfield(Value input, int index) {
    return insert(new SubfieldOp(location, input, index)).result();
  }

  public Value subfield(Value input, String name) {
    Preconditions.checkArgument(input.type() instanceof BundleType, "%s is not a bundle", input);
    int index = ((BundleType) input.type()).elementIndex(name);
    Preconditions.checkArgument(index >= 0, "%s has no field %s", input, name);
    return subfield(input, index);
  }

  public Value subindex(Value input, int index) {
    return insert(new SubindexOp(location, input, index)).result();
  }

  public Value and(Value lhs, Value rhs) {
    return insert(new AndPrimOp(location, lhs, rhs)).result();
  }

  public Value not(Value input) {
    return insert(new NotPrimOp(location, input)).result();
  }

  public Value mux(Value sel, Value high, Value low) {
    return insert(new MuxPrimOp(location, sel, high, low)).result();
  }

  // Statements

  @CanIgnoreReturnValue
  public ConnectOp connect(Value dest, Value src) {
    return insert(new ConnectOp(location, dest, src));
  }

  @CanIgnoreReturnValue
  public StrictConnectOp strictConnect(Value dest, Value src) {
    return insert(new StrictConnectOp(location, dest, src));
  }

  @CanIgnoreReturnValue
  public PartialConnectOp partialConnect(Value dest, Value src) {
    return insert(new PartialConnectOp(location, dest, src));
  }

  @CanIgnoreReturnValue
  public WhenOp when(Value condition, boolean withElse) {
    return insert(new WhenOp(location, condition, withElse));
  }

  @CanIgnoreReturnValue
  public AssertOp assertOp(Value clock, Value predicate, Value enable, String message) {
    return insert(new AssertOp(location, clock, predicate, enable, message));
  }

  @CanIgnoreReturnValue
  public AssumeOp assume(Value clock, Value predicate, Value enable, String message) {
    return insert(new AssumeOp(location, clock, predicate, enable, message));
  }

  @CanIgnoreReturnValue
  public CoverOp cover(Value clock, Value predicate, Value enable, String message) {
    return insert(new CoverOp(location, clock, predicate, enable, message));
  }

  @CanIgnoreReturnValue
  public PrintFOp printf(Value clock, Value cond, String format, Value... args) {
    return insert(new PrintFOp(location, clock, cond, format, args));
  }

  @CanIgnoreReturnValue
  public StopOp stop(Value clock, Value cond, int exitCode) {
    return insert(new StopOp(location, clock, cond, exitCode));
  }
}
