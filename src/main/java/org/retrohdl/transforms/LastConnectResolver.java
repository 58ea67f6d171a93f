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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.retrohdl.ir.AndPrimOp;
import org.retrohdl.ir.AssertOp;
import org.retrohdl.ir.AssumeOp;
import org.retrohdl.ir.Block;
import org.retrohdl.ir.ConnectBase;
import org.retrohdl.ir.ConnectOp;
import org.retrohdl.ir.ConstantOp;
import org.retrohdl.ir.CoverOp;
import org.retrohdl.ir.Direction;
import org.retrohdl.ir.FieldRef;
import org.retrohdl.ir.Flow;
import org.retrohdl.ir.HwType;
import org.retrohdl.ir.HwType.AnalogType;
import org.retrohdl.ir.HwType.BundleType;
import org.retrohdl.ir.HwType.VectorType;
import org.retrohdl.ir.InstanceOp;
import org.retrohdl.ir.InvalidValueOp;
import org.retrohdl.ir.Location;
import org.retrohdl.ir.MemOp;
import org.retrohdl.ir.MuxPrimOp;
import org.retrohdl.ir.NodeOp;
import org.retrohdl.ir.NotPrimOp;
import org.retrohdl.ir.OpBuilder;
import org.retrohdl.ir.OpResult;
import org.retrohdl.ir.OpVisitor;
import org.retrohdl.ir.Operation;
import org.retrohdl.ir.PartialConnectOp;
import org.retrohdl.ir.PrintFOp;
import org.retrohdl.ir.RegOp;
import org.retrohdl.ir.RegResetOp;
import org.retrohdl.ir.StopOp;
import org.retrohdl.ir.StrictConnectOp;
import org.retrohdl.ir.SubfieldOp;
import org.retrohdl.ir.SubindexOp;
import org.retrohdl.ir.Value;
import org.retrohdl.ir.WhenOp;
import org.retrohdl.ir.WireOp;

/**
 * Processes the statements of a block, resolving last-connect semantics and recursively expanding
 * WhenOps.
 *
 * <p>Each {@code visit} method returns true if it changed the IR (other than by expanding nested
 * WhenOps, which always changes it). There are two subclasses: {@link ModuleVisitor} for the module
 * body and {@link WhenOpVisitor} for the blocks of a WhenOp.
 */
abstract class LastConnectResolver implements OpVisitor<Boolean> {

  /**
   * Maps each destination to the connect driving it in the current scope. This is used both to
   * resolve last-connect semantics and to find the connects that must be merged at the end of a
   * WhenOp.
   */
  final ScopedDriverMap driverMap;

  LastConnectResolver(ScopedDriverMap driverMap) {
    this.driverMap = driverMap;
  }

  /**
   * Records {@code connect} as the driver of {@code dest} in the current scope, erasing any
   * previous connect to {@code dest} in the same scope. Returns true if an old connect was erased.
   */
  @CanIgnoreReturnValue
  boolean setLastConnect(FieldRef dest, ConnectBase connect) {
    DriverMap scope = driverMap.lastScope();
    if (!scope.containsKey(dest)) {
      scope.put(dest, connect);
      return false;
    }
    // Null entries are inserted by declarations and have nothing to erase.
    ConnectBase oldConnect = scope.put(dest, connect);
    if (oldConnect != null) {
      oldConnect.erase();
      return true;
    }
    return false;
  }

  /**
   * Records that each ground field of {@code value} that is a sink or duplex (given that {@code
   * value} itself has the given flow) exists and must be driven.
   */
  void declareSinks(Value value, Flow flow) {
    declareSinks(value, value.type(), flow, 0);
  }

  /**
   * Declares the sinks within the field of {@code root} with the given type and field id. Returns
   * the largest field id in that field's subtree.
   */
  private int declareSinks(Value root, HwType type, Flow flow, int fieldId) {
    if (type instanceof BundleType bundle) {
      for (BundleType.Element element : bundle.elements) {
        Flow elementFlow = element.flip() ? flow.swap() : flow;
        fieldId = declareSinks(root, element.type(), elementFlow, fieldId + 1);
      }
    } else if (type instanceof VectorType vector) {
      for (int i = 0; i < vector.size; i++) {
        fieldId = declareSinks(root, vector.elementType, flow, fieldId + 1);
      }
    } else if (!(type instanceof AnalogType) && flow != Flow.SOURCE) {
      // Analog fields are bidirectional and never need to be driven.
      driverMap.declare(new FieldRef(root, fieldId));
    }
    return fieldId;
  }

  /**
   * Creates the subfield and subindex operations that select each ground field of {@code value},
   * and calls {@code fn} with each of them.
   */
  private static void forEachSubelement(OpBuilder builder, Value value, Consumer<Value> fn) {
    HwType type = value.type();
    if (type instanceof BundleType) {
      for (int i = 0; i < type.numChildren(); i++) {
        forEachSubelement(builder, builder.subfield(value, i), fn);
      }
    } else if (type instanceof VectorType) {
      for (int i = 0; i < type.numChildren(); i++) {
        forEachSubelement(builder, builder.subindex(value, i), fn);
      }
    } else {
      fn.accept(value);
    }
  }

  /**
   * Registers hold their value unless connected, so each ground field of a register is driven by
   * itself until something else drives it.
   */
  private void initializeRegister(Operation op, Value register) {
    OpBuilder builder = OpBuilder.after(op).setLocation(op.location());
    forEachSubelement(
        builder,
        register,
        leaf -> driverMap.lastScope().put(FieldRef.of(leaf), builder.connect(leaf, leaf)));
  }

  /**
   * Returns a connect to {@code dest} (inserted by {@code b}) of a mux that selects between the
   * values connected by {@code whenTrueConn} and {@code whenFalseConn}.
   *
   * <p>If exactly one of those values is invalid the other is connected directly, since an invalid
   * value may take any value (including the other one). That is only valid here, where the mux
   * would otherwise be introduced by expansion; it is not a legal rewrite of an arbitrary mux.
   */
  static ConnectOp flattenConditionalConnections(
      OpBuilder b,
      Location loc,
      Value dest,
      Value cond,
      ConnectBase whenTrueConn,
      ConnectBase whenFalseConn) {
    Location fusedLoc = Location.fused(loc, whenTrueConn.location(), whenFalseConn.location());
    Value whenTrue = whenTrueConn.src();
    boolean trueIsInvalid = InvalidValueOp.isInvalid(whenTrue);
    Value whenFalse = whenFalseConn.src();
    boolean falseIsInvalid = InvalidValueOp.isInvalid(whenFalse);
    // mux(cond, invalid, x) -> x
    // mux(cond, x, invalid) -> x
    Value newValue = whenTrue;
    if (trueIsInvalid == falseIsInvalid) {
      newValue = b.setLocation(fusedLoc).mux(cond, whenTrue, whenFalse);
    } else if (trueIsInvalid) {
      newValue = whenFalse;
    }
    return b.setLocation(loc).connect(dest, newValue);
  }

  /**
   * Expands {@code whenOp}: the statements of both blocks are processed and moved into the parent
   * block, the connects made in each block are merged into the enclosing scope, and the WhenOp is
   * erased.
   *
   * @param outerCondition the conjunction of the conditions of all enclosing WhenOps, or null if
   *     {@code whenOp} is in the module body
   */
  void processWhenOp(WhenOp whenOp, @Nullable Value outerCondition) {
    Location loc = whenOp.location();
    OpBuilder b = OpBuilder.before(whenOp).setLocation(loc);
    Block parentBlock = whenOp.block();
    Value condition = whenOp.condition();

    // Process the then block. If we are already inside a when, its statements are also
    // conditional on the outer condition.
    Value thenCondition = condition;
    if (outerCondition != null) {
      thenCondition = b.and(outerCondition, thenCondition);
    }
    Block thenBlock = whenOp.thenBlock();
    driverMap.pushScope();
    new WhenOpVisitor(driverMap, thenCondition).process(thenBlock);
    parentBlock.spliceBefore(whenOp, thenBlock);
    DriverMap thenScope = driverMap.popScope();

    DriverMap elseScope = new DriverMap();
    if (whenOp.hasElse()) {
      Value elseCondition = b.not(condition);
      if (outerCondition != null) {
        elseCondition = b.and(outerCondition, elseCondition);
      }
      Block elseBlock = whenOp.elseBlock();
      driverMap.pushScope();
      new WhenOpVisitor(driverMap, elseCondition).process(elseBlock);
      parentBlock.spliceBefore(whenOp, elseBlock);
      elseScope = driverMap.popScope();
    }

    mergeScopes(loc, thenScope, elseScope, condition);

    // Both blocks are now empty.
    whenOp.erase();
  }

  /**
   * Combines the connects from each side of a WhenOp into the enclosing scope:
   *
   * <pre>
   * Prev | Then | Else | Outcome
   * -----|------|------|-------
   *      |  set |      | then
   *      |      |  set | else
   *  set |  set |  set | mux(p, then, else)
   *      |  set |  set | impossible
   *  set |  set |      | mux(p, then, prev)
   *  set |      |  set | mux(p, prev, else)
   * </pre>
   *
   * A field that is only set in one branch must have been declared in that branch, so it is just
   * copied to the enclosing scope. A field that was declared before the WhenOp but has no driver
   * there is an initialization error if it is set in only one branch; that connect is discarded so
   * that the field is reported as uninitialized.
   */
  private void mergeScopes(
      Location loc, DriverMap thenScope, DriverMap elseScope, Value thenCondition) {
    for (FieldRef dest : thenScope.fields()) {
      ConnectBase thenConnect = thenScope.get(dest);
      DriverMap outer = driverMap.scopeOf(dest);
      if (outer == null) {
        // A field declared in the then block can't be connected in the else block.
        Preconditions.checkState(
            !elseScope.containsKey(dest),
            "%s is driven in both blocks of a when but not declared outside it",
            dest);
        driverMap.lastScope().put(dest, thenConnect);
        continue;
      }
      // Fields tracked outside the WhenOp are only added to a branch scope by connects.
      assert thenConnect != null;

      ConnectBase elseConnect = elseScope.get(dest);
      if (elseConnect != null) {
        // Set in both blocks; any previous connect is superseded.
        ConnectOp newConnect =
            flattenConditionalConnections(
                OpBuilder.before(elseConnect),
                loc,
                thenConnect.dest(),
                thenCondition,
                thenConnect,
                elseConnect);
        thenConnect.erase();
        elseConnect.erase();
        setLastConnect(dest, newConnect);
        elseScope.remove(dest);
        continue;
      }

      ConnectBase outerConnect = outer.get(dest);
      if (outerConnect == null) {
        // mux(p, then, <nothing>)
        thenConnect.erase();
        continue;
      }

      ConnectOp newConnect =
          flattenConditionalConnections(
              OpBuilder.before(thenConnect),
              loc,
              thenConnect.dest(),
              thenCondition,
              thenConnect,
              outerConnect);
      thenConnect.erase();
      setLastConnect(dest, newConnect);
    }

    for (FieldRef dest : elseScope.fields()) {
      ConnectBase elseConnect = elseScope.get(dest);
      DriverMap outer = driverMap.scopeOf(dest);
      if (outer == null) {
        driverMap.lastScope().put(dest, elseConnect);
        continue;
      }
      assert elseConnect != null;

      ConnectBase outerConnect = outer.get(dest);
      if (outerConnect == null) {
        // mux(p, <nothing>, else)
        elseConnect.erase();
        continue;
      }

      ConnectOp newConnect =
          flattenConditionalConnections(
              OpBuilder.before(elseConnect),
              loc,
              outerConnect.dest(),
              thenCondition,
              outerConnect,
              elseConnect);
      elseConnect.erase();
      setLastConnect(dest, newConnect);
    }
  }

  // Declarations

  @Override
  public Boolean visit(WireOp op) {
    declareSinks(op.result(), Flow.DUPLEX);
    return false;
  }

  @Override
  public Boolean visit(RegOp op) {
    initializeRegister(op, op.result());
    return true;
  }

  @Override
  public Boolean visit(RegResetOp op) {
    initializeRegister(op, op.result());
    return true;
  }

  @Override
  public Boolean visit(NodeOp op) {
    return false;
  }

  @Override
  public Boolean visit(InstanceOp op) {
    // An instance's inputs must be driven by this module; its outputs drive values into it.
    for (OpResult result : op.results()) {
      Flow flow = (op.portDirection(result.index) == Direction.OUT) ? Flow.SOURCE : Flow.SINK;
      declareSinks(result, flow);
    }
    return false;
  }

  @Override
  public Boolean visit(MemOp op) {
    for (OpResult result : op.results()) {
      declareSinks(result, Flow.SINK);
    }
    return false;
  }

  // Expressions

  @Override
  public Boolean visit(ConstantOp op) {
    return false;
  }

  @Override
  public Boolean visit(InvalidValueOp op) {
    return false;
  }

  @Override
  public Boolean visit(SubfieldOp op) {
    return false;
  }

  @Override
  public Boolean visit(SubindexOp op) {
    return false;
  }

  @Override
  public Boolean visit(AndPrimOp op) {
    return false;
  }

  @Override
  public Boolean visit(NotPrimOp op) {
    return false;
  }

  @Override
  public Boolean visit(MuxPrimOp op) {
    return false;
  }

  // Statements

  @Override
  public Boolean visit(ConnectOp op) {
    return setLastConnect(FieldRef.of(op.dest()), op);
  }

  @Override
  public Boolean visit(StrictConnectOp op) {
    return setLastConnect(FieldRef.of(op.dest()), op);
  }

  @Override
  public Boolean visit(PartialConnectOp op) {
    throw new AssertionError("PartialConnectOps should have been removed: " + op);
  }

  // Verification and simulation statements need no processing outside a WhenOp.

  @Override
  public Boolean visit(AssertOp op) {
    return false;
  }

  @Override
  public Boolean visit(AssumeOp op) {
    return false;
  }

  @Override
  public Boolean visit(CoverOp op) {
    return false;
  }

  @Override
  public Boolean visit(PrintFOp op) {
    return false;
  }

  @Override
  public Boolean visit(StopOp op) {
    return false;
  }
}
