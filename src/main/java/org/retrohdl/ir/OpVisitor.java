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
 * A visitor over every kind of {@link Operation}. There are no default methods; adding a new kind
 * of Operation requires updating every implementation.
 */
public interface OpVisitor<R> {

  // Declarations

  R visit(WireOp op);

  R visit(RegOp op);

  R visit(RegResetOp op);

  R visit(NodeOp op);

  R visit(InstanceOp op);

  R visit(MemOp op);

  // Expressions

  R visit(ConstantOp op);

  R visit(InvalidValueOp op);

  R visit(SubfieldOp op);

  R visit(SubindexOp op);

  R visit(AndPrimOp op);

  R visit(NotPrimOp op);

  R visit(MuxPrimOp op);

  // Statements

  R visit(ConnectOp op);

  R visit(StrictConnectOp op);

  R visit(PartialConnectOp op);

  R visit(WhenOp op);

  R visit(AssertOp op);

  R visit(AssumeOp op);

  R visit(CoverOp op);

  R visit(PrintFOp op);

  R visit(StopOp op);
}
