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

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a module as readable text, for debugging and tests. Named values (ports and declarations)
 * are printed by name; other results are numbered in order of appearance, so printing the same IR
 * twice always gives the same text.
 */
public final class IrPrinter implements OpVisitor<String> {

  private final StringBuilder sb = new StringBuilder();
  private final Map<Value, String> names = new HashMap<>();
  private int nextNumber;

  private IrPrinter() {}

  /** Returns the text of the given module. */
  public static String print(FModule module) {
    IrPrinter printer = new IrPrinter();
    printer.sb.append("module ").append(module.name).append('(');
    printer.sb.append(
        module.ports().stream()
            .map(p -> (p.direction == Direction.IN ? "in " : "out ") + p.name() + ": " + p.type())
            .collect(Collectors.joining(", ")));
    printer.sb.append(") {\n");
    printer.printBlock(module.body(), 1);
    printer.sb.append("}\n");
    return printer.sb.toString();
  }

  private void printBlock(Block block, int depth) {
    for (Operation op : block) {
      indent(depth);
      sb.append(op.accept(this)).append('\n');
      if (op instanceof WhenOp when) {
        printBlock(when.thenBlock(), depth + 1);
        if (when.hasElse()) {
          indent(depth);
          sb.append("} else {\n");
          printBlock(when.elseBlock(), depth + 1);
        }
        indent(depth);
        sb.append("}\n");
      }
    }
  }

  private void indent(int depth) {
    sb.append("  ".repeat(depth));
  }

  private String name(Value v) {
    return names.computeIfAbsent(
        v, k -> "%" + (k.name() != null ? k.name() : String.valueOf(nextNumber++)));
  }

  /** Formats an operation with a single result. */
  private String def(Operation op, String rest) {
    return name(op.result(0)) + " = " + op.opName() + rest + " : " + op.result(0).type();
  }

  private String args(Operation op) {
    return op.operands().stream().map(this::name).collect(Collectors.joining(", "));
  }

  @Override
  public String visit(WireOp op) {
    return def(op, "");
  }

  @Override
  public String visit(RegOp op) {
    return def(op, " " + args(op));
  }

  @Override
  public String visit(RegResetOp op) {
    return def(op, " " + args(op));
  }

  @Override
  public String visit(NodeOp op) {
    return def(op, " " + args(op));
  }

  @Override
  public String visit(InstanceOp op) {
    String results = op.results().stream().map(this::name).collect(Collectors.joining(", "));
    return results + " = instance " + op.name + " of " + op.moduleName;
  }

  @Override
  public String visit(MemOp op) {
    String results = op.results().stream().map(this::name).collect(Collectors.joining(", "));
    return results + " = mem " + op.name + " depth " + op.depth;
  }

  @Override
  public String visit(ConstantOp op) {
    return def(op, " " + op.value);
  }

  @Override
  public String visit(InvalidValueOp op) {
    return def(op, "");
  }

  @Override
  public String visit(SubfieldOp op) {
    return def(op, " " + name(op.input()) + "." + op.fieldName());
  }

  @Override
  public String visit(SubindexOp op) {
    return def(op, " " + name(op.input()) + "[" + op.index + "]");
  }

  @Override
  public String visit(AndPrimOp op) {
    return def(op, " " + args(op));
  }

  @Override
  public String visit(NotPrimOp op) {
    return def(op, " " + args(op));
  }

  @Override
  public String visit(MuxPrimOp op) {
    return def(op, " " + args(op));
  }

  @Override
  public String visit(ConnectOp op) {
    return "connect " + args(op);
  }

  @Override
  public String visit(StrictConnectOp op) {
    return "strictconnect " + args(op);
  }

  @Override
  public String visit(PartialConnectOp op) {
    return "partialconnect " + args(op);
  }

  @Override
  public String visit(WhenOp op) {
    return "when " + name(op.condition()) + " {";
  }

  @Override
  public String visit(AssertOp op) {
    return "assert " + args(op) + ", \"" + op.message + "\"";
  }

  @Override
  public String visit(AssumeOp op) {
    return "assume " + args(op) + ", \"" + op.message + "\"";
  }

  @Override
  public String visit(CoverOp op) {
    return "cover " + args(op) + ", \"" + op.message + "\"";
  }

  @Override
  public String visit(PrintFOp op) {
    return "printf " + args(op) + ", \"" + op.format + "\"";
  }

  @Override
  public String visit(StopOp op) {
    return "stop " + args(op) + ", " + op.exitCode;
  }
}
