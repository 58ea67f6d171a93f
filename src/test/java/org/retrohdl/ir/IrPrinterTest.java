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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IrPrinterTest {

  @Test
  public void printsNestedWhens() {
    FModule module =
        new FModule(
            "Top",
            PortInfo.in("clk", HwType.CLOCK),
            PortInfo.in("c", HwType.BOOL),
            PortInfo.out("y", HwType.uint(4)));
    OpBuilder b = OpBuilder.atEnd(module.body());
    Value c = module.port("c");
    WhenOp when = b.when(c, true);
    OpBuilder t = OpBuilder.atEnd(when.thenBlock());
    t.connect(module.port("y"), t.constant(HwType.uint(4), 3));
    t.assertOp(module.port("clk"), c, c, "c holds");
    OpBuilder e = OpBuilder.atEnd(when.elseBlock());
    e.connect(module.port("y"), e.invalid(HwType.uint(4)));

    assertThat(IrPrinter.print(module))
        .isEqualTo(
            """
            module Top(in clk: Clock, in c: UInt<1>, out y: UInt<4>) {
              when %c {
                %0 = constant 3 : UInt<4>
                connect %y, %0
                assert %clk, %c, %c, "c holds"
              } else {
                %1 = invalidvalue : UInt<4>
                connect %y, %1
              }
            }
            """);
  }

  @Test
  public void printsDeclarations() {
    FModule module = new FModule("Top", PortInfo.in("clk", HwType.CLOCK));
    OpBuilder b = OpBuilder.atEnd(module.body());
    b.instance("sub", "Sub", PortInfo.in("a", HwType.BOOL), PortInfo.out("b", HwType.BOOL));
    b.mem("m", 16, ImmutableMap.of("r", HwType.uint(8)));
    b.reg("r", HwType.uint(8), module.port("clk"));

    assertThat(IrPrinter.print(module))
        .isEqualTo(
            """
            module Top(in clk: Clock) {
              %sub.a, %sub.b = instance sub of Sub
              %m.r = mem m depth 16
              %r = reg %clk : UInt<8>
            }
            """);
  }
}
