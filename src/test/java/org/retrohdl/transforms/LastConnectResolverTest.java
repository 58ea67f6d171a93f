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

import static com.google.common.truth.Truth.assertThat;
import static org.retrohdl.ir.HwType.field;
import static org.retrohdl.ir.HwType.flipped;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.retrohdl.ir.ConnectOp;
import org.retrohdl.ir.FModule;
import org.retrohdl.ir.FieldRef;
import org.retrohdl.ir.Flow;
import org.retrohdl.ir.HwType;
import org.retrohdl.ir.Location;
import org.retrohdl.ir.OpBuilder;
import org.retrohdl.ir.PortInfo;
import org.retrohdl.ir.Value;

@RunWith(JUnit4.class)
public class LastConnectResolverTest {

  /** Field ids: a=1, b=2, b.c=3, b.d=4, b.d[0]=5, b.d[1]=6, e=7 (analog). */
  private static final HwType NESTED =
      HwType.bundle(
          field("a", HwType.BOOL),
          field(
              "b",
              HwType.bundle(
                  field("c", HwType.BOOL), flipped("d", HwType.vector(HwType.BOOL, 2)))),
          field("e", HwType.analog(1)));

  private FModule module;
  private ModuleVisitor resolver;

  @Before
  public void setup() {
    module = new FModule("Top", PortInfo.in("x", HwType.BOOL), PortInfo.out("y", HwType.BOOL));
    resolver = new ModuleVisitor();
  }

  private ImmutableList<Integer> declaredIds(Flow flow) {
    Value wire = OpBuilder.atEnd(module.body()).wire("w", NESTED).result();
    resolver.declareSinks(wire, flow);
    return resolver.driverMap.lastScope().fields().stream()
        .map(FieldRef::fieldId)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void sinkLeaves() {
    // The flipped vector is a source, and the analog field is never tracked.
    assertThat(declaredIds(Flow.SINK)).containsExactly(1, 3).inOrder();
  }

  @Test
  public void sourceLeaves() {
    assertThat(declaredIds(Flow.SOURCE)).containsExactly(5, 6).inOrder();
  }

  @Test
  public void duplexLeaves() {
    assertThat(declaredIds(Flow.DUPLEX)).containsExactly(1, 3, 5, 6).inOrder();
  }

  @Test
  public void setLastConnectErasesPrevious() {
    OpBuilder b = OpBuilder.atEnd(module.body());
    FieldRef y = FieldRef.of(module.port("y"));
    resolver.declareSinks(module.port("y"), Flow.SINK);
    ConnectOp first = b.connect(module.port("y"), module.port("x"));
    ConnectOp second = b.connect(module.port("y"), module.port("x"));

    assertThat(resolver.setLastConnect(y, first)).isFalse();
    assertThat(resolver.setLastConnect(y, second)).isTrue();
    assertThat(first.isErased()).isTrue();
    assertThat(resolver.driverMap.lastScope().get(y)).isSameInstanceAs(second);
  }

  @Test
  public void setLastConnectOnlyErasesInCurrentScope() {
    OpBuilder b = OpBuilder.atEnd(module.body());
    FieldRef y = FieldRef.of(module.port("y"));
    ConnectOp outer = b.connect(module.port("y"), module.port("x"));
    resolver.setLastConnect(y, outer);
    resolver.driverMap.pushScope();
    ConnectOp inner = b.connect(module.port("y"), module.port("x"));

    assertThat(resolver.setLastConnect(y, inner)).isFalse();
    assertThat(outer.isErased()).isFalse();
    assertThat(resolver.driverMap.popScope().get(y)).isSameInstanceAs(inner);
    assertThat(resolver.driverMap.scopeOf(y).get(y)).isSameInstanceAs(outer);
  }

  @Test
  public void flattenKeepsMuxLocation() {
    OpBuilder b = OpBuilder.atEnd(module.body());
    Location whenLoc = Location.of("top.fir", 1, 1);
    Location thenLoc = Location.of("top.fir", 2, 3);
    Location elseLoc = Location.of("top.fir", 4, 3);
    ConnectOp thenConnect =
        b.setLocation(thenLoc).connect(module.port("y"), b.constant(HwType.BOOL, 1));
    ConnectOp elseConnect =
        b.setLocation(elseLoc).connect(module.port("y"), b.constant(HwType.BOOL, 0));

    ConnectOp merged =
        LastConnectResolver.flattenConditionalConnections(
            OpBuilder.atEnd(module.body()),
            whenLoc,
            module.port("y"),
            module.port("x"),
            thenConnect,
            elseConnect);

    assertThat(merged.location()).isEqualTo(whenLoc);
    assertThat(merged.src().location())
        .isEqualTo(Location.fused(whenLoc, thenLoc, elseLoc));
  }
}
