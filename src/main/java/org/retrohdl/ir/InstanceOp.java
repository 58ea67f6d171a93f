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

import com.google.common.collect.ImmutableList;

/**
 * Instantiates a submodule. Each port of the submodule is a result; its {@link PortInfo#direction}
 * is the direction declared by the submodule, so an {@link Direction#IN} port must be driven by the
 * instantiating module.
 */
public final class InstanceOp extends DeclOp {
  public final String moduleName;
  public final ImmutableList<PortInfo> ports;

  InstanceOp(Location location, String name, String moduleName, ImmutableList<PortInfo> ports) {
    super(location, name);
    this.moduleName = moduleName;
    this.ports = ports;
    for (PortInfo port : ports) {
      addResult(port.type(), name + "." + port.name());
    }
  }

  public Direction portDirection(int index) {
    return ports.get(index).direction();
  }

  @Override
  public String opName() {
    return "instance";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
