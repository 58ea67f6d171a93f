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
import java.util.List;

/**
 * A hardware module: a list of ports and a body. Within the body the ports are visible as {@link
 * PortValue}s; an {@link Direction#OUT} port must be driven by the body, an {@link Direction#IN}
 * port may only be read.
 */
public final class FModule {
  public final String name;
  public final Location location;
  private final ImmutableList<PortValue> ports;
  private final Block body = new Block(null);

  public FModule(String name, Location location, List<PortInfo> ports) {
    this.name = name;
    this.location = location;
    ImmutableList.Builder<PortValue> builder = ImmutableList.builder();
    for (int i = 0; i < ports.size(); i++) {
      PortInfo info = ports.get(i);
      builder.add(new PortValue(i, info.name(), info.direction(), info.type(), info.location()));
    }
    this.ports = builder.build();
  }

  public FModule(String name, PortInfo... ports) {
    this(name, Location.unknown(), ImmutableList.copyOf(ports));
  }

  public ImmutableList<PortValue> ports() {
    return ports;
  }

  /** Returns the port with the given name. */
  public PortValue port(String portName) {
    return ports.stream()
        .filter(p -> p.name().equals(portName))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No port " + portName + " in " + name));
  }

  public Direction portDirection(int index) {
    return ports.get(index).direction;
  }

  public Block body() {
    return body;
  }

  @Override
  public String toString() {
    return "module " + name;
  }
}
