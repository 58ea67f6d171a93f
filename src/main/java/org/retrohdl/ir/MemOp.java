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
 * Declares a memory. Each port (typically a bundle of address, enable, clock and data fields) is a
 * result that the module drives through its subfields.
 */
public final class MemOp extends DeclOp {
  public final int depth;
  public final ImmutableList<String> portNames;

  MemOp(
      Location location,
      String name,
      int depth,
      ImmutableList<String> portNames,
      ImmutableList<HwType> portTypes) {
    super(location, name);
    this.depth = depth;
    this.portNames = portNames;
    for (int i = 0; i < portNames.size(); i++) {
      addResult(portTypes.get(i), name + "." + portNames.get(i));
    }
  }

  @Override
  public String opName() {
    return "mem";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
