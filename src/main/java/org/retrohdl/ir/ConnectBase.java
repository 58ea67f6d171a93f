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
 * Base class for the statements that drive a value: {@link ConnectOp} and {@link StrictConnectOp}.
 * A connect drives every leaf of {@link #dest} from the corresponding leaf of {@link #src}.
 */
public abstract class ConnectBase extends Operation {

  ConnectBase(Location location, Value dest, Value src) {
    super(location, dest, src);
  }

  public final Value dest() {
    return operand(0);
  }

  public final Value src() {
    return operand(1);
  }
}
