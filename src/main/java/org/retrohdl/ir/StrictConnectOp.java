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

/** Drives {@link #dest} from {@link #src}, which must have exactly the same type. */
public final class StrictConnectOp extends ConnectBase {

  StrictConnectOp(Location location, Value dest, Value src) {
    super(location, dest, src);
    Preconditions.checkArgument(
        dest.type().equals(src.type()), "strictconnect of %s to %s", src.type(), dest.type());
  }

  @Override
  public String opName() {
    return "strictconnect";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
