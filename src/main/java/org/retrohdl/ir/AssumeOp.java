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

/** Restricts formal verification to traces on which the predicate holds while enabled. */
public final class AssumeOp extends VerifOp {

  AssumeOp(Location location, Value clock, Value predicate, Value enable, String message) {
    super(location, clock, predicate, enable, message);
  }

  @Override
  public String opName() {
    return "assume";
  }

  @Override
  public <R> R accept(OpVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
