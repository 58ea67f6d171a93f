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
 * Base class for the formal verification statements {@link AssertOp}, {@link AssumeOp} and {@link
 * CoverOp}. Each checks {@link #predicate} on every edge of {@link #clock} at which {@link #enable}
 * is set.
 */
public abstract class VerifOp extends Operation {
  public final String message;

  VerifOp(Location location, Value clock, Value predicate, Value enable, String message) {
    super(location, clock, predicate, enable);
    this.message = message;
  }

  public final Value clock() {
    return operand(0);
  }

  public final Value predicate() {
    return operand(1);
  }

  public final Value enable() {
    return operand(2);
  }

  public final void setEnable(Value enable) {
    setOperand(2, enable);
  }
}
