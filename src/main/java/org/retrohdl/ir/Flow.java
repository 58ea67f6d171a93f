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

/** How a value may be used at a particular site. */
public enum Flow {
  /** The value is produced elsewhere and may only be read here. */
  SOURCE,
  /** The value must be driven here. */
  SINK,
  /** The value may be both read and driven here (e.g. a wire). */
  DUPLEX;

  /**
   * Returns the flow seen through a flipped bundle element: sources become sinks and vice versa,
   * while duplex is unchanged.
   */
  public Flow swap() {
    return switch (this) {
      case SOURCE -> SINK;
      case SINK -> SOURCE;
      case DUPLEX -> DUPLEX;
    };
  }
}
