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

/**
 * Identifies one field of a (possibly aggregate) value: a root value together with the field id
 * (see {@link HwType}) of the field within the root's type. Field id zero refers to the whole root.
 *
 * <p>Two FieldRefs are equal if they have the same root (compared by identity) and field id.
 */
public record FieldRef(Value value, int fieldId) {

  public FieldRef {
    Preconditions.checkNotNull(value);
    Preconditions.checkArgument(fieldId >= 0 && fieldId <= value.type().maxFieldId());
  }

  /**
   * Returns the FieldRef for {@code value}, following any chain of {@link SubfieldOp}s and {@link
   * SubindexOp}s back to the value they select from.
   */
  public static FieldRef of(Value value) {
    int id = 0;
    for (; ; ) {
      Operation op = value.definingOp();
      if (op instanceof SubfieldOp subfield) {
        value = subfield.input();
        id += value.type().fieldId(subfield.fieldIndex);
      } else if (op instanceof SubindexOp subindex) {
        value = subindex.input();
        id += value.type().fieldId(subindex.index);
      } else {
        return new FieldRef(value, id);
      }
    }
  }

  /** Returns the type of the referenced field. */
  public HwType fieldType() {
    HwType type = value.type();
    for (int id = fieldId; id != 0; ) {
      int index = type.indexForFieldId(id);
      id -= type.fieldId(index);
      type = type.childType(index);
    }
    return type;
  }

  /**
   * Returns a human-readable path to the field, e.g. {@code "io.out.bits[2]"} for element 2 of
   * the {@code bits} field of the {@code out} field of {@code io}.
   */
  public String fieldName() {
    String root = value.name();
    StringBuilder sb = new StringBuilder(root != null ? root : value.toString());
    HwType type = value.type();
    for (int id = fieldId; id != 0; ) {
      int index = type.indexForFieldId(id);
      sb.append(type.childName(index));
      id -= type.fieldId(index);
      type = type.childType(index);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return fieldName();
  }
}
