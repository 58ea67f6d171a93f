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
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The type of a hardware value. There are four subclasses:
 *
 * <ul>
 *   <li>{@link GroundType}: a scalar (unsigned or signed integer, clock, or reset);
 *   <li>{@link AnalogType}: a bidirectional wire;
 *   <li>{@link BundleType}: an ordered record of named elements, each optionally flipped;
 *   <li>{@link VectorType}: a fixed-length array of a single element type.
 * </ul>
 *
 * <p>Every node of a type tree is assigned a <i>field id</i> by a pre-order numbering: the root is
 * zero, and each child's id is one more than the largest id used by its preceding sibling (or one
 * more than its parent's id, for the first child). Field ids are how the leaves of an aggregate
 * value are addressed (see {@link FieldRef}). Constructing a type whose field ids would not fit in
 * an int throws {@link ArithmeticException}.
 *
 * <p>HwTypes are immutable and compare by value.
 */
public abstract class HwType {

  /** A one-bit unsigned integer, the type of all conditions. */
  public static final GroundType BOOL = new GroundType(GroundType.Kind.UINT, 1);

  public static final GroundType CLOCK = new GroundType(GroundType.Kind.CLOCK, 1);

  public static final GroundType RESET = new GroundType(GroundType.Kind.RESET, 1);

  public static final GroundType ASYNC_RESET = new GroundType(GroundType.Kind.ASYNC_RESET, 1);

  private HwType() {}

  public static GroundType uint(int width) {
    return (width == 1) ? BOOL : new GroundType(GroundType.Kind.UINT, width);
  }

  public static GroundType sint(int width) {
    return new GroundType(GroundType.Kind.SINT, width);
  }

  public static AnalogType analog(int width) {
    return new AnalogType(width);
  }

  public static VectorType vector(HwType elementType, int size) {
    return new VectorType(elementType, size);
  }

  public static BundleType bundle(BundleType.Element... elements) {
    return new BundleType(ImmutableList.copyOf(elements));
  }

  /** Returns an unflipped bundle element. */
  public static BundleType.Element field(String name, HwType type) {
    return new BundleType.Element(name, false, type);
  }

  /** Returns a flipped bundle element. */
  public static BundleType.Element flipped(String name, HwType type) {
    return new BundleType.Element(name, true, type);
  }

  /** Returns the largest field id used by this type; zero for ground and analog types. */
  public abstract int maxFieldId();

  /** True for {@link GroundType}. */
  public boolean isGround() {
    return false;
  }

  /** True for {@link BundleType} and {@link VectorType}. */
  public boolean isAggregate() {
    return false;
  }

  /** Returns the number of immediate children of an aggregate type; zero for other types. */
  public int numChildren() {
    return 0;
  }

  /** Returns the type of the child at {@code index}. Only valid for aggregate types. */
  public HwType childType(int index) {
    throw new UnsupportedOperationException(this + " has no children");
  }

  /** Returns the field id (relative to this type) of the child at {@code index}. */
  public int fieldId(int index) {
    throw new UnsupportedOperationException(this + " has no children");
  }

  /**
   * Returns the index of the child whose subtree contains {@code fieldId}, which must be between 1
   * and {@link #maxFieldId} inclusive.
   */
  public int indexForFieldId(int fieldId) {
    throw new UnsupportedOperationException(this + " has no children");
  }

  /** Returns the name used for the child at {@code index} when printing a field path. */
  String childName(int index) {
    throw new UnsupportedOperationException(this + " has no children");
  }

  /** A scalar type. */
  public static final class GroundType extends HwType {
    public enum Kind {
      UINT,
      SINT,
      CLOCK,
      RESET,
      ASYNC_RESET
    }

    public final Kind kind;
    public final int width;

    GroundType(Kind kind, int width) {
      Preconditions.checkArgument(width >= 0);
      this.kind = kind;
      this.width = width;
    }

    @Override
    public int maxFieldId() {
      return 0;
    }

    @Override
    public boolean isGround() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof GroundType other && kind == other.kind && width == other.width;
    }

    @Override
    public int hashCode() {
      return kind.hashCode() * 31 + width;
    }

    @Override
    public String toString() {
      return switch (kind) {
        case UINT -> "UInt<" + width + ">";
        case SINT -> "SInt<" + width + ">";
        case CLOCK -> "Clock";
        case RESET -> "Reset";
        case ASYNC_RESET -> "AsyncReset";
      };
    }
  }

  /** A bidirectional wire; analog values are never tracked for initialization. */
  public static final class AnalogType extends HwType {
    public final int width;

    AnalogType(int width) {
      this.width = width;
    }

    @Override
    public int maxFieldId() {
      return 0;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof AnalogType other && width == other.width;
    }

    @Override
    public int hashCode() {
      return 0x5a1 + width;
    }

    @Override
    public String toString() {
      return "Analog<" + width + ">";
    }
  }

  /** An ordered record of named elements. */
  public static final class BundleType extends HwType {

    /** One element of a bundle; a flipped element has the opposite orientation to its bundle. */
    public record Element(String name, boolean flip, HwType type) {
      public Element {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
      }
    }

    public final ImmutableList<Element> elements;

    /** {@code fieldIds[i]} is the field id of element {@code i}. */
    private final int[] fieldIds;

    private final int maxFieldId;

    BundleType(ImmutableList<Element> elements) {
      Preconditions.checkArgument(
          elements.stream().map(Element::name).distinct().count() == elements.size(),
          "duplicate element name in %s",
          elements);
      this.elements = elements;
      this.fieldIds = new int[elements.size()];
      int id = 0;
      for (int i = 0; i < elements.size(); i++) {
        id = Math.addExact(id, 1);
        fieldIds[i] = id;
        id = Math.addExact(id, elements.get(i).type.maxFieldId());
      }
      this.maxFieldId = id;
    }

    /** Returns the index of the element with the given name, or -1 if there is none. */
    public int elementIndex(String name) {
      for (int i = 0; i < elements.size(); i++) {
        if (elements.get(i).name.equals(name)) {
          return i;
        }
      }
      return -1;
    }

    @Override
    public int maxFieldId() {
      return maxFieldId;
    }

    @Override
    public boolean isAggregate() {
      return true;
    }

    @Override
    public int numChildren() {
      return elements.size();
    }

    @Override
    public HwType childType(int index) {
      return elements.get(index).type;
    }

    @Override
    public int fieldId(int index) {
      return fieldIds[index];
    }

    @Override
    public int indexForFieldId(int fieldId) {
      Preconditions.checkArgument(fieldId > 0 && fieldId <= maxFieldId);
      int pos = Arrays.binarySearch(fieldIds, fieldId);
      // If fieldId isn't a child's id, it's inside the subtree of the preceding child.
      return (pos >= 0) ? pos : -pos - 2;
    }

    @Override
    String childName(int index) {
      return "." + elements.get(index).name;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof BundleType other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public String toString() {
      return elements.stream()
          .map(e -> (e.flip ? "flip " : "") + e.name + ": " + e.type)
          .collect(Collectors.joining(", ", "{", "}"));
    }
  }

  /** A fixed-length array. */
  public static final class VectorType extends HwType {
    public final HwType elementType;
    public final int size;

    /** The number of field ids used by each element, including the element itself. */
    private final int stride;

    private final int maxFieldId;

    VectorType(HwType elementType, int size) {
      Preconditions.checkArgument(size >= 0);
      this.elementType = Objects.requireNonNull(elementType);
      this.size = size;
      this.stride = Math.addExact(elementType.maxFieldId(), 1);
      this.maxFieldId = Math.multiplyExact(size, stride);
    }

    @Override
    public int maxFieldId() {
      return maxFieldId;
    }

    @Override
    public boolean isAggregate() {
      return true;
    }

    @Override
    public int numChildren() {
      return size;
    }

    @Override
    public HwType childType(int index) {
      Preconditions.checkElementIndex(index, size);
      return elementType;
    }

    @Override
    public int fieldId(int index) {
      Preconditions.checkElementIndex(index, size);
      return 1 + index * stride;
    }

    @Override
    public int indexForFieldId(int fieldId) {
      Preconditions.checkArgument(fieldId > 0 && fieldId <= maxFieldId());
      return (fieldId - 1) / stride;
    }

    @Override
    String childName(int index) {
      return "[" + index + "]";
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof VectorType other
          && size == other.size
          && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
      return elementType.hashCode() * 31 + size;
    }

    @Override
    public String toString() {
      return elementType + "[" + size + "]";
    }
  }
}
