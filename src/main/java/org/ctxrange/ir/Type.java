/*
 * Copyright 2025 The Ctxrange Authors
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

package org.ctxrange.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;

/**
 * The type of the value produced by a {@link Node}. There are three kinds:
 *
 * <ul>
 *   <li>{@link BitsType}: a fixed-width bit vector (the only scalar type)
 *   <li>{@link TupleType}: an ordered list of element types
 *   <li>{@link ArrayType}: a fixed number of elements of the same type
 * </ul>
 *
 * Each non-bits type is a tree whose leaves are BitsTypes; analyses that track per-leaf
 * information use a {@link LeafTypeTree}. Types are immutable and compared structurally.
 */
public abstract class Type {

  /** Only the nested subclasses may extend Type. */
  private Type() {}

  public static BitsType bits(int width) {
    return new BitsType(width);
  }

  public static TupleType tuple(Type... elements) {
    return new TupleType(ImmutableList.copyOf(elements));
  }

  public static ArrayType array(Type element, int size) {
    return new ArrayType(element, size);
  }

  /** Returns the scalar leaves of this type, in depth-first order. */
  public abstract ImmutableList<BitsType> leafTypes();

  /** Returns the number of scalar leaves of this type. */
  public int leafCount() {
    return leafTypes().size();
  }

  /** Returns the total number of bits in this type. */
  public int flatBitCount() {
    return leafTypes().stream().mapToInt(t -> t.width).sum();
  }

  public boolean isBits() {
    return this instanceof BitsType;
  }

  /** Should only be called on a BitsType; returns this. */
  public BitsType asBits() {
    Preconditions.checkArgument(isBits(), "Not a bits type: %s", this);
    return (BitsType) this;
  }

  /** A fixed-width bit vector. */
  public static final class BitsType extends Type {
    public final int width;

    private BitsType(int width) {
      Preconditions.checkArgument(width >= 0, "negative width %s", width);
      this.width = width;
    }

    @Override
    public ImmutableList<BitsType> leafTypes() {
      return ImmutableList.of(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof BitsType other && width == other.width;
    }

    @Override
    public int hashCode() {
      return width;
    }

    @Override
    public String toString() {
      return "bits[" + width + "]";
    }
  }

  /** An ordered list of element types. */
  public static final class TupleType extends Type {
    public final ImmutableList<Type> elements;

    private TupleType(ImmutableList<Type> elements) {
      this.elements = elements;
    }

    /** Returns the index of the first leaf of element {@code i} in {@link #leafTypes}. */
    public int leafOffset(int i) {
      Preconditions.checkElementIndex(i, elements.size());
      return elements.subList(0, i).stream().mapToInt(Type::leafCount).sum();
    }

    @Override
    public ImmutableList<BitsType> leafTypes() {
      return elements.stream()
          .flatMap(e -> e.leafTypes().stream())
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof TupleType other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode() + 1;
    }

    @Override
    public String toString() {
      return elements.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /** A fixed number of elements of the same type. */
  public static final class ArrayType extends Type {
    public final Type element;
    public final int size;

    private ArrayType(Type element, int size) {
      Preconditions.checkArgument(size >= 0, "negative size %s", size);
      this.element = element;
      this.size = size;
    }

    @Override
    public ImmutableList<BitsType> leafTypes() {
      ImmutableList<BitsType> elementLeaves = element.leafTypes();
      return Collections.nCopies(size, elementLeaves).stream()
          .flatMap(ImmutableList::stream)
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ArrayType other && size == other.size && element.equals(other.element);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(new Object[] {element, size});
    }

    @Override
    public String toString() {
      return element + "[" + size + "]";
    }
  }
}
