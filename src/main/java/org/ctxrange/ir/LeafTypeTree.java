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
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.IntStream;
import org.ctxrange.ir.Type.BitsType;

/**
 * A LeafTypeTree associates a value with each scalar leaf of a {@link Type}. Leaves are numbered
 * in depth-first order (see {@link Type#leafTypes}); a BitsType has exactly one leaf, numbered 0.
 *
 * <p>LeafTypeTrees are immutable; element values must be non-null.
 */
public final class LeafTypeTree<V> {
  private final Type type;
  private final ImmutableList<V> elements;

  private LeafTypeTree(Type type, ImmutableList<V> elements) {
    Preconditions.checkArgument(
        elements.size() == type.leafCount(),
        "%s has %s leaves, got %s",
        type,
        type.leafCount(),
        elements.size());
    this.type = type;
    this.elements = elements;
  }

  /** Returns a LeafTypeTree with the result of {@code fn} applied to each leaf type. */
  public static <V> LeafTypeTree<V> create(Type type, Function<BitsType, V> fn) {
    return new LeafTypeTree<>(
        type, type.leafTypes().stream().map(fn).collect(ImmutableList.toImmutableList()));
  }

  /** Returns a LeafTypeTree with the given leaf values. */
  public static <V> LeafTypeTree<V> of(Type type, List<V> elements) {
    return new LeafTypeTree<>(type, ImmutableList.copyOf(elements));
  }

  /** Returns a LeafTypeTree for a type with a single leaf. */
  public static <V> LeafTypeTree<V> of(Type type, V element) {
    return new LeafTypeTree<>(type, ImmutableList.of(element));
  }

  public Type type() {
    return type;
  }

  public ImmutableList<V> elements() {
    return elements;
  }

  /** Returns the value for leaf {@code i}. */
  public V get(int i) {
    return elements.get(i);
  }

  /** Should only be called on trees with a single leaf; returns its value. */
  public V get() {
    Preconditions.checkState(elements.size() == 1, "%s does not have a single leaf", type);
    return elements.get(0);
  }

  /** Returns the values for leaves {@code start} (inclusive) to {@code end} (exclusive). */
  public ImmutableList<V> slice(int start, int end) {
    return elements.subList(start, end);
  }

  public <W> LeafTypeTree<W> map(Function<? super V, W> fn) {
    return new LeafTypeTree<>(
        type, elements.stream().map(fn).collect(ImmutableList.toImmutableList()));
  }

  /** Combines corresponding leaves of two trees with the same type. */
  public static <A, B, W> LeafTypeTree<W> zip(
      BiFunction<? super A, ? super B, W> fn, LeafTypeTree<A> a, LeafTypeTree<B> b) {
    Preconditions.checkArgument(a.type.equals(b.type), "Type mismatch: %s vs %s", a.type, b.type);
    return new LeafTypeTree<>(
        a.type,
        IntStream.range(0, a.elements.size())
            .mapToObj(i -> fn.apply(a.elements.get(i), b.elements.get(i)))
            .collect(ImmutableList.toImmutableList()));
  }

  public boolean allMatch(Predicate<? super V> predicate) {
    return elements.stream().allMatch(predicate);
  }

  public boolean anyMatch(Predicate<? super V> predicate) {
    return elements.stream().anyMatch(predicate);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof LeafTypeTree<?> other
        && type.equals(other.type)
        && elements.equals(other.elements);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + elements.hashCode();
  }

  @Override
  public String toString() {
    return type.isBits() ? String.valueOf(elements.get(0)) : elements.toString();
  }
}
