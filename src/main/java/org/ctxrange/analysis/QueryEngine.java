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

package org.ctxrange.analysis;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.ctxrange.ir.IrFunction;
import org.ctxrange.ir.LeafTypeTree;
import org.ctxrange.ir.Node;
import org.ctxrange.num.BitValue;
import org.ctxrange.num.IntervalSet;
import org.ctxrange.num.TernaryValue;
import org.ctxrange.num.TernaryVector;
import org.jspecify.annotations.Nullable;

/**
 * A QueryEngine answers questions about the possible values of the nodes of a function. It must be
 * populated (once) with the function before being queried.
 *
 * <p>Every answer must be sound: anything a QueryEngine claims to know about a node must hold on
 * every execution of the function. An engine may know nothing about a node, in which case it
 * returns maximal interval sets and unknown ternaries.
 */
public interface QueryEngine {

  /** Analyzes {@code function}; must be called before any other method. */
  ReachedFixpoint populate(IrFunction function);

  /** True if this engine has analyzed {@code node}. */
  boolean isTracked(Node node);

  /** Returns what is known about each bit of each leaf of {@code node}. */
  LeafTypeTree<TernaryVector> getTernary(Node node);

  /** Returns the possible values of each leaf of {@code node}. */
  LeafTypeTree<IntervalSet> getIntervals(Node node);

  /** Returns what is known about a single bit. */
  default TernaryValue getTernary(TreeBitLocation location) {
    return getTernary(location.node).get(location.treeIndex).get(location.bitIndex);
  }

  default boolean isKnown(TreeBitLocation location) {
    return getTernary(location).isKnown();
  }

  default boolean isOne(TreeBitLocation location) {
    return getTernary(location) == TernaryValue.KNOWN_ONE;
  }

  default boolean isZero(TreeBitLocation location) {
    return getTernary(location) == TernaryValue.KNOWN_ZERO;
  }

  /** True if at most one of the given bits can be one. */
  default boolean atMostOneTrue(List<TreeBitLocation> bits) {
    return bits.stream().filter(b -> !isZero(b)).count() <= 1;
  }

  /** True if at least one of the given bits is known to be one. */
  default boolean atLeastOneTrue(List<TreeBitLocation> bits) {
    return bits.stream().anyMatch(this::isOne);
  }

  /** True if bit {@code a} being one implies that bit {@code b} is one. */
  boolean implies(TreeBitLocation a, TreeBitLocation b);

  /** True if the two bits are known to have the same value. */
  default boolean knownEquals(TreeBitLocation a, TreeBitLocation b) {
    TernaryValue av = getTernary(a);
    return av.isKnown() && av == getTernary(b);
  }

  /** True if the two bits are known to have different values. */
  default boolean knownNotEquals(TreeBitLocation a, TreeBitLocation b) {
    TernaryValue av = getTernary(a);
    TernaryValue bv = getTernary(b);
    return av.isKnown() && bv.isKnown() && av != bv;
  }

  /**
   * Returns the value of {@code node} implied by the given bits having the given values, or null if
   * no value is implied. The default implementation never finds one.
   */
  default @Nullable BitValue impliedNodeValue(
      Map<TreeBitLocation, Boolean> predicateBitValues, Node node) {
    return null;
  }

  /**
   * Returns a QueryEngine whose answers may assume that every element of {@code states} holds. The
   * default implementation returns this engine, which is always sound.
   */
  default QueryEngine specializeGivenPredicate(Set<PredicateState> states) {
    return this;
  }
}
