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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.ctxrange.ir.LeafTypeTree;
import org.ctxrange.ir.Node;
import org.ctxrange.ir.OpKind;
import org.ctxrange.num.BitValue;
import org.ctxrange.num.Interval;
import org.ctxrange.num.IntervalSet;
import org.ctxrange.num.TernaryVector;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Given a known fact about one node, derives facts about the operands of the operation that
 * produced it. Only the direct operands are refined; the refinements are not propagated further.
 *
 * <p>The recognized operations are
 *
 * <ul>
 *   <li>{@code a == b} and {@code a != b};
 *   <li>ordered comparisons between a value and a precise value; and
 *   <li>the range check {@code (x > low) && (x <= high)} (in any of its variants, see {@link
 *       CanonicalRange}).
 * </ul>
 *
 * If the known fact contradicts what the base engine has already determined (i.e. the
 * configuration is unreachable) nothing is derived for the operands.
 */
public final class BackPropagator {
  private static final Logger logger = LoggerFactory.getLogger(BackPropagator.class);

  private static final RangeData TRUE = RangeData.precise(BitValue.of(1, 1));

  private final RangeQueryEngine base;
  private final Node key;
  private final RangeData known;

  /** The facts derived so far, in the order they were derived. */
  private final Map<Node, RangeData> result = new LinkedHashMap<>();

  private BackPropagator(RangeQueryEngine base, Node key, RangeData known) {
    this.base = base;
    this.key = key;
    this.known = known;
  }

  /**
   * Returns {@code key -> known} together with the facts about {@code key}'s operands that can be
   * derived from it. Does not modify {@code base}.
   */
  public static ImmutableMap<Node, RangeData> backPropagate(
      RangeQueryEngine base, Node key, RangeData known) {
    Preconditions.checkArgument(
        known.intervalSet.type().equals(key.type),
        "Fact %s does not have the type of %s",
        known,
        key);
    BackPropagator propagator = new BackPropagator(base, key, known);
    propagator.result.put(key, known);
    switch (key.kind) {
      case EQ, NE -> propagator.equality();
      case ULT, ULE, UGT, UGE, SLT, SLE, SGT, SGE -> propagator.orderedComparison();
      case AND -> propagator.rangeCheck();
      case PARAM,
          LITERAL,
          IDENTITY,
          ADD,
          SUB,
          NEG,
          OR,
          XOR,
          NOT,
          SEL,
          ZERO_EXT,
          TUPLE,
          TUPLE_INDEX -> {
        // No refinement.
      }
    }
    return ImmutableMap.copyOf(propagator.result);
  }

  /** Returns the truth value of the key, which must be fully known. */
  private boolean keyTruth() {
    TernaryVector ternary = known.ternary;
    Preconditions.checkState(
        ternary != null && ternary.width() == 1 && ternary.isFullyKnown(),
        "Value of %s is not fully known: %s",
        key,
        known);
    return ternary.isKnownOne();
  }

  private void record(Node node, RangeData data) {
    // An operand may be recorded twice if it appears on both sides.
    result.merge(node, data, BackPropagator::meet);
  }

  private static RangeData meet(RangeData a, RangeData b) {
    return RangeData.of(LeafTypeTree.zip(IntervalSet::intersect, a.intervalSet, b.intervalSet));
  }

  private void unreachable() {
    logger.debug("{} = {} is unreachable, no operand refined", key, known);
  }

  private IntervalSet bits(Node node) {
    return base.getIntervals(node).get();
  }

  private void equality() {
    boolean equal = (key.kind == OpKind.EQ) == keyTruth();
    Node a = key.operand(0);
    Node b = key.operand(1);
    LeafTypeTree<IntervalSet> aSets = base.getIntervals(a);
    LeafTypeTree<IntervalSet> bSets = base.getIntervals(b);
    if (equal) {
      LeafTypeTree<IntervalSet> both = LeafTypeTree.zip(IntervalSet::intersect, aSets, bSets);
      if (both.anyMatch(IntervalSet::isEmpty)) {
        unreachable();
        return;
      }
      RangeData data = RangeData.of(both);
      record(a, data);
      record(b, data);
    } else if (aSets.allMatch(IntervalSet::isPrecise)) {
      excludeValue(b, bSets, a, aSets);
    } else if (bSets.allMatch(IntervalSet::isPrecise)) {
      excludeValue(a, aSets, b, bSets);
    }
  }

  /**
   * Records that {@code v} is not equal to the precise value {@code p}. A leaf of {@code v} can
   * only be refined if every other leaf of {@code v} is known to match {@code p}.
   */
  private void excludeValue(
      Node v, LeafTypeTree<IntervalSet> vSets, Node p, LeafTypeTree<IntervalSet> pSets) {
    int numLeaves = vSets.elements().size();
    int differing = -1;
    for (int i = 0; i < numLeaves; i++) {
      if (!vSets.get(i).equals(pSets.get(i))) {
        if (differing >= 0) {
          // At least two leaves may differ, so we can't tell which one does.
          return;
        }
        differing = i;
      }
    }
    if (differing < 0) {
      // v is precisely p
      unreachable();
      return;
    }
    IntervalSet vSet = vSets.get(differing);
    IntervalSet refined = remove(vSet, Interval.precise(pSets.get(differing).preciseValue()));
    if (refined.isEmpty()) {
      unreachable();
      return;
    }
    ImmutableList.Builder<IntervalSet> leaves = ImmutableList.builder();
    for (int i = 0; i < numLeaves; i++) {
      leaves.add(i == differing ? refined : vSets.get(i));
    }
    record(v, RangeData.of(LeafTypeTree.of(v.type, leaves.build())));
    record(p, RangeData.of(pSets));
  }

  /** Returns the elements of {@code set} that are not in {@code interval}. */
  private static IntervalSet remove(IntervalSet set, Interval interval) {
    IntervalSet widened =
        new IntervalSet.Builder(set.width)
            .addAll(IntervalSet.complement(set))
            .addInterval(interval)
            .build();
    return IntervalSet.intersect(IntervalSet.complement(widened), set);
  }

  private void orderedComparison() {
    OpKind op = keyTruth() ? key.kind : key.kind.invert();
    Node variable = key.operand(0);
    Node literal = key.operand(1);
    if (!bits(literal).isPrecise()) {
      if (!bits(variable).isPrecise()) {
        return;
      }
      Node tmp = variable;
      variable = literal;
      literal = tmp;
      op = op.reverse();
    }
    IntervalSet vSet = bits(variable);
    BitValue limit = bits(literal).preciseValue();
    boolean signed = op.isSigned();
    BitValue min = BitValue.min(limit.width, signed);
    BitValue max = BitValue.max(limit.width, signed);
    // The values the comparison excludes; in the signed case these intervals may wrap around.
    Interval excluded =
        switch (op) {
          case ULT, SLT -> Interval.closed(limit, max);
          case ULE, SLE -> limit.isMax(signed) ? null : Interval.leftOpen(limit, max);
          case UGT, SGT -> Interval.closed(min, limit);
          case UGE, SGE -> limit.isMin(signed) ? null : Interval.rightOpen(min, limit);
          default -> throw new AssertionError(op);
        };
    if (excluded == null) {
      return;
    }
    IntervalSet refined = remove(vSet, excluded);
    if (refined.isEmpty()) {
      unreachable();
      return;
    }
    record(variable, RangeData.of(variable, refined));
  }

  private void rangeCheck() {
    if (key.operandCount() != 2) {
      return;
    }
    CanonicalRange range = extractRange(key.operand(0), key.operand(1));
    if (range == null) {
      return;
    }
    boolean truth = keyTruth();
    boolean signed = range.isSigned();
    IntervalSet paramSet = bits(range.param);
    IntervalSet lowSet = bits(range.lowValue);
    IntervalSet highSet = bits(range.highValue);
    if (paramSet.isEmpty() || lowSet.isEmpty() || highSet.isEmpty()) {
      unreachable();
      return;
    }
    // If the check passed, x is above the smallest possible low and below the largest possible
    // high; if it failed, x is outside the range for the largest low and the smallest high.
    BitValue low = truth ? lowSet.lowerBound(signed) : lowSet.upperBound(signed);
    BitValue high = truth ? highSet.upperBound(signed) : highSet.lowerBound(signed);
    boolean lowOpen = range.lowCmp.isStrict();
    boolean highOpen = range.highCmp.isStrict();
    if (isEmptyRange(low, lowOpen, high, highOpen, signed)) {
      if (truth) {
        unreachable();
      }
      return;
    }
    Interval interval;
    if (lowOpen) {
      interval = highOpen ? Interval.open(low, high) : Interval.leftOpen(low, high);
    } else {
      interval = highOpen ? Interval.rightOpen(low, high) : Interval.closed(low, high);
    }
    IntervalSet rangeSet = new IntervalSet.Builder(paramSet.width).addInterval(interval).build();
    IntervalSet constrained =
        IntervalSet.intersect(paramSet, truth ? rangeSet : IntervalSet.complement(rangeSet));
    if (constrained.isEmpty()) {
      unreachable();
      return;
    }
    record(range.param, RangeData.of(range.param, constrained));
    if (truth) {
      record(range.lowRange, TRUE);
      record(range.highRange, TRUE);
    }
  }

  /** True if no value lies between the given bounds in the given ordering. */
  private static boolean isEmptyRange(
      BitValue low, boolean lowOpen, BitValue high, boolean highOpen, boolean signed) {
    if ((lowOpen && low.isMax(signed)) || (highOpen && high.isMin(signed))) {
      return true;
    }
    BitValue first = lowOpen ? low.increment() : low;
    BitValue last = highOpen ? high.decrement() : high;
    return first.compare(last, signed) > 0;
  }

  /**
   * If {@code e1} and {@code e2} are ordered comparisons with the same signedness that share an
   * operand, one bounding it from below and the other from above, returns the corresponding
   * CanonicalRange; otherwise returns null.
   *
   * <p>The shared operand is found by trying the pairings (e1 lhs, e2 lhs), (e1 rhs, e2 lhs), (e1
   * lhs, e2 rhs), (e1 rhs, e2 rhs) in that order; only the first match is considered.
   */
  static @Nullable CanonicalRange extractRange(Node e1, Node e2) {
    if (!e1.kind.isOrderedComparison()
        || !e2.kind.isOrderedComparison()
        || e1.kind.isSigned() != e2.kind.isSigned()) {
      return null;
    }
    for (int pairing = 0; pairing < 4; pairing++) {
      int side1 = pairing % 2;
      int side2 = pairing / 2;
      Node param = e1.operand(side1);
      if (param != e2.operand(side2)) {
        continue;
      }
      // Rewrite each comparison as (param op other)
      OpKind op1 = (side1 == 0) ? e1.kind : e1.kind.reverse();
      OpKind op2 = (side2 == 0) ? e2.kind : e2.kind.reverse();
      Node other1 = e1.operand(1 - side1);
      Node other2 = e2.operand(1 - side2);
      if (!op1.isLessThan() && op2.isLessThan()) {
        return new CanonicalRange(param, other1, op1, other2, op2, e1, e2);
      } else if (op1.isLessThan() && !op2.isLessThan()) {
        return new CanonicalRange(param, other2, op2, other1, op1, e2, e1);
      }
      return null;
    }
    return null;
  }
}
