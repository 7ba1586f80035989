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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import org.ctxrange.ir.IrFunction;
import org.ctxrange.ir.LeafTypeTree;
import org.ctxrange.ir.Node;
import org.ctxrange.ir.OpKind;
import org.ctxrange.ir.TopoSort;
import org.ctxrange.ir.Type;
import org.ctxrange.num.BitValue;
import org.ctxrange.num.Interval;
import org.ctxrange.num.IntervalSet;
import org.ctxrange.num.TernaryVector;
import org.jspecify.annotations.Nullable;

/**
 * A context-free range analysis. Visits the nodes of a function in topological order (or in the
 * order chosen by a {@link RangeDataProvider}), computing an IntervalSet for each leaf of each node
 * from the IntervalSets of its operands.
 *
 * <p>Since the graph is acyclic a single pass reaches the fixpoint. Givens supplied by the provider
 * are intersected with the computed result, so a RangeQueryEngine populated with givens that were
 * derived from another engine's results is never less precise than that engine.
 */
public class RangeQueryEngine implements QueryEngine {

  private final Map<Node, RangeData> ranges = new HashMap<>();
  private boolean populated;

  @Override
  @CanIgnoreReturnValue
  public ReachedFixpoint populate(IrFunction function) {
    ImmutableList<Node> order = TopoSort.of(function);
    return populateWithGivens(
        new RangeDataProvider() {
          @Override
          public @Nullable RangeData getKnownIntervals(Node node) {
            return null;
          }

          @Override
          public void iterateFunction(Consumer<Node> visitor) {
            order.forEach(visitor);
          }
        });
  }

  /**
   * Analyzes the nodes visited by {@code givens}, using its known intervals to refine the result
   * for the nodes it has them for.
   */
  @CanIgnoreReturnValue
  public ReachedFixpoint populateWithGivens(RangeDataProvider givens) {
    Preconditions.checkState(!populated, "RangeQueryEngine has already been populated");
    populated = true;
    givens.iterateFunction(
        node -> {
          LeafTypeTree<IntervalSet> computed = compute(node);
          RangeData given = givens.getKnownIntervals(node);
          if (given != null) {
            LeafTypeTree<IntervalSet> narrowed =
                LeafTypeTree.zip(IntervalSet::intersect, given.intervalSet, computed);
            // An empty leaf means the givens describe an unreachable configuration; the computed
            // result is still sound.
            if (!narrowed.anyMatch(IntervalSet::isEmpty)) {
              computed = narrowed;
            }
          }
          ranges.put(node, RangeData.of(computed));
        });
    return ReachedFixpoint.CHANGED;
  }

  /** True if the analysis visited {@code node}. */
  public boolean hasKnownIntervals(Node node) {
    return ranges.containsKey(node);
  }

  @Override
  public boolean isTracked(Node node) {
    return hasKnownIntervals(node);
  }

  @Override
  public LeafTypeTree<IntervalSet> getIntervals(Node node) {
    Preconditions.checkState(populated, "RangeQueryEngine has not been populated");
    RangeData data = ranges.get(node);
    return (data == null) ? maximal(node.type) : data.intervalSet;
  }

  @Override
  public LeafTypeTree<TernaryVector> getTernary(Node node) {
    Preconditions.checkState(populated, "RangeQueryEngine has not been populated");
    RangeData data = ranges.get(node);
    if (data == null) {
      return LeafTypeTree.create(node.type, t -> TernaryVector.unknown(t.width));
    } else if (data.ternary != null) {
      return LeafTypeTree.of(node.type, data.ternary);
    }
    return data.intervalSet.map(TernaryVector::fromIntervalSet);
  }

  @Override
  public boolean implies(TreeBitLocation a, TreeBitLocation b) {
    return isZero(a) || isOne(b);
  }

  private static LeafTypeTree<IntervalSet> maximal(Type type) {
    return LeafTypeTree.create(type, t -> IntervalSet.maximal(t.width));
  }

  private LeafTypeTree<IntervalSet> intervals(Node node) {
    RangeData data = ranges.get(node);
    return (data == null) ? maximal(node.type) : data.intervalSet;
  }

  private IntervalSet bits(Node node) {
    return intervals(node).get();
  }

  private static LeafTypeTree<IntervalSet> single(Node node, IntervalSet set) {
    return LeafTypeTree.of(node.type, set);
  }

  /** Computes the result for {@code node} from the current results for its operands. */
  private LeafTypeTree<IntervalSet> compute(Node node) {
    return switch (node.kind) {
      case PARAM -> maximal(node.type);
      case LITERAL -> single(node, IntervalSet.precise(((Node.Literal) node).value));
      case IDENTITY -> intervals(node.operand(0));
      case ADD -> single(node, add(bits(node.operand(0)), bits(node.operand(1))));
      case SUB -> single(node, sub(bits(node.operand(0)), bits(node.operand(1))));
      case NEG -> single(node, neg(bits(node.operand(0))));
      case AND, OR, XOR -> single(node, bitwise(node));
      case NOT -> single(node, not(bits(node.operand(0))));
      case EQ, NE, ULT, ULE, UGT, UGE, SLT, SLE, SGT, SGE -> single(node, compare(node));
      case SEL -> select((Node.Select) node);
      case ZERO_EXT -> single(node, zeroExt(bits(node.operand(0)), ((Node.ZeroExt) node).newWidth));
      case TUPLE -> {
        ImmutableList.Builder<IntervalSet> leaves = ImmutableList.builder();
        node.operands().forEach(operand -> leaves.addAll(intervals(operand).elements()));
        yield LeafTypeTree.of(node.type, leaves.build());
      }
      case TUPLE_INDEX -> {
        Type.TupleType tupleType = (Type.TupleType) node.operand(0).type;
        int start = tupleType.leafOffset(((Node.TupleIndex) node).index);
        yield LeafTypeTree.of(
            node.type, intervals(node.operand(0)).slice(start, start + node.type.leafCount()));
      }
    };
  }

  private static IntervalSet add(IntervalSet a, IntervalSet b) {
    if (a.isEmpty() || b.isEmpty()) {
      return IntervalSet.empty(a.width);
    } else if (a.isPrecise() && b.isPrecise()) {
      return IntervalSet.precise(a.preciseValue().add(b.preciseValue()));
    }
    // Use the hull, as long as the sum can't wrap.
    BigInteger upper = a.upperBound().toUnsigned().add(b.upperBound().toUnsigned());
    if (upper.bitLength() > a.width) {
      return IntervalSet.maximal(a.width);
    }
    return IntervalSet.of(
        a.width,
        Interval.closed(
            a.lowerBound().add(b.lowerBound()), BitValue.ofBigInteger(upper, a.width)));
  }

  private static IntervalSet sub(IntervalSet a, IntervalSet b) {
    if (a.isEmpty() || b.isEmpty()) {
      return IntervalSet.empty(a.width);
    } else if (a.isPrecise() && b.isPrecise()) {
      return IntervalSet.precise(a.preciseValue().sub(b.preciseValue()));
    }
    // Use the hull, as long as the difference can't wrap.
    if (a.lowerBound().compareUnsigned(b.upperBound()) < 0) {
      return IntervalSet.maximal(a.width);
    }
    return IntervalSet.of(
        a.width,
        Interval.closed(
            a.lowerBound().sub(b.upperBound()), a.upperBound().sub(b.lowerBound())));
  }

  private static IntervalSet neg(IntervalSet a) {
    if (a.isEmpty()) {
      return a;
    } else if (a.isPrecise()) {
      return IntervalSet.precise(a.preciseValue().negate());
    } else if (a.lowerBound().isZero()) {
      return IntervalSet.maximal(a.width);
    }
    // -x == 2^n - x, which is order-reversing on [1, MAX].
    return IntervalSet.of(
        a.width, Interval.closed(a.upperBound().negate(), a.lowerBound().negate()));
  }

  /** {@code ~x == MAX - x}, so each interval maps to an interval. */
  private static IntervalSet not(IntervalSet a) {
    IntervalSet.Builder builder = new IntervalSet.Builder(a.width);
    for (Interval interval : a.intervals()) {
      builder.addInterval(Interval.closed(interval.upper.not(), interval.lower.not()));
    }
    return builder.build();
  }

  private IntervalSet bitwise(Node node) {
    ImmutableList<IntervalSet> operands =
        node.operands().stream().map(this::bits).collect(ImmutableList.toImmutableList());
    if (operands.stream().anyMatch(IntervalSet::isEmpty)) {
      return IntervalSet.empty(node.width());
    } else if (operands.stream().allMatch(IntervalSet::isPrecise)) {
      BitValue result = operands.get(0).preciseValue();
      for (IntervalSet operand : operands.subList(1, operands.size())) {
        BitValue v = operand.preciseValue();
        result =
            switch (node.kind) {
              case AND -> result.and(v);
              case OR -> result.or(v);
              case XOR -> result.xor(v);
              default -> throw new AssertionError();
            };
      }
      return IntervalSet.precise(result);
    }
    TernaryVector result = TernaryVector.fromIntervalSet(operands.get(0));
    for (IntervalSet operand : operands.subList(1, operands.size())) {
      TernaryVector v = TernaryVector.fromIntervalSet(operand);
      result =
          switch (node.kind) {
            case AND -> result.and(v);
            case OR -> result.or(v);
            case XOR -> result.xor(v);
            default -> throw new AssertionError();
          };
    }
    return result.toIntervalSet();
  }

  private static final IntervalSet TRUE = IntervalSet.precise(BitValue.of(1, 1));
  private static final IntervalSet FALSE = IntervalSet.precise(BitValue.of(0, 1));
  private static final IntervalSet TRUE_OR_FALSE = IntervalSet.maximal(1);

  private static IntervalSet fromBoolean(@Nullable Boolean b) {
    return (b == null) ? TRUE_OR_FALSE : (b ? TRUE : FALSE);
  }

  private IntervalSet compare(Node node) {
    LeafTypeTree<IntervalSet> a = intervals(node.operand(0));
    LeafTypeTree<IntervalSet> b = intervals(node.operand(1));
    if (a.anyMatch(IntervalSet::isEmpty) || b.anyMatch(IntervalSet::isEmpty)) {
      return IntervalSet.empty(1);
    }
    if (node.kind == OpKind.EQ || node.kind == OpKind.NE) {
      Boolean equal = equal(a, b);
      return fromBoolean(equal == null ? null : (node.kind == OpKind.EQ) == equal);
    }
    return fromBoolean(decide(node.kind, a.get(), b.get()));
  }

  /** Returns true if the values are known equal, false if known different, null otherwise. */
  private static @Nullable Boolean equal(LeafTypeTree<IntervalSet> a, LeafTypeTree<IntervalSet> b) {
    boolean allPreciseAndEqual = true;
    for (int i = 0; i < a.elements().size(); i++) {
      IntervalSet x = a.get(i);
      IntervalSet y = b.get(i);
      if (IntervalSet.intersect(x, y).isEmpty()) {
        return false;
      }
      allPreciseAndEqual &= x.isPrecise() && x.equals(y);
    }
    return allPreciseAndEqual ? Boolean.TRUE : null;
  }

  /**
   * Returns the result of the ordered comparison {@code a op b} if it is the same for every pair of
   * values, otherwise null.
   */
  static @Nullable Boolean decide(OpKind op, IntervalSet a, IntervalSet b) {
    if (!op.isLessThan()) {
      return decide(op.reverse(), b, a);
    }
    boolean signed = op.isSigned();
    int maxVsMin = a.upperBound(signed).compare(b.lowerBound(signed), signed);
    int minVsMax = a.lowerBound(signed).compare(b.upperBound(signed), signed);
    if (op.isStrict()) {
      return (maxVsMin < 0) ? Boolean.TRUE : (minVsMax >= 0 ? Boolean.FALSE : null);
    } else {
      return (maxVsMin <= 0) ? Boolean.TRUE : (minVsMax > 0 ? Boolean.FALSE : null);
    }
  }

  private LeafTypeTree<IntervalSet> select(Node.Select select) {
    IntervalSet selector = bits(select.selector());
    int width = selector.width;
    ImmutableList<Node> cases = select.cases();
    LeafTypeTree<IntervalSet> result = null;
    for (int i = 0; i < cases.size(); i++) {
      if (selector.contains(BitValue.of(i, width))) {
        result = union(result, intervals(cases.get(i)));
      }
    }
    if (select.hasDefault()
        && !selector.isEmpty()
        && selector.upperBound().toUnsigned().compareTo(BigInteger.valueOf(cases.size())) >= 0) {
      result = union(result, intervals(select.defaultValue()));
    }
    return (result == null)
        ? LeafTypeTree.create(select.type, t -> IntervalSet.empty(t.width))
        : result;
  }

  private static LeafTypeTree<IntervalSet> union(
      @Nullable LeafTypeTree<IntervalSet> a, LeafTypeTree<IntervalSet> b) {
    return (a == null) ? b : LeafTypeTree.zip(IntervalSet::union, a, b);
  }

  private static IntervalSet zeroExt(IntervalSet a, int newWidth) {
    IntervalSet.Builder builder = new IntervalSet.Builder(newWidth);
    for (Interval interval : a.intervals()) {
      BitValue lower = interval.lower.zeroExtend(newWidth);
      builder.addInterval(Interval.closed(lower, interval.upper.zeroExtend(newWidth)));
    }
    return builder.build();
  }
}
