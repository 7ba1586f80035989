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

import java.util.Objects;
import org.ctxrange.ir.LeafTypeTree;
import org.ctxrange.ir.Node;
import org.ctxrange.ir.Type;
import org.ctxrange.num.BitValue;
import org.ctxrange.num.IntervalSet;
import org.ctxrange.num.TernaryVector;
import org.jspecify.annotations.Nullable;

/**
 * What a range analysis knows about a single node: an IntervalSet for each leaf of its type, and
 * (for bits-typed nodes only) the corresponding TernaryVector. RangeData is immutable.
 */
public final class RangeData {
  /** Null unless the node has a bits type. */
  public final @Nullable TernaryVector ternary;

  public final LeafTypeTree<IntervalSet> intervalSet;

  public RangeData(@Nullable TernaryVector ternary, LeafTypeTree<IntervalSet> intervalSet) {
    assert (ternary != null) == intervalSet.type().isBits();
    this.ternary = ternary;
    this.intervalSet = intervalSet;
  }

  /**
   * Returns a RangeData for the given per-leaf interval sets, deriving the ternary from the
   * interval set if the type is bits.
   */
  public static RangeData of(LeafTypeTree<IntervalSet> intervalSet) {
    TernaryVector ternary =
        intervalSet.type().isBits() ? TernaryVector.fromIntervalSet(intervalSet.get()) : null;
    return new RangeData(ternary, intervalSet);
  }

  /** Returns a RangeData for a bits-typed node whose values are {@code set}. */
  public static RangeData of(Node node, IntervalSet set) {
    return of(LeafTypeTree.of(node.type, set));
  }

  /** Returns a RangeData for a bits value known to be exactly {@code value}. */
  public static RangeData precise(BitValue value) {
    return new RangeData(
        TernaryVector.fromBits(value),
        LeafTypeTree.of(Type.bits(value.width), IntervalSet.precise(value)));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RangeData other
        && Objects.equals(ternary, other.ternary)
        && intervalSet.equals(other.intervalSet);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ternary, intervalSet);
  }

  @Override
  public String toString() {
    return (ternary == null) ? intervalSet.toString() : intervalSet + " " + ternary;
  }
}
