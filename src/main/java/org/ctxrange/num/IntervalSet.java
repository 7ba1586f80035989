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

package org.ctxrange.num;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An IntervalSet is an immutable set of same-width BitValues, represented as a sorted list of
 * disjoint, non-adjacent, proper {@link Interval}s (in unsigned order). IntervalSets are always
 * normalized; they are constructed with a {@link Builder}, whose {@link Builder#build} does the
 * normalization.
 *
 * <p>Two IntervalSets are equal if and only if they contain the same values.
 */
public final class IntervalSet {

  public final int width;

  private final ImmutableList<Interval> intervals;

  private IntervalSet(int width, ImmutableList<Interval> intervals) {
    this.width = width;
    this.intervals = intervals;
  }

  /** Returns an IntervalSet containing no values. */
  public static IntervalSet empty(int width) {
    return new IntervalSet(width, ImmutableList.of());
  }

  /** Returns an IntervalSet containing every value of the given width. */
  public static IntervalSet maximal(int width) {
    return new IntervalSet(width, ImmutableList.of(Interval.maximal(width)));
  }

  /** Returns an IntervalSet containing only the given value. */
  public static IntervalSet precise(BitValue value) {
    return new IntervalSet(value.width, ImmutableList.of(Interval.precise(value)));
  }

  /** Returns the normalized union of the given intervals, which must all have the same width. */
  public static IntervalSet of(int width, Interval... intervals) {
    Builder builder = new Builder(width);
    for (Interval interval : intervals) {
      builder.addInterval(interval);
    }
    return builder.build();
  }

  /** Returns the normalized intervals of this set, in increasing order. */
  public ImmutableList<Interval> intervals() {
    return intervals;
  }

  public int numberOfIntervals() {
    return intervals.size();
  }

  public boolean isEmpty() {
    return intervals.isEmpty();
  }

  public boolean isMaximal() {
    return intervals.size() == 1 && intervals.get(0).equals(Interval.maximal(width));
  }

  /** True if this set contains exactly one value. */
  public boolean isPrecise() {
    return intervals.size() == 1 && intervals.get(0).isPrecise();
  }

  /** If this set contains exactly one value, returns it; otherwise returns null. */
  public @Nullable BitValue preciseValue() {
    return isPrecise() ? intervals.get(0).lower : null;
  }

  /** Returns the smallest value in this set (unsigned ordering), or null if it is empty. */
  public @Nullable BitValue lowerBound() {
    return isEmpty() ? null : intervals.get(0).lower;
  }

  /** Returns the largest value in this set (unsigned ordering), or null if it is empty. */
  public @Nullable BitValue upperBound() {
    return isEmpty() ? null : intervals.get(intervals.size() - 1).upper;
  }

  /**
   * Returns the smallest value in this set using the signed or unsigned ordering, or null if it is
   * empty.
   */
  public @Nullable BitValue lowerBound(boolean signed) {
    // With no sign bit both orderings agree.
    if (!signed || isEmpty() || width == 0) {
      return lowerBound();
    }
    // Negative values are the ones at or above minSigned in unsigned order; the smallest of those
    // (if there are any) is the signed minimum.
    BitValue minSigned = BitValue.minSigned(width);
    for (Interval interval : intervals) {
      if (interval.upper.compareUnsigned(minSigned) >= 0) {
        return interval.lower.compareUnsigned(minSigned) >= 0 ? interval.lower : minSigned;
      }
    }
    return lowerBound();
  }

  /**
   * Returns the largest value in this set using the signed or unsigned ordering, or null if it is
   * empty.
   */
  public @Nullable BitValue upperBound(boolean signed) {
    if (!signed || isEmpty() || width == 0) {
      return upperBound();
    }
    BitValue maxSigned = BitValue.maxSigned(width);
    for (Interval interval : intervals.reverse()) {
      if (interval.lower.compareUnsigned(maxSigned) <= 0) {
        return interval.upper.compareUnsigned(maxSigned) <= 0 ? interval.upper : maxSigned;
      }
    }
    return upperBound();
  }

  public boolean contains(BitValue value) {
    Preconditions.checkArgument(value.width == width, "Width mismatch: %s vs %s", value, width);
    return intervals.stream().anyMatch(interval -> interval.contains(value));
  }

  /** True if every value in {@code other} is also in this set. */
  public boolean containsAll(IntervalSet other) {
    return intersect(this, other).equals(other);
  }

  /** Returns the number of values in this set. */
  public BigInteger size() {
    BigInteger result = BigInteger.ZERO;
    for (Interval interval : intervals) {
      BigInteger span = interval.upper.toUnsigned().subtract(interval.lower.toUnsigned());
      result = result.add(span).add(BigInteger.ONE);
    }
    return result;
  }

  private static void checkSameWidth(IntervalSet a, IntervalSet b) {
    Preconditions.checkArgument(a.width == b.width, "Width mismatch: %s vs %s", a.width, b.width);
  }

  /** Returns the values that are in both sets. */
  public static IntervalSet intersect(IntervalSet a, IntervalSet b) {
    checkSameWidth(a, b);
    if (a.isMaximal() || b.isEmpty()) {
      return b;
    } else if (b.isMaximal() || a.isEmpty()) {
      return a;
    }
    ImmutableList.Builder<Interval> result = ImmutableList.builder();
    int i = 0;
    int j = 0;
    while (i < a.intervals.size() && j < b.intervals.size()) {
      Interval x = a.intervals.get(i);
      Interval y = b.intervals.get(j);
      BitValue lower = x.lower.compareUnsigned(y.lower) >= 0 ? x.lower : y.lower;
      BitValue upper = x.upper.compareUnsigned(y.upper) <= 0 ? x.upper : y.upper;
      if (lower.compareUnsigned(upper) <= 0) {
        result.add(Interval.closed(lower, upper));
      }
      // Advance whichever interval ends first.
      if (x.upper.compareUnsigned(y.upper) < 0) {
        i++;
      } else {
        j++;
      }
    }
    // Intersecting normalized sets can't produce overlapping or adjacent intervals.
    return new IntervalSet(a.width, result.build());
  }

  /** Returns the values that are in either set. */
  public static IntervalSet union(IntervalSet a, IntervalSet b) {
    checkSameWidth(a, b);
    if (a.isEmpty() || b.isMaximal()) {
      return b;
    } else if (b.isEmpty() || a.isMaximal()) {
      return a;
    }
    return new Builder(a.width).addAll(a).addAll(b).build();
  }

  /** Returns the values of {@code set.width} bits that are not in {@code set}. */
  public static IntervalSet complement(IntervalSet set) {
    int width = set.width;
    if (set.isEmpty()) {
      return maximal(width);
    }
    ImmutableList.Builder<Interval> result = ImmutableList.builder();
    BitValue next = BitValue.zero(width);
    boolean nextValid = true;
    for (Interval interval : set.intervals) {
      if (nextValid && next.compareUnsigned(interval.lower) < 0) {
        result.add(Interval.closed(next, interval.lower.decrement()));
      }
      // If this interval ends at MAX there is nothing after it.
      nextValid = !interval.upper.isAllOnes();
      next = interval.upper.increment();
    }
    if (nextValid) {
      result.add(Interval.closed(next, BitValue.allOnes(width)));
    }
    return new IntervalSet(width, result.build());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof IntervalSet other
        && width == other.width
        && intervals.equals(other.intervals);
  }

  @Override
  public int hashCode() {
    return 31 * width + intervals.hashCode();
  }

  @Override
  public String toString() {
    return intervals.stream().map(Interval::toString).collect(Collectors.joining(", ", "{", "}"));
  }

  /**
   * A Builder accumulates intervals (which may overlap, be adjacent, or be improper) and produces
   * a normalized IntervalSet.
   */
  public static class Builder {
    private final int width;
    private final List<Interval> pending = new ArrayList<>();

    public Builder(int width) {
      this.width = width;
    }

    /** Adds the given interval; an improper interval adds both of its pieces. */
    @CanIgnoreReturnValue
    public Builder addInterval(Interval interval) {
      Preconditions.checkArgument(
          interval.width() == width, "Width mismatch: %s vs %s", interval, width);
      if (interval.isImproper()) {
        pending.add(Interval.closed(interval.lower, BitValue.allOnes(width)));
        pending.add(Interval.closed(BitValue.zero(width), interval.upper));
      } else {
        pending.add(interval);
      }
      return this;
    }

    /** Adds all the values of the given set. */
    @CanIgnoreReturnValue
    public Builder addAll(IntervalSet set) {
      Preconditions.checkArgument(set.width == width, "Width mismatch: %s vs %s", set.width, width);
      pending.addAll(set.intervals);
      return this;
    }

    /** Returns the normalized IntervalSet containing every value added so far. */
    public IntervalSet build() {
      List<Interval> sorted = new ArrayList<>(pending);
      sorted.sort(Comparator.comparing(interval -> interval.lower.toUnsigned()));
      ImmutableList.Builder<Interval> result = ImmutableList.builder();
      Interval current = null;
      for (Interval interval : sorted) {
        if (current == null) {
          current = interval;
        } else if (current.upper.isAllOnes()
            || interval.lower.compareUnsigned(current.upper.increment()) <= 0) {
          // Overlapping or adjacent; merge
          if (interval.upper.compareUnsigned(current.upper) > 0) {
            current = Interval.closed(current.lower, interval.upper);
          }
        } else {
          result.add(current);
          current = interval;
        }
      }
      if (current != null) {
        result.add(current);
      }
      return new IntervalSet(width, result.build());
    }
  }
}
