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

/**
 * An Interval is an inclusive range {@code [lower, upper]} of same-width BitValues, ordered as
 * unsigned integers.
 *
 * <p>An Interval whose lower bound is greater than its upper bound is <i>improper</i>: it wraps
 * around and represents {@code [lower, MAX] ∪ [0, upper]}. Improper intervals arise naturally when
 * a signed range (e.g. {@code -3..4}) is expressed in unsigned terms; {@link IntervalSet} splits
 * them when normalizing.
 */
public final class Interval {
  public final BitValue lower;
  public final BitValue upper;

  private Interval(BitValue lower, BitValue upper) {
    Preconditions.checkArgument(
        lower.width == upper.width, "Width mismatch: %s vs %s", lower, upper);
    this.lower = lower;
    this.upper = upper;
  }

  /** Returns {@code [lower, upper]}. */
  public static Interval closed(BitValue lower, BitValue upper) {
    return new Interval(lower, upper);
  }

  /** Returns {@code (lower, upper)}, i.e. {@code [lower+1, upper-1]} (with wrapping). */
  public static Interval open(BitValue lower, BitValue upper) {
    return new Interval(lower.increment(), upper.decrement());
  }

  /** Returns {@code (lower, upper]}, i.e. {@code [lower+1, upper]} (with wrapping). */
  public static Interval leftOpen(BitValue lower, BitValue upper) {
    return new Interval(lower.increment(), upper);
  }

  /** Returns {@code [lower, upper)}, i.e. {@code [lower, upper-1]} (with wrapping). */
  public static Interval rightOpen(BitValue lower, BitValue upper) {
    return new Interval(lower, upper.decrement());
  }

  /** Returns the interval containing only {@code value}. */
  public static Interval precise(BitValue value) {
    return new Interval(value, value);
  }

  /** Returns the interval containing every value of the given width. */
  public static Interval maximal(int width) {
    return new Interval(BitValue.zero(width), BitValue.allOnes(width));
  }

  public int width() {
    return lower.width;
  }

  /** True if this interval wraps around (lower bound greater than upper bound). */
  public boolean isImproper() {
    return lower.compareUnsigned(upper) > 0;
  }

  public boolean isPrecise() {
    return lower.equals(upper);
  }

  public boolean contains(BitValue value) {
    if (isImproper()) {
      return value.compareUnsigned(lower) >= 0 || value.compareUnsigned(upper) <= 0;
    }
    return value.compareUnsigned(lower) >= 0 && value.compareUnsigned(upper) <= 0;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Interval other && lower.equals(other.lower) && upper.equals(other.upper);
  }

  @Override
  public int hashCode() {
    return 31 * lower.hashCode() + upper.hashCode();
  }

  @Override
  public String toString() {
    return String.format("[%s, %s]", lower.toUnsigned(), upper.toUnsigned());
  }
}
