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
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/**
 * A TernaryVector records, for each bit of a fixed-width value, whether it is known to be zero,
 * known to be one, or unknown. It is represented by two BitValues: a mask of the known bits, and
 * the values of those bits (unknown bits are always zero in {@link #values}).
 *
 * <p>TernaryVectors are immutable, and strictly less informative than the {@link IntervalSet}s they
 * are usually derived from (see {@link #fromIntervalSet}).
 */
public final class TernaryVector {
  private final BitValue known;
  private final BitValue values;

  private TernaryVector(BitValue known, BitValue values) {
    assert values.and(known.not()).isZero();
    this.known = known;
    this.values = values;
  }

  /** Returns a TernaryVector with every bit known to match {@code value}. */
  public static TernaryVector fromBits(BitValue value) {
    return new TernaryVector(BitValue.allOnes(value.width), value);
  }

  /** Returns a TernaryVector with no known bits. */
  public static TernaryVector unknown(int width) {
    return new TernaryVector(BitValue.zero(width), BitValue.zero(width));
  }

  /**
   * Returns a TernaryVector whose known bits are those set in {@code known}, with the values given
   * by the corresponding bits of {@code values}.
   */
  public static TernaryVector fromKnownBits(BitValue known, BitValue values) {
    Preconditions.checkArgument(known.width == values.width);
    return new TernaryVector(known, values.and(known));
  }

  /**
   * Returns a TernaryVector in which a bit is known if and only if every value in {@code set} has
   * the same value for that bit. An empty set has no known bits.
   */
  public static TernaryVector fromIntervalSet(IntervalSet set) {
    if (set.isEmpty()) {
      return unknown(set.width);
    }
    TernaryVector result = null;
    for (Interval interval : set.intervals()) {
      // Every value in [lower, upper] shares the bits above the highest bit in which lower and
      // upper differ.
      int diffLength = interval.lower.xor(interval.upper).toUnsigned().bitLength();
      BigInteger mask =
          BitValue.allOnes(set.width).toUnsigned().shiftRight(diffLength).shiftLeft(diffLength);
      TernaryVector forInterval =
          fromKnownBits(BitValue.ofBigInteger(mask, set.width), interval.lower);
      result = (result == null) ? forInterval : union(result, forInterval);
    }
    return result;
  }

  public int width() {
    return known.width;
  }

  public TernaryValue get(int i) {
    return known.bit(i) ? TernaryValue.of(values.bit(i)) : TernaryValue.UNKNOWN;
  }

  public boolean isFullyKnown() {
    return known.isAllOnes();
  }

  /** Returns the value of a fully known vector, or null if any bit is unknown. */
  public @Nullable BitValue knownValue() {
    return isFullyKnown() ? values : null;
  }

  /** True if this is a single-bit vector known to be one. */
  public boolean isKnownOne() {
    return width() == 1 && get(0) == TernaryValue.KNOWN_ONE;
  }

  /** True if this is a single-bit vector known to be zero. */
  public boolean isKnownZero() {
    return width() == 1 && get(0) == TernaryValue.KNOWN_ZERO;
  }

  /**
   * Returns the least informative vector consistent with both arguments, i.e. the bits known in
   * the result are those known (with the same value) in both.
   */
  public static TernaryVector union(TernaryVector a, TernaryVector b) {
    BitValue agree = a.known.and(b.known).and(a.values.xor(b.values).not());
    return fromKnownBits(agree, a.values);
  }

  public TernaryVector and(TernaryVector other) {
    BitValue knownOne = values.and(other.values);
    BitValue knownZero = known.and(values.not()).or(other.known.and(other.values.not()));
    return fromKnownBits(knownOne.or(knownZero), knownOne);
  }

  public TernaryVector or(TernaryVector other) {
    BitValue knownOne = values.or(other.values);
    BitValue knownZero = known.and(values.not()).and(other.known.and(other.values.not()));
    return fromKnownBits(knownOne.or(knownZero), knownOne);
  }

  public TernaryVector xor(TernaryVector other) {
    return fromKnownBits(known.and(other.known), values.xor(other.values));
  }

  public TernaryVector not() {
    return fromKnownBits(known, values.not());
  }

  /**
   * Returns the smallest single interval containing every value consistent with this vector
   * (unknown bits zero for the lower bound, one for the upper bound).
   */
  public IntervalSet toIntervalSet() {
    return IntervalSet.of(width(), Interval.closed(values, values.or(known.not())));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TernaryVector other
        && known.equals(other.known)
        && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return 31 * known.hashCode() + values.hashCode();
  }

  /** Returns the bits most significant first, e.g. {@code "0b1X0"}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("0b");
    for (int i = width() - 1; i >= 0; i--) {
      sb.append(get(i));
    }
    return sb.toString();
  }
}
