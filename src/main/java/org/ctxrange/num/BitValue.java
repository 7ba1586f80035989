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

/**
 * A BitValue is an immutable fixed-width two's-complement integer. The value is stored as an
 * unsigned BigInteger in {@code 0..2^width-1}; whether it is interpreted as signed or unsigned is
 * up to the operation (see {@link #compareSigned} and {@link #compareUnsigned}).
 *
 * <p>All arithmetic wraps modulo {@code 2^width}. Combining BitValues of different widths throws
 * an IllegalArgumentException.
 */
public final class BitValue {

  /** The number of bits; may be zero. */
  public final int width;

  /** The unsigned value, in {@code 0..2^width-1}. */
  private final BigInteger value;

  private BitValue(int width, BigInteger value) {
    assert value.signum() >= 0 && value.bitLength() <= width;
    this.width = width;
    this.value = value;
  }

  /** Returns {@code 2^width}. */
  private static BigInteger modulus(int width) {
    return BigInteger.ONE.shiftLeft(width);
  }

  /**
   * Returns a BitValue with the low {@code width} bits of {@code value}'s two's-complement
   * representation, so e.g. {@code of(-1, 8)} is 255.
   */
  public static BitValue of(long value, int width) {
    return ofBigInteger(BigInteger.valueOf(value), width);
  }

  /** Like {@link #of(long, int)}, but accepts an arbitrary BigInteger. */
  public static BitValue ofBigInteger(BigInteger value, int width) {
    Preconditions.checkArgument(width >= 0, "negative width %s", width);
    return new BitValue(width, value.mod(modulus(width)));
  }

  public static BitValue zero(int width) {
    return ofBigInteger(BigInteger.ZERO, width);
  }

  public static BitValue allOnes(int width) {
    return ofBigInteger(modulus(width).subtract(BigInteger.ONE), width);
  }

  /** Returns the most negative signed value of the given width (only the top bit set). */
  public static BitValue minSigned(int width) {
    Preconditions.checkArgument(width > 0);
    return new BitValue(width, BigInteger.ONE.shiftLeft(width - 1));
  }

  /** Returns the most positive signed value of the given width (all bits but the top set). */
  public static BitValue maxSigned(int width) {
    Preconditions.checkArgument(width > 0);
    return new BitValue(width, BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE));
  }

  /**
   * Returns the smallest representable value in the signed or unsigned ordering. A zero-width
   * value has no sign bit; its only value is zero in either ordering.
   */
  public static BitValue min(int width, boolean signed) {
    return (signed && width > 0) ? minSigned(width) : zero(width);
  }

  /** Returns the largest representable value in the signed or unsigned ordering. */
  public static BitValue max(int width, boolean signed) {
    return (signed && width > 0) ? maxSigned(width) : allOnes(width);
  }

  /** True if this is the smallest representable value in the given ordering. */
  public boolean isMin(boolean signed) {
    return equals(min(width, signed));
  }

  /** True if this is the largest representable value in the given ordering. */
  public boolean isMax(boolean signed) {
    return equals(max(width, signed));
  }

  private void checkSameWidth(BitValue other) {
    Preconditions.checkArgument(
        width == other.width, "Width mismatch: %s vs %s", width, other.width);
  }

  public BitValue add(BitValue other) {
    checkSameWidth(other);
    return ofBigInteger(value.add(other.value), width);
  }

  public BitValue sub(BitValue other) {
    checkSameWidth(other);
    return ofBigInteger(value.subtract(other.value), width);
  }

  public BitValue negate() {
    return ofBigInteger(value.negate(), width);
  }

  /** Returns {@code this + 1}, wrapping from all-ones to zero. */
  public BitValue increment() {
    return ofBigInteger(value.add(BigInteger.ONE), width);
  }

  /** Returns {@code this - 1}, wrapping from zero to all-ones. */
  public BitValue decrement() {
    return ofBigInteger(value.subtract(BigInteger.ONE), width);
  }

  public BitValue and(BitValue other) {
    checkSameWidth(other);
    return new BitValue(width, value.and(other.value));
  }

  public BitValue or(BitValue other) {
    checkSameWidth(other);
    return new BitValue(width, value.or(other.value));
  }

  public BitValue xor(BitValue other) {
    checkSameWidth(other);
    return new BitValue(width, value.xor(other.value));
  }

  public BitValue not() {
    return xor(allOnes(width));
  }

  /** Returns this value zero-extended (or truncated) to {@code newWidth} bits. */
  public BitValue zeroExtend(int newWidth) {
    return ofBigInteger(value, newWidth);
  }

  /** Compares the two values as unsigned integers. */
  public int compareUnsigned(BitValue other) {
    checkSameWidth(other);
    return value.compareTo(other.value);
  }

  /** Compares the two values as two's-complement signed integers. */
  public int compareSigned(BitValue other) {
    checkSameWidth(other);
    return toSigned().compareTo(other.toSigned());
  }

  /** Compares the two values in the signed or unsigned ordering. */
  public int compare(BitValue other, boolean signed) {
    return signed ? compareSigned(other) : compareUnsigned(other);
  }

  /** Returns the value interpreted as unsigned. */
  public BigInteger toUnsigned() {
    return value;
  }

  /** Returns the value interpreted as two's-complement signed. */
  public BigInteger toSigned() {
    if (width > 0 && value.testBit(width - 1)) {
      return value.subtract(modulus(width));
    }
    return value;
  }

  /** Returns bit {@code i}, where bit 0 is the least significant. */
  public boolean bit(int i) {
    Preconditions.checkElementIndex(i, width);
    return value.testBit(i);
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public boolean isAllOnes() {
    return value.bitLength() == width && value.bitCount() == width;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof BitValue other && width == other.width && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * width + value.hashCode();
  }

  @Override
  public String toString() {
    return String.format("bits[%s]:%s", width, value);
  }
}
