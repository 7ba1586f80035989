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

/**
 * The closed set of operations a {@link Node} can perform.
 *
 * <p>Analyses are expected to switch exhaustively over OpKind (using switch expressions, so that
 * adding a new kind is a compile error until every analysis has decided how to handle it).
 */
public enum OpKind {
  /** A function parameter. */
  PARAM("param"),
  /** A constant; see {@link Node.Literal}. */
  LITERAL("literal"),
  IDENTITY("identity"),
  ADD("add"),
  SUB("sub"),
  NEG("neg"),
  /** Bitwise and of one or more operands; on 1-bit values this is boolean AND. */
  AND("and"),
  OR("or"),
  XOR("xor"),
  NOT("not"),
  EQ("eq"),
  NE("ne"),
  ULT("ult"),
  ULE("ule"),
  UGT("ugt"),
  UGE("uge"),
  SLT("slt"),
  SLE("sle"),
  SGT("sgt"),
  SGE("sge"),
  /** A multi-way select; see {@link Node.Select}. */
  SEL("sel"),
  /** See {@link Node.ZeroExt}. */
  ZERO_EXT("zero_ext"),
  TUPLE("tuple"),
  /** See {@link Node.TupleIndex}. */
  TUPLE_INDEX("tuple_index");

  /** The name used when printing IR. */
  public final String irName;

  OpKind(String irName) {
    this.irName = irName;
  }

  /** True for EQ, NE, and the eight ordered comparisons. */
  public boolean isComparison() {
    return this == EQ || this == NE || isOrderedComparison();
  }

  /** True for the signed and unsigned {@code <, <=, >, >=} comparisons. */
  public boolean isOrderedComparison() {
    return switch (this) {
      case ULT, ULE, UGT, UGE, SLT, SLE, SGT, SGE -> true;
      default -> false;
    };
  }

  /** Should only be called on ordered comparisons; true if the comparison is signed. */
  public boolean isSigned() {
    assert isOrderedComparison();
    return this == SLT || this == SLE || this == SGT || this == SGE;
  }

  /** Should only be called on ordered comparisons; true for {@code <} and {@code >}. */
  public boolean isStrict() {
    assert isOrderedComparison();
    return this == ULT || this == UGT || this == SLT || this == SGT;
  }

  /** Should only be called on ordered comparisons; true for {@code <} and {@code <=}. */
  public boolean isLessThan() {
    assert isOrderedComparison();
    return this == ULT || this == ULE || this == SLT || this == SLE;
  }

  /**
   * Should only be called on comparisons; returns the comparison {@code op2} such that {@code (x
   * op y) == (y op2 x)}. EQ and NE are their own reverse.
   */
  public OpKind reverse() {
    return switch (this) {
      case EQ -> EQ;
      case NE -> NE;
      case ULT -> UGT;
      case ULE -> UGE;
      case UGT -> ULT;
      case UGE -> ULE;
      case SLT -> SGT;
      case SLE -> SGE;
      case SGT -> SLT;
      case SGE -> SLE;
      default -> throw new IllegalArgumentException(this + " is not a comparison");
    };
  }

  /**
   * Should only be called on comparisons; returns the comparison {@code op2} such that {@code (x
   * op2 y) == !(x op y)}.
   */
  public OpKind invert() {
    return switch (this) {
      case EQ -> NE;
      case NE -> EQ;
      case ULT -> UGE;
      case ULE -> UGT;
      case UGT -> ULE;
      case UGE -> ULT;
      case SLT -> SGE;
      case SLE -> SGT;
      case SGT -> SLE;
      case SGE -> SLT;
      default -> throw new IllegalArgumentException(this + " is not a comparison");
    };
  }

  @Override
  public String toString() {
    return irName;
  }
}
