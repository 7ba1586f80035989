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

import static com.google.common.truth.Truth.assertThat;
import static org.ctxrange.analysis.RangeQueryEngineTest.precise;
import static org.ctxrange.analysis.RangeQueryEngineTest.range;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.ctxrange.ir.IrBuilder;
import org.ctxrange.ir.IrFunction;
import org.ctxrange.ir.Node;
import org.ctxrange.ir.OpKind;
import org.ctxrange.ir.Type;
import org.ctxrange.num.BitValue;
import org.ctxrange.num.IntervalSet;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class BackPropagatorTest {

  static final RangeData TRUE = RangeData.precise(BitValue.of(1, 1));
  static final RangeData FALSE = RangeData.precise(BitValue.of(0, 1));

  private static IntervalSet refined(ImmutableMap<Node, RangeData> result, Node node) {
    return result.get(node).intervalSet.get();
  }

  /** Each row is {@code (kind, limit, truth, expected)} for {@code (x kind limit) == truth}. */
  private static Object[] literalComparisons() {
    return new Object[] {
      new Object[] {OpKind.ULT, 5, true, "{[0, 4]}"},
      new Object[] {OpKind.ULT, 5, false, "{[5, 255]}"},
      new Object[] {OpKind.ULT, 0, true, "none"},
      new Object[] {OpKind.ULE, 10, true, "{[0, 10]}"},
      new Object[] {OpKind.ULE, 255, true, "none"},
      new Object[] {OpKind.UGT, 10, true, "{[11, 255]}"},
      new Object[] {OpKind.UGT, 255, true, "none"},
      new Object[] {OpKind.UGE, 200, true, "{[200, 255]}"},
      new Object[] {OpKind.UGE, 0, true, "none"},
      new Object[] {OpKind.SLT, 0, true, "{[128, 255]}"},
      new Object[] {OpKind.SLE, 0, false, "{[1, 127]}"},
      new Object[] {OpKind.SLE, 127, true, "none"},
      new Object[] {OpKind.SGT, 250, true, "{[0, 127], [251, 255]}"},
      new Object[] {OpKind.SGT, 127, true, "none"},
      new Object[] {OpKind.SGE, 253, true, "{[0, 127], [253, 255]}"},
      new Object[] {OpKind.SGE, 128, true, "none"},
    };
  }

  @Test
  @Parameters(method = "literalComparisons")
  @TestCaseName("{0}_{1}_{2}")
  public void literalComparison(OpKind kind, int limit, boolean truth, String expected) {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node cmp = b.compare(kind, x, b.literal(limit, 8));
    IrFunction f = b.build(cmp);
    RangeQueryEngine base = new GivensProvider(f).populate();
    ImmutableMap<Node, RangeData> result =
        BackPropagator.backPropagate(base, cmp, truth ? TRUE : FALSE);
    assertThat(result.get(cmp)).isEqualTo(truth ? TRUE : FALSE);
    if (expected.equals("none")) {
      assertThat(result.keySet()).containsExactly(cmp);
    } else {
      assertThat(result.keySet()).containsExactly(cmp, x).inOrder();
      assertThat(refined(result, x).toString()).isEqualTo(expected);
    }
  }

  @Test
  public void literalOnTheLeft() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node cmp = b.ugt(b.literal(5, 8), x);
    IrFunction f = b.build(cmp);
    RangeQueryEngine base = new GivensProvider(f).populate();
    assertThat(refined(BackPropagator.backPropagate(base, cmp, TRUE), x))
        .isEqualTo(range(8, 0, 4));
    assertThat(refined(BackPropagator.backPropagate(base, cmp, FALSE), x))
        .isEqualTo(range(8, 5, 255));
  }

  @Test
  public void comparisonWithoutPreciseSide() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node y = b.param("y", Type.bits(8));
    Node cmp = b.ult(x, y);
    IrFunction f = b.build(cmp);
    RangeQueryEngine base = new GivensProvider(f).populate();
    assertThat(BackPropagator.backPropagate(base, cmp, TRUE).keySet()).containsExactly(cmp);
  }

  @Test
  public void equalityKnownTrue() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node y = b.param("y", Type.bits(8));
    Node eq = b.eq(x, y);
    Node ne = b.ne(x, y);
    IrFunction f = b.build(null);
    RangeQueryEngine base =
        new GivensProvider(f).given(x, range(8, 0, 10)).given(y, range(8, 5, 20)).populate();
    for (ImmutableMap<Node, RangeData> result :
        ImmutableList.of(
            BackPropagator.backPropagate(base, eq, TRUE),
            BackPropagator.backPropagate(base, ne, FALSE))) {
      assertThat(result).hasSize(3);
      assertThat(refined(result, x)).isEqualTo(range(8, 5, 10));
      assertThat(refined(result, y)).isEqualTo(range(8, 5, 10));
      assertThat(result.get(x).ternary).isNotNull();
    }
    // The base engine is not modified
    assertThat(base.getIntervals(x).get()).isEqualTo(range(8, 0, 10));
  }

  @Test
  public void disjointEqualityIsUnreachable() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node y = b.param("y", Type.bits(8));
    Node eq = b.eq(x, y);
    IrFunction f = b.build(eq);
    RangeQueryEngine base =
        new GivensProvider(f).given(x, range(8, 0, 1)).given(y, range(8, 5, 6)).populate();
    assertThat(BackPropagator.backPropagate(base, eq, TRUE)).containsExactly(eq, TRUE);
  }

  @Test
  public void inequalityRemovesPreciseValue() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node zero = b.literal(0, 8);
    Node ten = b.literal(10, 8);
    Node eq = b.eq(x, zero);
    Node ne = b.ne(ten, x);
    Node same = b.eq(zero, b.literal(0, 8));
    IrFunction f = b.build(null);
    RangeQueryEngine base = new GivensProvider(f).given(x, range(8, 0, 10)).populate();

    ImmutableMap<Node, RangeData> result = BackPropagator.backPropagate(base, eq, FALSE);
    assertThat(refined(result, x)).isEqualTo(range(8, 1, 10));
    assertThat(refined(result, zero)).isEqualTo(precise(8, 0));

    result = BackPropagator.backPropagate(base, ne, TRUE);
    assertThat(refined(result, x)).isEqualTo(range(8, 0, 9));
    assertThat(refined(result, ten)).isEqualTo(precise(8, 10));

    // 0 != 0 can't happen
    assertThat(BackPropagator.backPropagate(base, same, FALSE).keySet()).containsExactly(same);
  }

  @Test
  public void tupleInequality() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node y = b.param("y", Type.bits(8));
    Node one = b.literal(1, 8);
    Node five = b.literal(5, 8);
    Node t1 = b.tuple(x, one);
    Node t2 = b.tuple(five, one);
    Node t3 = b.tuple(x, y);
    Node ne1 = b.ne(t1, t2);
    Node ne3 = b.ne(t3, t2);
    IrFunction f = b.build(null);
    RangeQueryEngine base = new GivensProvider(f).populate();

    // Only the first element of t1 can differ from t2
    ImmutableMap<Node, RangeData> result = BackPropagator.backPropagate(base, ne1, TRUE);
    assertThat(result.get(t1).intervalSet.elements())
        .containsExactly(IntervalSet.complement(precise(8, 5)), precise(8, 1))
        .inOrder();
    assertThat(result.get(t1).ternary).isNull();
    // Either element of t3 might differ
    assertThat(BackPropagator.backPropagate(base, ne3, TRUE).keySet()).containsExactly(ne3);
  }

  @Test
  public void rangeCheck() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node low = b.ult(b.literal(10, 8), x);
    Node high = b.ule(x, b.literal(20, 8));
    Node check = b.and(low, high);
    IrFunction f = b.build(check);
    RangeQueryEngine base = new GivensProvider(f).given(x, range(8, 0, 15)).populate();

    // 10 < x <= 20, intersected with x's prior range
    ImmutableMap<Node, RangeData> result = BackPropagator.backPropagate(base, check, TRUE);
    assertThat(refined(result, x)).isEqualTo(range(8, 11, 15));
    assertThat(result.get(low)).isEqualTo(TRUE);
    assertThat(result.get(high)).isEqualTo(TRUE);

    result = BackPropagator.backPropagate(base, check, FALSE);
    assertThat(result.keySet()).containsExactly(check, x).inOrder();
    assertThat(refined(result, x)).isEqualTo(range(8, 0, 10));
  }

  @Test
  public void rangeCheckWithVariableBounds() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node lo = b.param("lo", Type.bits(8));
    Node check = b.and(b.ugt(x, lo), b.ult(x, b.literal(20, 8)));
    IrFunction f = b.build(check);
    RangeQueryEngine base = new GivensProvider(f).given(lo, range(8, 5, 8)).populate();
    // x > 5 is all we know if the check passed
    assertThat(refined(BackPropagator.backPropagate(base, check, TRUE), x))
        .isEqualTo(range(8, 6, 19));
    // if it failed, x can't be in (8, 20)
    assertThat(refined(BackPropagator.backPropagate(base, check, FALSE), x))
        .isEqualTo(IntervalSet.union(range(8, 0, 8), range(8, 20, 255)));
  }

  @Test
  public void signedRangeCheck() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node check = b.and(b.sgt(x, b.literal(-5, 8)), b.slt(x, b.literal(5, 8)));
    IrFunction f = b.build(check);
    RangeQueryEngine base = new GivensProvider(f).populate();
    // -4..4
    assertThat(refined(BackPropagator.backPropagate(base, check, TRUE), x))
        .isEqualTo(IntervalSet.union(range(8, 0, 4), range(8, 252, 255)));
    assertThat(refined(BackPropagator.backPropagate(base, check, FALSE), x))
        .isEqualTo(range(8, 5, 251));
  }

  @Test
  public void unsupportedAndShapes() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node y = b.param("y", Type.bits(8));
    Node above = b.ugt(x, b.literal(20, 8));
    Node below = b.ult(x, b.literal(10, 8));
    Node empty = b.and(above, below);
    Node threeWay = b.and(above, below, b.ult(y, x));
    Node mixed = b.and(b.sgt(x, b.literal(1, 8)), below);
    Node unrelated = b.and(above, b.ult(y, b.literal(3, 8)));
    IrFunction f = b.build(null);
    RangeQueryEngine base = new GivensProvider(f).populate();
    for (Node check : new Node[] {empty, threeWay, mixed, unrelated}) {
      assertThat(BackPropagator.backPropagate(base, check, TRUE).keySet()).containsExactly(check);
    }
  }

  @Test
  public void otherOperationsAreNotRefined() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node sum = b.add(x, b.literal(1, 8));
    IrFunction f = b.build(sum);
    RangeQueryEngine base = new GivensProvider(f).populate();
    RangeData three = RangeData.precise(BitValue.of(3, 8));
    assertThat(BackPropagator.backPropagate(base, sum, three)).containsExactly(sum, three);
  }

  @Test
  public void preconditions() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node cmp = b.ult(x, b.literal(5, 8));
    IrFunction f = b.build(cmp);
    RangeQueryEngine base = new GivensProvider(f).populate();
    RangeData unknown = RangeData.of(cmp, IntervalSet.maximal(1));
    assertThrows(
        IllegalStateException.class, () -> BackPropagator.backPropagate(base, cmp, unknown));
    assertThrows(
        IllegalArgumentException.class,
        () -> BackPropagator.backPropagate(base, cmp, RangeData.precise(BitValue.of(1, 8))));
  }
}
