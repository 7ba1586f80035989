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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IrBuilderTest {

  @Test
  public void simpleFunction() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node five = b.literal(5, 8);
    Node lt = b.ult(x, five);
    IrFunction f = b.build(lt);
    assertThat(f.params()).containsExactly(x);
    assertThat(f.nodes()).containsExactly(x, five, lt).inOrder();
    assertThat(f.returnValue()).isSameInstanceAs(lt);
    assertThat(lt.type).isEqualTo(Type.bits(1));
    assertThat(five.toIrString()).isEqualTo("literal.1: bits[8] = literal(value=5)");
    assertThat(lt.toIrString()).isEqualTo("ult.2: bits[1] = ult(x, literal.1)");
    assertThat(f.toIrString())
        .isEqualTo(
            "fn f {\n"
                + "  x: bits[8] = param()\n"
                + "  literal.1: bits[8] = literal(value=5)\n"
                + "  ult.2: bits[1] = ult(x, literal.1)\n"
                + "  ret ult.2\n"
                + "}");
  }

  @Test
  public void selects() {
    IrBuilder b = new IrBuilder("f");
    Node s1 = b.param("s1", Type.bits(1));
    Node s2 = b.param("s2", Type.bits(2));
    Node x = b.param("x", Type.bits(8));
    Node y = b.param("y", Type.bits(8));
    Node.Select full = b.select(s1, x, y);
    assertThat(full.selector()).isSameInstanceAs(s1);
    assertThat(full.cases()).containsExactly(x, y).inOrder();
    assertThat(full.hasDefault()).isFalse();
    assertThat(full.defaultValue()).isNull();
    Node.Select withDefault = b.select(s2, List.of(x, y, x), y);
    assertThat(withDefault.cases()).hasSize(3);
    assertThat(withDefault.defaultValue()).isSameInstanceAs(y);
    assertThat(withDefault.toIrString()).endsWith("sel(s2, x, y, x, y, has_default)");
    // A default is needed if some selector values have no case
    assertThrows(IllegalArgumentException.class, () -> b.select(s2, x, y, x));
    // ... and not allowed otherwise
    assertThrows(IllegalArgumentException.class, () -> b.select(s1, List.of(x, y), x));
    assertThrows(IllegalArgumentException.class, () -> b.select(s1, List.of(x, y, x), y));
    // The cases must have the same type
    assertThrows(IllegalArgumentException.class, () -> b.select(s1, x, s1));
    IrFunction f = b.build(null);
    assertThat(f.selects()).containsExactly(full, withDefault).inOrder();
  }

  @Test
  public void typeChecks() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node y = b.param("y", Type.bits(4));
    Node t = b.param("t", Type.tuple(Type.bits(8), Type.bits(4)));
    assertThrows(IllegalArgumentException.class, () -> b.add(x, y));
    assertThrows(IllegalArgumentException.class, () -> b.ult(x, y));
    assertThrows(IllegalArgumentException.class, () -> b.ult(t, t));
    assertThrows(IllegalArgumentException.class, () -> b.compare(OpKind.ADD, x, x));
    assertThrows(IllegalArgumentException.class, () -> b.zeroExt(x, 4));
    assertThrows(IllegalArgumentException.class, () -> b.tupleIndex(x, 0));
    // Tuples may be compared for equality
    assertThat(b.eq(t, t).type).isEqualTo(Type.bits(1));
  }

  @Test
  public void nodesFromOtherFunctions() {
    IrBuilder other = new IrBuilder("g");
    Node foreign = other.param("z", Type.bits(8));
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    assertThrows(IllegalArgumentException.class, () -> b.add(x, foreign));
  }

  @Test
  public void noChangesAfterBuild() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    b.build(x);
    assertThrows(IllegalStateException.class, () -> b.neg(x));
    assertThrows(IllegalStateException.class, () -> b.build(x));
  }

  @Test
  public void tuples() {
    IrBuilder b = new IrBuilder("f");
    Node x = b.param("x", Type.bits(8));
    Node y = b.param("y", Type.bits(1));
    Node z = b.param("z", Type.bits(4));
    Node inner = b.tuple(y, z);
    Node outer = b.tuple(x, inner);
    Type.TupleType type = (Type.TupleType) outer.type;
    assertThat(type.toString()).isEqualTo("(bits[8], (bits[1], bits[4]))");
    assertThat(type.leafCount()).isEqualTo(3);
    assertThat(type.flatBitCount()).isEqualTo(13);
    assertThat(type.leafOffset(1)).isEqualTo(1);
    Node extracted = b.tupleIndex(outer, 1);
    assertThat(extracted.type).isEqualTo(inner.type);
    assertThat(extracted.toIrString()).endsWith("tuple_index(tuple.4, index=1)");
  }

  @Test
  public void types() {
    Type array = Type.array(Type.bits(2), 3);
    assertThat(array.toString()).isEqualTo("bits[2][3]");
    assertThat(array.leafTypes()).containsExactly(Type.bits(2), Type.bits(2), Type.bits(2));
    assertThat(array.isBits()).isFalse();
    assertThat(Type.bits(5).asBits().width).isEqualTo(5);
    assertThat(Type.tuple(Type.bits(1), array))
        .isEqualTo(Type.tuple(Type.bits(1), Type.array(Type.bits(2), 3)));
  }

  @Test
  public void leafTypeTrees() {
    Type type = Type.tuple(Type.bits(8), Type.tuple(Type.bits(1), Type.bits(4)));
    LeafTypeTree<Integer> widths = LeafTypeTree.create(type, t -> t.width);
    assertThat(widths.elements()).containsExactly(8, 1, 4).inOrder();
    assertThat(widths.map(w -> w * 2).elements()).containsExactly(16, 2, 8).inOrder();
    assertThat(LeafTypeTree.zip(Integer::sum, widths, widths).get(2)).isEqualTo(8);
    assertThat(widths.slice(1, 3)).containsExactly(1, 4).inOrder();
    assertThat(widths.allMatch(w -> w > 0)).isTrue();
    assertThat(widths.anyMatch(w -> w > 4)).isTrue();
    assertThrows(IllegalStateException.class, widths::get);
    assertThrows(IllegalArgumentException.class, () -> LeafTypeTree.of(type, ImmutableList.of(1)));
    assertThat(LeafTypeTree.of(Type.bits(3), 7).get()).isEqualTo(7);
  }

  @Test
  public void comparisonKinds() {
    assertThat(OpKind.ULT.reverse()).isEqualTo(OpKind.UGT);
    assertThat(OpKind.SGE.reverse()).isEqualTo(OpKind.SLE);
    assertThat(OpKind.EQ.reverse()).isEqualTo(OpKind.EQ);
    assertThat(OpKind.ULT.invert()).isEqualTo(OpKind.UGE);
    assertThat(OpKind.SGT.invert()).isEqualTo(OpKind.SLE);
    assertThat(OpKind.NE.invert()).isEqualTo(OpKind.EQ);
    assertThat(OpKind.SLE.isSigned()).isTrue();
    assertThat(OpKind.ULE.isStrict()).isFalse();
    assertThat(OpKind.UGT.isLessThan()).isFalse();
    assertThat(OpKind.EQ.isOrderedComparison()).isFalse();
    assertThat(OpKind.EQ.isComparison()).isTrue();
    assertThrows(IllegalArgumentException.class, OpKind.AND::reverse);
    assertThrows(IllegalArgumentException.class, OpKind.SEL::invert);
  }
}
