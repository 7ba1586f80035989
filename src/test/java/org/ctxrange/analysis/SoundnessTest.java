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

import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import org.ctxrange.ir.IrFunction;
import org.ctxrange.ir.IrInterpreter;
import org.ctxrange.ir.LeafTypeTree;
import org.ctxrange.ir.Node;
import org.ctxrange.num.BitValue;
import org.ctxrange.num.IntervalSet;
import org.ctxrange.num.TernaryValue;
import org.ctxrange.num.TernaryVector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Evaluates a function on many inputs and checks that, for each select, the engine specialized on
 * the arm actually taken describes every node's value.
 */
@RunWith(JUnit4.class)
public class SoundnessTest {

  private static PredicateState takenArm(Node.Select select, BitValue selectorValue) {
    int numCases = select.cases().size();
    if (selectorValue.toUnsigned().compareTo(BigInteger.valueOf(numCases)) < 0) {
      return PredicateState.of(select, selectorValue.toUnsigned().intValue());
    }
    return PredicateState.defaultArm(select);
  }

  private static void checkNode(
      QueryEngine engine, Node node, LeafTypeTree<BitValue> value, String context) {
    LeafTypeTree<IntervalSet> intervals = engine.getIntervals(node);
    LeafTypeTree<TernaryVector> ternary = engine.getTernary(node);
    for (int i = 0; i < value.elements().size(); i++) {
      BitValue v = value.get(i);
      assertWithMessage("%s: %s = %s", context, node, v)
          .that(intervals.get(i).contains(v))
          .isTrue();
      TernaryVector bits = ternary.get(i);
      for (int b = 0; b < v.width; b++) {
        TernaryValue t = bits.get(b);
        if (t.isKnown()) {
          assertWithMessage("%s: bit %s of %s = %s", context, b, node, v)
              .that(t)
              .isEqualTo(TernaryValue.of(v.bit(b)));
        }
      }
    }
  }

  private static void checkInputs(
      ContextSensitiveRangeQueryEngine engine, IrFunction f, long x, long y, long s) {
    Node xParam = f.params().get(0);
    Node yParam = f.params().get(1);
    Node sParam = f.params().get(2);
    ImmutableMap<Node, LeafTypeTree<BitValue>> values =
        IrInterpreter.evaluateBits(
            f,
            Map.of(
                xParam, BitValue.of(x, 8), yParam, BitValue.of(y, 8), sParam, BitValue.of(s, 2)));
    for (Node.Select select : f.selects()) {
      PredicateState state = takenArm(select, values.get(select.selector()).get());
      QueryEngine specialized = engine.specializeGivenPredicate(Set.of(state));
      String context = String.format("x=%s y=%s s=%s in %s", x, y, s, state);
      for (Node node : f.nodes()) {
        checkNode(specialized, node, values.get(node), context);
      }
    }
  }

  @Test
  public void specializedEnginesAreSound() {
    IrFunction f = ContextSensitiveRangeQueryEngineTest.sampleFunction();
    ContextSensitiveRangeQueryEngine engine = new ContextSensitiveRangeQueryEngine();
    engine.populate(f);
    for (long x = 0; x < 256; x++) {
      long[] ys = {0, 1, 7, 9, 100, x, (x + 1) & 0xff, 255};
      for (long y : ys) {
        for (long s = 0; s < 4; s++) {
          checkInputs(engine, f, x, y, s);
        }
      }
    }
  }

  @Test
  public void baseEngineIsSound() {
    IrFunction f = ContextSensitiveRangeQueryEngineTest.sampleFunction();
    RangeQueryEngine base = new RangeQueryEngine();
    base.populate(f);
    for (long x = 0; x < 256; x += 3) {
      for (long y = 0; y < 256; y += 5) {
        ImmutableMap<Node, LeafTypeTree<BitValue>> values =
            IrInterpreter.evaluateBits(
                f,
                Map.of(
                    f.params().get(0), BitValue.of(x, 8),
                    f.params().get(1), BitValue.of(y, 8),
                    f.params().get(2), BitValue.of(x & 3, 2)));
        for (Node node : f.nodes()) {
          checkNode(base, node, values.get(node), "x=" + x + " y=" + y);
        }
      }
    }
  }
}
