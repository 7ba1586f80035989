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

import java.util.List;
import org.ctxrange.ir.IrBuilder;
import org.ctxrange.ir.Node;
import org.ctxrange.ir.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PredicateStateTest {

  private final IrBuilder b = new IrBuilder("f");
  private final Node s = b.param("s", Type.bits(4));
  private final Node x = b.param("x", Type.bits(8));
  private final Node.Select withDefault = b.select(s, List.of(x, x, x), x);
  private final Node.Select other = b.select(s, List.of(x, x, x), x);

  @Test
  public void caseArms() {
    PredicateState state = PredicateState.of(withDefault, 1);
    assertThat(state.node()).isSameInstanceAs(withDefault);
    assertThat(state.isDefaultArm()).isFalse();
    assertThat(state.armIndex()).isEqualTo(1);
    assertThat(state.arm()).isEqualTo(PredicateState.Arm.caseIndex(1));
    assertThat(state).isEqualTo(PredicateState.of(withDefault, PredicateState.Arm.caseIndex(1)));
    assertThat(state.hashCode()).isEqualTo(PredicateState.of(withDefault, 1).hashCode());
    assertThat(state).isNotEqualTo(PredicateState.of(withDefault, 2));
    assertThat(state).isNotEqualTo(PredicateState.of(other, 1));
    assertThat(state.toString()).isEqualTo("sel.2@1");
  }

  @Test
  public void defaultArm() {
    PredicateState state = PredicateState.defaultArm(withDefault);
    assertThat(state.isDefaultArm()).isTrue();
    assertThat(state).isEqualTo(PredicateState.of(withDefault, PredicateState.Arm.DEFAULT));
    assertThat(state.toString()).isEqualTo("sel.2@default");
    assertThrows(IllegalStateException.class, state::armIndex);
  }

  @Test
  public void invalidStates() {
    Node.Select noDefault = b.select(b.param("c", Type.bits(1)), x, x);
    assertThrows(IllegalArgumentException.class, () -> PredicateState.of(x, 0));
    assertThrows(IllegalArgumentException.class, () -> PredicateState.of(withDefault, 3));
    assertThrows(IllegalArgumentException.class, () -> PredicateState.of(withDefault, -1));
    assertThrows(IllegalArgumentException.class, () -> PredicateState.defaultArm(noDefault));
    assertThrows(IllegalArgumentException.class, () -> PredicateState.defaultArm(s));
    assertThrows(
        IllegalArgumentException.class,
        () -> PredicateState.of(noDefault, PredicateState.Arm.DEFAULT));
  }

  @Test
  public void equivalenceKeys() {
    EquivalenceKey key = EquivalenceKey.of(PredicateState.of(withDefault, 1));
    assertThat(key.selector()).isSameInstanceAs(s);
    assertThat(key).isEqualTo(EquivalenceKey.of(PredicateState.of(other, 1)));
    assertThat(key).isNotEqualTo(EquivalenceKey.of(PredicateState.defaultArm(other)));
  }

  @Test
  public void selectorValues() {
    // 3 cases with a 4-bit selector; the default is chosen by 3..15
    assertThat(ContextAnalysis.selectorValue(PredicateState.defaultArm(withDefault)))
        .isEqualTo(RangeData.of(s, range(4, 3, 15)));
    assertThat(ContextAnalysis.selectorValue(PredicateState.of(withDefault, 2)))
        .isEqualTo(RangeData.of(s, precise(4, 2)));
  }
}
