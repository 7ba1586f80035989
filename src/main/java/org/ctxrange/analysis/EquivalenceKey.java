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

import org.ctxrange.ir.Node;

/**
 * PredicateStates with the same selector and arm imply the same facts, so they share a single
 * specialized engine.
 */
record EquivalenceKey(Node selector, PredicateState.Arm arm) {
  static EquivalenceKey of(PredicateState state) {
    return new EquivalenceKey(state.node().selector(), state.arm());
  }
}
