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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.function.Consumer;
import org.ctxrange.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * A RangeDataProvider that supplies a fixed map of givens and visits the nodes of a topological
 * order, stopping just before {@code finish} (if it is non-null).
 */
final class ContextGivens implements RangeDataProvider {
  private final ImmutableList<Node> order;
  private final @Nullable Node finish;
  private final ImmutableMap<Node, RangeData> givens;

  ContextGivens(
      ImmutableList<Node> order, @Nullable Node finish, ImmutableMap<Node, RangeData> givens) {
    this.order = order;
    this.finish = finish;
    this.givens = givens;
  }

  @Override
  public @Nullable RangeData getKnownIntervals(Node node) {
    return givens.get(node);
  }

  @Override
  public void iterateFunction(Consumer<Node> visitor) {
    for (Node node : order) {
      if (node == finish) {
        return;
      }
      visitor.accept(node);
    }
  }
}
