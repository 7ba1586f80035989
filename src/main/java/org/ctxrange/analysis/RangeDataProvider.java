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

import java.util.function.Consumer;
import org.ctxrange.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * Supplies the "givens" for {@link RangeQueryEngine#populateWithGivens}: facts about some nodes
 * that are known from outside the analysis, and the order in which the nodes should be visited.
 */
public interface RangeDataProvider {
  /** Returns what is known about {@code node} in advance, or null if nothing is. */
  @Nullable RangeData getKnownIntervals(Node node);

  /**
   * Calls {@code visitor} on each node to be analyzed, in an order in which each node follows its
   * operands. Nodes that are never visited are not analyzed.
   */
  void iterateFunction(Consumer<Node> visitor);
}
