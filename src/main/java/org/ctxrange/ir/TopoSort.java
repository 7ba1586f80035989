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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/** A static-only class that orders the nodes of a function consistently with data dependence. */
public class TopoSort {

  /**
   * Returns every node of {@code function} in an order in which each node follows all of its
   * operands. Among nodes that are ready at the same time the one with the lowest id comes first,
   * so the result is deterministic.
   */
  public static ImmutableList<Node> of(IrFunction function) {
    Map<Node, Integer> pendingOperands = new HashMap<>();
    Map<Node, List<Node>> users = new HashMap<>();
    PriorityQueue<Node> ready = new PriorityQueue<>(Comparator.comparingInt((Node n) -> n.id));
    for (Node node : function.nodes()) {
      // A node that uses the same operand twice waits for it once per use
      pendingOperands.put(node, node.operandCount());
      for (Node operand : node.operands()) {
        users.computeIfAbsent(operand, k -> new ArrayList<>()).add(node);
      }
      if (node.operandCount() == 0) {
        ready.add(node);
      }
    }
    ImmutableList.Builder<Node> result =
        ImmutableList.builderWithExpectedSize(function.nodeCount());
    while (!ready.isEmpty()) {
      Node node = ready.poll();
      result.add(node);
      for (Node user : users.getOrDefault(node, List.of())) {
        if (pendingOperands.merge(user, -1, Integer::sum) == 0) {
          ready.add(user);
        }
      }
    }
    ImmutableList<Node> order = result.build();
    // IrBuilder guarantees the graph is acyclic
    assert order.size() == function.nodeCount();
    return order;
  }

  private TopoSort() {}
}
