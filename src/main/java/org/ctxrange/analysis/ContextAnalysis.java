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

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import org.ctxrange.ir.IrFunction;
import org.ctxrange.ir.Node;
import org.ctxrange.ir.OpKind;
import org.ctxrange.ir.TopoSort;
import org.ctxrange.num.BitValue;
import org.ctxrange.num.Interval;
import org.ctxrange.num.IntervalSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a specialized RangeQueryEngine for each arm of each select in a function.
 *
 * <p>The arms are grouped by {@link EquivalenceKey}; the engine for a group is computed by
 * back-propagating the selector value implied by the arm, and then re-running the range analysis
 * with the results as givens over the nodes that precede the select.
 */
final class ContextAnalysis {
  private static final Logger logger = LoggerFactory.getLogger(ContextAnalysis.class);

  /**
   * The results of the analysis. Each PredicateState of the function is mapped to the index in
   * {@code engines} of its specialized engine.
   */
  record Result(
      RangeQueryEngine base,
      ImmutableList<RangeQueryEngine> engines,
      ImmutableMap<PredicateState, Integer> engineIndex) {}

  private final Executor executor;

  ContextAnalysis(Executor executor) {
    this.executor = executor;
  }

  Result execute(IrFunction function) {
    ImmutableList<Node> order = TopoSort.of(function);
    RangeQueryEngine base = new RangeQueryEngine();
    base.populateWithGivens(new ContextGivens(order, null, ImmutableMap.of()));

    Map<EquivalenceKey, List<PredicateState>> groups = new LinkedHashMap<>();
    for (PredicateState state : predicateStates(order)) {
      groups.computeIfAbsent(EquivalenceKey.of(state), k -> new ArrayList<>()).add(state);
    }
    logger.debug(
        "{}: {} selects, {} equivalence groups",
        function.name,
        function.selects().size(),
        groups.size());

    List<ListenableFuture<RangeQueryEngine>> futures = new ArrayList<>();
    for (List<PredicateState> group : groups.values()) {
      // The last state has the latest select, so its traversal includes every node that precedes
      // any of the group's selects.
      PredicateState representative = group.get(group.size() - 1);
      futures.add(Futures.submit(() -> specialize(base, order, representative), executor));
    }
    ImmutableList<RangeQueryEngine> engines;
    try {
      engines = ImmutableList.copyOf(Futures.getUnchecked(Futures.allAsList(futures)));
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }

    ImmutableMap.Builder<PredicateState, Integer> engineIndex = ImmutableMap.builder();
    int i = 0;
    for (List<PredicateState> group : groups.values()) {
      for (PredicateState state : group) {
        engineIndex.put(state, i);
      }
      i++;
    }
    return new Result(base, engines, engineIndex.buildOrThrow());
  }

  /**
   * Returns every PredicateState of the selects in {@code order}: one for each case (in order) and
   * one for the default, if there is one.
   */
  static ImmutableList<PredicateState> predicateStates(List<Node> order) {
    ImmutableList.Builder<PredicateState> result = ImmutableList.builder();
    for (Node node : order) {
      if (node.kind == OpKind.SEL) {
        Node.Select select = (Node.Select) node;
        for (int i = 0; i < select.cases().size(); i++) {
          result.add(PredicateState.of(select, i));
        }
        if (select.hasDefault()) {
          result.add(PredicateState.defaultArm(select));
        }
      }
    }
    return result.build();
  }

  private static RangeQueryEngine specialize(
      RangeQueryEngine base, ImmutableList<Node> order, PredicateState state) {
    Node selector = state.node().selector();
    ImmutableMap<Node, RangeData> givens =
        BackPropagator.backPropagate(base, selector, selectorValue(state));
    logger.trace("{}: {}", state, givens);
    RangeQueryEngine engine = new RangeQueryEngine();
    engine.populateWithGivens(new ContextGivens(order, state.node(), givens));
    return engine;
  }

  /** Returns the selector values for which the select chooses the given arm. */
  static RangeData selectorValue(PredicateState state) {
    Node.Select select = state.node();
    Node selector = select.selector();
    Preconditions.checkArgument(
        selector.type.isBits(), "Selector of %s must have a bits type", select);
    int width = selector.width();
    if (state.isDefaultArm()) {
      BitValue numCases = BitValue.of(select.cases().size(), width);
      return RangeData.of(
          selector, IntervalSet.of(width, Interval.closed(numCases, BitValue.allOnes(width))));
    }
    int index = state.armIndex();
    Preconditions.checkArgument(
        BigInteger.valueOf(index).bitLength() <= width,
        "Selector of %s is too narrow for arm %s",
        select,
        index);
    return RangeData.of(selector, IntervalSet.precise(BitValue.of(index, width)));
  }
}
