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

import org.ctxrange.ir.IrFunction;
import org.ctxrange.ir.LeafTypeTree;
import org.ctxrange.ir.Node;
import org.ctxrange.num.IntervalSet;
import org.ctxrange.num.TernaryVector;

/**
 * A read-only view that answers each query with a specialized engine if it has results for all
 * the nodes involved, and with the base engine otherwise. Since the specialized results are
 * intersections with the base results, the answers are never less precise than the base engine's.
 */
final class ProxyContextQueryEngine implements QueryEngine {
  private final RangeQueryEngine base;
  private final RangeQueryEngine specialized;

  ProxyContextQueryEngine(RangeQueryEngine base, RangeQueryEngine specialized) {
    this.base = base;
    this.specialized = specialized;
  }

  @Override
  public ReachedFixpoint populate(IrFunction function) {
    throw new UnsupportedOperationException(
        "Cannot populate proxy query engine. Populate must be called on original engine only.");
  }

  private QueryEngine mostSpecific(Node node) {
    return specialized.hasKnownIntervals(node) ? specialized : base;
  }

  /** A query about two nodes is answered entirely by one engine. */
  private QueryEngine mostSpecific(Node a, Node b) {
    return (specialized.hasKnownIntervals(a) && specialized.hasKnownIntervals(b))
        ? specialized
        : base;
  }

  @Override
  public boolean isTracked(Node node) {
    return base.isTracked(node);
  }

  @Override
  public LeafTypeTree<TernaryVector> getTernary(Node node) {
    return mostSpecific(node).getTernary(node);
  }

  @Override
  public LeafTypeTree<IntervalSet> getIntervals(Node node) {
    return mostSpecific(node).getIntervals(node);
  }

  @Override
  public boolean implies(TreeBitLocation a, TreeBitLocation b) {
    return mostSpecific(a.node, b.node).implies(a, b);
  }

  @Override
  public boolean knownEquals(TreeBitLocation a, TreeBitLocation b) {
    return mostSpecific(a.node, b.node).knownEquals(a, b);
  }

  @Override
  public boolean knownNotEquals(TreeBitLocation a, TreeBitLocation b) {
    return mostSpecific(a.node, b.node).knownNotEquals(a, b);
  }
}
