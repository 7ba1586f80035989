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
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Set;
import java.util.concurrent.Executor;
import org.ctxrange.ir.IrFunction;
import org.ctxrange.ir.LeafTypeTree;
import org.ctxrange.ir.Node;
import org.ctxrange.num.IntervalSet;
import org.ctxrange.num.TernaryVector;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A range analysis that, in addition to the usual context-free results, can answer queries under
 * the assumption that a select chooses a particular arm (see {@link #specializeGivenPredicate}).
 *
 * <p>Queries made directly on this engine are answered with the context-free results.
 *
 * <p>After {@link #populate} returns the engine is not modified, so it (and any specialized views
 * of it) may be queried from multiple threads. The results of {@code populate} are published
 * through a single volatile field.
 */
public class ContextSensitiveRangeQueryEngine implements QueryEngine {
  private static final Logger logger =
      LoggerFactory.getLogger(ContextSensitiveRangeQueryEngine.class);

  private final Executor executor;

  /**
   * The base engine, the distinct specialized engines (many PredicateStates may share one), and
   * the index of each PredicateState's engine. Null until {@link #populate} is called.
   */
  private volatile ContextAnalysis.@Nullable Result result;

  /** Creates an engine that computes its specialized engines sequentially. */
  public ContextSensitiveRangeQueryEngine() {
    this(MoreExecutors.directExecutor());
  }

  /**
   * Creates an engine that computes its specialized engines on {@code executor}. The results do not
   * depend on the executor.
   */
  public ContextSensitiveRangeQueryEngine(Executor executor) {
    this.executor = Preconditions.checkNotNull(executor);
  }

  @Override
  @CanIgnoreReturnValue
  public ReachedFixpoint populate(IrFunction function) {
    Preconditions.checkState(result == null, "Engine has already been populated");
    ContextAnalysis.Result populated = new ContextAnalysis(executor).execute(function);
    result = populated;
    logger.debug(
        "{}: {} predicate states, {} specialized engines",
        function.name,
        populated.engineIndex().size(),
        populated.engines().size());
    return ReachedFixpoint.CHANGED;
  }

  private ContextAnalysis.Result result() {
    ContextAnalysis.Result populated = result;
    Preconditions.checkState(populated != null, "Engine has not been populated");
    return populated;
  }

  private RangeQueryEngine base() {
    return result().base();
  }

  /** Returns the context-free engine. */
  public RangeQueryEngine baseEngine() {
    return base();
  }

  /** Returns the number of distinct specialized engines. */
  public int engineCount() {
    return result().engines().size();
  }

  /** Returns the PredicateStates that have a specialized engine. */
  public ImmutableSet<PredicateState> predicateStates() {
    return result().engineIndex().keySet();
  }

  /** Returns the specialized engine for {@code state}, or null if there is none. */
  public @Nullable RangeQueryEngine specializedEngine(PredicateState state) {
    ContextAnalysis.Result populated = result();
    Integer index = populated.engineIndex().get(state);
    return (index == null) ? null : populated.engines().get(index);
  }

  @Override
  public boolean isTracked(Node node) {
    return base().isTracked(node);
  }

  @Override
  public LeafTypeTree<TernaryVector> getTernary(Node node) {
    return base().getTernary(node);
  }

  @Override
  public LeafTypeTree<IntervalSet> getIntervals(Node node) {
    return base().getIntervals(node);
  }

  @Override
  public boolean implies(TreeBitLocation a, TreeBitLocation b) {
    return base().implies(a, b);
  }

  /**
   * Returns a QueryEngine whose answers may assume that the given states hold.
   *
   * <p>Only one of the states is used; if more than one is given the others are ignored, which
   * is sound but may lose precision. If {@code states} is empty, or the chosen state is not from
   * this engine's function, returns this engine.
   */
  @Override
  public QueryEngine specializeGivenPredicate(Set<PredicateState> states) {
    RangeQueryEngine base = base();
    if (states.isEmpty()) {
      return this;
    }
    PredicateState state = states.iterator().next();
    RangeQueryEngine specialized = specializedEngine(state);
    if (specialized == null) {
      return this;
    }
    if (states.size() > 1) {
      logger.debug("Specializing on {}, ignoring {} other states", state, states.size() - 1);
    }
    return new ProxyContextQueryEngine(base, specialized);
  }
}
