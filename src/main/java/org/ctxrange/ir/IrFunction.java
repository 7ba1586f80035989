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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An IrFunction is a named dataflow graph: its parameters, every Node in creation order (which is
 * always a valid topological order, since operands must be created first), and an optional return
 * value. IrFunctions are created by {@link IrBuilder#build} and are immutable.
 */
public final class IrFunction {
  public final String name;
  private final ImmutableList<Node> params;
  private final ImmutableList<Node> nodes;
  private final @Nullable Node returnValue;

  IrFunction(
      String name,
      ImmutableList<Node> params,
      ImmutableList<Node> nodes,
      @Nullable Node returnValue) {
    this.name = name;
    this.params = params;
    this.nodes = nodes;
    this.returnValue = returnValue;
  }

  public ImmutableList<Node> params() {
    return params;
  }

  /** Returns every node of this function, in creation order. */
  public ImmutableList<Node> nodes() {
    return nodes;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public @Nullable Node returnValue() {
    return returnValue;
  }

  /** Returns the selects in this function, in creation order. */
  public ImmutableList<Node.Select> selects() {
    return nodes.stream()
        .filter(n -> n instanceof Node.Select)
        .map(n -> (Node.Select) n)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns a multi-line listing of this function's nodes. */
  public String toIrString() {
    String body = nodes.stream().map(n -> "  " + n.toIrString()).collect(Collectors.joining("\n"));
    String ret = (returnValue == null) ? "" : "\n  ret " + returnValue.name;
    return String.format("fn %s {\n%s%s\n}", name, body, ret);
  }

  @Override
  public String toString() {
    return name;
  }
}
