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
import java.util.Objects;
import org.ctxrange.ir.Node;

/**
 * A PredicateState identifies one arm of one select: the context in which that select chooses the
 * given case (or its default).
 */
public final class PredicateState {

  /** One arm of a select: either a case index or the default. */
  public static final class Arm {
    private static final int DEFAULT_INDEX = -1;

    public static final Arm DEFAULT = new Arm(DEFAULT_INDEX);

    private final int index;

    private Arm(int index) {
      this.index = index;
    }

    public static Arm caseIndex(int index) {
      Preconditions.checkArgument(index >= 0, "Negative case index %s", index);
      return new Arm(index);
    }

    public boolean isDefault() {
      return index == DEFAULT_INDEX;
    }

    /** Should only be called on a case arm; returns its index. */
    public int index() {
      Preconditions.checkState(!isDefault(), "The default arm has no index");
      return index;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Arm other && index == other.index;
    }

    @Override
    public int hashCode() {
      return index;
    }

    @Override
    public String toString() {
      return isDefault() ? "default" : String.valueOf(index);
    }
  }

  private final Node.Select select;
  private final Arm arm;

  private PredicateState(Node.Select select, Arm arm) {
    this.select = select;
    this.arm = arm;
  }

  private static Node.Select checkSelect(Node node) {
    Preconditions.checkArgument(node instanceof Node.Select, "%s is not a select", node);
    return (Node.Select) node;
  }

  /** Returns the state in which {@code select} chooses case {@code index}. */
  public static PredicateState of(Node select, int index) {
    Node.Select sel = checkSelect(select);
    Preconditions.checkArgument(
        index >= 0 && index < sel.cases().size(),
        "Arm %s is out of range for %s, which has %s cases",
        index,
        select,
        sel.cases().size());
    return new PredicateState(sel, Arm.caseIndex(index));
  }

  /** Returns the state in which {@code select} chooses its default value. */
  public static PredicateState defaultArm(Node select) {
    Node.Select sel = checkSelect(select);
    Preconditions.checkArgument(sel.hasDefault(), "%s has no default arm", select);
    return new PredicateState(sel, Arm.DEFAULT);
  }

  /** Returns the state for the given arm, validated as by {@link #of} or {@link #defaultArm}. */
  public static PredicateState of(Node select, Arm arm) {
    return arm.isDefault() ? defaultArm(select) : of(select, arm.index());
  }

  public Node.Select node() {
    return select;
  }

  public Arm arm() {
    return arm;
  }

  public boolean isDefaultArm() {
    return arm.isDefault();
  }

  /** Should only be called on a case arm; returns its index. */
  public int armIndex() {
    return arm.index();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof PredicateState other && select == other.select && arm.equals(other.arm);
  }

  @Override
  public int hashCode() {
    return Objects.hash(select.id, arm);
  }

  @Override
  public String toString() {
    return select + "@" + arm;
  }
}
