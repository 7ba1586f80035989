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

import java.util.Objects;
import org.ctxrange.ir.Node;
import org.ctxrange.ir.OpKind;

/**
 * The shape of a range check {@code (param lowCmp lowValue) && (param highCmp highValue)}, where
 * {@code lowCmp} is one of {@code >, >=} and {@code highCmp} is one of {@code <, <=} (with the same
 * signedness). The comparisons are written with {@code param} on the left, even if the nodes they
 * were extracted from ({@link #lowRange}, {@link #highRange}) had it on the right.
 */
final class CanonicalRange {
  final Node param;
  final Node lowValue;
  final OpKind lowCmp;
  final Node highValue;
  final OpKind highCmp;

  /** The comparison node that bounds {@link #param} from below. */
  final Node lowRange;

  /** The comparison node that bounds {@link #param} from above. */
  final Node highRange;

  CanonicalRange(
      Node param,
      Node lowValue,
      OpKind lowCmp,
      Node highValue,
      OpKind highCmp,
      Node lowRange,
      Node highRange) {
    assert lowCmp.isOrderedComparison() && !lowCmp.isLessThan();
    assert highCmp.isOrderedComparison() && highCmp.isLessThan();
    assert lowCmp.isSigned() == highCmp.isSigned();
    this.param = param;
    this.lowValue = lowValue;
    this.lowCmp = lowCmp;
    this.highValue = highValue;
    this.highCmp = highCmp;
    this.lowRange = lowRange;
    this.highRange = highRange;
  }

  boolean isSigned() {
    return lowCmp.isSigned();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CanonicalRange other
        && param == other.param
        && lowValue == other.lowValue
        && lowCmp == other.lowCmp
        && highValue == other.highValue
        && highCmp == other.highCmp
        && lowRange == other.lowRange
        && highRange == other.highRange;
  }

  @Override
  public int hashCode() {
    return Objects.hash(param.id, lowValue.id, lowCmp, highValue.id, highCmp);
  }

  @Override
  public String toString() {
    return String.format(
        "%s %s %s && %s %s %s", param, lowCmp, lowValue, param, highCmp, highValue);
  }
}
