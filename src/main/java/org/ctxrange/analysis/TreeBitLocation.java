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

/** Identifies a single bit of a single leaf of a node's value. */
public final class TreeBitLocation {
  public final Node node;

  /** The index of the bit within its leaf; bit 0 is the least significant. */
  public final int bitIndex;

  /** The index of the leaf, in the order of {@link org.ctxrange.ir.Type#leafTypes}. */
  public final int treeIndex;

  public TreeBitLocation(Node node, int bitIndex, int treeIndex) {
    Preconditions.checkElementIndex(treeIndex, node.type.leafCount());
    Preconditions.checkElementIndex(bitIndex, node.type.leafTypes().get(treeIndex).width);
    this.node = node;
    this.bitIndex = bitIndex;
    this.treeIndex = treeIndex;
  }

  /** Creates the location of bit {@code bitIndex} of a bits-typed node. */
  public TreeBitLocation(Node node, int bitIndex) {
    this(node, bitIndex, 0);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TreeBitLocation other
        && node == other.node
        && bitIndex == other.bitIndex
        && treeIndex == other.treeIndex;
  }

  @Override
  public int hashCode() {
    return Objects.hash(node.id, bitIndex, treeIndex);
  }

  @Override
  public String toString() {
    return node.type.isBits()
        ? String.format("%s[%s]", node, bitIndex)
        : String.format("%s{%s}[%s]", node, treeIndex, bitIndex);
  }
}
