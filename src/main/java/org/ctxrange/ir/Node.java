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
import org.ctxrange.num.BitValue;
import org.jspecify.annotations.Nullable;

/**
 * A Node is a value-producing operation in an {@link IrFunction}'s dataflow graph. Each Node has
 * an {@link OpKind}, an ordered list of operand Nodes, and a result {@link Type}.
 *
 * <p>Nodes are immutable and can only be created by an {@link IrBuilder}, which ensures that each
 * Node's operands were created before it. Nodes are compared by identity; {@link #id} is unique
 * within the containing function.
 *
 * <p>Operations that need more than their operands (constants, selects, extensions, tuple
 * indexing) are represented by subclasses.
 */
public class Node {
  public final int id;
  public final String name;
  public final OpKind kind;
  public final Type type;
  private final ImmutableList<Node> operands;

  Node(int id, String name, OpKind kind, Type type, ImmutableList<Node> operands) {
    this.id = id;
    this.name = name;
    this.kind = kind;
    this.type = type;
    this.operands = operands;
  }

  public ImmutableList<Node> operands() {
    return operands;
  }

  public Node operand(int i) {
    return operands.get(i);
  }

  public int operandCount() {
    return operands.size();
  }

  /** Should only be called on nodes with a bits type; returns its width. */
  public int width() {
    return type.asBits().width;
  }

  /** Returns a one-line description of this node, e.g. {@code "x3: bits[1] = ult(a, b)"}. */
  public String toIrString() {
    return String.format(
        "%s: %s = %s(%s)",
        name,
        type,
        kind,
        operands.stream().map(n -> n.name).collect(Collectors.joining(", ")) + extraToString());
  }

  /** Returns any non-operand arguments, formatted to follow the operand list. */
  String extraToString() {
    return "";
  }

  @Override
  public String toString() {
    return name;
  }

  /** A constant. */
  public static final class Literal extends Node {
    public final BitValue value;

    Literal(int id, String name, BitValue value) {
      super(id, name, OpKind.LITERAL, Type.bits(value.width), ImmutableList.of());
      this.value = value;
    }

    @Override
    String extraToString() {
      return "value=" + value.toUnsigned();
    }
  }

  /**
   * A multi-way select. Operand 0 is the selector; the following operands are the cases, and if
   * the select has a default value it is the last operand. If the selector's value is {@code i <
   * cases().size()} the result is {@code cases().get(i)}; otherwise the result is the default.
   */
  public static final class Select extends Node {
    private final int numCases;
    private final boolean hasDefault;

    Select(int id, String name, Type type, ImmutableList<Node> operands, boolean hasDefault) {
      super(id, name, OpKind.SEL, type, operands);
      this.numCases = operands.size() - 1 - (hasDefault ? 1 : 0);
      this.hasDefault = hasDefault;
    }

    public Node selector() {
      return operand(0);
    }

    public ImmutableList<Node> cases() {
      return operands().subList(1, 1 + numCases);
    }

    public boolean hasDefault() {
      return hasDefault;
    }

    /** Returns the default value, or null if this select has none. */
    public @Nullable Node defaultValue() {
      return hasDefault ? operand(operandCount() - 1) : null;
    }

    @Override
    String extraToString() {
      return hasDefault ? ", has_default" : "";
    }
  }

  /** Zero-extends its single operand to {@link #newWidth} bits. */
  public static final class ZeroExt extends Node {
    public final int newWidth;

    ZeroExt(int id, String name, Node operand, int newWidth) {
      super(id, name, OpKind.ZERO_EXT, Type.bits(newWidth), ImmutableList.of(operand));
      this.newWidth = newWidth;
    }

    @Override
    String extraToString() {
      return ", new_bit_count=" + newWidth;
    }
  }

  /** Extracts element {@link #index} of its single (tuple-typed) operand. */
  public static final class TupleIndex extends Node {
    public final int index;

    TupleIndex(int id, String name, Type type, Node operand, int index) {
      super(id, name, OpKind.TUPLE_INDEX, type, ImmutableList.of(operand));
      this.index = index;
    }

    @Override
    String extraToString() {
      return ", index=" + index;
    }
  }
}
