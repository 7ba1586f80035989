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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.ctxrange.num.BitValue;
import org.jspecify.annotations.Nullable;

/**
 * An IrBuilder creates the Nodes of a single {@link IrFunction}. Each method checks that its
 * operands belong to this builder and have suitable types, throwing an IllegalArgumentException if
 * they don't.
 *
 * <p>Nodes are named after their kind and id (e.g. {@code "ult.4"}) unless a name is given.
 */
public class IrBuilder {
  private final String functionName;
  private final List<Node> nodes = new ArrayList<>();
  private final List<Node> params = new ArrayList<>();
  private boolean built;

  public IrBuilder(String functionName) {
    this.functionName = functionName;
  }

  private <T extends Node> T append(T node) {
    Preconditions.checkState(!built, "Function %s has already been built", functionName);
    nodes.add(node);
    return node;
  }

  private int nextId() {
    return nodes.size();
  }

  private String defaultName(OpKind kind) {
    return kind.irName + "." + nextId();
  }

  private void checkOperands(Node... operands) {
    for (Node operand : operands) {
      Preconditions.checkArgument(
          operand.id < nodes.size() && nodes.get(operand.id) == operand,
          "%s does not belong to %s",
          operand,
          functionName);
    }
  }

  private Node simple(OpKind kind, Type type, Node... operands) {
    checkOperands(operands);
    return append(
        new Node(nextId(), defaultName(kind), kind, type, ImmutableList.copyOf(operands)));
  }

  private static Type checkSameBitsType(Node... operands) {
    Preconditions.checkArgument(operands.length > 0, "At least one operand required");
    Type type = operands[0].type;
    Preconditions.checkArgument(type.isBits(), "%s is not bits-typed", operands[0]);
    for (Node operand : operands) {
      Preconditions.checkArgument(
          operand.type.equals(type), "Type mismatch: %s vs %s", operand.type, type);
    }
    return type;
  }

  public Node param(String name, Type type) {
    Node result = append(new Node(nextId(), name, OpKind.PARAM, type, ImmutableList.of()));
    params.add(result);
    return result;
  }

  public Node literal(BitValue value) {
    return append(new Node.Literal(nextId(), defaultName(OpKind.LITERAL), value));
  }

  public Node literal(long value, int width) {
    return literal(BitValue.of(value, width));
  }

  public Node identity(Node operand) {
    return simple(OpKind.IDENTITY, operand.type, operand);
  }

  public Node add(Node a, Node b) {
    return simple(OpKind.ADD, checkSameBitsType(a, b), a, b);
  }

  public Node sub(Node a, Node b) {
    return simple(OpKind.SUB, checkSameBitsType(a, b), a, b);
  }

  public Node neg(Node a) {
    return simple(OpKind.NEG, checkSameBitsType(a), a);
  }

  public Node and(Node... operands) {
    return simple(OpKind.AND, checkSameBitsType(operands), operands);
  }

  public Node or(Node... operands) {
    return simple(OpKind.OR, checkSameBitsType(operands), operands);
  }

  public Node xor(Node... operands) {
    return simple(OpKind.XOR, checkSameBitsType(operands), operands);
  }

  public Node not(Node a) {
    return simple(OpKind.NOT, checkSameBitsType(a), a);
  }

  /** Returns a 1-bit node comparing {@code a} and {@code b} with the given comparison. */
  public Node compare(OpKind kind, Node a, Node b) {
    Preconditions.checkArgument(kind.isComparison(), "%s is not a comparison", kind);
    if (kind.isOrderedComparison()) {
      checkSameBitsType(a, b);
    } else {
      Preconditions.checkArgument(
          a.type.equals(b.type), "Type mismatch: %s vs %s", a.type, b.type);
    }
    return simple(kind, Type.bits(1), a, b);
  }

  public Node eq(Node a, Node b) {
    return compare(OpKind.EQ, a, b);
  }

  public Node ne(Node a, Node b) {
    return compare(OpKind.NE, a, b);
  }

  public Node ult(Node a, Node b) {
    return compare(OpKind.ULT, a, b);
  }

  public Node ule(Node a, Node b) {
    return compare(OpKind.ULE, a, b);
  }

  public Node ugt(Node a, Node b) {
    return compare(OpKind.UGT, a, b);
  }

  public Node uge(Node a, Node b) {
    return compare(OpKind.UGE, a, b);
  }

  public Node slt(Node a, Node b) {
    return compare(OpKind.SLT, a, b);
  }

  public Node sle(Node a, Node b) {
    return compare(OpKind.SLE, a, b);
  }

  public Node sgt(Node a, Node b) {
    return compare(OpKind.SGT, a, b);
  }

  public Node sge(Node a, Node b) {
    return compare(OpKind.SGE, a, b);
  }

  /**
   * Returns a select on {@code selector}. A default value is required if the selector can take
   * values that don't correspond to a case, and not allowed otherwise.
   */
  public Node.Select select(Node selector, List<Node> cases, @Nullable Node defaultValue) {
    checkSameBitsType(selector);
    Preconditions.checkArgument(!cases.isEmpty(), "A select needs at least one case");
    ImmutableList.Builder<Node> operands = ImmutableList.<Node>builder().add(selector);
    operands.addAll(cases);
    if (defaultValue != null) {
      operands.add(defaultValue);
    }
    ImmutableList<Node> allOperands = operands.build();
    checkOperands(allOperands.toArray(new Node[0]));
    Type type = cases.get(0).type;
    for (Node value : allOperands.subList(1, allOperands.size())) {
      Preconditions.checkArgument(
          value.type.equals(type), "Type mismatch: %s vs %s", value.type, type);
    }
    BigInteger selectorValues = BigInteger.ONE.shiftLeft(selector.width());
    int cmp = BigInteger.valueOf(cases.size()).compareTo(selectorValues);
    Preconditions.checkArgument(cmp <= 0, "Too many cases for a %s-bit selector", selector.width());
    Preconditions.checkArgument(
        (cmp < 0) == (defaultValue != null),
        cmp < 0 ? "A default is required" : "A default is not allowed");
    return append(
        new Node.Select(
            nextId(), defaultName(OpKind.SEL), type, allOperands, defaultValue != null));
  }

  public Node.Select select(Node selector, Node... cases) {
    return select(selector, Arrays.asList(cases), null);
  }

  public Node zeroExt(Node operand, int newWidth) {
    checkSameBitsType(operand);
    checkOperands(operand);
    Preconditions.checkArgument(
        newWidth >= operand.width(), "Can't zero-extend %s to %s bits", operand, newWidth);
    return append(new Node.ZeroExt(nextId(), defaultName(OpKind.ZERO_EXT), operand, newWidth));
  }

  public Node tuple(Node... elements) {
    Type type = Type.tuple(Arrays.stream(elements).map(n -> n.type).toArray(Type[]::new));
    return simple(OpKind.TUPLE, type, elements);
  }

  public Node tupleIndex(Node tuple, int index) {
    checkOperands(tuple);
    Preconditions.checkArgument(tuple.type instanceof Type.TupleType, "%s is not a tuple", tuple);
    Type.TupleType tupleType = (Type.TupleType) tuple.type;
    Preconditions.checkElementIndex(index, tupleType.elements.size());
    return append(
        new Node.TupleIndex(
            nextId(),
            defaultName(OpKind.TUPLE_INDEX),
            tupleType.elements.get(index),
            tuple,
            index));
  }

  /** Returns the function; no more nodes may be added after this is called. */
  public IrFunction build(@Nullable Node returnValue) {
    Preconditions.checkState(!built, "Function %s has already been built", functionName);
    if (returnValue != null) {
      checkOperands(returnValue);
    }
    built = true;
    return new IrFunction(
        functionName, ImmutableList.copyOf(params), ImmutableList.copyOf(nodes), returnValue);
  }
}
