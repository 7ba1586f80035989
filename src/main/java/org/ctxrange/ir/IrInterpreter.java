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
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.function.BinaryOperator;
import org.ctxrange.num.BitValue;

/**
 * Evaluates an {@link IrFunction} on concrete parameter values. Every value (of any type) is
 * represented as a {@code LeafTypeTree<BitValue>}.
 */
public class IrInterpreter {

  /**
   * Returns the value of every node of {@code function}, given values for each of its parameters.
   */
  public static ImmutableMap<Node, LeafTypeTree<BitValue>> evaluate(
      IrFunction function, Map<Node, LeafTypeTree<BitValue>> args) {
    Map<Node, LeafTypeTree<BitValue>> values = new HashMap<>();
    for (Node node : TopoSort.of(function)) {
      values.put(node, evaluateNode(node, values, args));
    }
    return ImmutableMap.copyOf(values);
  }

  /** A convenience version of {@link #evaluate} for functions whose parameters are all bits. */
  public static ImmutableMap<Node, LeafTypeTree<BitValue>> evaluateBits(
      IrFunction function, Map<Node, BitValue> args) {
    Map<Node, LeafTypeTree<BitValue>> trees = new HashMap<>();
    args.forEach((param, value) -> trees.put(param, LeafTypeTree.of(param.type, value)));
    return evaluate(function, trees);
  }

  private static LeafTypeTree<BitValue> evaluateNode(
      Node node,
      Map<Node, LeafTypeTree<BitValue>> values,
      Map<Node, LeafTypeTree<BitValue>> args) {
    return switch (node.kind) {
      case PARAM -> {
        LeafTypeTree<BitValue> arg = args.get(node);
        Preconditions.checkArgument(arg != null, "No value for parameter %s", node);
        Preconditions.checkArgument(
            arg.type().equals(node.type), "Expected %s for %s, got %s", node.type, node, arg);
        yield arg;
      }
      case LITERAL -> LeafTypeTree.of(node.type, ((Node.Literal) node).value);
      case IDENTITY -> values.get(node.operand(0));
      case ADD -> bits(node, bit(values, node, 0).add(bit(values, node, 1)));
      case SUB -> bits(node, bit(values, node, 0).sub(bit(values, node, 1)));
      case NEG -> bits(node, bit(values, node, 0).negate());
      case AND -> bits(node, fold(values, node, BitValue::and));
      case OR -> bits(node, fold(values, node, BitValue::or));
      case XOR -> bits(node, fold(values, node, BitValue::xor));
      case NOT -> bits(node, bit(values, node, 0).not());
      case EQ, NE, ULT, ULE, UGT, UGE, SLT, SLE, SGT, SGE -> bits(node, compare(node, values));
      case SEL -> {
        Node.Select select = (Node.Select) node;
        BigInteger selector = bit(values, node, 0).toUnsigned();
        ImmutableList<Node> cases = select.cases();
        Node chosen =
            (selector.compareTo(BigInteger.valueOf(cases.size())) < 0)
                ? cases.get(selector.intValueExact())
                : select.defaultValue();
        yield values.get(chosen);
      }
      case ZERO_EXT -> bits(node, bit(values, node, 0).zeroExtend(((Node.ZeroExt) node).newWidth));
      case TUPLE -> {
        ImmutableList.Builder<BitValue> leaves = ImmutableList.builder();
        node.operands().forEach(operand -> leaves.addAll(values.get(operand).elements()));
        yield LeafTypeTree.of(node.type, leaves.build());
      }
      case TUPLE_INDEX -> {
        Node.TupleIndex tupleIndex = (Node.TupleIndex) node;
        Type.TupleType tupleType = (Type.TupleType) node.operand(0).type;
        int start = tupleType.leafOffset(tupleIndex.index);
        yield LeafTypeTree.of(
            node.type, values.get(node.operand(0)).slice(start, start + node.type.leafCount()));
      }
    };
  }

  private static LeafTypeTree<BitValue> bits(Node node, BitValue value) {
    return LeafTypeTree.of(node.type, value);
  }

  private static BitValue bit(Map<Node, LeafTypeTree<BitValue>> values, Node node, int operand) {
    return values.get(node.operand(operand)).get();
  }

  private static BitValue fold(
      Map<Node, LeafTypeTree<BitValue>> values, Node node, BinaryOperator<BitValue> op) {
    return node.operands().stream().map(n -> values.get(n).get()).reduce(op).orElseThrow();
  }

  private static BitValue compare(Node node, Map<Node, LeafTypeTree<BitValue>> values) {
    LeafTypeTree<BitValue> a = values.get(node.operand(0));
    LeafTypeTree<BitValue> b = values.get(node.operand(1));
    boolean result =
        switch (node.kind) {
          case EQ -> a.equals(b);
          case NE -> !a.equals(b);
          default -> {
            int cmp = a.get().compare(b.get(), node.kind.isSigned());
            yield switch (node.kind) {
              case ULT, SLT -> cmp < 0;
              case ULE, SLE -> cmp <= 0;
              case UGT, SGT -> cmp > 0;
              case UGE, SGE -> cmp >= 0;
              default -> throw new AssertionError();
            };
          }
        };
    return BitValue.of(result ? 1 : 0, 1);
  }

  private IrInterpreter() {}
}
