/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.relax.match;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.relax.ir.Rx;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Graph of the expressions reachable from a root, with edges from each
 * expression to the expressions it reads.
 *
 * <p>Each node also knows its place in the post-dominator tree: its
 * {@link Node#dominatorParent() dominator parent} is the nearest node that
 * lies on every path from it to the root. For example, in
 *
 * <blockquote>
 *
 * <pre>{@code
 * b = exp(a)
 * c = relu(b)
 * }</pre>
 *
 * </blockquote>
 *
 * <p>with root {@code c}, the dominator parent of {@code a} is {@code b}; if
 * the root were the tuple {@code (c, sqrt(a))}, it would be the tuple.
 *
 * <p>Nodes are keyed by identity, so two structurally equal expressions at
 * different places in the graph are different nodes.
 */
public class DependencyGraph {
  public final Rx.Expr root;
  private final Map<Rx.Expr, Node> nodeMap;
  private final ImmutableList<Node> topologicalOrder;

  private DependencyGraph(
      Rx.Expr root,
      Map<Rx.Expr, Node> nodeMap,
      ImmutableList<Node> topologicalOrder) {
    this.root = requireNonNull(root);
    this.nodeMap = requireNonNull(nodeMap);
    this.topologicalOrder = requireNonNull(topologicalOrder);
  }

  /** Creates the dependency graph of the expressions reachable from root. */
  public static DependencyGraph create(Rx.Expr root) {
    final Map<Rx.Expr, Node> nodeMap = Maps.newIdentityHashMap();
    final List<Node> order = new ArrayList<>();
    addPostOrder(root, nodeMap, order);

    for (Node node : order) {
      for (Rx.Expr input : Rx.inputs(node.expr)) {
        final Node inputNode = requireNonNull(nodeMap.get(input));
        node.inputs.add(inputNode);
        inputNode.outputs.add(node);
      }
    }

    // Consumers come after their inputs, so walk backwards from the root
    for (Node node : ImmutableList.copyOf(order).reverse()) {
      if (!node.outputs.isEmpty()) {
        final Node parent = leastCommonAncestor(node.outputs);
        node.dominatorParent = parent;
        node.depth = parent.depth + 1;
        parent.dominatorChildren.add(node);
      }
    }
    return new DependencyGraph(root, nodeMap, ImmutableList.copyOf(order));
  }

  /**
   * Adds the expressions reachable from {@code root} to {@code order}, each
   * after its inputs. Uses an explicit stack, so that a long chain of
   * expressions does not overflow the call stack.
   */
  private static void addPostOrder(
      Rx.Expr root, Map<Rx.Expr, Node> nodeMap, List<Node> order) {
    // An expression is on the stack twice: first to push its inputs, then
    // (marked as expanded) to add it after they have been added.
    final Deque<Rx.Expr> stack = new ArrayDeque<>();
    final Set<Rx.Expr> expanded = Sets.newIdentityHashSet();
    stack.push(root);
    while (!stack.isEmpty()) {
      final Rx.Expr expr = stack.pop();
      if (nodeMap.containsKey(expr)) {
        continue;
      }
      if (expanded.add(expr)) {
        stack.push(expr);
        // Push in reverse, so that the first input is added first
        for (Rx.Expr input : Lists.reverse(Rx.inputs(expr))) {
          if (!nodeMap.containsKey(input)) {
            stack.push(input);
          }
        }
      } else {
        final Node node = new Node(expr, order.size());
        nodeMap.put(expr, node);
        order.add(node);
      }
    }
  }

  private static Node leastCommonAncestor(List<Node> nodes) {
    Node ancestor = nodes.get(0);
    for (Node node : nodes.subList(1, nodes.size())) {
      ancestor = leastCommonAncestor(ancestor, node);
    }
    return ancestor;
  }

  private static Node leastCommonAncestor(Node left, Node right) {
    while (left != right) {
      if (left.depth < right.depth) {
        right = requireNonNull(right.dominatorParent);
      } else if (left.depth > right.depth) {
        left = requireNonNull(left.dominatorParent);
      } else {
        left = requireNonNull(left.dominatorParent);
        right = requireNonNull(right.dominatorParent);
      }
    }
    return left;
  }

  /** Returns whether an expression is a node of this graph. */
  public boolean contains(Rx.Expr expr) {
    return nodeMap.containsKey(expr);
  }

  /**
   * Returns the node of an expression.
   *
   * @throws IllegalStateException if the expression is not in this graph
   */
  public Node node(Rx.Expr expr) {
    final @Nullable Node node = nodeMap.get(expr);
    checkState(
        node != null, "expression is not in the dependency graph: %s", expr);
    return node;
  }

  /** Returns the nodes, each after all of its inputs; the root is last. */
  public List<Node> nodes() {
    return topologicalOrder;
  }

  /** Node of a dependency graph. */
  public static class Node {
    public final Rx.Expr expr;
    /** Position in topological order. */
    public final int index;

    final List<Node> inputs = new ArrayList<>();
    final List<Node> outputs = new ArrayList<>();
    final List<Node> dominatorChildren = new ArrayList<>();
    @Nullable Node dominatorParent;
    int depth;

    Node(Rx.Expr expr, int index) {
      this.expr = requireNonNull(expr);
      this.index = index;
    }

    @Override
    public String toString() {
      return index + ": " + expr;
    }

    /**
     * Returns the nodes that this node reads, in argument order. A node that
     * is read twice occurs twice.
     */
    public List<Node> inputs() {
      return Collections.unmodifiableList(inputs);
    }

    /** Returns the nodes that read this node. */
    public List<Node> outputs() {
      return Collections.unmodifiableList(outputs);
    }

    /** Returns the nodes whose dominator parent is this node. */
    public List<Node> dominatorChildren() {
      return Collections.unmodifiableList(dominatorChildren);
    }

    /** Returns the dominator parent; null for the root. */
    public @Nullable Node dominatorParent() {
      return dominatorParent;
    }

    /** Returns the depth in the dominator tree; 0 for the root. */
    public int depth() {
      return depth;
    }

    /**
     * Returns whether this node lies on every path from {@code node} to the
     * root. A node dominates itself.
     */
    public boolean dominates(Node node) {
      for (@Nullable Node n = node; n != null; n = n.dominatorParent) {
        if (n == this) {
          return true;
        }
      }
      return false;
    }
  }
}

// End DependencyGraph.java
