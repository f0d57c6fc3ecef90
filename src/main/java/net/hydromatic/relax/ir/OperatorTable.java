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
package net.hydromatic.relax.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Registry of operators, and of the attribute maps that describe them.
 *
 * <p>An attribute map, such as "TOpPattern", assigns a value to some of the
 * operators in the table. An attribute pattern on an operator reads these
 * maps.
 */
public class OperatorTable {
  /** Operators whose arguments may be swapped without changing the result. */
  private static final ImmutableSet<String> COMMUTATIVE =
      ImmutableSet.of("add", "multiply");

  /** Values of the "TOpPattern" attribute. */
  public static final int ELEM_WISE = 0;
  public static final int BROADCAST = 1;
  public static final int INJECTIVE = 2;
  public static final int COMM_REDUCE = 3;
  public static final int OUT_ELEM_WISE_FUSABLE = 4;
  public static final int OPAQUE = 8;

  private static final OperatorTable STANDARD =
      builder()
          .add("add", BROADCAST)
          .add("subtract", BROADCAST)
          .add("multiply", BROADCAST)
          .add("divide", BROADCAST)
          .add("exp", ELEM_WISE)
          .add("sqrt", ELEM_WISE)
          .add("nn.relu", ELEM_WISE)
          .add("nn.softmax", OPAQUE)
          .add("nn.conv2d", OUT_ELEM_WISE_FUSABLE)
          .add("nn.dense", OUT_ELEM_WISE_FUSABLE)
          .add("matmul", OUT_ELEM_WISE_FUSABLE)
          .add("reshape", INJECTIVE)
          .add("sum", COMM_REDUCE)
          .add("print", OPAQUE)
          .attr("print", "TOpIsStateful", true)
          .build();

  private final ImmutableMap<String, Rx.Operator> operators;
  private final ImmutableMap<String, ImmutableMap<Rx.Operator, Object>>
      attrMaps;

  private OperatorTable(
      ImmutableMap<String, Rx.Operator> operators,
      ImmutableMap<String, ImmutableMap<Rx.Operator, Object>> attrMaps) {
    this.operators = operators;
    this.attrMaps = attrMaps;
  }

  /** Returns the table of standard operators. */
  public static OperatorTable standard() {
    return STANDARD;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether an operator is commutative.
   *
   * <p>Only "add" and "multiply" are.
   */
  public static boolean isCommutative(String name) {
    return COMMUTATIVE.contains(name);
  }

  /** Returns the operator with a given name, or null. */
  public Rx.@Nullable Operator lookup(String name) {
    return operators.get(name);
  }

  /**
   * Returns the operator with a given name.
   *
   * @throws IllegalArgumentException if there is no such operator
   */
  public Rx.Operator get(String name) {
    final Rx.@Nullable Operator operator = operators.get(name);
    checkArgument(operator != null, "unknown operator '%s'", name);
    return operator;
  }

  /** Returns whether any operator has a value for a given attribute. */
  public boolean hasAttrMap(String attrName) {
    return attrMaps.containsKey(attrName);
  }

  /**
   * Returns the values of a given attribute, keyed by operator; empty if
   * there is no such attribute.
   */
  public ImmutableMap<Rx.Operator, Object> attrMap(String attrName) {
    final @Nullable ImmutableMap<Rx.Operator, Object> map =
        attrMaps.get(attrName);
    return map == null ? ImmutableMap.of() : map;
  }

  /** Builder for {@link OperatorTable}. */
  public static class Builder {
    private final Map<String, Rx.Operator> operators = new LinkedHashMap<>();
    private final Map<String, Map<Rx.Operator, Object>> attrMaps =
        new LinkedHashMap<>();

    private Builder() {}

    /** Registers an operator. */
    public Builder add(String name) {
      checkArgument(
          !operators.containsKey(name), "duplicate operator '%s'", name);
      operators.put(name, new Rx.Operator(name));
      return this;
    }

    /** Registers an operator with a value of the "TOpPattern" attribute. */
    public Builder add(String name, int opPattern) {
      return add(name).attr(name, "TOpPattern", opPattern);
    }

    /** Sets the value of an attribute of a registered operator. */
    public Builder attr(String name, String attrName, Object value) {
      final Rx.@Nullable Operator operator = operators.get(name);
      checkArgument(operator != null, "unknown operator '%s'", name);
      attrMaps
          .computeIfAbsent(attrName, k -> new LinkedHashMap<>())
          .put(operator, value);
      return this;
    }

    public OperatorTable build() {
      final ImmutableMap.Builder<String, ImmutableMap<Rx.Operator, Object>> b =
          ImmutableMap.builder();
      attrMaps.forEach((name, map) -> b.put(name, ImmutableMap.copyOf(map)));
      return new OperatorTable(ImmutableMap.copyOf(operators), b.build());
    }
  }
}

// End OperatorTable.java
