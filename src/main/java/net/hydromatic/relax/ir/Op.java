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

/** Sub-types of {@link IrNode}. */
public enum Op {
  // expressions
  VAR(true),
  DATAFLOW_VAR(true),
  GLOBAL_VAR(true),
  CONSTANT(true),
  OPERATOR(true),
  EXTERN_FUNC(true),
  TUPLE(true),
  TUPLE_GET_ITEM(true),
  CALL(true),
  FUNCTION,
  IF,
  SHAPE_EXPR(true),
  RUNTIME_DEP_SHAPE(true),

  // symbolic integer expressions
  INT_IMM(true),
  FLOAT_IMM(true),
  STRING_IMM(true),
  PRIM_VAR(true),
  TIMES(" * ", 7),
  FLOOR_DIV(" // ", 7),
  FLOOR_MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),

  // types
  TENSOR_TYPE(true),
  TUPLE_TYPE(true),
  FUNCTION_TYPE(" -> ", 6, false),
  SHAPE_TYPE(true),
  OBJECT_TYPE(true),

  // patterns
  WILDCARD_PAT(true),
  OR_PAT(" | ", 1),
  AND_PAT(" & ", 2),
  NOT_PAT("~ ", 9),
  CONSTANT_PAT(true),
  VAR_PAT(true),
  DATAFLOW_VAR_PAT(true),
  GLOBAL_VAR_PAT(true),
  EXTERN_FUNC_PAT(true),
  EXPR_PAT(true),
  TUPLE_PAT(true),
  TUPLE_GET_ITEM_PAT(true),
  FUNCTION_PAT(true),
  IF_PAT(true),
  CALL_PAT(true),
  ATTR_PAT(true),
  TYPE_PAT(true),
  SHAPE_PAT(true),
  DATA_TYPE_PAT(true),
  PRIM_ARR_PAT(true),
  RUNTIME_DEP_SHAPE_PAT(true),
  DOMINATOR_PAT(true);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is the op of a pattern. */
  public boolean isPattern() {
    return name().endsWith("_PAT");
  }

  /** Returns whether this is the op of a type. */
  public boolean isType() {
    return name().endsWith("_TYPE");
  }

  /** Returns whether this is the op of a variable expression. */
  public boolean isVar() {
    return this == VAR || this == DATAFLOW_VAR;
  }
}

// End Op.java
