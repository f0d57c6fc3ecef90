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
package net.hydromatic.relax.analysis;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.relax.ir.Attrs;
import net.hydromatic.relax.ir.Prim;
import net.hydromatic.relax.ir.Rx;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Deep, order-sensitive comparison of IR values.
 *
 * <p>Compares expressions, symbolic integers, types, data types, attributes,
 * and lists and maps of them. Free variables are equal only if they are the
 * same object; the parameters of two functions being compared are paired up
 * positionally, so that {@code fn (x) { x }} equals {@code fn (y) { y }}, but
 * {@code fn (x) { y }} does not.
 *
 * <p>Annotations (checked type and shape) of expressions are not compared.
 */
public class StructuralEqual {
  /** Maps a parameter on the left to its counterpart on the right. */
  private final Map<Rx.Var, Rx.Var> varMap = Maps.newIdentityHashMap();
  /** Inverse of {@link #varMap}. */
  private final Map<Rx.Var, Rx.Var> reverseVarMap =
      Maps.newIdentityHashMap();

  private StructuralEqual() {}

  /** Returns whether two values are structurally equal. */
  public static boolean equal(@Nullable Object left, @Nullable Object right) {
    return new StructuralEqual().eq(left, right);
  }

  private boolean eq(@Nullable Object left, @Nullable Object right) {
    if (left instanceof Rx.Expr && right instanceof Rx.Expr) {
      return exprEq((Rx.Expr) left, (Rx.Expr) right);
    }
    if (left == right) {
      return true;
    }
    if (left == null || right == null) {
      return false;
    }
    if (left instanceof Prim.Expr && right instanceof Prim.Expr) {
      return primEq((Prim.Expr) left, (Prim.Expr) right);
    }
    if (left instanceof Attrs && right instanceof Attrs) {
      return ((Attrs) left).typeKey.equals(((Attrs) right).typeKey)
          && eq(((Attrs) left).fields, ((Attrs) right).fields);
    }
    if (left instanceof List && right instanceof List) {
      return listEq((List<?>) left, (List<?>) right);
    }
    if (left instanceof Map && right instanceof Map) {
      final Map<?, ?> leftMap = (Map<?, ?>) left;
      final Map<?, ?> rightMap = (Map<?, ?>) right;
      if (!leftMap.keySet().equals(rightMap.keySet())) {
        return false;
      }
      for (Map.Entry<?, ?> entry : leftMap.entrySet()) {
        if (!eq(entry.getValue(), rightMap.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    }
    if (left instanceof Number && right instanceof Number) {
      return numberEq((Number) left, (Number) right);
    }
    // Types, data types, strings and booleans are values.
    return left.equals(right);
  }

  private boolean listEq(List<?> left, List<?> right) {
    if (left.size() != right.size()) {
      return false;
    }
    for (int i = 0; i < left.size(); i++) {
      if (!eq(left.get(i), right.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean numberEq(Number left, Number right) {
    if (isIntegral(left) && isIntegral(right)) {
      return left.longValue() == right.longValue();
    }
    return left.doubleValue() == right.doubleValue();
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long
        || n instanceof Integer
        || n instanceof Short
        || n instanceof Byte;
  }

  private boolean exprEq(Rx.Expr left, Rx.Expr right) {
    if (left.op != right.op) {
      return false;
    }
    switch (left.op) {
    case VAR:
    case DATAFLOW_VAR:
      final Rx.@Nullable Var mapped = varMap.get((Rx.Var) left);
      final Rx.@Nullable Var reverseMapped = reverseVarMap.get((Rx.Var) right);
      if (mapped == null && reverseMapped == null) {
        // Both free
        return left == right;
      }
      return mapped == right && reverseMapped == left;

    case GLOBAL_VAR:
      return ((Rx.GlobalVar) left).name.equals(((Rx.GlobalVar) right).name);

    case CONSTANT:
      final Rx.Constant c0 = (Rx.Constant) left;
      final Rx.Constant c1 = (Rx.Constant) right;
      return c0.dtype.equals(c1.dtype)
          && c0.dims.equals(c1.dims)
          && listEq(c0.data, c1.data);

    case OPERATOR:
      return ((Rx.Operator) left).name.equals(((Rx.Operator) right).name);

    case EXTERN_FUNC:
      return ((Rx.ExternFunc) left)
          .globalSymbol.equals(((Rx.ExternFunc) right).globalSymbol);

    case TUPLE:
      return listEq(((Rx.Tuple) left).fields, ((Rx.Tuple) right).fields);

    case TUPLE_GET_ITEM:
      final Rx.TupleGetItem g0 = (Rx.TupleGetItem) left;
      final Rx.TupleGetItem g1 = (Rx.TupleGetItem) right;
      return g0.index == g1.index && exprEq(g0.tuple, g1.tuple);

    case CALL:
      final Rx.Call call0 = (Rx.Call) left;
      final Rx.Call call1 = (Rx.Call) right;
      return exprEq(call0.fn, call1.fn)
          && listEq(call0.args, call1.args)
          && eq(call0.attrs, call1.attrs);

    case FUNCTION:
      return functionEq((Rx.Function) left, (Rx.Function) right);

    case IF:
      final Rx.If if0 = (Rx.If) left;
      final Rx.If if1 = (Rx.If) right;
      return exprEq(if0.cond, if1.cond)
          && exprEq(if0.ifTrue, if1.ifTrue)
          && exprEq(if0.ifFalse, if1.ifFalse);

    case SHAPE_EXPR:
      return listEq(
          ((Rx.ShapeExpr) left).values, ((Rx.ShapeExpr) right).values);

    case RUNTIME_DEP_SHAPE:
      return true;

    default:
      throw new AssertionError("unknown expression " + left.op + ": " + left);
    }
  }

  /**
   * Compares two functions, pairing their parameters while comparing the
   * bodies.
   */
  private boolean functionEq(Rx.Function f0, Rx.Function f1) {
    if (f0.params.size() != f1.params.size()) {
      return false;
    }
    final ImmutableMap<Rx.Var, Rx.Var> outerVarMap =
        ImmutableMap.copyOf(varMap);
    final ImmutableMap<Rx.Var, Rx.Var> outerReverseVarMap =
        ImmutableMap.copyOf(reverseVarMap);
    try {
      for (int i = 0; i < f0.params.size(); i++) {
        final Rx.Var p0 = f0.params.get(i);
        final Rx.Var p1 = f1.params.get(i);
        if (p0.op != p1.op
            || !Objects.equals(p0.checkedType, p1.checkedType)) {
          return false;
        }
        varMap.put(p0, p1);
        reverseVarMap.put(p1, p0);
      }
      return Objects.equals(f0.retType, f1.retType)
          && eq(f0.attrs, f1.attrs)
          && exprEq(f0.body, f1.body);
    } finally {
      // Parameters are not visible outside the function
      reset(varMap, outerVarMap);
      reset(reverseVarMap, outerReverseVarMap);
    }
  }

  private static void reset(Map<Rx.Var, Rx.Var> map,
      Map<Rx.Var, Rx.Var> contents) {
    map.clear();
    map.putAll(contents);
  }

  private boolean primEq(Prim.Expr left, Prim.Expr right) {
    if (left.op != right.op) {
      return false;
    }
    switch (left.op) {
    case INT_IMM:
      return ((Prim.IntImm) left).value == ((Prim.IntImm) right).value;

    case FLOAT_IMM:
      return ((Prim.FloatImm) left).value == ((Prim.FloatImm) right).value;

    case STRING_IMM:
      return ((Prim.StringImm) left)
          .value.equals(((Prim.StringImm) right).value);

    case PRIM_VAR:
      return left == right;

    case PLUS:
    case MINUS:
    case TIMES:
    case FLOOR_DIV:
    case FLOOR_MOD:
      final Prim.Binary b0 = (Prim.Binary) left;
      final Prim.Binary b1 = (Prim.Binary) right;
      return primEq(b0.a0, b1.a0) && primEq(b0.a1, b1.a1);

    default:
      throw new AssertionError("unknown expression " + left.op + ": " + left);
    }
  }
}

// End StructuralEqual.java
