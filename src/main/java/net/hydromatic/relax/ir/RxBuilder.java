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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Longs;
import java.util.List;
import java.util.Map;
import net.hydromatic.relax.type.DataType;
import net.hydromatic.relax.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds dataflow expressions and symbolic integer expressions. */
public enum RxBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  rx;

  private final Rx.RuntimeDepShape runtimeDepShape = new Rx.RuntimeDepShape();

  /** Creates a variable. */
  public Rx.Var var(String name) {
    return new Rx.Var(name, null, null);
  }

  /** Creates a variable with a type and a shape. */
  public Rx.Var var(String name, @Nullable Type type, Rx.@Nullable Expr shape) {
    return new Rx.Var(name, type, shape);
  }

  /** Creates a dataflow variable. */
  public Rx.DataflowVar dataflowVar(String name) {
    return new Rx.DataflowVar(name, null, null);
  }

  /** Creates a dataflow variable with a type and a shape. */
  public Rx.DataflowVar dataflowVar(
      String name, @Nullable Type type, Rx.@Nullable Expr shape) {
    return new Rx.DataflowVar(name, type, shape);
  }

  /** Creates a reference to a global function. */
  public Rx.GlobalVar globalVar(String name) {
    return new Rx.GlobalVar(name);
  }

  /** Creates a constant tensor. */
  public Rx.Constant constant(
      DataType dtype, List<Long> dims, List<? extends Number> data) {
    return new Rx.Constant(
        dtype, ImmutableList.copyOf(dims), ImmutableList.copyOf(data), null,
        null);
  }

  /** Creates a scalar {@code float32} constant. */
  public Rx.Constant constant(double value) {
    return constant(
        DataType.FLOAT32, ImmutableList.of(), ImmutableList.of(value));
  }

  /** Creates a scalar {@code int64} constant. */
  public Rx.Constant constant(long value) {
    return constant(
        DataType.INT64, ImmutableList.of(), ImmutableList.of(value));
  }

  /** Returns the standard operator with a given name. */
  public Rx.Operator op(String name) {
    return OperatorTable.standard().get(name);
  }

  /** Creates a reference to an external function. */
  public Rx.ExternFunc externFunc(String globalSymbol) {
    return new Rx.ExternFunc(globalSymbol);
  }

  /** Creates a tuple. */
  public Rx.Tuple tuple(Rx.Expr... fields) {
    return new Rx.Tuple(ImmutableList.copyOf(fields), null, null);
  }

  /** Creates a tuple. */
  public Rx.Tuple tuple(List<? extends Rx.Expr> fields) {
    return new Rx.Tuple(ImmutableList.copyOf(fields), null, null);
  }

  /** Creates a tuple projection, "tuple[index]". */
  public Rx.TupleGetItem tupleGetItem(Rx.Expr tuple, int index) {
    return new Rx.TupleGetItem(tuple, index, null, null);
  }

  /** Creates a call without attributes. */
  public Rx.Call call(Rx.Expr fn, Rx.Expr... args) {
    return new Rx.Call(fn, ImmutableList.copyOf(args), null, null, null);
  }

  /** Creates a call to a standard operator. */
  public Rx.Call call(String opName, Rx.Expr... args) {
    return call(op(opName), args);
  }

  /** Creates a call with attributes. */
  public Rx.Call call(
      Rx.Expr fn, List<? extends Rx.Expr> args, @Nullable Attrs attrs) {
    return new Rx.Call(fn, ImmutableList.copyOf(args), attrs, null, null);
  }

  /** Creates a call with attributes, a type and a shape. */
  public Rx.Call call(
      Rx.Expr fn,
      List<? extends Rx.Expr> args,
      @Nullable Attrs attrs,
      @Nullable Type type,
      Rx.@Nullable Expr shape) {
    return new Rx.Call(fn, ImmutableList.copyOf(args), attrs, type, shape);
  }

  /** Creates a function. */
  public Rx.Function function(List<? extends Rx.Var> params, Rx.Expr body) {
    return new Rx.Function(
        ImmutableList.copyOf(params), body, null, ImmutableMap.of(), null);
  }

  /** Creates a function with a return type and attributes. */
  public Rx.Function function(
      List<? extends Rx.Var> params,
      Rx.Expr body,
      @Nullable Type retType,
      Map<String, ?> attrs) {
    return new Rx.Function(
        ImmutableList.copyOf(params),
        body,
        retType,
        ImmutableMap.copyOf(attrs),
        null);
  }

  /** Creates a conditional expression. */
  public Rx.If ifThenElse(Rx.Expr cond, Rx.Expr ifTrue, Rx.Expr ifFalse) {
    return new Rx.If(cond, ifTrue, ifFalse, null, null);
  }

  /** Creates a shape literal. */
  public Rx.ShapeExpr shape(Prim.Expr... values) {
    return new Rx.ShapeExpr(ImmutableList.copyOf(values));
  }

  /** Creates a shape literal. */
  public Rx.ShapeExpr shape(List<? extends Prim.Expr> values) {
    return new Rx.ShapeExpr(ImmutableList.copyOf(values));
  }

  /** Creates a shape literal whose dimensions are all constants. */
  public Rx.ShapeExpr shape(long... dims) {
    final ImmutableList.Builder<Prim.Expr> values = ImmutableList.builder();
    for (long dim : dims) {
      values.add(intImm(dim));
    }
    return new Rx.ShapeExpr(values.build());
  }

  /** Returns the marker for a shape that is only known at run time. */
  public Rx.RuntimeDepShape runtimeDepShape() {
    return runtimeDepShape;
  }

  // symbolic integer expressions

  /** Creates an integer literal. */
  public Prim.IntImm intImm(long value) {
    return new Prim.IntImm(value);
  }

  /** Creates a floating-point literal. */
  public Prim.FloatImm floatImm(double value) {
    return new Prim.FloatImm(value);
  }

  /** Creates a string literal. */
  public Prim.StringImm stringImm(String value) {
    return new Prim.StringImm(value);
  }

  /** Creates a symbolic variable. */
  public Prim.Var primVar(String name) {
    return new Prim.Var(name);
  }

  /** Creates "a0 + a1". */
  public Prim.Expr plus(Prim.Expr a0, Prim.Expr a1) {
    return new Prim.Binary(Op.PLUS, a0, a1);
  }

  /** Creates "a0 - a1". */
  public Prim.Expr minus(Prim.Expr a0, Prim.Expr a1) {
    return new Prim.Binary(Op.MINUS, a0, a1);
  }

  /** Creates "a0 * a1". */
  public Prim.Expr times(Prim.Expr a0, Prim.Expr a1) {
    return new Prim.Binary(Op.TIMES, a0, a1);
  }

  /** Creates "a0 // a1", rounding towards negative infinity. */
  public Prim.Expr floorDiv(Prim.Expr a0, Prim.Expr a1) {
    return new Prim.Binary(Op.FLOOR_DIV, a0, a1);
  }

  /** Creates "a0 % a1", with the sign of the divisor. */
  public Prim.Expr floorMod(Prim.Expr a0, Prim.Expr a1) {
    return new Prim.Binary(Op.FLOOR_MOD, a0, a1);
  }

  /** Converts a list of longs to a list of integer literals. */
  public List<Prim.Expr> intImms(long... values) {
    final ImmutableList.Builder<Prim.Expr> b = ImmutableList.builder();
    Longs.asList(values).forEach(v -> b.add(intImm(v)));
    return b.build();
  }
}

// End RxBuilder.java
