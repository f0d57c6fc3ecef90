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
package net.hydromatic.relax.pattern;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.relax.ir.Op;
import net.hydromatic.relax.ir.Prim;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.ir.RxBuilder;
import net.hydromatic.relax.type.Type;

/** Builds dataflow patterns. */
public enum DfpBuilder {
  /**
   * The singleton instance of the pattern builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  dfp;

  /** Creates a pattern that matches any expression. */
  public Dfp.WildcardPat wildcard() {
    return new Dfp.WildcardPat();
  }

  /** Creates a pattern that matches the standard operator with given name. */
  public Dfp.ExprPat isOp(String name) {
    return new Dfp.ExprPat(RxBuilder.rx.op(name));
  }

  /**
   * Creates a pattern that matches an expression structurally equal to a
   * given expression.
   */
  public Dfp.ExprPat isExpr(Rx.Expr expr) {
    return new Dfp.ExprPat(expr);
  }

  /** Creates a pattern that matches a constant. */
  public Dfp.ConstantPat isConst() {
    return new Dfp.ConstantPat();
  }

  /** Creates a pattern that matches any variable. */
  public Dfp.VarPat isVar() {
    return isVar("");
  }

  /**
   * Creates a pattern that matches a variable with a given name, or any
   * variable if the name is empty.
   */
  public Dfp.VarPat isVar(String name) {
    return new Dfp.VarPat(Op.VAR_PAT, name);
  }

  /**
   * Creates a pattern that matches a dataflow variable with a given name, or
   * any dataflow variable if the name is empty.
   */
  public Dfp.VarPat isDfVar(String name) {
    return new Dfp.VarPat(Op.DATAFLOW_VAR_PAT, name);
  }

  /**
   * Creates a pattern that matches a global variable with a given name, or
   * any global variable if the name is empty.
   */
  public Dfp.VarPat isGv(String name) {
    return new Dfp.VarPat(Op.GLOBAL_VAR_PAT, name);
  }

  /**
   * Creates a pattern that matches a reference to the external function with
   * a given symbol, or to any external function if the symbol is empty.
   */
  public Dfp.ExternFuncPat isExternFunc(String globalSymbol) {
    return new Dfp.ExternFuncPat(globalSymbol);
  }

  /** Creates a pattern that matches a tuple with given fields. */
  public Dfp.TuplePat isTuple(Dfp.Pattern... fields) {
    return new Dfp.TuplePat(ImmutableList.copyOf(fields));
  }

  /** Creates a pattern that matches a tuple with given fields. */
  public Dfp.TuplePat isTuple(List<? extends Dfp.Pattern> fields) {
    return new Dfp.TuplePat(ImmutableList.copyOf(fields));
  }

  /** Creates a pattern that matches any tuple. */
  public Dfp.TuplePat isAnyTuple() {
    return new Dfp.TuplePat(null);
  }

  /**
   * Creates a pattern that matches field {@code index} of a tuple; if {@code
   * index} is -1, matches any field.
   */
  public Dfp.TupleGetItemPat isTupleGetItem(Dfp.Pattern tuple, int index) {
    return new Dfp.TupleGetItemPat(tuple, index);
  }

  /** Creates a pattern that matches a function. */
  public Dfp.FunctionPat isFunction(
      List<? extends Dfp.Pattern> params, Dfp.Pattern body) {
    return new Dfp.FunctionPat(ImmutableList.copyOf(params), body);
  }

  /** Creates a pattern that matches a function with any parameters. */
  public Dfp.FunctionPat isFunction(Dfp.Pattern body) {
    return new Dfp.FunctionPat(null, body);
  }

  /** Creates a pattern that matches a conditional expression. */
  public Dfp.IfPat isIf(
      Dfp.Pattern cond, Dfp.Pattern ifTrue, Dfp.Pattern ifFalse) {
    return new Dfp.IfPat(cond, ifTrue, ifFalse);
  }

  /** Creates a pattern that matches a shape literal. */
  public Dfp.PrimArrPat isShape(List<? extends Prim.Expr> dims) {
    return new Dfp.PrimArrPat(ImmutableList.copyOf(dims));
  }

  /** Creates a pattern that matches a shape literal. */
  public Dfp.PrimArrPat isShape(long... dims) {
    return isShape(RxBuilder.rx.intImms(dims));
  }

  /**
   * Creates a pattern that matches an expression whose shape is only known at
   * run time.
   */
  public Dfp.RuntimeDepShapePat isRuntimeDepShape() {
    return new Dfp.RuntimeDepShapePat();
  }

  /** Creates a pattern that matches an expression with a given type. */
  public Dfp.TypePat hasType(Type type) {
    return wildcard().hasType(type);
  }

  /** Creates a pattern that matches an expression with a given data type. */
  public Dfp.DataTypePat hasDtype(String dtype) {
    return wildcard().hasDtype(dtype);
  }

  /** Creates a pattern that matches an expression with a given shape. */
  public Dfp.ShapePat hasShape(List<? extends Prim.Expr> dims) {
    return wildcard().hasShape(dims);
  }

  /**
   * Creates a dominator pattern.
   *
   * @param child Pattern for the node where the search starts
   * @param path Pattern that every node between child and parent must match
   * @param parent Pattern for the node that dominates the child
   */
  public Dfp.DominatorPat dominates(
      Dfp.Pattern child, Dfp.Pattern path, Dfp.Pattern parent) {
    return new Dfp.DominatorPat(child, path, parent);
  }

  /**
   * Converts an attribute value supplied by the user into the literal that an
   * attribute pattern holds.
   */
  static Object toLiteral(Object value) {
    if (value instanceof Boolean) {
      return RxBuilder.rx.intImm((Boolean) value ? 1 : 0);
    }
    if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte) {
      return RxBuilder.rx.intImm(((Number) value).longValue());
    }
    if (value instanceof Float || value instanceof Double) {
      return RxBuilder.rx.floatImm(((Number) value).doubleValue());
    }
    return value;
  }
}

// End DfpBuilder.java
