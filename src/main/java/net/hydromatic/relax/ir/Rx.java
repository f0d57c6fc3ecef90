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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.relax.type.DataType;
import net.hydromatic.relax.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Dataflow expressions.
 *
 * <p>Expressions form a directed acyclic graph: a sub-expression that is used
 * twice is referenced twice, not copied. Expressions never override {@link
 * Object#equals}, so two expressions that print the same but were created
 * separately are different nodes of the graph.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public class Rx {
  private Rx() {}

  /** Abstract base class of dataflow expressions. */
  public abstract static class Expr extends IrNode {
    /** Type computed by type inference, or null if not known. */
    public final @Nullable Type checkedType;

    /**
     * Shape, or null if not known. If not null, it is a {@link ShapeExpr} or a
     * {@link RuntimeDepShape}.
     */
    public final @Nullable Expr shape;

    Expr(Op op, @Nullable Type checkedType, @Nullable Expr shape) {
      super(op);
      this.checkedType = checkedType;
      this.shape = shape;
      checkArgument(
          shape == null
              || shape.op == Op.SHAPE_EXPR
              || shape.op == Op.RUNTIME_DEP_SHAPE,
          "not a shape: %s",
          shape);
    }
  }

  /** Variable. */
  public static class Var extends Expr {
    /** Name hint; does not determine identity. */
    public final String name;

    Var(Op op, String name, @Nullable Type checkedType, @Nullable Expr shape) {
      super(op, checkedType, shape);
      this.name = requireNonNull(name);
      checkArgument(op.isVar());
      checkArgument(!name.isEmpty(), "empty name");
    }

    Var(String name, @Nullable Type checkedType, @Nullable Expr shape) {
      this(Op.VAR, name, checkedType, shape);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /**
   * Variable that is defined inside a dataflow block and is not visible
   * outside it.
   */
  public static class DataflowVar extends Var {
    DataflowVar(String name, @Nullable Type checkedType, @Nullable Expr shape) {
      super(Op.DATAFLOW_VAR, name, checkedType, shape);
    }
  }

  /** Reference to a function defined at module level, such as "@main". */
  public static class GlobalVar extends Expr {
    public final String name;

    GlobalVar(String name) {
      super(Op.GLOBAL_VAR, null, null);
      this.name = requireNonNull(name);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("@").append(name);
    }
  }

  /** Constant tensor. */
  public static class Constant extends Expr {
    public final DataType dtype;
    /** Static shape; empty for a scalar. */
    public final ImmutableList<Long> dims;
    /** Elements, in row-major order. */
    public final ImmutableList<Number> data;

    Constant(
        DataType dtype,
        ImmutableList<Long> dims,
        ImmutableList<Number> data,
        @Nullable Type checkedType,
        @Nullable Expr shape) {
      super(Op.CONSTANT, checkedType, shape);
      this.dtype = requireNonNull(dtype);
      this.dims = requireNonNull(dims);
      this.data = requireNonNull(data);
      long size = 1;
      for (long dim : dims) {
        checkArgument(dim >= 0, "negative dimension %s", dim);
        size *= dim;
      }
      checkArgument(
          data.size() == size,
          "expected %s elements, got %s",
          size,
          data.size());
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      w.append("const(").append(dtype.toString()).append("[");
      for (int i = 0; i < dims.size(); i++) {
        w.append(i == 0 ? "" : ", ").append(Long.toString(dims.get(i)));
      }
      return w.append("])");
    }
  }

  /**
   * Primitive operator, such as "add".
   *
   * <p>Operators are interned: each {@link OperatorTable} holds one instance
   * per name.
   */
  public static class Operator extends Expr {
    public final String name;

    Operator(String name) {
      super(Op.OPERATOR, null, null);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Reference to a function implemented outside the IR. */
  public static class ExternFunc extends Expr {
    public final String globalSymbol;

    ExternFunc(String globalSymbol) {
      super(Op.EXTERN_FUNC, null, null);
      this.globalSymbol = requireNonNull(globalSymbol);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("extern(").appendValue(globalSymbol).append(")");
    }
  }

  /** Tuple. */
  public static class Tuple extends Expr {
    public final ImmutableList<Expr> fields;

    Tuple(
        ImmutableList<Expr> fields,
        @Nullable Type checkedType,
        @Nullable Expr shape) {
      super(Op.TUPLE, checkedType, shape);
      this.fields = requireNonNull(fields);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("(").appendAll(fields).append(")");
    }
  }

  /** Projection of one field from a tuple, "t[i]". */
  public static class TupleGetItem extends Expr {
    public final Expr tuple;
    public final int index;

    TupleGetItem(
        Expr tuple,
        int index,
        @Nullable Type checkedType,
        @Nullable Expr shape) {
      super(Op.TUPLE_GET_ITEM, checkedType, shape);
      this.tuple = requireNonNull(tuple);
      this.index = index;
      checkArgument(index >= 0, "negative index %s", index);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(tuple, left, Op.TUPLE_GET_ITEM.left)
          .append("[")
          .append(Integer.toString(index))
          .append("]");
    }
  }

  /** Call to an operator, function or external function. */
  public static class Call extends Expr {
    public final Expr fn;
    public final ImmutableList<Expr> args;
    /** Attributes; null for calls that have none, such as function calls. */
    public final @Nullable Attrs attrs;

    Call(
        Expr fn,
        ImmutableList<Expr> args,
        @Nullable Attrs attrs,
        @Nullable Type checkedType,
        @Nullable Expr shape) {
      super(Op.CALL, checkedType, shape);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      this.attrs = attrs;
    }

    /** Returns whether the callee is the operator with the given name. */
    public boolean isOp(String name) {
      return fn instanceof Operator && ((Operator) fn).name.equals(name);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      w.append(fn, 0, Op.CALL.left).append("(").appendAll(args);
      if (attrs != null) {
        w.append(args.isEmpty() ? "" : ", ").appendAttrs(attrs.fields);
      }
      return w.append(")");
    }
  }

  /** Function. */
  public static class Function extends Expr {
    public final ImmutableList<Var> params;
    public final Expr body;
    public final @Nullable Type retType;
    /** Function attributes, such as "global_symbol"; possibly empty. */
    public final ImmutableMap<String, Object> attrs;

    Function(
        ImmutableList<Var> params,
        Expr body,
        @Nullable Type retType,
        ImmutableMap<String, Object> attrs,
        @Nullable Type checkedType) {
      super(Op.FUNCTION, checkedType, null);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
      this.retType = retType;
      this.attrs = requireNonNull(attrs);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      w.append("fn (").appendAll(params).append(") ");
      if (!attrs.isEmpty()) {
        w.appendAttrs(attrs).append(" ");
      }
      return w.append("{ ").append(body, 0, 0).append(" }");
    }
  }

  /** Conditional expression. */
  public static class If extends Expr {
    public final Expr cond;
    public final Expr ifTrue;
    public final Expr ifFalse;

    If(
        Expr cond,
        Expr ifTrue,
        Expr ifFalse,
        @Nullable Type checkedType,
        @Nullable Expr shape) {
      super(Op.IF, checkedType, shape);
      this.cond = requireNonNull(cond);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("if (")
          .append(cond, 0, 0)
          .append(") { ")
          .append(ifTrue, 0, 0)
          .append(" } else { ")
          .append(ifFalse, 0, 0)
          .append(" }");
    }
  }

  /** Shape literal, a list of symbolic dimensions. */
  public static class ShapeExpr extends Expr {
    public final ImmutableList<Prim.Expr> values;

    ShapeExpr(ImmutableList<Prim.Expr> values) {
      super(Op.SHAPE_EXPR, null, null);
      this.values = requireNonNull(values);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("shape(").appendAll(values).append(")");
    }
  }

  /** Shape that is only known at run time. */
  public static class RuntimeDepShape extends Expr {
    RuntimeDepShape() {
      super(Op.RUNTIME_DEP_SHAPE, null, null);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("RuntimeDepShape()");
    }
  }

  /** Returns the expressions that {@code expr} directly reads, in order. */
  public static List<Expr> inputs(Expr expr) {
    switch (expr.op) {
    case VAR:
    case DATAFLOW_VAR:
    case GLOBAL_VAR:
    case CONSTANT:
    case OPERATOR:
    case EXTERN_FUNC:
    case SHAPE_EXPR:
    case RUNTIME_DEP_SHAPE:
      return ImmutableList.of();

    case TUPLE:
      return ((Tuple) expr).fields;

    case TUPLE_GET_ITEM:
      return ImmutableList.of(((TupleGetItem) expr).tuple);

    case CALL:
      final Call call = (Call) expr;
      return ImmutableList.<Expr>builder()
          .add(call.fn)
          .addAll(call.args)
          .build();

    case FUNCTION:
      final Function function = (Function) expr;
      return ImmutableList.<Expr>builder()
          .addAll(function.params)
          .add(function.body)
          .build();

    case IF:
      final If anIf = (If) expr;
      return ImmutableList.of(anIf.cond, anIf.ifTrue, anIf.ifFalse);

    default:
      throw new AssertionError("unknown expression " + expr.op + ": " + expr);
    }
  }
}

// End Rx.java
