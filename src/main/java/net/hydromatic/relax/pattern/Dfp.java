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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.relax.ir.IrNode;
import net.hydromatic.relax.ir.IrWriter;
import net.hydromatic.relax.ir.Op;
import net.hydromatic.relax.ir.Prim;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.type.DataType;
import net.hydromatic.relax.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Dataflow patterns.
 *
 * <p>A pattern is an immutable tree that describes the shape of the
 * expressions it matches. For example,
 *
 * <blockquote>
 *
 * <pre>{@code
 * dfp.isOp("add").call(dfp.wildcard(), dfp.isConst())
 * }</pre>
 *
 * </blockquote>
 *
 * <p>matches a call to "add" whose second argument is a constant (or, since
 * "add" is commutative, whose first argument is a constant).
 *
 * <p>Patterns are compared by identity. If the same pattern object occurs
 * twice in a pattern tree, both occurrences must match the same expression.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public class Dfp {
  private Dfp() {}

  /** Abstract base class of patterns. */
  public abstract static class Pattern extends IrNode {
    Pattern(Op op) {
      super(op);
      checkArgument(op.isPattern(), "not a pattern op: %s", op);
    }

    /** Returns a pattern that matches a call of this with given arguments. */
    public CallPat call(Pattern... args) {
      return new CallPat(this, ImmutableList.copyOf(args));
    }

    /** Returns a pattern that matches a call of this with any arguments. */
    public CallPat callAny() {
      return new CallPat(this, null);
    }

    /** Returns a pattern that matches this or {@code other}. */
    public OrPat or(Pattern other) {
      return new OrPat(this, other);
    }

    /** Returns a pattern that matches this and {@code other}. */
    public AndPat and(Pattern other) {
      return new AndPat(this, other);
    }

    /** Returns a pattern that matches whatever this does not. */
    public NotPat not() {
      return new NotPat(this);
    }

    /**
     * Returns a pattern that matches this and whose attributes have given
     * values.
     *
     * <p>Values are converted to IR literals: integers and booleans to {@link
     * Prim.IntImm}, floating-point numbers to {@link Prim.FloatImm}; strings
     * and other values are used as is.
     */
    public AttrPat hasAttr(Map<String, ?> attrs) {
      final ImmutableMap.Builder<String, Object> b = ImmutableMap.builder();
      attrs.forEach((name, value) -> b.put(name, DfpBuilder.toLiteral(value)));
      return new AttrPat(this, b.build());
    }

    /** Returns a pattern that matches this and has a given type. */
    public TypePat hasType(Type type) {
      return new TypePat(this, type);
    }

    /** Returns a pattern that matches this and has a given shape. */
    public ShapePat hasShape(List<? extends Prim.Expr> dims) {
      return new ShapePat(this, ImmutableList.copyOf(dims));
    }

    /**
     * Returns a pattern that matches this and whose elements have a given data
     * type, such as "float32".
     */
    public DataTypePat hasDtype(String dtype) {
      return new DataTypePat(this, DataType.parse(dtype));
    }

    /**
     * Returns a pattern that matches when this is dominated by {@code parent},
     * every node between them matching {@code path}.
     */
    public DominatorPat dominates(Pattern parent, Pattern path) {
      return new DominatorPat(this, path, parent);
    }

    /** Returns a pattern that projects field {@code index} of this. */
    public TupleGetItemPat getItem(int index) {
      return new TupleGetItemPat(this, index);
    }
  }

  /** Pattern that matches any expression. */
  public static class WildcardPat extends Pattern {
    WildcardPat() {
      super(Op.WILDCARD_PAT);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("*");
    }
  }

  /** Pattern that matches if either of two patterns matches. */
  public static class OrPat extends Pattern {
    public final Pattern left;
    public final Pattern right;

    OrPat(Pattern left, Pattern right) {
      super(Op.OR_PAT);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }
  }

  /** Pattern that matches if both of two patterns match. */
  public static class AndPat extends Pattern {
    public final Pattern left;
    public final Pattern right;

    AndPat(Pattern left, Pattern right) {
      super(Op.AND_PAT);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }
  }

  /** Pattern that matches if a pattern does not match. */
  public static class NotPat extends Pattern {
    public final Pattern reject;

    NotPat(Pattern reject) {
      super(Op.NOT_PAT);
      this.reject = requireNonNull(reject);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("~").append(reject, op.right, right);
    }
  }

  /** Pattern that matches a constant. */
  public static class ConstantPat extends Pattern {
    ConstantPat() {
      super(Op.CONSTANT_PAT);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("const");
    }
  }

  /**
   * Pattern that matches a variable, a dataflow variable or a global
   * variable, optionally with a given name.
   */
  public static class VarPat extends Pattern {
    /** Required name; empty matches any name. */
    public final String name;

    VarPat(Op op, String name) {
      super(op);
      this.name = requireNonNull(name);
      checkArgument(
          op == Op.VAR_PAT
              || op == Op.DATAFLOW_VAR_PAT
              || op == Op.GLOBAL_VAR_PAT);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      w.append(
          op == Op.VAR_PAT
              ? "var"
              : op == Op.DATAFLOW_VAR_PAT ? "dfvar" : "gv");
      return name.isEmpty() ? w : w.append("(").appendValue(name).append(")");
    }
  }

  /**
   * Pattern that matches a reference to an external function, optionally with
   * a given symbol.
   */
  public static class ExternFuncPat extends Pattern {
    /** Required symbol; empty matches any symbol. */
    public final String globalSymbol;

    ExternFuncPat(String globalSymbol) {
      super(Op.EXTERN_FUNC_PAT);
      this.globalSymbol = requireNonNull(globalSymbol);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      w.append("extern");
      return globalSymbol.isEmpty()
          ? w
          : w.append("(").appendValue(globalSymbol).append(")");
    }
  }

  /** Pattern that matches an expression structurally equal to a given one. */
  public static class ExprPat extends Pattern {
    public final Rx.Expr expr;

    ExprPat(Rx.Expr expr) {
      super(Op.EXPR_PAT);
      this.expr = requireNonNull(expr);
    }

    /**
     * Returns the operator if this pattern is a standard operator with the
     * given name, otherwise null.
     */
    public Rx.@Nullable Operator operator(String name) {
      return expr instanceof Rx.Operator
              && ((Rx.Operator) expr).name.equals(name)
          ? (Rx.Operator) expr
          : null;
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(expr, left, right);
    }
  }

  /** Pattern that matches a tuple. */
  public static class TuplePat extends Pattern {
    /** Field patterns; null matches a tuple with any number of fields. */
    public final @Nullable ImmutableList<Pattern> fields;

    TuplePat(@Nullable ImmutableList<Pattern> fields) {
      super(Op.TUPLE_PAT);
      this.fields = fields;
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return fields == null
          ? w.append("(...)")
          : w.append("(").appendAll(fields).append(")");
    }
  }

  /** Pattern that matches a projection from a tuple. */
  public static class TupleGetItemPat extends Pattern {
    /** Value of {@link #index} that matches any index. */
    public static final int ANY_INDEX = -1;

    public final Pattern tuple;
    public final int index;

    TupleGetItemPat(Pattern tuple, int index) {
      super(Op.TUPLE_GET_ITEM_PAT);
      this.tuple = requireNonNull(tuple);
      this.index = index;
      checkArgument(index >= ANY_INDEX, "invalid index %s", index);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(tuple, left, op.left)
          .append("[")
          .append(index == ANY_INDEX ? "*" : Integer.toString(index))
          .append("]");
    }
  }

  /** Pattern that matches a function. */
  public static class FunctionPat extends Pattern {
    /** Parameter patterns; null matches any number of parameters. */
    public final @Nullable ImmutableList<Pattern> params;

    public final Pattern body;

    FunctionPat(@Nullable ImmutableList<Pattern> params, Pattern body) {
      super(Op.FUNCTION_PAT);
      this.params = params;
      this.body = requireNonNull(body);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      w.append("fn ");
      if (params == null) {
        w.append("(...)");
      } else {
        w.append("(").appendAll(params).append(")");
      }
      return w.append(" { ").append(body, 0, 0).append(" }");
    }
  }

  /** Pattern that matches a conditional expression. */
  public static class IfPat extends Pattern {
    public final Pattern cond;
    public final Pattern ifTrue;
    public final Pattern ifFalse;

    IfPat(Pattern cond, Pattern ifTrue, Pattern ifFalse) {
      super(Op.IF_PAT);
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

  /** Pattern that matches a call. */
  public static class CallPat extends Pattern {
    public final Pattern fn;
    /** Argument patterns; null matches any number of arguments. */
    public final @Nullable ImmutableList<Pattern> args;

    CallPat(Pattern fn, @Nullable ImmutableList<Pattern> args) {
      super(Op.CALL_PAT);
      this.fn = requireNonNull(fn);
      this.args = args;
    }

    /**
     * Returns whether the callee of this pattern is the operator with the
     * given name.
     */
    public boolean isOp(String name) {
      return fn instanceof ExprPat && ((ExprPat) fn).operator(name) != null;
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      w.append(fn, 0, op.left);
      return args == null
          ? w.append("(...)")
          : w.append("(").appendAll(args).append(")");
    }
  }

  /**
   * Pattern that matches if a pattern matches and the expression's attributes
   * have given values.
   */
  public static class AttrPat extends Pattern {
    public final Pattern pattern;
    public final ImmutableMap<String, Object> attrs;

    AttrPat(Pattern pattern, ImmutableMap<String, Object> attrs) {
      super(Op.ATTR_PAT);
      this.pattern = requireNonNull(pattern);
      this.attrs = requireNonNull(attrs);
      checkArgument(!attrs.isEmpty(), "no attributes");
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("has_attr(")
          .append(pattern, 0, 0)
          .append(", ")
          .appendAttrs(attrs)
          .append(")");
    }
  }

  /** Pattern that matches if a pattern matches and has a given type. */
  public static class TypePat extends Pattern {
    public final Pattern pattern;
    public final Type type;

    TypePat(Pattern pattern, Type type) {
      super(Op.TYPE_PAT);
      this.pattern = requireNonNull(pattern);
      this.type = requireNonNull(type);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("has_type(")
          .append(pattern, 0, 0)
          .append(", ")
          .append(type.toString())
          .append(")");
    }
  }

  /** Pattern that matches if a pattern matches and has a given shape. */
  public static class ShapePat extends Pattern {
    public final Pattern pattern;
    public final ImmutableList<Prim.Expr> dims;

    ShapePat(Pattern pattern, ImmutableList<Prim.Expr> dims) {
      super(Op.SHAPE_PAT);
      this.pattern = requireNonNull(pattern);
      this.dims = requireNonNull(dims);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("has_shape(")
          .append(pattern, 0, 0)
          .append(", [")
          .appendAll(dims)
          .append("])");
    }
  }

  /**
   * Pattern that matches if a pattern matches and its elements have a given
   * data type.
   */
  public static class DataTypePat extends Pattern {
    public final Pattern pattern;
    public final DataType dtype;

    DataTypePat(Pattern pattern, DataType dtype) {
      super(Op.DATA_TYPE_PAT);
      this.pattern = requireNonNull(pattern);
      this.dtype = requireNonNull(dtype);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("has_dtype(")
          .append(pattern, 0, 0)
          .append(", ")
          .append(dtype.toString())
          .append(")");
    }
  }

  /** Pattern that matches a shape literal with given dimensions. */
  public static class PrimArrPat extends Pattern {
    public final ImmutableList<Prim.Expr> dims;

    PrimArrPat(ImmutableList<Prim.Expr> dims) {
      super(Op.PRIM_ARR_PAT);
      this.dims = requireNonNull(dims);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("shape(").appendAll(dims).append(")");
    }
  }

  /**
   * Pattern that matches an expression whose shape is only known at run
   * time.
   */
  public static class RuntimeDepShapePat extends Pattern {
    RuntimeDepShapePat() {
      super(Op.RUNTIME_DEP_SHAPE_PAT);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("RuntimeDepShape");
    }
  }

  /**
   * Pattern that matches if {@link #child} matches, and every path from it
   * through its inputs reaches a node that matches {@link #parent}, every
   * intermediate node matching {@link #path}.
   *
   * <p>For example, to find an element-wise chain that feeds a convolution,
   * match {@code dominates(relu, elemWise, conv2d)} against the relu call.
   */
  public static class DominatorPat extends Pattern {
    public final Pattern child;
    public final Pattern path;
    public final Pattern parent;

    DominatorPat(Pattern child, Pattern path, Pattern parent) {
      super(Op.DOMINATOR_PAT);
      this.child = requireNonNull(child);
      this.path = requireNonNull(path);
      this.parent = requireNonNull(parent);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("dominates(")
          .append(child, 0, 0)
          .append(", ")
          .append(path, 0, 0)
          .append(", ")
          .append(parent, 0, 0)
          .append(")");
    }
  }
}

// End Dfp.java
