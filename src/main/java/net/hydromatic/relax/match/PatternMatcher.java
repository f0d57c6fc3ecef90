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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.relax.analysis.CanonicalAnalyzer;
import net.hydromatic.relax.analysis.StructuralEqual;
import net.hydromatic.relax.analysis.SymbolicAnalyzer;
import net.hydromatic.relax.analysis.TypeInferrer;
import net.hydromatic.relax.analysis.TypeInferrers;
import net.hydromatic.relax.ir.Attrs;
import net.hydromatic.relax.ir.IrNode;
import net.hydromatic.relax.ir.Op;
import net.hydromatic.relax.ir.OperatorTable;
import net.hydromatic.relax.ir.Prim;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.pattern.Dfp;
import net.hydromatic.relax.type.DataType;
import net.hydromatic.relax.type.TensorType;
import net.hydromatic.relax.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether a pattern matches an expression, and records which
 * sub-pattern matched which sub-expression.
 *
 * <p>The matcher descends the pattern and the expression together, and
 * backtracks when an alternative fails: every binding made during the failed
 * alternative is rolled back before the next is tried. After a match, {@link
 * #state()} holds the bindings.
 *
 * <p>A matcher is not thread-safe; each call to {@link #match} resets its
 * state.
 */
public class PatternMatcher {
  private final TypeInferrer typeInferrer;
  private final SymbolicAnalyzer analyzer;
  private final OperatorTable operatorTable;
  private final @Nullable ImmutableMap<Rx.Var, Rx.Expr> varToValue;
  private final Rx.@Nullable Expr graphRoot;
  private final MatchTracer tracer;
  private final boolean commutativeMatch;
  private final boolean associativeMatch;
  private final boolean initialMemoize;
  private final boolean autoJump;
  private final MatchState state;

  /**
   * Whether a pattern that is already bound is resolved to its binding
   * instead of being matched again. Dominator patterns toggle it.
   */
  private boolean memoize;

  /** Root of the dependency graph for the current match. */
  private Rx.@Nullable Expr root;

  /** Dependency graph; built on first use by a dominator pattern. */
  private @Nullable DependencyGraph graph;

  private PatternMatcher(Builder builder) {
    this.typeInferrer = builder.typeInferrer;
    this.analyzer = builder.analyzer;
    this.operatorTable = builder.operatorTable;
    this.varToValue =
        builder.varToValue == null
            ? null
            : ImmutableMap.copyOf(builder.varToValue);
    this.graphRoot = builder.graphRoot;
    this.tracer = builder.tracer;
    this.commutativeMatch = Prop.COMMUTATIVE_MATCH.booleanValue(builder.props);
    this.associativeMatch = Prop.ASSOCIATIVE_MATCH.booleanValue(builder.props);
    this.initialMemoize = Prop.MEMOIZE.booleanValue(builder.props);
    this.autoJump = Prop.AUTO_JUMP.booleanValue(builder.props);
    this.state = new MatchState(tracer);
    this.memoize = initialMemoize;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether a pattern matches an expression.
   *
   * <p>Clears the state before starting; on success, the state holds the
   * bindings.
   */
  public boolean match(Dfp.Pattern pattern, Rx.Expr expr) {
    state.clear();
    memoize = initialMemoize;
    root = graphRoot != null ? graphRoot : expr;
    graph = null;
    return visit(pattern, expr);
  }

  /** Returns the bindings made by the most recent match. */
  public MatchState state() {
    return state;
  }

  /**
   * Returns the dependency graph of the current match, building it if
   * necessary.
   */
  DependencyGraph graph() {
    if (graph == null) {
      checkState(root != null, "no match in progress");
      graph = DependencyGraph.create(root);
    }
    return graph;
  }

  /**
   * Matches a pattern against an expression, committing the binding on
   * success and rolling back on failure.
   */
  boolean visit(Dfp.Pattern pattern, Rx.Expr expr) {
    if (memoize && state.isBound(pattern)) {
      final List<Rx.Expr> exprs = state.getAll(pattern);
      checkState(
          exprs.size() == 1,
          "pattern %s is bound to %s expressions",
          pattern,
          exprs.size());
      final boolean matched = exprs.get(0) == expr;
      tracer.onVisit(pattern, expr, matched);
      return matched;
    }
    final int watermark = state.watermark();
    final boolean matched = dispatch(pattern, expr);
    if (matched) {
      state.commit(pattern, expr);
    } else {
      state.rollback(watermark);
    }
    tracer.onVisit(pattern, expr, matched);
    return matched;
  }

  private boolean dispatch(Dfp.Pattern pattern, Rx.Expr expr) {
    switch (pattern.op) {
    case WILDCARD_PAT:
      return true;

    case OR_PAT:
      final Dfp.OrPat orPat = (Dfp.OrPat) pattern;
      return visit(orPat.left, expr) || visit(orPat.right, expr);

    case AND_PAT:
      final Dfp.AndPat andPat = (Dfp.AndPat) pattern;
      return visit(andPat.left, expr) && visit(andPat.right, expr);

    case NOT_PAT:
      return !visit(((Dfp.NotPat) pattern).reject, expr);

    case CONSTANT_PAT:
      return jump(expr).op == Op.CONSTANT;

    case VAR_PAT:
      return expr.op.isVar()
          && nameMatches(((Dfp.VarPat) pattern).name, ((Rx.Var) expr).name);

    case DATAFLOW_VAR_PAT:
      return expr.op == Op.DATAFLOW_VAR
          && nameMatches(((Dfp.VarPat) pattern).name, ((Rx.Var) expr).name);

    case GLOBAL_VAR_PAT:
      return expr.op == Op.GLOBAL_VAR
          && nameMatches(
              ((Dfp.VarPat) pattern).name, ((Rx.GlobalVar) expr).name);

    case EXTERN_FUNC_PAT:
      final Rx.Expr externFunc = jump(expr);
      return externFunc.op == Op.EXTERN_FUNC
          && nameMatches(
              ((Dfp.ExternFuncPat) pattern).globalSymbol,
              ((Rx.ExternFunc) externFunc).globalSymbol);

    case EXPR_PAT:
      return matchExpr((Dfp.ExprPat) pattern, expr);

    case TUPLE_PAT:
      return matchTuple((Dfp.TuplePat) pattern, jump(expr));

    case TUPLE_GET_ITEM_PAT:
      return matchTupleGetItem((Dfp.TupleGetItemPat) pattern, jump(expr));

    case FUNCTION_PAT:
      return matchFunction((Dfp.FunctionPat) pattern, jump(expr));

    case IF_PAT:
      return matchIf((Dfp.IfPat) pattern, jump(expr));

    case CALL_PAT:
      return matchCall((Dfp.CallPat) pattern, jump(expr));

    case ATTR_PAT:
      return matchAttr((Dfp.AttrPat) pattern, expr);

    case TYPE_PAT:
      return matchType((Dfp.TypePat) pattern, expr);

    case SHAPE_PAT:
      return matchShape((Dfp.ShapePat) pattern, expr);

    case DATA_TYPE_PAT:
      return matchDataType((Dfp.DataTypePat) pattern, expr);

    case PRIM_ARR_PAT:
      final Rx.Expr shape = jump(expr);
      return shape.op == Op.SHAPE_EXPR
          && analyzer.shapesEqual(
              ((Dfp.PrimArrPat) pattern).dims, ((Rx.ShapeExpr) shape).values);

    case RUNTIME_DEP_SHAPE_PAT:
      final Rx.@Nullable Expr inferredShape = typeInferrer.inferShape(expr);
      return inferredShape != null
          && inferredShape.op == Op.RUNTIME_DEP_SHAPE;

    case DOMINATOR_PAT:
      return matchDominator((Dfp.DominatorPat) pattern, expr);

    default:
      throw new AssertionError(
          "unknown pattern " + pattern.op + ": " + pattern);
    }
  }

  /**
   * If auto-jump is enabled and {@code expr} is a variable with a known
   * value, returns the value; otherwise returns {@code expr}.
   */
  private Rx.Expr jump(Rx.Expr expr) {
    if (autoJump && expr.op.isVar()) {
      final Rx.@Nullable Expr value = requireNonNull(varToValue).get(expr);
      if (value != null) {
        return value;
      }
    }
    return expr;
  }

  private static boolean nameMatches(String patternName, String name) {
    return patternName.isEmpty() || patternName.equals(name);
  }

  private boolean matchExpr(Dfp.ExprPat pattern, Rx.Expr expr) {
    if (StructuralEqual.equal(pattern.expr, expr)) {
      return true;
    }
    final Rx.Expr value = jump(expr);
    return value != expr && StructuralEqual.equal(pattern.expr, value);
  }

  private boolean matchTuple(Dfp.TuplePat pattern, Rx.Expr expr) {
    if (expr.op != Op.TUPLE) {
      return false;
    }
    return pattern.fields == null
        || matchAll(pattern.fields, ((Rx.Tuple) expr).fields);
  }

  private boolean matchTupleGetItem(
      Dfp.TupleGetItemPat pattern, Rx.Expr expr) {
    if (expr.op != Op.TUPLE_GET_ITEM) {
      return false;
    }
    final Rx.TupleGetItem getItem = (Rx.TupleGetItem) expr;
    return (pattern.index == Dfp.TupleGetItemPat.ANY_INDEX
            || pattern.index == getItem.index)
        && visit(pattern.tuple, getItem.tuple);
  }

  private boolean matchFunction(Dfp.FunctionPat pattern, Rx.Expr expr) {
    if (expr.op != Op.FUNCTION) {
      return false;
    }
    final Rx.Function function = (Rx.Function) expr;
    if (pattern.params != null && !matchAll(pattern.params, function.params)) {
      return false;
    }
    return visit(pattern.body, function.body);
  }

  private boolean matchIf(Dfp.IfPat pattern, Rx.Expr expr) {
    if (expr.op != Op.IF) {
      return false;
    }
    final Rx.If anIf = (Rx.If) expr;
    return visit(pattern.cond, anIf.cond)
        && visit(pattern.ifTrue, anIf.ifTrue)
        && visit(pattern.ifFalse, anIf.ifFalse);
  }

  /**
   * Matches patterns against expressions positionally. Fails if the lists
   * have different lengths.
   */
  private boolean matchAll(
      List<? extends Dfp.Pattern> patterns, List<? extends Rx.Expr> exprs) {
    if (patterns.size() != exprs.size()) {
      return false;
    }
    for (int i = 0; i < patterns.size(); i++) {
      if (!visit(patterns.get(i), exprs.get(i))) {
        return false;
      }
    }
    return true;
  }

  private boolean matchCall(Dfp.CallPat pattern, Rx.Expr expr) {
    if (expr.op != Op.CALL) {
      return false;
    }
    final Rx.Call call = (Rx.Call) expr;
    final int watermark = state.watermark();
    if (visit(pattern.fn, call.fn)) {
      final int argWatermark = state.watermark();
      if (matchArgs(pattern.args, call.args, argWatermark)) {
        return true;
      }
      if (commutativeMatch
          && pattern.args != null
          && isCommutative(pattern.fn)) {
        return matchArgs(pattern.args.reverse(), call.args, argWatermark);
      }
      return false;
    }
    state.rollback(watermark);
    return associativeMatch && matchAssociative(pattern, call, watermark);
  }

  /**
   * Matches call arguments positionally; null patterns match any arguments.
   * On failure, rolls back to {@code watermark}.
   */
  private boolean matchArgs(
      @Nullable ImmutableList<Dfp.Pattern> patterns,
      List<Rx.Expr> args,
      int watermark) {
    if (patterns == null || matchAll(patterns, args)) {
      return true;
    }
    state.rollback(watermark);
    return false;
  }

  private static boolean isCommutative(Dfp.Pattern fn) {
    return fn instanceof Dfp.ExprPat
        && ((Dfp.ExprPat) fn).expr instanceof Rx.Operator
        && OperatorTable.isCommutative(
            ((Rx.Operator) ((Dfp.ExprPat) fn).expr).name);
  }

  /** Returns whether an expression is a call to a given operator. */
  private boolean isCallTo(Rx.Expr expr, String opName) {
    final Rx.Expr value = jump(expr);
    return value instanceof Rx.Call && ((Rx.Call) value).isOp(opName);
  }

  /**
   * Tries to match a call pattern whose operator did not match, after
   * rebalancing "multiply" and "divide".
   *
   * <p>Pattern {@code divide(multiply(a, b), c)} is tried as {@code
   * multiply(b, divide(a, c))} and then as {@code multiply(a, divide(b, c))}
   * against a call to "multiply" that has a "divide" argument. Pattern {@code
   * multiply(divide(a, b), c)} is tried as {@code divide(multiply(a, c), b)}
   * against a call to "divide" that has a "multiply" argument.
   */
  private boolean matchAssociative(
      Dfp.CallPat pattern, Rx.Call call, int watermark) {
    if (pattern.args == null
        || pattern.args.size() != 2
        || call.args.size() != 2) {
      return false;
    }
    if (pattern.isOp("divide")
        && pattern.args.get(0) instanceof Dfp.CallPat) {
      final Dfp.CallPat mulPat = (Dfp.CallPat) pattern.args.get(0);
      if (mulPat.isOp("multiply")
          && mulPat.args != null
          && mulPat.args.size() == 2
          && call.isOp("multiply")
          && (isCallTo(call.args.get(0), "divide")
              || isCallTo(call.args.get(1), "divide"))) {
        for (int argId = 0; argId < 2; argId++) {
          final Dfp.CallPat div =
              pattern.fn.call(mulPat.args.get(argId), pattern.args.get(1));
          final Dfp.CallPat mul =
              mulPat.fn.call(mulPat.args.get((argId + 1) % 2), div);
          tracer.onRewrite(pattern, mul);
          if (visit(mul, call)) {
            return true;
          }
          state.rollback(watermark);
        }
        return false;
      }
    }
    if (pattern.isOp("multiply")) {
      for (int argId = 0; argId < 2; argId++) {
        if (!(pattern.args.get(argId) instanceof Dfp.CallPat)) {
          continue;
        }
        final Dfp.CallPat divPat = (Dfp.CallPat) pattern.args.get(argId);
        if (divPat.isOp("divide")
            && divPat.args != null
            && divPat.args.size() == 2
            && call.isOp("divide")
            && (isCallTo(call.args.get(0), "multiply")
                || isCallTo(call.args.get(1), "multiply"))) {
          final Dfp.CallPat mul =
              pattern.fn.call(
                  divPat.args.get(0), pattern.args.get((argId + 1) % 2));
          final Dfp.CallPat div = divPat.fn.call(mul, divPat.args.get(1));
          tracer.onRewrite(pattern, div);
          return visit(div, call);
        }
      }
    }
    return false;
  }

  private boolean matchAttr(Dfp.AttrPat pattern, Rx.Expr expr0) {
    if (!visit(pattern.pattern, expr0)) {
      return false;
    }
    final Rx.Expr expr = jump(expr0);
    switch (expr.op) {
    case OPERATOR:
      final Rx.@Nullable Operator operator =
          operatorTable.lookup(((Rx.Operator) expr).name);
      for (Map.Entry<String, Object> entry : pattern.attrs.entrySet()) {
        if (operator == null || !operatorTable.hasAttrMap(entry.getKey())) {
          return false;
        }
        final @Nullable Object value =
            operatorTable.attrMap(entry.getKey()).get(operator);
        if (value == null || !matchAttrValue(entry.getValue(), value)) {
          return false;
        }
      }
      return true;

    case CALL:
      final @Nullable Attrs attrs = ((Rx.Call) expr).attrs;
      final List<String> names =
          attrs == null ? ImmutableList.of() : attrs.attributeNames();
      for (Map.Entry<String, Object> entry : pattern.attrs.entrySet()) {
        if (attrs == null
            || !names.contains(entry.getKey())
            || !matchAttrValue(entry.getValue(), attrs.get(entry.getKey()))) {
          return false;
        }
      }
      return true;

    case FUNCTION:
      final ImmutableMap<String, Object> functionAttrs =
          ((Rx.Function) expr).attrs;
      for (Map.Entry<String, Object> entry : pattern.attrs.entrySet()) {
        if (!functionAttrs.containsKey(entry.getKey())
            || !StructuralEqual.equal(
                entry.getValue(), functionAttrs.get(entry.getKey()))) {
          return false;
        }
      }
      return true;

    default:
      return false;
    }
  }

  /**
   * Returns whether the literal in an attribute pattern equals a runtime
   * attribute value.
   *
   * <p>Integers and booleans are compared with {@link Prim.IntImm}, floating
   * point numbers with {@link Prim.FloatImm}, and strings and data types with
   * {@link Prim.StringImm} or {@link String}. IR objects, types, attributes,
   * lists and maps are compared structurally.
   *
   * @throws AssertionError if the runtime value is of a kind that attributes
   *     cannot hold, or a data type is compared with a literal that is not a
   *     string or a data type
   */
  static boolean matchAttrValue(Object literal, @Nullable Object value) {
    if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte) {
      return literal instanceof Prim.IntImm
          && ((Prim.IntImm) literal).value == ((Number) value).longValue();
    }
    if (value instanceof Boolean) {
      return literal instanceof Prim.IntImm
          && ((Prim.IntImm) literal).value == ((Boolean) value ? 1 : 0);
    }
    if (value instanceof Double || value instanceof Float) {
      return literal instanceof Prim.FloatImm
          && ((Prim.FloatImm) literal).value == ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      return stringMatches(literal, (String) value);
    }
    if (value instanceof DataType) {
      if (literal instanceof DataType) {
        return literal.equals(value);
      }
      if (literal instanceof Prim.StringImm || literal instanceof String) {
        return stringMatches(literal, value.toString());
      }
      throw new AssertionError("unsupported data type literal " + literal);
    }
    if (value instanceof IrNode
        || value instanceof Type
        || value instanceof Attrs
        || value instanceof List
        || value instanceof Map) {
      return StructuralEqual.equal(literal, value);
    }
    throw new AssertionError(
        "unsupported attribute value "
            + value
            + (value == null ? "" : " of " + value.getClass()));
  }

  private static boolean stringMatches(Object literal, String s) {
    if (literal instanceof Prim.StringImm) {
      return ((Prim.StringImm) literal).value.equals(s);
    }
    return literal instanceof String && literal.equals(s);
  }

  private boolean matchType(Dfp.TypePat pattern, Rx.Expr expr) {
    final @Nullable Type type = typeInferrer.inferType(expr);
    return type != null
        && StructuralEqual.equal(pattern.type, type)
        && visit(pattern.pattern, expr);
  }

  private boolean matchShape(Dfp.ShapePat pattern, Rx.Expr expr) {
    final Rx.@Nullable Expr shape = typeInferrer.inferShape(expr);
    return shape instanceof Rx.ShapeExpr
        && analyzer.shapesEqual(pattern.dims, ((Rx.ShapeExpr) shape).values)
        && visit(pattern.pattern, expr);
  }

  private boolean matchDataType(Dfp.DataTypePat pattern, Rx.Expr expr) {
    final @Nullable Type type = typeInferrer.inferType(expr);
    return type instanceof TensorType
        && pattern.dtype.equals(((TensorType) type).dtype)
        && visit(pattern.pattern, expr);
  }

  private boolean matchDominator(Dfp.DominatorPat pattern, Rx.Expr expr) {
    if (!visit(pattern.child, expr)) {
      return false;
    }
    final boolean matchesPath = matchesPath(pattern, expr);
    memoize = initialMemoize;
    return matchesPath && dominatesParent(pattern, expr);
  }

  /**
   * Returns whether every input path from {@code expr} reaches the parent,
   * passing only through nodes that match the path pattern. The callee of a
   * call is not an input path.
   */
  private boolean matchesPath(Dfp.DominatorPat pattern, Rx.Expr expr) {
    final Rx.@Nullable Expr callee =
        expr instanceof Rx.Call ? ((Rx.Call) expr).fn : null;
    for (DependencyGraph.Node input : graph().node(expr).inputs()) {
      if (input.expr == callee) {
        continue;
      }
      memoize = initialMemoize;
      if (visit(pattern.parent, input.expr)) {
        return true;
      }
      memoize = false;
      if (!visit(pattern.path, input.expr)
          || !matchesPath(pattern, input.expr)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether a node that {@code expr} dominates matches the parent
   * pattern.
   */
  private boolean dominatesParent(Dfp.DominatorPat pattern, Rx.Expr expr) {
    final DependencyGraph graph = graph();
    final Deque<Rx.Expr> stack = new ArrayDeque<>();
    final Set<Rx.Expr> visited = Sets.newIdentityHashSet();
    stack.push(expr);
    while (!stack.isEmpty()) {
      final Rx.Expr current = stack.pop();
      for (DependencyGraph.Node child
          : graph.node(current).dominatorChildren()) {
        if (visited.add(child.expr)) {
          if (visit(pattern.parent, child.expr)) {
            return true;
          }
          stack.push(child.expr);
        }
      }
    }
    return false;
  }

  /** Builder for {@link PatternMatcher}. */
  public static class Builder {
    private TypeInferrer typeInferrer = TypeInferrers.annotated();
    private SymbolicAnalyzer analyzer = CanonicalAnalyzer.create();
    private OperatorTable operatorTable = OperatorTable.standard();
    private @Nullable Map<Rx.Var, Rx.Expr> varToValue;
    private Rx.@Nullable Expr graphRoot;
    private MatchTracer tracer = MatchTracers.nullTracer();
    private final Map<Prop, Object> props = new EnumMap<>(Prop.class);

    private Builder() {}

    /** Sets the type inferrer; default {@link TypeInferrers#annotated()}. */
    public Builder withTypeInferrer(TypeInferrer typeInferrer) {
      this.typeInferrer = requireNonNull(typeInferrer);
      return this;
    }

    /** Sets the symbolic analyzer; default a new {@link CanonicalAnalyzer}. */
    public Builder withAnalyzer(SymbolicAnalyzer analyzer) {
      this.analyzer = requireNonNull(analyzer);
      return this;
    }

    /**
     * Sets the operator table that attribute patterns read; default {@link
     * OperatorTable#standard()}.
     */
    public Builder withOperatorTable(OperatorTable operatorTable) {
      this.operatorTable = requireNonNull(operatorTable);
      return this;
    }

    /**
     * Sets the values of variables, and enables {@link Prop#AUTO_JUMP
     * auto-jump}.
     */
    public Builder withVarToValue(
        Map<? extends Rx.Var, ? extends Rx.Expr> varToValue) {
      this.varToValue = ImmutableMap.copyOf(varToValue);
      Prop.AUTO_JUMP.set(props, true);
      return this;
    }

    /**
     * Sets the root of the dependency graph that dominator patterns use;
     * default is the expression being matched.
     */
    public Builder withGraphRoot(Rx.Expr graphRoot) {
      this.graphRoot = requireNonNull(graphRoot);
      return this;
    }

    /** Sets the tracer; default {@link MatchTracers#nullTracer()}. */
    public Builder withTracer(MatchTracer tracer) {
      this.tracer = requireNonNull(tracer);
      return this;
    }

    /** Sets a property. */
    public Builder set(Prop prop, @Nullable Object value) {
      prop.set(props, value);
      return this;
    }

    /**
     * Sets a property by name, converting a string value to the property's
     * type.
     */
    public Builder set(String propName, @Nullable Object value) {
      Prop.lookup(propName).setLenient(props, value);
      return this;
    }

    /**
     * Creates a matcher.
     *
     * @throws IllegalStateException if auto-jump is enabled but there is no
     *     map from variables to values
     */
    public PatternMatcher build() {
      checkState(
          !Prop.AUTO_JUMP.booleanValue(props) || varToValue != null,
          "auto-jump requires a map from variables to values");
      return new PatternMatcher(this);
    }
  }
}

// End PatternMatcher.java
