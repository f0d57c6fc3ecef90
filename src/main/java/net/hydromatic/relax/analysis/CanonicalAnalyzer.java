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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Maps;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.relax.ir.Op;
import net.hydromatic.relax.ir.Prim;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbolic analyzer that converts each side to a canonical polynomial.
 *
 * <p>A polynomial is a sum of monomials, each an integer coefficient times a
 * product of atoms. An atom is a symbolic variable that has no bound value,
 * or a floor-division or floor-modulo whose operands are not both constant.
 * Two expressions are provably equal if their difference is the zero
 * polynomial.
 *
 * <p>For example, {@code n * 2 + m} and {@code m + n + n} are equal, but
 * {@code (n * 2) // 2} and {@code n} are not, because the division is
 * opaque.
 */
public class CanonicalAnalyzer implements SymbolicAnalyzer {
  private final Map<Prim.Var, Prim.Expr> bindings = Maps.newIdentityHashMap();

  private CanonicalAnalyzer() {}

  /** Creates an analyzer with no bound variables. */
  public static CanonicalAnalyzer create() {
    return new CanonicalAnalyzer();
  }

  @Override
  public boolean canProveEqual(Prim.Expr a, Prim.Expr b) {
    final @Nullable Poly difference = difference(a, b);
    if (difference == null) {
      return StructuralEqual.equal(a, b);
    }
    return difference.isZero();
  }

  /**
   * Returns the polynomial {@code a - b}, or null if either side is not an
   * integer expression or a coefficient does not fit in a {@code long}.
   */
  private @Nullable Poly difference(Prim.Expr a, Prim.Expr b) {
    try {
      final @Nullable Poly pa = canonicalize(a);
      final @Nullable Poly pb = canonicalize(b);
      if (pa == null || pb == null) {
        return null;
      }
      return pa.plus(pb.times(Poly.constant(-1)));
    } catch (ArithmeticException e) {
      // Overflow; wrapped coefficients would prove false equalities
      return null;
    }
  }

  @Override
  public void bind(Prim.Var var, Prim.Expr value) {
    checkArgument(!references(value, var), "cyclic binding of %s", var);
    bindings.put(var, value);
  }

  @Override
  public Prim.@Nullable Expr boundValue(Prim.Var var) {
    return bindings.get(var);
  }

  /** Returns whether {@code e} references {@code var}, after substitution. */
  private boolean references(Prim.Expr e, Prim.Var var) {
    switch (e.op) {
    case PRIM_VAR:
      if (e == var) {
        return true;
      }
      final Prim.@Nullable Expr value = bindings.get((Prim.Var) e);
      return value != null && references(value, var);

    case PLUS:
    case MINUS:
    case TIMES:
    case FLOOR_DIV:
    case FLOOR_MOD:
      final Prim.Binary binary = (Prim.Binary) e;
      return references(binary.a0, var) || references(binary.a1, var);

    default:
      return false;
    }
  }

  /**
   * Converts an expression to a polynomial, or returns null if it is not an
   * integer expression.
   *
   * @throws ArithmeticException if a coefficient overflows
   */
  @Nullable Poly canonicalize(Prim.Expr e) {
    switch (e.op) {
    case INT_IMM:
      return Poly.constant(((Prim.IntImm) e).value);

    case FLOAT_IMM:
    case STRING_IMM:
      return null;

    case PRIM_VAR:
      final Prim.@Nullable Expr value = bindings.get((Prim.Var) e);
      return value != null ? canonicalize(value) : Poly.atom(e);

    case PLUS:
    case MINUS:
    case TIMES:
    case FLOOR_DIV:
    case FLOOR_MOD:
      final Prim.Binary binary = (Prim.Binary) e;
      final @Nullable Poly p0 = canonicalize(binary.a0);
      final @Nullable Poly p1 = canonicalize(binary.a1);
      if (p0 == null || p1 == null) {
        return null;
      }
      switch (e.op) {
      case PLUS:
        return p0.plus(p1);
      case MINUS:
        return p0.plus(p1.times(Poly.constant(-1)));
      case TIMES:
        return p0.times(p1);
      default:
        if (p0.isConstant() && p1.isConstant() && p1.constantValue() != 0) {
          final long c0 = p0.constantValue();
          final long c1 = p1.constantValue();
          if (e.op == Op.FLOOR_MOD) {
            return Poly.constant(Math.floorMod(c0, c1));
          }
          // Math.floorDiv(Long.MIN_VALUE, -1) wraps
          return Poly.constant(
              c1 == -1 ? Math.negateExact(c0) : Math.floorDiv(c0, c1));
        }
        return Poly.atom(new Opaque(e.op, p0, p1));
      }

    default:
      throw new AssertionError("unknown expression " + e.op + ": " + e);
    }
  }

  /**
   * Polynomial with integer coefficients. Immutable.
   *
   * <p>Arithmetic throws {@link ArithmeticException} on overflow.
   */
  static final class Poly {
    private static final ImmutableMultiset<Object> UNIT =
        ImmutableMultiset.of();

    /** Maps each monomial to its coefficient; never contains zero. */
    final ImmutableMap<ImmutableMultiset<Object>, Long> terms;

    private Poly(ImmutableMap<ImmutableMultiset<Object>, Long> terms) {
      this.terms = requireNonNull(terms);
    }

    static Poly constant(long value) {
      return value == 0
          ? new Poly(ImmutableMap.of())
          : new Poly(ImmutableMap.of(UNIT, value));
    }

    static Poly atom(Object atom) {
      return new Poly(ImmutableMap.of(ImmutableMultiset.of(atom), 1L));
    }

    boolean isZero() {
      return terms.isEmpty();
    }

    boolean isConstant() {
      return terms.isEmpty() || terms.size() == 1 && terms.containsKey(UNIT);
    }

    long constantValue() {
      return terms.getOrDefault(UNIT, 0L);
    }

    Poly plus(Poly other) {
      final Map<ImmutableMultiset<Object>, Long> sum =
          new LinkedHashMap<>(terms);
      other.terms.forEach((monomial, c) ->
          sum.merge(monomial, c, Math::addExact));
      return of(sum);
    }

    Poly times(Poly other) {
      final Map<ImmutableMultiset<Object>, Long> product =
          new LinkedHashMap<>();
      terms.forEach((m0, c0) ->
          other.terms.forEach((m1, c1) -> {
            final ImmutableMultiset<Object> monomial =
                ImmutableMultiset.<Object>builder()
                    .addAll(m0)
                    .addAll(m1)
                    .build();
            product.merge(monomial, Math.multiplyExact(c0, c1),
                Math::addExact);
          }));
      return of(product);
    }

    private static Poly of(Map<ImmutableMultiset<Object>, Long> terms) {
      terms.values().removeIf(c -> c == 0L);
      return new Poly(ImmutableMap.copyOf(terms));
    }

    @Override
    public int hashCode() {
      return terms.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Poly && terms.equals(((Poly) o).terms);
    }

    @Override
    public String toString() {
      return terms.toString();
    }
  }

  /** Floor-division or floor-modulo that cannot be folded. */
  private static final class Opaque {
    final Op op;
    final Poly p0;
    final Poly p1;

    Opaque(Op op, Poly p0, Poly p1) {
      this.op = op;
      this.p0 = p0;
      this.p1 = p1;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, p0, p1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Opaque
              && op == ((Opaque) o).op
              && p0.equals(((Opaque) o).p0)
              && p1.equals(((Opaque) o).p1);
    }

    @Override
    public String toString() {
      return "(" + p0 + op.padded + p1 + ")";
    }
  }
}

// End CanonicalAnalyzer.java
