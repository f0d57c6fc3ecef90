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

/**
 * Symbolic integer expressions, used for shape dimensions and for literal
 * attribute values in patterns.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public class Prim {
  private Prim() {}

  /** Base class of symbolic expressions. */
  public abstract static class Expr extends IrNode {
    Expr(Op op) {
      super(op);
    }
  }

  /** Integer literal. */
  public static class IntImm extends Expr {
    public final long value;

    IntImm(long value) {
      super(Op.INT_IMM);
      this.value = value;
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(Long.toString(value));
    }
  }

  /** Floating-point literal. */
  public static class FloatImm extends Expr {
    public final double value;

    FloatImm(double value) {
      super(Op.FLOAT_IMM);
      this.value = value;
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(Double.toString(value));
    }
  }

  /** String literal. */
  public static class StringImm extends Expr {
    public final String value;

    StringImm(String value) {
      super(Op.STRING_IMM);
      this.value = requireNonNull(value);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.appendValue(value);
    }
  }

  /**
   * Symbolic variable, such as the batch size "n".
   *
   * <p>Two variables with the same name are different variables unless they
   * are the same object.
   */
  public static class Var extends Expr {
    public final String name;

    Var(String name) {
      super(Op.PRIM_VAR);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Arithmetic on two symbolic expressions. */
  public static class Binary extends Expr {
    public final Expr a0;
    public final Expr a1;

    Binary(Op op, Expr a0, Expr a1) {
      super(op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(
          op == Op.PLUS
              || op == Op.MINUS
              || op == Op.TIMES
              || op == Op.FLOOR_DIV
              || op == Op.FLOOR_MOD,
          "not a binary op: %s",
          op);
    }

    @Override
    protected IrWriter unparse(IrWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }
}

// End Prim.java
