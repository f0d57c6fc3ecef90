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

import java.util.List;
import net.hydromatic.relax.ir.Prim;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides equality of symbolic integer expressions, such as the dimensions
 * of a shape.
 *
 * <p>An analyzer may know the value of some symbolic variables; see {@link
 * #bind}.
 */
public interface SymbolicAnalyzer {
  /**
   * Returns whether {@code a} and {@code b} are equal for every value of
   * their free variables. A result of false means "could not prove", not
   * "proved different".
   */
  boolean canProveEqual(Prim.Expr a, Prim.Expr b);

  /** Returns whether two shapes are provably equal, dimension by dimension. */
  default boolean shapesEqual(
      List<? extends Prim.Expr> a, List<? extends Prim.Expr> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!canProveEqual(a.get(i), b.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Records that {@code var} has value {@code value}. */
  void bind(Prim.Var var, Prim.Expr value);

  /** Returns the value bound to {@code var}, or null. */
  Prim.@Nullable Expr boundValue(Prim.Var var);
}

// End SymbolicAnalyzer.java
