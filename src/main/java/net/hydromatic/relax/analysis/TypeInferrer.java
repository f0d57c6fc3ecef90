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

import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes the type and shape of an expression.
 *
 * @see TypeInferrers
 */
public interface TypeInferrer {
  /** Returns the type of an expression, or null if it is not known. */
  @Nullable Type inferType(Rx.Expr expr);

  /**
   * Returns the shape of an expression, or null if it is not known.
   *
   * <p>If not null, the result is a {@link Rx.ShapeExpr} or a {@link
   * Rx.RuntimeDepShape}.
   */
  Rx.@Nullable Expr inferShape(Rx.Expr expr);
}

// End TypeInferrer.java
