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
package net.hydromatic.relax.type;

import java.util.Locale;
import net.hydromatic.relax.ir.Op;

/** Type that has no components. */
public enum PrimitiveType implements Type {
  /** Type of a {@link net.hydromatic.relax.ir.Rx.ShapeExpr}. */
  SHAPE(Op.SHAPE_TYPE),
  /** Type of a value about which nothing is known. */
  OBJECT(Op.OBJECT_TYPE);

  private final Op op;

  /** The name in the IR, e.g. {@code Shape}. */
  public final String moniker;

  PrimitiveType(Op op) {
    this.op = op;
    final String lower = name().toLowerCase(Locale.ROOT);
    this.moniker = Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(moniker);
  }
}

// End PrimitiveType.java
