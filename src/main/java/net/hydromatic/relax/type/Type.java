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

import net.hydromatic.relax.ir.Op;

/**
 * Type of an expression, as computed by type inference.
 *
 * <p>Types are values: two types are equal if they have the same structure,
 * which is what a type pattern checks.
 */
public interface Type {
  /** Type operator. */
  Op op();

  /**
   * Returns the {@code i}th component type. Throws for types except {@link
   * TupleType} and {@link FuncType}.
   */
  default Type arg(int i) {
    throw new UnsupportedOperationException();
  }

  /** Writes a description of this type to a string builder. */
  StringBuilder describe(StringBuilder buf);
}

// End Type.java
