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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.relax.ir.Op;

/** The type of a function value. */
public class FuncType implements Type {
  public final List<Type> paramTypes;
  public final Type resultType;

  FuncType(List<? extends Type> paramTypes, Type resultType) {
    this.paramTypes = ImmutableList.copyOf(paramTypes);
    this.resultType = requireNonNull(resultType);
  }

  /** Creates a function type. */
  public static FuncType of(List<? extends Type> paramTypes, Type resultType) {
    return new FuncType(paramTypes, resultType);
  }

  @Override
  public Op op() {
    return Op.FUNCTION_TYPE;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The parameter types are numbered from 0; the result type follows
   * them.
   */
  @Override
  public Type arg(int i) {
    return i == paramTypes.size() ? resultType : paramTypes.get(i);
  }

  @Override
  public int hashCode() {
    return Objects.hash(paramTypes, resultType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FuncType
            && ((FuncType) o).paramTypes.equals(paramTypes)
            && ((FuncType) o).resultType.equals(resultType);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    for (int i = 0; i < paramTypes.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      paramTypes.get(i).describe(buf);
    }
    buf.append(')').append(Op.FUNCTION_TYPE.padded);
    return resultType.describe(buf);
  }
}

// End FuncType.java
