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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.relax.ir.Op;

/** The type of a tuple value. */
public class TupleType implements Type {
  public final List<Type> fieldTypes;

  TupleType(List<? extends Type> fieldTypes) {
    this.fieldTypes = ImmutableList.copyOf(fieldTypes);
  }

  /** Creates a tuple type. */
  public static TupleType of(List<? extends Type> fieldTypes) {
    return new TupleType(fieldTypes);
  }

  /** Creates a tuple type. */
  public static TupleType of(Type... fieldTypes) {
    return new TupleType(ImmutableList.copyOf(fieldTypes));
  }

  @Override
  public Op op() {
    return Op.TUPLE_TYPE;
  }

  @Override
  public Type arg(int i) {
    return fieldTypes.get(i);
  }

  @Override
  public int hashCode() {
    return fieldTypes.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleType
            && ((TupleType) o).fieldTypes.equals(fieldTypes);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("Tuple(");
    for (int i = 0; i < fieldTypes.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      fieldTypes.get(i).describe(buf);
    }
    return buf.append(")");
  }
}

// End TupleType.java
