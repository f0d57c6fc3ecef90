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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Attributes of a {@link Rx.Call}, such as the strides of a convolution.
 *
 * <p>An attributes object has a type key (for example
 * "relax.attrs.Conv2DAttrs") and an ordered list of named fields. It is the
 * reflection surface that an attribute pattern reads: {@link
 * #attributeNames()} lists the fields, and {@link #get(String)} returns a
 * field's value.
 *
 * <p>Field values are runtime values: {@link Integer} or {@link Long} for
 * integers, {@link Float} or {@link Double} for floating-point values, {@link
 * String}, {@link net.hydromatic.relax.type.DataType}, or an IR object such as
 * a list of {@link Prim.Expr}.
 */
public final class Attrs {
  public final String typeKey;
  public final ImmutableMap<String, Object> fields;

  private Attrs(String typeKey, ImmutableMap<String, Object> fields) {
    this.typeKey = requireNonNull(typeKey);
    this.fields = requireNonNull(fields);
    checkArgument(!typeKey.isEmpty(), "empty type key");
  }

  /** Creates an attributes object. Field order is preserved. */
  public static Attrs of(String typeKey, Map<String, ?> fields) {
    return new Attrs(typeKey, ImmutableMap.copyOf(fields));
  }

  /** Returns the names of the fields, in declaration order. */
  public ImmutableList<String> attributeNames() {
    return fields.keySet().asList();
  }

  /** Returns the value of a field, or null if there is no such field. */
  public @Nullable Object get(String name) {
    return fields.get(name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeKey, fields);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Attrs
            && ((Attrs) o).typeKey.equals(typeKey)
            && ((Attrs) o).fields.equals(fields);
  }

  @Override
  public String toString() {
    return new IrWriter().append(typeKey).appendAttrs(fields).toString();
  }
}

// End Attrs.java
