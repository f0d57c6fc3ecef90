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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import net.hydromatic.relax.ir.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type of a tensor whose rank and element type may be known.
 *
 * <p>The shape itself is not part of the type; it is carried by the
 * expression's shape annotation.
 */
public class TensorType implements Type {
  /** Value of {@link #ndim} when the rank is not known. */
  public static final int UNKNOWN_NDIM = -1;

  public final int ndim;
  public final @Nullable DataType dtype;

  TensorType(int ndim, @Nullable DataType dtype) {
    checkArgument(ndim >= UNKNOWN_NDIM, "invalid ndim %s", ndim);
    this.ndim = ndim;
    this.dtype = dtype;
  }

  /** Creates a tensor type. */
  public static TensorType of(int ndim, @Nullable DataType dtype) {
    return new TensorType(ndim, dtype);
  }

  /** Creates a tensor type with a given rank and dtype name. */
  public static TensorType of(int ndim, String dtype) {
    return new TensorType(ndim, DataType.parse(dtype));
  }

  @Override
  public Op op() {
    return Op.TENSOR_TYPE;
  }

  @Override
  public int hashCode() {
    return Objects.hash(ndim, dtype);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TensorType
            && ((TensorType) o).ndim == ndim
            && Objects.equals(((TensorType) o).dtype, dtype);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("Tensor(ndim=").append(ndim);
    if (dtype != null) {
      buf.append(", dtype=").append(dtype);
    }
    return buf.append(")");
  }
}

// End TensorType.java
