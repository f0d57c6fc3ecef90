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
import static java.util.Objects.requireNonNull;

import com.google.common.primitives.Ints;
import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Element type of a tensor, such as {@code float32}, {@code int64}, {@code
 * bool} or the vector type {@code float16x4}.
 */
public final class DataType {
  public static final DataType BOOL = new DataType(Code.UINT, 1, 1);
  public static final DataType INT32 = new DataType(Code.INT, 32, 1);
  public static final DataType INT64 = new DataType(Code.INT, 64, 1);
  public static final DataType FLOAT16 = new DataType(Code.FLOAT, 16, 1);
  public static final DataType FLOAT32 = new DataType(Code.FLOAT, 32, 1);
  public static final DataType FLOAT64 = new DataType(Code.FLOAT, 64, 1);

  public final Code code;
  public final int bits;
  public final int lanes;

  private DataType(Code code, int bits, int lanes) {
    this.code = requireNonNull(code);
    this.bits = bits;
    this.lanes = lanes;
    checkArgument(bits > 0, "bits must be positive: %s", bits);
    checkArgument(lanes > 0, "lanes must be positive: %s", lanes);
  }

  /** Creates a data type. */
  public static DataType of(Code code, int bits, int lanes) {
    return new DataType(code, bits, lanes);
  }

  /**
   * Parses a data type name such as "float32" or "int8x16".
   *
   * @throws IllegalArgumentException if the name is not valid
   */
  public static DataType parse(String name) {
    if (name.equals("bool")) {
      return BOOL;
    }
    if (name.equals("handle")) {
      return new DataType(Code.HANDLE, 64, 1);
    }
    for (Code code : Code.PARSE_ORDER) {
      if (name.startsWith(code.prefix)) {
        final String rest = name.substring(code.prefix.length());
        final int x = rest.indexOf('x');
        final @Nullable Integer bits =
            Ints.tryParse(x < 0 ? rest : rest.substring(0, x));
        final @Nullable Integer lanes =
            x < 0 ? Integer.valueOf(1) : Ints.tryParse(rest.substring(x + 1));
        checkArgument(
            bits != null && lanes != null, "invalid data type '%s'", name);
        return new DataType(code, bits, lanes);
      }
    }
    throw new IllegalArgumentException("invalid data type '" + name + "'");
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, bits, lanes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DataType
            && ((DataType) o).code == code
            && ((DataType) o).bits == bits
            && ((DataType) o).lanes == lanes;
  }

  @Override
  public String toString() {
    if (code == Code.UINT && bits == 1 && lanes == 1) {
      return "bool";
    }
    if (code == Code.HANDLE) {
      return "handle";
    }
    return code.prefix + bits + (lanes == 1 ? "" : "x" + lanes);
  }

  /** Type code of a {@link DataType}. */
  public enum Code {
    INT,
    UINT,
    FLOAT,
    BFLOAT,
    HANDLE;

    /** Order in which prefixes are tried; "uint" before "int". */
    static final Code[] PARSE_ORDER = {UINT, INT, BFLOAT, FLOAT};

    final String prefix = name().toLowerCase(Locale.ROOT);
  }
}

// End DataType.java
