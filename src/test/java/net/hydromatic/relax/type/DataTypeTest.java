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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link DataType} and the other types. */
public class DataTypeTest {
  /** Parses data type names and prints them back. */
  @Test void testParse() {
    checkRoundTrip("float32", DataType.Code.FLOAT, 32, 1);
    checkRoundTrip("float16", DataType.Code.FLOAT, 16, 1);
    checkRoundTrip("int64", DataType.Code.INT, 64, 1);
    checkRoundTrip("uint8", DataType.Code.UINT, 8, 1);
    checkRoundTrip("bfloat16", DataType.Code.BFLOAT, 16, 1);
    checkRoundTrip("float16x4", DataType.Code.FLOAT, 16, 4);
    checkRoundTrip("int8x16", DataType.Code.INT, 8, 16);
    checkRoundTrip("bool", DataType.Code.UINT, 1, 1);
    checkRoundTrip("handle", DataType.Code.HANDLE, 64, 1);

    assertThat(DataType.parse("float32"), is(DataType.FLOAT32));
    assertThat(DataType.parse("int32"), is(DataType.INT32));
    assertThat(DataType.parse("bool"), is(DataType.BOOL));
  }

  private static void checkRoundTrip(String name, DataType.Code code,
      int bits, int lanes) {
    final DataType dataType = DataType.parse(name);
    assertThat(dataType.code, is(code));
    assertThat(dataType.bits, is(bits));
    assertThat(dataType.lanes, is(lanes));
    assertThat(dataType, hasToString(name));
    assertThat(DataType.of(code, bits, lanes), is(dataType));
  }

  @Test void testParseInvalid() {
    assertThrows(IllegalArgumentException.class,
        () -> DataType.parse("float"));
    assertThrows(IllegalArgumentException.class,
        () -> DataType.parse("foo"));
    assertThrows(IllegalArgumentException.class,
        () -> DataType.parse("int32x"));
    assertThrows(IllegalArgumentException.class,
        () -> DataType.parse("int0"));
  }

  @Test void testTypeToString() {
    final TensorType matrix = TensorType.of(2, "float32");
    assertThat(matrix, hasToString("Tensor(ndim=2, dtype=float32)"));
    assertThat(TensorType.of(TensorType.UNKNOWN_NDIM, (DataType) null),
        hasToString("Tensor(ndim=-1)"));
    assertThat(TupleType.of(matrix, PrimitiveType.SHAPE),
        hasToString("Tuple(Tensor(ndim=2, dtype=float32), Shape)"));
    assertThat(FuncType.of(TupleType.of(matrix).fieldTypes, matrix),
        hasToString("(Tensor(ndim=2, dtype=float32)) -> "
            + "Tensor(ndim=2, dtype=float32)"));
  }

  /** Types are values; two types with the same structure are equal. */
  @Test void testTypeEquals() {
    assertThat(TensorType.of(2, "float32").equals(TensorType.of(2, "float32")),
        is(true));
    assertThat(TensorType.of(2, "float32").equals(TensorType.of(2, "int32")),
        is(false));
    assertThat(TensorType.of(2, "float32").equals(TensorType.of(3, "float32")),
        is(false));
    assertThat(TupleType.of(PrimitiveType.SHAPE)
            .equals(TupleType.of(PrimitiveType.SHAPE)),
        is(true));
    assertThat(TupleType.of(PrimitiveType.SHAPE)
            .equals(TupleType.of(PrimitiveType.OBJECT)),
        is(false));
  }
}

// End DataTypeTest.java
