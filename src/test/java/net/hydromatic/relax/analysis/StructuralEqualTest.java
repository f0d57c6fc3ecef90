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

import net.hydromatic.relax.ir.Attrs;
import net.hydromatic.relax.ir.Prim;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.type.DataType;
import net.hydromatic.relax.type.TensorType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static net.hydromatic.relax.ir.RxBuilder.rx;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

/** Tests {@link StructuralEqual}. */
public class StructuralEqualTest {
  /** Two expressions built separately are equal if they have the same
   * structure and the same free variables. */
  @Test void testExpr() {
    final Rx.Var x = rx.var("x");
    final Rx.Var y = rx.var("y");
    final Rx.Call e0 = rx.call("add", x, rx.constant(1.0));
    final Rx.Call e1 = rx.call("add", x, rx.constant(1.0));
    assertThat(e0 == e1, is(false));
    assertThat(StructuralEqual.equal(e0, e1), is(true));
    assertThat(StructuralEqual.equal(e0, rx.call("add", y, rx.constant(1.0))),
        is(false));
    assertThat(StructuralEqual.equal(e0, rx.call("add", x, rx.constant(2.0))),
        is(false));
    assertThat(
        StructuralEqual.equal(e0, rx.call("multiply", x, rx.constant(1.0))),
        is(false));
    // argument order matters
    assertThat(StructuralEqual.equal(rx.call("add", x, y),
        rx.call("add", y, x)), is(false));

    // variables with the same name are different variables
    assertThat(StructuralEqual.equal(x, rx.var("x")), is(false));
    assertThat(StructuralEqual.equal(rx.globalVar("main"),
        rx.globalVar("main")), is(true));
    assertThat(StructuralEqual.equal(rx.tupleGetItem(rx.tuple(x, y), 1),
        rx.tupleGetItem(rx.tuple(x, y), 1)), is(true));
    assertThat(StructuralEqual.equal(rx.tupleGetItem(rx.tuple(x, y), 1),
        rx.tupleGetItem(rx.tuple(x, y), 0)), is(false));
    assertThat(StructuralEqual.equal(rx.shape(3, 4), rx.shape(3, 4)),
        is(true));
  }

  @Test void testConstant() {
    final Rx.Constant c0 =
        rx.constant(DataType.INT32, ImmutableList.of(2L),
            ImmutableList.of(1, 2));
    final Rx.Constant c1 =
        rx.constant(DataType.INT32, ImmutableList.of(2L),
            ImmutableList.of(1L, 2L));
    final Rx.Constant c2 =
        rx.constant(DataType.INT64, ImmutableList.of(2L),
            ImmutableList.of(1, 2));
    final Rx.Constant c3 =
        rx.constant(DataType.INT32, ImmutableList.of(1L, 2L),
            ImmutableList.of(1, 2));
    assertThat(StructuralEqual.equal(c0, c1), is(true));
    assertThat(StructuralEqual.equal(c0, c2), is(false));
    assertThat(StructuralEqual.equal(c0, c3), is(false));
  }

  /** Functions that differ only in the names of their parameters are
   * equal. */
  @Test void testFunction() {
    final Rx.Var x = rx.var("x");
    final Rx.Var y = rx.var("y");
    final Rx.Var z = rx.var("z");
    final Rx.Function f0 =
        rx.function(ImmutableList.of(x), rx.call("exp", x));
    final Rx.Function f1 =
        rx.function(ImmutableList.of(y), rx.call("exp", y));
    final Rx.Function f2 =
        rx.function(ImmutableList.of(y), rx.call("exp", z));
    final Rx.Function f3 =
        rx.function(ImmutableList.of(x, y), rx.call("exp", x));
    assertThat(StructuralEqual.equal(f0, f1), is(true));
    assertThat(StructuralEqual.equal(f0, f2), is(false));
    assertThat(StructuralEqual.equal(f0, f3), is(false));

    final Rx.Function f4 =
        rx.function(ImmutableList.of(x), x, null,
            ImmutableMap.of("global_symbol", "main"));
    final Rx.Function f5 =
        rx.function(ImmutableList.of(y), y, null,
            ImmutableMap.of("global_symbol", "main"));
    final Rx.Function f6 =
        rx.function(ImmutableList.of(y), y, null,
            ImmutableMap.of("global_symbol", "other"));
    assertThat(StructuralEqual.equal(f4, f5), is(true));
    assertThat(StructuralEqual.equal(f4, f6), is(false));
  }

  /** A free variable never equals a parameter, on either side. */
  @Test void testFunctionFreeVariable() {
    final Rx.Var x = rx.var("x");
    final Rx.Var y = rx.var("y");
    // fn (x) { y } returns its free variable; fn (y) { y } is the identity
    final Rx.Function constant = rx.function(ImmutableList.of(x), y);
    final Rx.Function identity = rx.function(ImmutableList.of(y), y);
    assertThat(StructuralEqual.equal(constant, identity), is(false));
    assertThat(StructuralEqual.equal(identity, constant), is(false));
    assertThat(StructuralEqual.equal(constant, constant), is(true));
    assertThat(
        StructuralEqual.equal(constant, rx.function(ImmutableList.of(x), y)),
        is(true));

    // Parameters of one function are free outside it
    final Rx.Tuple t0 =
        rx.tuple(rx.function(ImmutableList.of(x), x), x);
    final Rx.Tuple t1 =
        rx.tuple(rx.function(ImmutableList.of(y), y), y);
    assertThat(StructuralEqual.equal(t0, t1), is(false));
    final Rx.Tuple t2 =
        rx.tuple(rx.function(ImmutableList.of(y), y), x);
    assertThat(StructuralEqual.equal(t0, t2), is(true));

    // Nested functions pair their own parameters
    final Rx.Var z = rx.var("z");
    final Rx.Function nested0 =
        rx.function(ImmutableList.of(x),
            rx.function(ImmutableList.of(y), rx.tuple(x, y)));
    final Rx.Function nested1 =
        rx.function(ImmutableList.of(y),
            rx.function(ImmutableList.of(z), rx.tuple(y, z)));
    final Rx.Function nested2 =
        rx.function(ImmutableList.of(y),
            rx.function(ImmutableList.of(z), rx.tuple(z, y)));
    assertThat(StructuralEqual.equal(nested0, nested1), is(true));
    assertThat(StructuralEqual.equal(nested0, nested2), is(false));
  }

  @Test void testPrim() {
    final Prim.Var n = rx.primVar("n");
    assertThat(StructuralEqual.equal(rx.plus(n, rx.intImm(1)),
        rx.plus(n, rx.intImm(1))), is(true));
    assertThat(StructuralEqual.equal(rx.plus(n, rx.intImm(1)),
        rx.plus(rx.intImm(1), n)), is(false));
    assertThat(StructuralEqual.equal(n, rx.primVar("n")), is(false));
    assertThat(StructuralEqual.equal(rx.stringImm("a"), rx.stringImm("a")),
        is(true));
    assertThat(StructuralEqual.equal(rx.floatImm(1.5), rx.floatImm(1.5)),
        is(true));
    assertThat(StructuralEqual.equal(rx.intImm(1), rx.floatImm(1)),
        is(false));
  }

  @Test void testValues() {
    assertThat(StructuralEqual.equal(null, null), is(true));
    assertThat(StructuralEqual.equal(null, 1), is(false));
    assertThat(StructuralEqual.equal(1, 1L), is(true));
    assertThat(StructuralEqual.equal(1, 1.0), is(true));
    assertThat(StructuralEqual.equal("NCHW", "NCHW"), is(true));
    assertThat(StructuralEqual.equal(rx.intImms(1, 2), rx.intImms(1, 2)),
        is(true));
    assertThat(StructuralEqual.equal(rx.intImms(1, 2), rx.intImms(1, 2, 3)),
        is(false));
    assertThat(StructuralEqual.equal(ImmutableMap.of("a", rx.intImm(1)),
        ImmutableMap.of("a", rx.intImm(1))), is(true));
    assertThat(StructuralEqual.equal(ImmutableMap.of("a", rx.intImm(1)),
        ImmutableMap.of("b", rx.intImm(1))), is(false));
    assertThat(StructuralEqual.equal(TensorType.of(2, "float32"),
        TensorType.of(2, "float32")), is(true));
    assertThat(StructuralEqual.equal(DataType.FLOAT32,
        DataType.parse("float32")), is(true));

    final Attrs a0 =
        Attrs.of("relax.attrs.Conv2DAttrs",
            ImmutableMap.of("strides", rx.intImms(1, 1)));
    final Attrs a1 =
        Attrs.of("relax.attrs.Conv2DAttrs",
            ImmutableMap.of("strides", rx.intImms(1, 1)));
    final Attrs a2 =
        Attrs.of("relax.attrs.PoolAttrs",
            ImmutableMap.of("strides", rx.intImms(1, 1)));
    assertThat(StructuralEqual.equal(a0, a1), is(true));
    assertThat(StructuralEqual.equal(a0, a2), is(false));
  }
}

// End StructuralEqualTest.java
