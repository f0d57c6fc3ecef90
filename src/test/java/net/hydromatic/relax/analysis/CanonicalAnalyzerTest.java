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

import net.hydromatic.relax.ir.Prim;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static net.hydromatic.relax.ir.RxBuilder.rx;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link CanonicalAnalyzer}. */
public class CanonicalAnalyzerTest {
  private final Prim.Var n = rx.primVar("n");
  private final Prim.Var m = rx.primVar("m");

  private static Prim.Expr i(long value) {
    return rx.intImm(value);
  }

  @Test void testPolynomial() {
    final SymbolicAnalyzer analyzer = CanonicalAnalyzer.create();
    // n * 2 + m = m + n + n
    assertThat(
        analyzer.canProveEqual(rx.plus(rx.times(n, i(2)), m),
            rx.plus(rx.plus(m, n), n)),
        is(true));
    // n * (m + 1) = n * m + n
    assertThat(
        analyzer.canProveEqual(rx.times(n, rx.plus(m, i(1))),
            rx.plus(rx.times(n, m), n)),
        is(true));
    // (n + 1) * (n - 1) = n * n - 1
    assertThat(
        analyzer.canProveEqual(rx.times(rx.plus(n, i(1)), rx.minus(n, i(1))),
            rx.minus(rx.times(n, n), i(1))),
        is(true));
    // n - n = 0
    assertThat(analyzer.canProveEqual(rx.minus(n, n), i(0)), is(true));
    assertThat(analyzer.canProveEqual(n, m), is(false));
    assertThat(analyzer.canProveEqual(n, rx.primVar("n")), is(false));
    assertThat(analyzer.canProveEqual(rx.plus(n, i(1)), n), is(false));
  }

  @Test void testFloorDivMod() {
    final SymbolicAnalyzer analyzer = CanonicalAnalyzer.create();
    assertThat(analyzer.canProveEqual(rx.floorDiv(i(7), i(2)), i(3)),
        is(true));
    assertThat(analyzer.canProveEqual(rx.floorDiv(i(-7), i(2)), i(-4)),
        is(true));
    assertThat(analyzer.canProveEqual(rx.floorMod(i(-7), i(2)), i(1)),
        is(true));
    // Division by a symbolic value is opaque, but opaque terms with equal
    // operands are equal
    assertThat(
        analyzer.canProveEqual(rx.floorDiv(rx.plus(n, m), i(2)),
            rx.floorDiv(rx.plus(m, n), i(2))),
        is(true));
    assertThat(
        analyzer.canProveEqual(rx.floorDiv(n, i(2)), rx.floorMod(n, i(2))),
        is(false));
    // Not simplified, so not provably equal
    assertThat(analyzer.canProveEqual(rx.floorDiv(rx.times(n, i(2)), i(2)), n),
        is(false));
    // Division by zero is left opaque
    assertThat(analyzer.canProveEqual(rx.floorDiv(i(1), i(0)), i(0)),
        is(false));
  }

  @Test void testBind() {
    final SymbolicAnalyzer analyzer = CanonicalAnalyzer.create();
    assertThat(analyzer.canProveEqual(rx.times(n, i(2)), i(8)), is(false));
    analyzer.bind(n, i(4));
    assertThat(analyzer.canProveEqual(rx.times(n, i(2)), i(8)), is(true));
    assertThat(analyzer.boundValue(m), nullValue());

    // m is bound to an expression that mentions n
    analyzer.bind(m, rx.plus(n, i(1)));
    assertThat(analyzer.canProveEqual(m, i(5)), is(true));

    final Prim.Var k = rx.primVar("k");
    assertThrows(IllegalArgumentException.class,
        () -> analyzer.bind(k, rx.plus(k, i(1))));
  }

  @Test void testBoundValue() {
    final SymbolicAnalyzer analyzer = CanonicalAnalyzer.create();
    final Prim.Expr four = i(4);
    analyzer.bind(n, four);
    assertThat(analyzer.boundValue(n), sameInstance(four));
  }

  @Test void testShapesEqual() {
    final SymbolicAnalyzer analyzer = CanonicalAnalyzer.create();
    assertThat(
        analyzer.shapesEqual(ImmutableList.of(rx.times(n, i(2)), i(4)),
            ImmutableList.of(rx.plus(n, n), i(4))),
        is(true));
    assertThat(
        analyzer.shapesEqual(ImmutableList.of(n, i(4)),
            ImmutableList.of(n, i(5))),
        is(false));
    assertThat(
        analyzer.shapesEqual(ImmutableList.of(n), ImmutableList.of(n, i(1))),
        is(false));
    assertThat(analyzer.shapesEqual(ImmutableList.of(), ImmutableList.of()),
        is(true));
  }

  /** Tests that arithmetic that overflows a {@code long} does not wrap
   * around into a false equality. */
  @Test void testOverflow() {
    final SymbolicAnalyzer analyzer = CanonicalAnalyzer.create();
    final Prim.Expr maxPlusOne = rx.plus(i(Long.MAX_VALUE), i(1));
    assertThat(analyzer.canProveEqual(maxPlusOne, i(Long.MIN_VALUE)),
        is(false));
    // Falls back to structural comparison
    assertThat(
        analyzer.canProveEqual(maxPlusOne, rx.plus(i(Long.MAX_VALUE), i(1))),
        is(true));

    // n * 2^62 * 5 would wrap to n * 2^62
    final Prim.Expr n62 = rx.times(n, i(1L << 62));
    assertThat(analyzer.canProveEqual(n62, rx.times(n62, i(5))), is(false));
    assertThat(analyzer.canProveEqual(n62, rx.times(i(1L << 62), n)),
        is(true));

    assertThat(
        analyzer.canProveEqual(rx.floorDiv(i(Long.MIN_VALUE), i(-1)),
            i(Long.MIN_VALUE)),
        is(false));
    assertThat(
        analyzer.canProveEqual(rx.floorDiv(i(Long.MAX_VALUE), i(-1)),
            i(-Long.MAX_VALUE)),
        is(true));
    assertThat(
        analyzer.shapesEqual(ImmutableList.of(i(Long.MIN_VALUE)),
            ImmutableList.of(maxPlusOne)),
        is(false));
  }

  /** Expressions that are not integers are compared structurally. */
  @Test void testNonInteger() {
    final SymbolicAnalyzer analyzer = CanonicalAnalyzer.create();
    assertThat(analyzer.canProveEqual(rx.floatImm(1.5), rx.floatImm(1.5)),
        is(true));
    assertThat(analyzer.canProveEqual(rx.floatImm(1.5), i(1)), is(false));
    assertThat(analyzer.canProveEqual(rx.stringImm("a"), rx.stringImm("a")),
        is(true));
  }
}

// End CanonicalAnalyzerTest.java
