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
package net.hydromatic.relax.match;

import net.hydromatic.relax.ir.Attrs;
import net.hydromatic.relax.ir.OperatorTable;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.pattern.Dfp;
import net.hydromatic.relax.type.DataType;
import net.hydromatic.relax.type.TensorType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static net.hydromatic.relax.ir.RxBuilder.rx;
import static net.hydromatic.relax.pattern.DfpBuilder.dfp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests attribute patterns, and the comparison of attribute values. */
public class AttrMatchTest {
  private final Rx.Var x = rx.var("x");
  private final Rx.Var w = rx.var("w");

  private static boolean match(Dfp.Pattern pattern, Rx.Expr expr) {
    return Matches.match(pattern, expr);
  }

  private Rx.Call conv2d(Attrs attrs) {
    return rx.call(rx.op("nn.conv2d"), ImmutableList.of(x, w), attrs);
  }

  /** Attributes of an operator come from the operator table. */
  @Test void testOperatorAttr() {
    final Dfp.Pattern broadcast =
        dfp.wildcard().hasAttr(
            ImmutableMap.of("TOpPattern", OperatorTable.BROADCAST));
    assertThat(match(broadcast, rx.op("add")), is(true));
    assertThat(match(broadcast, rx.op("exp")), is(false));
    assertThat(match(broadcast.callAny(), rx.call("add", x, w)), is(true));
    assertThat(match(broadcast.callAny(), rx.call("exp", x)), is(false));

    final Dfp.Pattern stateful =
        dfp.wildcard().hasAttr(ImmutableMap.of("TOpIsStateful", true));
    assertThat(match(stateful, rx.op("print")), is(true));
    // "add" has no value for "TOpIsStateful"
    assertThat(match(stateful, rx.op("add")), is(false));
    // no operator has a value for "TOpFoo"
    assertThat(
        match(dfp.wildcard().hasAttr(ImmutableMap.of("TOpFoo", 1)),
            rx.op("add")),
        is(false));
    // an expression that is not an operator, call or function
    assertThat(match(broadcast, x), is(false));
  }

  @Test void testOperatorTable() {
    final OperatorTable table =
        OperatorTable.builder()
            .add("add", OperatorTable.ELEM_WISE)
            .attr("add", "FInferType", "broadcast")
            .build();
    final PatternMatcher matcher =
        PatternMatcher.builder().withOperatorTable(table).build();
    final Dfp.Pattern elemWise =
        dfp.isOp("add").hasAttr(
            ImmutableMap.of("TOpPattern", OperatorTable.ELEM_WISE));
    assertThat(matcher.match(elemWise, rx.op("add")), is(true));
    assertThat(match(elemWise, rx.op("add")), is(false));
    final Dfp.Pattern inferType =
        dfp.wildcard().hasAttr(ImmutableMap.of("FInferType", "broadcast"));
    assertThat(matcher.match(inferType, rx.op("add")), is(true));
    // "multiply" is not in the table
    assertThat(matcher.match(inferType, rx.op("multiply")), is(false));
  }

  @Test void testCallAttr() {
    final Rx.Call conv =
        conv2d(
            Attrs.of("relax.attrs.Conv2DAttrs",
                ImmutableMap.of("data_layout", "NCHW",
                    "groups", 1,
                    "strides", rx.intImms(1, 1),
                    "alpha", 0.5)));
    final Dfp.Pattern convPat = dfp.isOp("nn.conv2d").callAny();
    assertThat(
        match(convPat.hasAttr(ImmutableMap.of("data_layout", "NCHW")), conv),
        is(true));
    assertThat(
        match(convPat.hasAttr(ImmutableMap.of("data_layout", "NHWC")), conv),
        is(false));
    assertThat(match(convPat.hasAttr(ImmutableMap.of("groups", 1)), conv),
        is(true));
    assertThat(match(convPat.hasAttr(ImmutableMap.of("groups", 2)), conv),
        is(false));
    assertThat(
        match(convPat.hasAttr(ImmutableMap.of("strides", rx.intImms(1, 1))),
            conv),
        is(true));
    assertThat(
        match(convPat.hasAttr(ImmutableMap.of("strides", rx.intImms(2, 2))),
            conv),
        is(false));
    assertThat(match(convPat.hasAttr(ImmutableMap.of("alpha", 0.5)), conv),
        is(true));
    assertThat(
        match(
            convPat.hasAttr(
                ImmutableMap.of("data_layout", "NCHW", "groups", 1)),
            conv),
        is(true));
    assertThat(
        match(
            convPat.hasAttr(
                ImmutableMap.of("data_layout", "NCHW", "groups", 2)),
            conv),
        is(false));
    // no such field
    assertThat(match(convPat.hasAttr(ImmutableMap.of("padding", 0)), conv),
        is(false));
    // a call without attributes
    assertThat(
        match(convPat.hasAttr(ImmutableMap.of("groups", 1)),
            rx.call("nn.conv2d", x, w)),
        is(false));
  }

  @Test void testDataTypeAttr() {
    final Rx.Call conv =
        conv2d(
            Attrs.of("relax.attrs.Conv2DAttrs",
                ImmutableMap.of("out_dtype", DataType.FLOAT32)));
    final Dfp.Pattern convPat = dfp.isOp("nn.conv2d").callAny();
    assertThat(
        match(convPat.hasAttr(ImmutableMap.of("out_dtype", "float32")), conv),
        is(true));
    assertThat(
        match(convPat.hasAttr(ImmutableMap.of("out_dtype", "int32")), conv),
        is(false));
    assertThat(
        match(convPat.hasAttr(ImmutableMap.of("out_dtype", DataType.FLOAT32)),
            conv),
        is(true));
    assertThat(
        match(
            convPat.hasAttr(
                ImmutableMap.of("out_dtype", rx.stringImm("float32"))),
            conv),
        is(true));
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> match(convPat.hasAttr(ImmutableMap.of("out_dtype", 1)),
                conv));
    assertThat(e.getMessage(), is("unsupported data type literal 1"));
  }

  @Test void testUnsupportedAttr() {
    final Rx.Call conv =
        conv2d(
            Attrs.of("relax.attrs.Conv2DAttrs",
                ImmutableMap.of("mode", 'c')));
    final Dfp.Pattern convPat = dfp.isOp("nn.conv2d").callAny();
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> match(convPat.hasAttr(ImmutableMap.of("mode", "c")), conv));
    assertThat(e.getMessage(),
        is("unsupported attribute value c of class java.lang.Character"));
  }

  /** Attributes of a function are compared structurally. */
  @Test void testFunctionAttr() {
    final Rx.Function f =
        rx.function(ImmutableList.of(x), x, TensorType.of(1, "float32"),
            ImmutableMap.of("global_symbol", "main", "Primitive", 1));
    final Dfp.Pattern fnPat = dfp.isFunction(dfp.wildcard());
    assertThat(
        match(fnPat.hasAttr(ImmutableMap.of("global_symbol", "main")), f),
        is(true));
    assertThat(
        match(fnPat.hasAttr(ImmutableMap.of("global_symbol", "other")), f),
        is(false));
    assertThat(
        match(fnPat.hasAttr(ImmutableMap.of("Composite", "conv2d")), f),
        is(false));
    // the pattern holds IntImm 1, the function holds the integer 1
    assertThat(match(fnPat.hasAttr(ImmutableMap.of("Primitive", 1)), f),
        is(false));
    assertThat(
        match(fnPat.hasAttr(ImmutableMap.of("Primitive", rx.intImm(1))), f),
        is(false));
  }

  @Test void testMatchAttrValue() {
    assertThat(PatternMatcher.matchAttrValue(rx.intImm(1), 1), is(true));
    assertThat(PatternMatcher.matchAttrValue(rx.intImm(1), 1L), is(true));
    assertThat(PatternMatcher.matchAttrValue(rx.intImm(1), 2), is(false));
    assertThat(PatternMatcher.matchAttrValue(rx.intImm(1), true), is(true));
    assertThat(PatternMatcher.matchAttrValue(rx.intImm(0), false), is(true));
    assertThat(PatternMatcher.matchAttrValue(rx.intImm(0), true), is(false));
    assertThat(PatternMatcher.matchAttrValue(rx.floatImm(0.5), 0.5),
        is(true));
    assertThat(PatternMatcher.matchAttrValue(rx.floatImm(0.5), 0.5f),
        is(true));
    assertThat(PatternMatcher.matchAttrValue(rx.intImm(1), 1.0), is(false));
    assertThat(PatternMatcher.matchAttrValue(rx.stringImm("a"), "a"),
        is(true));
    assertThat(PatternMatcher.matchAttrValue("a", "a"), is(true));
    assertThat(PatternMatcher.matchAttrValue("a", "b"), is(false));
    assertThat(PatternMatcher.matchAttrValue(rx.intImm(1), "1"), is(false));
    assertThat(
        PatternMatcher.matchAttrValue(TensorType.of(1, "int32"),
            TensorType.of(1, "int32")),
        is(true));
    assertThat(
        PatternMatcher.matchAttrValue(ImmutableMap.of("k", "v"),
            ImmutableMap.of("k", "v")),
        is(true));
    assertThrows(AssertionError.class,
        () -> PatternMatcher.matchAttrValue(rx.intImm(1), null));
    assertThrows(AssertionError.class,
        () -> PatternMatcher.matchAttrValue(rx.intImm(1), new Object()));
  }
}

// End AttrMatchTest.java
