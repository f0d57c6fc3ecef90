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

import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.pattern.Dfp;

import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static net.hydromatic.relax.ir.RxBuilder.rx;
import static net.hydromatic.relax.pattern.DfpBuilder.dfp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

/** Tests {@link MatchTracers}. */
public class MatchTracersTest {
  private static String[] trace(PatternMatcher.Builder builder,
      Dfp.Pattern pattern, Rx.Expr expr) {
    final StringWriter sw = new StringWriter();
    final PatternMatcher matcher =
        builder.withTracer(MatchTracers.printTracer(new PrintWriter(sw)))
            .build();
    matcher.match(pattern, expr);
    return sw.toString().split("\\R");
  }

  /** Traces a match in which the arguments of a commutative call are
   * swapped. */
  @Test void testPrintTracer() {
    final Rx.Var x = rx.var("x");
    final Dfp.Pattern pattern =
        dfp.isOp("add").call(dfp.wildcard(), dfp.isVar());
    final String[] lines =
        trace(PatternMatcher.builder(), pattern,
            rx.call("add", x, rx.constant(1.0)));
    final String[] expected = {
        "match add add",
        "match * x",
        "no match var const(float32[])",
        "rollback 1 [*]",
        "match var x",
        "match * const(float32[])",
        "match add(*, var) add(x, const(float32[]))",
    };
    assertThat(lines, is(expected));
  }

  @Test void testPrintTracerRewrite() {
    final Rx.Var p = rx.var("p");
    final Rx.Var q = rx.var("q");
    final Rx.Var r = rx.var("r");
    final Dfp.Pattern pattern =
        dfp.isOp("multiply")
            .call(dfp.isOp("divide").call(dfp.isVar("p"), dfp.isVar("r")),
                dfp.isVar("q"));
    final String[] lines =
        trace(PatternMatcher.builder(), pattern,
            rx.call("divide", rx.call("multiply", p, q), r));
    assertThat(lines[0], is("no match multiply divide"));
    assertThat(lines[1],
        is("rewrite multiply(divide(var(\"p\"), var(\"r\")), var(\"q\")) -> "
            + "divide(multiply(var(\"p\"), var(\"q\")), var(\"r\"))"));
    assertThat(lines[lines.length - 1],
        is("match multiply(divide(var(\"p\"), var(\"r\")), var(\"q\")) "
            + "divide(multiply(p, q), r)"));
  }

  @Test void testNullTracer() {
    assertThat(MatchTracers.nullTracer() == MatchTracers.nullTracer(),
        is(true));
    final PatternMatcher matcher =
        PatternMatcher.builder()
            .withTracer(MatchTracers.nullTracer())
            .build();
    assertThat(matcher.match(dfp.wildcard(), rx.var("x")), is(true));
  }
}

// End MatchTracersTest.java
