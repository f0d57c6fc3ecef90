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

import java.util.Map;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.pattern.Dfp;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry points for matching a pattern against an expression with the default
 * configuration.
 *
 * <p>To configure the matcher, or to reuse one for many matches, use {@link
 * PatternMatcher#builder()}.
 */
public abstract class Matches {
  private Matches() {}

  /** Returns whether a pattern matches an expression. */
  public static boolean match(Dfp.Pattern pattern, Rx.Expr expr) {
    return PatternMatcher.builder().build().match(pattern, expr);
  }

  /**
   * Returns whether a pattern matches an expression, replacing each variable
   * that has a value in {@code varToValue} by its value as it is matched.
   */
  public static boolean match(
      Dfp.Pattern pattern,
      Rx.Expr expr,
      Map<? extends Rx.Var, ? extends Rx.Expr> varToValue) {
    return PatternMatcher.builder()
        .withVarToValue(varToValue)
        .build()
        .match(pattern, expr);
  }

  /**
   * Matches a pattern against an expression and returns the bindings, or
   * null if the pattern does not match.
   */
  public static MatchState.@Nullable Snapshot extract(
      Dfp.Pattern pattern, Rx.Expr expr) {
    return extract(PatternMatcher.builder().build(), pattern, expr);
  }

  /**
   * Matches a pattern against an expression, with variable values, and
   * returns the bindings, or null if the pattern does not match.
   */
  public static MatchState.@Nullable Snapshot extract(
      Dfp.Pattern pattern,
      Rx.Expr expr,
      Map<? extends Rx.Var, ? extends Rx.Expr> varToValue) {
    final PatternMatcher matcher =
        PatternMatcher.builder().withVarToValue(varToValue).build();
    return extract(matcher, pattern, expr);
  }

  private static MatchState.@Nullable Snapshot extract(
      PatternMatcher matcher, Dfp.Pattern pattern, Rx.Expr expr) {
    return matcher.match(pattern, expr) ? matcher.state().snapshot() : null;
  }
}

// End Matches.java
