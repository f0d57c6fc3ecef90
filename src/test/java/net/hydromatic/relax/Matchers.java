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
package net.hydromatic.relax;

import net.hydromatic.relax.analysis.StructuralEqual;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.match.MatchState;
import net.hydromatic.relax.pattern.Dfp;

import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a match state in which a pattern is bound to an expression
   * (the same object, not merely an equal one). */
  public static Matcher<MatchState> binds(Dfp.Pattern pattern,
      Rx.Expr expr) {
    return new TypeSafeMatcher<MatchState>() {
      protected boolean matchesSafely(MatchState state) {
        return state.get(pattern) == expr;
      }

      public void describeTo(Description description) {
        description.appendText("state that binds " + pattern + " to "
            + expr);
      }

      @Override protected void describeMismatchSafely(MatchState state,
          Description description) {
        description.appendText("was ").appendValue(state.get(pattern));
      }
    };
  }

  /** Matches an expression that is structurally equal to a given one. */
  public static Matcher<Rx.Expr> structurallyEqualTo(Rx.Expr expected) {
    return new TypeSafeMatcher<Rx.Expr>() {
      protected boolean matchesSafely(Rx.Expr expr) {
        return StructuralEqual.equal(expected, expr);
      }

      public void describeTo(Description description) {
        description.appendText("expression structurally equal to "
            + expected);
      }
    };
  }
}

// End Matchers.java
