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

import java.util.List;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.pattern.Dfp;

/**
 * Called on various events during matching.
 *
 * @see MatchTracers
 */
public interface MatchTracer {
  /**
   * Called when the matcher has decided whether a pattern matches an
   * expression. If the pattern was already bound, the decision was made by
   * comparing with the bound expression.
   */
  void onVisit(Dfp.Pattern pattern, Rx.Expr expr, boolean matched);

  /**
   * Called when bindings are undone. {@code erasedPatterns} lists the
   * patterns that are no longer bound, oldest first; it is never empty.
   */
  void onRollback(int watermark, List<Dfp.Pattern> erasedPatterns);

  /**
   * Called when a call pattern that did not match as written is rebalanced,
   * before the rebalanced pattern is tried.
   */
  void onRewrite(Dfp.Pattern original, Dfp.Pattern rewritten);
}

// End MatchTracer.java
