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

import static java.util.Objects.requireNonNull;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.List;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.pattern.Dfp;

/** Implementations of {@link MatchTracer}. */
public class MatchTracers {
  private MatchTracers() {}

  /** Returns a tracer that does nothing. */
  public static MatchTracer nullTracer() {
    return NullTracer.INSTANCE;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static MatchTracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static MatchTracer printTracer(OutputStream stream) {
    return printTracer(new PrintWriter(stream));
  }

  /** Implementation of {@link MatchTracer} that does nothing. */
  private enum NullTracer implements MatchTracer {
    INSTANCE;

    @Override
    public void onVisit(Dfp.Pattern pattern, Rx.Expr expr, boolean matched) {}

    @Override
    public void onRollback(int watermark, List<Dfp.Pattern> erasedPatterns) {}

    @Override
    public void onRewrite(Dfp.Pattern original, Dfp.Pattern rewritten) {}
  }

  /**
   * Implementation of {@link MatchTracer} that writes to a given {@link
   * PrintWriter}.
   */
  private static class PrintTracer implements MatchTracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush() {
      w.println(b);
      b.setLength(0);
      w.flush();
    }

    @Override
    public void onVisit(Dfp.Pattern pattern, Rx.Expr expr, boolean matched) {
      b.append(matched ? "match " : "no match ")
          .append(pattern)
          .append(' ')
          .append(expr);
      flush();
    }

    @Override
    public void onRollback(int watermark, List<Dfp.Pattern> erasedPatterns) {
      b.append("rollback ")
          .append(watermark)
          .append(' ')
          .append(erasedPatterns);
      flush();
    }

    @Override
    public void onRewrite(Dfp.Pattern original, Dfp.Pattern rewritten) {
      b.append("rewrite ").append(original).append(" -> ").append(rewritten);
      flush();
    }
  }
}

// End MatchTracers.java
