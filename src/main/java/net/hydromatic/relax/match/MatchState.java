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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.pattern.Dfp;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Bindings made during a match, and the log that allows them to be undone.
 *
 * <p>Each time a pattern matches an expression, the matcher commits the pair:
 * it appends the expression to the pattern's list of bindings, and the
 * pattern to the log. To backtrack, the matcher notes the {@link
 * #watermark()} before an attempt and, if the attempt fails, calls {@link
 * #rollback(int)}, which undoes every commit made since.
 *
 * <p>Patterns are keyed by identity.
 */
public class MatchState {
  private final Map<Dfp.Pattern, List<Rx.Expr>> bindings =
      Maps.newIdentityHashMap();
  private final List<Dfp.Pattern> log = new ArrayList<>();
  private final MatchTracer tracer;

  MatchState(MatchTracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the number of commits; a position to roll back to. */
  public int watermark() {
    return log.size();
  }

  /** Records that {@code pattern} matched {@code expr}. */
  void commit(Dfp.Pattern pattern, Rx.Expr expr) {
    bindings.computeIfAbsent(pattern, p -> new ArrayList<>()).add(expr);
    log.add(pattern);
  }

  /**
   * Undoes every commit made after the log had length {@code watermark}, most
   * recent first.
   */
  void rollback(int watermark) {
    checkArgument(
        watermark >= 0 && watermark <= log.size(),
        "watermark %s out of range [0, %s]",
        watermark,
        log.size());
    if (watermark == log.size()) {
      return;
    }
    final List<Dfp.Pattern> tail = log.subList(watermark, log.size());
    final ImmutableList<Dfp.Pattern> erased = ImmutableList.copyOf(tail);
    for (Dfp.Pattern pattern : erased.reverse()) {
      final List<Rx.Expr> exprs = requireNonNull(bindings.get(pattern));
      exprs.remove(exprs.size() - 1);
      if (exprs.isEmpty()) {
        bindings.remove(pattern);
      }
    }
    tail.clear();
    tracer.onRollback(watermark, erased);
  }

  /** Removes all bindings. */
  void clear() {
    bindings.clear();
    log.clear();
  }

  /** Returns whether a pattern is bound. */
  public boolean isBound(Dfp.Pattern pattern) {
    return bindings.containsKey(pattern);
  }

  /**
   * Returns the expression that a pattern is bound to, or null if it is not
   * bound. If the pattern was bound more than once, returns the first.
   */
  public Rx.@Nullable Expr get(Dfp.Pattern pattern) {
    final @Nullable List<Rx.Expr> exprs = bindings.get(pattern);
    return exprs == null ? null : exprs.get(0);
  }

  /** Returns every expression that a pattern is bound to, oldest first. */
  public List<Rx.Expr> getAll(Dfp.Pattern pattern) {
    final @Nullable List<Rx.Expr> exprs = bindings.get(pattern);
    return exprs == null ? ImmutableList.of() : ImmutableList.copyOf(exprs);
  }

  /** Returns the log: the committed patterns, in the order committed. */
  public List<Dfp.Pattern> matchedPatterns() {
    return ImmutableList.copyOf(log);
  }

  /** Returns an immutable copy of the current bindings. */
  public Snapshot snapshot() {
    final Map<Dfp.Pattern, Rx.Expr> map = new LinkedHashMap<>();
    for (Dfp.Pattern pattern : log) {
      map.computeIfAbsent(pattern, p -> requireNonNull(get(p)));
    }
    return new Snapshot(ImmutableMap.copyOf(map));
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }

  /**
   * Bindings of a successful match, in the order that patterns were first
   * bound.
   */
  public static class Snapshot {
    private final ImmutableMap<Dfp.Pattern, Rx.Expr> bindings;

    Snapshot(ImmutableMap<Dfp.Pattern, Rx.Expr> bindings) {
      this.bindings = requireNonNull(bindings);
    }

    /** Returns the map from each bound pattern to its expression. */
    public ImmutableMap<Dfp.Pattern, Rx.Expr> bindings() {
      return bindings;
    }

    /** Returns the expression bound to a pattern, or null. */
    public Rx.@Nullable Expr get(Dfp.Pattern pattern) {
      return bindings.get(pattern);
    }

    @Override
    public String toString() {
      return bindings.toString();
    }
  }
}

// End MatchState.java
