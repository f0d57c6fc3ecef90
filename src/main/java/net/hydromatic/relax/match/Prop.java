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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a {@link PatternMatcher}.
 *
 * @see PatternMatcher.Builder#set(Prop, Object)
 */
public enum Prop {
  /**
   * Boolean property "commutativeMatch" controls whether a call pattern whose
   * operator is commutative ("add" or "multiply") retries with its arguments
   * swapped if they do not match in order. Default is true.
   */
  COMMUTATIVE_MATCH("commutativeMatch", Boolean.class, true, true),

  /**
   * Boolean property "associativeMatch" controls whether a call pattern that
   * mixes "multiply" and "divide" is rebalanced if it does not match as
   * written. For example, {@code divide(multiply(a, b), c)} matches {@code
   * multiply(a, divide(b, c))}. Default is true.
   */
  ASSOCIATIVE_MATCH("associativeMatch", Boolean.class, true, true),

  /**
   * Boolean property "memoize" is whether a pattern that has already matched
   * an expression is, at the start of a match, resolved to that expression
   * rather than matched again. Default is true.
   *
   * <p>Dominator patterns switch memoization off while they match the path
   * pattern, and back to this value afterwards.
   */
  MEMOIZE("memoize", Boolean.class, true, true),

  /**
   * Boolean property "autoJump" is whether a variable is replaced by the
   * value it is bound to before it is matched. Requires a map from variables
   * to values. Default is false.
   */
  AUTO_JUMP("autoJump", Boolean.class, true, false);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(
      String camelName,
      Class<?> type,
      boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    final @Nullable Prop prop = BY_NAME.get(propName);
    checkArgument(prop != null, "property %s not found", propName);
    return prop;
  }

  /** Returns the value of a property. */
  public @Nullable Object get(Map<Prop, Object> map) {
    final @Nullable Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkArgument(
        type == Boolean.class,
        "invalid type %s for property %s",
        type,
        camelName);
    final @Nullable Object o = get(map);
    checkArgument(
        o != null, "no value for property %s and no default value", camelName);
    return (Boolean) o;
  }

  /**
   * Sets the value of a property, converting strings such as "true" to the
   * property's type.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Boolean.class && value instanceof String) {
      final String s = ((String) value).trim().toLowerCase(Locale.ROOT);
      checkArgument(
          s.equals("true") || s.equals("false"),
          "value for property %s must be 'true' or 'false'",
          camelName);
      set(map, Boolean.valueOf(s));
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      checkArgument(!required, "property %s is required", camelName);
      map.remove(this);
    } else {
      checkArgument(
          type.isInstance(value),
          "value for property %s must have type %s",
          camelName,
          type);
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous
   * value or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
