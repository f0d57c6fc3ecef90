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
package net.hydromatic.relax.ir;

import java.util.List;
import java.util.Map;

/** Builds the string representation of an {@link IrNode}. */
public class IrWriter {
  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public IrWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an object that is not a node, such as an attribute value. */
  public IrWriter appendValue(Object o) {
    if (o instanceof IrNode) {
      return append((IrNode) o, 0, 0);
    }
    if (o instanceof String) {
      b.append('"').append(o).append('"');
      return this;
    }
    b.append(o);
    return this;
  }

  /**
   * Appends a child node, enclosing it in parentheses if its operator binds
   * less tightly than its neighbors.
   */
  public IrWriter append(IrNode node, int left, int right) {
    if (left > node.op.left || node.op.right < right) {
      b.append('(');
      node.unparse(this, 0, 0);
      b.append(')');
    } else {
      node.unparse(this, left, right);
    }
    return this;
  }

  /** Appends an infix expression. */
  public IrWriter infix(int left, IrNode a0, Op op, IrNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    return append(a0, left, op.left)
        .append(op.padded)
        .append(a1, op.right, right);
  }

  /** Appends a list of nodes separated by commas. */
  public IrWriter appendAll(List<? extends IrNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }

  /** Appends a map of attributes, "{name=value, ...}". */
  public IrWriter appendAttrs(Map<String, ?> attrs) {
    b.append('{');
    int i = 0;
    for (Map.Entry<String, ?> entry : attrs.entrySet()) {
      if (i++ > 0) {
        b.append(", ");
      }
      b.append(entry.getKey()).append('=');
      appendValue(entry.getValue());
    }
    b.append('}');
    return this;
  }
}

// End IrWriter.java
