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
package net.hydromatic.flatcore.ast;

import java.util.List;

/** Context for writing a flat program out as a string. */
public class FlatWriter {
  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string to the output. */
  public FlatWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public FlatWriter append(FlatNode node) {
    return node.unparse(this);
  }

  /** Appends a list of nodes, with a start, separator and end. */
  public FlatWriter appendAll(
      List<? extends FlatNode> nodes, String start, String sep, String end) {
    append(start);
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      append(nodes.get(i));
    }
    return append(end);
  }

  /** Appends a variable. */
  public FlatWriter var(int i) {
    return append("v").append(Integer.toString(i));
  }

  /** Appends a list of variables, with a start, separator and end. */
  public FlatWriter vars(List<Integer> vars, String start, String sep,
      String end) {
    append(start);
    for (int i = 0; i < vars.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      var(vars.get(i));
    }
    return append(end);
  }

  /** Appends a literal value; characters are quoted. */
  public FlatWriter literal(Object value) {
    if (value instanceof Character) {
      return append("'").append(value.toString()).append("'");
    }
    return append(value.toString());
  }
}

// End FlatWriter.java
