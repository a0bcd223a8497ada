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
package net.hydromatic.flatcore.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.flatcore.ast.QName;

/**
 * Immutable rendering of a node of a graph and the nodes it refers to.
 *
 * <p>A term is taken from the graph when a result is produced, so it remains
 * valid after the search backtracks and the graph changes.
 */
public abstract class Term {
  /** Term that stands for a node that has not been evaluated. */
  public static final Term UNEVALUATED = new Simple("_");

  /** Term that stands for nodes deeper than the print depth. */
  public static final Term ELLIPSIS = new Simple("...");

  /**
   * Creates a term from a node of a graph.
   *
   * @param graph Graph
   * @param handle Handle of node
   * @param depth Nesting depth at which arguments are replaced with an
   *     ellipsis
   */
  public static Term of(Graph graph, int handle, int depth) {
    if (depth < 0) {
      return ELLIPSIS;
    }
    final int h = graph.deref(handle);
    final Node node = graph.get(h);
    switch (node.kind) {
    case CONSTRUCTOR:
      final Node.Constructor constructor = (Node.Constructor) node;
      return new Compound(constructor.name, "",
          args(graph, constructor.args, depth));
    case PARTIAL:
      final Node.Partial partial = (Node.Partial) node;
      return new Compound(partial.name, "/" + partial.missing,
          args(graph, partial.args, depth));
    case VALUE:
      return new Literal(((Node.Value) node).value);
    case LOGIC_VARIABLE:
      return new Simple("_" + h);
    default:
      return UNEVALUATED;
    }
  }

  private static ImmutableList<Term> args(Graph graph, List<Integer> handles,
      int depth) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    handles.forEach(h -> b.add(of(graph, h, depth - 1)));
    return b.build();
  }

  /** Returns whether this term needs parentheses when it is an argument. */
  boolean isCompound() {
    return false;
  }

  /** Writes this term to a builder. */
  abstract StringBuilder unparse(StringBuilder buf);

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Term && toString().equals(o.toString());
  }

  /** Term that prints as a fixed string. */
  private static class Simple extends Term {
    private final String s;

    Simple(String s) {
      this.s = requireNonNull(s);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(s);
    }
  }

  /** Literal value. */
  @SuppressWarnings("rawtypes")
  private static class Literal extends Term {
    private final Comparable value;

    Literal(Comparable value) {
      this.value = requireNonNull(value);
    }

    @Override
    boolean isCompound() {
      return value instanceof Number && ((Number) value).doubleValue() < 0;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      if (value instanceof Character) {
        return buf.append('\'').append(value).append('\'');
      }
      return buf.append(value);
    }
  }

  /** Constructor or partial application, with its arguments. */
  private static class Compound extends Term {
    private final QName name;
    private final String suffix;
    private final ImmutableList<Term> args;

    Compound(QName name, String suffix, ImmutableList<Term> args) {
      this.name = requireNonNull(name);
      this.suffix = requireNonNull(suffix);
      this.args = requireNonNull(args);
    }

    @Override
    boolean isCompound() {
      return !args.isEmpty();
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(name.name).append(suffix);
      for (Term arg : args) {
        buf.append(' ');
        if (arg.isCompound()) {
          arg.unparse(buf.append('(')).append(')');
        } else {
          arg.unparse(buf);
        }
      }
      return buf;
    }
  }
}

// End Term.java
