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
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the state of a {@link Graph}.
 *
 * <p>Contains every slot, so every edge refers to a node that is present.
 * Rendered as Graphviz "dot" text by {@link #toDot()}.
 */
public class GraphSnapshot {
  public final ImmutableList<Entry> entries;
  /** Handle of the node that changed in the step that led to this snapshot,
   * or -1. */
  public final int focus;

  private GraphSnapshot(ImmutableList<Entry> entries, int focus) {
    this.entries = requireNonNull(entries);
    this.focus = focus;
  }

  /**
   * Takes a snapshot of a graph.
   *
   * @param graph Graph
   * @param focus Handle of the node to highlight, or -1
   * @param withEnvironments Whether to include the environments of
   *     unevaluated nodes
   */
  public static GraphSnapshot of(Graph graph, int focus,
      boolean withEnvironments) {
    final List<Node> nodes = graph.nodes();
    final ImmutableList.Builder<Entry> b =
        ImmutableList.builderWithExpectedSize(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      final Node node = nodes.get(i);
      final Map<Integer, Integer> environment = new LinkedHashMap<>();
      if (withEnvironments && node instanceof Node.Unevaluated) {
        ((Node.Unevaluated) node).env.visit(environment::putIfAbsent);
      }
      b.add(
          new Entry(i, node.kind, label(node), node.edges(),
              ImmutableMap.copyOf(environment)));
    }
    return new GraphSnapshot(b.build(), focus);
  }

  private static String label(Node node) {
    switch (node.kind) {
    case CONSTRUCTOR:
      return ((Node.Constructor) node).name.name;
    case PARTIAL:
      final Node.Partial partial = (Node.Partial) node;
      return partial.name.name + "/" + partial.missing;
    case REFERENCE:
      return "ref";
    case LOGIC_VARIABLE:
      return "free";
    default:
      return node.toString();
    }
  }

  /** Renders this snapshot in Graphviz "dot" format. */
  public String toDot() {
    final StringBuilder buf = new StringBuilder("digraph G {\n");
    for (Entry entry : entries) {
      buf.append("  n").append(entry.handle).append(" [label=\"")
          .append(entry.handle).append(": ")
          .append(escape(entry.label)).append("\", shape=")
          .append(shape(entry.kind));
      if (entry.handle == focus) {
        buf.append(", style=bold, color=red");
      }
      buf.append("];\n");
    }
    for (Entry entry : entries) {
      for (int i = 0; i < entry.edges.size(); i++) {
        buf.append("  n").append(entry.handle)
            .append(" -> n").append(entry.edges.get(i));
        if (entry.edges.size() > 1) {
          buf.append(" [label=\"").append(i).append("\"]");
        }
        buf.append(";\n");
      }
      entry.environment.forEach((var, handle) ->
          buf.append("  n").append(entry.handle)
              .append(" -> n").append(handle)
              .append(" [style=dashed, label=\"v").append(var)
              .append("\"];\n"));
    }
    return buf.append("}\n").toString();
  }

  private static String shape(Node.Kind kind) {
    switch (kind) {
    case UNEVALUATED:
      return "ellipse";
    case REFERENCE:
      return "point";
    case LOGIC_VARIABLE:
      return "diamond";
    default:
      return "box";
    }
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  /** State of one slot. */
  public static class Entry {
    public final int handle;
    public final Node.Kind kind;
    public final String label;
    public final ImmutableList<Integer> edges;
    /** For an unevaluated node, maps each visible variable to the handle of
     * its node. */
    public final ImmutableMap<Integer, Integer> environment;

    Entry(int handle, Node.Kind kind, String label,
        ImmutableList<Integer> edges,
        ImmutableMap<Integer, Integer> environment) {
      this.handle = handle;
      this.kind = requireNonNull(kind);
      this.label = requireNonNull(label);
      this.edges = requireNonNull(edges);
      this.environment = requireNonNull(environment);
    }
  }
}

// End GraphSnapshot.java
