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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable graph of nodes, stored in an arena and addressed by handle.
 *
 * <p>A handle is the index of a slot in the arena. Slots are never moved, so
 * a handle remains valid until the slot is discarded by {@link
 * #restore(Checkpoint)}.
 *
 * <p>Every {@link #update} is recorded on a trail, so that the graph can be
 * restored to a previous {@link Checkpoint}. Allocations are not recorded;
 * restoring a checkpoint discards every slot allocated after it.
 */
public class Graph {
  private final List<Node> nodes = new ArrayList<>();

  /** Handles of updated slots, in order of update. */
  private final List<Integer> trailHandles = new ArrayList<>();

  /** Content of each updated slot before its update. */
  private final List<Node> trailNodes = new ArrayList<>();

  /** Allocates a slot, and returns its handle. */
  public int alloc(Node node) {
    nodes.add(requireNonNull(node));
    return nodes.size() - 1;
  }

  /** Returns the content of a slot. */
  public Node get(int handle) {
    return nodes.get(handle);
  }

  /** Replaces the content of a slot, and returns the previous content. */
  public Node update(int handle, Node node) {
    final Node previous = nodes.set(handle, requireNonNull(node));
    trailHandles.add(handle);
    trailNodes.add(previous);
    return previous;
  }

  /**
   * Follows references and bound logic variables, returning the handle of the
   * first node that is neither.
   */
  public int deref(int handle) {
    for (;;) {
      final Node node = nodes.get(handle);
      switch (node.kind) {
      case REFERENCE:
        handle = ((Node.Reference) node).target;
        break;
      case LOGIC_VARIABLE:
        final Node.LogicVariable variable = (Node.LogicVariable) node;
        if (!variable.isBound()) {
          return handle;
        }
        handle = variable.binding;
        break;
      default:
        return handle;
      }
    }
  }

  /** Returns the number of slots. */
  public int size() {
    return nodes.size();
  }

  /** Returns the number of updates that can be undone. */
  public int trailSize() {
    return trailHandles.size();
  }

  /** Returns a copy of the contents of all slots. */
  public ImmutableList<Node> nodes() {
    return ImmutableList.copyOf(nodes);
  }

  /** Records the current state, so that it can later be restored. */
  public Checkpoint checkpoint() {
    return new Checkpoint(trailHandles.size(), nodes.size());
  }

  /**
   * Restores the state at a checkpoint.
   *
   * <p>Undoes, most recent first, every update made since the checkpoint,
   * then discards every slot allocated since the checkpoint.
   */
  public void restore(Checkpoint checkpoint) {
    checkState(checkpoint.trailMark <= trailHandles.size()
            && checkpoint.size <= nodes.size(),
        "checkpoint %s is not older than current state", checkpoint);
    for (int i = trailHandles.size() - 1; i >= checkpoint.trailMark; i--) {
      final int handle = trailHandles.remove(i);
      final Node previous = trailNodes.remove(i);
      if (handle < checkpoint.size) {
        nodes.set(handle, previous);
      }
    }
    nodes.subList(checkpoint.size, nodes.size()).clear();
  }

  /** Position in the history of a graph. */
  public static class Checkpoint {
    final int trailMark;
    final int size;

    Checkpoint(int trailMark, int size) {
      checkArgument(trailMark >= 0 && size >= 0);
      this.trailMark = trailMark;
      this.size = size;
    }

    /** Returns the number of slots that existed when this checkpoint was
     * taken. */
    public int size() {
      return size;
    }

    @Override
    public String toString() {
      return "{trail: " + trailMark + ", size: " + size + "}";
    }
  }
}

// End Graph.java
