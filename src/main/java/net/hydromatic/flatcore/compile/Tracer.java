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
package net.hydromatic.flatcore.compile;

import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.eval.Graph;
import net.hydromatic.flatcore.eval.Node;
import net.hydromatic.flatcore.eval.PathFailure;
import net.hydromatic.flatcore.eval.Solution;

/** Called on various events during lifting and evaluation. */
public interface Tracer {
  /** Called when a program has been lifted. */
  void onLift(Flat.Program program);

  /**
   * Called when the evaluator rewrites a node of the graph.
   *
   * @param graph Graph, after the rewrite
   * @param handle Handle of the node that was rewritten
   * @param before Previous content of the node
   * @param after New content of the node
   */
  void onStep(Graph graph, int handle, Node before, Node after);

  /** Called on each result of an evaluation. */
  void onResult(Solution solution);

  /** Called when a search path fails. */
  void onFailure(PathFailure failure);
}

// End Tracer.java
