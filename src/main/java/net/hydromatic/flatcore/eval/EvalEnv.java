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

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Evaluation environment.
 *
 * <p>Maps the local variables of an activation to handles of nodes in a
 * {@link Graph}. Environments are immutable; binding a variable creates a new
 * environment that inherits from this one.
 */
public interface EvalEnv {
  /** Value returned by {@link #getOpt(int)} if a variable is not bound. */
  int UNBOUND = -1;

  /** Returns the handle bound to {@code var}, or {@link #UNBOUND}. */
  int getOpt(int var);

  /** Returns the lowest variable index bound in this environment, or 0 if
   * there are no negative indexes. */
  int minVar();

  /**
   * Returns a variable index that is not bound in this environment and cannot
   * occur in a program.
   *
   * <p>The evaluator uses such variables to name nodes that it allocates for
   * sub-expressions, for example the scrutinee of a case.
   */
  default int freshVar() {
    return Math.min(-1, minVar() - 1);
  }

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (var, handle).
   */
  default EvalEnv bind(int var, int handle) {
    return new EvalEnvs.SubEvalEnv(this, var, handle);
  }

  /**
   * Creates an environment that has the same content as this one, plus a
   * binding for each variable.
   */
  default EvalEnv bindAll(List<Integer> vars, List<Integer> handles) {
    if (vars.isEmpty()) {
      return this;
    }
    if (vars.size() == 1) {
      return bind(vars.get(0), handles.get(0));
    }
    return new EvalEnvs.ArraySubEvalEnv(this, vars, handles);
  }

  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same variable
   * are visited, but after the more obscuring bindings.
   */
  void visit(BiConsumer<Integer, Integer> consumer);
}

// End EvalEnv.java
