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
import static java.util.Objects.requireNonNull;

import com.google.common.primitives.Ints;
import java.util.List;
import java.util.function.BiConsumer;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  private static final EvalEnv EMPTY = new EmptyEvalEnv();

  private EvalEnvs() {}

  /** Returns an environment with no bindings. */
  public static EvalEnv empty() {
    return EMPTY;
  }

  /** Environment with no bindings. */
  private static class EmptyEvalEnv implements EvalEnv {
    @Override
    public int getOpt(int var) {
      return UNBOUND;
    }

    @Override
    public int minVar() {
      return 0;
    }

    @Override
    public void visit(BiConsumer<Integer, Integer> consumer) {}
  }

  /**
   * Evaluation environment that inherits from a parent environment and adds
   * one binding.
   */
  static class SubEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final int var;
    protected final int handle;
    private final int minVar;

    SubEvalEnv(EvalEnv parentEnv, int var, int handle) {
      this.parentEnv = requireNonNull(parentEnv);
      this.var = var;
      this.handle = handle;
      this.minVar = Math.min(var, parentEnv.minVar());
    }

    @Override
    public void visit(BiConsumer<Integer, Integer> consumer) {
      consumer.accept(var, handle);
      parentEnv.visit(consumer);
    }

    @Override
    public int minVar() {
      return minVar;
    }

    @Override
    public int getOpt(int var) {
      for (SubEvalEnv e = this; ; ) {
        if (var == e.var) {
          return e.handle;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.getOpt(var);
        }
      }
    }
  }

  /** Similar to {@link SubEvalEnv} but binds several variables. */
  static class ArraySubEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final int[] vars;
    protected final int[] handles;
    private final int minVar;

    ArraySubEvalEnv(EvalEnv parentEnv, List<Integer> vars,
        List<Integer> handles) {
      checkArgument(vars.size() == handles.size(),
          "variables %s and handles %s", vars, handles);
      this.parentEnv = requireNonNull(parentEnv);
      this.vars = Ints.toArray(vars);
      this.handles = Ints.toArray(handles);
      this.minVar = Math.min(Ints.min(this.vars), parentEnv.minVar());
    }

    @Override
    public void visit(BiConsumer<Integer, Integer> consumer) {
      for (int i = 0; i < vars.length; i++) {
        consumer.accept(vars[i], handles[i]);
      }
      parentEnv.visit(consumer);
    }

    @Override
    public int minVar() {
      return minVar;
    }

    @Override
    public int getOpt(int var) {
      final int i = Ints.indexOf(vars, var);
      if (i >= 0) {
        return handles[i];
      }
      return parentEnv.getOpt(var);
    }
  }
}

// End EvalEnvs.java
