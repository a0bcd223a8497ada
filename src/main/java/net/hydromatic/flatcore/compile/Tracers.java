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

import java.util.function.Consumer;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.eval.Graph;
import net.hydromatic.flatcore.eval.Node;
import net.hydromatic.flatcore.eval.PathFailure;
import net.hydromatic.flatcore.eval.Solution;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a lifted program, then
   * calls the underlying tracer.
   */
  public static Tracer withOnLift(Tracer tracer,
      Consumer<Flat.Program> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLift(Flat.Program program) {
        consumer.accept(program);
        super.onLift(program);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action after each rewrite of a
   * node, then calls the underlying tracer.
   */
  public static Tracer withOnStep(Tracer tracer, StepConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(Graph graph, int handle, Node before, Node after) {
        consumer.accept(graph, handle, before, after);
        super.onStep(graph, handle, before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of an
   * evaluation, then calls the underlying tracer.
   */
  public static Tracer withOnResult(Tracer tracer,
      Consumer<Solution> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(Solution solution) {
        consumer.accept(solution);
        super.onResult(solution);
      }
    };
  }

  public static Tracer withOnFailure(Tracer tracer,
      Consumer<PathFailure> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFailure(PathFailure failure) {
        consumer.accept(failure);
        super.onFailure(failure);
      }
    };
  }

  /** Action performed on a rewrite step. */
  @FunctionalInterface
  public interface StepConsumer {
    void accept(Graph graph, int handle, Node before, Node after);
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onLift(Flat.Program program) {}

    @Override
    public void onStep(Graph graph, int handle, Node before, Node after) {}

    @Override
    public void onResult(Solution solution) {}

    @Override
    public void onFailure(PathFailure failure) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onLift(Flat.Program program) {
      tracer.onLift(program);
    }

    @Override
    public void onStep(Graph graph, int handle, Node before, Node after) {
      tracer.onStep(graph, handle, before, after);
    }

    @Override
    public void onResult(Solution solution) {
      tracer.onResult(solution);
    }

    @Override
    public void onFailure(PathFailure failure) {
      tracer.onFailure(failure);
    }
  }
}

// End Tracers.java
