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
import static net.hydromatic.flatcore.ast.FlatBuilder.flat;
import static net.hydromatic.flatcore.util.Static.range;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.ast.QName;
import net.hydromatic.flatcore.compile.CompileException;
import net.hydromatic.flatcore.compile.Tracer;

/**
 * Search for the results of an expression.
 *
 * <p>The search is a depth-first exploration of the alternatives created by
 * choices and by narrowing. Each call to {@link #next()} continues until the
 * current path yields a result; a path that fails is reported to the
 * {@link Tracer} and abandoned. The search ends when there are no pending
 * alternatives. The caller may stop pulling results at any time.
 *
 * <p>To resume an alternative, the search restores the graph to the
 * alternative's checkpoint, rewrites the alternative's target node, and
 * evaluates the root again. Nodes that were reduced before the checkpoint
 * keep their results, so evaluation proceeds straight to the target.
 */
public class Search extends AbstractIterator<Solution> {
  private final Graph graph;
  private final Evaluator evaluator;
  private final Tracer tracer;
  private final Deque<Alternative> alternatives = new ArrayDeque<>();
  private final int root;
  /** Logic variables passed as arguments to the entry function. */
  private final ImmutableList<Integer> variables;
  private final int printDepth;

  private boolean started;
  private int solutionCount;
  private int failureCount;

  private Search(Flat.Program program, QName entry, int printDepth,
      Tracer tracer) {
    this.graph = new Graph();
    this.tracer = requireNonNull(tracer);
    this.evaluator = new Evaluator(program, graph, alternatives, tracer);
    this.printDepth = printDepth;
    final Flat.FuncDecl funcDecl = requireNonNull(program.func(entry));
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int i = 0; i < funcDecl.arity; i++) {
      b.add(graph.alloc(Node.LogicVariable.FREE));
    }
    this.variables = b.build();
    final ImmutableList<Integer> params = range(funcDecl.arity);
    this.root =
        graph.alloc(
            new Node.Unevaluated(flat.call(entry, flat.vars(params)),
                EvalEnvs.empty().bindAll(params, variables), entry));
  }

  /**
   * Creates a search for the results of calling a program's entry function.
   *
   * <p>The entry function is given by {@link Prop#ENTRY_FUNCTION_NAME}. If the
   * function has parameters, each is given a free logic variable, and each
   * solution contains the values of those variables.
   *
   * @throws CompileException if there is no such function
   */
  public static Search execute(Map<Prop, Object> propMap,
      Flat.Program program, Tracer tracer) {
    final String entryFunctionName =
        (String) Prop.ENTRY_FUNCTION_NAME.get(propMap);
    checkArgument(entryFunctionName != null, "no entry function");
    return execute(program, entryFunctionName,
        Prop.PRINT_DEPTH.intValue(propMap), tracer);
  }

  /** Creates a search for the results of calling a function. */
  public static Search execute(Flat.Program program, String entryFunctionName,
      int printDepth, Tracer tracer) {
    return new Search(program, resolve(program, entryFunctionName),
        printDepth, tracer);
  }

  /**
   * Resolves the name of an entry function. The name may be local to the
   * program's module ("f") or qualified ("M.f").
   */
  static QName resolve(Flat.Program program, String name) {
    final QName local = QName.of(program.name, name);
    if (program.func(local) != null) {
      return local;
    }
    final int i = name.lastIndexOf('.');
    if (i > 0 && i < name.length() - 1) {
      final QName qualified =
          QName.of(name.substring(0, i), name.substring(i + 1));
      if (program.func(qualified) != null) {
        return qualified;
      }
    }
    throw new CompileException(local, "unknown entry function " + name);
  }

  @Override
  protected Solution computeNext() {
    for (;;) {
      if (started) {
        final Alternative alternative = alternatives.poll();
        if (alternative == null) {
          return endOfData();
        }
        graph.restore(alternative.checkpoint);
        evaluator.rewrite(alternative.target,
            alternative.resume.apply(graph));
      }
      started = true;
      try {
        final int result = evaluator.hnf(root);
        final Solution solution =
            new Solution(++solutionCount,
                Term.of(graph, result, printDepth),
                ImmutableList.copyOf(
                    variables.stream()
                        .map(v -> Term.of(graph, v, printDepth))
                        .iterator()));
        tracer.onResult(solution);
        return solution;
      } catch (PathFailure e) {
        evaluator.reset();
        ++failureCount;
        tracer.onFailure(e);
      }
    }
  }

  /** Returns the graph. */
  public Graph graph() {
    return graph;
  }

  /** Returns the handle of the root node. */
  public int root() {
    return root;
  }

  /** Returns the number of solutions produced so far. */
  public int solutionCount() {
    return solutionCount;
  }

  /** Returns the number of search paths that have failed so far. */
  public int failureCount() {
    return failureCount;
  }

  /** Returns the number of rewrite steps performed so far. */
  public int stepCount() {
    return evaluator.stepCount();
  }

  /** Returns the number of pending alternatives. */
  public int pendingCount() {
    return alternatives.size();
  }

  /** Pending alternative: a checkpoint, and a change to make to the graph
   * after restoring that checkpoint. */
  static class Alternative {
    final Graph.Checkpoint checkpoint;
    final int target;
    final Function<Graph, Node> resume;

    Alternative(Graph.Checkpoint checkpoint, int target,
        Function<Graph, Node> resume) {
      this.checkpoint = requireNonNull(checkpoint);
      this.target = target;
      this.resume = requireNonNull(resume);
    }
  }
}

// End Search.java
