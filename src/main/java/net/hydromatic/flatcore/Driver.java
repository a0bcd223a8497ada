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
package net.hydromatic.flatcore;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.compile.CompileException;
import net.hydromatic.flatcore.compile.Lifter;
import net.hydromatic.flatcore.compile.Tracer;
import net.hydromatic.flatcore.compile.Tracers;
import net.hydromatic.flatcore.eval.Confirmer;
import net.hydromatic.flatcore.eval.Graph;
import net.hydromatic.flatcore.eval.GraphSnapshot;
import net.hydromatic.flatcore.eval.GraphViewer;
import net.hydromatic.flatcore.eval.GraphViewers;
import net.hydromatic.flatcore.eval.Node;
import net.hydromatic.flatcore.eval.ProgramStore;
import net.hydromatic.flatcore.eval.Prop;
import net.hydromatic.flatcore.eval.Search;
import net.hydromatic.flatcore.eval.Solution;
import net.hydromatic.flatcore.util.FlatException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lifts a program and executes it.
 *
 * <p>The driver validates its configuration, lifts the program, hands the
 * lifted program to a {@link ProgramStore}, and, if an entry function is
 * configured, searches for its results. Output lines go to a consumer, as
 * much as {@link Prop#VERBOSITY} allows.
 *
 * <p>A driver is immutable. Collaborators are added using the {@code with}
 * methods, each of which returns a new driver.
 */
public class Driver {
  private final ImmutableMap<Prop, Object> propMap;
  private final Consumer<String> outLines;
  private final Tracer tracer;
  private final @Nullable ProgramStore store;
  private final @Nullable GraphViewer viewer;
  private final @Nullable Confirmer confirmer;

  private Driver(Map<Prop, Object> propMap, Consumer<String> outLines,
      Tracer tracer, @Nullable ProgramStore store,
      @Nullable GraphViewer viewer, @Nullable Confirmer confirmer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.outLines = requireNonNull(outLines);
    this.tracer = requireNonNull(tracer);
    this.store = store;
    this.viewer = viewer;
    this.confirmer = confirmer;
  }

  /** Creates a driver. */
  public static Driver create(Map<Prop, Object> propMap,
      Consumer<String> outLines) {
    return new Driver(propMap, outLines, Tracers.empty(), null, null, null);
  }

  /** Returns a driver that notifies a given tracer. */
  public Driver withTracer(Tracer tracer) {
    return new Driver(propMap, outLines, tracer, store, viewer, confirmer);
  }

  /** Returns a driver that stores lifted programs in a given store. */
  public Driver withStore(ProgramStore store) {
    return new Driver(propMap, outLines, tracer, store, viewer, confirmer);
  }

  /** Returns a driver that shows graph snapshots in a given viewer, rather
   * than running {@link Prop#VIEWER_COMMAND}. */
  public Driver withViewer(GraphViewer viewer) {
    return new Driver(propMap, outLines, tracer, store, viewer, confirmer);
  }

  /** Returns a driver that asks a given confirmer whether to continue. */
  public Driver withConfirmer(Confirmer confirmer) {
    return new Driver(propMap, outLines, tracer, store, viewer, confirmer);
  }

  /**
   * Checks that a configuration is valid.
   *
   * @param propMap Property values
   * @param hasViewer Whether a graph viewer has been supplied
   * @param hasConfirmer Whether a confirmer has been supplied
   * @throws ConfigException if the configuration is not valid
   */
  public static void validate(Map<Prop, Object> propMap, boolean hasViewer,
      boolean hasConfirmer) {
    final int showGraphLevel = Prop.SHOW_GRAPH_LEVEL.intValue(propMap);
    if (showGraphLevel < 0 || showGraphLevel > 3) {
      throw new ConfigException("showGraphLevel must be between 0 and 3: "
          + showGraphLevel);
    }
    final int verbosity = Prop.VERBOSITY.intValue(propMap);
    if (verbosity < 0 || verbosity > 3) {
      throw new ConfigException("verbosity must be between 0 and 3: "
          + verbosity);
    }
    if (Prop.PRINT_DEPTH.intValue(propMap) < 0) {
      throw new ConfigException("printDepth must not be negative");
    }
    final boolean execute = Prop.ENTRY_FUNCTION_NAME.get(propMap) != null;
    if (execute && !Prop.LIFT.booleanValue(propMap)) {
      throw new ConfigException("execution requires lifting");
    }
    if (execute
        && showGraphLevel > 0
        && !hasViewer
        && Prop.VIEWER_COMMAND.stringValue(propMap).trim().isEmpty()) {
      throw new ConfigException("showGraphLevel " + showGraphLevel
          + " requires a viewer command");
    }
    if (execute && Prop.INTERACTIVE.booleanValue(propMap) && !hasConfirmer) {
      throw new ConfigException("interactive mode requires a confirmer");
    }
  }

  /**
   * Lifts a program and, if an entry function is configured, executes it.
   *
   * @throws ConfigException if the configuration is not valid
   * @throws CompileException if the program refers to a function that does
   *     not exist, or calls a function with the wrong number of arguments
   */
  public Result run(Flat.Program program) {
    validate(propMap, viewer != null, confirmer != null);
    final int verbosity = Prop.VERBOSITY.intValue(propMap);

    final Flat.Program lifted;
    if (Prop.LIFT.booleanValue(propMap)) {
      lifted = Lifter.lift(propMap, program);
      tracer.onLift(lifted);
      if (verbosity >= 2) {
        Splitter.on('\n').omitEmptyStrings().split(lifted.toString())
            .forEach(outLines);
      }
      if (store != null) {
        store.store(lifted);
      }
    } else {
      lifted = program;
    }

    final String entryFunctionName =
        (String) Prop.ENTRY_FUNCTION_NAME.get(propMap);
    if (entryFunctionName == null) {
      return new Result(lifted, ImmutableList.of(), 0, false);
    }
    try {
      return new Run(verbosity).execute(lifted);
    } catch (CompileException e) {
      outLines.accept(e.describeTo(new StringBuilder()).toString());
      throw e;
    }
  }

  /** State of an execution. */
  private class Run {
    final int verbosity;
    final int showGraphLevel;
    final @Nullable GraphViewer viewer;
    boolean pausing;
    int snapshotCount;

    Run(int verbosity) {
      this.verbosity = verbosity;
      this.showGraphLevel = Prop.SHOW_GRAPH_LEVEL.intValue(propMap);
      this.viewer = showGraphLevel == 0 ? null
          : Driver.this.viewer != null ? Driver.this.viewer
          : GraphViewers.command(Prop.DIRECTORY.fileValue(propMap),
              Prop.VIEWER_COMMAND.stringValue(propMap));
      this.pausing = Prop.INTERACTIVE.booleanValue(propMap);
    }

    Result execute(Flat.Program program) {
      Tracer tracer = Driver.this.tracer;
      if (verbosity >= 3) {
        tracer = Tracers.withOnFailure(tracer,
            failure -> outLines.accept(failure.toString()));
      }
      if (showGraphLevel >= 2) {
        tracer = Tracers.withOnStep(tracer, this::onStep);
      }
      final Search search = Search.execute(propMap, program, tracer);
      final ImmutableList.Builder<Solution> solutions =
          ImmutableList.builder();
      boolean stopped = false;
      try {
        while (search.hasNext()) {
          final Solution solution = search.next();
          solutions.add(solution);
          if (verbosity >= 1) {
            outLines.accept(solution.toString());
          }
          if (showGraphLevel == 1) {
            view(GraphSnapshot.of(search.graph(), search.root(), false));
          }
          if (pausing && !confirm(solution.toString())) {
            stopped = true;
            break;
          }
        }
      } catch (CancellationException e) {
        stopped = true;
      }
      if (verbosity >= 1) {
        final int count = search.solutionCount();
        outLines.accept(count == 0 ? "no solutions"
            : count == 1 ? "1 solution"
            : count + " solutions");
      }
      return new Result(program, solutions.build(), search.failureCount(),
          stopped);
    }

    void onStep(Graph graph, int handle, Node before, Node after) {
      final int step = snapshotCount;
      view(GraphSnapshot.of(graph, handle, showGraphLevel >= 3));
      if (pausing
          && !confirm("step " + step + ": " + handle + ": "
              + before + " => " + after)) {
        throw new CancellationException("stopped at step " + step);
      }
    }

    void view(GraphSnapshot snapshot) {
      requireNonNull(viewer).view(snapshot, snapshotCount++);
    }

    /** Asks whether to continue; returns false to stop. */
    boolean confirm(String prompt) {
      switch (requireNonNull(confirmer).confirm(prompt)) {
      case ALL:
        pausing = false;
        return true;
      case STOP:
        return false;
      default:
        return true;
      }
    }
  }

  /** Result of running a program. */
  public static class Result {
    /** The program that was executed, after lifting. */
    public final Flat.Program program;
    public final ImmutableList<Solution> solutions;
    /** Number of search paths that failed. */
    public final int failureCount;
    /** Whether the user stopped the search before it finished. */
    public final boolean stopped;

    Result(Flat.Program program, ImmutableList<Solution> solutions,
        int failureCount, boolean stopped) {
      this.program = requireNonNull(program);
      this.solutions = requireNonNull(solutions);
      this.failureCount = failureCount;
      this.stopped = stopped;
    }
  }

  /** Invalid configuration. */
  public static class ConfigException extends RuntimeException
      implements FlatException {
    public ConfigException(String message) {
      super(message);
    }

    @Override
    public StringBuilder describeTo(StringBuilder buf) {
      return buf.append("Invalid configuration: ").append(getMessage());
    }
  }
}

// End Driver.java
