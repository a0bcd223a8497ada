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

import static net.hydromatic.flatcore.Fx.call;
import static net.hydromatic.flatcore.Fx.fun;
import static net.hydromatic.flatcore.Fx.fx;
import static net.hydromatic.flatcore.Fx.i;
import static net.hydromatic.flatcore.Fx.prim;
import static net.hydromatic.flatcore.ast.FlatBuilder.flat;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.compile.CompileException;
import net.hydromatic.flatcore.compile.Tracers;
import net.hydromatic.flatcore.eval.Confirmer;
import net.hydromatic.flatcore.eval.Confirmers;
import net.hydromatic.flatcore.eval.FileProgramStore;
import net.hydromatic.flatcore.eval.GraphSnapshot;
import net.hydromatic.flatcore.eval.GraphViewers;
import net.hydromatic.flatcore.eval.Node;
import net.hydromatic.flatcore.eval.Prop;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Driver}. */
public class DriverTest {
  /** Program whose function "main" has two results. */
  private static final Flat.Program TWO =
      fx(fun("main", 0, flat.choice(i(1), i(2)))).program();

  /** Program whose function "main" has three results. */
  private static final Flat.Program THREE =
      fx(fun("main", 0, flat.choice(i(1), flat.choice(i(2), i(3)))))
          .program();

  private final List<String> lines = new ArrayList<>();

  private static Map<Prop, Object> props(Object... keyValues) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      ((Prop) keyValues[i]).set(map, keyValues[i + 1]);
    }
    return map;
  }

  private Driver driver(Object... keyValues) {
    return Driver.create(props(keyValues), lines::add);
  }

  @Test
  void testRun() {
    final Driver.Result result =
        driver(Prop.ENTRY_FUNCTION_NAME, "main").run(TWO);
    assertThat(lines, is(ImmutableList.of("1", "2", "2 solutions")));
    assertThat(result.solutions.size(), is(2));
    assertThat(result.solutions.get(1).index, is(2));
    assertThat(result.failureCount, is(0));
    assertThat(result.stopped, is(false));
  }

  /** Without an entry function, the program is lifted but not executed. */
  @Test
  void testLiftOnly() {
    final List<Flat.Program> lifted = new ArrayList<>();
    final Driver.Result result =
        driver()
            .withTracer(Tracers.withOnLift(Tracers.empty(), lifted::add))
            .run(TWO);
    assertThat(result.solutions, empty());
    assertThat(lines, empty());
    assertThat(lifted, is(ImmutableList.of(result.program)));

    // With lifting disabled, the program is returned unchanged.
    final Driver.Result result2 = driver(Prop.LIFT, false).run(TWO);
    assertThat(result2.program, sameInstance(TWO));
  }

  @Test
  void testVerbosity() {
    driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.VERBOSITY, 2).run(TWO);
    assertThat(lines,
        is(
            ImmutableList.of("module M", "public M.main() = (1 ? 2)", "1",
                "2", "2 solutions")));

    lines.clear();
    driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.VERBOSITY, 0).run(TWO);
    assertThat(lines, empty());

    lines.clear();
    final Flat.Program failing =
        fx(fun("main", 0, flat.choice(prim("failed"), i(2)))).program();
    final Driver.Result result =
        driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.VERBOSITY, 3)
            .run(failing);
    assertThat(result.failureCount, is(1));
    assertThat(lines.subList(lines.size() - 3, lines.size()),
        is(
            ImmutableList.of("Failure (failed) in M.main: failed", "2",
                "1 solution")));

    lines.clear();
    driver(Prop.ENTRY_FUNCTION_NAME, "main")
        .run(fx(fun("main", 0, prim("failed"))).program());
    assertThat(lines, is(ImmutableList.of("no solutions")));
  }

  @Test
  void testValidate() {
    assertInvalid("showGraphLevel must be between 0 and 3: 4",
        Prop.SHOW_GRAPH_LEVEL, 4);
    assertInvalid("verbosity must be between 0 and 3: -1",
        Prop.VERBOSITY, -1);
    assertInvalid("printDepth must not be negative", Prop.PRINT_DEPTH, -1);
    assertInvalid("execution requires lifting",
        Prop.ENTRY_FUNCTION_NAME, "main", Prop.LIFT, false);
    assertInvalid("showGraphLevel 2 requires a viewer command",
        Prop.ENTRY_FUNCTION_NAME, "main", Prop.SHOW_GRAPH_LEVEL, 2,
        Prop.VIEWER_COMMAND, " ");
    assertInvalid("interactive mode requires a confirmer",
        Prop.ENTRY_FUNCTION_NAME, "main", Prop.INTERACTIVE, true);

    // Without an entry function, nothing is executed, so there is no need
    // for a confirmer or viewer.
    Driver.validate(
        props(Prop.INTERACTIVE, true, Prop.SHOW_GRAPH_LEVEL, 2,
            Prop.VIEWER_COMMAND, ""),
        false, false);
    Driver.validate(
        props(Prop.ENTRY_FUNCTION_NAME, "main", Prop.INTERACTIVE, true,
            Prop.SHOW_GRAPH_LEVEL, 2, Prop.VIEWER_COMMAND, ""),
        true, true);
  }

  private void assertInvalid(String message, Object... keyValues) {
    final Driver.ConfigException e =
        assertThrows(Driver.ConfigException.class,
            () -> driver(keyValues).run(TWO));
    assertThat(e.getMessage(), is(message));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("Invalid configuration: " + message));
  }

  @Test
  void testInteractive() {
    final List<String> prompts = new ArrayList<>();
    final Driver.Result result =
        driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.INTERACTIVE, true)
            .withConfirmer(
                Confirmers.of(prompts::add,
                    ImmutableList.of(Confirmer.Answer.MORE)))
            .run(THREE);
    assertThat(result.stopped, is(true));
    assertThat(result.solutions.size(), is(2));
    assertThat(prompts, is(ImmutableList.of("1", "2")));
    assertThat(lines, is(ImmutableList.of("1", "2", "2 solutions")));

    // "all" stops asking.
    prompts.clear();
    lines.clear();
    final Driver.Result result2 =
        driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.INTERACTIVE, true)
            .withConfirmer(
                Confirmers.of(prompts::add,
                    ImmutableList.of(Confirmer.Answer.ALL)))
            .run(THREE);
    assertThat(result2.stopped, is(false));
    assertThat(result2.solutions.size(), is(3));
    assertThat(prompts, is(ImmutableList.of("1")));
  }

  @Test
  void testStore(@TempDir File dir) throws IOException {
    final FileProgramStore store = new FileProgramStore(dir);
    final Flat.Program program =
        fx(fun("main", 0,
            call("g", flat.caseOf(i(1), Fx.on(1, i(2))))),
            fun("g", 1, Fx.v(0)))
            .program();
    final Driver.Result result = driver().withStore(store).run(program);
    final File file = store.file("M");
    assertThat(file, is(new File(dir, "M.lifted")));
    assertThat(
        new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8),
        is(result.program.toString()));
    assertThat(result.program.funcs.size(), is(3));
  }

  /** Level 1 shows the graph after each result. */
  @Test
  void testShowGraphAfterResult() {
    final List<GraphSnapshot> snapshots = new ArrayList<>();
    final List<Integer> steps = new ArrayList<>();
    driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.SHOW_GRAPH_LEVEL, 1)
        .withViewer((snapshot, step) -> {
          snapshots.add(snapshot);
          steps.add(step);
        })
        .run(TWO);
    assertThat(steps, is(ImmutableList.of(0, 1)));
    assertThat(snapshots.get(0).focus, is(0));
  }

  /** Levels 2 and 3 show the graph after each step; level 3 also shows
   * environments. */
  @Test
  void testShowGraphAfterStep() {
    for (int level : new int[] {2, 3}) {
      final List<GraphSnapshot> snapshots = new ArrayList<>();
      final List<Node> befores = new ArrayList<>();
      driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.SHOW_GRAPH_LEVEL, level)
          .withTracer(
              Tracers.withOnStep(Tracers.empty(),
                  (graph, h, before, after) -> befores.add(before)))
          .withViewer((snapshot, step) -> {
            assertThat(step, is(snapshots.size()));
            snapshots.add(snapshot);
          })
          .run(fx(fun("main", 0, flat.let(0, i(3), Fx.v(0)))).program());
      assertThat(snapshots.size(), is(befores.size()));
      final boolean hasEnvironment =
          snapshots.stream()
              .flatMap(s -> s.entries.stream())
              .anyMatch(e -> !e.environment.isEmpty());
      assertThat(hasEnvironment, is(level == 3));
    }
  }

  /** Stopping at a step abandons the search. */
  @Test
  void testStopAtStep() {
    final List<String> prompts = new ArrayList<>();
    final Driver.Result result =
        driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.SHOW_GRAPH_LEVEL, 2,
            Prop.INTERACTIVE, true)
            .withViewer((snapshot, step) -> { })
            .withConfirmer(
                Confirmers.of(prompts::add,
                    ImmutableList.of(Confirmer.Answer.MORE)))
            .run(TWO);
    assertThat(result.stopped, is(true));
    assertThat(result.solutions, empty());
    assertThat(prompts.size(), is(2));
    assertThat(prompts.get(0), startsWith("step 0: 0: M.main => "));
    assertThat(prompts.get(1), startsWith("step 1: 0: "));
    assertThat(lines, is(ImmutableList.of("no solutions")));
  }

  /** Writes snapshots to files if the viewer command is empty. */
  @Test
  void testViewerCommand(@TempDir File dir) throws IOException {
    final Driver.Result result =
        driver(Prop.ENTRY_FUNCTION_NAME, "main", Prop.SHOW_GRAPH_LEVEL, 1,
            Prop.VIEWER_COMMAND, "", Prop.DIRECTORY, dir)
            .withViewer(GraphViewers.command(dir, ""))
            .run(TWO);
    assertThat(result.solutions.size(), is(2));
    final File file = new File(dir, "step1.dot");
    assertThat(file.exists(), is(true));
    assertThat(
        new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8),
        startsWith("digraph G {\n"));
  }

  @Test
  void testCompileError() {
    final Flat.Program program =
        fx(fun("main", 0, call("nothere"))).program();
    assertThrows(CompileException.class,
        () -> driver(Prop.ENTRY_FUNCTION_NAME, "main").run(program));
    assertThat(lines,
        is(ImmutableList.of("Error in M.main: unresolved name M.nothere")));
  }
}

// End DriverTest.java
