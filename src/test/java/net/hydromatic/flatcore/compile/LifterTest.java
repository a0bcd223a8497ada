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

import static net.hydromatic.flatcore.Fx.FALSE;
import static net.hydromatic.flatcore.Fx.TRUE;
import static net.hydromatic.flatcore.Fx.call;
import static net.hydromatic.flatcore.Fx.con;
import static net.hydromatic.flatcore.Fx.fun;
import static net.hydromatic.flatcore.Fx.fx;
import static net.hydromatic.flatcore.Fx.i;
import static net.hydromatic.flatcore.Fx.on;
import static net.hydromatic.flatcore.Fx.prim;
import static net.hydromatic.flatcore.Fx.v;
import static net.hydromatic.flatcore.Matchers.lines;
import static net.hydromatic.flatcore.ast.FlatBuilder.flat;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.flatcore.Fx;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.eval.Prop;
import org.junit.jupiter.api.Test;

/** Tests for {@link Lifter}. */
public class LifterTest {
  /** A case that is the argument of a call is lifted into a function whose
   * parameters are the free variables of the case. */
  @Test
  void testCaseInArgument() {
    final Fx fx =
        fx(fun("f", 1,
            call("g",
                flat.caseOf(v(0), on(true, i(1)), on(false, i(0))))));
    final String expected =
        lines("module M",
            "public M.f(v0) = M.g(M.f_CASE0(v0))",
            "private M.f_CASE0(v0) = "
                + "case v0 of {Prelude.True -> 1; Prelude.False -> 0}");
    fx.assertLifted(expected)
        .assertFixedPoint()
        .assertSynthesizedFunctionsAreSound();
  }

  /** A case at the top of a function body stays where it is. */
  @Test
  void testTopLevelCase() {
    final Fx fx =
        fx(fun("f", 2,
            flat.caseOf(v(0), on(true, prim("+", v(1), i(1))),
                on(false, v(1)))));
    assertThat(fx.lifted(), sameInstance(fx.program()));
    fx.assertFixedPoint();
  }

  /** A case whose scrutinee is not a variable becomes a call to a function
   * whose last parameter is the scrutinee. */
  @Test
  void testComplexScrutinee() {
    final Flat.FuncDecl f =
        fun("f", 2,
            flat.caseOf(call("h", v(0)),
                on("Just", prim("+", v(2), v(1)), 2),
                on("Nothing", v(1))));
    final String expected =
        lines("module M",
            "public M.f(v0, v1) = M.f_COMPLEXCASE0(v1, M.h(v0))",
            "private M.f_COMPLEXCASE0(v1, v3) = case v3 of "
                + "{M.Just(v2) -> Prelude.+(v2, v1); M.Nothing -> v1}");
    fx(f).assertLifted(expected)
        .assertFixedPoint()
        .assertSynthesizedFunctionsAreSound();

    // With the option off, the case stays where it is.
    final Fx fx = fx(f).with(Prop.LIFT_COMPLEX_SCRUTINEE, false);
    assertThat(fx.lifted(), sameInstance(fx.program()));
  }

  /** The scrutinee is lifted first, so a let in the scrutinee gets the
   * lower number. */
  @Test
  void testComplexScrutineeContainingLet() {
    final Flat.FuncDecl f =
        fun("f", 1,
            flat.caseOf(flat.let(1, i(5), prim("<", v(0), v(1))),
                on(true, i(1)), on(false, i(2))));
    final String expected =
        lines("module M",
            "public M.f(v0) = M.f_COMPLEXCASE1(M.f_LET0(v0))",
            "private M.f_LET0(v0) = let {v1 = 5} in Prelude.<(v0, v1)",
            "private M.f_COMPLEXCASE1(v2) = "
                + "case v2 of {Prelude.True -> 1; Prelude.False -> 2}");
    fx(f).assertLifted(expected)
        .assertFixedPoint()
        .assertSynthesizedFunctionsAreSound();
  }

  /** Option "liftCase" controls whether a case in the branch of a top-level
   * case is lifted. */
  @Test
  void testLiftCase() {
    final Flat.FuncDecl f =
        fun("f", 2,
            flat.caseOf(v(0),
                on(true,
                    flat.caseOf(v(1), on(true, i(1)), on(false, i(2)))),
                on(false, i(3))));
    final String expected =
        lines("module M",
            "public M.f(v0, v1) = case v0 of "
                + "{Prelude.True -> M.f_CASE0(v1); Prelude.False -> 3}",
            "private M.f_CASE0(v1) = "
                + "case v1 of {Prelude.True -> 1; Prelude.False -> 2}");
    fx(f).assertLifted(expected).assertFixedPoint();

    final Fx fx = fx(f).with(Prop.LIFT_CASE, false);
    assertThat(fx.lifted(), sameInstance(fx.program()));
    fx.assertFixedPoint();
  }

  @Test
  void testLet() {
    final Flat.Exp let =
        flat.let(1, prim("+", v(0), i(1)), prim("*", v(1), v(1)));
    final String expected =
        lines("module M",
            "public M.f(v0) = M.g(M.f_LET0(v0))",
            "private M.f_LET0(v0) = "
                + "let {v1 = Prelude.+(v0, 1)} in Prelude.*(v1, v1)");
    fx(fun("f", 1, call("g", let)))
        .assertLifted(expected)
        .assertFixedPoint()
        .assertSynthesizedFunctionsAreSound();

    // A let at the top of a function stays, but a case in its body is
    // lifted.
    final Flat.Exp let2 =
        flat.let(1, i(5), flat.caseOf(v(0), on(true, v(1))));
    final String expected2 =
        lines("module M",
            "public M.f(v0) = let {v1 = 5} in M.f_CASE0(v0, v1)",
            "private M.f_CASE0(v0, v1) = case v0 of {Prelude.True -> v1}");
    fx(fun("f", 1, let2))
        .assertLifted(expected2)
        .assertSynthesizedFunctionsAreSound();
  }

  @Test
  void testFree() {
    final Flat.Exp free =
        flat.free(ImmutableList.of(1), prim("=:=", v(1), v(0)));
    final String expected =
        lines("module M",
            "public M.f(v0) = M.g(M.f_FREE0(v0))",
            "private M.f_FREE0(v0) = let {v1} free in Prelude.=:=(v1, v0)");
    fx(fun("f", 1, call("g", free)))
        .assertLifted(expected)
        .assertFixedPoint()
        .assertSynthesizedFunctionsAreSound();
  }

  /** A choice is never lifted, but the case in its alternative is. */
  @Test
  void testChoice() {
    final Flat.Exp choice =
        flat.choice(flat.caseOf(v(0), on(true, i(1))), i(2));
    final String expected =
        lines("module M",
            "public M.f(v0) = (M.f_CASE0(v0) ? 2)",
            "private M.f_CASE0(v0) = case v0 of {Prelude.True -> 1}");
    fx(fun("f", 1, choice))
        .assertLifted(expected)
        .assertFixedPoint();
  }

  /** A type annotation does not change whether its expression is
   * lifted. */
  @Test
  void testTyped() {
    final Flat.Exp typed =
        flat.typed(flat.caseOf(v(0), on(true, i(1))), "Int");
    final Fx fx = fx(fun("f", 1, typed));
    assertThat(fx.lifted(), sameInstance(fx.program()));

    final String expected =
        lines("module M",
            "public M.f(v0) = M.g((M.f_CASE0(v0) :: Int))",
            "private M.f_CASE0(v0) = case v0 of {Prelude.True -> 1}");
    fx(fun("f", 1, call("g", typed)))
        .assertLifted(expected)
        .assertFixedPoint();
  }

  /** The body of a synthesized function is lifted too. Functions are
   * placed immediately after the function they came from, in the order in
   * which they were started. */
  @Test
  void testNested() {
    final Flat.Exp inner = flat.caseOf(v(0), on(true, i(1)));
    final Flat.Exp outer =
        flat.caseOf(v(0),
            on(true, call("h", inner)),
            on(false, i(0)));
    final String expected =
        lines("module M",
            "public M.f(v0) = M.g(M.f_CASE0(v0))",
            "private M.f_CASE0(v0) = case v0 of "
                + "{Prelude.True -> M.h(M.f_CASE1(v0)); Prelude.False -> 0}",
            "private M.f_CASE1(v0) = case v0 of {Prelude.True -> 1}",
            "public M.k() = M.g(M.k_LET0)",
            "private M.k_LET0() = let {v0 = 1} in v0");
    fx(fun("f", 1, call("g", outer)),
        fun("k", 0, call("g", flat.let(0, i(1), v(0)))))
        .assertLifted(expected)
        .assertFixedPoint()
        .assertSynthesizedFunctionsAreSound();
  }

  /** Generated names skip names that already exist, and the counter starts
   * again for each function. */
  @Test
  void testNameCollision() {
    final Flat.Exp caseOf = flat.caseOf(v(0), on(true, FALSE));
    final String body = "case v0 of {Prelude.True -> Prelude.False}";
    final String expected =
        lines("module M",
            "public M.f(v0) = M.g(M.f_CASE1(v0))",
            "private M.f_CASE1(v0) = " + body,
            "public M.f_CASE0(v0) = v0",
            "public M.h(v0) = M.g(M.h_CASE0(v0), M.h_CASE1(v0))",
            "private M.h_CASE0(v0) = " + body,
            "private M.h_CASE1(v0) = " + body);
    fx(fun("f", 1, call("g", caseOf)),
        fun("f_CASE0", 1, v(0)),
        fun("h", 1, call("g", caseOf, caseOf)))
        .assertLifted(expected)
        .assertFixedPoint()
        .assertSynthesizedFunctionsAreSound();
  }

  /** External functions are unchanged. */
  @Test
  void testExternal() {
    final Fx fx =
        fx(flat.funcDecl(Fx.m("+"), 2, Flat.Visibility.PUBLIC, "_",
            flat.external("+")));
    assertThat(fx.lifted(), sameInstance(fx.program()));
  }

  /** Lifts a family of programs with control constructs nested to various
   * depths, and checks properties of each. */
  @Test
  void testProperties() {
    final List<Flat.Exp> exps = new ArrayList<>();
    exps.add(v(0));
    exps.add(TRUE);
    for (int depth = 0; depth < 3; depth++) {
      final List<Flat.Exp> next = new ArrayList<>(exps);
      for (Flat.Exp e : exps) {
        next.add(flat.caseOf(v(0), on(true, e), on(false, i(depth))));
        next.add(flat.caseOf(call("h", e), on(true, v(1))));
        next.add(flat.let(depth + 2, e, con("Pair", v(depth + 2), v(1))));
        next.add(flat.free(ImmutableList.of(depth + 5), call("h", e)));
        next.add(flat.choice(e, call("h", e)));
      }
      exps.clear();
      exps.addAll(next.subList(next.size() - 5, next.size()));
      exps.add(v(1));
      for (boolean liftCase : new boolean[] {true, false}) {
        for (boolean liftComplexScrutinee : new boolean[] {true, false}) {
          for (Flat.Exp e : next) {
            fx(fun("f", 2, e), fun("f2", 2, call("g", e)))
                .with(Prop.LIFT_CASE, liftCase)
                .with(Prop.LIFT_COMPLEX_SCRUTINEE, liftComplexScrutinee)
                .assertFixedPoint()
                .assertSynthesizedFunctionsAreSound();
          }
        }
      }
    }
  }
}

// End LifterTest.java
