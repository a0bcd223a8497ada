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
package net.hydromatic.flatcore.ast;

import static net.hydromatic.flatcore.Fx.FALSE;
import static net.hydromatic.flatcore.Fx.TRUE;
import static net.hydromatic.flatcore.Fx.con;
import static net.hydromatic.flatcore.Fx.i;
import static net.hydromatic.flatcore.Fx.m;
import static net.hydromatic.flatcore.Fx.on;
import static net.hydromatic.flatcore.Fx.prim;
import static net.hydromatic.flatcore.Fx.v;
import static net.hydromatic.flatcore.Matchers.isFlat;
import static net.hydromatic.flatcore.Matchers.lines;
import static net.hydromatic.flatcore.Matchers.throwsA;
import static net.hydromatic.flatcore.ast.FlatBuilder.flat;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import net.hydromatic.flatcore.Fx;
import org.junit.jupiter.api.Test;

/** Tests for {@link Flat} and {@link FlatBuilder}. */
public class FlatTest {
  @Test
  void testUnparseExpressions() {
    assertThat(v(3), isFlat("v3"));
    assertThat(flat.charLiteral('x'), isFlat("'x'"));
    assertThat(flat.floatLiteral(1.5), isFlat("1.5"));
    assertThat(prim("+", v(0), i(1)), isFlat("Prelude.+(v0, 1)"));
    assertThat(TRUE, isFlat("Prelude.True"));
    assertThat(flat.partCall(m("add"), 1, i(2)), isFlat("M.add/1(2)"));
    assertThat(flat.consPartCall(m("Just"), 1), isFlat("M.Just/1"));
    assertThat(flat.caseOf(v(0), on(true, i(1)), on(false, i(0))),
        isFlat("case v0 of {Prelude.True -> 1; Prelude.False -> 0}"));
    assertThat(flat.caseOf(v(0), on("Cons", v(1), 1, 2), on(7, v(0))),
        isFlat("case v0 of {M.Cons(v1, v2) -> v1; 7 -> v0}"));
    assertThat(flat.let(1, i(5), prim("+", v(1), v(1))),
        isFlat("let {v1 = 5} in Prelude.+(v1, v1)"));
    assertThat(flat.free(ImmutableList.of(1, 2), con("Pair", v(1), v(2))),
        isFlat("let {v1, v2} free in M.Pair(v1, v2)"));
    assertThat(flat.choice(i(1), i(2)), isFlat("(1 ? 2)"));
    assertThat(flat.typed(v(0), "Int"), isFlat("(v0 :: Int)"));
  }

  @Test
  void testUnparseProgram() {
    final Flat.Program program =
        flat.program("M", ImmutableList.of("Prelude"),
            ImmutableList.of("data Maybe a = Nothing | Just a"),
            ImmutableList.of(
                Fx.fun("f", 1, FALSE),
                flat.funcDecl(m("+"), 2, Flat.Visibility.PRIVATE, "Int",
                    flat.external("prim_Int_plus"))),
            ImmutableList.of("infixl 6 +"));
    final String expected =
        lines("module M",
            "import Prelude",
            "type data Maybe a = Nothing | Just a",
            "infix infixl 6 +",
            "public M.f(v0) = Prelude.False",
            "private M.+/2 external \"prim_Int_plus\"");
    assertThat(program, hasToString(expected));
    assertThat(program.func(m("f")), is(program.funcs.get(0)));
    assertThat(program.func(m("g")), nullValue());
    assertThat(program.funcs.get(1).rule(), nullValue());
  }

  /** Tests that {@code copy} returns the same object if nothing has
   * changed. */
  @Test
  void testCopy() {
    final Flat.Apply apply = prim("+", v(0), i(1));
    assertThat(apply.copy(ImmutableList.of(v(0), i(1))),
        sameInstance(apply));
    assertThat(apply.copy(ImmutableList.of(v(0), i(2))),
        isFlat("Prelude.+(v0, 2)"));

    final Flat.Case caseOf = flat.caseOf(v(0), on(true, i(1)));
    assertThat(caseOf.copy(caseOf.exp, caseOf.branches),
        sameInstance(caseOf));

    final Flat.Program program = flat.program("M",
        ImmutableList.of(Fx.fun("f", 0, i(1))));
    assertThat(program.copy(program.funcs), sameInstance(program));
  }

  @Test
  void testInvalid() {
    Fx.assertError(() -> flat.apply(Op.FUNC_PARTCALL, m("f"),
            ImmutableList.of(), 0),
        throwsA(IllegalArgumentException.class,
            containsString("partial call must be missing arguments")));
    Fx.assertError(() -> flat.funcDecl(m("f"), 2, Flat.Visibility.PUBLIC,
            "_", flat.rule(ImmutableList.of(0), v(0))),
        throwsA(IllegalArgumentException.class,
            containsString("arity of M.f does not match")));
    Fx.assertError(() -> flat.program("M",
            ImmutableList.of(Fx.fun("f", 0, i(1)), Fx.fun("f", 0, i(2)))),
        throwsA(IllegalArgumentException.class,
            containsString("Multiple entries with same key")));
  }

  @Test
  void testQName() {
    final QName name = QName.of("Prelude", "True");
    assertThat(name, hasToString("Prelude.True"));
    assertThat(name.sibling("False"), is(QName.of("Prelude", "False")));
    assertThat(QName.of("A", "z").compareTo(QName.of("B", "a")) < 0,
        is(true));
  }
}

// End FlatTest.java
