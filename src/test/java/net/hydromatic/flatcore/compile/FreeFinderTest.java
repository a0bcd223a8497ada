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

import static net.hydromatic.flatcore.Fx.call;
import static net.hydromatic.flatcore.Fx.con;
import static net.hydromatic.flatcore.Fx.i;
import static net.hydromatic.flatcore.Fx.on;
import static net.hydromatic.flatcore.Fx.prim;
import static net.hydromatic.flatcore.Fx.v;
import static net.hydromatic.flatcore.ast.FlatBuilder.flat;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;

import com.google.common.collect.ImmutableList;
import net.hydromatic.flatcore.ast.Flat;
import org.junit.jupiter.api.Test;

/** Tests for {@link FreeFinder}. */
public class FreeFinderTest {
  private static void check(Flat.Exp exp, Integer... expected) {
    assertThat(FreeFinder.freeVars(exp), is(ImmutableList.copyOf(expected)));
  }

  @Test
  void testAtoms() {
    check(v(3), 3);
    check(i(3));
  }

  /** Variables are returned in order of first occurrence, without
   * duplicates. */
  @Test
  void testApply() {
    check(call("f", v(2), i(1), v(0), v(2), con("Pair", v(1), v(0))),
        2, 0, 1);
  }

  @Test
  void testChoiceAndTyped() {
    check(flat.choice(v(1), flat.typed(prim("+", v(0), v(1)), "Int")), 1, 0);
  }

  @Test
  void testFree() {
    check(flat.free(ImmutableList.of(1), prim("=:=", v(1), v(0))), 0);
  }

  /** Bound variables are not free in the body, nor in the bindings, which
   * may be recursive. */
  @Test
  void testLet() {
    final Flat.Exp let =
        flat.let(
            ImmutableList.of(
                flat.binding(1, con("Cons", v(2), v(1))),
                flat.binding(3, prim("+", v(4), v(3)))),
            call("g", v(1), v(5), v(3)));
    check(let, 5, 2, 4);
  }

  @Test
  void testCase() {
    final Flat.Case caseOf =
        flat.caseOf(v(0),
            on("Cons", prim("+", v(1), v(3)), 1, 2),
            on("Nil", v(2)));
    // v2 is bound in the first branch but free in the second
    check(caseOf, 0, 3, 2);
    assertThat(FreeFinder.freeVars(caseOf.branches),
        is(ImmutableList.of(3, 2)));
    assertThat(
        FreeFinder.freeVars(
            flat.caseOf(v(0), on("Just", v(1), 1)).branches),
        empty());
  }
}

// End FreeFinderTest.java
