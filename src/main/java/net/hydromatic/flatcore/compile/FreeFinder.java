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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.ast.Visitor;

/**
 * Finds free variables in an expression.
 *
 * <p>Variables are returned in order of first occurrence, without duplicates.
 * The order matters: it determines the order of the parameters of functions
 * synthesized by the {@link Lifter}.
 */
public class FreeFinder extends Visitor {
  private final ImmutableSet<Integer> bound;
  private final Consumer<Integer> consumer;

  private FreeFinder(ImmutableSet<Integer> bound, Consumer<Integer> consumer) {
    this.bound = bound;
    this.consumer = consumer;
  }

  /** Returns the free variables of an expression. */
  public static ImmutableList<Integer> freeVars(Flat.Exp exp) {
    final Set<Integer> set = new LinkedHashSet<>();
    exp.accept(new FreeFinder(ImmutableSet.of(), set::add));
    return ImmutableList.copyOf(set);
  }

  /** Returns the free variables of a list of case branches; that is, the
   * union of the free variables of each branch's expression, less the
   * variables bound by the branch's pattern. */
  public static ImmutableList<Integer> freeVars(List<Flat.Branch> branches) {
    final Set<Integer> set = new LinkedHashSet<>();
    final FreeFinder freeFinder = new FreeFinder(ImmutableSet.of(), set::add);
    branches.forEach(branch -> branch.accept(freeFinder));
    return ImmutableList.copyOf(set);
  }

  /** Returns a finder that treats some more variables as bound. */
  private FreeFinder push(List<Integer> vars) {
    if (vars.isEmpty()) {
      return this;
    }
    return new FreeFinder(
        ImmutableSet.<Integer>builder().addAll(bound).addAll(vars).build(),
        consumer);
  }

  @Override
  protected void visit(Flat.Var var) {
    if (!bound.contains(var.index)) {
      consumer.accept(var.index);
    }
  }

  @Override
  protected void visit(Flat.Branch branch) {
    branch.exp.accept(push(branch.pat.vars()));
  }

  @Override
  protected void visit(Flat.Let let) {
    // Bindings may be recursive, so the bound variables are in scope in both
    // the body and the bindings.
    final FreeFinder freeFinder = push(let.vars());
    let.exp.accept(freeFinder);
    let.bindings.forEach(binding -> binding.exp.accept(freeFinder));
  }

  @Override
  protected void visit(Flat.Free free) {
    free.exp.accept(push(free.vars));
  }
}

// End FreeFinder.java
