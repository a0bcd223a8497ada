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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms flat programs.
 *
 * <p>Each {@code visit} method returns a node of the same kind, with its
 * children transformed; if no child changed, returns the node itself.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected <E extends FlatNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // expressions

  protected Flat.Exp visit(Flat.Var var) {
    return var; // leaf
  }

  protected Flat.Exp visit(Flat.Literal literal) {
    return literal; // leaf
  }

  protected Flat.Exp visit(Flat.Apply apply) {
    return apply.copy(visitList(apply.args));
  }

  protected Flat.Exp visit(Flat.Case caseOf) {
    return caseOf.copy(caseOf.exp.accept(this), visitList(caseOf.branches));
  }

  protected Flat.Exp visit(Flat.Let let) {
    return let.copy(visitList(let.bindings), let.exp.accept(this));
  }

  protected Flat.Exp visit(Flat.Free free) {
    return free.copy(free.exp.accept(this));
  }

  protected Flat.Exp visit(Flat.Choice choice) {
    return choice.copy(choice.left.accept(this), choice.right.accept(this));
  }

  protected Flat.Exp visit(Flat.Typed typed) {
    return typed.copy(typed.exp.accept(this));
  }

  // patterns

  protected Flat.Pat visit(Flat.ConPat conPat) {
    return conPat; // leaf
  }

  protected Flat.Pat visit(Flat.LiteralPat literalPat) {
    return literalPat; // leaf
  }

  // miscellaneous

  protected Flat.Branch visit(Flat.Branch branch) {
    return branch.copy(branch.pat.accept(this), branch.exp.accept(this));
  }

  protected Flat.Binding visit(Flat.Binding binding) {
    return binding.copy(binding.exp.accept(this));
  }

  protected Flat.Body visit(Flat.Rule rule) {
    return rule.copy(rule.exp.accept(this));
  }

  protected Flat.Body visit(Flat.External external) {
    return external; // leaf
  }

  protected Flat.FuncDecl visit(Flat.FuncDecl funcDecl) {
    return funcDecl.copy(funcDecl.body.accept(this));
  }

  protected Flat.Program visit(Flat.Program program) {
    return program.copy(visitList(program.funcs));
  }
}

// End Shuttle.java
