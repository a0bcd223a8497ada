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

/** Visits flat programs. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends FlatNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Flat.Var var) {}

  protected void visit(Flat.Literal literal) {}

  protected void visit(Flat.Apply apply) {
    apply.args.forEach(this::accept);
  }

  protected void visit(Flat.Case caseOf) {
    caseOf.exp.accept(this);
    caseOf.branches.forEach(this::accept);
  }

  protected void visit(Flat.Let let) {
    let.bindings.forEach(this::accept);
    let.exp.accept(this);
  }

  protected void visit(Flat.Free free) {
    free.exp.accept(this);
  }

  protected void visit(Flat.Choice choice) {
    choice.left.accept(this);
    choice.right.accept(this);
  }

  protected void visit(Flat.Typed typed) {
    typed.exp.accept(this);
  }

  // patterns

  protected void visit(Flat.ConPat conPat) {}

  protected void visit(Flat.LiteralPat literalPat) {
    literalPat.literal.accept(this);
  }

  // miscellaneous

  protected void visit(Flat.Branch branch) {
    branch.pat.accept(this);
    branch.exp.accept(this);
  }

  protected void visit(Flat.Binding binding) {
    binding.exp.accept(this);
  }

  protected void visit(Flat.Rule rule) {
    rule.exp.accept(this);
  }

  protected void visit(Flat.External external) {}

  protected void visit(Flat.FuncDecl funcDecl) {
    funcDecl.body.accept(this);
  }

  protected void visit(Flat.Program program) {
    program.funcs.forEach(this::accept);
  }
}

// End Visitor.java
