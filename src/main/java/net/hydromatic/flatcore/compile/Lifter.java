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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.flatcore.ast.FlatBuilder.flat;
import static net.hydromatic.flatcore.util.Static.append;
import static net.hydromatic.flatcore.util.Static.transformEager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.ast.QName;
import net.hydromatic.flatcore.ast.Shuttle;
import net.hydromatic.flatcore.ast.Visitor;
import net.hydromatic.flatcore.compile.NameGenerator.Tag;
import net.hydromatic.flatcore.eval.Prop;

/**
 * Lifts nested case, let and free expressions into new top-level functions.
 *
 * <p>After lifting, a function body contains case, let and free expressions
 * only at its top, or in the branches of a top-level case if {@link
 * Prop#LIFT_CASE} is false. Every other occurrence, for example in the
 * argument of a call, becomes a call to a synthesized function whose
 * parameters are the free variables of the occurrence.
 *
 * <p>A Lifter instance either is "nested" or not. A nested lifter is used for
 * expressions that occur where a control construct cannot be represented
 * inline, and therefore must be extracted.
 */
public class Lifter extends Shuttle {
  private final Context cx;
  private final boolean nested;

  private Lifter(Context cx, boolean nested) {
    this.cx = requireNonNull(cx);
    this.nested = nested;
  }

  /** Lifts a program, using options from a property map. */
  public static Flat.Program lift(Map<Prop, Object> propMap,
      Flat.Program program) {
    return lift(Prop.LIFT_CASE.booleanValue(propMap),
        Prop.LIFT_COMPLEX_SCRUTINEE.booleanValue(propMap), program);
  }

  /**
   * Lifts a program.
   *
   * <p>The functions synthesized while lifting a function are placed
   * immediately after it.
   *
   * @param liftCase Whether to lift case expressions in the branches of a
   *     top-level case
   * @param liftComplexScrutinee Whether to lift case expressions whose
   *     scrutinee is not a variable
   * @param program Program
   * @return Lifted program
   */
  public static Flat.Program lift(boolean liftCase,
      boolean liftComplexScrutinee, Flat.Program program) {
    final NameGenerator nameGenerator =
        new NameGenerator(transformEager(program.funcs, f -> f.name.name));
    final Context cx =
        new Context(nameGenerator, liftCase, liftComplexScrutinee);
    final List<Flat.FuncDecl> funcs = new ArrayList<>();
    for (Flat.FuncDecl funcDecl : program.funcs) {
      cx.start(funcDecl.name);
      funcs.add(funcDecl.accept(cx.top));
      funcs.addAll(cx.synthesized);
    }
    return program.copy(funcs);
  }

  @Override
  protected Flat.Exp visit(Flat.Apply apply) {
    return apply.copy(transformEager(apply.args, arg -> arg.accept(cx.nested)));
  }

  @Override
  protected Flat.Exp visit(Flat.Case caseOf) {
    if (!(caseOf.exp instanceof Flat.Var) && cx.liftComplexScrutinee) {
      // "case e of branches" becomes "f(v1, ..., vn, e)" where
      // "f(v1, ..., vn, s) = case s of branches".
      final Flat.Exp scrutinee = caseOf.exp.accept(cx.nested);
      final List<Integer> vars = FreeFinder.freeVars(caseOf.branches);
      final int s = MaxVarFinder.maxVar(caseOf) + 1;
      final QName name =
          cx.synthesize(Tag.COMPLEXCASE, append(vars, s),
              flat.caseOf(flat.var(s), caseOf.branches));
      return flat.call(name, append(flat.vars(vars), scrutinee));
    }
    if (nested) {
      return cx.synthesizeCall(Tag.CASE, caseOf);
    }
    final Lifter branchLifter = cx.liftCase ? cx.nested : cx.top;
    return caseOf.copy(caseOf.exp.accept(cx.nested),
        transformEager(caseOf.branches,
            branch ->
                branch.copy(branch.pat, branch.exp.accept(branchLifter))));
  }

  @Override
  protected Flat.Exp visit(Flat.Let let) {
    if (nested) {
      return cx.synthesizeCall(Tag.LET, let);
    }
    return let.copy(
        transformEager(let.bindings,
            binding -> binding.copy(binding.exp.accept(cx.nested))),
        let.exp.accept(cx.nested));
  }

  @Override
  protected Flat.Exp visit(Flat.Free free) {
    if (nested) {
      return cx.synthesizeCall(Tag.FREE, free);
    }
    return free.copy(free.exp.accept(cx.nested));
  }

  @Override
  protected Flat.Exp visit(Flat.Choice choice) {
    // A choice is never extracted, but its alternatives are.
    return choice.copy(choice.left.accept(cx.nested),
        choice.right.accept(cx.nested));
  }

  @Override
  protected Flat.Exp visit(Flat.Typed typed) {
    return typed.copy(typed.exp.accept(this));
  }

  /** State of a lifting run. */
  private static class Context {
    final NameGenerator nameGenerator;
    final boolean liftCase;
    final boolean liftComplexScrutinee;
    final Lifter top = new Lifter(this, false);
    final Lifter nested = new Lifter(this, true);

    /** Functions synthesized while lifting the current function. Null
     * entries are placeholders for functions whose bodies are being
     * lifted. */
    final List<Flat.FuncDecl> synthesized = new ArrayList<>();

    /** The top-level function being lifted. */
    QName current;

    Context(NameGenerator nameGenerator, boolean liftCase,
        boolean liftComplexScrutinee) {
      this.nameGenerator = nameGenerator;
      this.liftCase = liftCase;
      this.liftComplexScrutinee = liftComplexScrutinee;
    }

    void start(QName function) {
      current = function;
      nameGenerator.reset(function.name);
      synthesized.clear();
    }

    /** Synthesizes a function whose parameters are the free variables of an
     * expression, and returns a call to it. */
    Flat.Exp synthesizeCall(Tag tag, Flat.Exp exp) {
      final List<Integer> vars = FreeFinder.freeVars(exp);
      return flat.call(synthesize(tag, vars, exp), flat.vars(vars));
    }

    /** Synthesizes a function, lifting its body, and returns its name. */
    QName synthesize(Tag tag, List<Integer> params, Flat.Exp exp) {
      final QName name = current.sibling(nameGenerator.get(tag));
      final int slot = synthesized.size();
      synthesized.add(null);
      final Flat.Exp body = exp.accept(top);
      synthesized.set(slot,
          flat.funcDecl(name, params.size(), Flat.Visibility.PRIVATE, "_",
              flat.rule(params, body)));
      return name;
    }
  }

  /** Finds the highest variable index used or bound in an expression. */
  private static class MaxVarFinder extends Visitor {
    int max = -1;

    static int maxVar(Flat.Exp exp) {
      final MaxVarFinder finder = new MaxVarFinder();
      exp.accept(finder);
      return finder.max;
    }

    private void add(List<Integer> vars) {
      vars.forEach(v -> max = Math.max(max, v));
    }

    @Override
    protected void visit(Flat.Var var) {
      max = Math.max(max, var.index);
    }

    @Override
    protected void visit(Flat.ConPat conPat) {
      add(conPat.vars);
    }

    @Override
    protected void visit(Flat.Let let) {
      add(let.vars());
      super.visit(let);
    }

    @Override
    protected void visit(Flat.Free free) {
      add(free.vars);
      super.visit(free);
    }
  }
}

// End Lifter.java
