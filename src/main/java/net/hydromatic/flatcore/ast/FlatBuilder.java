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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;

/** Builds flat program nodes. */
public enum FlatBuilder {
  /**
   * The singleton instance of the flat builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  flat;

  /** Creates a reference to a variable. */
  public Flat.Var var(int index) {
    return new Flat.Var(index);
  }

  /** Creates a list of references to variables. */
  public ImmutableList<Flat.Exp> vars(List<Integer> indexes) {
    final ImmutableList.Builder<Flat.Exp> b = ImmutableList.builder();
    indexes.forEach(i -> b.add(var(i)));
    return b.build();
  }

  /** Creates a literal, deducing its kind from the class of the value. */
  public Flat.Literal literal(Object value) {
    if (value instanceof Integer) {
      return intLiteral((Integer) value);
    }
    if (value instanceof Double) {
      return floatLiteral((Double) value);
    }
    if (value instanceof Character) {
      return charLiteral((Character) value);
    }
    throw new IllegalArgumentException("not a literal: " + value);
  }

  /** Creates an {@code int} literal. */
  public Flat.Literal intLiteral(int value) {
    return new Flat.Literal(Op.INT_LITERAL, value);
  }

  /** Creates a {@code float} literal. */
  public Flat.Literal floatLiteral(double value) {
    return new Flat.Literal(Op.FLOAT_LITERAL, value);
  }

  /** Creates a {@code char} literal. */
  public Flat.Literal charLiteral(char value) {
    return new Flat.Literal(Op.CHAR_LITERAL, value);
  }

  /** Creates an application. */
  public Flat.Apply apply(Op op, QName name, List<? extends Flat.Exp> args,
      int missing) {
    return new Flat.Apply(op, name, ImmutableList.copyOf(args), missing);
  }

  /** Creates a call to a function. */
  public Flat.Apply call(QName name, List<? extends Flat.Exp> args) {
    return apply(Op.FUNC_CALL, name, args, 0);
  }

  /** Creates a call to a function. */
  public Flat.Apply call(QName name, Flat.Exp... args) {
    return call(name, ImmutableList.copyOf(args));
  }

  /** Creates a call to a constructor. */
  public Flat.Apply cons(QName name, List<? extends Flat.Exp> args) {
    return apply(Op.CONS_CALL, name, args, 0);
  }

  /** Creates a call to a constructor. */
  public Flat.Apply cons(QName name, Flat.Exp... args) {
    return cons(name, ImmutableList.copyOf(args));
  }

  /** Creates a partial call to a function. */
  public Flat.Apply partCall(QName name, int missing, Flat.Exp... args) {
    return apply(Op.FUNC_PARTCALL, name, ImmutableList.copyOf(args), missing);
  }

  /** Creates a partial call to a constructor. */
  public Flat.Apply consPartCall(QName name, int missing, Flat.Exp... args) {
    return apply(Op.CONS_PARTCALL, name, ImmutableList.copyOf(args), missing);
  }

  /** Creates a case expression. */
  public Flat.Case caseOf(Flat.Exp exp, List<Flat.Branch> branches) {
    return new Flat.Case(exp, ImmutableList.copyOf(branches));
  }

  /** Creates a case expression. */
  public Flat.Case caseOf(Flat.Exp exp, Flat.Branch... branches) {
    return caseOf(exp, ImmutableList.copyOf(branches));
  }

  /** Creates a branch of a case expression. */
  public Flat.Branch branch(Flat.Pat pat, Flat.Exp exp) {
    return new Flat.Branch(pat, exp);
  }

  /** Creates a constructor pattern. */
  public Flat.ConPat conPat(QName con, List<Integer> vars) {
    return new Flat.ConPat(con, ImmutableList.copyOf(vars));
  }

  /** Creates a constructor pattern. */
  public Flat.ConPat conPat(QName con, int... vars) {
    return conPat(con, Ints.asList(vars));
  }

  /** Creates a literal pattern. */
  public Flat.LiteralPat literalPat(Flat.Literal literal) {
    return new Flat.LiteralPat(literal);
  }

  /** Creates a let expression. */
  public Flat.Let let(List<Flat.Binding> bindings, Flat.Exp exp) {
    return new Flat.Let(ImmutableList.copyOf(bindings), exp);
  }

  /** Creates a let expression with one binding. */
  public Flat.Let let(int var, Flat.Exp bound, Flat.Exp exp) {
    return let(ImmutableList.of(binding(var, bound)), exp);
  }

  /** Creates a binding in a let expression. */
  public Flat.Binding binding(int var, Flat.Exp exp) {
    return new Flat.Binding(var, exp);
  }

  /** Creates an expression that introduces free variables. */
  public Flat.Free free(List<Integer> vars, Flat.Exp exp) {
    return new Flat.Free(ImmutableList.copyOf(vars), exp);
  }

  /** Creates a choice. */
  public Flat.Choice choice(Flat.Exp left, Flat.Exp right) {
    return new Flat.Choice(left, right);
  }

  /** Creates a typed expression. */
  public Flat.Typed typed(Flat.Exp exp, String type) {
    return new Flat.Typed(exp, type);
  }

  /** Creates a rule. */
  public Flat.Rule rule(List<Integer> params, Flat.Exp exp) {
    return new Flat.Rule(ImmutableList.copyOf(params), exp);
  }

  /** Creates the body of an external function. */
  public Flat.External external(String marker) {
    return new Flat.External(marker);
  }

  /** Creates a function declaration. */
  public Flat.FuncDecl funcDecl(QName name, int arity,
      Flat.Visibility visibility, String type, Flat.Body body) {
    return new Flat.FuncDecl(name, arity, visibility, type, body);
  }

  /** Creates a public function declaration defined by a rule. */
  public Flat.FuncDecl function(QName name, List<Integer> params,
      Flat.Exp exp) {
    return funcDecl(name, params.size(), Flat.Visibility.PUBLIC, "_",
        rule(params, exp));
  }

  /** Creates a program. */
  public Flat.Program program(String name, List<String> imports,
      List<String> typeDecls, List<Flat.FuncDecl> funcs,
      List<String> opDecls) {
    return new Flat.Program(name, ImmutableList.copyOf(imports),
        ImmutableList.copyOf(typeDecls), ImmutableList.copyOf(funcs),
        ImmutableList.copyOf(opDecls));
  }

  /** Creates a program with no imports, type or fixity declarations. */
  public Flat.Program program(String name, List<Flat.FuncDecl> funcs) {
    return program(name, ImmutableList.of(), ImmutableList.of(), funcs,
        ImmutableList.of());
  }
}

// End FlatBuilder.java
