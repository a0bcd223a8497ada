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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.flatcore.ast.FlatBuilder.flat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Flat expressions, patterns, function declarations and programs.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. All nodes are immutable; use {@link FlatBuilder} to create them.
 *
 * <p>Variables are identified by integer indexes that are local to a function
 * declaration. A {@link Let}, {@link Free} or {@link Branch} introduces
 * variables; so do the parameters of a {@link Rule}.
 */
public class Flat {
  private Flat() {}

  /** Visibility of a function declaration. */
  public enum Visibility {
    PUBLIC,
    PRIVATE
  }

  /** Base class of flat expressions. */
  public abstract static class Exp extends FlatNode {
    Exp(Op op) {
      super(op);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);
  }

  /** Reference to a variable. */
  public static class Var extends Exp {
    public final int index;

    Var(int index) {
      super(Op.VAR);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return index;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && index == ((Var) o).index;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.var(index);
    }
  }

  /** Literal: an integer, float or character constant. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Op op, Comparable value) {
      super(op);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && op == ((Literal) o).op
              && value.equals(((Literal) o).value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.literal(value);
    }
  }

  /**
   * Application of a function or constructor to arguments.
   *
   * <p>If the application is partial ({@link Op#FUNC_PARTCALL} or {@link
   * Op#CONS_PARTCALL}), {@link #missing} is the number of arguments that are
   * yet to be supplied; otherwise it is zero.
   */
  public static class Apply extends Exp {
    public final QName name;
    public final ImmutableList<Exp> args;
    public final int missing;

    Apply(Op op, QName name, ImmutableList<Exp> args, int missing) {
      super(op);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      this.missing = missing;
      checkArgument(
          op == Op.FUNC_CALL
              || op == Op.CONS_CALL
              || op == Op.FUNC_PARTCALL
              || op == Op.CONS_PARTCALL,
          "not an application: %s",
          op);
      checkArgument(
          op.isPartial() == (missing > 0),
          "partial call must be missing arguments: %s %s",
          op,
          missing);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      w.append(name.toString());
      if (missing > 0) {
        w.append("/").append(Integer.toString(missing));
      }
      if (args.isEmpty()) {
        return w;
      }
      return w.appendAll(args, "(", ", ", ")");
    }

    public Apply copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : flat.apply(op, name, args, missing);
    }
  }

  /** Case expression. */
  public static class Case extends Exp {
    public final Exp exp;
    public final ImmutableList<Branch> branches;

    Case(Exp exp, ImmutableList<Branch> branches) {
      super(Op.CASE);
      this.exp = requireNonNull(exp);
      this.branches = requireNonNull(branches);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.append("case ")
          .append(exp)
          .append(" of ")
          .appendAll(branches, "{", "; ", "}");
    }

    public Case copy(Exp exp, List<Branch> branches) {
      return exp == this.exp && branches.equals(this.branches)
          ? this
          : flat.caseOf(exp, branches);
    }
  }

  /** Branch of a {@link Case}: a pattern and the expression that is
   * evaluated if the pattern matches. */
  public static class Branch extends FlatNode {
    public final Pat pat;
    public final Exp exp;

    Branch(Pat pat, Exp exp) {
      super(Op.BRANCH);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Branch accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.append(pat).append(" -> ").append(exp);
    }

    public Branch copy(Pat pat, Exp exp) {
      return pat == this.pat && exp == this.exp ? this : flat.branch(pat, exp);
    }
  }

  /** Base class for a pattern. */
  public abstract static class Pat extends FlatNode {
    Pat(Op op) {
      super(op);
    }

    /** Returns the variables bound by this pattern. */
    public abstract ImmutableList<Integer> vars();

    @Override
    public abstract Pat accept(Shuttle shuttle);
  }

  /** Pattern that matches a constructor and binds its fields to fresh
   * variables. */
  public static class ConPat extends Pat {
    public final QName con;
    public final ImmutableList<Integer> vars;

    ConPat(QName con, ImmutableList<Integer> vars) {
      super(Op.CON_PAT);
      this.con = requireNonNull(con);
      this.vars = requireNonNull(vars);
    }

    @Override
    public ImmutableList<Integer> vars() {
      return vars;
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      w.append(con.toString());
      return vars.isEmpty() ? w : w.vars(vars, "(", ", ", ")");
    }
  }

  /** Pattern that matches a literal. */
  public static class LiteralPat extends Pat {
    public final Literal literal;

    LiteralPat(Literal literal) {
      super(Op.LITERAL_PAT);
      this.literal = requireNonNull(literal);
    }

    @Override
    public ImmutableList<Integer> vars() {
      return ImmutableList.of();
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.append(literal);
    }
  }

  /**
   * "Let" expression.
   *
   * <p>Bindings are mutually recursive: any binding's expression, and the body,
   * may reference any of the variables bound.
   */
  public static class Let extends Exp {
    public final ImmutableList<Binding> bindings;
    public final Exp exp;

    Let(ImmutableList<Binding> bindings, Exp exp) {
      super(Op.LET);
      this.bindings = requireNonNull(bindings);
      this.exp = requireNonNull(exp);
    }

    /** Returns the variables bound by this let. */
    public ImmutableList<Integer> vars() {
      final ImmutableList.Builder<Integer> b = ImmutableList.builder();
      bindings.forEach(binding -> b.add(binding.var));
      return b.build();
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.append("let ")
          .appendAll(bindings, "{", "; ", "}")
          .append(" in ")
          .append(exp);
    }

    public Let copy(List<Binding> bindings, Exp exp) {
      return bindings.equals(this.bindings) && exp == this.exp
          ? this
          : flat.let(bindings, exp);
    }
  }

  /** Binding of a variable to an expression, in a {@link Let}. */
  public static class Binding extends FlatNode {
    public final int var;
    public final Exp exp;

    Binding(int var, Exp exp) {
      super(Op.BINDING);
      this.var = var;
      this.exp = requireNonNull(exp);
    }

    @Override
    public Binding accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.var(var).append(" = ").append(exp);
    }

    public Binding copy(Exp exp) {
      return exp == this.exp ? this : flat.binding(var, exp);
    }
  }

  /** Expression that introduces free (logic) variables. */
  public static class Free extends Exp {
    public final ImmutableList<Integer> vars;
    public final Exp exp;

    Free(ImmutableList<Integer> vars, Exp exp) {
      super(Op.FREE);
      this.vars = requireNonNull(vars);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.append("let ")
          .vars(vars, "{", ", ", "}")
          .append(" free in ")
          .append(exp);
    }

    public Free copy(Exp exp) {
      return exp == this.exp ? this : flat.free(vars, exp);
    }
  }

  /** Nondeterministic choice between two expressions. */
  public static class Choice extends Exp {
    public final Exp left;
    public final Exp right;

    Choice(Exp left, Exp right) {
      super(Op.CHOICE);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.append("(").append(left).append(" ? ").append(right).append(")");
    }

    public Choice copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : flat.choice(left, right);
    }
  }

  /** Expression annotated with a type. The type is not interpreted. */
  public static class Typed extends Exp {
    public final Exp exp;
    public final String type;

    Typed(Exp exp, String type) {
      super(Op.TYPED);
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.append("(").append(exp).append(" :: ").append(type).append(")");
    }

    public Typed copy(Exp exp) {
      return exp == this.exp ? this : flat.typed(exp, type);
    }
  }

  /** Body of a function declaration: a {@link Rule} or an {@link External}. */
  public abstract static class Body extends FlatNode {
    Body(Op op) {
      super(op);
    }

    @Override
    public abstract Body accept(Shuttle shuttle);
  }

  /** Body of a function that is defined by an expression over its
   * parameters. */
  public static class Rule extends Body {
    public final ImmutableList<Integer> params;
    public final Exp exp;

    Rule(ImmutableList<Integer> params, Exp exp) {
      super(Op.RULE);
      this.params = requireNonNull(params);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Body accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.vars(params, "(", ", ", ")").append(" = ").append(exp);
    }

    public Rule copy(Exp exp) {
      return exp == this.exp ? this : flat.rule(params, exp);
    }
  }

  /** Body of a function that is implemented outside the program. */
  public static class External extends Body {
    public final String marker;

    External(String marker) {
      super(Op.EXTERNAL);
      this.marker = requireNonNull(marker);
    }

    @Override
    public Body accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      return w.append(" external \"").append(marker).append("\"");
    }
  }

  /** Function declaration. */
  public static class FuncDecl extends FlatNode {
    public final QName name;
    public final int arity;
    public final Visibility visibility;
    /** Result type. Not interpreted, and meaningless after lifting. */
    public final String type;
    public final Body body;

    FuncDecl(QName name, int arity, Visibility visibility, String type,
        Body body) {
      super(Op.FUNC_DECL);
      this.name = requireNonNull(name);
      this.arity = arity;
      this.visibility = requireNonNull(visibility);
      this.type = requireNonNull(type);
      this.body = requireNonNull(body);
      checkArgument(
          !(body instanceof Rule) || ((Rule) body).params.size() == arity,
          "arity of %s does not match its parameters",
          name);
    }

    /** Returns the rule, or null if the function is external. */
    public @Nullable Rule rule() {
      return body instanceof Rule ? (Rule) body : null;
    }

    @Override
    public FuncDecl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      w.append(visibility.name().toLowerCase(Locale.ROOT))
          .append(" ")
          .append(name.toString());
      if (body instanceof External) {
        w.append("/").append(Integer.toString(arity));
      }
      return w.append(body);
    }

    public FuncDecl copy(Body body) {
      return body == this.body
          ? this
          : flat.funcDecl(name, arity, visibility, type, body);
    }
  }

  /** Program: the contents of one module. */
  public static class Program extends FlatNode {
    public final String name;
    public final ImmutableList<String> imports;
    /** Type declarations. Not interpreted. */
    public final ImmutableList<String> typeDecls;
    /** Function declarations, in declaration order. */
    public final ImmutableList<FuncDecl> funcs;
    /** Fixity declarations. Not interpreted. */
    public final ImmutableList<String> opDecls;

    private final ImmutableMap<QName, FuncDecl> funcMap;

    Program(String name, ImmutableList<String> imports,
        ImmutableList<String> typeDecls, ImmutableList<FuncDecl> funcs,
        ImmutableList<String> opDecls) {
      super(Op.PROGRAM);
      this.name = requireNonNull(name);
      this.imports = requireNonNull(imports);
      this.typeDecls = requireNonNull(typeDecls);
      this.funcs = requireNonNull(funcs);
      this.opDecls = requireNonNull(opDecls);
      final ImmutableMap.Builder<QName, FuncDecl> b = ImmutableMap.builder();
      funcs.forEach(f -> b.put(f.name, f));
      this.funcMap = b.buildOrThrow();
    }

    /** Returns the declaration of a function, or null if not found. */
    public @Nullable FuncDecl func(QName name) {
      return funcMap.get(name);
    }

    @Override
    public Program accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    FlatWriter unparse(FlatWriter w) {
      w.append("module ").append(name).append("\n");
      imports.forEach(i -> w.append("import ").append(i).append("\n"));
      typeDecls.forEach(t -> w.append("type ").append(t).append("\n"));
      opDecls.forEach(o -> w.append("infix ").append(o).append("\n"));
      funcs.forEach(f -> w.append(f).append("\n"));
      return w;
    }

    public Program copy(List<FuncDecl> funcs) {
      return funcs.equals(this.funcs)
          ? this
          : flat.program(name, imports, typeDecls, funcs, opDecls);
    }
  }
}

// End Flat.java
