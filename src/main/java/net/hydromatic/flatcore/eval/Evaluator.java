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
package net.hydromatic.flatcore.eval;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.flatcore.ast.FlatBuilder.flat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.ast.QName;
import net.hydromatic.flatcore.compile.CompileException;
import net.hydromatic.flatcore.compile.Tracer;

/**
 * Reduces nodes of a {@link Graph} to head normal form.
 *
 * <p>Evaluation is by small steps. Each step replaces the content of an
 * {@link Node.Unevaluated} slot, either by its result or by a simpler
 * suspended expression, so that a node that is shared by several references
 * is reduced at most once. All changes go through {@link Graph#update}, and
 * can therefore be undone when the search backtracks.
 *
 * <p>When evaluation reaches a choice, or a case whose scrutinee is a free
 * logic variable, the evaluator continues with the first alternative and
 * pushes the others onto a stack of pending alternatives.
 */
public class Evaluator {
  static final String PRELUDE = "Prelude";
  static final QName TRUE = QName.of(PRELUDE, "True");
  static final QName FALSE = QName.of(PRELUDE, "False");

  final Flat.Program program;
  final Graph graph;
  private final Deque<Search.Alternative> alternatives;
  private final Tracer tracer;

  /** Nodes that are being reduced; demanding one of them is a black
   * hole. */
  private final BitSet active = new BitSet();

  /** Number of rewrites performed. */
  private int stepCount;

  Evaluator(Flat.Program program, Graph graph,
      Deque<Search.Alternative> alternatives, Tracer tracer) {
    this.program = requireNonNull(program);
    this.graph = requireNonNull(graph);
    this.alternatives = requireNonNull(alternatives);
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the number of rewrites performed so far. */
  public int stepCount() {
    return stepCount;
  }

  /** Forgets the nodes under reduction, after a path has failed. */
  void reset() {
    active.clear();
  }

  /** Replaces the content of a slot, and notifies the tracer. */
  void rewrite(int handle, Node node) {
    final Node before = graph.update(handle, node);
    ++stepCount;
    tracer.onStep(graph, handle, before, node);
  }

  /**
   * Records a choice point. Evaluation continues after this method returns;
   * if it later backtracks to this point, the content of slot
   * {@code target} is replaced by the result of {@code resume}.
   */
  void pushAlternative(Graph.Checkpoint checkpoint, int target,
      Function<Graph, Node> resume) {
    alternatives.push(new Search.Alternative(checkpoint, target, resume));
  }

  /**
   * Reduces a node to head normal form, and returns the handle of the node
   * that holds the result.
   *
   * <p>The result is a constructor, a literal value, a partial application or
   * a free logic variable.
   */
  public int hnf(int handle) {
    for (;;) {
      handle = graph.deref(handle);
      final Node node = graph.get(handle);
      if (!(node instanceof Node.Unevaluated)) {
        return handle;
      }
      final Node.Unevaluated u = (Node.Unevaluated) node;
      if (active.get(handle)) {
        throw new PathFailure(PathFailure.Kind.UNDEFINED, u.owner,
            "infinite loop detected evaluating " + u.exp);
      }
      active.set(handle);
      try {
        step(handle, u);
      } finally {
        active.clear(handle);
      }
    }
  }

  /**
   * Reduces a node to normal form, by reducing it to head normal form and
   * then doing the same to every argument of the resulting constructor or
   * partial application.
   */
  public void nf(int handle, Set<Integer> visited) {
    final int h = hnf(handle);
    if (!visited.add(h)) {
      return;
    }
    for (int arg : graph.get(h).edges()) {
      nf(arg, visited);
    }
  }

  /** Performs one step of reduction of an unevaluated node. */
  private void step(int h, Node.Unevaluated u) {
    final Flat.Exp exp = u.exp;
    switch (exp.op) {
    case VAR:
      final int target = graph.deref(lookup(u, ((Flat.Var) exp).index));
      if (target == h) {
        throw new PathFailure(PathFailure.Kind.UNDEFINED, u.owner,
            "infinite loop detected evaluating " + exp);
      }
      rewrite(h, new Node.Reference(target));
      return;

    case INT_LITERAL:
    case FLOAT_LITERAL:
    case CHAR_LITERAL:
      rewrite(h, new Node.Value(((Flat.Literal) exp).value));
      return;

    case TYPED:
      rewrite(h, u.with(((Flat.Typed) exp).exp, u.env));
      return;

    case CHOICE:
      final Flat.Choice choice = (Flat.Choice) exp;
      pushAlternative(graph.checkpoint(), h,
          g -> u.with(choice.right, u.env));
      rewrite(h, u.with(choice.left, u.env));
      return;

    case LET:
      final Flat.Let let = (Flat.Let) exp;
      // Bindings may refer to each other, so the environment binds the
      // handles of slots that are about to be allocated.
      final List<Integer> handles = new ArrayList<>();
      for (int i = 0; i < let.bindings.size(); i++) {
        handles.add(graph.size() + i);
      }
      final EvalEnv letEnv = u.env.bindAll(let.vars(), handles);
      for (Flat.Binding binding : let.bindings) {
        graph.alloc(u.with(binding.exp, letEnv));
      }
      rewrite(h, u.with(let.exp, letEnv));
      return;

    case FREE:
      final Flat.Free free = (Flat.Free) exp;
      final List<Integer> variables = new ArrayList<>();
      free.vars.forEach(v ->
          variables.add(graph.alloc(Node.LogicVariable.FREE)));
      rewrite(h, u.with(free.exp, u.env.bindAll(free.vars, variables)));
      return;

    case CASE:
      stepCase(h, u, (Flat.Case) exp);
      return;

    case FUNC_CALL:
    case CONS_CALL:
    case FUNC_PARTCALL:
    case CONS_PARTCALL:
      stepApply(h, u, (Flat.Apply) exp);
      return;

    default:
      throw new AssertionError("unexpected " + exp.op);
    }
  }

  private void stepApply(int h, Node.Unevaluated u, Flat.Apply apply) {
    if (!apply.args.stream().allMatch(arg -> arg instanceof Flat.Var)) {
      // Allocate a node for each argument that is not a variable, and
      // continue with a call whose arguments are all variables.
      EvalEnv env = u.env;
      final List<Flat.Exp> args = new ArrayList<>();
      for (Flat.Exp arg : apply.args) {
        if (arg instanceof Flat.Var) {
          args.add(arg);
        } else {
          final int v = env.freshVar();
          env = env.bind(v, graph.alloc(u.with(arg, u.env)));
          args.add(flat.var(v));
        }
      }
      rewrite(h, u.with(apply.copy(args), env));
      return;
    }
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    apply.args.forEach(arg -> b.add(lookup(u, ((Flat.Var) arg).index)));
    final ImmutableList<Integer> args = b.build();
    switch (apply.op) {
    case CONS_CALL:
      rewrite(h, new Node.Constructor(apply.name, args));
      return;
    case FUNC_PARTCALL:
    case CONS_PARTCALL:
      rewrite(h, new Node.Partial(apply.op, apply.name, args, apply.missing));
      return;
    default:
      call(h, u.owner, apply.name, args);
    }
  }

  /**
   * Replaces a node by a call to a function.
   *
   * <p>Resolves the name first against the functions of the program, then
   * against the built-in functions.
   */
  void call(int h, QName owner, QName name, ImmutableList<Integer> args) {
    final Flat.FuncDecl funcDecl = program.func(name);
    if (funcDecl == null) {
      final BuiltIn builtIn = BuiltIn.lookup(name);
      if (builtIn == null) {
        throw new CompileException(owner, "unresolved name " + name);
      }
      reduce(h, owner, builtIn, args);
      return;
    }
    if (funcDecl.arity != args.size()) {
      throw new CompileException(owner,
          "function " + name + " has arity " + funcDecl.arity
              + " but is called with " + args.size() + " arguments");
    }
    final Flat.Rule rule = funcDecl.rule();
    if (rule == null) {
      final BuiltIn builtIn =
          BuiltIn.lookup(QName.of(PRELUDE, funcDecl.name.name));
      if (builtIn == null) {
        throw new CompileException(name,
            "unknown external function " + funcDecl.name.name);
      }
      reduce(h, name, builtIn, args);
      return;
    }
    final EvalEnv env = EvalEnvs.empty().bindAll(rule.params, args);
    rewrite(h, new Node.Unevaluated(rule.exp, env, name));
  }

  private void reduce(int h, QName owner, BuiltIn builtIn,
      ImmutableList<Integer> args) {
    if (builtIn.arity != args.size()) {
      throw new CompileException(owner,
          "built-in " + builtIn.opName + " has arity " + builtIn.arity
              + " but is called with " + args.size() + " arguments");
    }
    builtIn.reduce(this, h, owner, args);
  }

  private void stepCase(int h, Node.Unevaluated u, Flat.Case caseOf) {
    if (caseOf.branches.isEmpty()) {
      throw new PathFailure(PathFailure.Kind.EMPTY_CASE, u.owner,
          "case has no branches: " + caseOf);
    }
    if (!(caseOf.exp instanceof Flat.Var)) {
      final int v = u.env.freshVar();
      final int scrutinee = graph.alloc(u.with(caseOf.exp, u.env));
      rewrite(h,
          u.with(caseOf.copy(flat.var(v), caseOf.branches),
              u.env.bind(v, scrutinee)));
      return;
    }
    final int s = hnf(lookup(u, ((Flat.Var) caseOf.exp).index));
    final Node node = graph.get(s);
    switch (node.kind) {
    case CONSTRUCTOR:
      final Node.Constructor constructor = (Node.Constructor) node;
      for (Flat.Branch branch : caseOf.branches) {
        if (branch.pat instanceof Flat.ConPat
            && ((Flat.ConPat) branch.pat).con.equals(constructor.name)) {
          final List<Integer> vars = branch.pat.vars();
          if (vars.size() != constructor.args.size()) {
            throw new CompileException(u.owner,
                "pattern " + branch.pat + " has " + vars.size()
                    + " variables but constructor has "
                    + constructor.args.size() + " arguments");
          }
          rewrite(h, u.with(branch.exp, u.env.bindAll(vars, constructor.args)));
          return;
        }
      }
      break;

    case VALUE:
      final Object value = ((Node.Value) node).value;
      for (Flat.Branch branch : caseOf.branches) {
        if (branch.pat instanceof Flat.LiteralPat
            && ((Flat.LiteralPat) branch.pat).literal.value.equals(value)) {
          rewrite(h, u.with(branch.exp, u.env));
          return;
        }
      }
      break;

    case LOGIC_VARIABLE:
      narrow(s, caseOf);
      // The variable is now bound; the next step selects a branch.
      return;

    default:
      throw new PathFailure(PathFailure.Kind.UNDEFINED, u.owner,
          "cannot match partial application " + node);
    }
    throw new PathFailure(PathFailure.Kind.NO_MATCH, u.owner,
        "no branch matches " + Term.of(graph, s, 4) + " in " + caseOf);
  }

  /**
   * Binds a free logic variable to each of the patterns of a case, in turn.
   *
   * <p>Only the constructors and literals that occur in the patterns are
   * tried. The first pattern is bound now; the others become pending
   * alternatives, pushed in reverse order so that they are explored in the
   * order they are written.
   */
  private void narrow(int variable, Flat.Case caseOf) {
    final Map<Object, Flat.Pat> patterns = new LinkedHashMap<>();
    for (Flat.Branch branch : caseOf.branches) {
      final Object key = branch.pat instanceof Flat.ConPat
          ? ((Flat.ConPat) branch.pat).con
          : ((Flat.LiteralPat) branch.pat).literal.value;
      patterns.putIfAbsent(key, branch.pat);
    }
    final List<Flat.Pat> distinct = ImmutableList.copyOf(patterns.values());
    final Graph.Checkpoint checkpoint = graph.checkpoint();
    for (int i = distinct.size() - 1; i > 0; i--) {
      final Flat.Pat pat = distinct.get(i);
      pushAlternative(checkpoint, variable, g -> instantiate(g, pat));
    }
    rewrite(variable, instantiate(graph, distinct.get(0)));
  }

  /**
   * Allocates a term that matches a pattern, whose arguments are fresh logic
   * variables, and returns a binding to it.
   */
  private static Node instantiate(Graph graph, Flat.Pat pat) {
    final Node node;
    if (pat instanceof Flat.ConPat) {
      final Flat.ConPat conPat = (Flat.ConPat) pat;
      final ImmutableList.Builder<Integer> args = ImmutableList.builder();
      conPat.vars.forEach(v -> args.add(graph.alloc(Node.LogicVariable.FREE)));
      node = new Node.Constructor(conPat.con, args.build());
    } else {
      node = new Node.Value(((Flat.LiteralPat) pat).literal.value);
    }
    return new Node.LogicVariable(graph.alloc(node));
  }

  private static int lookup(Node.Unevaluated u, int var) {
    final int handle = u.env.getOpt(var);
    if (handle == EvalEnv.UNBOUND) {
      throw new CompileException(u.owner, "unbound variable v" + var);
    }
    return handle;
  }

  /**
   * Replaces a node by a reference to another node. Fails if the other node
   * is a reference to the node itself.
   */
  void redirect(int h, QName owner, int target) {
    final int t = graph.deref(target);
    if (t == h) {
      throw new PathFailure(PathFailure.Kind.UNDEFINED, owner,
          "infinite loop detected");
    }
    rewrite(h, new Node.Reference(t));
  }

  /** Returns whether a node is a constructor with a given name. */
  boolean isConstructor(int handle, QName name) {
    final Node node = graph.get(handle);
    return node instanceof Node.Constructor
        && ((Node.Constructor) node).name.equals(name);
  }

  /** Creates a boolean constructor. */
  static Node bool(boolean b) {
    return new Node.Constructor(b ? TRUE : FALSE, ImmutableList.of());
  }
}

// End Evaluator.java
