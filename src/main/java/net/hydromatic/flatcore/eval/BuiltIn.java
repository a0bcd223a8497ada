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

import static net.hydromatic.flatcore.ast.FlatBuilder.flat;
import static net.hydromatic.flatcore.util.Static.append;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.IntBinaryOperator;
import java.util.function.IntPredicate;
import net.hydromatic.flatcore.ast.Op;
import net.hydromatic.flatcore.ast.QName;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in function.
 *
 * <p>Built-in functions live in module "Prelude". A call to a name that is not
 * defined in the program resolves to a built-in function; so does a program
 * function whose body is external, by its local name.
 */
public enum BuiltIn {
  /** Function "+", of type {@code int -> int -> int}. */
  PLUS("+", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      arithmetic(ev, h, owner, args, (a, b) -> a + b, Double::sum);
    }
  },

  MINUS("-", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      arithmetic(ev, h, owner, args, (a, b) -> a - b, (a, b) -> a - b);
    }
  },

  TIMES("*", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      arithmetic(ev, h, owner, args, (a, b) -> a * b, (a, b) -> a * b);
    }
  },

  /** Function "div", integer division rounding towards negative
   * infinity. */
  DIV("div", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      final int a = intValue(ev, owner, args.get(0));
      final int b = intValue(ev, owner, args.get(1));
      if (b == 0) {
        throw new PathFailure(PathFailure.Kind.UNDEFINED, owner,
            "division by zero");
      }
      ev.rewrite(h, new Node.Value(Math.floorDiv(a, b)));
    }
  },

  /** Function "mod"; the result has the same sign as the divisor. */
  MOD("mod", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      final int a = intValue(ev, owner, args.get(0));
      final int b = intValue(ev, owner, args.get(1));
      if (b == 0) {
        throw new PathFailure(PathFailure.Kind.UNDEFINED, owner,
            "division by zero");
      }
      ev.rewrite(h, new Node.Value(Math.floorMod(a, b)));
    }
  },

  NEGATE("negate", 1) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      final Comparable<?> value = value(ev, owner, args.get(0));
      if (value instanceof Integer) {
        ev.rewrite(h, new Node.Value(-(Integer) value));
      } else if (value instanceof Double) {
        ev.rewrite(h, new Node.Value(-(Double) value));
      } else {
        throw notNumeric(owner, value);
      }
    }
  },

  /** Function "==", structural equality. */
  EQ("==", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      ev.rewrite(h,
          Evaluator.bool(equal(ev, owner, args.get(0), args.get(1))));
    }
  },

  NE("/=", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      ev.rewrite(h,
          Evaluator.bool(!equal(ev, owner, args.get(0), args.get(1))));
    }
  },

  LT("<", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      comparison(ev, h, owner, args, c -> c < 0);
    }
  },

  LE("<=", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      comparison(ev, h, owner, args, c -> c <= 0);
    }
  },

  GT(">", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      comparison(ev, h, owner, args, c -> c > 0);
    }
  },

  GE(">=", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      comparison(ev, h, owner, args, c -> c >= 0);
    }
  },

  /** Function "normalForm", which evaluates its argument completely. */
  NORMAL_FORM("normalForm", 1) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      ev.nf(args.get(0), new HashSet<>());
      ev.redirect(h, owner, args.get(0));
    }
  },

  /** Function "apply", which applies a partial application to one more
   * argument. */
  APPLY("apply", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      apply(ev, h, owner, args.get(0), args.get(1));
    }
  },

  /** Function "$!", which evaluates its argument to head normal form, then
   * applies a function to it. */
  STRICT_APPLY("$!", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      ev.hnf(args.get(1));
      apply(ev, h, owner, args.get(0), args.get(1));
    }
  },

  /** Function "$!!", which evaluates its argument to normal form, then
   * applies a function to it. */
  NORMAL_APPLY("$!!", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      ev.nf(args.get(1), new HashSet<>());
      apply(ev, h, owner, args.get(0), args.get(1));
    }
  },

  SEQ("seq", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      ev.hnf(args.get(0));
      ev.redirect(h, owner, args.get(1));
    }
  },

  /** Function "&", conjunction of constraints. Fails if the first argument
   * is false; otherwise evaluates to the second argument. */
  AND("&", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      final int a = ev.hnf(args.get(0));
      if (ev.isConstructor(a, Evaluator.FALSE)) {
        throw new PathFailure(PathFailure.Kind.FAILED, owner,
            "constraint is false");
      }
      ev.redirect(h, owner, args.get(1));
    }
  },

  /** Function "=:=", unification. Binds free logic variables so that its
   * arguments are equal, or fails. */
  UNIFY("=:=", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      unify(ev, owner, args.get(0), args.get(1));
      ev.rewrite(h, Evaluator.bool(true));
    }
  },

  /** Function "?", choice between its arguments. */
  CHOICE("?", 2) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      final int right = args.get(1);
      ev.pushAlternative(ev.graph.checkpoint(), h,
          g -> new Node.Unevaluated(flat.var(0),
              EvalEnvs.empty().bind(0, right), owner));
      ev.redirect(h, owner, args.get(0));
    }
  },

  FAILED("failed", 0) {
    @Override
    void reduce(Evaluator ev, int h, QName owner, List<Integer> args) {
      throw new PathFailure(PathFailure.Kind.FAILED, owner, "failed");
    }
  };

  /** Name of the function in module "Prelude". */
  public final String opName;
  public final int arity;

  private static final ImmutableMap<String, BuiltIn> BY_OP_NAME =
      Maps.uniqueIndex(Arrays.asList(values()), b -> b.opName);

  BuiltIn(String opName, int arity) {
    this.opName = opName;
    this.arity = arity;
  }

  /** Returns the qualified name of this built-in. */
  public QName qname() {
    return QName.of(Evaluator.PRELUDE, opName);
  }

  /** Looks up a built-in function by qualified name; returns null if not
   * found. */
  public static @Nullable BuiltIn lookup(QName name) {
    if (!name.module.equals(Evaluator.PRELUDE)) {
      return null;
    }
    return BY_OP_NAME.get(name.name);
  }

  /**
   * Reduces a call to this built-in. Either rewrites node {@code h} or throws
   * {@link PathFailure}.
   *
   * @param ev Evaluator
   * @param h Handle of the node that holds the call
   * @param owner Function that contains the call
   * @param args Handles of the arguments
   */
  abstract void reduce(Evaluator ev, int h, QName owner, List<Integer> args);

  /** Evaluates a node to head normal form, and returns its literal
   * value. */
  static Comparable<?> value(Evaluator ev, QName owner, int handle) {
    final Node node = ev.graph.get(ev.hnf(handle));
    if (!(node instanceof Node.Value)) {
      throw new PathFailure(PathFailure.Kind.UNDEFINED, owner,
          "not a literal: " + node);
    }
    return ((Node.Value) node).value;
  }

  static int intValue(Evaluator ev, QName owner, int handle) {
    final Comparable<?> value = value(ev, owner, handle);
    if (!(value instanceof Integer)) {
      throw notNumeric(owner, value);
    }
    return (Integer) value;
  }

  private static PathFailure notNumeric(QName owner, Object value) {
    return new PathFailure(PathFailure.Kind.UNDEFINED, owner,
        "not a number: " + value);
  }

  private static void arithmetic(Evaluator ev, int h, QName owner,
      List<Integer> args, IntBinaryOperator intOp,
      DoubleBinaryOperator doubleOp) {
    final Comparable<?> a = value(ev, owner, args.get(0));
    final Comparable<?> b = value(ev, owner, args.get(1));
    if (a instanceof Integer && b instanceof Integer) {
      ev.rewrite(h,
          new Node.Value(intOp.applyAsInt((Integer) a, (Integer) b)));
    } else if (a instanceof Double && b instanceof Double) {
      ev.rewrite(h,
          new Node.Value(doubleOp.applyAsDouble((Double) a, (Double) b)));
    } else {
      throw notNumeric(owner, a instanceof Number ? b : a);
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private static void comparison(Evaluator ev, int h, QName owner,
      List<Integer> args, IntPredicate predicate) {
    final Comparable a = value(ev, owner, args.get(0));
    final Comparable b = value(ev, owner, args.get(1));
    if (a.getClass() != b.getClass()) {
      throw new PathFailure(PathFailure.Kind.UNDEFINED, owner,
          "cannot compare " + a + " and " + b);
    }
    ev.rewrite(h, Evaluator.bool(predicate.test(a.compareTo(b))));
  }

  /** Returns whether two terms are equal, evaluating them as far as
   * necessary. */
  static boolean equal(Evaluator ev, QName owner, int a, int b) {
    final int x = ev.hnf(a);
    final int y = ev.hnf(b);
    if (x == y) {
      return true;
    }
    final Node nx = ev.graph.get(x);
    final Node ny = ev.graph.get(y);
    if (nx instanceof Node.Value && ny instanceof Node.Value) {
      return ((Node.Value) nx).value.equals(((Node.Value) ny).value);
    }
    if (nx instanceof Node.Constructor && ny instanceof Node.Constructor) {
      final Node.Constructor cx = (Node.Constructor) nx;
      final Node.Constructor cy = (Node.Constructor) ny;
      if (!cx.name.equals(cy.name) || cx.args.size() != cy.args.size()) {
        return false;
      }
      for (int i = 0; i < cx.args.size(); i++) {
        if (!equal(ev, owner, cx.args.get(i), cy.args.get(i))) {
          return false;
        }
      }
      return true;
    }
    throw new PathFailure(PathFailure.Kind.UNDEFINED, owner,
        "cannot compare " + nx + " and " + ny);
  }

  /**
   * Unifies two terms. Binds free logic variables, recording each binding so
   * that it is undone on backtracking. There is no occurs check.
   */
  static void unify(Evaluator ev, QName owner, int a, int b) {
    final int x = ev.hnf(a);
    final int y = ev.hnf(b);
    if (x == y) {
      return;
    }
    final Node nx = ev.graph.get(x);
    final Node ny = ev.graph.get(y);
    if (nx instanceof Node.LogicVariable) {
      ev.rewrite(x, new Node.LogicVariable(y));
      return;
    }
    if (ny instanceof Node.LogicVariable) {
      ev.rewrite(y, new Node.LogicVariable(x));
      return;
    }
    if (nx instanceof Node.Value && ny instanceof Node.Value) {
      if (((Node.Value) nx).value.equals(((Node.Value) ny).value)) {
        return;
      }
    } else if (nx instanceof Node.Constructor
        && ny instanceof Node.Constructor) {
      final Node.Constructor cx = (Node.Constructor) nx;
      final Node.Constructor cy = (Node.Constructor) ny;
      if (cx.name.equals(cy.name) && cx.args.size() == cy.args.size()) {
        for (int i = 0; i < cx.args.size(); i++) {
          unify(ev, owner, cx.args.get(i), cy.args.get(i));
        }
        return;
      }
    } else if (nx instanceof Node.Partial || ny instanceof Node.Partial) {
      throw new PathFailure(PathFailure.Kind.UNDEFINED, owner,
          "cannot unify partial application");
    }
    throw new PathFailure(PathFailure.Kind.FAILED, owner,
        "cannot unify " + Term.of(ev.graph, x, 4) + " with "
            + Term.of(ev.graph, y, 4));
  }

  /** Applies a partial application to one more argument. */
  static void apply(Evaluator ev, int h, QName owner, int f, int x) {
    final Node node = ev.graph.get(ev.hnf(f));
    if (!(node instanceof Node.Partial)) {
      throw new PathFailure(PathFailure.Kind.UNDEFINED, owner,
          "not a partial application: " + node);
    }
    final Node.Partial partial = (Node.Partial) node;
    final ImmutableList<Integer> args = append(partial.args, x);
    if (partial.missing > 1) {
      ev.rewrite(h,
          new Node.Partial(partial.op, partial.name, args,
              partial.missing - 1));
    } else if (partial.op.full() == Op.CONS_CALL) {
      ev.rewrite(h, new Node.Constructor(partial.name, args));
    } else {
      ev.call(h, owner, partial.name, args);
    }
  }
}

// End BuiltIn.java
