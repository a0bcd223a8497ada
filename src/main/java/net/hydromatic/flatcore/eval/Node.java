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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.flatcore.ast.Flat;
import net.hydromatic.flatcore.ast.Op;
import net.hydromatic.flatcore.ast.QName;

/**
 * Content of a slot in a {@link Graph}.
 *
 * <p>Nodes are immutable. The evaluator reduces a node by replacing the
 * content of its slot, so every reference to the slot observes the result.
 * Nodes refer to other nodes by handle.
 */
public abstract class Node {
  public final Kind kind;

  Node(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns the handles of the nodes that this node refers to. */
  public ImmutableList<Integer> edges() {
    return ImmutableList.of();
  }

  /** Returns whether this node is in head normal form. */
  public boolean isHeadNormal() {
    return kind != Kind.UNEVALUATED && kind != Kind.REFERENCE;
  }

  /** Kind of node. */
  public enum Kind {
    UNEVALUATED,
    CONSTRUCTOR,
    PARTIAL,
    VALUE,
    REFERENCE,
    LOGIC_VARIABLE
  }

  /** Suspended evaluation of an expression in an environment. */
  public static class Unevaluated extends Node {
    public final Flat.Exp exp;
    public final EvalEnv env;
    /** Function whose body contains the expression; used to report
     * errors. */
    public final QName owner;

    public Unevaluated(Flat.Exp exp, EvalEnv env, QName owner) {
      super(Kind.UNEVALUATED);
      this.exp = requireNonNull(exp);
      this.env = requireNonNull(env);
      this.owner = requireNonNull(owner);
    }

    /** Returns a node that evaluates another expression in the same
     * function. */
    public Unevaluated with(Flat.Exp exp, EvalEnv env) {
      return exp == this.exp && env == this.env
          ? this
          : new Unevaluated(exp, env, owner);
    }

    @Override
    public String toString() {
      return exp.toString();
    }
  }

  /** Constructor applied to all of its arguments. */
  public static class Constructor extends Node {
    public final QName name;
    public final ImmutableList<Integer> args;

    public Constructor(QName name, ImmutableList<Integer> args) {
      super(Kind.CONSTRUCTOR);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public ImmutableList<Integer> edges() {
      return args;
    }

    @Override
    public String toString() {
      return name + (args.isEmpty() ? "" : args.toString());
    }
  }

  /** Function or constructor applied to fewer arguments than its arity. */
  public static class Partial extends Node {
    public final Op op;
    public final QName name;
    public final ImmutableList<Integer> args;
    public final int missing;

    public Partial(Op op, QName name, ImmutableList<Integer> args,
        int missing) {
      super(Kind.PARTIAL);
      checkArgument(op.isPartial(), "not partial: %s", op);
      checkArgument(missing > 0, "missing %s", missing);
      this.op = op;
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      this.missing = missing;
    }

    @Override
    public ImmutableList<Integer> edges() {
      return args;
    }

    @Override
    public String toString() {
      return name + "/" + missing + args;
    }
  }

  /** Literal value. */
  @SuppressWarnings("rawtypes")
  public static class Value extends Node {
    public final Comparable value;

    public Value(Comparable value) {
      super(Kind.VALUE);
      this.value = requireNonNull(value);
    }

    @Override
    public String toString() {
      return value instanceof Character ? "'" + value + "'" : value.toString();
    }
  }

  /** Redirection to another node, left behind when a node is reduced to
   * a node that already exists. */
  public static class Reference extends Node {
    public final int target;

    public Reference(int target) {
      super(Kind.REFERENCE);
      checkArgument(target >= 0);
      this.target = target;
    }

    @Override
    public ImmutableList<Integer> edges() {
      return ImmutableList.of(target);
    }

    @Override
    public String toString() {
      return "-> " + target;
    }
  }

  /** Logic variable, either free or bound to another node. */
  public static class LogicVariable extends Node {
    /** Value of {@link #binding} for a free variable. */
    public static final int NONE = -1;

    static final LogicVariable FREE = new LogicVariable(NONE);

    public final int binding;

    public LogicVariable(int binding) {
      super(Kind.LOGIC_VARIABLE);
      this.binding = binding;
    }

    public boolean isBound() {
      return binding != NONE;
    }

    @Override
    public boolean isHeadNormal() {
      return !isBound();
    }

    @Override
    public ImmutableList<Integer> edges() {
      return isBound() ? ImmutableList.of(binding) : ImmutableList.of();
    }

    @Override
    public String toString() {
      return isBound() ? "free -> " + binding : "free";
    }
  }
}

// End Node.java
