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

/** Sub-types of {@link FlatNode}. */
public enum Op {
  // variables
  VAR,

  // literals
  INT_LITERAL,
  FLOAT_LITERAL,
  CHAR_LITERAL,

  // applications
  FUNC_CALL,
  CONS_CALL,
  /** Call to a function that is missing one or more arguments. */
  FUNC_PARTCALL,
  /** Call to a constructor that is missing one or more arguments. */
  CONS_PARTCALL,

  // control
  CASE,
  LET,
  FREE,
  CHOICE,
  TYPED,

  // patterns
  CON_PAT,
  LITERAL_PAT,

  // miscellaneous
  BRANCH,
  BINDING,
  RULE,
  EXTERNAL,
  FUNC_DECL,
  PROGRAM;

  /** Returns whether this is a call to a function (full or partial). */
  public boolean isFunction() {
    return this == FUNC_CALL || this == FUNC_PARTCALL;
  }

  /** Returns whether this is a partial call. */
  public boolean isPartial() {
    return this == FUNC_PARTCALL || this == CONS_PARTCALL;
  }

  /** Returns the kind of full call that a partial call becomes when it has
   * received all of its arguments. */
  public Op full() {
    switch (this) {
      case FUNC_PARTCALL:
        return FUNC_CALL;
      case CONS_PARTCALL:
        return CONS_CALL;
      default:
        return this;
    }
  }
}

// End Op.java
