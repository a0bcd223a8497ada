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

import net.hydromatic.flatcore.ast.QName;
import net.hydromatic.flatcore.util.FlatException;

/**
 * Failure of one search path.
 *
 * <p>The search controller catches this exception, abandons the current path
 * and resumes the next pending alternative. It never escapes a search.
 */
public class PathFailure extends RuntimeException implements FlatException {
  public final Kind kind;
  private final QName function;

  public PathFailure(Kind kind, QName function, String message) {
    super(message, null, false, false);
    this.kind = requireNonNull(kind);
    this.function = requireNonNull(function);
  }

  /** Returns the function in which the path failed. */
  public QName function() {
    return function;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Failure (")
        .append(kind.description)
        .append(") in ")
        .append(function)
        .append(": ")
        .append(getMessage());
  }

  /** Why a path failed. */
  public enum Kind {
    /** The scrutinee of a case matched none of its branches. */
    NO_MATCH("no match"),
    /** A case had no branches. */
    EMPTY_CASE("pattern match failure"),
    /** An expression could not be reduced to head normal form. */
    UNDEFINED("undefined"),
    /** The program called {@code failed} or a unification failed. */
    FAILED("failed");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }
}

// End PathFailure.java
