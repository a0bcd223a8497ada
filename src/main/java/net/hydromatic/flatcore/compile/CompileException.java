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

import net.hydromatic.flatcore.ast.QName;
import net.hydromatic.flatcore.util.FlatException;

/**
 * An internal or static error, such as a call to a function that does not
 * exist or a call with the wrong number of arguments.
 *
 * <p>Such errors are fatal; they abort the whole run.
 */
public class CompileException extends RuntimeException
    implements FlatException {
  private final QName function;

  /**
   * Creates a CompileException.
   *
   * @param function Function whose body contains the error
   * @param message Message
   */
  public CompileException(QName function, String message) {
    super(message);
    this.function = requireNonNull(function);
  }

  /** Returns the function whose body contains the error. */
  public QName function() {
    return function;
  }

  @Override
  public String toString() {
    return super.toString() + " in " + function;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error in ")
        .append(function)
        .append(": ")
        .append(getMessage());
  }
}

// End CompileException.java
