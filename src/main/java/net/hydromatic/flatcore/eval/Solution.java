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

import com.google.common.collect.ImmutableList;

/** Result of one search path: the value of the entry expression and the
 * values of its logic variables. */
public class Solution {
  /** Ordinal of this solution in the search, starting at 1. */
  public final int index;
  public final Term value;
  /** Values of the logic variables that were passed to the entry
   * function, one per parameter. */
  public final ImmutableList<Term> bindings;

  public Solution(int index, Term value, ImmutableList<Term> bindings) {
    this.index = index;
    this.value = requireNonNull(value);
    this.bindings = requireNonNull(bindings);
  }

  @Override
  public String toString() {
    if (bindings.isEmpty()) {
      return value.toString();
    }
    final StringBuilder buf = new StringBuilder("{");
    for (int i = 0; i < bindings.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append('v').append(i).append(" = ").append(bindings.get(i));
    }
    return buf.append("} ").append(value).toString();
  }
}

// End Solution.java
