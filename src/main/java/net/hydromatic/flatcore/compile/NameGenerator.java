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

import java.util.HashSet;
import java.util.Set;

/**
 * Generates names for functions synthesized by the {@link Lifter}.
 *
 * <p>A name has the form "{@code f_TAGn}", where "f" is the name of the
 * top-level function being lifted, "TAG" is the kind of construct that was
 * lifted, and "n" is a counter. The counter restarts at zero for each
 * top-level function, and is shared by all tags. A name that collides with a
 * pre-existing name, or with a name that was generated earlier, is skipped.
 */
public class NameGenerator {
  private final Set<String> used;
  private String prefix = "";
  private int id = 0;

  /** Creates a NameGenerator that avoids the given names. */
  public NameGenerator(Iterable<String> existingNames) {
    this.used = new HashSet<>();
    existingNames.forEach(used::add);
  }

  /** Starts generating names for a new top-level function. */
  public void reset(String functionName) {
    this.prefix = functionName;
    this.id = 0;
  }

  /** Generates a name that is unique in this program. */
  public String get(Tag tag) {
    for (;;) {
      final String name = prefix + "_" + tag.name() + id++;
      if (used.add(name)) {
        return name;
      }
    }
  }

  /** Returns whether a name has been used, either because it existed before
   * or because this generator generated it. */
  public boolean isUsed(String name) {
    return used.contains(name);
  }

  /** Kind of construct that a synthesized function was lifted from. */
  public enum Tag {
    CASE,
    COMPLEXCASE,
    LET,
    FREE
  }
}

// End NameGenerator.java
