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

import com.google.common.collect.Ordering;
import java.util.Comparator;

/**
 * Qualified name of a function or constructor: a module name and a name that
 * is local to the module.
 *
 * <p>Prints as "module.name", for example "Prelude.True".
 */
public final class QName implements Comparable<QName> {
  /** Ordering that compares qualified names by module, then by name. */
  public static final Ordering<QName> ORDERING =
      Ordering.from(
          Comparator.comparing((QName q) -> q.module)
              .thenComparing(q -> q.name));

  public final String module;
  public final String name;

  private QName(String module, String name) {
    this.module = requireNonNull(module, "module");
    this.name = requireNonNull(name, "name");
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Creates a qualified name. */
  public static QName of(String module, String name) {
    return new QName(module, name);
  }

  /** Returns a name in the same module as this one. */
  public QName sibling(String name) {
    return new QName(module, name);
  }

  @Override
  public int compareTo(QName o) {
    return ORDERING.compare(this, o);
  }

  @Override
  public int hashCode() {
    return module.hashCode() * 31 + name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof QName
            && module.equals(((QName) o).module)
            && name.equals(((QName) o).name);
  }

  @Override
  public String toString() {
    return module + "." + name;
  }
}

// End QName.java
