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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>Properties configure lifting and execution. Their values are held in a
 * {@code Map<Prop, Object>}; a property that has no value in the map has its
 * default value.
 */
public enum Prop {
  /**
   * File property "directory" is the directory into which compiled programs
   * and graph snapshots are written. Default is the current directory.
   */
  DIRECTORY("directory", File.class, true, new File("")),

  /**
   * String property "entryFunctionName" is the name of the function to
   * execute. It may be qualified ("Module.f") or local to the program's module
   * ("f"). If not set, the program is lifted but not executed.
   */
  ENTRY_FUNCTION_NAME("entryFunctionName", String.class, false, null),

  /**
   * Boolean property "interactive" controls whether to ask for confirmation
   * after each result. Default is false.
   */
  INTERACTIVE("interactive", Boolean.class, true, false),

  /**
   * Boolean property "lift" controls whether to run the lifting pass. Default
   * is true. Execution requires lifting.
   */
  LIFT("lift", Boolean.class, true, true),

  /**
   * Boolean property "liftCase" controls whether a case expression in a branch
   * of a top-level case is lifted into a new function. Default is true.
   */
  LIFT_CASE("liftCase", Boolean.class, true, true),

  /**
   * Boolean property "liftComplexScrutinee" controls whether a case
   * expression whose scrutinee is not a variable is lifted into a new function
   * that takes the scrutinee as its last parameter. Default is true.
   */
  LIFT_COMPLEX_SCRUTINEE("liftComplexScrutinee", Boolean.class, true, true),

  /**
   * Integer property "printDepth" controls printing of results. The depth of
   * nesting of a data structure at which ellipsis begins. Default is 20.
   */
  PRINT_DEPTH("printDepth", Integer.class, true, 20),

  /**
   * Integer property "showGraphLevel" controls graph snapshots. 0 (the
   * default) means no snapshots; 1 means a snapshot after each result; 2
   * means a snapshot after each reduction step; 3 is like 2 but also shows the
   * environments of unevaluated nodes.
   */
  SHOW_GRAPH_LEVEL("showGraphLevel", Integer.class, true, 0),

  /**
   * Integer property "verbosity" controls how much is reported. 0 reports
   * nothing; 1 (the default) reports results; 2 also reports the lifted
   * program; 3 also reports each failed search path.
   */
  VERBOSITY("verbosity", Integer.class, true, 1),

  /**
   * String property "viewerCommand" is the command that renders a graph
   * snapshot. The name of the file containing the snapshot is appended.
   */
  VIEWER_COMMAND("viewerCommand", String.class, true, "dot -Tsvg -O");

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or null if it has no value and no
   * default value. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of a file property. */
  public File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, allowing strings for boolean, integer and
   * file types.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = (String) value;
      if (type == Boolean.class) {
        set(map, Boolean.valueOf(s));
      } else if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be an integer: " + s, e);
        }
      } else if (type == File.class) {
        set(map, new File(s));
      }
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property "
            + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
