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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("printDepth"), is(Prop.PRINT_DEPTH));
    assertThat(Prop.lookup("PRINT_DEPTH"), is(Prop.PRINT_DEPTH));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("colour"));
    assertThat(e.getMessage(), is("property colour not found"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.DIRECTORY));
    assertThat(Prop.BY_NAME.size(), is(2 * Prop.values().length));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.LIFT.booleanValue(map), is(true));
    assertThat(Prop.LIFT_CASE.booleanValue(map), is(true));
    assertThat(Prop.LIFT_COMPLEX_SCRUTINEE.booleanValue(map), is(true));
    assertThat(Prop.INTERACTIVE.booleanValue(map), is(false));
    assertThat(Prop.PRINT_DEPTH.intValue(map), is(20));
    assertThat(Prop.VERBOSITY.intValue(map), is(1));
    assertThat(Prop.SHOW_GRAPH_LEVEL.intValue(map), is(0));
    assertThat(Prop.VIEWER_COMMAND.stringValue(map), is("dot -Tsvg -O"));
    assertThat(Prop.ENTRY_FUNCTION_NAME.get(map), nullValue());
    assertThrows(IllegalStateException.class,
        () -> Prop.ENTRY_FUNCTION_NAME.stringValue(map));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.VERBOSITY.set(map, 3);
    Prop.ENTRY_FUNCTION_NAME.set(map, "main");
    assertThat(Prop.VERBOSITY.intValue(map), is(3));
    assertThat(Prop.ENTRY_FUNCTION_NAME.stringValue(map), is("main"));

    // Setting an optional property to null removes it.
    Prop.ENTRY_FUNCTION_NAME.set(map, null);
    assertThat(map.containsKey(Prop.ENTRY_FUNCTION_NAME), is(false));
    assertThat(Prop.VERBOSITY.remove(map), is(3));
    assertThat(Prop.VERBOSITY.intValue(map), is(1));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.VERBOSITY.set(map, "3"));
    assertThat(e.getMessage(),
        is("value for property verbosity must have type "
            + Integer.class));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.LIFT.set(map, null));
    assertThat(e2.getMessage(), is("property lift is required"));
    final IllegalArgumentException e3 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.LIFT.intValue(map));
    assertThat(e3.getMessage(),
        is("invalid type " + Boolean.class + " for property lift"));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.LIFT.setLenient(map, "false");
    Prop.PRINT_DEPTH.setLenient(map, "5");
    Prop.DIRECTORY.setLenient(map, "/tmp/out");
    Prop.ENTRY_FUNCTION_NAME.setLenient(map, "M.main");
    assertThat(Prop.LIFT.booleanValue(map), is(false));
    assertThat(Prop.PRINT_DEPTH.intValue(map), is(5));
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("/tmp/out")));
    assertThat(Prop.ENTRY_FUNCTION_NAME.stringValue(map), is("M.main"));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.PRINT_DEPTH.setLenient(map, "deep"));
    assertThat(e.getMessage(),
        is("value for property printDepth must be an integer: deep"));
  }
}

// End PropTest.java
