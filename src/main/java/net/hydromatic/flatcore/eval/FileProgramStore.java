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

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import net.hydromatic.flatcore.ast.Flat;

/**
 * Program store that writes each program to a file in a directory.
 *
 * <p>The file is called "<i>module</i>.lifted", and contains the program as
 * printed by {@link Flat.Program#toString()}.
 */
public class FileProgramStore implements ProgramStore {
  private final File directory;

  public FileProgramStore(File directory) {
    this.directory = requireNonNull(directory);
  }

  /** Returns the file in which a module is stored. */
  public File file(String moduleName) {
    return new File(directory, moduleName + SUFFIX);
  }

  @Override
  public void store(Flat.Program program) {
    final File file = file(program.name);
    try {
      Files.write(file.toPath(),
          program.toString().getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("error writing " + file, e);
    }
  }
}

// End FileProgramStore.java
