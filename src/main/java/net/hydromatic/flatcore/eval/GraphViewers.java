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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/** Implementations of {@link GraphViewer}. */
public abstract class GraphViewers {
  private GraphViewers() {}

  /**
   * Returns a viewer that writes each snapshot to a file
   * "step<i>N</i>.dot" in a directory, then runs a command with the file
   * name as its last argument, and waits for the command to finish.
   *
   * <p>If the command is empty, only writes the file.
   */
  public static GraphViewer command(File directory, String command) {
    return new CommandGraphViewer(directory, command);
  }

  /** Viewer that writes a file and invokes an external command. */
  private static class CommandGraphViewer implements GraphViewer {
    private final File directory;
    private final ImmutableList<String> command;

    CommandGraphViewer(File directory, String command) {
      this.directory = requireNonNull(directory);
      this.command =
          ImmutableList.copyOf(
              Splitter.on(' ').omitEmptyStrings().trimResults()
                  .split(command));
    }

    @Override
    public void view(GraphSnapshot snapshot, int step) {
      final File file = new File(directory, "step" + step + ".dot");
      try {
        Files.write(file.toPath(),
            snapshot.toDot().getBytes(StandardCharsets.UTF_8));
        if (command.isEmpty()) {
          return;
        }
        final List<String> args = new ArrayList<>(command);
        args.add(file.getPath());
        final Process process =
            new ProcessBuilder(args)
                .directory(directory.getAbsoluteFile())
                .inheritIO()
                .start();
        final int status = process.waitFor();
        if (status != 0) {
          throw new IllegalStateException("viewer command " + args
              + " failed with status " + status);
        }
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("interrupted while viewing "
            + file, e);
      }
    }
  }
}

// End GraphViewers.java
