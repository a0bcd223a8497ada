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
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;

/** Implementations of {@link Confirmer}. */
public abstract class Confirmers {
  private Confirmers() {}

  /**
   * Returns a confirmer that gives a fixed sequence of answers, then
   * {@link Confirmer.Answer#STOP}. Each prompt is passed to a consumer.
   */
  public static Confirmer of(Consumer<String> prompts,
      List<Confirmer.Answer> answers) {
    return new FixedConfirmer(prompts, answers);
  }

  /** Returns a confirmer that reads answers from a terminal. */
  public static Confirmer of(Terminal terminal) {
    final LineReader lineReader = LineReaderBuilder.builder()
        .appName("flatcore")
        .terminal(terminal)
        .build();
    return of(lineReader);
  }

  /**
   * Returns a confirmer that reads answers from a line reader.
   *
   * <p>"y", "yes" or an empty line means {@link Confirmer.Answer#MORE};
   * "a" or "all" means {@link Confirmer.Answer#ALL}; anything else, end of
   * input, or an interrupt means {@link Confirmer.Answer#STOP}.
   */
  public static Confirmer of(LineReader lineReader) {
    return new LineReaderConfirmer(lineReader);
  }

  /** Converts a line of user input into an answer. */
  static Confirmer.Answer parse(String line) {
    switch (line.trim().toLowerCase(Locale.ROOT)) {
    case "":
    case "y":
    case "yes":
      return Confirmer.Answer.MORE;
    case "a":
    case "all":
      return Confirmer.Answer.ALL;
    default:
      return Confirmer.Answer.STOP;
    }
  }

  /** Confirmer that gives a fixed sequence of answers. */
  private static class FixedConfirmer implements Confirmer {
    private final Consumer<String> prompts;
    private final Iterator<Answer> answers;

    FixedConfirmer(Consumer<String> prompts, List<Answer> answers) {
      this.prompts = requireNonNull(prompts);
      this.answers = ImmutableList.copyOf(answers).iterator();
    }

    @Override
    public Answer confirm(String prompt) {
      prompts.accept(prompt);
      return answers.hasNext() ? answers.next() : Answer.STOP;
    }
  }

  /** Confirmer that reads from JLine's line reader. */
  private static class LineReaderConfirmer implements Confirmer {
    private final LineReader lineReader;

    LineReaderConfirmer(LineReader lineReader) {
      this.lineReader = requireNonNull(lineReader);
    }

    @Override
    public Answer confirm(String prompt) {
      final String line;
      try {
        line = lineReader.readLine(prompt + " More? [Y(es)/n(o)/a(ll)] ");
      } catch (UserInterruptException | EndOfFileException e) {
        return Answer.STOP;
      }
      return parse(line);
    }
  }
}

// End Confirmers.java
