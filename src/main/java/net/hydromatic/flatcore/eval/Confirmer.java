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

/**
 * Asks the user whether to continue a search.
 *
 * <p>Called after each result when running interactively, and after each
 * step when stepping through evaluation.
 */
public interface Confirmer {
  /**
   * Asks whether to continue.
   *
   * @param prompt Description of the state of the search, for example the
   *     result that has just been produced
   * @return Answer
   */
  Answer confirm(String prompt);

  /** Answer to a confirmation request. */
  enum Answer {
    /** Continue to the next result or step, and ask again. */
    MORE,
    /** Continue without asking again. */
    ALL,
    /** Stop the search. */
    STOP
  }
}

// End Confirmer.java
