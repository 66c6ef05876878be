/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sweep.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.sweep.tree.Node;
import exm.sweep.tree.Revision;

/**
 * Outcome of one run of the driver over a tree
 */
public class RewriteResult {
  private final Revision revision;
  private final DriverState state;
  private final int iterations;
  private final ChangeLog changeLog;
  private final List<String> diagnostics;
  private final List<MatchReport> matches;

  RewriteResult(Revision revision, DriverState state, int iterations,
                ChangeLog changeLog, List<String> diagnostics,
                List<MatchReport> matches) {
    assert(state.isTerminal());
    this.revision = revision;
    this.state = state;
    this.iterations = iterations;
    this.changeLog = changeLog;
    this.diagnostics = Collections.unmodifiableList(
                              new ArrayList<String>(diagnostics));
    this.matches = Collections.unmodifiableList(
                              new ArrayList<MatchReport>(matches));
  }

  public Revision revision() {
    return revision;
  }

  public Node root() {
    return revision.root();
  }

  /**
   * @return CONVERGED or BUDGET_EXHAUSTED
   */
  public DriverState state() {
    return state;
  }

  public boolean isConverged() {
    return state == DriverState.CONVERGED;
  }

  public boolean isBudgetExhausted() {
    return state == DriverState.BUDGET_EXHAUSTED;
  }

  /**
   * @return number of rewriting phases
   */
  public int iterations() {
    return iterations;
  }

  public ChangeLog changeLog() {
    return changeLog;
  }

  /**
   * @return problems that did not stop the run
   */
  public List<String> diagnostics() {
    return diagnostics;
  }

  /**
   * @return matches of rules with no replacement
   */
  public List<MatchReport> matches() {
    return matches;
  }

  @Override
  public String toString() {
    return state + " after " + iterations + " iterations, " +
           changeLog.size() + " edits";
  }
}
