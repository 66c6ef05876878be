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
package exm.sweep.simplify;

import org.apache.log4j.Logger;

import exm.sweep.common.Settings;
import exm.sweep.common.exceptions.InvalidOptionException;
import exm.sweep.engine.ChangeLog;
import exm.sweep.tree.Node;

/**
 * Removes code made dead by constant conditions.  Folding can expose a
 * constant branch, pruning can leave unreachable statements and unused
 * bindings, and removing those can enable more folding, so the passes
 * are repeated until a round changes nothing.
 */
public class DeadCodeSimplifier {

  private final CleanupProfile profile;
  private final SimplifierPipeline pipeline;
  private final long maxRounds;

  public DeadCodeSimplifier(CleanupProfile profile, long maxRounds) {
    this.profile = profile;
    this.maxRounds = maxRounds;
    this.pipeline = new SimplifierPipeline();
    pipeline.addPass(new ConstantFold());
    pipeline.addPass(new BranchPrune());
    pipeline.addPass(new UnreachableCode());
    pipeline.addPass(new UnusedBindings());
  }

  public static DeadCodeSimplifier fromSettings(CleanupProfile profile)
                                        throws InvalidOptionException {
    return new DeadCodeSimplifier(profile,
                     Settings.getPositiveLong(Settings.SIMPLIFY_MAX_PASSES));
  }

  public CleanupProfile profile() {
    return profile;
  }

  /**
   * @param logger
   * @param root tree to simplify
   * @param baseline tree before the rewrite that made code dead, used to
   *        tell which bindings lost their last use.  May be null.
   * @param changeLog receives an entry per simplification
   * @return simplified tree, or root if nothing changed
   */
  public Node simplify(Logger logger, Node root, Node baseline,
                       ChangeLog changeLog) {
    Node curr = root;
    for (long round = 1; round <= maxRounds; round++) {
      SimplifierContext context = new SimplifierContext(profile, baseline,
                                                        changeLog);
      Node next = pipeline.runPipeline(logger, context, curr, round);
      if (next == curr) {
        logger.debug("Simplifier converged after " + round + " rounds");
        return curr;
      }
      curr = next;
    }
    logger.debug("Simplifier stopped after " + maxRounds + " rounds");
    return curr;
  }
}
