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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import exm.sweep.engine.ChangeLog;
import exm.sweep.tree.Node;

/**
 * State shared by the passes of one simplification round
 */
public class SimplifierContext {
  public final CleanupProfile profile;

  /**
   * Tree as it was before the rewrite that triggered simplification, or
   * null if unknown
   */
  public final Node baseline;

  public final ChangeLog changeLog;

  /** Blocks that received the statements of a pruned branch */
  private final Set<Node> prunedBlocks =
          Collections.newSetFromMap(new IdentityHashMap<Node, Boolean>());

  public SimplifierContext(CleanupProfile profile, Node baseline,
                           ChangeLog changeLog) {
    this.profile = profile;
    this.baseline = baseline;
    this.changeLog = changeLog;
  }

  public void markPruned(Node block) {
    prunedBlocks.add(block);
  }

  public boolean isPruned(Node block) {
    return prunedBlocks.contains(block);
  }

  public boolean hasPrunedBlocks() {
    return !prunedBlocks.isEmpty();
  }
}
