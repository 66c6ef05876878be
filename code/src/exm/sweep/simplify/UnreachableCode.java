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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sweep.common.Settings;
import exm.sweep.simplify.CleanupProfile.ConditionalShape;
import exm.sweep.tree.Node;

/**
 * Delete statements that follow an always-terminating statement, in
 * blocks that just received the statements of a pruned branch.  Code the
 * author wrote after a return is left alone.
 */
public class UnreachableCode implements SimplifierPass {

  public static final String CHANGE_NAME = "simplify:unreachable";

  @Override
  public String getPassName() {
    return "Unreachable code removal";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.SIMPLIFY_UNREACHABLE;
  }

  @Override
  public Node simplify(Logger logger, SimplifierContext context, Node root) {
    if (!context.hasPrunedBlocks()) {
      return root;
    }
    return removeUnreachable(logger, context, root);
  }

  private static Node removeUnreachable(Logger logger,
                          SimplifierContext context, Node node) {
    CleanupProfile p = context.profile;
    // Check mark before rebuilding changes identity
    boolean marked = p.isBlock(node) && context.isPruned(node);
    List<Node> children = new ArrayList<Node>(node.childCount());
    boolean changed = false;
    for (Node child: node.children()) {
      Node newChild = removeUnreachable(logger, context, child);
      changed = changed || newChild != child;
      children.add(newChild);
    }

    if (marked) {
      boolean terminated = false;
      List<Node> kept = new ArrayList<Node>(children.size());
      for (Node child: children) {
        if (p.isDelimiter(child)) {
          kept.add(child);
        } else if (terminated) {
          logger.trace("Removing unreachable " + child.kind() + " at " +
                       child.span());
          context.changeLog.add(CHANGE_NAME, child.span(), null);
          changed = true;
        } else {
          kept.add(child);
          terminated = alwaysTerminates(p, child);
        }
      }
      children = kept;
    }
    return changed ? node.withChildren(children) : node;
  }

  /**
   * Conservative: anything not known to terminate is assumed to fall
   * through.
   */
  static boolean alwaysTerminates(CleanupProfile p, Node stmt) {
    if (stmt == null) {
      return false;
    }
    if (p.isTerminator(stmt)) {
      return true;
    }
    if (p.isBlock(stmt)) {
      List<Node> stmts = BranchPrune.meaningful(p, stmt);
      for (Node s: stmts) {
        if (alwaysTerminates(p, s)) {
          return true;
        }
      }
      return false;
    }
    ConditionalShape cond = p.conditional();
    if (cond != null && cond.matches(stmt)) {
      Node alt = BranchPrune.unwrapElse(p, cond.alternative(stmt));
      return alt != null && alwaysTerminates(p, cond.consequence(stmt)) &&
             alwaysTerminates(p, alt);
    }
    return false;
  }
}
