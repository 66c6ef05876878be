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
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sweep.common.Settings;
import exm.sweep.common.util.TernaryLogic.Ternary;
import exm.sweep.simplify.CleanupProfile.ConditionalShape;
import exm.sweep.tree.Node;
import exm.sweep.tree.Span;

/**
 * Replace conditionals whose condition is a boolean literal with the
 * branch that is always taken.  Inside a block, the statements of the
 * taken branch are flattened into the enclosing block, and that block is
 * marked for unreachable code removal.
 */
public class BranchPrune implements SimplifierPass {

  public static final String CHANGE_NAME = "simplify:branch-prune";

  @Override
  public String getPassName() {
    return "Branch pruning";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.SIMPLIFY_BRANCH_PRUNE;
  }

  @Override
  public Node simplify(Logger logger, SimplifierContext context, Node root) {
    CleanupProfile p = context.profile;
    if (!p.hasBooleans() ||
        (p.conditional() == null && p.ternary() == null)) {
      return root;
    }
    Pruned res = prune(logger, context, root, false);
    if (res.nodes.size() != 1) {
      // Root can't vanish: leave it as it was
      return root;
    }
    return res.nodes.get(0);
  }

  /** Result of pruning one node */
  private static class Pruned {
    final List<Node> nodes;
    /** True if a conditional was replaced by its branch */
    final boolean branchTaken;

    Pruned(List<Node> nodes, boolean branchTaken) {
      this.nodes = nodes;
      this.branchTaken = branchTaken;
    }

    static Pruned same(Node node) {
      return new Pruned(Collections.singletonList(node), false);
    }
  }

  /**
   * @param inBlock whether node is a direct child of a block
   */
  private static Pruned prune(Logger logger, SimplifierContext context,
                              Node node, boolean inBlock) {
    CleanupProfile p = context.profile;
    boolean isBlock = p.isBlock(node);
    List<Node> children = new ArrayList<Node>(node.childCount());
    boolean changed = false;
    boolean flattened = false;
    for (Node child: node.children()) {
      Pruned r = prune(logger, context, child, isBlock);
      if (r.nodes.size() != 1 || r.nodes.get(0) != child) {
        changed = true;
      }
      flattened = flattened || r.branchTaken;
      children.addAll(r.nodes);
    }
    Node curr = changed ? node.withChildren(children) : node;

    if (isBlock && flattened) {
      context.markPruned(curr);
    }

    if (p.isElseClause(curr) && changed && meaningful(p, curr).isEmpty()) {
      // Nothing left after else
      return new Pruned(Collections.<Node>emptyList(), false);
    }

    ConditionalShape cond = p.conditional();
    if (cond != null && cond.matches(curr)) {
      Ternary t = conditionTruth(p, cond.condition(curr));
      if (t.isKnown()) {
        Node taken = (t == Ternary.TRUE) ? cond.consequence(curr) :
                                   unwrapElse(p, cond.alternative(curr));
        logPrune(logger, context, curr, taken);
        return takeBranch(p, curr, taken, inBlock);
      }
    }

    ConditionalShape ternary = p.ternary();
    if (ternary != null && ternary.matches(curr)) {
      Ternary t = conditionTruth(p, ternary.condition(curr));
      Node taken = (t == Ternary.TRUE) ? ternary.consequence(curr) :
                   (t == Ternary.FALSE) ? ternary.alternative(curr) : null;
      if (taken != null) {
        logPrune(logger, context, curr, taken);
        return new Pruned(Collections.singletonList(
                              taken.withField(curr.field())), false);
      }
    }
    return Pruned.same(curr);
  }

  private static Ternary conditionTruth(CleanupProfile p, Node condition) {
    Node c = condition;
    while (c != null && p.isParenthesized(c)) {
      c = p.unparenthesize(c);
    }
    return c == null ? Ternary.MAYBE : p.truth(c);
  }

  private static void logPrune(Logger logger, SimplifierContext context,
                               Node conditional, Node taken) {
    Span repl = taken == null ? null : taken.span();
    if (logger.isTraceEnabled()) {
      logger.trace("Pruned conditional at " + conditional.span() +
                   ", taking " + (taken == null ? "nothing" : repl));
    }
    context.changeLog.add(CHANGE_NAME, conditional.span(), repl);
  }

  private static Pruned takeBranch(CleanupProfile p, Node conditional,
                                   Node taken, boolean inBlock) {
    if (taken == null) {
      if (inBlock || conditional.field() != null) {
        return new Pruned(Collections.<Node>emptyList(), true);
      }
      // Needs to remain a statement: leave an empty block
      Node cons = p.conditional().consequence(conditional);
      return new Pruned(Collections.singletonList(
            cons.withChildren(delimiters(p, cons)).withField(null)), true);
    }
    if (inBlock && p.isBlock(taken)) {
      return new Pruned(meaningful(p, taken), true);
    }
    return new Pruned(Collections.singletonList(
                          taken.withField(conditional.field())), true);
  }

  /**
   * @return the branch inside an else clause, or the node itself
   */
  static Node unwrapElse(CleanupProfile p, Node alternative) {
    if (alternative == null || !p.isElseClause(alternative)) {
      return alternative;
    }
    List<Node> inner = meaningful(p, alternative);
    return inner.isEmpty() ? null : inner.get(inner.size() - 1);
  }

  /**
   * @return children that are not delimiters
   */
  static List<Node> meaningful(CleanupProfile p, Node node) {
    List<Node> res = new ArrayList<Node>(node.childCount());
    for (Node c: node.children()) {
      if (!p.isDelimiter(c)) {
        res.add(c);
      }
    }
    return res;
  }

  private static List<Node> delimiters(CleanupProfile p, Node node) {
    List<Node> res = new ArrayList<Node>();
    for (Node c: node.children()) {
      if (p.isDelimiter(c)) {
        res.add(c);
      }
    }
    return res;
  }
}
