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
import exm.sweep.common.util.TernaryLogic.Ternary;
import exm.sweep.simplify.CleanupProfile.OperatorShape;
import exm.sweep.tree.Node;

/**
 * Short-circuit folding of boolean operators and parentheses around
 * boolean literals.  A literal on the right of an operator only absorbs
 * the left operand if evaluating the left operand has no effects.
 */
public class ConstantFold implements SimplifierPass {

  public static final String CHANGE_NAME = "simplify:constant-fold";

  @Override
  public String getPassName() {
    return "Constant folding";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.SIMPLIFY_CONSTANT_FOLD;
  }

  @Override
  public Node simplify(Logger logger, SimplifierContext context, Node root) {
    if (!context.profile.hasBooleans()) {
      return root;
    }
    return fold(logger, context, root);
  }

  private static Node fold(Logger logger, SimplifierContext context,
                           Node node) {
    List<Node> children = new ArrayList<Node>(node.childCount());
    boolean changed = false;
    for (Node child: node.children()) {
      Node newChild = fold(logger, context, child);
      changed = changed || newChild != child;
      children.add(newChild);
    }
    Node curr = changed ? node.withChildren(children) : node;
    Node folded = foldNode(context.profile, curr);
    if (folded != curr) {
      if (logger.isTraceEnabled()) {
        logger.trace("Folded " + curr + " to " + folded);
      }
      context.changeLog.add(CHANGE_NAME, node.span(), folded.span());
    }
    return folded;
  }

  /**
   * Fold a single node whose children are already folded
   * @return folded node, or node itself
   */
  static Node foldNode(CleanupProfile p, Node node) {
    if (p.isParenthesized(node)) {
      Node inner = p.unparenthesize(node);
      if (inner != null) {
        Ternary t = p.truth(inner);
        if (t.isKnown()) {
          return p.booleanLiteral(t == Ternary.TRUE, node.field(),
                                  node.span());
        }
      }
      return node;
    }

    OperatorShape not = p.not();
    if (not != null && not.matches(node)) {
      List<Node> ops = not.operands(node);
      if (ops.size() == 1) {
        Ternary t = Ternary.not(p.truth(ops.get(0)));
        if (t.isKnown()) {
          return p.booleanLiteral(t == Ternary.TRUE, node.field(),
                                  node.span());
        }
      }
      return node;
    }

    OperatorShape and = p.and();
    if (and != null && and.matches(node)) {
      return foldBinary(p, node, and.operands(node), false);
    }
    OperatorShape or = p.or();
    if (or != null && or.matches(node)) {
      return foldBinary(p, node, or.operands(node), true);
    }
    return node;
  }

  /**
   * @param absorbing the literal value that decides the result: true for
   *        or, false for and
   */
  private static Node foldBinary(CleanupProfile p, Node node,
                                 List<Node> ops, boolean absorbing) {
    if (ops.size() != 2) {
      return node;
    }
    Node left = ops.get(0);
    Node right = ops.get(1);
    Ternary absorb = Ternary.fromBool(absorbing);
    Ternary neutral = Ternary.fromBool(!absorbing);
    Ternary tl = p.truth(left);
    Ternary tr = p.truth(right);
    if (tl.isKnown() && tr.isKnown()) {
      Ternary t = absorbing ? Ternary.or(tl, tr) : Ternary.and(tl, tr);
      return p.booleanLiteral(t == Ternary.TRUE, node.field(), node.span());
    } else if (tl == absorb) {
      return p.booleanLiteral(absorbing, node.field(), node.span());
    } else if (tl == neutral) {
      return right.withField(node.field());
    } else if (tr == neutral) {
      return left.withField(node.field());
    } else if (tr == absorb && p.isPure(left)) {
      return p.booleanLiteral(absorbing, node.field(), node.span());
    }
    return node;
  }
}
