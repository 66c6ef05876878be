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
package exm.sweep.tree;

import java.util.ArrayList;
import java.util.List;

import exm.sweep.common.util.StackLite;

public class TreeWalk {

  /**
   * Walk pre-order, so that an enclosing construct is visited before
   * anything inside it
   * @param root
   * @param walker
   */
  public static void walk(Node root, TreeWalker walker) {
    walk(root, NodePath.root(), new StackLite<Node>(), walker);
  }

  private static void walk(Node node, NodePath path,
                           StackLite<Node> ancestors, TreeWalker walker) {
    boolean descend = walker.visit(node, path, ancestors);
    if (!descend) {
      return;
    }
    ancestors.push(node);
    for (int i = 0; i < node.childCount(); i++) {
      walk(node.child(i), path.child(i), ancestors, walker);
    }
    ancestors.pop();
    walker.leave(node, path);
  }

  /**
   * @return all nodes in pre-order
   */
  public static List<Node> preorder(Node root) {
    final List<Node> res = new ArrayList<Node>();
    walk(root, new TreeWalker() {
      @Override
      public boolean visit(Node node, NodePath path, List<Node> ancestors) {
        res.add(node);
        return true;
      }
    });
    return res;
  }

  public static abstract class TreeWalker {
    /**
     * @param node
     * @param path location of node in tree being walked
     * @param ancestors ancestors of node, root first.  Only valid for the
     *        duration of the call.
     * @return false to skip the children of node
     */
    public abstract boolean visit(Node node, NodePath path,
                                  List<Node> ancestors);

    /**
     * Called after the children of a node were walked.  Not called for
     * nodes whose children were skipped.
     */
    public void leave(Node node, NodePath path) {
      // Nothing by default
    }
  }
}
