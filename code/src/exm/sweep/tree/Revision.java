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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.sweep.common.exceptions.SweepRuntimeError;

/**
 * Immutable snapshot of a whole tree.  Rewriting never changes a
 * revision; {@link #apply(List, Set)} builds the next one, re-creating
 * only the ancestors of the edited sites so that every untouched subtree
 * is shared with this revision.
 */
public class Revision {

  private final int number;
  private final Node root;

  private Revision(int number, Node root) {
    this.number = number;
    this.root = root;
  }

  public static Revision initial(Node root) {
    if (root == null) {
      throw new SweepRuntimeError("Revision needs a root node");
    }
    return new Revision(0, root);
  }

  public int number() {
    return number;
  }

  public Node root() {
    return root;
  }

  /**
   * Successor revision with a new root, for passes that rebuild the tree
   * themselves
   */
  public Revision next(Node newRoot) {
    return new Revision(number + 1, newRoot);
  }

  public Node resolve(NodePath path) {
    Node curr = root;
    for (int level = 0; level < path.depth(); level++) {
      int i = path.index(level);
      if (i >= curr.childCount()) {
        throw new SweepRuntimeError("Path " + path + " does not exist in "
                                    + "revision " + number);
      }
      curr = curr.child(i);
    }
    return curr;
  }

  /**
   * Ancestors of the node at path, nearest first, root last
   */
  public List<Node> ancestors(NodePath path) {
    List<Node> res = new ArrayList<Node>(path.depth());
    Node curr = root;
    for (int level = 0; level < path.depth(); level++) {
      res.add(curr);
      curr = curr.child(path.index(level));
    }
    Collections.reverse(res);
    return res;
  }

  /**
   * Where an edit ended up in the new revision
   */
  public static class EditSite {
    public final TreeEdit edit;
    /** Ancestors of the edited position in the new revision, nearest first */
    public final List<Node> ancestors = new ArrayList<Node>();
    /** Extra nodes removed along with a deleted list element */
    public final List<Node> removedSeparators = new ArrayList<Node>();

    private EditSite(TreeEdit edit) {
      this.edit = edit;
    }

    public Node parent() {
      return ancestors.isEmpty() ? null : ancestors.get(0);
    }
  }

  public static class Applied {
    public final Revision revision;
    /** One site per edit, in the order edits were given */
    public final List<EditSite> sites;

    private Applied(Revision revision, List<EditSite> sites) {
      this.revision = revision;
      this.sites = Collections.unmodifiableList(sites);
    }
  }

  /**
   * Apply a batch of non-overlapping edits, all expressed as paths in this
   * revision.
   * @param edits
   * @param separatorKinds kinds of separator leaves in list-like
   *        constructs; deleting an element also deletes one adjacent
   *        separator
   * @return the new revision and the site of each edit within it
   */
  public Applied apply(List<TreeEdit> edits, Set<String> separatorKinds) {
    Map<NodePath, Integer> editAt = new HashMap<NodePath, Integer>();
    List<NodePath> sorted = new ArrayList<NodePath>();
    for (int i = 0; i < edits.size(); i++) {
      NodePath p = edits.get(i).path;
      if (editAt.put(p, i) != null) {
        throw new SweepRuntimeError("Two edits at " + p);
      }
      sorted.add(p);
    }
    Collections.sort(sorted);
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i - 1).isPrefixOf(sorted.get(i))) {
        throw new SweepRuntimeError("Overlapping edits at " +
                        sorted.get(i - 1) + " and " + sorted.get(i));
      }
    }

    List<EditSite> sites = new ArrayList<EditSite>(edits.size());
    for (TreeEdit e: edits) {
      sites.add(new EditSite(e));
    }

    Integer rootEdit = editAt.get(NodePath.root());
    if (rootEdit != null) {
      TreeEdit e = edits.get(rootEdit);
      if (e.replacement.size() != 1) {
        throw new SweepRuntimeError("Root must be replaced by exactly one " +
                                    "node: " + e);
      }
      return new Applied(next(e.replacement.get(0)), sites);
    }

    Set<NodePath> onEditPath = new HashSet<NodePath>();
    for (NodePath p: sorted) {
      NodePath curr = p;
      while (!curr.isRoot()) {
        curr = curr.parent();
        if (!onEditPath.add(curr)) {
          break;
        }
      }
    }

    Node newRoot = rebuild(root, NodePath.root(), edits, editAt, onEditPath,
                           sites, separatorKinds, new ArrayList<Integer>());
    return new Applied(next(newRoot), sites);
  }

  private static Node rebuild(Node node, NodePath path, List<TreeEdit> edits,
      Map<NodePath, Integer> editAt, Set<NodePath> onEditPath,
      List<EditSite> sites, Set<String> separatorKinds,
      List<Integer> editsBelow) {
    int n = node.childCount();
    // Replacement list for each original child position
    List<List<Node>> slots = new ArrayList<List<Node>>(n);
    boolean[] deleted = new boolean[n];
    List<Integer> below = new ArrayList<Integer>();
    boolean changed = false;

    for (int i = 0; i < n; i++) {
      Node child = node.child(i);
      NodePath childPath = path.child(i);
      Integer e = editAt.get(childPath);
      if (e != null) {
        List<Node> repl = edits.get(e).replacement;
        slots.add(repl);
        deleted[i] = repl.isEmpty();
        below.add(e);
        changed = true;
      } else if (onEditPath.contains(childPath)) {
        Node newChild = rebuild(child, childPath, edits, editAt, onEditPath,
                                sites, separatorKinds, below);
        slots.add(Collections.singletonList(newChild));
        changed = changed || newChild != child;
      } else {
        slots.add(Collections.singletonList(child));
      }
    }

    if (!changed) {
      return node;
    }

    boolean[] dropped = new boolean[n];
    if (separatorKinds != null && !separatorKinds.isEmpty()) {
      for (int i = 0; i < n; i++) {
        if (deleted[i]) {
          int sep = findSeparator(node, i, deleted, dropped, separatorKinds);
          if (sep >= 0) {
            dropped[sep] = true;
            Integer e = editAt.get(path.child(i));
            sites.get(e).removedSeparators.add(node.child(sep));
          }
        }
      }
    }

    List<Node> newChildren = new ArrayList<Node>(n);
    for (int i = 0; i < n; i++) {
      if (!dropped[i]) {
        newChildren.addAll(slots.get(i));
      }
    }
    Node result = node.withChildren(newChildren);
    for (int e: below) {
      sites.get(e).ancestors.add(result);
    }
    editsBelow.addAll(below);
    return result;
  }

  /**
   * Find the separator to drop along with deleted element i: the next
   * surviving sibling if it is a separator, otherwise the previous one.
   * @return index of separator, or -1 if none
   */
  private static int findSeparator(Node parent, int i, boolean[] deleted,
                  boolean[] dropped, Set<String> separatorKinds) {
    int n = parent.childCount();
    for (int j = i + 1; j < n; j++) {
      if (deleted[j] || dropped[j]) {
        continue;
      }
      if (separatorKinds.contains(parent.child(j).kind())) {
        return j;
      }
      break;
    }
    for (int j = i - 1; j >= 0; j--) {
      if (deleted[j] || dropped[j]) {
        continue;
      }
      if (separatorKinds.contains(parent.child(j).kind())) {
        return j;
      }
      break;
    }
    return -1;
  }

  @Override
  public String toString() {
    return "Revision " + number + ": " + root;
  }
}
