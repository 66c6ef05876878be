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
import java.util.List;

/**
 * Replacement of the node at a path by zero or more nodes.  Zero nodes
 * is a deletion, more than one splices the nodes into the parent's
 * child list in place of the original.
 */
public class TreeEdit {
  public final NodePath path;
  public final List<Node> replacement;

  private TreeEdit(NodePath path, List<Node> replacement) {
    this.path = path;
    this.replacement = Collections.unmodifiableList(
                              new ArrayList<Node>(replacement));
  }

  public static TreeEdit replace(NodePath path, Node node) {
    return new TreeEdit(path, Collections.singletonList(node));
  }

  public static TreeEdit splice(NodePath path, List<Node> nodes) {
    return new TreeEdit(path, nodes);
  }

  public static TreeEdit delete(NodePath path) {
    return new TreeEdit(path, Collections.<Node>emptyList());
  }

  public boolean isDeletion() {
    return replacement.isEmpty();
  }

  @Override
  public String toString() {
    return (isDeletion() ? "delete " : "replace ") + path +
           (isDeletion() ? "" : " with " + replacement);
  }
}
