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
package exm.sweep.match;

import java.util.List;

import exm.sweep.common.exceptions.SweepRuntimeError;
import exm.sweep.tree.Node;
import exm.sweep.tree.NodePath;

/**
 * Evaluates patterns against nodes.  Matching only looks at the subtree
 * rooted at the candidate node and never modifies anything.
 */
public class Matcher {

  /** Kind of the node bound by a capture around a repeat */
  public static final String SEQUENCE_KIND = "<sequence>";

  /**
   * @param pattern
   * @param node candidate node
   * @param path location of node, recorded in bindings
   * @return bindings if matched, null otherwise
   */
  public static BindingSet match(Pattern pattern, Node node, NodePath path) {
    return match(pattern, node, path, BindingSet.EMPTY);
  }

  public static boolean matches(Pattern pattern, Node node) {
    return match(pattern, node, NodePath.root()) != null;
  }

  private static BindingSet match(Pattern p, Node node, NodePath path,
                                  BindingSet b) {
    switch (p.kind) {
      case ANY:
        return b;
      case NODE:
        if (!p.nodeKind().equals(node.kind())) {
          return null;
        }
        if (p.subs() == null) {
          return b;
        } else if (p.isUnordered()) {
          return matchUnordered(p.subs(), 0, node, path,
                                new boolean[node.childCount()], b);
        } else {
          return matchSequence(p.subs(), 0, node, 0, path, b);
        }
      case LITERAL:
        if (p.nodeKind() != null && !p.nodeKind().equals(node.kind())) {
          return null;
        }
        return p.value().equals(node.text()) ? b : null;
      case TEXT:
        return p.regex().matcher(node.text()).matches() ? b : null;
      case FIELD:
        if (!p.fieldName().equals(node.field())) {
          return null;
        }
        return match(p.inner(), node, path, b);
      case CAPTURE:
        BindingSet inner = match(p.inner(), node, path, b);
        if (inner == null) {
          return null;
        }
        return inner.bind(p.captureName(), node, path);
      case ONE_OF:
        for (Pattern alt: p.subs()) {
          BindingSet res = match(alt, node, path, b);
          if (res != null) {
            return res;
          }
        }
        return null;
      case REPEAT:
        throw new SweepRuntimeError("repeat pattern outside child list: " + p);
      default:
        throw new SweepRuntimeError("Unknown pattern kind " + p.kind);
    }
  }

  /**
   * @return true if node stands for a run of siblings bound by a capture
   *         around a repeat
   */
  public static boolean isSequence(Node node) {
    return node != null && SEQUENCE_KIND.equals(node.kind());
  }

  /**
   * Match sub-patterns pi.. against children ci.. of parent, all of the
   * remaining children must be consumed.  Repeats are tried shortest
   * first.  A capture around a repeat binds the absorbed children,
   * wrapped in a sequence node.
   */
  private static BindingSet matchSequence(List<Pattern> pats, int pi,
            Node parent, int ci, NodePath path, BindingSet b) {
    int n = parent.childCount();
    if (pi == pats.size()) {
      return ci == n ? b : null;
    }
    Pattern p = pats.get(pi);
    Pattern rep = p.isSequenceCapture() ? p.inner() : p;
    if (rep.kind == Pattern.PatternKind.REPEAT) {
      for (int end = ci; end <= n; end++) {
        if (end > ci) {
          int last = end - 1;
          if (match(rep.inner(), parent.child(last), path.child(last), b)
                  == null) {
            break;
          }
        }
        BindingSet next = b;
        if (rep != p) {
          Node run = Node.create(SEQUENCE_KIND,
                                 parent.children().subList(ci, end));
          next = b.bind(p.captureName(), run, path);
          if (next == null) {
            continue;
          }
        }
        BindingSet res = matchSequence(pats, pi + 1, parent, end, path,
                                       next);
        if (res != null) {
          return res;
        }
      }
      return null;
    }
    if (ci >= n) {
      return null;
    }
    BindingSet res = match(p, parent.child(ci), path.child(ci), b);
    if (res == null) {
      return null;
    }
    return matchSequence(pats, pi + 1, parent, ci + 1, path, res);
  }

  private static BindingSet matchUnordered(List<Pattern> pats, int pi,
          Node parent, NodePath path, boolean used[], BindingSet b) {
    if (pi == pats.size()) {
      return b;
    }
    Pattern p = pats.get(pi);
    for (int ci = 0; ci < parent.childCount(); ci++) {
      if (used[ci]) {
        continue;
      }
      BindingSet res = match(p, parent.child(ci), path.child(ci), b);
      if (res != null) {
        used[ci] = true;
        BindingSet rest = matchUnordered(pats, pi + 1, parent, path, used,
                                         res);
        if (rest != null) {
          return rest;
        }
        used[ci] = false;
      }
    }
    return null;
  }
}
