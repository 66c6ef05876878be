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
import java.util.Map;

import org.apache.log4j.Logger;

import exm.sweep.common.Settings;
import exm.sweep.common.util.Pair;
import exm.sweep.simplify.Scopes.Declaration;
import exm.sweep.tree.Node;
import exm.sweep.tree.Span;

/**
 * Delete local declarations whose last uses were removed.  A declaration
 * that was already unused before the triggering rewrite is left alone,
 * as is one whose initializer may have effects.
 */
public class UnusedBindings implements SimplifierPass {

  public static final String CHANGE_NAME = "simplify:unused-binding";

  @Override
  public String getPassName() {
    return "Unused binding removal";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.SIMPLIFY_UNUSED_BINDINGS;
  }

  @Override
  public Node simplify(Logger logger, SimplifierContext context, Node root) {
    CleanupProfile p = context.profile;
    if (context.baseline == null || p.declarations().isEmpty()) {
      return root;
    }
    Map<Pair<Span, List<String>>, int[]> before =
            Scopes.usageCounts(p, context.baseline);
    if (before.isEmpty()) {
      return root;
    }
    Map<Pair<Span, List<String>>, int[]> after =
            Scopes.usageCounts(p, root);
    return remove(logger, context, root, before, after);
  }

  private static Node remove(Logger logger, SimplifierContext context,
          Node node, Map<Pair<Span, List<String>>, int[]> before,
          Map<Pair<Span, List<String>>, int[]> after) {
    CleanupProfile p = context.profile;
    boolean block = p.isBlock(node);
    List<Node> children = new ArrayList<Node>(node.childCount());
    boolean changed = false;
    for (Node child: node.children()) {
      if (block) {
        Declaration d = Scopes.declaration(p, child);
        if (d != null && lostAllUses(d, before, after) &&
            (d.initializer == null || p.isPure(d.initializer))) {
          logger.trace("Removing unused binding of " + d.names + " at " +
                       child.span());
          context.changeLog.add(CHANGE_NAME, child.span(), null);
          changed = true;
          continue;
        }
      }
      Node newChild = remove(logger, context, child, before, after);
      changed = changed || newChild != child;
      children.add(newChild);
    }
    return changed ? node.withChildren(children) : node;
  }

  private static boolean lostAllUses(Declaration d,
          Map<Pair<Span, List<String>>, int[]> before,
          Map<Pair<Span, List<String>>, int[]> after) {
    Pair<Span, List<String>> key = d.key();
    if (key == null || d.names.isEmpty()) {
      return false;
    }
    int[] b = before.get(key);
    int[] a = after.get(key);
    if (b == null || a == null) {
      return false;
    }
    boolean usedBefore = false;
    for (int i = 0; i < a.length; i++) {
      if (a[i] > 0) {
        return false;
      }
      usedBefore = usedBefore || b[i] > 0;
    }
    return usedBefore;
  }
}
