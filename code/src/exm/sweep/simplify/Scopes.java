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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.sweep.common.util.Pair;
import exm.sweep.simplify.CleanupProfile.DeclarationShape;
import exm.sweep.tree.Node;
import exm.sweep.tree.Span;
import exm.sweep.tree.TreeWalk;

/**
 * Lexical scope analysis over blocks: which names each declaration binds
 * and how many times they are used in the rest of the block.
 *
 * A nested block that redeclares a name shadows it from that point on,
 * and uses after the redeclaration are not counted.
 */
public class Scopes {

  /** Declaration statement with its names */
  public static class Declaration {
    public final Node node;
    public final List<String> names;
    /** Initializer expression, may be null */
    public final Node initializer;

    Declaration(Node node, List<String> names, Node initializer) {
      this.node = node;
      this.names = Collections.unmodifiableList(names);
      this.initializer = initializer;
    }

    /**
     * Identifies the declaration across revisions.  Null if the
     * declaration has no known source location.
     */
    public Pair<Span, List<String>> key() {
      if (!node.span().isKnown()) {
        return null;
      }
      return Pair.create(node.span(), names);
    }
  }

  /**
   * @return declaration if node is one, else null
   */
  public static Declaration declaration(CleanupProfile p, Node node) {
    DeclarationShape shape = p.declarationShape(node);
    if (shape == null) {
      return null;
    }
    List<String> names = new ArrayList<String>();
    Node namesNode = node.childByField(shape.namesField);
    if (namesNode != null) {
      for (Node n: TreeWalk.preorder(namesNode)) {
        if (p.isIdentifier(n)) {
          names.add(n.value());
        }
      }
    }
    Node init = shape.valueField == null ? null :
                node.childByField(shape.valueField);
    return new Declaration(node, names, init);
  }

  /**
   * Count uses of every declared name in every block of the tree
   * @return map from declaration key to use count per name
   */
  public static Map<Pair<Span, List<String>>, int[]> usageCounts(
                                          CleanupProfile p, Node root) {
    Map<Pair<Span, List<String>>, int[]> res =
            new HashMap<Pair<Span, List<String>>, int[]>();
    if (p.declarations().isEmpty()) {
      return res;
    }
    for (Node node: TreeWalk.preorder(root)) {
      if (!p.isBlock(node)) {
        continue;
      }
      List<Node> stmts = node.children();
      for (int i = 0; i < stmts.size(); i++) {
        Declaration d = declaration(p, stmts.get(i));
        if (d == null || d.key() == null) {
          continue;
        }
        int[] counts = new int[d.names.size()];
        for (int j = 0; j < d.names.size(); j++) {
          for (int k = i + 1; k < stmts.size(); k++) {
            Node later = stmts.get(k);
            Declaration redecl = declaration(p, later);
            if (redecl != null && redecl.names.contains(d.names.get(j))) {
              counts[j] += redecl.initializer == null ? 0 :
                        countUses(p, redecl.initializer, d.names.get(j));
              break;
            }
            counts[j] += countUses(p, later, d.names.get(j));
          }
        }
        res.put(d.key(), counts);
      }
    }
    return res;
  }

  /**
   * Uses of name within node, respecting shadowing in nested blocks
   */
  public static int countUses(CleanupProfile p, Node node, String name) {
    if (p.isIdentifier(node)) {
      return name.equals(node.value()) ? 1 : 0;
    }
    int uses = 0;
    boolean block = p.isBlock(node);
    for (Node child: node.children()) {
      if (block) {
        Declaration d = declaration(p, child);
        if (d != null && d.names.contains(name)) {
          if (d.initializer != null) {
            uses += countUses(p, d.initializer, name);
          }
          return uses;
        }
      }
      uses += countUses(p, child, name);
    }
    return uses;
  }
}
