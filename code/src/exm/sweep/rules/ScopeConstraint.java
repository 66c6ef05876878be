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
package exm.sweep.rules;

import java.util.List;

import exm.sweep.tree.Node;

/**
 * Restricts where a rule may match, by looking at the ancestors of the
 * candidate node.  Null components are unconstrained.
 */
public class ScopeConstraint {

  public static final ScopeConstraint NONE =
          new ScopeConstraint(null, null, null);

  /** Kind of the immediate parent */
  private final String parentKind;
  /** Field label of the candidate within its parent */
  private final String field;
  /** Kind of some ancestor */
  private final String enclosingKind;

  public ScopeConstraint(String parentKind, String field,
                         String enclosingKind) {
    this.parentKind = parentKind;
    this.field = field;
    this.enclosingKind = enclosingKind;
  }

  public String parentKind() {
    return parentKind;
  }

  public String field() {
    return field;
  }

  public String enclosingKind() {
    return enclosingKind;
  }

  /**
   * @param node candidate
   * @param ancestors ancestors of candidate, nearest first
   */
  public boolean admits(Node node, List<Node> ancestors) {
    if (field != null && !field.equals(node.field())) {
      return false;
    }
    if (parentKind != null) {
      if (ancestors.isEmpty() ||
          !parentKind.equals(ancestors.get(0).kind())) {
        return false;
      }
    }
    if (enclosingKind != null) {
      for (Node anc: ancestors) {
        if (enclosingKind.equals(anc.kind())) {
          return true;
        }
      }
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return "scope(parent=" + parentKind + ", field=" + field +
           ", enclosing=" + enclosingKind + ")";
  }
}
