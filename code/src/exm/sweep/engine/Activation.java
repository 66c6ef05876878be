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
package exm.sweep.engine;

import java.util.Collections;
import java.util.List;

import exm.sweep.rules.EdgeScope;
import exm.sweep.rules.Rule;
import exm.sweep.tree.Node;
import exm.sweep.tree.Span;

/**
 * A successor rule made eligible by a rewrite, together with where it may
 * match in the next scan.
 *
 * Targets are nodes of the revision produced by the rewrite.  A later
 * rebuild of the tree can replace them with equal copies, so a target
 * also matches a node of the same kind and span.
 */
class Activation {
  final Rule rule;
  final EdgeScope scope;
  /** CAPTURE: candidates, PARENT: ancestors nearest first,
   *  ENCLOSING: the single enclosing node */
  final List<Node> targets;
  /** Rule whose rewrite caused this */
  final String cause;

  Activation(Rule rule, EdgeScope scope, List<Node> targets, String cause) {
    this.rule = rule;
    this.scope = scope;
    this.targets = Collections.unmodifiableList(targets);
    this.cause = cause;
  }

  static boolean sameTarget(Node target, Node candidate) {
    if (target == candidate) {
      return true;
    }
    Span s = target.span();
    return s.isKnown() && s.equals(candidate.span()) &&
           target.kind().equals(candidate.kind());
  }

  @Override
  public String toString() {
    return rule.key() + " " + scope.name().toLowerCase() + " after " + cause;
  }
}
