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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.sweep.common.exceptions.SweepRuntimeError;

/**
 * Immutable element of a parsed program tree.
 *
 * A node has a kind tag supplied by the external parser, an optional
 * field label naming the role it plays in its parent (e.g. the condition
 * of a conditional), an optional literal value (normally only on
 * leaves), an ordered list of children and a source span.
 *
 * Nodes are never modified after construction, so a subtree can be
 * shared between any number of revisions.  Equality is structural and
 * ignores spans.
 */
public final class Node {

  private final String kind;
  private final String field;
  private final String value;
  private final List<Node> children;
  private final Span span;

  /** Cached structural hash code, 0 if not yet computed */
  private int hash;

  private Node(String kind, String field, String value,
               List<Node> children, Span span) {
    if (kind == null || kind.isEmpty()) {
      throw new SweepRuntimeError("Node kind must be non-empty");
    }
    this.kind = kind;
    this.field = field;
    this.value = value;
    this.children = children;
    this.span = span == null ? Span.UNKNOWN : span;
  }

  public static Node leaf(String kind, String value) {
    return leaf(kind, value, Span.UNKNOWN);
  }

  public static Node leaf(String kind, String value, Span span) {
    return new Node(kind, null, value, Collections.<Node>emptyList(), span);
  }

  public static Node create(String kind, Node ...children) {
    return create(kind, Arrays.asList(children));
  }

  public static Node create(String kind, List<Node> children) {
    return new Node(kind, null, null, copyChildren(children),
                    coverChildren(children));
  }

  public static Node create(String kind, String field, String value,
                            List<Node> children, Span span) {
    return new Node(kind, field, value, copyChildren(children), span);
  }

  private static List<Node> copyChildren(List<Node> children) {
    if (children.isEmpty()) {
      return Collections.emptyList();
    }
    for (Node child: children) {
      if (child == null) {
        throw new SweepRuntimeError("Null child node");
      }
    }
    return Collections.unmodifiableList(new ArrayList<Node>(children));
  }

  private static Span coverChildren(List<Node> children) {
    Span result = Span.UNKNOWN;
    for (Node child: children) {
      result = Span.cover(result, child.span);
    }
    return result;
  }

  /**
   * Same node in a different slot of its parent
   */
  public Node withField(String newField) {
    return new Node(kind, newField, value, children, span);
  }

  /**
   * New node with same kind, field, value and span but different children
   */
  public Node withChildren(List<Node> newChildren) {
    return new Node(kind, field, value, copyChildren(newChildren), span);
  }

  public String kind() {
    return kind;
  }

  public String field() {
    return field;
  }

  public String value() {
    return value;
  }

  public boolean hasValue() {
    return value != null;
  }

  public List<Node> children() {
    return children;
  }

  public Node child(int i) {
    return children.get(i);
  }

  public int childCount() {
    return children.size();
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  public Span span() {
    return span;
  }

  /**
   * @return first child with the given field label, or null
   */
  public Node childByField(String fieldName) {
    int i = indexOfField(fieldName);
    return i < 0 ? null : children.get(i);
  }

  public int indexOfField(String fieldName) {
    if (fieldName == null) {
      return -1;
    }
    for (int i = 0; i < children.size(); i++) {
      if (fieldName.equals(children.get(i).field)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Source text as far as it can be reconstructed from the tree: the
   * values of all leaves in order, concatenated without separators.
   */
  public String text() {
    if (isLeaf()) {
      return value == null ? "" : value;
    }
    StringBuilder sb = new StringBuilder();
    appendText(sb);
    return sb.toString();
  }

  private void appendText(StringBuilder sb) {
    if (value != null) {
      sb.append(value);
    }
    for (Node child: children) {
      child.appendText(sb);
    }
  }

  /**
   * @return total number of nodes in this subtree
   */
  public int size() {
    int n = 1;
    for (Node child: children) {
      n += child.size();
    }
    return n;
  }

  /**
   * Check the span invariant: every child with a known span lies within
   * its parent's span, and children are ordered and do not overlap.
   * Gaps between children (whitespace, comments) are allowed.
   */
  public boolean spansWellFormed() {
    int prevEnd = span.isKnown() ? span.start : -1;
    for (Node child: children) {
      Span cs = child.span;
      if (cs.isKnown()) {
        if (span.isKnown() && !span.contains(cs)) {
          return false;
        }
        if (cs.start < prevEnd) {
          return false;
        }
        prevEnd = cs.end;
      }
      if (!child.spansWellFormed()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int h = hash;
    if (h == 0) {
      final int prime = 31;
      h = kind.hashCode();
      h = prime * h + (field == null ? 0 : field.hashCode());
      h = prime * h + (value == null ? 0 : value.hashCode());
      h = prime * h + children.hashCode();
      if (h == 0) {
        h = 1;
      }
      hash = h;
    }
    return h;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Node)) {
      return false;
    }
    Node other = (Node)obj;
    if (hashCode() != other.hashCode()) {
      return false;
    }
    if (!kind.equals(other.kind)) {
      return false;
    }
    if (field == null ? other.field != null : !field.equals(other.field)) {
      return false;
    }
    if (value == null ? other.value != null : !value.equals(other.value)) {
      return false;
    }
    return children.equals(other.children);
  }

  @Override
  public String toString() {
    return TreeNotation.print(this);
  }
}
