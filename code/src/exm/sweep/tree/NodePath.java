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

import java.util.Arrays;

import exm.sweep.common.exceptions.SweepRuntimeError;

/**
 * Location of a node within one revision: the child indices to follow
 * from the root.  Paths order in pre-order traversal order, so an
 * ancestor sorts before all of its descendants.
 */
public final class NodePath implements Comparable<NodePath> {

  private static final NodePath ROOT = new NodePath(new int[0]);

  private final int[] indices;

  private NodePath(int[] indices) {
    this.indices = indices;
  }

  public static NodePath root() {
    return ROOT;
  }

  public static NodePath of(int ...indices) {
    for (int i: indices) {
      if (i < 0) {
        throw new SweepRuntimeError("Negative index in path "
                                    + Arrays.toString(indices));
      }
    }
    return new NodePath(indices.clone());
  }

  public NodePath child(int index) {
    if (index < 0) {
      throw new SweepRuntimeError("Negative child index " + index);
    }
    int[] newIndices = Arrays.copyOf(indices, indices.length + 1);
    newIndices[indices.length] = index;
    return new NodePath(newIndices);
  }

  public NodePath parent() {
    if (isRoot()) {
      throw new SweepRuntimeError("Root path has no parent");
    }
    return new NodePath(Arrays.copyOf(indices, indices.length - 1));
  }

  public boolean isRoot() {
    return indices.length == 0;
  }

  public int depth() {
    return indices.length;
  }

  public int index(int level) {
    return indices[level];
  }

  /**
   * @return true if this path is other or one of its ancestors
   */
  public boolean isPrefixOf(NodePath other) {
    if (indices.length > other.indices.length) {
      return false;
    }
    for (int i = 0; i < indices.length; i++) {
      if (indices[i] != other.indices[i]) {
        return false;
      }
    }
    return true;
  }

  public boolean isStrictAncestorOf(NodePath other) {
    return indices.length < other.indices.length && isPrefixOf(other);
  }

  @Override
  public int compareTo(NodePath o) {
    int n = Math.min(indices.length, o.indices.length);
    for (int i = 0; i < n; i++) {
      if (indices[i] != o.indices[i]) {
        return indices[i] < o.indices[i] ? -1 : 1;
      }
    }
    return indices.length - o.indices.length;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(indices);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NodePath)) {
      return false;
    }
    return Arrays.equals(indices, ((NodePath)obj).indices);
  }

  @Override
  public String toString() {
    if (isRoot()) {
      return "/";
    }
    StringBuilder sb = new StringBuilder();
    for (int i: indices) {
      sb.append('/').append(i);
    }
    return sb.toString();
  }
}
