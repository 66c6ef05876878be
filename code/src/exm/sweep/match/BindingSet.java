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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import exm.sweep.tree.Node;
import exm.sweep.tree.NodePath;

/**
 * Capture names bound by a successful match.  Bindings refer to nodes of
 * the revision that was matched and are only meaningful until the next
 * rewrite.  Instances are immutable: binding a name yields a new set.
 */
public class BindingSet {

  public static final BindingSet EMPTY =
          new BindingSet(Collections.<String, Binding>emptyMap());

  public static class Binding {
    public final Node node;
    public final NodePath path;

    private Binding(Node node, NodePath path) {
      this.node = node;
      this.path = path;
    }

    @Override
    public String toString() {
      return path + "=" + node;
    }
  }

  private final Map<String, Binding> bindings;

  private BindingSet(Map<String, Binding> bindings) {
    this.bindings = bindings;
  }

  /**
   * @return new binding set with name bound, this if name was already
   *      bound to an equal node, or null if it was bound to a different
   *      node
   */
  public BindingSet bind(String name, Node node, NodePath path) {
    Binding prev = bindings.get(name);
    if (prev != null) {
      return prev.node.equals(node) ? this : null;
    }
    Map<String, Binding> newBindings =
            new LinkedHashMap<String, Binding>(bindings);
    newBindings.put(name, new Binding(node, path));
    return new BindingSet(Collections.unmodifiableMap(newBindings));
  }

  public boolean contains(String name) {
    return bindings.containsKey(name);
  }

  public Node get(String name) {
    Binding b = bindings.get(name);
    return b == null ? null : b.node;
  }

  public NodePath pathOf(String name) {
    Binding b = bindings.get(name);
    return b == null ? null : b.path;
  }

  public Set<String> names() {
    return bindings.keySet();
  }

  public int size() {
    return bindings.size();
  }

  /**
   * @return capture name to source text of captured node
   */
  public Map<String, String> texts() {
    Map<String, String> res = new LinkedHashMap<String, String>();
    for (Map.Entry<String, Binding> e: bindings.entrySet()) {
      res.put(e.getKey(), e.getValue().node.text());
    }
    return res;
  }

  @Override
  public String toString() {
    return bindings.toString();
  }
}
