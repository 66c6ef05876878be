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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import exm.sweep.common.Logging;
import exm.sweep.common.exceptions.InvalidRuleException;

/**
 * Rules plus the directed edges that say which rules become eligible
 * after a rule fires.  Built once through {@link Builder} and read-only
 * afterwards, so one graph can be shared by concurrent runs.
 *
 * Declaration order is significant: when several rules match the same
 * node, the one declared first wins.
 */
public class RuleGraph {

  private final List<Rule> rules;
  private final Map<String, Integer> index;
  private final ImmutableListMultimap<String, Edge> edges;

  private RuleGraph(List<Rule> rules, ListMultimap<String, Edge> edges) {
    this.rules = Collections.unmodifiableList(new ArrayList<Rule>(rules));
    Map<String, Integer> idx = new LinkedHashMap<String, Integer>();
    for (int i = 0; i < rules.size(); i++) {
      idx.put(rules.get(i).name(), i);
    }
    this.index = Collections.unmodifiableMap(idx);
    this.edges = ImmutableListMultimap.copyOf(edges);
  }

  public static class Builder {
    private final List<Rule> rules = new ArrayList<Rule>();
    private final ListMultimap<String, Edge> edges =
            ArrayListMultimap.create();

    public Builder register(Rule rule) {
      rules.add(rule);
      return this;
    }

    public Builder addEdge(String from, Edge edge) {
      edges.put(from, edge);
      return this;
    }

    /**
     * Validate and freeze
     * @throws InvalidRuleException on the first problem found
     */
    public RuleGraph build() throws InvalidRuleException {
      Map<String, Rule> byName = new LinkedHashMap<String, Rule>();
      for (Rule r: rules) {
        r.validate();
        if (byName.put(r.name(), r) != null) {
          throw new InvalidRuleException(r.name(), "declared twice");
        }
      }

      // A rule's own successors come before edges declared separately
      ListMultimap<String, Edge> all = ArrayListMultimap.create();
      for (Rule r: rules) {
        all.putAll(r.name(), r.successors());
      }
      for (Map.Entry<String, Edge> e: edges.entries()) {
        Rule from = byName.get(e.getKey());
        if (from == null) {
          throw new InvalidRuleException(e.getKey(), "edge " +
                  e.getValue() + " starts at an unknown rule");
        }
        Edge edge = e.getValue();
        if (edge.scope == EdgeScope.CAPTURE && !from.isDummy() &&
            !from.pattern().captureNames().contains(edge.argument)) {
          throw new InvalidRuleException(from.name(), "edge " + edge +
                  " refers to capture \"" + edge.argument +
                  "\" which the pattern never binds");
        }
        all.put(e.getKey(), edge);
      }
      for (Map.Entry<String, Edge> e: all.entries()) {
        if (!byName.containsKey(e.getValue().target)) {
          throw new InvalidRuleException(e.getKey(), "edge " +
                  e.getValue() + " leads to an unknown rule");
        }
      }
      RuleGraph g = new RuleGraph(rules, all);
      Logger logger = Logging.getSweepLogger();
      if (logger.isDebugEnabled()) {
        logger.debug("Rule graph: " + g.rules.size() + " rules, " +
                     g.edges.size() + " edges");
      }
      return g;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Rule> rules() {
    return rules;
  }

  public Rule get(String name) {
    Integer i = index.get(name);
    return i == null ? null : rules.get(i);
  }

  /**
   * @return position in declaration order, -1 if unknown
   */
  public int declarationIndex(String name) {
    Integer i = index.get(name);
    return i == null ? -1 : i;
  }

  /**
   * Rules eligible everywhere from the start, in declaration order
   */
  public List<Rule> topLevelRules() {
    List<Rule> res = new ArrayList<Rule>();
    for (Rule r: rules) {
      if (r.isTopLevel() && !r.isDummy()) {
        res.add(r);
      }
    }
    return res;
  }

  /**
   * @return edges as declared, including edges to dummy rules
   */
  public List<Edge> edgesFrom(String name) {
    return edges.get(name);
  }

  /**
   * Edges out of a rule with dummy rules passed through: an edge into a
   * dummy rule is replaced by the dummy rule's own outgoing edges.  Every
   * returned edge leads to a rule with a pattern.
   */
  public List<Edge> successorEdges(String name) {
    List<Edge> res = new ArrayList<Edge>();
    Set<String> visited = new HashSet<String>();
    visited.add(name);
    collectSuccessors(name, res, visited);
    return res;
  }

  private void collectSuccessors(String name, List<Edge> res,
                                 Set<String> visited) {
    for (Edge e: edges.get(name)) {
      Rule target = get(e.target);
      if (target.isDummy()) {
        if (visited.add(target.name())) {
          collectSuccessors(target.name(), res, visited);
        }
      } else {
        res.add(e);
      }
    }
  }

  /**
   * @return rules that can become eligible after the named rule fires
   */
  public List<Rule> successorsOf(String name) {
    List<Rule> res = new ArrayList<Rule>();
    for (Edge e: successorEdges(name)) {
      res.add(get(e.target));
    }
    return res;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Rule r: rules) {
      sb.append(r).append('\n');
      for (Edge e: edges.get(r.name())) {
        sb.append("  ").append(e).append('\n');
      }
    }
    return sb.toString();
  }
}
