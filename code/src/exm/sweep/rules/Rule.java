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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import exm.sweep.common.exceptions.InvalidRuleException;
import exm.sweep.match.Pattern;

/**
 * A named rewrite: where it applies (pattern and scope) and what it
 * produces (replacement template).
 *
 * A rule with no pattern is a dummy that only groups outgoing edges.
 * A rule with a pattern but no replacement only reports matches.
 * Rules with unfilled holes must be instantiated with substitutions
 * before they can match.
 */
public class Rule {

  private final String name;
  private final Pattern pattern;
  private final Template replacement;
  private final ScopeConstraint scope;
  private final boolean topLevel;
  private final List<Edge> successors;
  /** Substitutions already applied, sorted by hole name */
  private final Map<String, String> substitutions;

  public Rule(String name, Pattern pattern, Template replacement,
              ScopeConstraint scope, boolean topLevel, List<Edge> successors) {
    this(name, pattern, replacement, scope, topLevel, successors,
         Collections.<String, String>emptyMap());
  }

  private Rule(String name, Pattern pattern, Template replacement,
               ScopeConstraint scope, boolean topLevel, List<Edge> successors,
               Map<String, String> substitutions) {
    this.name = name;
    this.pattern = pattern;
    this.replacement = replacement;
    this.scope = scope == null ? ScopeConstraint.NONE : scope;
    this.topLevel = topLevel;
    this.successors = successors == null ? Collections.<Edge>emptyList() :
            Collections.unmodifiableList(new ArrayList<Edge>(successors));
    this.substitutions = Collections.unmodifiableMap(
                              new TreeMap<String, String>(substitutions));
  }

  public static Rule rewrite(String name, Pattern pattern,
                             Template replacement) {
    return new Rule(name, pattern, replacement, null, true, null);
  }

  public static Rule dummy(String name, List<Edge> successors) {
    return new Rule(name, null, null, null, false, successors);
  }

  public String name() {
    return name;
  }

  public Pattern pattern() {
    return pattern;
  }

  public Template replacement() {
    return replacement;
  }

  public ScopeConstraint scope() {
    return scope;
  }

  public boolean isTopLevel() {
    return topLevel;
  }

  public List<Edge> successors() {
    return successors;
  }

  public Map<String, String> substitutions() {
    return substitutions;
  }

  public boolean isDummy() {
    return pattern == null;
  }

  public boolean isMatchOnly() {
    return pattern != null && replacement == null;
  }

  /**
   * @return holes that must be substituted before the rule can match
   */
  public Set<String> holes() {
    Set<String> res = new LinkedHashSet<String>();
    if (pattern == null) {
      return res;
    }
    res.addAll(pattern.holes());
    if (replacement != null) {
      Set<String> captures = pattern.captureNames();
      for (String h: replacement.valueHoles()) {
        if (!captures.contains(h)) {
          res.add(h);
        }
      }
    }
    return res;
  }

  public boolean isInstantiated() {
    return holes().isEmpty();
  }

  /**
   * Fill holes.  Substitutions for names the rule does not use are
   * ignored, so that the same map can be passed to all rules.
   */
  public Rule instantiate(Map<String, String> subs) {
    if (pattern == null) {
      return this;
    }
    Set<String> holes = holes();
    Map<String, String> used = new TreeMap<String, String>(substitutions);
    for (Map.Entry<String, String> e: subs.entrySet()) {
      if (holes.contains(e.getKey())) {
        used.put(e.getKey(), e.getValue());
      }
    }
    if (used.size() == substitutions.size()) {
      return this;
    }
    return new Rule(name, pattern.substitute(used),
            replacement == null ? null : replacement.substitute(used),
            scope, topLevel, successors, used);
  }

  /**
   * Identifies an instantiation: rule name plus substitutions
   */
  public String key() {
    if (substitutions.isEmpty()) {
      return name;
    }
    return name + substitutions;
  }

  /**
   * Check the rule on its own.  Edges are checked by the graph.
   */
  public void validate() throws InvalidRuleException {
    if (name == null || name.trim().isEmpty()) {
      throw new InvalidRuleException(null, "rule has no name");
    }
    if (pattern == null) {
      if (replacement != null) {
        throw new InvalidRuleException(name,
                              "replacement given without a pattern");
      }
      return;
    }
    pattern.validate(name);
    Set<String> captures = pattern.captureNames();
    if (replacement != null) {
      for (String c: replacement.captureNames()) {
        if (!captures.contains(c)) {
          throw new InvalidRuleException(name, "replacement refers to " +
                  "capture \"" + c + "\" which the pattern never binds");
        }
      }
    }
    for (Edge e: successors) {
      if (e.scope == EdgeScope.CAPTURE && !captures.contains(e.argument)) {
        throw new InvalidRuleException(name, "edge " + e + " refers to " +
                "capture \"" + e.argument + "\" which the pattern never binds");
      }
    }
  }

  @Override
  public String toString() {
    if (isDummy()) {
      return name + ": <dummy>";
    }
    return key() + ": " + pattern + " => " +
           (replacement == null ? "<match only>" : replacement);
  }
}
