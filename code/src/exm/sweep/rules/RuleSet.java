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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import exm.sweep.simplify.CleanupProfile;

/**
 * A validated rule graph with the language profile and default
 * substitutions it was declared with
 */
public class RuleSet {
  private final RuleGraph graph;
  private final CleanupProfile profile;
  private final Map<String, String> defaultSubstitutions;

  public RuleSet(RuleGraph graph, CleanupProfile profile,
                 Map<String, String> defaultSubstitutions) {
    this.graph = graph;
    this.profile = profile == null ? CleanupProfile.EMPTY : profile;
    this.defaultSubstitutions = Collections.unmodifiableMap(
            new LinkedHashMap<String, String>(defaultSubstitutions));
  }

  public RuleGraph graph() {
    return graph;
  }

  public CleanupProfile profile() {
    return profile;
  }

  public Map<String, String> defaultSubstitutions() {
    return defaultSubstitutions;
  }

  /**
   * Defaults overridden by the given substitutions
   */
  public Map<String, String> substitutions(Map<String, String> overrides) {
    Map<String, String> res =
            new LinkedHashMap<String, String>(defaultSubstitutions);
    res.putAll(overrides);
    return res;
  }
}
