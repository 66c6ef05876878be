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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.sweep.tree.Span;

/**
 * Edits in the order they were applied
 */
public class ChangeLog {
  private final List<Edit> entries = new ArrayList<Edit>();

  public void add(String ruleName, Span original, Span replacement) {
    entries.add(new Edit(ruleName, original, replacement));
  }

  public void addAll(ChangeLog other) {
    entries.addAll(other.entries);
  }

  public List<Edit> entries() {
    return Collections.unmodifiableList(entries);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * @return names of rules that made edits, in order, with repeats
   */
  public List<String> ruleNames() {
    List<String> res = new ArrayList<String>(entries.size());
    for (Edit e: entries) {
      res.add(e.ruleName);
    }
    return res;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Edit e: entries) {
      sb.append(e).append('\n');
    }
    return sb.toString();
  }
}
