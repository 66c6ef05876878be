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
import java.util.Map;

import exm.sweep.tree.Span;

/**
 * A match of a rule that reports instead of rewriting
 */
public class MatchReport {
  public final String ruleName;
  public final Span span;
  /** Capture name to captured text */
  public final Map<String, String> captures;

  public MatchReport(String ruleName, Span span,
                     Map<String, String> captures) {
    this.ruleName = ruleName;
    this.span = span;
    this.captures = Collections.unmodifiableMap(captures);
  }

  @Override
  public int hashCode() {
    return ruleName.hashCode() * 31 + span.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof MatchReport)) {
      return false;
    }
    MatchReport other = (MatchReport)obj;
    return ruleName.equals(other.ruleName) && span.equals(other.span) &&
           captures.equals(other.captures);
  }

  @Override
  public String toString() {
    return ruleName + " " + span + " " + captures;
  }
}
