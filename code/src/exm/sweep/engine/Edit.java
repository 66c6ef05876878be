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

import exm.sweep.tree.Span;

/**
 * One entry of the change log
 */
public class Edit {
  public final String ruleName;
  public final Span original;
  /** Null if the original was deleted */
  public final Span replacement;

  public Edit(String ruleName, Span original, Span replacement) {
    this.ruleName = ruleName;
    this.original = original;
    this.replacement = replacement;
  }

  public boolean isDeletion() {
    return replacement == null;
  }

  @Override
  public String toString() {
    return ruleName + " " + original + " -> " +
           (replacement == null ? "deleted" : replacement.toString());
  }
}
