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

/**
 * Where a successor rule is allowed to match after its predecessor
 * fired.
 */
public enum EdgeScope {
  /** Only at the node bound to a named capture of the predecessor */
  CAPTURE,
  /** At the nearest ancestor of the rewritten site that matches */
  PARENT,
  /** Anywhere inside the nearest ancestor of a given kind */
  ENCLOSING,
  /** Anywhere in the tree, for the rest of the run */
  GLOBAL;

  public static EdgeScope fromString(String s) {
    return valueOf(s.trim().toUpperCase());
  }
}
