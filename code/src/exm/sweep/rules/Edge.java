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

import exm.sweep.common.exceptions.SweepRuntimeError;

/**
 * Directed edge of the rule graph: once the source rule fires, the target
 * rule becomes eligible within the scope.
 */
public class Edge {
  public final String target;
  public final EdgeScope scope;
  /** Capture name for CAPTURE, ancestor kind for ENCLOSING, else null */
  public final String argument;

  private Edge(String target, EdgeScope scope, String argument) {
    this.target = target;
    this.scope = scope;
    this.argument = argument;
  }

  public static Edge capture(String target, String captureName) {
    if (captureName == null) {
      throw new SweepRuntimeError("Capture edge to " + target +
                                  " needs a capture name");
    }
    return new Edge(target, EdgeScope.CAPTURE, captureName);
  }

  public static Edge parent(String target) {
    return new Edge(target, EdgeScope.PARENT, null);
  }

  public static Edge enclosing(String target, String kind) {
    if (kind == null) {
      throw new SweepRuntimeError("Enclosing edge to " + target +
                                  " needs an ancestor kind");
    }
    return new Edge(target, EdgeScope.ENCLOSING, kind);
  }

  public static Edge global(String target) {
    return new Edge(target, EdgeScope.GLOBAL, null);
  }

  public static Edge create(String target, EdgeScope scope,
                            String argument) {
    switch (scope) {
      case CAPTURE:
        return capture(target, argument);
      case ENCLOSING:
        return enclosing(target, argument);
      case PARENT:
        return parent(target);
      case GLOBAL:
        return global(target);
      default:
        throw new SweepRuntimeError("Unknown edge scope " + scope);
    }
  }

  @Override
  public String toString() {
    return "-" + scope.name().toLowerCase() +
           (argument == null ? "" : "(" + argument + ")") + "-> " + target;
  }
}
