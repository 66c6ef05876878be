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
package exm.sweep.common.exceptions;

/**
 * A rule set that cannot be used safely: malformed pattern, replacement
 * referring to a capture that is never bound, dangling rule graph edge.
 * Always reported before any rewriting starts.
 */
public class InvalidRuleException extends UserException {

  private final String ruleName;

  public InvalidRuleException(String ruleName, String message) {
    super("Rule " + (ruleName == null ? "<unnamed>" : "\"" + ruleName + "\"")
          + ": " + message);
    this.ruleName = ruleName;
  }

  public InvalidRuleException(String message, Throwable cause) {
    super(message, cause);
    this.ruleName = null;
  }

  /**
   * @return name of offending rule, or null if not specific to a rule
   */
  public String getRuleName() {
    return ruleName;
  }

  private static final long serialVersionUID = 1L;
}
