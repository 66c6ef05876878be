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
package exm.sweep.simplify;

import org.apache.log4j.Logger;

import exm.sweep.tree.Node;

public interface SimplifierPass {
  public String getPassName();

  /**
   * @return name of boolean setting that enables the pass, or null if
   *         always enabled
   */
  public String getConfigEnabledKey();

  /**
   * @param logger
   * @param context shared by the passes of one round
   * @param root tree to simplify
   * @return the simplified tree, or root itself if nothing changed
   */
  public Node simplify(Logger logger, SimplifierContext context, Node root);
}
