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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sweep.common.Settings;
import exm.sweep.tree.Node;

public class SimplifierPipeline {

  private final List<SimplifierPass> passes = new ArrayList<SimplifierPass>();

  public void addPass(SimplifierPass pass) {
    passes.add(pass);
  }

  public List<SimplifierPass> passes() {
    return passes;
  }

  public Node runPipeline(Logger logger, SimplifierContext context,
                          Node root, long round) {
    for (SimplifierPass pass: passes) {
      if (passEnabled(pass)) {
        logger.trace("Round: " + round + " Pass: " + pass.getPassName());
        Node result = pass.simplify(logger, context, root);
        if (result != root && logger.isTraceEnabled()) {
          logger.trace("Tree after " + pass.getPassName() + ":\n" + result);
        }
        root = result;
      }
    }
    return root;
  }

  public boolean passEnabled(SimplifierPass pass) {
    String key = pass.getConfigEnabledKey();
    return key == null || Settings.getBoolean(key);
  }
}
