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
package exm.sweep.common.util;

/**
 * Truth values for expressions that may or may not be decidable from the
 * tree alone
 */
public class TernaryLogic {

  public enum Ternary {
    TRUE,
    FALSE,
    /** Not known without running the code */
    MAYBE;

    /**
     * Short-circuit or: TRUE on either side decides the result
     */
    public static Ternary or(Ternary a, Ternary b) {
      if (a == TRUE || b == TRUE) {
        return TRUE;
      }
      if (a == MAYBE || b == MAYBE) {
        return MAYBE;
      }
      return FALSE;
    }

    /**
     * Short-circuit and: FALSE on either side decides the result
     */
    public static Ternary and(Ternary a, Ternary b) {
      if (a == FALSE || b == FALSE) {
        return FALSE;
      }
      if (a == MAYBE || b == MAYBE) {
        return MAYBE;
      }
      return TRUE;
    }

    public static Ternary not(Ternary a) {
      switch (a) {
        case TRUE:
          return FALSE;
        case FALSE:
          return TRUE;
        default:
          return MAYBE;
      }
    }

    public boolean isKnown() {
      return this != MAYBE;
    }

    public static Ternary fromBool(boolean val) {
      return val ? TRUE : FALSE;
    }
  }
}
