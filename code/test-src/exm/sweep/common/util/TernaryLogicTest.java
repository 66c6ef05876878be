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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.sweep.common.util.TernaryLogic.Ternary;

public class TernaryLogicTest {

  @Test
  public void testShortCircuit() {
    assertEquals(Ternary.TRUE, Ternary.or(Ternary.MAYBE, Ternary.TRUE));
    assertEquals(Ternary.MAYBE, Ternary.or(Ternary.MAYBE, Ternary.FALSE));
    assertEquals(Ternary.FALSE, Ternary.or(Ternary.FALSE, Ternary.FALSE));
    assertEquals(Ternary.FALSE, Ternary.and(Ternary.MAYBE, Ternary.FALSE));
    assertEquals(Ternary.MAYBE, Ternary.and(Ternary.TRUE, Ternary.MAYBE));
    assertEquals(Ternary.TRUE, Ternary.and(Ternary.TRUE, Ternary.TRUE));
  }

  @Test
  public void testNot() {
    assertEquals(Ternary.FALSE, Ternary.not(Ternary.TRUE));
    assertEquals(Ternary.TRUE, Ternary.not(Ternary.FALSE));
    assertEquals(Ternary.MAYBE, Ternary.not(Ternary.MAYBE));
  }

  @Test
  public void testKnown() {
    assertTrue(Ternary.fromBool(false).isKnown());
    assertFalse(Ternary.MAYBE.isKnown());
  }
}
