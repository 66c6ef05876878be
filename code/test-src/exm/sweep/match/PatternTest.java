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
package exm.sweep.match;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.LinkedHashSet;

import org.junit.Test;

import exm.sweep.common.exceptions.InvalidRuleException;

public class PatternTest {

  @Test
  public void testCaptureNamesInOrder() {
    Pattern p = Pattern.node("a", Pattern.capture("x"),
        Pattern.node("b", Pattern.capture("y", Pattern.node("c"))));
    assertEquals(new LinkedHashSet<String>(Arrays.asList("x", "y")),
                 p.captureNames());
  }

  @Test
  public void testEscapedAtIsNotAHole() {
    Pattern p = Pattern.literal("user@@example");
    assertEquals(0, p.holes().size());
    assertEquals("user@example", p.value());
  }

  @Test
  public void testValidPatternPasses() throws InvalidRuleException {
    Pattern.node("block", Pattern.repeat(),
                 Pattern.capture("last")).validate("ok");
  }

  @Test(expected=InvalidRuleException.class)
  public void testCaptureInsideRepeat() throws InvalidRuleException {
    Pattern.node("block",
        Pattern.repeat(Pattern.capture("stmt"))).validate("bad");
  }

  @Test(expected=InvalidRuleException.class)
  public void testTopLevelRepeat() throws InvalidRuleException {
    Pattern.repeat().validate("bad");
  }

  @Test(expected=InvalidRuleException.class)
  public void testRepeatInUnordered() throws InvalidRuleException {
    Pattern.unordered("a", Pattern.repeat()).validate("bad");
  }

  @Test(expected=InvalidRuleException.class)
  public void testRepeatOutsideChildList() throws InvalidRuleException {
    Pattern.capture("x", Pattern.repeat()).validate("bad");
  }

  @Test
  public void testSequenceCaptureInChildList() throws InvalidRuleException {
    Pattern.node("block", Pattern.capture("rest", Pattern.repeat()),
                 Pattern.node("return_statement")).validate("ok");
  }

  @Test(expected=InvalidRuleException.class)
  public void testSequenceCaptureInUnordered() throws InvalidRuleException {
    Pattern.unordered("a",
        Pattern.capture("rest", Pattern.repeat())).validate("bad");
  }
}
