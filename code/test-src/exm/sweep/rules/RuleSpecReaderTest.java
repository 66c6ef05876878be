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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.junit.Test;

import exm.sweep.common.exceptions.InvalidRuleException;
import exm.sweep.common.exceptions.InvalidTreeException;
import exm.sweep.common.util.TernaryLogic.Ternary;
import exm.sweep.match.Matcher;
import exm.sweep.match.Pattern;
import exm.sweep.simplify.CleanupProfile;
import exm.sweep.tree.TreeNotation;

public class RuleSpecReaderTest {

  public static String resource(String name) throws IOException {
    InputStream in = RuleSpecReaderTest.class.getResourceAsStream(
                                                "/exm/sweep/" + name);
    assertNotNull("missing test resource " + name, in);
    try {
      return IOUtils.toString(in, "UTF-8");
    } finally {
      in.close();
    }
  }

  private static RuleSet read(String text) throws InvalidRuleException {
    return new RuleSpecReader().read("test", text);
  }

  @Test
  public void testReadFlagRules() throws Exception {
    RuleSet rs = read(resource("go-flags.yaml"));
    RuleGraph g = rs.graph();
    assertEquals(9, g.rules().size());
    assertEquals(5, g.topLevelRules().size());
    assertEquals("STALE_FLAG", rs.defaultSubstitutions().get("flag"));
    assertEquals("OTHER", rs.substitutions(
            Collections.singletonMap("flag", "OTHER")).get("flag"));

    List<Edge> edges = g.successorEdges("delete_true_variable");
    assertEquals(1, edges.size());
    assertEquals(EdgeScope.ENCLOSING, edges.get(0).scope);
    assertEquals("function_declaration", edges.get(0).argument);
    assertEquals(EdgeScope.PARENT,
                 g.successorEdges("replace_is_enabled").get(0).scope);

    assertTrue(g.get("report_todo").isMatchOnly());
    assertFalse(g.get("replace_true_variable").isTopLevel());

    Rule r = g.get("replace_is_enabled").instantiate(rs.defaultSubstitutions());
    assertTrue(r.isInstantiated());
    assertTrue(Matcher.matches(r.pattern(), TreeNotation.read(
        "(call_expression function:(identifier \"isEnabled\") " +
        "arguments:(argument_list (identifier \"STALE_FLAG\")))")));
    assertTrue(Matcher.matches(r.pattern(), TreeNotation.read(
        "(call_expression function:(identifier \"isEnabled\") " +
        "arguments:(argument_list " +
        "(interpreted_string_literal \"\\\"STALE_FLAG\\\"\")))")));
    assertEquals(EdgeScope.ENCLOSING,
        g.successorEdges("resolve_false_value").get(0).scope);
  }

  @Test
  public void testLanguageProfile() throws Exception {
    CleanupProfile p = read(resource("go-flags.yaml")).profile();
    assertEquals("go", p.name());
    assertTrue(p.hasBooleans());
    assertTrue(p.isConstant(TreeNotation.read("(int_literal \"3\")")));
    assertEquals(Ternary.FALSE,
                 p.truth(TreeNotation.read("(false \"false\")")));
    assertTrue(p.not().matches(TreeNotation.read(
        "(unary_expression (! \"!\") (identifier \"x\"))")));
    assertEquals("right", p.declarations().get(0).valueField);
    assertFalse(p.isPure(TreeNotation.read(
        "(call_expression function:(identifier \"f\") " +
        "arguments:(argument_list))")));
  }

  @Test
  public void testNoLanguage() throws Exception {
    RuleSet rs = read(resource("scopes.yaml"));
    assertEquals(CleanupProfile.EMPTY, rs.profile());
    assertFalse(rs.profile().hasBooleans());
    assertTrue(rs.graph().get("junction").isDummy());
    assertEquals("everywhere",
                 rs.graph().successorsOf("plant").get(0).name());
  }

  @Test
  public void testPatternShapes() throws Exception {
    RuleSet rs = read(
        "rules:\n" +
        "  - name: r\n" +
        "    pattern:\n" +
        "      kind: block\n" +
        "      children:\n" +
        "        - {repeat: {kind: call}}\n" +
        "        - oneOf: [{kind: return}, {text: \"panic.*\"}]\n" +
        "          capture: last\n" +
        "    replacement: {capture: last}\n");
    Pattern p = rs.graph().get("r").pattern();
    assertTrue(Matcher.matches(p, TreeNotation.read(
        "(block (call \"a\") (stmt \"panic(1)\"))")));
    assertFalse(Matcher.matches(p, TreeNotation.read(
        "(block (stmt \"a\") (return))")));
  }

  private static void expectInvalid(String text, String ruleName) {
    try {
      read(text);
      fail("expected InvalidRuleException");
    } catch (InvalidRuleException e) {
      assertEquals(ruleName, e.getRuleName());
    }
  }

  @Test
  public void testInvalidDocuments() {
    expectInvalid("rules: [{name: r, pattern: {kind: a, text: b}}]", "r");
    expectInvalid("rules: [{name: r, pattern: {kind: a}, " +
                  "replacement: {kind: b, delete: true}}]", "r");
    expectInvalid("rules: [{name: r, pattern: {kind: a}, " +
                  "successors: [{rule: r, scope: sideways}]}]", "r");
    expectInvalid("rules: [{name: r, pattern: {kind: a}, " +
                  "successors: [{rule: r, scope: capture}]}]", "r");
    expectInvalid("rules: [{name: r, pattern: {text: \"(\"}}]", "r");
    expectInvalid("rules: [{name: r, pattern: {kind: a}}]\n" +
                  "edges: [{from: r, to: [s]}]", "r");
    expectInvalid("rules: [{pattern: {kind: a}}]", null);
  }

  @Test(expected=InvalidRuleException.class)
  public void testUnknownProperty() throws InvalidRuleException {
    read("rules: [{name: r, pattern: {kind: a}, colour: red}]");
  }

  @Test(expected=InvalidRuleException.class)
  public void testMalformedYaml() throws InvalidRuleException {
    read("rules: [{name: r, pattern: {kind: a}");
  }

  @Test
  public void testMalformedReportsCause() {
    try {
      read("rules: {name: r}");
      fail("expected InvalidRuleException");
    } catch (InvalidRuleException e) {
      assertNull(e.getRuleName());
      assertNotNull(e.getCause());
    }
  }

  @Test(expected=InvalidRuleException.class)
  public void testEmptyDocument() throws InvalidRuleException {
    read("");
  }

  @Test(expected=InvalidTreeException.class)
  public void testTreeErrorsAreSeparate() throws InvalidTreeException {
    TreeNotation.read("(unclosed");
  }
}
