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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.sweep.common.Logging;
import exm.sweep.common.Settings;
import exm.sweep.match.Pattern;
import exm.sweep.rules.Edge;
import exm.sweep.rules.Rule;
import exm.sweep.rules.RuleGraph;
import exm.sweep.rules.RuleSet;
import exm.sweep.rules.RuleSpecReader;
import exm.sweep.rules.RuleSpecReaderTest;
import exm.sweep.rules.Template;
import exm.sweep.simplify.CleanupProfile;
import exm.sweep.simplify.DeadCodeSimplifier;
import exm.sweep.tree.Node;
import exm.sweep.tree.TreeNotation;

public class FixpointDriverTest {

  private static Logger logger;

  private static final Map<String, String> NO_SUBS =
          Collections.<String, String>emptyMap();

  @BeforeClass
  public static void setupLogging() {
    logger = Logging.setupLogging(null, false);
  }

  private static FixpointDriver driver(RuleGraph g, long maxIterations,
                                       long deadlineMillis) {
    return new FixpointDriver(logger, g, CleanupProfile.EMPTY, NO_SUBS,
           maxIterations, deadlineMillis,
           new DeadCodeSimplifier(CleanupProfile.EMPTY, 10));
  }

  private static FixpointDriver driver(RuleGraph g) {
    return driver(g, 100, 0);
  }

  private static Rule rename(String name, String from, String to) {
    return Rule.rewrite(name, Pattern.literal("item", from),
                        Template.leaf("item", to));
  }

  @Test
  public void testEdgeScopes() throws Exception {
    RuleSet rs = new RuleSpecReader().read("scopes.yaml",
                        RuleSpecReaderTest.resource("scopes.yaml"));
    FixpointDriver d = new FixpointDriver(logger, rs.graph(), rs.profile(),
        rs.substitutions(NO_SUBS), 100, 0,
        new DeadCodeSimplifier(rs.profile(), 10));
    Node root = TreeNotation.read(
        "(root (wrapper (item \"a\")) (item \"a\") (list (item \"x\")) " +
        "(list) (seed (name \"foo\")) (item \"foo\") (box (item \"foo\")) " +
        "(item \"bar\"))");
    RewriteResult res = d.run(root);
    assertTrue(res.isConverged());
    assertEquals(2, res.iterations());
    // Capture scope renames only the unwrapped item, parent scope
    // collapses only the emptied list, global scope reaches everywhere
    assertEquals(TreeNotation.read(
        "(root (item \"b\") (item \"a\") (empty) (list) (planted) " +
        "(item \"gone\") (box (item \"gone\")) (item \"bar\"))"),
        res.root());
    assertEquals(Arrays.asList("unwrap", "plant", "drop", "rename",
                               "collapse", "everywhere", "everywhere"),
                 res.changeLog().ruleNames());
    assertTrue(res.changeLog().entries().get(2).isDeletion());
    assertTrue(res.diagnostics().isEmpty());
  }

  /** Competing rules plus capture, parent and global successors */
  public static final String SCOPES_TREE =
      "(root (wrapper (item \"a\")) (item \"a\") (list (item \"x\")) " +
      "(list) (seed (name \"foo\")) (item \"foo\") (box (item \"foo\")) " +
      "(item \"bar\") (wrapper (item \"a\")) (seed (name \"bar\")))";

  @Test
  public void testRepeatedRunsIdentical() throws Exception {
    RuleSet rs = new RuleSpecReader().read("scopes.yaml",
                        RuleSpecReaderTest.resource("scopes.yaml"));
    FixpointDriver d = new FixpointDriver(logger, rs.graph(), rs.profile(),
        rs.substitutions(NO_SUBS), 100, 0,
        new DeadCodeSimplifier(rs.profile(), 10));
    RewriteResult first = d.run(TreeNotation.read(SCOPES_TREE));
    assertTrue(first.changeLog().size() > 5);
    for (int i = 0; i < 5; i++) {
      RewriteResult again = d.run(TreeNotation.read(SCOPES_TREE));
      assertEquals(first.changeLog().toString(),
                   again.changeLog().toString());
      assertEquals(TreeNotation.print(first.root()),
                   TreeNotation.print(again.root()));
      assertEquals(first.iterations(), again.iterations());
    }
  }

  @Test
  public void testFirstDeclaredRuleWins() throws Exception {
    RuleGraph g = RuleGraph.builder()
        .register(rename("first", "a", "one"))
        .register(rename("second", "a", "two"))
        .build();
    RewriteResult res = driver(g).run(TreeNotation.read(
        "(root (item \"a\") (item \"a\"))"));
    assertEquals(TreeNotation.read("(root (item \"one\") (item \"one\"))"),
                 res.root());
    assertEquals(Arrays.asList("first", "first"),
                 res.changeLog().ruleNames());
  }

  @Test
  public void testOutermostFirst() throws Exception {
    Rule swap = Rule.rewrite("swap",
        Pattern.node("pair", Pattern.capture("x"), Pattern.capture("y")),
        Template.node("swapped", Template.hole("y"), Template.hole("x")));
    RuleGraph g = RuleGraph.builder()
        .register(rename("inner", "a", "b"))
        .register(swap)
        .build();
    RewriteResult res = driver(g).run(TreeNotation.read(
        "(root (pair (item \"a\") (item \"c\")))"));
    assertTrue(res.isConverged());
    assertEquals(2, res.iterations());
    assertEquals(TreeNotation.read(
        "(root (swapped (item \"c\") (item \"b\")))"), res.root());
    assertEquals(Arrays.asList("swap", "inner"),
                 res.changeLog().ruleNames());
  }

  @Test
  public void testSecondRunChangesNothing() throws Exception {
    RuleGraph g = RuleGraph.builder()
        .register(rename("ab", "a", "b"))
        .register(Rule.rewrite("drop", Pattern.literal("item", "x"),
                               Template.DELETE))
        .build();
    FixpointDriver d = driver(g);
    Node root = TreeNotation.read(
        "(root (item \"a\") (list (item \"x\") (item \"a\")))");
    RewriteResult first = d.run(root);
    assertEquals(3, first.changeLog().size());
    RewriteResult second = d.run(first.root());
    assertTrue(second.isConverged());
    assertEquals(0, second.iterations());
    assertTrue(second.changeLog().isEmpty());
    assertEquals(first.root(), second.root());

    // Same input gives the same output and log
    RewriteResult again = d.run(root);
    assertEquals(first.root(), again.root());
    assertEquals(first.changeLog().toString(),
                 again.changeLog().toString());
  }

  @Test
  public void testIterationBudget() throws Exception {
    RuleGraph g = RuleGraph.builder()
        .register(rename("ab", "a", "b"))
        .register(rename("ba", "b", "a"))
        .build();
    RewriteResult res = driver(g, 5, 0).run(TreeNotation.read(
        "(root (item \"a\"))"));
    assertTrue(res.isBudgetExhausted());
    assertEquals(DriverState.BUDGET_EXHAUSTED, res.state());
    assertEquals(5, res.iterations());
    assertEquals(TreeNotation.read("(root (item \"b\"))"), res.root());
    assertEquals(1, res.diagnostics().size());
  }

  @Test
  public void testDeadline() throws Exception {
    RuleGraph g = RuleGraph.builder()
        .register(rename("ab", "a", "b"))
        .register(rename("ba", "b", "a"))
        .build();
    RewriteResult res = driver(g, Long.MAX_VALUE, 1).run(
                          TreeNotation.read("(root (item \"a\"))"));
    assertTrue(res.isBudgetExhausted());
    assertTrue(res.diagnostics().get(0).startsWith("Deadline"));
  }

  @Test
  public void testMatchOnlyRuleReports() throws Exception {
    RuleGraph g = RuleGraph.builder()
        .register(new Rule("todo",
            Pattern.capture("c", Pattern.text("//\\s*TODO.*")), null,
            null, true, null))
        .build();
    Node root = TreeNotation.read(
        "(root (comment \"// keep\") (comment \"// TODO: remove\"))");
    RewriteResult res = driver(g).run(root);
    assertTrue(res.isConverged());
    assertEquals(0, res.iterations());
    assertEquals(root, res.root());
    assertEquals(1, res.matches().size());
    MatchReport m = res.matches().get(0);
    assertEquals("todo", m.ruleName);
    assertEquals(root.child(1).span(), m.span);
    assertEquals("// TODO: remove", m.captures.get("c"));
  }

  @Test
  public void testUnboundCaptureSkipsOnlyThatRewrite() throws Exception {
    Rule partial = Rule.rewrite("partial",
        Pattern.oneOf(Pattern.capture("c", Pattern.node("a")),
                      Pattern.node("b")),
        Template.node("wrapped", Template.hole("c")));
    RuleGraph g = RuleGraph.builder()
        .register(partial)
        .register(rename("xy", "x", "y"))
        .build();
    RewriteResult res = driver(g).run(TreeNotation.read(
        "(root (b \"1\") (item \"x\"))"));
    assertTrue(res.isConverged());
    assertEquals(TreeNotation.read("(root (b \"1\") (item \"y\"))"),
                 res.root());
    assertEquals(1, res.diagnostics().size());
    assertTrue(res.diagnostics().get(0).contains("partial"));
  }

  @Test
  public void testUnsubstitutedRuleIsNeverTried() throws Exception {
    RuleGraph g = RuleGraph.builder()
        .register(rename("flagged", "@flag", "done"))
        .build();
    Node root = TreeNotation.read("(root (item \"@flag\") (item \"F\"))");
    RewriteResult res = driver(g).run(root);
    assertEquals(root, res.root());

    RewriteResult filled = new FixpointDriver(logger, g,
        CleanupProfile.EMPTY, Collections.singletonMap("flag", "F"), 100, 0,
        new DeadCodeSimplifier(CleanupProfile.EMPTY, 10)).run(root);
    assertEquals(TreeNotation.read(
        "(root (item \"@flag\") (item \"done\"))"), filled.root());
  }

  @Test
  public void testSuccessorTakesCaptureText() throws Exception {
    Rule def = new Rule("def",
        Pattern.node("def", Pattern.capture("name", Pattern.node("name"))),
        Template.DELETE, null, true,
        Collections.singletonList(Edge.global("use")));
    Rule use = new Rule("use", Pattern.literal("ref", "@name"),
        Template.leaf("ref", "inlined"), null, false, null);
    RuleGraph g = RuleGraph.builder().register(def).register(use).build();
    RewriteResult res = driver(g).run(TreeNotation.read(
        "(root (def (name \"v\")) (ref \"v\") (ref \"w\"))"));
    assertEquals(TreeNotation.read(
        "(root (ref \"inlined\") (ref \"w\"))"), res.root());
  }

  @Test
  public void testLimitsFromSettings() throws Exception {
    Settings.set(Settings.MAX_ITERATIONS, "1");
    try {
      RuleSet rs = new RuleSet(RuleGraph.builder()
          .register(rename("ab", "a", "b"))
          .register(rename("bc", "b", "c"))
          .build(), null, NO_SUBS);
      RewriteResult res = new FixpointDriver(logger, rs, NO_SUBS).run(
                          TreeNotation.read("(root (item \"a\"))"));
      assertTrue(res.isBudgetExhausted());
      assertEquals(TreeNotation.read("(root (item \"b\"))"), res.root());
    } finally {
      Settings.reset(Settings.MAX_ITERATIONS);
    }
  }
}
