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
import exm.sweep.rules.RuleSet;
import exm.sweep.rules.RuleSpecReader;
import exm.sweep.rules.RuleSpecReaderTest;
import exm.sweep.simplify.DeadCodeSimplifier;
import exm.sweep.tree.TreeNotation;

/**
 * Stale flag cleanup on Go-shaped trees, with the flag rules chaining
 * into dead code removal
 */
public class FlagCleanupTest {

  private static Logger logger;
  private static RuleSet flagRules;

  @BeforeClass
  public static void setup() throws Exception {
    logger = Logging.setupLogging(null, false);
    flagRules = new RuleSpecReader().read("go-flags.yaml",
                        RuleSpecReaderTest.resource("go-flags.yaml"));
  }

  private static RewriteResult run(RuleSet rs, String tree)
                                                  throws Exception {
    Map<String, String> none = Collections.emptyMap();
    FixpointDriver d = new FixpointDriver(logger, rs.graph(), rs.profile(),
        rs.substitutions(none), 100, 0,
        new DeadCodeSimplifier(rs.profile(), 10));
    return d.run(TreeNotation.read(tree));
  }

  private static String call(String fn, String arg) {
    return "(call_expression function:(identifier \"" + fn + "\") " +
           "arguments:(argument_list" +
           (arg == null ? "" : " (identifier \"" + arg + "\")") + "))";
  }

  private static String block(String ...stmts) {
    StringBuilder sb = new StringBuilder("(block ({ \"{\")");
    for (String s: stmts) {
      sb.append(' ').append(s);
    }
    return sb.append(" (} \"}\"))").toString();
  }

  private static String function(String name, String body) {
    return "(source_file (function_declaration (func \"func\") " +
           "name:(identifier \"" + name + "\") " +
           "(parameter_list (lparen \"(\") (rparen \")\")) " +
           "body:" + body + "))";
  }

  private static String ret(String value) {
    return "(return_statement (return \"return\") " +
           "(interpreted_string_literal \"" + value + "\"))";
  }

  private static String decl(String name, String value) {
    return "(short_var_declaration left:(expression_list (identifier \"" +
           name + "\")) (:= \":=\") right:(expression_list " + value + "))";
  }

  private static String str(String s) {
    return "(interpreted_string_literal \"\\\"" + s + "\\\"\")";
  }

  private static String callStr(String fn, String arg) {
    return "(call_expression function:(identifier \"" + fn + "\") " +
           "arguments:(argument_list " + str(arg) + "))";
  }

  /** exp.Getter("arg") */
  private static String expValue(String getter, String arg) {
    return "(call_expression function:(selector_expression " +
           "operand:(identifier \"exp\") (. \".\") " +
           "field:(field_identifier \"" + getter + "\")) " +
           "arguments:(argument_list " + str(arg) + "))";
  }

  /** a, b := value */
  private static String declPair(String a, String b, String value) {
    return "(short_var_declaration left:(expression_list (identifier \"" +
           a + "\") (, \",\") (identifier \"" + b + "\")) (:= \":=\") " +
           "right:(expression_list " + value + "))";
  }

  private static String errCheck() {
    return "(if_statement (if \"if\") condition:(binary_expression " +
           "(identifier \"err\") (!= \"!=\") (nil \"nil\")) " +
           "consequence:" + block(call("log", "err")) + ")";
  }

  private static String retVar(String name) {
    return "(return_statement (return \"return\") (identifier \"" +
           name + "\"))";
  }

  private static String ifEnabled(String consequence, String alternative) {
    return "(if_statement (if \"if\") condition:(identifier \"enabled\") " +
           "consequence:" + consequence +
           " alternative:(else_clause (else \"else\") " + alternative + "))";
  }

  @Test
  public void testVariableChainsIntoPrunedBranch() throws Exception {
    String before = function("f", block(
        decl("enabled", call("isDisabled", "STALE_FLAG")),
        "(if_statement (if \"if\") condition:(unary_expression (! \"!\") " +
          "(identifier \"enabled\")) consequence:" +
          block(ret("not enabled")) + ")",
        ret("enabled")));
    RewriteResult res = run(flagRules, before);
    assertTrue(res.isConverged());
    assertEquals(3, res.iterations());
    assertEquals(TreeNotation.read(function("f", block(ret("not enabled")))),
                 res.root());
    assertEquals(Arrays.asList("replace_is_disabled", "delete_false_variable",
        "replace_false_variable", "simplify:constant-fold",
        "simplify:branch-prune", "simplify:unreachable"),
        res.changeLog().ruleNames());
  }

  @Test
  public void testUnreachableOnlyInPrunedBlock() throws Exception {
    String before = function("g", block(
        "(if_statement (if \"if\") condition:(identifier \"a\") " +
          "consequence:" + block(
            "(if_statement (if \"if\") condition:" +
              call("isEnabled", "STALE_FLAG") + " consequence:" +
              block(ret("early")) + ")",
            call("println", "removed")) + ")",
        ret("late"),
        call("println", "kept")));
    RewriteResult res = run(flagRules, before);
    assertTrue(res.isConverged());
    assertEquals(1, res.iterations());
    String after = function("g", block(
        "(if_statement (if \"if\") condition:(identifier \"a\") " +
          "consequence:" + block(ret("early")) + ")",
        ret("late"),
        call("println", "kept")));
    assertEquals(TreeNotation.read(after), res.root());
    assertEquals(Arrays.asList("replace_is_enabled",
        "simplify:branch-prune", "simplify:unreachable"),
        res.changeLog().ruleNames());
  }

  @Test
  public void testEnabledTakesConsequence() throws Exception {
    String before = function("h", block(
        "(if_statement (if \"if\") condition:" +
          call("isEnabled", "STALE_FLAG") +
          " consequence:" + block(call("on", null)) +
          " alternative:(else_clause (else \"else\") " +
            block(call("off", null)) + "))",
        call("done", null)));
    RewriteResult res = run(flagRules, before);
    assertEquals(TreeNotation.read(function("h", block(call("on", null),
                                   call("done", null)))), res.root());
  }

  @Test
  public void testDisabledFallsToElseIf() throws Exception {
    String elseIf = "(if_statement (if \"if\") condition:(identifier \"b\") " +
                    "consequence:" + block(call("c", null)) + ")";
    String before = function("k", block(
        "(if_statement (if \"if\") condition:" +
          call("isDisabled", "STALE_FLAG") +
          " consequence:" + block(call("a", null)) +
          " alternative:(else_clause (else \"else\") " + elseIf + "))"));
    RewriteResult res = run(flagRules, before);
    assertEquals(TreeNotation.read(function("k", block(elseIf))),
                 res.root());
  }

  @Test
  public void testBindingThatLostItsUseIsRemoved() throws Exception {
    String before = function("m", block(
        decl("y", "(int_literal \"1\")"),
        decl("z", call("compute", null)),
        "(if_statement (if \"if\") condition:" +
          call("isDisabled", "STALE_FLAG") +
          " consequence:" + block(call("use", "y"), call("use", "z")) + ")",
        call("println", null)));
    RewriteResult res = run(flagRules, before);
    // z keeps its initializer since compute() may have effects
    assertEquals(TreeNotation.read(function("m", block(
        decl("z", call("compute", null)), call("println", null)))),
        res.root());
    assertEquals(Arrays.asList("replace_is_disabled",
        "simplify:branch-prune", "simplify:unused-binding"),
        res.changeLog().ruleNames());
  }

  @Test
  public void testOtherFlagUntouched() throws Exception {
    String before = function("n", block(
        "(if_statement (if \"if\") condition:" +
          call("isEnabled", "LIVE_FLAG") +
          " consequence:" + block(call("on", null)) + ")"));
    RewriteResult res = run(flagRules, before);
    assertTrue(res.isConverged());
    assertEquals(0, res.iterations());
    assertTrue(res.changeLog().isEmpty());
    assertEquals(TreeNotation.read(before), res.root());
  }

  @Test
  public void testTodoCommentsReported() throws Exception {
    RewriteResult res = run(flagRules, function("p", block(
        "(comment \"// TODO: drop STALE_FLAG\")", call("on", null))));
    assertEquals(1, res.matches().size());
    assertEquals("report_todo", res.matches().get(0).ruleName);
    assertEquals("// TODO: drop STALE_FLAG",
                 res.matches().get(0).captures.get("c"));
  }

  @Test
  public void testDeletedElementTakesItsSeparator() throws Exception {
    RuleSet rs = new RuleSpecReader().read("cases.yaml",
        "language:\n" +
        "  name: swift\n" +
        "  separators: [\",\"]\n" +
        "rules:\n" +
        "  - name: drop_one\n" +
        "    pattern: {kind: case, value: .one}\n" +
        "    replacement: {delete: true}\n");
    RewriteResult res = run(rs,
        "(array (lbracket \"[\") (case \".two\") (, \",\") (case \".one\") " +
        "(, \",\") (case \".four\") (rbracket \"]\"))");
    assertEquals("[.two,.four]", res.root().text());
    assertEquals(TreeNotation.read("(array (lbracket \"[\") " +
        "(case \".two\") (, \",\") (case \".four\") (rbracket \"]\"))"),
        res.root());
  }

  @Test
  public void testStringFlagTakesConsequence() throws Exception {
    String before = function("h", block(
        "(if_statement (if \"if\") condition:" +
          callStr("isEnabled", "STALE_FLAG") +
          " consequence:" + block(call("on", null)) +
          " alternative:(else_clause (else \"else\") " +
            block(call("off", null)) + "))",
        call("done", null)));
    RewriteResult res = run(flagRules, before);
    assertTrue(res.isConverged());
    assertEquals(TreeNotation.read(function("h", block(call("on", null),
                                   call("done", null)))), res.root());
    assertEquals(Arrays.asList("replace_is_enabled", "simplify:branch-prune"),
                 res.changeLog().ruleNames());
  }

  @Test
  public void testStringFlagInCondition() throws Exception {
    String before = function("h", block(
        "(if_statement (if \"if\") condition:(binary_expression " +
          callStr("isDisabled", "STALE_FLAG") + " (&& \"&&\") " +
          "(identifier \"x\")) consequence:" + block(call("a", null)) + ")",
        call("b", null)));
    RewriteResult res = run(flagRules, before);
    assertEquals(TreeNotation.read(function("h", block(call("b", null)))),
                 res.root());
  }

  @Test
  public void testTrueValueDropsErrorCheck() throws Exception {
    String before = function("a", block(
        declPair("enabled", "err", expValue("BoolValue", "true")),
        errCheck(),
        retVar("enabled")));
    RewriteResult res = run(flagRules, before);
    assertTrue(res.isConverged());
    assertEquals(TreeNotation.read(function("a", block(
        "(return_statement (return \"return\") (true \"true\"))"))),
        res.root());
    assertEquals(Arrays.asList("resolve_true_value", "replace_true_variable"),
                 res.changeLog().ruleNames());
  }

  @Test
  public void testLaterErrorRedeclarationSurvives() throws Exception {
    String before = function("b", block(
        declPair("enabled", "err", expValue("BoolValue", "true")),
        errCheck(),
        declPair("s", "err", expValue("StrValue", "str")),
        errCheck(),
        ifEnabled(block(retVar("s")), block(ret("prefix")))));
    RewriteResult res = run(flagRules, before);
    assertTrue(res.isConverged());
    assertEquals(TreeNotation.read(function("b", block(
        declPair("s", "err", expValue("StrValue", "str")),
        errCheck(),
        retVar("s")))), res.root());
    assertEquals(Arrays.asList("resolve_true_value", "replace_true_variable"),
                 res.changeLog().ruleNames().subList(0, 2));
  }

  @Test
  public void testFalseValueTakesElse() throws Exception {
    String before = function("c", block(
        declPair("enabled", "err", expValue("BoolValue", "false")),
        errCheck(),
        declPair("s", "err", expValue("StrValue", "str")),
        errCheck(),
        ifEnabled(block(retVar("s")),
                  block(call("println", "s"), ret("prefix")))));
    RewriteResult res = run(flagRules, before);
    assertEquals(TreeNotation.read(function("c", block(
        declPair("s", "err", expValue("StrValue", "str")),
        errCheck(),
        call("println", "s"),
        ret("prefix")))), res.root());
  }

  @Test
  public void testErrorCheckOnOtherVariableKept() throws Exception {
    // The check must test the error bound by the same declaration
    String before = function("d", block(
        declPair("enabled", "e2", expValue("BoolValue", "true")),
        errCheck(),
        retVar("enabled")));
    RewriteResult res = run(flagRules, before);
    assertEquals(0, res.iterations());
    assertEquals(TreeNotation.read(before), res.root());
  }
}
