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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.sweep.common.Logging;
import exm.sweep.common.exceptions.InvalidTreeException;
import exm.sweep.engine.ChangeLog;
import exm.sweep.tree.Node;
import exm.sweep.tree.TreeNotation;

public class ConstantFoldTest {

  private static final CleanupProfile PROFILE = CLikeProfile.create();

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() {
    logger = Logging.setupLogging(null, false);
  }

  private static Node fold(String tree) throws InvalidTreeException {
    return ConstantFold.foldNode(PROFILE, TreeNotation.read(tree));
  }

  private static String and(String l, String r) {
    return "(binary_expression " + l + " (&& \"&&\") " + r + ")";
  }

  private static String or(String l, String r) {
    return "(binary_expression " + l + " (|| \"||\") " + r + ")";
  }

  private static final String T = "(true \"true\")";
  private static final String F = "(false \"false\")";
  private static final String X = "(identifier \"x\")";
  private static final String CALL =
      "(call_expression function:(identifier \"f\") " +
      "arguments:(argument_list))";

  private static void assertTree(String expected, Node actual)
                                          throws InvalidTreeException {
    assertEquals(TreeNotation.read(expected), actual);
  }

  @Test
  public void testParenthesesAndNot() throws InvalidTreeException {
    assertTree(T, fold("(parenthesized_expression (lparen \"(\") " + T +
                       " (rparen \")\"))"));
    assertTree(T, fold("(unary_expression (! \"!\") " + F + ")"));
    assertTree(F, fold("(unary_expression (! \"!\") " + T + ")"));
    Node notX = TreeNotation.read("(unary_expression (! \"!\") " + X + ")");
    assertSame(notX, ConstantFold.foldNode(PROFILE, notX));
  }

  @Test
  public void testAnd() throws InvalidTreeException {
    assertTree(X, fold(and(T, X)));
    assertTree(X, fold(and(X, T)));
    assertTree(F, fold(and(F, CALL)));
    assertTree(F, fold(and(X, F)));
    // The call still has to run
    assertTree(and(CALL, F), fold(and(CALL, F)));
  }

  @Test
  public void testOr() throws InvalidTreeException {
    assertTree(T, fold(or(T, CALL)));
    assertTree(X, fold(or(F, X)));
    assertTree(T, fold(or(X, T)));
    assertTree(or(CALL, T), fold(or(CALL, T)));
  }

  @Test
  public void testPureCallMayBeDropped() throws InvalidTreeException {
    String ready = "(call_expression function:(identifier \"isReady\") " +
                   "arguments:(argument_list " + X + "))";
    assertTree(F, fold(and(ready, F)));
  }

  @Test
  public void testFoldKeepsField() throws InvalidTreeException {
    Node n = fold("condition:" + and(T, X));
    assertEquals("condition", n.field());
    assertEquals("x", n.value());
  }

  @Test
  public void testNestedFoldLogsEachStep() throws InvalidTreeException {
    Node root = TreeNotation.read("(if_statement condition:" +
        and("(unary_expression (! \"!\") (parenthesized_expression " +
            "(lparen \"(\") " + F + " (rparen \")\")))", X) +
        " consequence:(block))");
    ChangeLog log = new ChangeLog();
    SimplifierContext ctx = new SimplifierContext(PROFILE, null, log);
    Node res = new ConstantFold().simplify(logger, ctx, root);
    assertTree("(if_statement condition:" + X + " consequence:(block))",
               res);
    assertEquals(3, log.size());
    assertEquals(ConstantFold.CHANGE_NAME, log.entries().get(0).ruleName);
  }

  @Test
  public void testNoBooleansNoFolding() throws InvalidTreeException {
    Node root = TreeNotation.read(and(T, X));
    SimplifierContext ctx = new SimplifierContext(CleanupProfile.EMPTY,
                                                  null, new ChangeLog());
    assertSame(root, new ConstantFold().simplify(logger, ctx, root));
  }
}
