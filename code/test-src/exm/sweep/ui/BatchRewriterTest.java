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
package exm.sweep.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.sweep.common.Logging;
import exm.sweep.common.exceptions.SweepRuntimeError;
import exm.sweep.engine.FixpointDriver;
import exm.sweep.engine.FixpointDriverTest;
import exm.sweep.engine.RewriteResult;
import exm.sweep.match.Pattern;
import exm.sweep.rules.Rule;
import exm.sweep.rules.RuleGraph;
import exm.sweep.rules.RuleSet;
import exm.sweep.rules.RuleSpecReader;
import exm.sweep.rules.RuleSpecReaderTest;
import exm.sweep.rules.Template;
import exm.sweep.simplify.CleanupProfile;
import exm.sweep.simplify.DeadCodeSimplifier;
import exm.sweep.tree.TreeNotation;
import exm.sweep.ui.BatchRewriter.FileResult;
import exm.sweep.ui.BatchRewriter.Input;

public class BatchRewriterTest {

  private static Logger logger;
  private static FixpointDriver driver;

  @BeforeClass
  public static void setup() throws Exception {
    logger = Logging.setupLogging(null, false);
    RuleGraph g = RuleGraph.builder()
        .register(Rule.rewrite("ab", Pattern.literal("item", "a"),
                               Template.leaf("item", "b")))
        .build();
    driver = new FixpointDriver(logger, g, CleanupProfile.EMPTY,
        Collections.<String, String>emptyMap(), 100, 0,
        new DeadCodeSimplifier(CleanupProfile.EMPTY, 10));
  }

  @Test
  public void testFailureIsolatedToOneInput() throws Exception {
    BatchRewriter batch = new BatchRewriter(logger, driver, 2);
    List<FileResult> results = batch.rewriteAll(Arrays.asList(
        new Input("good.tree", "(root (item \"a\"))"),
        new Input("bad.tree", "(root (item \"a\")"),
        new Input("other.tree", "(root (item \"c\") (item \"a\"))")));
    assertEquals(3, results.size());

    FileResult good = results.get(0);
    assertEquals("good.tree", good.name);
    assertTrue(good.succeeded());
    assertEquals(TreeNotation.read("(root (item \"b\"))"),
                 good.result.root());

    FileResult bad = results.get(1);
    assertFalse(bad.succeeded());
    assertFalse(bad.internalError);
    assertTrue(bad.error, bad.error.contains("bad.tree"));

    FileResult other = results.get(2);
    assertTrue(other.succeeded());
    assertNull(other.error);
    assertEquals(1, other.result.changeLog().size());
  }

  @Test
  public void testResultsInInputOrder() {
    List<Input> inputs = new ArrayList<Input>();
    for (int i = 0; i < 20; i++) {
      inputs.add(new Input("t" + i, "(root (item \"" +
                           (i % 2 == 0 ? "a" : "z") + "\"))"));
    }
    List<FileResult> results =
            new BatchRewriter(logger, driver, 4).rewriteAll(inputs);
    for (int i = 0; i < 20; i++) {
      assertEquals("t" + i, results.get(i).name);
      assertEquals(i % 2 == 0 ? 1 : 0,
                   results.get(i).result.changeLog().size());
    }
  }

  @Test(expected=SweepRuntimeError.class)
  public void testNeedsAThread() {
    new BatchRewriter(logger, driver, 0);
  }

  @Test
  public void testThreadsDoNotChangeResults() throws Exception {
    RuleSet rs = new RuleSpecReader().read("scopes.yaml",
                        RuleSpecReaderTest.resource("scopes.yaml"));
    FixpointDriver d = new FixpointDriver(logger, rs.graph(), rs.profile(),
        rs.substitutions(Collections.<String, String>emptyMap()), 100, 0,
        new DeadCodeSimplifier(rs.profile(), 10));
    RewriteResult single = d.run(
                      TreeNotation.read(FixpointDriverTest.SCOPES_TREE));
    List<Input> inputs = new ArrayList<Input>();
    for (int i = 0; i < 8; i++) {
      inputs.add(new Input("t" + i + ".tree", FixpointDriverTest.SCOPES_TREE));
    }
    List<FileResult> results = new BatchRewriter(logger, d, 4)
                                                  .rewriteAll(inputs);
    for (FileResult r: results) {
      assertTrue(r.error, r.succeeded());
      assertEquals(single.changeLog().toString(),
                   r.result.changeLog().toString());
      assertEquals(TreeNotation.print(single.root()),
                   TreeNotation.print(r.result.root()));
    }
  }
}
