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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.sweep.common.exceptions.InvalidRuleException;
import exm.sweep.common.exceptions.InvalidTreeException;
import exm.sweep.match.BindingSet;
import exm.sweep.match.Matcher;
import exm.sweep.match.Pattern;
import exm.sweep.tree.Node;
import exm.sweep.tree.NodePath;
import exm.sweep.tree.Span;
import exm.sweep.tree.TreeNotation;

public class TemplateTest {

  private static final Pattern CALL = Pattern.node("call",
      Pattern.field("function", Pattern.capture("fn")),
      Pattern.field("arguments", Pattern.capture("args")));

  private static Node call() throws InvalidTreeException {
    return TreeNotation.read("value:(call function:(identifier \"f\") " +
        "arguments:(argument_list (identifier \"a\") (identifier \"b\")))");
  }

  private static List<Node> instantiate(Template t, Node n)
                                          throws InvalidRuleException {
    BindingSet b = Matcher.match(CALL, n, NodePath.root());
    return t.instantiate("test", b, n);
  }

  @Test
  public void testNodeTakesMatchedFieldAndSpan() throws Exception {
    Node n = call();
    List<Node> res = instantiate(Template.leaf("true", "true"), n);
    assertEquals(1, res.size());
    assertEquals("value", res.get(0).field());
    assertEquals(n.span(), res.get(0).span());
  }

  @Test
  public void testHoleAndCaptureText() throws Exception {
    Template t = Template.node("call", Template.hole("fn"),
                    Template.node("argument_list", "@fn(@@)",
                                  Collections.<Template>emptyList()));
    Node res = instantiate(t, call()).get(0);
    assertEquals("function", res.child(0).field());
    assertEquals("f", res.child(0).text());
    assertEquals("f(@)", res.child(1).value());
    assertEquals(Span.UNKNOWN, res.child(1).span());
  }

  @Test
  public void testSpliceInsertsChildren() throws Exception {
    List<Node> res = instantiate(Template.splice("args"), call());
    assertEquals(2, res.size());
    assertEquals("a", res.get(0).text());
    // Spliced nodes take the field of the replaced node
    assertEquals("value", res.get(1).field());
  }

  @Test
  public void testDelete() throws Exception {
    assertTrue(instantiate(Template.DELETE, call()).isEmpty());
  }

  @Test
  public void testSubstituteLeavesCaptureHoles() {
    Template t = Template.leaf("identifier", "@fn-@flag");
    assertEquals(Arrays.asList("fn", "flag"),
                 Arrays.asList(t.valueHoles().toArray()));
    Template filled = t.substitute(Collections.singletonMap("flag", "X"));
    assertEquals(Collections.singleton("fn"), filled.valueHoles());
    assertSame(Template.DELETE, Template.DELETE.substitute(
                                  Collections.singletonMap("flag", "X")));
  }

  @Test(expected=InvalidRuleException.class)
  public void testUnboundValueHole() throws Exception {
    instantiate(Template.leaf("identifier", "@missing"), call());
  }

  @Test(expected=InvalidRuleException.class)
  public void testUnboundCapture() throws Exception {
    instantiate(Template.hole("missing"), call());
  }

  @Test
  public void testHoleOnSequenceSplices() throws Exception {
    Node n = TreeNotation.read("(block (a \"1\") (c \"3\") (d \"4\"))");
    Pattern p = Pattern.node("block",
        Pattern.capture("before", Pattern.repeat()),
        Pattern.node("c"),
        Pattern.capture("after", Pattern.repeat()));
    BindingSet b = Matcher.match(p, n, NodePath.root());
    Template t = Template.node("block", Template.hole("before"),
                               Template.hole("after"));
    List<Node> out = t.instantiate("drop_c", b, n);
    assertEquals(1, out.size());
    assertEquals(TreeNotation.read("(block (a \"1\") (d \"4\"))"),
                 out.get(0));
  }
}
