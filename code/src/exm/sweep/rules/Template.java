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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.sweep.common.exceptions.InvalidRuleException;
import exm.sweep.common.exceptions.SweepRuntimeError;
import exm.sweep.match.BindingSet;
import exm.sweep.tree.Node;
import exm.sweep.tree.Span;

/**
 * Replacement for a matched node: a tree fragment whose leaves may refer
 * to captured nodes, or the deletion marker.
 *
 * Values may contain {@code @name} holes that are filled with the text of
 * a capture, or with a substitution supplied when the rule is
 * instantiated.
 */
public class Template {

  public enum TemplateKind {
    /** New node built from the template */
    NODE,
    /** The captured node itself */
    HOLE,
    /** The children of the captured node, in place */
    SPLICE,
    /** Remove the matched node */
    DELETE,
  }

  private static final Pattern VALUE_HOLE =
          Pattern.compile("@@|@([A-Za-z_][A-Za-z0-9_]*)");

  public static final Template DELETE =
          new Template(TemplateKind.DELETE, null, null, null, null, null);

  public final TemplateKind kind;
  private final String nodeKind;
  private final String field;
  private final String value;
  private final String captureName;
  private final List<Template> children;

  private Template(TemplateKind kind, String nodeKind, String field,
                   String value, String captureName, List<Template> children) {
    this.kind = kind;
    this.nodeKind = nodeKind;
    this.field = field;
    this.value = value;
    this.captureName = captureName;
    this.children = children == null ? Collections.<Template>emptyList() :
            Collections.unmodifiableList(new ArrayList<Template>(children));
  }

  public static Template leaf(String kind, String value) {
    return new Template(TemplateKind.NODE, kind, null, value, null, null);
  }

  public static Template node(String kind, Template ...children) {
    return node(kind, null, Arrays.asList(children));
  }

  public static Template node(String kind, String value,
                              List<Template> children) {
    if (kind == null || kind.isEmpty()) {
      throw new SweepRuntimeError("Template node needs a kind");
    }
    return new Template(TemplateKind.NODE, kind, null, value, null, children);
  }

  public static Template hole(String captureName) {
    return new Template(TemplateKind.HOLE, null, null, null, captureName,
                        null);
  }

  public static Template splice(String captureName) {
    return new Template(TemplateKind.SPLICE, null, null, null, captureName,
                        null);
  }

  public Template withField(String newField) {
    if (kind == TemplateKind.DELETE || kind == TemplateKind.SPLICE) {
      throw new SweepRuntimeError("Cannot set field on " + kind + " template");
    }
    return new Template(kind, nodeKind, newField, value, captureName,
                        children);
  }

  public boolean isDeletion() {
    return kind == TemplateKind.DELETE;
  }

  /**
   * @return names of captures the template places in its output
   */
  public Set<String> captureNames() {
    Set<String> res = new LinkedHashSet<String>();
    collectCaptures(res);
    return res;
  }

  private void collectCaptures(Set<String> res) {
    if (captureName != null) {
      res.add(captureName);
    }
    for (Template child: children) {
      child.collectCaptures(res);
    }
  }

  /**
   * @return names of holes in values, either captures or substitutions
   */
  public Set<String> valueHoles() {
    Set<String> res = new LinkedHashSet<String>();
    collectValueHoles(res);
    return res;
  }

  private void collectValueHoles(Set<String> res) {
    if (value != null) {
      Matcher m = VALUE_HOLE.matcher(value);
      while (m.find()) {
        if (m.group(1) != null) {
          res.add(m.group(1));
        }
      }
    }
    for (Template child: children) {
      child.collectValueHoles(res);
    }
  }

  /**
   * Fill value holes from substitutions, leaving others in place
   */
  public Template substitute(Map<String, String> substitutions) {
    if (substitutions.isEmpty() || kind != TemplateKind.NODE) {
      return this;
    }
    String newValue = value == null ? null : fill(value, substitutions);
    List<Template> newChildren = new ArrayList<Template>(children.size());
    for (Template child: children) {
      newChildren.add(child.substitute(substitutions));
    }
    return new Template(kind, nodeKind, field, newValue, captureName,
                        newChildren);
  }

  private static String fill(String s, Map<String, String> substitutions) {
    Matcher m = VALUE_HOLE.matcher(s);
    StringBuffer sb = new StringBuffer();
    while (m.find()) {
      String name = m.group(1);
      String replacement;
      if (name != null && substitutions.containsKey(name)) {
        replacement = substitutions.get(name).replace("@", "@@");
      } else {
        replacement = m.group();
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /**
   * Build the replacement for a match.
   *
   * Top-level nodes without an explicit field take over the field of the
   * matched node, since they occupy its position.  The top-level node
   * built from a NODE template takes the span of the matched node.
   * @param bindings from the match
   * @param matched the matched node
   * @return replacement nodes, empty for deletion
   * @throws InvalidRuleException if a capture is not bound
   */
  public List<Node> instantiate(String ruleName, BindingSet bindings,
                            Node matched) throws InvalidRuleException {
    List<Node> res = new ArrayList<Node>();
    instantiate(ruleName, bindings, matched.span(), true, res);
    if (matched.field() == null) {
      return res;
    }
    List<Node> withFields = new ArrayList<Node>(res.size());
    for (Node n: res) {
      withFields.add(n.field() == null ? n.withField(matched.field()) : n);
    }
    return withFields;
  }

  private void instantiate(String ruleName, BindingSet bindings,
        Span matchedSpan, boolean top, List<Node> out)
                                    throws InvalidRuleException {
    switch (kind) {
      case DELETE:
        if (!top) {
          throw new InvalidRuleException(ruleName,
                                "delete marker inside replacement");
        }
        return;
      case HOLE: {
        Node captured = lookup(ruleName, bindings);
        if (exm.sweep.match.Matcher.isSequence(captured)) {
          out.addAll(captured.children());
        } else {
          out.add(field == null ? captured : captured.withField(field));
        }
        return;
      }
      case SPLICE: {
        Node captured = lookup(ruleName, bindings);
        out.addAll(captured.children());
        return;
      }
      case NODE: {
        List<Node> kids = new ArrayList<Node>();
        for (Template child: children) {
          child.instantiate(ruleName, bindings, matchedSpan, false, kids);
        }
        String v = value == null ? null : fillFromBindings(ruleName, value,
                                                           bindings);
        out.add(Node.create(nodeKind, field, v, kids,
                            top ? matchedSpan : Span.UNKNOWN));
        return;
      }
      default:
        throw new SweepRuntimeError("Unknown template kind " + kind);
    }
  }

  private Node lookup(String ruleName, BindingSet bindings)
                                          throws InvalidRuleException {
    Node captured = bindings.get(captureName);
    if (captured == null) {
      throw new InvalidRuleException(ruleName, "replacement refers to " +
                           "capture \"" + captureName + "\" with no binding");
    }
    return captured;
  }

  private static String fillFromBindings(String ruleName, String s,
              BindingSet bindings) throws InvalidRuleException {
    Matcher m = VALUE_HOLE.matcher(s);
    StringBuffer sb = new StringBuffer();
    while (m.find()) {
      String name = m.group(1);
      String replacement;
      if (name == null) {
        replacement = "@";
      } else if (bindings.contains(name)) {
        replacement = bindings.get(name).text();
      } else {
        throw new InvalidRuleException(ruleName, "replacement value refers "
                + "to \"@" + name + "\" which is neither captured nor "
                + "substituted");
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  @Override
  public String toString() {
    switch (kind) {
      case DELETE:
        return "<delete>";
      case HOLE:
        return (field == null ? "" : field + ":") + "@" + captureName;
      case SPLICE:
        return "@" + captureName + "...";
      default:
        StringBuilder sb = new StringBuilder();
        if (field != null) {
          sb.append(field).append(':');
        }
        sb.append('(').append(nodeKind);
        if (value != null) {
          sb.append(" \"").append(value).append('"');
        }
        for (Template child: children) {
          sb.append(' ').append(child);
        }
        return sb.append(')').toString();
    }
  }
}
