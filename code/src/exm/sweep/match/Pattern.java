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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

import exm.sweep.common.exceptions.InvalidRuleException;
import exm.sweep.common.exceptions.SweepRuntimeError;

/**
 * A structural pattern over nodes.  Patterns are a closed set of
 * variants distinguished by {@link PatternKind}; they can only be
 * constructed through the static builder methods below.
 *
 * Literal values and text expressions may contain holes of the form
 * {@code @name}, filled in by {@link #substitute(Map)} before matching.
 * {@code @@} stands for a literal {@code @}.
 */
public class Pattern {

  public enum PatternKind {
    /** Matches any single node */
    ANY,
    /** Kind equality, optionally with child sub-patterns */
    NODE,
    /** Exact value (leaf) or text (inner node), optionally with kind */
    LITERAL,
    /** Regular expression over the node text */
    TEXT,
    /** Field label equality around an inner pattern */
    FIELD,
    /** Binds the node matched by the inner pattern to a name */
    CAPTURE,
    /** Zero or more consecutive children, only inside a child list */
    REPEAT,
    /** First alternative that matches */
    ONE_OF,
  }

  private static final java.util.regex.Pattern HOLE =
          java.util.regex.Pattern.compile("@@|@([A-Za-z_][A-Za-z0-9_]*)");

  public final PatternKind kind;

  /** Node kind for NODE and LITERAL, may be null for LITERAL */
  private final String nodeKind;

  /**
   * LITERAL: expected value, TEXT: expression source, FIELD: field label,
   * CAPTURE: capture name
   */
  private final String str;

  /** Compiled expression for TEXT */
  private final java.util.regex.Pattern regex;

  /**
   * NODE: child sub-patterns, null if children unconstrained.
   * ONE_OF: alternatives.  FIELD, CAPTURE, REPEAT: single inner pattern.
   */
  private final List<Pattern> subs;

  /** NODE only: match sub-patterns to children in any order */
  private final boolean unordered;

  private Pattern(PatternKind kind, String nodeKind, String str,
                  List<Pattern> subs, boolean unordered) {
    this.kind = kind;
    this.nodeKind = nodeKind;
    this.str = str;
    this.subs = subs == null ? null :
            Collections.unmodifiableList(new ArrayList<Pattern>(subs));
    this.unordered = unordered;
    this.regex = kind == PatternKind.TEXT ?
                 java.util.regex.Pattern.compile(unescapeHoles(str)) : null;
  }

  private static final Pattern ANY_PATTERN =
          new Pattern(PatternKind.ANY, null, null, null, false);

  public static Pattern any() {
    return ANY_PATTERN;
  }

  /**
   * Match kind only, any children
   */
  public static Pattern node(String kind) {
    checkNonEmpty(kind, "kind");
    return new Pattern(PatternKind.NODE, kind, null, null, false);
  }

  /**
   * Match kind and exactly the given sequence of children.  REPEAT
   * sub-patterns absorb any number of children.
   */
  public static Pattern node(String kind, Pattern ...children) {
    return node(kind, Arrays.asList(children));
  }

  public static Pattern node(String kind, List<Pattern> children) {
    checkNonEmpty(kind, "kind");
    return new Pattern(PatternKind.NODE, kind, null, children, false);
  }

  /**
   * Match kind, with each sub-pattern matching a different child in any
   * order.  Children not matched by any sub-pattern are ignored.
   */
  public static Pattern unordered(String kind, Pattern ...children) {
    return unordered(kind, Arrays.asList(children));
  }

  public static Pattern unordered(String kind, List<Pattern> children) {
    checkNonEmpty(kind, "kind");
    return new Pattern(PatternKind.NODE, kind, null, children, true);
  }

  public static Pattern literal(String value) {
    return literal(null, value);
  }

  public static Pattern literal(String kind, String value) {
    if (value == null) {
      throw new SweepRuntimeError("Literal pattern needs a value");
    }
    return new Pattern(PatternKind.LITERAL, kind, value, null, false);
  }

  public static Pattern text(String regex) {
    checkNonEmpty(regex, "text expression");
    return new Pattern(PatternKind.TEXT, null, regex, null, false);
  }

  public static Pattern field(String field, Pattern inner) {
    checkNonEmpty(field, "field");
    return new Pattern(PatternKind.FIELD, null, field,
                       Collections.singletonList(inner), false);
  }

  public static Pattern capture(String name) {
    return capture(name, any());
  }

  /**
   * Bind the matched node to name.  Around a repeat in a child list, binds
   * the run of children the repeat absorbed.
   */
  public static Pattern capture(String name, Pattern inner) {
    checkNonEmpty(name, "capture name");
    return new Pattern(PatternKind.CAPTURE, null, name,
                       Collections.singletonList(inner), false);
  }

  public static Pattern repeat() {
    return repeat(any());
  }

  public static Pattern repeat(Pattern inner) {
    return new Pattern(PatternKind.REPEAT, null, null,
                       Collections.singletonList(inner), false);
  }

  public static Pattern oneOf(Pattern ...alternatives) {
    return oneOf(Arrays.asList(alternatives));
  }

  public static Pattern oneOf(List<Pattern> alternatives) {
    if (alternatives.isEmpty()) {
      throw new SweepRuntimeError("oneOf needs at least one alternative");
    }
    return new Pattern(PatternKind.ONE_OF, null, null, alternatives, false);
  }

  private static void checkNonEmpty(String s, String what) {
    if (s == null || s.isEmpty()) {
      throw new SweepRuntimeError("Pattern " + what + " must be non-empty");
    }
  }

  public String nodeKind() {
    return nodeKind;
  }

  public String value() {
    if (kind != PatternKind.LITERAL) {
      throw new SweepRuntimeError("value() for " + kind + " pattern");
    }
    return unescapeHoles(str);
  }

  public String fieldName() {
    if (kind != PatternKind.FIELD) {
      throw new SweepRuntimeError("fieldName() for " + kind + " pattern");
    }
    return str;
  }

  public String captureName() {
    if (kind != PatternKind.CAPTURE) {
      throw new SweepRuntimeError("captureName() for " + kind + " pattern");
    }
    return str;
  }

  public java.util.regex.Pattern regex() {
    if (kind != PatternKind.TEXT) {
      throw new SweepRuntimeError("regex() for " + kind + " pattern");
    }
    return regex;
  }

  /**
   * @return sub-patterns, or null for NODE patterns that don't constrain
   *         children
   */
  public List<Pattern> subs() {
    return subs;
  }

  public Pattern inner() {
    if (kind != PatternKind.FIELD && kind != PatternKind.CAPTURE &&
        kind != PatternKind.REPEAT) {
      throw new SweepRuntimeError("inner() for " + kind + " pattern");
    }
    return subs.get(0);
  }

  public boolean isUnordered() {
    return unordered;
  }

  /**
   * A capture around a repeat, binding the run of children the repeat
   * absorbed
   */
  public boolean isSequenceCapture() {
    return kind == PatternKind.CAPTURE &&
           subs.get(0).kind == PatternKind.REPEAT;
  }

  /**
   * @return names of captures anywhere in pattern, in order of appearance
   */
  public Set<String> captureNames() {
    Set<String> res = new LinkedHashSet<String>();
    collectCaptures(res);
    return res;
  }

  private void collectCaptures(Set<String> res) {
    if (kind == PatternKind.CAPTURE) {
      res.add(str);
    }
    if (subs != null) {
      for (Pattern sub: subs) {
        sub.collectCaptures(res);
      }
    }
  }

  /**
   * @return names of holes not yet substituted
   */
  public Set<String> holes() {
    Set<String> res = new LinkedHashSet<String>();
    collectHoles(res);
    return res;
  }

  private void collectHoles(Set<String> res) {
    if (kind == PatternKind.LITERAL || kind == PatternKind.TEXT) {
      Matcher m = HOLE.matcher(str);
      while (m.find()) {
        if (m.group(1) != null) {
          res.add(m.group(1));
        }
      }
    }
    if (subs != null) {
      for (Pattern sub: subs) {
        sub.collectHoles(res);
      }
    }
  }

  /**
   * Fill in holes.  Holes with no substitution are left in place.
   * @param substitutions hole name to text
   * @return new pattern, or this if nothing was substituted
   */
  public Pattern substitute(Map<String, String> substitutions) {
    if (substitutions.isEmpty()) {
      return this;
    }
    switch (kind) {
      case LITERAL:
        String newVal = fill(str, substitutions, false);
        return newVal.equals(str) ? this :
               new Pattern(kind, nodeKind, newVal, null, false);
      case TEXT:
        String newRegex = fill(str, substitutions, true);
        return newRegex.equals(str) ? this :
               new Pattern(kind, nodeKind, newRegex, null, false);
      case ANY:
        return this;
      default:
        if (subs == null) {
          return this;
        }
        List<Pattern> newSubs = new ArrayList<Pattern>(subs.size());
        boolean changed = false;
        for (Pattern sub: subs) {
          Pattern newSub = sub.substitute(substitutions);
          changed = changed || newSub != sub;
          newSubs.add(newSub);
        }
        return changed ? new Pattern(kind, nodeKind, str, newSubs, unordered)
                       : this;
    }
  }

  private static String fill(String s, Map<String, String> substitutions,
                             boolean quote) {
    Matcher m = HOLE.matcher(s);
    StringBuffer sb = new StringBuffer();
    while (m.find()) {
      String name = m.group(1);
      String replacement;
      if (name == null || !substitutions.containsKey(name)) {
        replacement = m.group();
      } else if (quote) {
        replacement = java.util.regex.Pattern.quote(substitutions.get(name));
      } else {
        replacement = substitutions.get(name).replace("@", "@@");
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static String unescapeHoles(String s) {
    return s.replace("@@", "@");
  }

  /**
   * Check the pattern is well-formed
   * @param ruleName for error messages
   * @throws InvalidRuleException
   */
  public void validate(String ruleName) throws InvalidRuleException {
    if (kind == PatternKind.REPEAT || isSequenceCapture()) {
      throw new InvalidRuleException(ruleName,
                        "repeat is only allowed in an ordered child list");
    }
    validateRec(ruleName, false);
  }

  private void validateRec(String ruleName, boolean inRepeat)
                                            throws InvalidRuleException {
    switch (kind) {
      case CAPTURE:
        if (inRepeat) {
          throw new InvalidRuleException(ruleName, "capture \"" + str +
                                         "\" inside repeat");
        }
        break;
      case NODE:
        if (subs != null) {
          for (Pattern sub: subs) {
            if ((sub.kind == PatternKind.REPEAT ||
                 sub.isSequenceCapture()) && unordered) {
              throw new InvalidRuleException(ruleName,
                        "repeat is not allowed in an unordered child list");
            }
          }
        }
        break;
      default:
        break;
    }
    if (subs != null) {
      for (Pattern sub: subs) {
        boolean sequence = sub.kind == PatternKind.REPEAT ||
                           sub.isSequenceCapture();
        if (sequence && kind != PatternKind.NODE &&
            !(kind == PatternKind.CAPTURE && sub.kind == PatternKind.REPEAT)) {
          throw new InvalidRuleException(ruleName,
                        "repeat is only allowed in an ordered child list");
        }
        sub.validateRec(ruleName, inRepeat || kind == PatternKind.REPEAT);
      }
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case ANY:
        return "_";
      case NODE:
        if (subs == null) {
          return "(" + nodeKind + " ...)";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(unordered ? "{" : "(").append(nodeKind);
        for (Pattern sub: subs) {
          sb.append(' ').append(sub);
        }
        return sb.append(unordered ? "}" : ")").toString();
      case LITERAL:
        return (nodeKind == null ? "" : nodeKind + "=") + "\"" + str + "\"";
      case TEXT:
        return "/" + str + "/";
      case FIELD:
        return str + ":" + subs.get(0);
      case CAPTURE:
        return subs.get(0) + "@" + str;
      case REPEAT:
        return subs.get(0) + "*";
      case ONE_OF:
        StringBuilder alts = new StringBuilder("[");
        for (int i = 0; i < subs.size(); i++) {
          if (i > 0) {
            alts.append(" | ");
          }
          alts.append(subs.get(i));
        }
        return alts.append("]").toString();
      default:
        throw new SweepRuntimeError("Unknown pattern kind " + kind);
    }
  }
}
