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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exm.sweep.common.util.TernaryLogic.Ternary;
import exm.sweep.tree.Node;
import exm.sweep.tree.Span;

/**
 * Language vocabulary for the simplifier: which node kinds are boolean
 * literals, operators, conditionals, blocks and so on.  Nothing about a
 * particular language is hard-coded in the passes; they only consult the
 * profile.  Any part may be missing, in which case the passes that need
 * it do nothing.
 */
public class CleanupProfile {

  public static final CleanupProfile EMPTY = new Builder("none").build();

  /** Leaf of a given kind, optionally with a given text */
  public static class LiteralShape {
    public final String kind;
    public final String value;

    public LiteralShape(String kind, String value) {
      this.kind = kind;
      this.value = value;
    }

    public boolean matches(Node node) {
      return node.kind().equals(kind) &&
             (value == null || value.equals(node.text()));
    }

    public Node make(String field, Span span) {
      return Node.create(kind, field, value == null ? kind : value,
                         Collections.<Node>emptyList(), span);
    }
  }

  /**
   * Operator node recognised by kind plus an operator token among its
   * children.  The operands are the remaining children.
   */
  public static class OperatorShape {
    public final String kind;
    public final String operator;

    public OperatorShape(String kind, String operator) {
      this.kind = kind;
      this.operator = operator;
    }

    public boolean matches(Node node) {
      return node.kind().equals(kind) && operatorIndex(node) >= 0;
    }

    private int operatorIndex(Node node) {
      for (int i = 0; i < node.childCount(); i++) {
        Node c = node.child(i);
        if (c.isLeaf() && (operator.equals(c.kind()) ||
                           operator.equals(c.value()))) {
          return i;
        }
      }
      return -1;
    }

    public List<Node> operands(Node node) {
      int op = operatorIndex(node);
      List<Node> res = new ArrayList<Node>(node.childCount());
      for (int i = 0; i < node.childCount(); i++) {
        if (i != op) {
          res.add(node.child(i));
        }
      }
      return res;
    }
  }

  /** if/else statement or ternary expression */
  public static class ConditionalShape {
    public final String kind;
    public final String conditionField;
    public final String consequenceField;
    public final String alternativeField;

    public ConditionalShape(String kind, String conditionField,
                       String consequenceField, String alternativeField) {
      this.kind = kind;
      this.conditionField = conditionField;
      this.consequenceField = consequenceField;
      this.alternativeField = alternativeField;
    }

    public boolean matches(Node node) {
      return node.kind().equals(kind) && condition(node) != null &&
             consequence(node) != null;
    }

    public Node condition(Node node) {
      return node.childByField(conditionField);
    }

    public Node consequence(Node node) {
      return node.childByField(consequenceField);
    }

    /**
     * @return alternative as it appears in the tree, possibly wrapped in an
     *         else clause, or null
     */
    public Node alternative(Node node) {
      return alternativeField == null ? null :
             node.childByField(alternativeField);
    }
  }

  /** Local binding: names field holds identifiers, value field the init */
  public static class DeclarationShape {
    public final String kind;
    public final String namesField;
    public final String valueField;

    public DeclarationShape(String kind, String namesField,
                            String valueField) {
      this.kind = kind;
      this.namesField = namesField;
      this.valueField = valueField;
    }
  }

  public static class CallShape {
    public final String kind;
    public final String functionField;

    public CallShape(String kind, String functionField) {
      this.kind = kind;
      this.functionField = functionField;
    }
  }

  private final String name;
  private final LiteralShape trueLiteral;
  private final LiteralShape falseLiteral;
  private final Set<String> literalKinds;
  private final OperatorShape and;
  private final OperatorShape or;
  private final OperatorShape not;
  private final Set<String> parenthesisKinds;
  private final ConditionalShape conditional;
  private final ConditionalShape ternary;
  private final String elseClauseKind;
  private final Set<String> blockKinds;
  private final Set<String> terminatorKinds;
  private final List<DeclarationShape> declarations;
  private final String identifierKind;
  private final CallShape call;
  private final Set<String> pureCalls;
  private final Set<String> pureKinds;
  private final Set<String> separatorKinds;
  private final Set<String> delimiterKinds;

  private CleanupProfile(Builder b) {
    this.name = b.name;
    this.trueLiteral = b.trueLiteral;
    this.falseLiteral = b.falseLiteral;
    this.literalKinds = frozen(b.literalKinds);
    this.and = b.and;
    this.or = b.or;
    this.not = b.not;
    this.parenthesisKinds = frozen(b.parenthesisKinds);
    this.conditional = b.conditional;
    this.ternary = b.ternary;
    this.elseClauseKind = b.elseClauseKind;
    this.blockKinds = frozen(b.blockKinds);
    this.terminatorKinds = frozen(b.terminatorKinds);
    this.declarations = Collections.unmodifiableList(
                  new ArrayList<DeclarationShape>(b.declarations));
    this.identifierKind = b.identifierKind;
    this.call = b.call;
    this.pureCalls = frozen(b.pureCalls);
    this.pureKinds = frozen(b.pureKinds);
    this.separatorKinds = frozen(b.separatorKinds);
    this.delimiterKinds = frozen(b.delimiterKinds);
  }

  private static Set<String> frozen(Set<String> s) {
    return Collections.unmodifiableSet(new LinkedHashSet<String>(s));
  }

  public static class Builder {
    private final String name;
    private LiteralShape trueLiteral;
    private LiteralShape falseLiteral;
    private final Set<String> literalKinds = new LinkedHashSet<String>();
    private OperatorShape and;
    private OperatorShape or;
    private OperatorShape not;
    private final Set<String> parenthesisKinds = new LinkedHashSet<String>();
    private ConditionalShape conditional;
    private ConditionalShape ternary;
    private String elseClauseKind;
    private final Set<String> blockKinds = new LinkedHashSet<String>();
    private final Set<String> terminatorKinds = new LinkedHashSet<String>();
    private final List<DeclarationShape> declarations =
            new ArrayList<DeclarationShape>();
    private String identifierKind;
    private CallShape call;
    private final Set<String> pureCalls = new LinkedHashSet<String>();
    private final Set<String> pureKinds = new LinkedHashSet<String>();
    private final Set<String> separatorKinds = new LinkedHashSet<String>();
    private final Set<String> delimiterKinds = new LinkedHashSet<String>();

    public Builder(String name) {
      this.name = name;
    }

    public Builder booleans(LiteralShape t, LiteralShape f) {
      this.trueLiteral = t;
      this.falseLiteral = f;
      return this;
    }

    public Builder literalKinds(Collection<String> kinds) {
      literalKinds.addAll(kinds);
      return this;
    }

    public Builder and(OperatorShape shape) {
      this.and = shape;
      return this;
    }

    public Builder or(OperatorShape shape) {
      this.or = shape;
      return this;
    }

    public Builder not(OperatorShape shape) {
      this.not = shape;
      return this;
    }

    public Builder parenthesisKinds(Collection<String> kinds) {
      parenthesisKinds.addAll(kinds);
      return this;
    }

    public Builder conditional(ConditionalShape shape) {
      this.conditional = shape;
      return this;
    }

    public Builder ternary(ConditionalShape shape) {
      this.ternary = shape;
      return this;
    }

    public Builder elseClauseKind(String kind) {
      this.elseClauseKind = kind;
      return this;
    }

    public Builder blockKinds(Collection<String> kinds) {
      blockKinds.addAll(kinds);
      return this;
    }

    public Builder terminatorKinds(Collection<String> kinds) {
      terminatorKinds.addAll(kinds);
      return this;
    }

    public Builder declaration(DeclarationShape shape) {
      declarations.add(shape);
      return this;
    }

    public Builder identifierKind(String kind) {
      this.identifierKind = kind;
      return this;
    }

    public Builder call(CallShape shape) {
      this.call = shape;
      return this;
    }

    public Builder pureCalls(Collection<String> names) {
      pureCalls.addAll(names);
      return this;
    }

    public Builder pureKinds(Collection<String> kinds) {
      pureKinds.addAll(kinds);
      return this;
    }

    public Builder separatorKinds(Collection<String> kinds) {
      separatorKinds.addAll(kinds);
      return this;
    }

    public Builder delimiterKinds(Collection<String> kinds) {
      delimiterKinds.addAll(kinds);
      return this;
    }

    public CleanupProfile build() {
      return new CleanupProfile(this);
    }
  }

  public String name() {
    return name;
  }

  public ConditionalShape conditional() {
    return conditional;
  }

  public ConditionalShape ternary() {
    return ternary;
  }

  public OperatorShape and() {
    return and;
  }

  public OperatorShape or() {
    return or;
  }

  public OperatorShape not() {
    return not;
  }

  public List<DeclarationShape> declarations() {
    return declarations;
  }

  public Set<String> separatorKinds() {
    return separatorKinds;
  }

  public boolean hasBooleans() {
    return trueLiteral != null && falseLiteral != null;
  }

  /**
   * @return TRUE or FALSE for boolean literals, MAYBE otherwise
   */
  public Ternary truth(Node node) {
    if (trueLiteral != null && trueLiteral.matches(node)) {
      return Ternary.TRUE;
    } else if (falseLiteral != null && falseLiteral.matches(node)) {
      return Ternary.FALSE;
    }
    return Ternary.MAYBE;
  }

  public Node booleanLiteral(boolean val, String field, Span span) {
    return (val ? trueLiteral : falseLiteral).make(field, span);
  }

  /**
   * A literal whose value is fixed: boolean or one of the literal kinds
   */
  public boolean isConstant(Node node) {
    return truth(node).isKnown() || literalKinds.contains(node.kind());
  }

  public boolean isParenthesized(Node node) {
    return parenthesisKinds.contains(node.kind());
  }

  /**
   * @return the expression inside parentheses, or null if there isn't
   *         exactly one
   */
  public Node unparenthesize(Node node) {
    Node inner = null;
    for (Node c: node.children()) {
      if (isDelimiter(c)) {
        continue;
      }
      if (inner != null) {
        return null;
      }
      inner = c;
    }
    return inner;
  }

  public boolean isElseClause(Node node) {
    return elseClauseKind != null && elseClauseKind.equals(node.kind());
  }

  public boolean isBlock(Node node) {
    return blockKinds.contains(node.kind());
  }

  public Set<String> blockKinds() {
    return blockKinds;
  }

  public boolean isTerminator(Node node) {
    return terminatorKinds.contains(node.kind());
  }

  /**
   * Punctuation and keywords: leaves that carry no meaning of their own
   * inside blocks, parentheses and else clauses
   */
  public boolean isDelimiter(Node node) {
    return node.isLeaf() && delimiterKinds.contains(node.kind());
  }

  public boolean isIdentifier(Node node) {
    return identifierKind != null && identifierKind.equals(node.kind()) &&
           node.hasValue();
  }

  public DeclarationShape declarationShape(Node node) {
    for (DeclarationShape d: declarations) {
      if (d.kind.equals(node.kind())) {
        return d;
      }
    }
    return null;
  }

  /**
   * Whether evaluating the expression can be skipped without changing
   * behaviour.  Unknown composite kinds are assumed impure.
   */
  public boolean isPure(Node node) {
    if (node.isLeaf()) {
      return true;
    }
    if (call != null && call.kind.equals(node.kind())) {
      Node fn = node.childByField(call.functionField);
      if (fn == null || !pureCalls.contains(fn.text())) {
        return false;
      }
      for (Node c: node.children()) {
        if (c != fn && !isPure(c)) {
          return false;
        }
      }
      return true;
    }
    boolean known = isParenthesized(node) || pureKinds.contains(node.kind())
        || (and != null && and.matches(node))
        || (or != null && or.matches(node))
        || (not != null && not.matches(node));
    if (!known) {
      return false;
    }
    for (Node c: node.children()) {
      if (!isPure(c)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "CleanupProfile(" + name + ")";
  }
}
