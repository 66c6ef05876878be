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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule document as written in YAML or JSON.  Field names match the keys
 * in the document; Jackson fills them in and {@link RuleSpecReader}
 * compiles the result.
 */
public class RuleSpec {

  public LanguageDef language;

  /** Defaults for holes, overridden by substitutions given to the engine */
  public Map<String, String> substitutions =
          new LinkedHashMap<String, String>();

  public List<RuleDef> rules = new ArrayList<RuleDef>();

  public List<EdgeDef> edges = new ArrayList<EdgeDef>();

  public static class RuleDef {
    public String name;
    public PatternDef pattern;
    public TemplateDef replacement;
    public ScopeDef scope;
    /** False if only reachable through edges */
    public boolean topLevel = true;
    public List<SuccessorDef> successors = new ArrayList<SuccessorDef>();
  }

  /**
   * A pattern node.  Exactly one shape applies: {@code any}, {@code repeat},
   * {@code oneOf}, {@code text}, {@code value} (with optional kind), or
   * {@code kind} (with optional children).  {@code capture} and
   * {@code field} wrap whichever shape it is.
   */
  public static class PatternDef {
    public String kind;
    public String value;
    public String text;
    public String field;
    public String capture;
    public Boolean any;
    public List<PatternDef> children;
    public boolean unordered;
    public PatternDef repeat;
    public List<PatternDef> oneOf;
  }

  /**
   * A replacement node: {@code delete}, {@code capture} (the captured
   * node), {@code splice} (its children), or {@code kind} with optional
   * value and children.
   */
  public static class TemplateDef {
    public boolean delete;
    public String capture;
    public String splice;
    public String kind;
    public String value;
    public String field;
    public List<TemplateDef> children;
  }

  public static class ScopeDef {
    public String parent;
    public String field;
    public String enclosing;
  }

  public static class SuccessorDef {
    public String rule;
    public String scope = "parent";
    public String capture;
    public String enclosing;
  }

  public static class EdgeDef {
    public String from;
    public List<String> to = new ArrayList<String>();
    public String scope = "parent";
    public String capture;
    public String enclosing;
  }

  public static class LanguageDef {
    public String name = "unnamed";
    public LiteralDef trueLiteral;
    public LiteralDef falseLiteral;
    public List<String> literals = new ArrayList<String>();
    public OperatorDef and;
    public OperatorDef or;
    public OperatorDef not;
    public List<String> parentheses = new ArrayList<String>();
    public ConditionalDef conditional;
    public ConditionalDef ternary;
    public String elseClause;
    public List<String> blocks = new ArrayList<String>();
    public List<String> terminators = new ArrayList<String>();
    public List<DeclarationDef> declarations =
            new ArrayList<DeclarationDef>();
    public String identifier;
    public CallDef call;
    public List<String> pureCalls = new ArrayList<String>();
    public List<String> pureKinds = new ArrayList<String>();
    public List<String> separators = new ArrayList<String>();
    public List<String> delimiters = new ArrayList<String>();
  }

  public static class LiteralDef {
    public String kind;
    public String value;
  }

  public static class OperatorDef {
    public String kind;
    public String operator;
  }

  public static class ConditionalDef {
    public String kind;
    public String condition = "condition";
    public String consequence = "consequence";
    public String alternative = "alternative";
  }

  public static class DeclarationDef {
    public String kind;
    public String names = "left";
    public String value = "right";
  }

  public static class CallDef {
    public String kind;
    public String function = "function";
  }
}
