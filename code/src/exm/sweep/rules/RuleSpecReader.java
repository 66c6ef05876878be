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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import exm.sweep.common.Logging;
import exm.sweep.common.exceptions.InvalidRuleException;
import exm.sweep.match.Pattern;
import exm.sweep.rules.RuleSpec.ConditionalDef;
import exm.sweep.rules.RuleSpec.DeclarationDef;
import exm.sweep.rules.RuleSpec.EdgeDef;
import exm.sweep.rules.RuleSpec.LanguageDef;
import exm.sweep.rules.RuleSpec.LiteralDef;
import exm.sweep.rules.RuleSpec.OperatorDef;
import exm.sweep.rules.RuleSpec.PatternDef;
import exm.sweep.rules.RuleSpec.RuleDef;
import exm.sweep.rules.RuleSpec.SuccessorDef;
import exm.sweep.rules.RuleSpec.TemplateDef;
import exm.sweep.simplify.CleanupProfile;

/**
 * Reads rule documents.  YAML is a superset of JSON, so one reader
 * handles both.  Every problem in the document is reported as an
 * {@link InvalidRuleException} before any tree is touched.
 */
public class RuleSpecReader {

  private final ObjectMapper mapper;

  public RuleSpecReader() {
    mapper = new ObjectMapper(new YAMLFactory());
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
  }

  public RuleSet read(File file) throws InvalidRuleException {
    String text;
    try {
      text = FileUtils.readFileToString(file, "UTF-8");
    } catch (IOException e) {
      throw new InvalidRuleException("Could not read rule file " +
                                     file + ": " + e.getMessage(), e);
    }
    return read(file.getPath(), text);
  }

  public RuleSet read(String source, String text)
                                          throws InvalidRuleException {
    RuleSpec spec;
    try {
      spec = mapper.readValue(text, RuleSpec.class);
    } catch (JsonProcessingException e) {
      throw new InvalidRuleException("Malformed rule document " + source +
                                     ": " + e.getOriginalMessage(), e);
    }
    if (spec == null) {
      throw new InvalidRuleException(null, "empty rule document " + source);
    }
    RuleSet rs = compile(spec);
    Logger logger = Logging.getSweepLogger();
    logger.debug("Read " + rs.graph().rules().size() + " rules from " +
                 source + " for " + rs.profile());
    return rs;
  }

  public RuleSet compile(RuleSpec spec) throws InvalidRuleException {
    RuleGraph.Builder builder = RuleGraph.builder();
    for (RuleDef def: spec.rules) {
      builder.register(compileRule(def));
    }
    for (EdgeDef def: spec.edges) {
      if (StringUtils.isBlank(def.from)) {
        throw new InvalidRuleException(null, "edge without \"from\"");
      }
      for (String to: def.to) {
        builder.addEdge(def.from, compileEdge(def.from, to, def.scope,
                                              def.capture, def.enclosing));
      }
    }
    return new RuleSet(builder.build(), compileProfile(spec.language),
                       spec.substitutions);
  }

  private Rule compileRule(RuleDef def) throws InvalidRuleException {
    if (StringUtils.isBlank(def.name)) {
      throw new InvalidRuleException(null, "rule without a name");
    }
    Pattern pattern = def.pattern == null ? null :
                      compilePattern(def.name, def.pattern);
    Template replacement = def.replacement == null ? null :
                      compileTemplate(def.name, def.replacement, true);
    ScopeConstraint scope = def.scope == null ? null :
      new ScopeConstraint(def.scope.parent, def.scope.field,
                          def.scope.enclosing);
    List<Edge> successors = new ArrayList<Edge>();
    for (SuccessorDef s: def.successors) {
      successors.add(compileEdge(def.name, s.rule, s.scope, s.capture,
                                 s.enclosing));
    }
    return new Rule(def.name, pattern, replacement, scope, def.topLevel,
                    successors);
  }

  private Edge compileEdge(String from, String to, String scope,
          String capture, String enclosing) throws InvalidRuleException {
    if (StringUtils.isBlank(to)) {
      throw new InvalidRuleException(from, "edge without a target rule");
    }
    EdgeScope s;
    try {
      s = EdgeScope.fromString(scope);
    } catch (IllegalArgumentException e) {
      throw new InvalidRuleException(from, "unknown edge scope \"" +
                                     scope + "\"");
    }
    switch (s) {
      case CAPTURE:
        if (StringUtils.isBlank(capture)) {
          throw new InvalidRuleException(from, "capture edge to " + to +
                                         " needs \"capture\"");
        }
        return Edge.capture(to, capture);
      case ENCLOSING:
        if (StringUtils.isBlank(enclosing)) {
          throw new InvalidRuleException(from, "enclosing edge to " + to +
                                         " needs \"enclosing\"");
        }
        return Edge.enclosing(to, enclosing);
      default:
        return Edge.create(to, s, null);
    }
  }

  Pattern compilePattern(String rule, PatternDef def)
                                          throws InvalidRuleException {
    Pattern base;
    int shapes = count(def.any != null && def.any, def.repeat != null,
                       def.oneOf != null, def.text != null,
                       def.value != null || def.kind != null);
    if (shapes > 1) {
      throw new InvalidRuleException(rule, "pattern mixes shapes: " +
              "use one of any, repeat, oneOf, text, value or kind");
    }
    if (def.children != null && (def.kind == null || def.value != null)) {
      throw new InvalidRuleException(rule, "children need a kind " +
                                     "and no value");
    }
    if (def.repeat != null) {
      base = Pattern.repeat(compilePattern(rule, def.repeat));
    } else if (def.oneOf != null) {
      List<Pattern> alts = new ArrayList<Pattern>();
      for (PatternDef alt: def.oneOf) {
        alts.add(compilePattern(rule, alt));
      }
      if (alts.isEmpty()) {
        throw new InvalidRuleException(rule, "empty oneOf");
      }
      base = Pattern.oneOf(alts);
    } else if (def.text != null) {
      try {
        base = Pattern.text(def.text);
      } catch (java.util.regex.PatternSyntaxException e) {
        throw new InvalidRuleException(rule, "bad text expression: " +
                                       e.getDescription());
      }
    } else if (def.value != null) {
      base = Pattern.literal(def.kind, def.value);
    } else if (def.kind != null) {
      if (def.children == null) {
        base = Pattern.node(def.kind);
      } else {
        List<Pattern> subs = new ArrayList<Pattern>();
        for (PatternDef c: def.children) {
          subs.add(compilePattern(rule, c));
        }
        base = def.unordered ? Pattern.unordered(def.kind, subs) :
                               Pattern.node(def.kind, subs);
      }
    } else {
      base = Pattern.any();
    }
    if (def.capture != null) {
      base = Pattern.capture(def.capture, base);
    }
    if (def.field != null) {
      base = Pattern.field(def.field, base);
    }
    return base;
  }

  private static int count(boolean ...flags) {
    int n = 0;
    for (boolean f: flags) {
      if (f) {
        n++;
      }
    }
    return n;
  }

  private Template compileTemplate(String rule, TemplateDef def,
                           boolean top) throws InvalidRuleException {
    int shapes = count(def.delete, def.capture != null, def.splice != null,
                       def.kind != null);
    if (shapes != 1) {
      throw new InvalidRuleException(rule, "replacement must be exactly " +
              "one of delete, capture, splice or kind");
    }
    Template t;
    if (def.delete) {
      if (!top) {
        throw new InvalidRuleException(rule,
                                "delete marker inside replacement");
      }
      return Template.DELETE;
    } else if (def.capture != null) {
      t = Template.hole(def.capture);
    } else if (def.splice != null) {
      if (def.field != null) {
        throw new InvalidRuleException(rule, "splice cannot take a field");
      }
      return Template.splice(def.splice);
    } else {
      List<Template> kids = new ArrayList<Template>();
      if (def.children != null) {
        for (TemplateDef c: def.children) {
          kids.add(compileTemplate(rule, c, false));
        }
      }
      t = Template.node(def.kind, def.value, kids);
    }
    return def.field == null ? t : t.withField(def.field);
  }

  private CleanupProfile compileProfile(LanguageDef def)
                                          throws InvalidRuleException {
    if (def == null) {
      return CleanupProfile.EMPTY;
    }
    CleanupProfile.Builder b = new CleanupProfile.Builder(def.name);
    if ((def.trueLiteral == null) != (def.falseLiteral == null)) {
      throw new InvalidRuleException(null, "language " + def.name +
              ": give both trueLiteral and falseLiteral or neither");
    }
    if (def.trueLiteral != null) {
      b.booleans(literal(def.name, def.trueLiteral),
                 literal(def.name, def.falseLiteral));
    }
    b.literalKinds(def.literals);
    b.and(operator(def.name, def.and));
    b.or(operator(def.name, def.or));
    b.not(operator(def.name, def.not));
    b.parenthesisKinds(def.parentheses);
    b.conditional(conditional(def.name, def.conditional));
    b.ternary(conditional(def.name, def.ternary));
    b.elseClauseKind(def.elseClause);
    b.blockKinds(def.blocks);
    b.terminatorKinds(def.terminators);
    for (DeclarationDef d: def.declarations) {
      requireKind(def.name, "declaration", d.kind);
      b.declaration(new CleanupProfile.DeclarationShape(d.kind, d.names,
                                                        d.value));
    }
    b.identifierKind(def.identifier);
    if (def.call != null) {
      requireKind(def.name, "call", def.call.kind);
      b.call(new CleanupProfile.CallShape(def.call.kind,
                                          def.call.function));
    }
    b.pureCalls(def.pureCalls);
    b.pureKinds(def.pureKinds);
    b.separatorKinds(def.separators);
    b.delimiterKinds(def.delimiters);
    return b.build();
  }

  private static void requireKind(String lang, String what, String kind)
                                          throws InvalidRuleException {
    if (StringUtils.isBlank(kind)) {
      throw new InvalidRuleException(null, "language " + lang + ": " +
                                     what + " needs a kind");
    }
  }

  private static CleanupProfile.LiteralShape literal(String lang,
                      LiteralDef def) throws InvalidRuleException {
    requireKind(lang, "literal", def.kind);
    return new CleanupProfile.LiteralShape(def.kind, def.value);
  }

  private static CleanupProfile.OperatorShape operator(String lang,
                      OperatorDef def) throws InvalidRuleException {
    if (def == null) {
      return null;
    }
    requireKind(lang, "operator", def.kind);
    if (StringUtils.isEmpty(def.operator)) {
      throw new InvalidRuleException(null, "language " + lang +
              ": operator " + def.kind + " needs an operator token");
    }
    return new CleanupProfile.OperatorShape(def.kind, def.operator);
  }

  private static CleanupProfile.ConditionalShape conditional(String lang,
                      ConditionalDef def) throws InvalidRuleException {
    if (def == null) {
      return null;
    }
    requireKind(lang, "conditional", def.kind);
    return new CleanupProfile.ConditionalShape(def.kind, def.condition,
                                      def.consequence, def.alternative);
  }
}
