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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.Lists;

import exm.sweep.common.Logging;
import exm.sweep.common.Settings;
import exm.sweep.common.exceptions.InvalidOptionException;
import exm.sweep.common.exceptions.InvalidRuleException;
import exm.sweep.common.exceptions.SweepRuntimeError;
import exm.sweep.common.util.Pair;
import exm.sweep.common.util.StackLite;
import exm.sweep.match.BindingSet;
import exm.sweep.match.Matcher;
import exm.sweep.rules.Edge;
import exm.sweep.rules.Rule;
import exm.sweep.rules.RuleGraph;
import exm.sweep.rules.RuleSet;
import exm.sweep.simplify.CleanupProfile;
import exm.sweep.simplify.DeadCodeSimplifier;
import exm.sweep.tree.Node;
import exm.sweep.tree.NodePath;
import exm.sweep.tree.Revision;
import exm.sweep.tree.Span;
import exm.sweep.tree.TreeEdit;
import exm.sweep.tree.TreeWalk;
import exm.sweep.tree.TreeWalk.TreeWalker;

/**
 * Applies a rule graph to a tree until nothing more matches.
 *
 * Each iteration scans the whole tree for matches of the eligible rules,
 * then applies the non-overlapping ones as a single batch, outermost
 * first.  Rules that fired make their successors eligible for the next
 * scan.  Runs stop when a scan finds nothing to rewrite, or when the
 * iteration cap or deadline is reached.
 *
 * The driver holds no state between runs, so one driver can serve
 * several threads.
 */
public class FixpointDriver {

  private final Logger logger;
  private final RuleGraph graph;
  private final CleanupProfile profile;
  private final Map<String, String> substitutions;
  private final long maxIterations;
  /** 0 for no deadline */
  private final long deadlineMillis;
  private final DeadCodeSimplifier simplifier;

  /**
   * Driver with limits taken from settings
   * @param substitutions hole values, overriding the rule set's defaults
   */
  public FixpointDriver(Logger logger, RuleSet rules,
        Map<String, String> substitutions) throws InvalidOptionException {
    this(logger, rules.graph(), rules.profile(),
         rules.substitutions(substitutions),
         Settings.getPositiveLong(Settings.MAX_ITERATIONS),
         Settings.getLong(Settings.DEADLINE_MILLIS),
         DeadCodeSimplifier.fromSettings(rules.profile()));
  }

  public FixpointDriver(Logger logger, RuleGraph graph,
          CleanupProfile profile, Map<String, String> substitutions,
          long maxIterations, long deadlineMillis,
          DeadCodeSimplifier simplifier) {
    this.logger = logger;
    this.graph = graph;
    this.profile = profile;
    this.substitutions = Collections.unmodifiableMap(
            new LinkedHashMap<String, String>(substitutions));
    this.maxIterations = maxIterations;
    this.deadlineMillis = deadlineMillis;
    this.simplifier = simplifier;
  }

  public RewriteResult run(Node root) {
    return new Run(root).execute();
  }

  /**
   * A match chosen during scanning
   */
  private static class Candidate {
    final Rule rule;
    final int rank;
    final Node node;
    final NodePath path;
    final BindingSet bindings;

    Candidate(Rule rule, int rank, Node node, NodePath path,
              BindingSet bindings) {
      this.rule = rule;
      this.rank = rank;
      this.node = node;
      this.path = path;
      this.bindings = bindings;
    }
  }

  private static final Comparator<Candidate> OUTERMOST_FIRST =
          new Comparator<Candidate>() {
    @Override
    public int compare(Candidate a, Candidate b) {
      if (a.path.depth() != b.path.depth()) {
        return a.path.depth() - b.path.depth();
      }
      return a.path.compareTo(b.path);
    }
  };

  /**
   * State of a single run
   */
  private class Run {
    private Revision rev;
    private final ChangeLog changeLog = new ChangeLog();
    private final List<String> diagnostics = new ArrayList<String>();
    private final Set<MatchReport> matches =
            new LinkedHashSet<MatchReport>();
    /** Rules eligible everywhere, in declaration order */
    private final List<Rule> global = new ArrayList<Rule>();
    private final Set<String> globalKeys = new HashSet<String>();
    private List<Activation> pending = new ArrayList<Activation>();
    private int iterations = 0;
    private final long startNanos = System.nanoTime();

    Run(Node root) {
      this.rev = Revision.initial(root);
      for (Rule r: graph.topLevelRules()) {
        Rule inst = r.instantiate(substitutions);
        if (inst.isInstantiated()) {
          addGlobal(inst);
        } else {
          Logging.uniqueWarn("Rule " + r.name() + " is never tried: no " +
                             "substitution for " + inst.holes());
        }
      }
    }

    private void addGlobal(Rule rule) {
      if (!globalKeys.add(rule.key())) {
        return;
      }
      int rank = graph.declarationIndex(rule.name());
      int pos = global.size();
      while (pos > 0 &&
             graph.declarationIndex(global.get(pos - 1).name()) > rank) {
        pos--;
      }
      global.add(pos, rule);
    }

    RewriteResult execute() {
      while (true) {
        logger.trace("Iteration " + iterations + ": " + DriverState.SCANNING);
        List<Candidate> candidates = scan();
        pending = new ArrayList<Activation>();
        if (candidates.isEmpty()) {
          return finish(DriverState.CONVERGED);
        }
        if (iterations >= maxIterations) {
          diagnostics.add("Stopped after " + iterations + " iterations " +
                          "with rewrites still pending");
          return finish(DriverState.BUDGET_EXHAUSTED);
        }
        if (deadlineMillis > 0 &&
            (System.nanoTime() - startNanos) / 1000000 >= deadlineMillis) {
          diagnostics.add("Deadline of " + deadlineMillis + "ms passed " +
                          "after " + iterations + " iterations");
          return finish(DriverState.BUDGET_EXHAUSTED);
        }
        iterations++;
        logger.trace("Iteration " + iterations + ": " +
                     DriverState.REWRITING + " " + candidates.size() +
                     " candidates");
        if (!rewrite(candidates)) {
          return finish(DriverState.CONVERGED);
        }
      }
    }

    private RewriteResult finish(DriverState state) {
      logger.debug(state + " after " + iterations + " iterations, " +
                   changeLog.size() + " edits");
      for (String d: diagnostics) {
        logger.debug("Diagnostic: " + d);
      }
      return new RewriteResult(rev, state, iterations, changeLog,
                  diagnostics, new ArrayList<MatchReport>(matches));
    }

    /**
     * Find the best candidate for every node
     * @return candidates in no particular order
     */
    private List<Candidate> scan() {
      final Map<NodePath, Candidate> best =
              new LinkedHashMap<NodePath, Candidate>();
      final List<Activation> capture = new ArrayList<Activation>();
      final List<Activation> enclosing = new ArrayList<Activation>();
      final List<Activation> parent = new ArrayList<Activation>();
      for (Activation a: pending) {
        switch (a.scope) {
          case CAPTURE:
            capture.add(a);
            break;
          case ENCLOSING:
            enclosing.add(a);
            break;
          case PARENT:
            parent.add(a);
            break;
          default:
            throw new SweepRuntimeError("Unexpected activation " + a);
        }
      }
      final List<Pair<Node, NodePath>> visited =
              new ArrayList<Pair<Node, NodePath>>();

      TreeWalk.walk(rev.root(), new TreeWalker() {
        /** Enclosing activations for the current subtree */
        private final StackLite<Activation> active =
                new StackLite<Activation>();
        private final StackLite<Integer> pushed = new StackLite<Integer>();

        @Override
        public boolean visit(Node node, NodePath path, List<Node> ancestors) {
          List<Node> nearestFirst = Lists.reverse(ancestors);
          if (!parent.isEmpty()) {
            visited.add(Pair.create(node, path));
          }
          for (Rule r: global) {
            consider(best, r, node, path, nearestFirst);
          }
          for (Activation a: capture) {
            for (Node target: a.targets) {
              if (Activation.sameTarget(target, node)) {
                consider(best, a.rule, node, path, nearestFirst);
                break;
              }
            }
          }
          int count = 0;
          for (Activation a: enclosing) {
            if (Activation.sameTarget(a.targets.get(0), node)) {
              active.push(a);
              count++;
            }
          }
          pushed.push(count);
          for (Activation a: active) {
            consider(best, a.rule, node, path, nearestFirst);
          }
          return true;
        }

        @Override
        public void leave(Node node, NodePath path) {
          int count = pushed.pop();
          for (int i = 0; i < count; i++) {
            active.pop();
          }
        }
      });

      for (Activation a: parent) {
        considerAncestors(best, a, visited);
      }
      return new ArrayList<Candidate>(best.values());
    }

    /**
     * Try ancestors nearest first, stopping at the first match
     */
    private void considerAncestors(Map<NodePath, Candidate> best,
              Activation a, List<Pair<Node, NodePath>> visited) {
      for (Node target: a.targets) {
        for (Pair<Node, NodePath> v: visited) {
          if (Activation.sameTarget(target, v.val1)) {
            if (consider(best, a.rule, v.val1, v.val2,
                         rev.ancestors(v.val2))) {
              return;
            }
            break;
          }
        }
      }
    }

    /**
     * @return true if the rule matched
     */
    private boolean consider(Map<NodePath, Candidate> best, Rule rule,
                   Node node, NodePath path, List<Node> ancestors) {
      if (!rule.scope().admits(node, ancestors)) {
        return false;
      }
      BindingSet bindings = Matcher.match(rule.pattern(), node, path);
      if (bindings == null) {
        return false;
      }
      if (rule.isMatchOnly()) {
        matches.add(new MatchReport(rule.name(), node.span(),
                                    bindings.texts()));
        return true;
      }
      Candidate c = new Candidate(rule, graph.declarationIndex(rule.name()),
                                  node, path, bindings);
      Candidate prev = best.get(path);
      if (prev == null) {
        best.put(path, c);
      } else if (c.rank < prev.rank) {
        ambiguous(path, c, prev);
        best.put(path, c);
      } else if (!c.rule.key().equals(prev.rule.key())) {
        ambiguous(path, prev, c);
      }
      return true;
    }

    private void ambiguous(NodePath path, Candidate winner,
                           Candidate loser) {
      if (logger.isDebugEnabled()) {
        logger.debug("Ambiguous match at " + path + " " +
                     winner.node.span() + ": " + winner.rule.key() +
                     " takes precedence over " + loser.rule.key());
      }
    }

    /**
     * Apply the candidates that do not overlap an outer one
     * @return true if the tree changed
     */
    private boolean rewrite(List<Candidate> candidates) {
      Collections.sort(candidates, OUTERMOST_FIRST);
      List<Candidate> accepted = new ArrayList<Candidate>();
      List<List<Node>> replacements = new ArrayList<List<Node>>();
      List<TreeEdit> edits = new ArrayList<TreeEdit>();
      for (Candidate c: candidates) {
        if (insideAccepted(accepted, c)) {
          logger.trace("Skipping " + c.rule.key() + " at " + c.path +
                       ": inside a rewritten region");
          continue;
        }
        List<Node> repl;
        try {
          repl = c.rule.replacement().instantiate(c.rule.name(),
                                                  c.bindings, c.node);
        } catch (InvalidRuleException e) {
          skipped("Skipped rewrite at " + c.node.span() + ": " +
                  e.getMessage());
          continue;
        }
        if (repl.size() == 1 && repl.get(0).equals(c.node)) {
          logger.trace("Skipping no-op " + c.rule.key() + " at " + c.path);
          continue;
        }
        if (c.path.isRoot() && repl.size() != 1) {
          skipped("Rule " + c.rule.name() + " would replace the root " +
                  "with " + repl.size() + " nodes");
          continue;
        }
        accepted.add(c);
        replacements.add(repl);
        edits.add(TreeEdit.splice(c.path, repl));
      }
      if (accepted.isEmpty()) {
        return false;
      }

      Revision before = rev;
      Revision.Applied applied = rev.apply(edits, profile.separatorKinds());
      rev = applied.revision;
      boolean newConstant = false;
      for (int i = 0; i < accepted.size(); i++) {
        Candidate c = accepted.get(i);
        List<Node> repl = replacements.get(i);
        changeLog.add(c.rule.name(), c.node.span(), replacementSpan(repl));
        if (logger.isTraceEnabled()) {
          logger.trace("Rewrote " + c.node + " with " + repl + " (" +
                       c.rule.name() + ")");
        }
        newConstant = newConstant || introducesConstant(c.node, repl);
        activateSuccessors(c, repl, applied.sites.get(i));
      }
      logger.debug("Iteration " + iterations + ": " + accepted.size() +
                   " rewrites, " + pending.size() + " activations");

      if (newConstant) {
        Node simplified = simplifier.simplify(logger, rev.root(),
                                              before.root(), changeLog);
        if (simplified != rev.root()) {
          rev = rev.next(simplified);
        }
      }
      return true;
    }

    /**
     * Record a rewrite that could not be made.  The same match is found
     * again on every later scan, so it is reported once.
     */
    private void skipped(String msg) {
      if (!diagnostics.contains(msg)) {
        logger.warn(msg);
        diagnostics.add(msg);
      }
    }

    private boolean insideAccepted(List<Candidate> accepted, Candidate c) {
      for (Candidate a: accepted) {
        if (a.path.isPrefixOf(c.path)) {
          return true;
        }
      }
      return false;
    }

    private Span replacementSpan(List<Node> repl) {
      if (repl.isEmpty()) {
        return null;
      }
      Span s = Span.UNKNOWN;
      for (Node n: repl) {
        s = Span.cover(s, n.span());
      }
      return s;
    }

    /**
     * A constant now stands where a non-constant expression was, or the
     * replacement carries more constants than the node it replaced
     */
    private boolean introducesConstant(Node matched, List<Node> repl) {
      if (!profile.isConstant(matched)) {
        for (Node r: repl) {
          if (profile.isConstant(r)) {
            return true;
          }
        }
      }
      return constants(repl) > constants(matched);
    }

    private int constants(List<Node> nodes) {
      int n = 0;
      for (Node node: nodes) {
        n += constants(node);
      }
      return n;
    }

    private int constants(Node node) {
      int n = 0;
      for (Node d: TreeWalk.preorder(node)) {
        if (profile.isConstant(d)) {
          n++;
        }
      }
      return n;
    }

    private void activateSuccessors(Candidate c, List<Node> repl,
                                    Revision.EditSite site) {
      for (Edge e: graph.successorEdges(c.rule.name())) {
        Map<String, String> subs =
                new LinkedHashMap<String, String>(substitutions);
        subs.putAll(c.rule.substitutions());
        subs.putAll(c.bindings.texts());
        Rule next = graph.get(e.target).instantiate(subs);
        if (!next.isInstantiated()) {
          logger.debug("Successor " + next.name() + " of " + c.rule.name() +
                       " lacks substitutions for " + next.holes());
          continue;
        }
        List<Node> targets;
        switch (e.scope) {
          case GLOBAL:
            addGlobal(next);
            continue;
          case CAPTURE:
            if (Matcher.isSequence(c.bindings.get(e.argument))) {
              targets = c.bindings.get(e.argument).children();
            } else if (c.path.equals(c.bindings.pathOf(e.argument))) {
              // Whole match was captured: look at what replaced it
              targets = repl;
            } else {
              targets = Collections.singletonList(
                                    c.bindings.get(e.argument));
            }
            break;
          case PARENT:
            targets = site.ancestors;
            break;
          case ENCLOSING:
            targets = new ArrayList<Node>(1);
            for (Node anc: site.ancestors) {
              if (anc.kind().equals(e.argument)) {
                targets.add(anc);
                break;
              }
            }
            break;
          default:
            throw new SweepRuntimeError("Unknown scope " + e.scope);
        }
        if (targets.isEmpty()) {
          logger.debug("Successor " + next.name() + " of " + c.rule.name() +
                       " has nowhere to match in " + e.scope + " scope");
          continue;
        }
        pending.add(new Activation(next, e.scope, targets, c.rule.name()));
      }
    }
  }
}
