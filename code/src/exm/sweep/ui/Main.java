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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.sweep.common.Logging;
import exm.sweep.common.Settings;
import exm.sweep.common.exceptions.InvalidOptionException;
import exm.sweep.common.exceptions.InvalidRuleException;
import exm.sweep.common.exceptions.SweepFatal;
import exm.sweep.engine.Edit;
import exm.sweep.engine.FixpointDriver;
import exm.sweep.engine.MatchReport;
import exm.sweep.rules.RuleSet;
import exm.sweep.rules.RuleSpecReader;
import exm.sweep.tree.TreeNotation;

/**
 * Command line interface.  Engine limits can also be passed as Java
 * properties; see Settings.java.
 */
public class Main {
  private static final String RULES_FLAG = "r";
  private static final String OUTDIR_FLAG = "o";
  private static final String SUBST_FLAG = "s";
  private static final String MAX_ITER_FLAG = "m";
  private static final String THREADS_FLAG = "t";

  public static void main(String[] args) {
    Args sweepArgs = processArgs(args);

    try {
      Settings.initSweepProperties();
      if (sweepArgs.maxIterations != null) {
        Settings.set(Settings.MAX_ITERATIONS, sweepArgs.maxIterations);
      }
      if (sweepArgs.threads != null) {
        Settings.set(Settings.THREADS, sweepArgs.threads);
      }
      Settings.getPositiveLong(Settings.MAX_ITERATIONS);
      Settings.getPositiveLong(Settings.THREADS);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = setupLogging();

    try {
      System.exit(run(logger, sweepArgs).code());
    } catch (SweepFatal ex) {
      System.exit(ex.exitCode);
    }
  }

  static class Args {
    final String rulesFile;
    final String outputDir;
    final Map<String, String> substitutions;
    final String maxIterations;
    final String threads;
    final List<String> inputs;

    Args(String rulesFile, String outputDir,
         Map<String, String> substitutions, String maxIterations,
         String threads, List<String> inputs) {
      this.rulesFile = rulesFile;
      this.outputDir = outputDir;
      this.substitutions = substitutions;
      this.maxIterations = maxIterations;
      this.threads = threads;
      this.inputs = inputs;
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option rules = new Option(RULES_FLAG, "rules", true,
                              "Rule document (YAML or JSON)");
    rules.setRequired(true);
    opts.addOption(rules);

    opts.addOption(OUTDIR_FLAG, "output", true,
                   "Directory for rewritten trees, default stdout");

    Option subst = new Option(SUBST_FLAG, "subst", true,
                              "Substitution for a rule hole: name=value");
    subst.setArgs(2);
    subst.setValueSeparator('=');
    opts.addOption(subst);

    opts.addOption(MAX_ITER_FLAG, "max-iterations", true,
                   "Rewriting iterations per tree before giving up");
    opts.addOption(THREADS_FLAG, "threads", true,
                   "Trees rewritten in parallel");
    return opts;
  }

  static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    Properties props = cmd.getOptionProperties(SUBST_FLAG);
    Map<String, String> substitutions = new LinkedHashMap<String, String>();
    for (String key: props.stringPropertyNames()) {
      substitutions.put(key, props.getProperty(key));
    }

    List<String> inputs = new ArrayList<String>();
    for (String a: cmd.getArgs()) {
      inputs.add(a);
    }
    if (inputs.isEmpty()) {
      System.err.println("Expected at least one input tree");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    return new Args(cmd.getOptionValue(RULES_FLAG),
                    cmd.getOptionValue(OUTDIR_FLAG), substitutions,
                    cmd.getOptionValue(MAX_ITER_FLAG),
                    cmd.getOptionValue(THREADS_FLAG), inputs);
  }

  private static Logger setupLogging() {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("sweep -r <rules> [options] <tree file>...", opts);
  }

  /**
   * @return exit code
   * @throws SweepFatal if the run cannot start
   */
  static ExitCode run(Logger logger, Args args) {
    RuleSet rules;
    FixpointDriver driver;
    int threads;
    try {
      rules = new RuleSpecReader().read(new File(args.rulesFile));
      driver = new FixpointDriver(logger, rules, args.substitutions);
      threads = (int)Settings.getPositiveLong(Settings.THREADS);
    } catch (InvalidRuleException e) {
      System.err.println(e.getMessage());
      throw new SweepFatal(ExitCode.ERROR_USER.code());
    } catch (InvalidOptionException e) {
      System.err.println(e.getMessage());
      throw new SweepFatal(ExitCode.ERROR_COMMAND.code());
    }

    List<BatchRewriter.Input> inputs = new ArrayList<BatchRewriter.Input>();
    for (String path: args.inputs) {
      try {
        inputs.add(new BatchRewriter.Input(path,
                    FileUtils.readFileToString(new File(path), "UTF-8")));
      } catch (IOException e) {
        System.err.println("Could not read " + path + ": " + e.getMessage());
        throw new SweepFatal(ExitCode.ERROR_IO.code());
      }
    }

    BatchRewriter batch = new BatchRewriter(logger, driver, threads);
    ExitCode status = ExitCode.SUCCESS;
    for (BatchRewriter.FileResult fr: batch.rewriteAll(inputs)) {
      if (!fr.succeeded()) {
        System.err.println(fr.name + ": " + fr.error);
        if (fr.internalError) {
          status = ExitCode.ERROR_INTERNAL;
        } else if (status == ExitCode.SUCCESS) {
          status = ExitCode.ERROR_USER;
        }
        continue;
      }
      report(logger, fr);
      try {
        writeOutput(args.outputDir, fr);
      } catch (IOException e) {
        System.err.println("Could not write output for " + fr.name + ": " +
                           e.getMessage());
        throw new SweepFatal(ExitCode.ERROR_IO.code());
      }
    }
    return status;
  }

  private static void report(Logger logger, BatchRewriter.FileResult fr) {
    System.out.println("== " + fr.name + ": " + fr.result);
    for (Edit e: fr.result.changeLog().entries()) {
      System.out.println("  " + e);
    }
    for (MatchReport m: fr.result.matches()) {
      System.out.println("  match " + m);
    }
    for (String d: fr.result.diagnostics()) {
      logger.warn(fr.name + ": " + d);
    }
  }

  private static void writeOutput(String outputDir,
        BatchRewriter.FileResult fr) throws IOException {
    String text = TreeNotation.printIndented(fr.result.root());
    if (outputDir == null) {
      System.out.println(text);
      return;
    }
    File out = new File(outputDir, new File(fr.name).getName());
    FileUtils.writeStringToFile(out, text + "\n", "UTF-8");
  }
}
