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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import exm.sweep.common.exceptions.InvalidTreeException;
import exm.sweep.common.exceptions.SweepRuntimeError;
import exm.sweep.engine.FixpointDriver;
import exm.sweep.engine.RewriteResult;
import exm.sweep.tree.Node;
import exm.sweep.tree.TreeNotation;

/**
 * Rewrites many trees in parallel with one shared driver.  Each tree is
 * independent: a tree that fails to parse or rewrite is reported in its
 * own result and does not affect the others.
 */
public class BatchRewriter {

  /** A tree to rewrite, in tree notation */
  public static class Input {
    public final String name;
    public final String text;

    public Input(String name, String text) {
      this.name = name;
      this.text = text;
    }
  }

  public static class FileResult {
    public final String name;
    /** Null if failed */
    public final RewriteResult result;
    /** Null if succeeded */
    public final String error;
    /** True if the failure was in the engine rather than the input */
    public final boolean internalError;

    private FileResult(String name, RewriteResult result, String error,
                       boolean internalError) {
      this.name = name;
      this.result = result;
      this.error = error;
      this.internalError = internalError;
    }

    public boolean succeeded() {
      return result != null;
    }

    @Override
    public String toString() {
      return name + ": " + (succeeded() ? result.toString() : error);
    }
  }

  private final Logger logger;
  private final FixpointDriver driver;
  private final int threads;

  public BatchRewriter(Logger logger, FixpointDriver driver, int threads) {
    if (threads < 1) {
      throw new SweepRuntimeError("Need at least one thread: " + threads);
    }
    this.logger = logger;
    this.driver = driver;
    this.threads = threads;
  }

  /**
   * @return one result per input, in input order
   */
  public List<FileResult> rewriteAll(List<Input> inputs) {
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<FileResult>> futures =
              new ArrayList<Future<FileResult>>(inputs.size());
      for (final Input input: inputs) {
        futures.add(pool.submit(new Callable<FileResult>() {
          @Override
          public FileResult call() {
            return rewrite(input);
          }
        }));
      }
      List<FileResult> results = new ArrayList<FileResult>(inputs.size());
      for (int i = 0; i < inputs.size(); i++) {
        results.add(await(inputs.get(i), futures.get(i)));
      }
      return results;
    } finally {
      pool.shutdownNow();
    }
  }

  private FileResult await(Input input, Future<FileResult> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new FileResult(input.name, null, "Interrupted", true);
    } catch (ExecutionException e) {
      logger.error("Rewriting " + input.name + " failed", e.getCause());
      return new FileResult(input.name, null,
                            String.valueOf(e.getCause()), true);
    }
  }

  /**
   * Rewrite a single tree, capturing any failure
   */
  public FileResult rewrite(Input input) {
    Node root;
    try {
      root = TreeNotation.read(input.name, input.text);
    } catch (InvalidTreeException e) {
      logger.warn(e.getMessage());
      return new FileResult(input.name, null, e.getMessage(), false);
    }
    try {
      RewriteResult result = driver.run(root);
      logger.debug(input.name + ": " + result);
      return new FileResult(input.name, result, null, false);
    } catch (RuntimeException e) {
      logger.error("Internal error rewriting " + input.name, e);
      return new FileResult(input.name, null, e.toString(), true);
    }
  }
}
