/*
 * Copyright 2025 The Retrospect Authors
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
 * limitations under the License.
 */

package org.retrohdl.transforms;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.retrohdl.ir.Circuit;
import org.retrohdl.ir.FModule;
import org.retrohdl.ir.IrPrinter;

/**
 * Replaces every WhenOp in a module with unconditional connects of muxed values, and checks that
 * every sink in the module is driven on every path.
 *
 * <p>After expansion each field has at most one connect, and verification and simulation statements
 * that were inside a WhenOp are enabled only when the WhenOp's conditions hold.
 *
 * <p>Modules are processed independently, so {@link #runOnCircuit} may process several at once (see
 * {@link ExpandWhensOptions#parallelism}); each module must only be reachable from one Circuit
 * while the pass runs.
 */
public final class ExpandWhensPass {

  private static final Logger logger = LogManager.getLogger();

  private final ExpandWhensOptions options;

  public ExpandWhensPass() {
    this(ExpandWhensOptions.DEFAULT);
  }

  public ExpandWhensPass(ExpandWhensOptions options) {
    this.options = options;
  }

  /**
   * The outcome of running the pass on one module.
   *
   * @param changed false if the module's IR was not modified, so any analyses of it are still valid
   * @param errors the undriven sinks; if non-empty, the module's IR has still been transformed
   */
  public record ModuleResult(
      FModule module, boolean changed, ImmutableList<InitializationError> errors) {

    public boolean failed() {
      return !errors.isEmpty();
    }
  }

  /** The outcome of running the pass on each module of a circuit, in module order. */
  public record CircuitResult(ImmutableList<ModuleResult> modules) {

    public boolean failed() {
      return modules.stream().anyMatch(ModuleResult::failed);
    }

    public boolean changed() {
      return modules.stream().anyMatch(ModuleResult::changed);
    }

    /** Returns the errors from all modules. */
    public ImmutableList<InitializationError> errors() {
      return modules.stream()
          .flatMap(m -> m.errors().stream())
          .collect(ImmutableList.toImmutableList());
    }
  }

  /** Expands the WhenOps of a single module and checks its initialization. */
  public ModuleResult runOnModule(FModule module) {
    if (options.verbose && logger.isDebugEnabled()) {
      logger.debug("Before expanding whens:\n{}", IrPrinter.print(module));
    }
    ModuleVisitor visitor = new ModuleVisitor();
    boolean changed = visitor.run(module);
    ImmutableList<InitializationError> errors;
    if (options.exhaustiveDiagnostics) {
      errors = visitor.findUninitialized();
    } else {
      try {
        visitor.checkInitialization();
        errors = ImmutableList.of();
      } catch (InitializationError e) {
        errors = ImmutableList.of(e);
      }
    }
    for (InitializationError error : errors) {
      logger.error(error.getMessage());
    }
    if (options.verbose && logger.isDebugEnabled()) {
      logger.debug("After expanding whens:\n{}", IrPrinter.print(module));
    }
    logger.debug(
        "Expanded whens in {}: changed={}, errors={}", module.name, changed, errors.size());
    return new ModuleResult(module, changed, errors);
  }

  /** Runs {@link #runOnModule} on each module of {@code circuit}. */
  public CircuitResult runOnCircuit(Circuit circuit) {
    ImmutableList<FModule> modules = circuit.modules();
    ImmutableList<ModuleResult> results;
    if (options.parallelism == 1 || modules.size() <= 1) {
      results = modules.stream().map(this::runOnModule).collect(ImmutableList.toImmutableList());
    } else {
      results = runConcurrently(modules);
    }
    CircuitResult result = new CircuitResult(results);
    logger.info(
        "Expanded whens in circuit {}: {} modules, {} failed",
        circuit.name,
        modules.size(),
        results.stream().filter(ModuleResult::failed).count());
    return result;
  }

  private ImmutableList<ModuleResult> runConcurrently(ImmutableList<FModule> modules) {
    ExecutorService executor =
        Executors.newFixedThreadPool(Math.min(options.parallelism, modules.size()));
    try {
      List<Future<ModuleResult>> futures = new ArrayList<>(modules.size());
      for (FModule module : modules) {
        futures.add(executor.submit(() -> runOnModule(module)));
      }
      ImmutableList.Builder<ModuleResult> results = ImmutableList.builder();
      for (Future<ModuleResult> future : futures) {
        results.add(future.get());
      }
      return results.build();
    } catch (ExecutionException e) {
      // Internal errors (e.g. an unexpected PartialConnectOp) are rethrown as-is.
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while expanding whens", e);
    } finally {
      executor.shutdownNow();
    }
  }
}
