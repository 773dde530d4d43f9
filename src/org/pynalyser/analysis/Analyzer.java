/*
 * Copyright 2026 The Pynalyser Authors.
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

package org.pynalyser.analysis;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.pynalyser.acr.Module;

/** Runs analysis passes over an enriched tree and collects what they report. */
public class Analyzer {

  private static final Logger logger = Logger.getLogger(Analyzer.class.getName());

  private final AnalyzerOptions options;
  private final ErrorManager errorManager;

  public Analyzer() {
    this(new AnalyzerOptions(), new LoggerErrorManager(logger));
  }

  public Analyzer(AnalyzerOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  public AnalyzerOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /** Reports {@code error} at its default level. */
  public void report(AnalysisError error) {
    report(error.getDefaultLevel(), error);
  }

  /** Reports {@code error} at {@code level}. Nothing is recorded at {@link CheckLevel#OFF}. */
  public void report(CheckLevel level, AnalysisError error) {
    if (level.isOn()) {
      errorManager.report(level, error);
    }
  }

  public ImmutableList<AnalysisError> getErrors() {
    return errorManager.getErrors();
  }

  public ImmutableList<AnalysisError> getWarnings() {
    return errorManager.getWarnings();
  }

  /** Creates the pass that records every rebinding in the symbol tables. */
  public RedefinitionAnalyzer redefinitions() {
    return new RedefinitionAnalyzer(this);
  }

  /**
   * Runs {@code passes} over {@code root} in order, then generates the error report. A pass that
   * throws ends the run; nothing is reported in that case.
   */
  public void analyze(Module root, List<? extends AnalyzerPass> passes) {
    checkNotNull(root);
    for (AnalyzerPass pass : passes) {
      String name = pass.getClass().getSimpleName();
      logger.fine("Running pass " + name);
      long start = System.nanoTime();
      pass.process(root);
      if (logger.isLoggable(Level.FINER)) {
        logger.finer(
            "Finished pass " + name + " in " + (System.nanoTime() - start) / 1_000_000 + " ms");
      }
    }
    errorManager.generateReport();
  }
}
