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

/**
 * An error manager that prints a sorted report when {@link #generateReport()} is called.
 * Subclasses decide where the lines go.
 */
public abstract class BasicErrorManager extends SortingErrorManager {

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : getSortedDiagnostics()) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /** Prints one reported error. */
  public abstract void println(CheckLevel level, AnalysisError error);

  /** Prints the number of errors and warnings. */
  protected abstract void printSummary();
}
