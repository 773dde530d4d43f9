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

import com.google.common.collect.ImmutableList;

/** Collects the findings of a run and reports them once the run is over. */
public interface ErrorManager {

  /** Records {@code error} at {@code level}. */
  void report(CheckLevel level, AnalysisError error);

  /** Writes out everything reported so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<AnalysisError> getErrors();

  ImmutableList<AnalysisError> getWarnings();
}
