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

import org.pynalyser.acr.Module;

/** A single analysis over a whole tree. */
public interface AnalyzerPass {

  /**
   * Processes the tree rooted at {@code root}. May update the symbol tables of its scopes.
   *
   * @param root Root of the enriched tree
   */
  void process(Module root);
}
