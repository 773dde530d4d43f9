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

import org.pynalyser.acr.SymbolTable;
import org.pynalyser.ast.Node;

/** Finds the symbol table of the lexical scope a visited node binds its names in. */
@FunctionalInterface
public interface SymbolTableResolver {

  SymbolTable resolve(NodeVisitor<?> traversal, Node n);

  /**
   * Uses the table of the traversal's current scope. A scope node is dispatched before the
   * traversal enters it, so its own name resolves to the enclosing scope's table.
   */
  SymbolTableResolver CURRENT_SCOPE = (traversal, n) -> traversal.getScope().getSymbolTable();
}
