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

import org.pynalyser.ast.Node;

/**
 * Thrown when a traversal meets a tree that breaks the shape the enriched tree guarantees: a flow
 * container element that is not a code block, a block or a terminal statement, or a scope
 * reference that names no nested scope. The tree was built wrong upstream; traversal cannot
 * continue.
 */
public final class StructuralInconsistencyException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final transient Node node;

  StructuralInconsistencyException(String message, Node node) {
    super(message);
    this.node = node;
  }

  /** The offending node. */
  public Node getNode() {
    return node;
  }
}
