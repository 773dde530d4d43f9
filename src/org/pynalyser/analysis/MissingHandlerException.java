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

import org.pynalyser.ast.Token;

/**
 * Thrown by a strict {@link NodeVisitor} that reaches a node kind it has no handler for. This is
 * a mistake in the visitor, not in the tree.
 */
public final class MissingHandlerException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final Token token;

  MissingHandlerException(Class<?> visitorClass, Token token) {
    super(
        "There is no handler for "
            + token
            + " in "
            + visitorClass.getSimpleName()
            + ". You see this message because the visitor is strict.");
    this.token = token;
  }

  /** The kind of the node that had no handler. */
  public Token getToken() {
    return token;
  }
}
