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

package org.pynalyser.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/** A node of the primitive tree, as produced by the parser. Its children live in its fields. */
public final class AstNode extends Node {

  public AstNode(Token token) {
    super(token);
    checkArgument(!token.isEnriched(), "%s is not a primitive node kind", token);
  }

  @CanIgnoreReturnValue
  public AstNode set(String name, @Nullable Object value) {
    setField(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public AstNode at(int lineno, int colOffset) {
    setSourcePosition(SourcePosition.at(lineno, colOffset));
    return this;
  }
}
