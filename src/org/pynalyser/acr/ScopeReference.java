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

package org.pynalyser.acr;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import org.jspecify.annotations.Nullable;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.Token;

/**
 * Stands in for a nested scope inside an expression, such as a lambda or a comprehension. The
 * reference holds only the scope's name and is resolved against the scope that is active when it
 * is reached.
 */
public final class ScopeReference extends Node {

  ScopeReference(String name) {
    super(Token.SCOPE_REFERENCE);
    checkArgument(!Strings.isNullOrEmpty(name), "a scope reference needs a name");
    setField("name", name);
  }

  public String getName() {
    return getString("name");
  }

  /** Looks the referenced scope up among the scopes nested in {@code enclosing}. */
  public @Nullable Scope resolve(Scope enclosing) {
    return enclosing.getChildScope(getName());
  }
}
