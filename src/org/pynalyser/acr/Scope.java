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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.pynalyser.ast.Token;

/**
 * A lexical namespace: a module, function, lambda, class or comprehension. A scope is a block that
 * also carries the name it is bound to in its enclosing namespace, a {@link SymbolTable}, and a
 * registry of the scopes nested directly inside it.
 *
 * <p>Scopes do not point back to their enclosing scope. Code that refers to a nested scope from
 * inside an expression does so through a {@link ScopeReference}, resolved against this registry.
 */
public class Scope extends Block {

  private final SymbolTable symbolTable = new SymbolTable();
  private final Map<String, Scope> childScopes = new LinkedHashMap<>();

  Scope(Token token, String name) {
    super(token);
    checkArgument(token.isScope(), "%s is not a scope kind", token);
    checkArgument(!Strings.isNullOrEmpty(name), "a scope needs a name");
    setField("name", name);
  }

  @Override
  @CanIgnoreReturnValue
  public Scope set(String field, @Nullable Object value) {
    checkArgument(!field.equals("name"), "the name of %s is fixed", this);
    super.set(field, value);
    return this;
  }

  public String getName() {
    return getString("name");
  }

  public SymbolTable getSymbolTable() {
    return symbolTable;
  }

  /** Registers {@code child} as a scope nested directly inside this one. */
  public void declareScope(Scope child) {
    checkArgument(child != this, "%s cannot be nested in itself", this);
    checkArgument(!(child instanceof Module), "a module cannot be nested: %s", child);
    String name = child.getName();
    checkArgument(
        !childScopes.containsKey(name), "%s already declares a nested scope '%s'", this, name);
    childScopes.put(name, child);
  }

  public @Nullable Scope getChildScope(String name) {
    return childScopes.get(name);
  }

  public ImmutableList<Scope> getChildScopes() {
    return ImmutableList.copyOf(childScopes.values());
  }
}
