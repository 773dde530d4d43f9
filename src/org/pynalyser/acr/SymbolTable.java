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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Maps the names bound in one scope to their {@link Binding}s. A name has no entry until it is
 * first bound; entries are never removed.
 */
public final class SymbolTable {

  private final Map<String, Binding> bindings = new LinkedHashMap<>();

  /**
   * Records a binding of {@code name}: creates its entry at generation 0, or moves an existing
   * entry to its next generation.
   */
  @CanIgnoreReturnValue
  public Binding nextDef(String name) {
    checkArgument(!Strings.isNullOrEmpty(name), "empty name");
    Binding binding = bindings.get(name);
    if (binding == null) {
      binding = new Binding(name);
      bindings.put(name, binding);
    } else {
      binding.nextDef();
    }
    return binding;
  }

  public @Nullable Binding getBinding(String name) {
    return bindings.get(name);
  }

  public boolean hasBinding(String name) {
    return bindings.containsKey(name);
  }

  /** Returns the current generation of {@code name}, or -1 if it was never bound. */
  public int getGeneration(String name) {
    Binding binding = bindings.get(name);
    return binding == null ? -1 : binding.getGeneration();
  }

  /** Bound names, in the order they were first bound. */
  public ImmutableSet<String> getNames() {
    return ImmutableSet.copyOf(bindings.keySet());
  }

  public int size() {
    return bindings.size();
  }

  @Override
  public String toString() {
    return bindings.values().toString();
  }
}
