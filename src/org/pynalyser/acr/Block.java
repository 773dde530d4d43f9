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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.Token;

/**
 * A control-flow container: a loop, a conditional, a try statement, an exception handler, a with
 * statement, or a {@link Scope}. A block owns one {@link FlowContainer} per block field declared by
 * its token; the remaining fields (loop targets, conditions and so on) are plain fields.
 */
public class Block extends Node {

  private final ImmutableMap<String, FlowContainer> containers;

  Block(Token token) {
    super(token);
    checkArgument(token.isBlock(), "%s is not a block kind", token);
    checkArgument(token.isScope() == (this instanceof Scope), "%s needs a Scope node", token);
    ImmutableMap.Builder<String, FlowContainer> builder = ImmutableMap.builder();
    for (String name : token.getBlockFields()) {
      builder.put(name, new FlowContainer(name));
    }
    this.containers = builder.buildOrThrow();
  }

  /** Returns the plain fields followed by the flow container fields. */
  @Override
  public ImmutableList<String> getFields() {
    return ImmutableList.<String>builder()
        .addAll(getToken().getFields())
        .addAll(getToken().getBlockFields())
        .build();
  }

  @Override
  public @Nullable Object getField(String name) {
    FlowContainer container = containers.get(name);
    return container != null ? container : super.getField(name);
  }

  /** Sets a plain field. Flow containers are filled through {@link #getFlowContainer}. */
  @CanIgnoreReturnValue
  public Block set(String name, @Nullable Object value) {
    setField(name, value);
    return this;
  }

  public ImmutableList<String> getBlockFields() {
    return getToken().getBlockFields();
  }

  public FlowContainer getFlowContainer(String name) {
    FlowContainer container = containers.get(name);
    checkArgument(container != null, "%s has no flow container '%s'", getToken(), name);
    return container;
  }

  /** Shorthand for the {@code body} container every block kind declares. */
  public FlowContainer getBody() {
    return getFlowContainer("body");
  }
}
