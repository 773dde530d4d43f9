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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Base class of every tree element, primitive or enriched.
 *
 * <p>A node is identified by its {@link Token}, which fixes the names and order of its fields.
 * Field values are nodes, lists of nodes, strings, numbers, booleans or null. The source position
 * is an auxiliary attribute: it is not a field and takes no part in traversal.
 */
public abstract class Node {

  private final Token token;
  private final Map<String, @Nullable Object> fields = new LinkedHashMap<>();
  private @Nullable SourcePosition sourcePosition;

  protected Node(Token token) {
    this.token = checkNotNull(token);
    for (String name : token.getFields()) {
      fields.put(name, null);
    }
  }

  public final Token getToken() {
    return token;
  }

  /** Returns the names of all fields of this node, in declaration order. */
  public ImmutableList<String> getFields() {
    return token.getFields();
  }

  public @Nullable Object getField(String name) {
    checkArgument(fields.containsKey(name), "%s has no field '%s'", token, name);
    return fields.get(name);
  }

  protected void setField(String name, @Nullable Object value) {
    checkArgument(fields.containsKey(name), "%s has no field '%s'", token, name);
    if (value instanceof List) {
      ImmutableList.Builder<Node> nodes = ImmutableList.builder();
      for (Object item : (List<?>) value) {
        checkArgument(
            item instanceof Node, "%s.%s holds a non-node element: %s", token, name, item);
        nodes.add((Node) item);
      }
      value = nodes.build();
    } else {
      checkArgument(
          value == null
              || value instanceof Node
              || value instanceof String
              || value instanceof Number
              || value instanceof Boolean,
          "Unsupported value for %s.%s: %s",
          token,
          name,
          value);
    }
    fields.put(name, value);
  }

  /** Returns the node held by a single-node field, or null if the field is unset. */
  public @Nullable Node getNode(String name) {
    Object value = getField(name);
    checkArgument(value == null || value instanceof Node, "%s.%s is not a node", token, name);
    return (Node) value;
  }

  /** Returns the nodes held by a list field. An unset list field reads as empty. */
  @SuppressWarnings("unchecked") // setField only stores ImmutableList<Node>
  public ImmutableList<Node> getNodeList(String name) {
    Object value = getField(name);
    if (value == null) {
      return ImmutableList.of();
    }
    checkArgument(value instanceof ImmutableList, "%s.%s is not a list", token, name);
    return (ImmutableList<Node>) value;
  }

  public @Nullable String getString(String name) {
    Object value = getField(name);
    checkArgument(value == null || value instanceof String, "%s.%s is not a string", token, name);
    return (String) value;
  }

  public @Nullable SourcePosition getSourcePosition() {
    return sourcePosition;
  }

  public void setSourcePosition(@Nullable SourcePosition sourcePosition) {
    this.sourcePosition = sourcePosition;
  }

  public final boolean isScope() {
    return token.isScope();
  }

  public final boolean isBlock() {
    return token.isBlock();
  }

  public final boolean isTerminal() {
    return token.isTerminal();
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isCodeBlock() {
    return token == Token.CODE_BLOCK;
  }

  public final boolean isScopeReference() {
    return token == Token.SCOPE_REFERENCE;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.toString());
    for (String name : token.getFields()) {
      Object value = fields.get(name);
      if (value instanceof String) {
        sb.append(' ').append(name).append('=').append(value);
      }
    }
    if (sourcePosition != null) {
      sb.append(" @").append(sourcePosition);
    }
    return sb.toString();
  }
}
