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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.EnumMap;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pynalyser.acr.Block;
import org.pynalyser.acr.CodeBlock;
import org.pynalyser.acr.FlowContainer;
import org.pynalyser.acr.Module;
import org.pynalyser.acr.Scope;
import org.pynalyser.acr.ScopeReference;
import org.pynalyser.ast.AstNode;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.Token;

/**
 * NodeVisitor walks an enriched tree while tracking the current scope and the current block.
 *
 * <p>Subclasses register one {@link Handler} per node kind they care about. For each visited node
 * the handler for its kind runs first, in the context of the enclosing scope and block. The
 * visitor then descends into the node:
 *
 * <ul>
 *   <li>into a {@link Scope} with both the current scope and the current block set to it;
 *   <li>into any other {@link Block} with the current block set to it;
 *   <li>into anything else with the context unchanged.
 * </ul>
 *
 * The previous context is restored when the descent ends, whether it returns or throws.
 *
 * <p>Descent into a block walks its flow containers in order: the statements of each {@link
 * CodeBlock}, nested blocks, and terminal statements. Any other element means the tree is
 * malformed and fails with a {@link StructuralInconsistencyException}. Descent into a primitive
 * node walks its fields in declaration order, and a {@link ScopeReference} descends into the scope
 * it names.
 *
 * <p>A node kind without a handler is silently skipped over, unless the visitor is strict, in which
 * case visiting it throws a {@link MissingHandlerException}.
 *
 * @param <R> the type returned by handlers
 */
public abstract class NodeVisitor<R> {

  /** Handles the nodes of one kind. */
  @FunctionalInterface
  public interface Handler<R> {
    @Nullable R handle(Node n);
  }

  private final boolean strict;
  private final EnumMap<Token, Handler<R>> handlers = new EnumMap<>(Token.class);

  /** The innermost scope being descended into, or null outside a traversal. */
  private @Nullable Scope scope;

  /** The innermost block being descended into, or null outside a traversal. */
  private @Nullable Block block;

  protected NodeVisitor() {
    this(false);
  }

  protected NodeVisitor(boolean strict) {
    this.strict = strict;
  }

  protected final void addHandler(Token token, Handler<R> handler) {
    checkNotNull(token);
    checkNotNull(handler);
    checkState(
        !handlers.containsKey(token),
        "%s already has a handler for %s",
        getClass().getSimpleName(),
        token);
    handlers.put(token, handler);
  }

  public final boolean hasHandler(Token token) {
    return handlers.containsKey(token);
  }

  public final boolean isStrict() {
    return strict;
  }

  public final boolean isTraversing() {
    return scope != null;
  }

  public Scope getScope() {
    checkState(scope != null, "No traversal in progress");
    return scope;
  }

  public Block getBlock() {
    checkState(block != null, "No traversal in progress");
    return block;
  }

  /** Traverses the tree rooted at {@code root}. The context is cleared on return. */
  public void start(Module root) {
    checkArgument(root != null, "Cannot traverse a null module");
    checkState(!isTraversing(), "A traversal of %s is already in progress", scope);
    scope = root;
    block = root;
    try {
      visit(root);
    } finally {
      scope = null;
      block = null;
    }
  }

  /**
   * Dispatches {@code n} to its handler, then descends into it.
   *
   * @return what the handler returned, or null if there is no handler
   */
  public @Nullable R visit(Node n) {
    checkArgument(n != null, "Cannot visit a null node");
    Handler<R> handler = handlers.get(n.getToken());
    if (handler == null && strict) {
      throw new MissingHandlerException(getClass(), n.getToken());
    }
    R result = handler == null ? null : handler.handle(n);

    if (n instanceof Scope) {
      Scope previousScope = scope;
      Block previousBlock = block;
      scope = (Scope) n;
      block = (Block) n;
      try {
        genericVisit(n);
      } finally {
        scope = previousScope;
        block = previousBlock;
      }
    } else if (n instanceof Block) {
      Block previousBlock = block;
      block = (Block) n;
      try {
        genericVisit(n);
      } finally {
        block = previousBlock;
      }
    } else {
      genericVisit(n);
    }
    return result;
  }

  /** Descends into the children of {@code n} without dispatching {@code n} itself. */
  protected void genericVisit(Node n) {
    if (n instanceof ScopeReference) {
      visitReferencedScope((ScopeReference) n);
    } else if (n instanceof Block) {
      traverseFlowContainers((Block) n);
    } else if (n instanceof CodeBlock) {
      traverseNodes(((CodeBlock) n).getStatements());
    } else if (n instanceof AstNode) {
      traverseFields(n);
    } else {
      throw new IllegalArgumentException("Not a tree node: " + n.getClass().getName());
    }
  }

  private void visitReferencedScope(ScopeReference reference) {
    Scope enclosing = getScope();
    Scope referenced = reference.resolve(enclosing);
    if (referenced == null) {
      throw new StructuralInconsistencyException(
          "Scope " + enclosing.getName() + " has no nested scope named " + reference.getName(),
          reference);
    }
    visit(referenced);
  }

  private void traverseFlowContainers(Block n) {
    for (String name : n.getBlockFields()) {
      FlowContainer container = n.getFlowContainer(name);
      for (Node item : container) {
        if (item instanceof CodeBlock) {
          traverseNodes(((CodeBlock) item).getStatements());
        } else if (item instanceof Block || item.isTerminal()) {
          visit(item);
        } else {
          throw new StructuralInconsistencyException(
              "Unreachable: "
                  + item.getToken()
                  + " in flow container "
                  + n.getToken()
                  + "."
                  + name
                  + " is not a code block, a block or a terminal statement",
              item);
        }
      }
    }
  }

  private void traverseFields(Node n) {
    for (String name : n.getFields()) {
      Object value = n.getField(name);
      if (value instanceof Node) {
        visit((Node) value);
      } else if (value instanceof List) {
        for (Object item : (List<?>) value) {
          visit((Node) item);
        }
      }
    }
  }

  private void traverseNodes(List<Node> nodes) {
    for (Node n : nodes) {
      visit(n);
    }
  }
}
