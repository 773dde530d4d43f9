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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.pynalyser.ast.IR;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.Token;

/**
 * An enriched tree construction helper class. Factories for nested scopes take the enclosing
 * scope and register the new scope with it, so that {@link ScopeReference}s can find it.
 */
public class Acr {

  private Acr() {}

  // Scopes

  public static Module module(String name) {
    return new Module(name);
  }

  public static Scope function(Scope parent, String name, @Nullable Node args) {
    return nested(parent, new Scope(Token.FUNCTION_DEF, name).set("args", args));
  }

  public static Scope asyncFunction(Scope parent, String name, @Nullable Node args) {
    return nested(parent, new Scope(Token.ASYNC_FUNCTION_DEF, name).set("args", args));
  }

  /** Creates a lambda scope whose body returns {@code body}. */
  public static Scope lambda(Scope parent, String name, @Nullable Node args, Node body) {
    Scope lambda = new Scope(Token.LAMBDA, name).set("args", args);
    lambda.getBody().add(IR.returnNode(checkNotNull(body)));
    return nested(parent, lambda);
  }

  public static Scope classDef(Scope parent, String name, Node... bases) {
    return nested(
        parent, new Scope(Token.CLASS_DEF, name).set("bases", ImmutableList.copyOf(bases)));
  }

  public static Scope comprehension(Scope parent, String name, Node elt) {
    return nested(parent, new Scope(Token.COMPREHENSION, name).set("elt", checkNotNull(elt)));
  }

  private static Scope nested(Scope parent, Scope child) {
    parent.declareScope(child);
    return child;
  }

  // Blocks

  public static Block forLoop(Node target, Node iter) {
    return new Block(Token.FOR).set("target", checkNotNull(target)).set("iter", checkNotNull(iter));
  }

  public static Block asyncForLoop(Node target, Node iter) {
    return new Block(Token.ASYNC_FOR)
        .set("target", checkNotNull(target))
        .set("iter", checkNotNull(iter));
  }

  public static Block whileLoop(Node test) {
    return new Block(Token.WHILE).set("test", checkNotNull(test));
  }

  public static Block ifBlock(Node test) {
    return new Block(Token.IF).set("test", checkNotNull(test));
  }

  public static Block tryBlock() {
    return new Block(Token.TRY);
  }

  public static Block exceptHandler(@Nullable Node type, @Nullable String name) {
    checkState(type != null || name == null, "a bare except cannot bind a name");
    return new Block(Token.EXCEPT_HANDLER).set("type", type).set("name", name);
  }

  public static Block with(Node... items) {
    for (Node item : items) {
      checkState(item.getToken() == Token.WITH_ITEM, item);
    }
    return new Block(Token.WITH).set("items", ImmutableList.copyOf(items));
  }

  public static Block asyncWith(Node... items) {
    for (Node item : items) {
      checkState(item.getToken() == Token.WITH_ITEM, item);
    }
    return new Block(Token.ASYNC_WITH).set("items", ImmutableList.copyOf(items));
  }

  // Structure

  public static CodeBlock codeBlock(Node... statements) {
    CodeBlock codeBlock = new CodeBlock();
    for (Node statement : statements) {
      codeBlock.add(statement);
    }
    return codeBlock;
  }

  public static ScopeReference scopeReference(String name) {
    return new ScopeReference(name);
  }

  public static ScopeReference scopeReference(Scope scope) {
    return new ScopeReference(scope.getName());
  }
}
