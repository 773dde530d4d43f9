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

import com.google.common.collect.ImmutableList;

/**
 * The closed set of node kinds, primitive and enriched alike. A token fixes the ordered field
 * names of its nodes, and for block kinds the ordered names of their flow containers.
 */
public enum Token {
  // Scopes
  MODULE(Category.SCOPE, fields("name"), fields("body")),
  FUNCTION_DEF(
      Category.SCOPE, fields("name", "args", "decorator_list", "returns"), fields("body")),
  ASYNC_FUNCTION_DEF(
      Category.SCOPE, fields("name", "args", "decorator_list", "returns"), fields("body")),
  LAMBDA(Category.SCOPE, fields("name", "args"), fields("body")),
  CLASS_DEF(Category.SCOPE, fields("name", "bases", "keywords", "decorator_list"), fields("body")),
  COMPREHENSION(Category.SCOPE, fields("name", "elt"), fields("body")),

  // Control-flow blocks
  FOR(Category.BLOCK, fields("target", "iter"), fields("body", "orelse")),
  ASYNC_FOR(Category.BLOCK, fields("target", "iter"), fields("body", "orelse")),
  WHILE(Category.BLOCK, fields("test"), fields("body", "orelse")),
  IF(Category.BLOCK, fields("test"), fields("body", "orelse")),
  TRY(Category.BLOCK, fields(), fields("body", "handlers", "orelse", "finalbody")),
  EXCEPT_HANDLER(Category.BLOCK, fields("type", "name"), fields("body")),
  WITH(Category.BLOCK, fields("items"), fields("body")),
  ASYNC_WITH(Category.BLOCK, fields("items"), fields("body")),

  // Enriched structure
  CODE_BLOCK(Category.STRUCTURE, fields("body")),
  SCOPE_REFERENCE(Category.STRUCTURE, fields("name")),

  // Statements
  EXPR(Category.STATEMENT, fields("value")),
  ASSIGN(Category.STATEMENT, fields("targets", "value")),
  AUG_ASSIGN(Category.STATEMENT, fields("target", "op", "value")),
  ANN_ASSIGN(Category.STATEMENT, fields("target", "annotation", "value", "simple")),
  IMPORT(Category.STATEMENT, fields("names")),
  IMPORT_FROM(Category.STATEMENT, fields("module", "names", "level")),
  DELETE(Category.STATEMENT, fields("targets")),
  GLOBAL(Category.STATEMENT, fields("names")),
  NONLOCAL(Category.STATEMENT, fields("names")),
  PASS(Category.STATEMENT, fields()),
  RETURN(Category.STATEMENT, fields("value")),
  RAISE(Category.STATEMENT, fields("exc", "cause")),
  ASSERT(Category.STATEMENT, fields("test", "msg")),
  BREAK(Category.STATEMENT, fields()),
  CONTINUE(Category.STATEMENT, fields()),

  // Expressions
  NAME(Category.EXPRESSION, fields("id")),
  ATTRIBUTE(Category.EXPRESSION, fields("value", "attr")),
  SUBSCRIPT(Category.EXPRESSION, fields("value", "slice")),
  STARRED(Category.EXPRESSION, fields("value")),
  TUPLE(Category.EXPRESSION, fields("elts")),
  LIST(Category.EXPRESSION, fields("elts")),
  SET(Category.EXPRESSION, fields("elts")),
  DICT(Category.EXPRESSION, fields("keys", "values")),
  CONSTANT(Category.EXPRESSION, fields("value")),
  BIN_OP(Category.EXPRESSION, fields("left", "op", "right")),
  UNARY_OP(Category.EXPRESSION, fields("op", "operand")),
  BOOL_OP(Category.EXPRESSION, fields("op", "values")),
  COMPARE(Category.EXPRESSION, fields("left", "ops", "comparators")),
  CALL(Category.EXPRESSION, fields("func", "args", "keywords")),
  NAMED_EXPR(Category.EXPRESSION, fields("target", "value")),
  IF_EXP(Category.EXPRESSION, fields("test", "body", "orelse")),
  AWAIT(Category.EXPRESSION, fields("value")),
  YIELD(Category.EXPRESSION, fields("value")),
  YIELD_FROM(Category.EXPRESSION, fields("value")),
  SLICE(Category.EXPRESSION, fields("lower", "upper", "step")),

  // Auxiliary
  ALIAS(Category.AUXILIARY, fields("name", "asname")),
  KEYWORD(Category.AUXILIARY, fields("arg", "value")),
  ARG(Category.AUXILIARY, fields("arg", "annotation")),
  ARGUMENTS(Category.AUXILIARY, fields("posonlyargs", "args", "vararg", "kwonlyargs", "kwarg")),
  WITH_ITEM(Category.AUXILIARY, fields("context_expr", "optional_vars"));

  /** Coarse grouping of tokens, used to tell enriched kinds from primitive ones. */
  public enum Category {
    SCOPE,
    BLOCK,
    STRUCTURE,
    STATEMENT,
    EXPRESSION,
    AUXILIARY
  }

  private final Category category;
  private final ImmutableList<String> fields;
  private final ImmutableList<String> blockFields;

  Token(Category category, ImmutableList<String> fields) {
    this(category, fields, ImmutableList.of());
  }

  Token(Category category, ImmutableList<String> fields, ImmutableList<String> blockFields) {
    this.category = category;
    this.fields = fields;
    this.blockFields = blockFields;
  }

  private static ImmutableList<String> fields(String... names) {
    return ImmutableList.copyOf(names);
  }

  public Category getCategory() {
    return category;
  }

  /** Names of the plain fields, in declaration order. */
  public ImmutableList<String> getFields() {
    return fields;
  }

  /** Names of the flow container fields, in execution order. Empty for non-block kinds. */
  public ImmutableList<String> getBlockFields() {
    return blockFields;
  }

  public boolean isScope() {
    return category == Category.SCOPE;
  }

  /** Whether this kind is a block. Every scope is also a block. */
  public boolean isBlock() {
    return category == Category.SCOPE || category == Category.BLOCK;
  }

  /** Whether this kind belongs to the enriched tree rather than the primitive one. */
  public boolean isEnriched() {
    return isBlock() || category == Category.STRUCTURE;
  }

  /** Statements that may sit directly in a flow container, outside of any code block. */
  public boolean isTerminal() {
    switch (this) {
      case RETURN:
      case RAISE:
      case ASSERT:
      case BREAK:
      case CONTINUE:
        return true;
      default:
        return false;
    }
  }
}
