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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A primitive tree construction helper class. */
public class IR {

  private IR() {}

  // Expressions

  public static AstNode name(String id) {
    checkArgument(!Strings.isNullOrEmpty(id), "empty name");
    return new AstNode(Token.NAME).set("id", id);
  }

  public static AstNode attribute(Node value, String attr) {
    checkArgument(!Strings.isNullOrEmpty(attr), "empty attribute");
    return new AstNode(Token.ATTRIBUTE).set("value", checkNotNull(value)).set("attr", attr);
  }

  public static AstNode subscript(Node value, Node slice) {
    return new AstNode(Token.SUBSCRIPT)
        .set("value", checkNotNull(value))
        .set("slice", checkNotNull(slice));
  }

  public static AstNode starred(Node value) {
    return new AstNode(Token.STARRED).set("value", checkNotNull(value));
  }

  public static AstNode tuple(Node... elts) {
    return new AstNode(Token.TUPLE).set("elts", ImmutableList.copyOf(elts));
  }

  public static AstNode list(Node... elts) {
    return new AstNode(Token.LIST).set("elts", ImmutableList.copyOf(elts));
  }

  public static AstNode set(Node... elts) {
    return new AstNode(Token.SET).set("elts", ImmutableList.copyOf(elts));
  }

  public static AstNode dict(List<? extends Node> keys, List<? extends Node> values) {
    checkArgument(
        keys.size() == values.size(), "%s keys for %s values", keys.size(), values.size());
    return new AstNode(Token.DICT)
        .set("keys", ImmutableList.copyOf(keys))
        .set("values", ImmutableList.copyOf(values));
  }

  public static AstNode constant(@Nullable Object value) {
    return new AstNode(Token.CONSTANT).set("value", value);
  }

  public static AstNode binOp(Node left, String op, Node right) {
    return new AstNode(Token.BIN_OP)
        .set("left", checkNotNull(left))
        .set("op", op)
        .set("right", checkNotNull(right));
  }

  public static AstNode unaryOp(String op, Node operand) {
    return new AstNode(Token.UNARY_OP).set("op", op).set("operand", checkNotNull(operand));
  }

  public static AstNode boolOp(String op, Node... values) {
    checkArgument(values.length >= 2, "a boolean operation needs two operands");
    return new AstNode(Token.BOOL_OP).set("op", op).set("values", ImmutableList.copyOf(values));
  }

  public static AstNode compare(Node left, String op, Node right) {
    return new AstNode(Token.COMPARE)
        .set("left", checkNotNull(left))
        .set("ops", ImmutableList.of(constant(op)))
        .set("comparators", ImmutableList.of(checkNotNull(right)));
  }

  public static AstNode call(Node func, Node... args) {
    return call(func, ImmutableList.copyOf(args), ImmutableList.of());
  }

  public static AstNode call(Node func, List<? extends Node> args, List<? extends Node> keywords) {
    for (Node keyword : keywords) {
      checkState(keyword.getToken() == Token.KEYWORD, keyword);
    }
    return new AstNode(Token.CALL)
        .set("func", checkNotNull(func))
        .set("args", ImmutableList.copyOf(args))
        .set("keywords", ImmutableList.copyOf(keywords));
  }

  public static AstNode namedExpr(Node target, Node value) {
    checkState(target.isName(), target);
    return new AstNode(Token.NAMED_EXPR).set("target", target).set("value", checkNotNull(value));
  }

  public static AstNode ifExp(Node test, Node body, Node orelse) {
    return new AstNode(Token.IF_EXP)
        .set("test", checkNotNull(test))
        .set("body", checkNotNull(body))
        .set("orelse", checkNotNull(orelse));
  }

  public static AstNode await(Node value) {
    return new AstNode(Token.AWAIT).set("value", checkNotNull(value));
  }

  public static AstNode yield(@Nullable Node value) {
    return new AstNode(Token.YIELD).set("value", value);
  }

  public static AstNode yieldFrom(Node value) {
    return new AstNode(Token.YIELD_FROM).set("value", checkNotNull(value));
  }

  public static AstNode slice(@Nullable Node lower, @Nullable Node upper, @Nullable Node step) {
    return new AstNode(Token.SLICE).set("lower", lower).set("upper", upper).set("step", step);
  }

  // Statements

  public static AstNode exprResult(Node value) {
    return new AstNode(Token.EXPR).set("value", checkNotNull(value));
  }

  /** Creates {@code t1 = t2 = ... = value}; targets are kept in source order. */
  public static AstNode assign(List<? extends Node> targets, Node value) {
    checkArgument(!targets.isEmpty(), "an assignment needs a target");
    return new AstNode(Token.ASSIGN)
        .set("targets", ImmutableList.copyOf(targets))
        .set("value", checkNotNull(value));
  }

  public static AstNode assign(Node target, Node value) {
    return assign(ImmutableList.of(target), value);
  }

  public static AstNode augAssign(Node target, String op, Node value) {
    return new AstNode(Token.AUG_ASSIGN)
        .set("target", checkNotNull(target))
        .set("op", op)
        .set("value", checkNotNull(value));
  }

  public static AstNode annAssign(Node target, Node annotation, @Nullable Node value) {
    return new AstNode(Token.ANN_ASSIGN)
        .set("target", checkNotNull(target))
        .set("annotation", checkNotNull(annotation))
        .set("value", value)
        .set("simple", target.isName());
  }

  public static AstNode importNode(Node... aliases) {
    checkArgument(aliases.length > 0, "an import needs at least one alias");
    for (Node alias : aliases) {
      checkState(alias.getToken() == Token.ALIAS, alias);
    }
    return new AstNode(Token.IMPORT).set("names", ImmutableList.copyOf(aliases));
  }

  public static AstNode importFrom(@Nullable String module, int level, Node... aliases) {
    checkArgument(aliases.length > 0, "an import needs at least one alias");
    checkArgument(level >= 0, "negative import level %s", level);
    for (Node alias : aliases) {
      checkState(alias.getToken() == Token.ALIAS, alias);
    }
    return new AstNode(Token.IMPORT_FROM)
        .set("module", module)
        .set("names", ImmutableList.copyOf(aliases))
        .set("level", level);
  }

  public static AstNode delete(Node... targets) {
    return new AstNode(Token.DELETE).set("targets", ImmutableList.copyOf(targets));
  }

  public static AstNode global(String... names) {
    return new AstNode(Token.GLOBAL).set("names", names(names));
  }

  public static AstNode nonlocal(String... names) {
    return new AstNode(Token.NONLOCAL).set("names", names(names));
  }

  public static AstNode pass() {
    return new AstNode(Token.PASS);
  }

  public static AstNode returnNode(@Nullable Node value) {
    return new AstNode(Token.RETURN).set("value", value);
  }

  public static AstNode raise(@Nullable Node exc, @Nullable Node cause) {
    checkArgument(exc != null || cause == null, "raise without exception cannot have a cause");
    return new AstNode(Token.RAISE).set("exc", exc).set("cause", cause);
  }

  public static AstNode assertNode(Node test, @Nullable Node msg) {
    return new AstNode(Token.ASSERT).set("test", checkNotNull(test)).set("msg", msg);
  }

  public static AstNode breakNode() {
    return new AstNode(Token.BREAK);
  }

  public static AstNode continueNode() {
    return new AstNode(Token.CONTINUE);
  }

  // Auxiliary nodes

  public static AstNode alias(String name) {
    return alias(name, null);
  }

  public static AstNode alias(String name, @Nullable String asname) {
    checkArgument(!Strings.isNullOrEmpty(name), "empty alias name");
    checkArgument(asname == null || !asname.isEmpty(), "empty alias asname");
    return new AstNode(Token.ALIAS).set("name", name).set("asname", asname);
  }

  public static AstNode keyword(@Nullable String arg, Node value) {
    return new AstNode(Token.KEYWORD).set("arg", arg).set("value", checkNotNull(value));
  }

  public static AstNode arg(String arg) {
    checkArgument(!Strings.isNullOrEmpty(arg), "empty argument name");
    return new AstNode(Token.ARG).set("arg", arg);
  }

  public static AstNode arguments(Node... args) {
    for (Node arg : args) {
      checkState(arg.getToken() == Token.ARG, arg);
    }
    return new AstNode(Token.ARGUMENTS).set("args", ImmutableList.copyOf(args));
  }

  public static AstNode withItem(Node contextExpr, @Nullable Node optionalVars) {
    return new AstNode(Token.WITH_ITEM)
        .set("context_expr", checkNotNull(contextExpr))
        .set("optional_vars", optionalVars);
  }

  private static ImmutableList<Node> names(String... names) {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (String name : names) {
      builder.add(name(name));
    }
    return builder.build();
  }
}
