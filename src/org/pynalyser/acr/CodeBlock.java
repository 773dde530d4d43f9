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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.Token;

/** A straight-line run of plain statements inside a flow container. */
public final class CodeBlock extends Node {

  CodeBlock() {
    super(Token.CODE_BLOCK);
    setField("body", ImmutableList.of());
  }

  @CanIgnoreReturnValue
  public CodeBlock add(Node statement) {
    checkNotNull(statement);
    checkArgument(
        statement.getToken().getCategory() == Token.Category.STATEMENT,
        "not a plain statement: %s",
        statement);
    setField(
        "body", ImmutableList.<Node>builder().addAll(getStatements()).add(statement).build());
    return this;
  }

  public ImmutableList<Node> getStatements() {
    return getNodeList("body");
  }
}
