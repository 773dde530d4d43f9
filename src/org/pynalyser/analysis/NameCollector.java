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

import com.google.common.collect.ImmutableList;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.Token;

/**
 * Lists the simple names a binding target binds.
 *
 * <p>Names come out in source order: left to right, outer before inner, so that {@code (a, (b,
 * c))} gives {@code [a, b, c]}. Tuples, lists and starred targets contribute the names nested in
 * them. Attribute and subscript targets bind no name of their own, but the names nested in them
 * are collected all the same.
 */
public final class NameCollector {

  private NameCollector() {}

  public static ImmutableList<String> collectNames(Node target) {
    checkArgument(target != null, "Cannot collect names from a null target");
    checkArgument(
        !target.getToken().isEnriched(), "Not a binding target: %s", target.getToken());
    NameVisitor visitor = new NameVisitor();
    visitor.visit(target);
    return visitor.names.build();
  }

  private static final class NameVisitor extends NodeVisitor<Void> {
    private final ImmutableList.Builder<String> names = ImmutableList.builder();

    NameVisitor() {
      addHandler(
          Token.NAME,
          n -> {
            names.add(checkNotNull(n.getString("id")));
            return null;
          });
    }

    @Override
    protected void genericVisit(Node n) {
      // Nested scopes bind in their own namespace.
      if (!n.isScopeReference()) {
        super.genericVisit(n);
      }
    }
  }
}
