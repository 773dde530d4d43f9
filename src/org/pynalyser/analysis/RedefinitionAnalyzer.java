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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.pynalyser.acr.Binding;
import org.pynalyser.acr.Module;
import org.pynalyser.acr.Scope;
import org.pynalyser.acr.SymbolTable;
import org.pynalyser.ast.Node;

/**
 * Records every point where a name is bound or rebound by advancing the name's {@link Binding} in
 * the symbol table of the scope it is bound in.
 *
 * <p>The names bound by a node are recorded before the node's own subtree is visited. For {@code i
 * = i + 1} the new generation of {@code i} is thus recorded before the read of {@code i} on the
 * right-hand side is reached.
 *
 * <p>A scope binds its name in the enclosing scope's table. The root module has no enclosing
 * scope, so its name goes to its own table.
 *
 * <p>Deletions, with-statement targets, pattern-match captures and {@code except ... as} names are
 * not collected.
 */
public class RedefinitionAnalyzer extends NodeVisitor<Void> implements AnalyzerPass {

  static final DiagnosticType REDEFINED_NAME =
      DiagnosticType.disabled("PYN_REDEFINED_NAME", "Name redefined: {0} (generation {1})");

  private final Analyzer analyzer;
  private final SymbolTableResolver symbolTableResolver;

  public RedefinitionAnalyzer(Analyzer analyzer) {
    this(analyzer, SymbolTableResolver.CURRENT_SCOPE);
  }

  public RedefinitionAnalyzer(Analyzer analyzer, SymbolTableResolver symbolTableResolver) {
    this.analyzer = checkNotNull(analyzer);
    this.symbolTableResolver = checkNotNull(symbolTableResolver);
  }

  @Override
  public void process(Module root) {
    start(root);
  }

  @Override
  public @Nullable Void visit(Node n) {
    ImmutableList<String> names = getBoundNames(n);
    if (!names.isEmpty()) {
      SymbolTable symtab = symbolTableResolver.resolve(this, n);
      CheckLevel level = analyzer.getOptions().getRedefinitionLevel();
      for (String name : names) {
        Binding binding = symtab.nextDef(name);
        if (binding.getGeneration() > 0) {
          analyzer.report(
              level,
              AnalysisError.make(
                  n, REDEFINED_NAME, name, String.valueOf(binding.getGeneration())));
        }
      }
    }
    return super.visit(n);
  }

  /** Returns the names {@code n} binds, in the order they are bound. */
  private ImmutableList<String> getBoundNames(Node n) {
    switch (n.getToken()) {
      case MODULE:
      case FUNCTION_DEF:
      case ASYNC_FUNCTION_DEF:
      case LAMBDA:
      case CLASS_DEF:
      case COMPREHENSION:
        return ImmutableList.of(((Scope) n).getName());
      case FOR:
      case ASYNC_FOR:
      case AUG_ASSIGN:
      case NAMED_EXPR:
        return NameCollector.collectNames(checkNotNull(n.getNode("target")));
      case ASSIGN:
        {
          ImmutableList.Builder<String> names = ImmutableList.builder();
          for (Node target : n.getNodeList("targets")) {
            names.addAll(NameCollector.collectNames(target));
          }
          return names.build();
        }
      case IMPORT:
      case IMPORT_FROM:
        {
          ImmutableList.Builder<String> names = ImmutableList.builder();
          for (Node alias : n.getNodeList("names")) {
            String asname = alias.getString("asname");
            names.add(asname != null ? asname : checkNotNull(alias.getString("name")));
          }
          return names.build();
        }
      default:
        return ImmutableList.of();
    }
  }
}
