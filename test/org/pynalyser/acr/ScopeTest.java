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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pynalyser.ast.IR;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.Token;

/** Tests for the enriched tree: scopes, blocks and their containers. */
@RunWith(JUnit4.class)
public final class ScopeTest {

  @Test
  public void testNestedScopesAreRegistered() {
    Module module = Acr.module("m");
    Scope f = Acr.function(module, "f", IR.arguments());
    Scope c = Acr.classDef(module, "C", IR.name("Base"));

    assertThat(module.getChildScopes()).containsExactly(f, c).inOrder();
    assertThat(module.getChildScope("f")).isSameInstanceAs(f);
    assertThat(module.getChildScope("g")).isNull();
    assertThat(f.getChildScopes()).isEmpty();
  }

  @Test
  public void testDuplicateNestedScopeRejected() {
    Module module = Acr.module("m");
    Acr.function(module, "f", null);

    assertThrows(IllegalArgumentException.class, () -> Acr.function(module, "f", null));
  }

  @Test
  public void testModuleCannotBeNested() {
    Module module = Acr.module("m");

    assertThrows(IllegalArgumentException.class, () -> module.declareScope(Acr.module("n")));
    assertThrows(IllegalArgumentException.class, () -> module.declareScope(module));
  }

  @Test
  public void testScopeNameIsFixed() {
    Scope f = Acr.function(Acr.module("m"), "f", null);

    assertThat(f.getName()).isEqualTo("f");
    assertThrows(IllegalArgumentException.class, () -> f.set("name", "g"));
  }

  @Test
  public void testScopeNeedsName() {
    assertThrows(IllegalArgumentException.class, () -> Acr.module(""));
  }

  @Test
  public void testEachScopeOwnsItsSymbolTable() {
    Module module = Acr.module("m");
    Scope f = Acr.function(module, "f", null);

    module.getSymbolTable().nextDef("x");

    assertThat(f.getSymbolTable().hasBinding("x")).isFalse();
  }

  @Test
  public void testLambdaBodyReturnsExpression() {
    Scope lambda = Acr.lambda(Acr.module("m"), "<lambda>", IR.arguments(), IR.name("x"));

    Node ret = lambda.getBody().getElements().get(0);
    assertThat(ret.getToken()).isEqualTo(Token.RETURN);
    assertThat(ret.getNode("value").getString("id")).isEqualTo("x");
  }

  @Test
  public void testScopeReferenceResolves() {
    Module module = Acr.module("m");
    Scope comp = Acr.comprehension(module, "<listcomp>", IR.name("y"));

    assertThat(Acr.scopeReference(comp).resolve(module)).isSameInstanceAs(comp);
    assertThat(Acr.scopeReference("missing").resolve(module)).isNull();
    assertThat(Acr.scopeReference(comp).resolve(comp)).isNull();
  }

  @Test
  public void testBlockFieldsFollowPlainFields() {
    Block loop = Acr.forLoop(IR.name("i"), IR.name("xs"));

    assertThat(loop.getFields()).containsExactly("target", "iter", "body", "orelse").inOrder();
    assertThat(loop.getField("orelse")).isSameInstanceAs(loop.getFlowContainer("orelse"));
    assertThat(loop.getNode("target").getString("id")).isEqualTo("i");
    assertThrows(IllegalArgumentException.class, () -> loop.getFlowContainer("handlers"));
  }

  @Test
  public void testTryContainersInOrder() {
    Block tryBlock = Acr.tryBlock();

    assertThat(tryBlock.getBlockFields())
        .containsExactly("body", "handlers", "orelse", "finalbody")
        .inOrder();
  }

  @Test
  public void testFlowContainerKeepsOrder() {
    Block ifBlock = Acr.ifBlock(IR.name("c"));
    CodeBlock first = Acr.codeBlock(IR.pass());
    Node ret = IR.returnNode(null);

    ifBlock.getBody().add(first).add(ret);

    assertThat(ifBlock.getBody()).containsExactly(first, ret).inOrder();
    assertThat(ifBlock.getBody().size()).isEqualTo(2);
    assertThat(ifBlock.getFlowContainer("orelse").isEmpty()).isTrue();
  }

  @Test
  public void testCodeBlockRejectsNonStatements() {
    CodeBlock codeBlock = Acr.codeBlock(IR.pass());

    assertThrows(IllegalArgumentException.class, () -> codeBlock.add(IR.name("x")));
    assertThrows(IllegalArgumentException.class, () -> codeBlock.add(Acr.whileLoop(IR.name("c"))));
    assertThat(codeBlock.getStatements()).hasSize(1);
  }

  @Test
  public void testBareExceptCannotBindName() {
    assertThrows(IllegalStateException.class, () -> Acr.exceptHandler(null, "e"));
    assertThat(Acr.exceptHandler(IR.name("E"), "e").getString("name")).isEqualTo("e");
  }

  @Test
  public void testWithRequiresItems() {
    assertThrows(IllegalStateException.class, () -> Acr.with(IR.name("cm")));
  }

  @Test
  public void testTokenAndNodeClassMustAgree() {
    assertThrows(IllegalArgumentException.class, () -> new Block(Token.FUNCTION_DEF));
    assertThrows(IllegalArgumentException.class, () -> new Scope(Token.FOR, "f"));
    assertThrows(IllegalArgumentException.class, () -> new Block(Token.ASSIGN));
  }
}
