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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SymbolTable}. */
@RunWith(JUnit4.class)
public final class SymbolTableTest {

  @Test
  public void testFirstDefinitionStartsAtZero() {
    SymbolTable table = new SymbolTable();

    Binding binding = table.nextDef("x");

    assertThat(binding.getName()).isEqualTo("x");
    assertThat(binding.getGeneration()).isEqualTo(0);
    assertThat(table.hasBinding("x")).isTrue();
    assertThat(table.getBinding("x")).isSameInstanceAs(binding);
  }

  @Test
  public void testRedefinitionIncrementsGeneration() {
    SymbolTable table = new SymbolTable();
    table.nextDef("x");
    table.nextDef("x");

    Binding binding = table.nextDef("x");

    assertThat(binding.getGeneration()).isEqualTo(2);
    assertThat(table.getGeneration("x")).isEqualTo(2);
    assertThat(table.size()).isEqualTo(1);
  }

  @Test
  public void testUnboundName() {
    SymbolTable table = new SymbolTable();

    assertThat(table.hasBinding("y")).isFalse();
    assertThat(table.getBinding("y")).isNull();
    assertThat(table.getGeneration("y")).isEqualTo(-1);
  }

  @Test
  public void testNamesInFirstBoundOrder() {
    SymbolTable table = new SymbolTable();
    table.nextDef("b");
    table.nextDef("a");
    table.nextDef("b");

    assertThat(table.getNames()).containsExactly("b", "a").inOrder();
  }

  @Test
  public void testBindingToString() {
    SymbolTable table = new SymbolTable();
    table.nextDef("x");

    assertThat(table.nextDef("x").toString()).isEqualTo("x#1");
  }
}
