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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** The binding state of one name in one scope: how many times it has been rebound. */
public final class Binding {

  private final String name;
  private int generation;

  Binding(String name) {
    this.name = name;
    this.generation = 0;
  }

  public String getName() {
    return name;
  }

  /** 0 after the first binding, incremented by each rebinding. */
  public int getGeneration() {
    return generation;
  }

  /** Moves this binding to its next generation and returns that generation. */
  @CanIgnoreReturnValue
  public int nextDef() {
    return ++generation;
  }

  @Override
  public String toString() {
    return name + "#" + generation;
  }
}
