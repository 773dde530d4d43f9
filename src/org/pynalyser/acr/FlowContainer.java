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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.pynalyser.ast.Node;

/**
 * The elements of one block field, in execution order. Each element is expected to be a {@link
 * CodeBlock}, a nested {@link Block}, or a terminal statement (return, raise, assert, break,
 * continue). That expectation is checked when the container is traversed, not here.
 */
public final class FlowContainer implements Iterable<Node> {

  private final String name;
  private final List<Node> elements = new ArrayList<>();

  FlowContainer(String name) {
    this.name = name;
  }

  /** The block field this container fills. */
  public String getName() {
    return name;
  }

  @CanIgnoreReturnValue
  public FlowContainer add(Node element) {
    elements.add(checkNotNull(element));
    return this;
  }

  public ImmutableList<Node> getElements() {
    return ImmutableList.copyOf(elements);
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  @Override
  public Iterator<Node> iterator() {
    return Iterators.unmodifiableIterator(elements.iterator());
  }

  @Override
  public String toString() {
    return name + elements;
  }
}
