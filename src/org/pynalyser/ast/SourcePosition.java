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

import com.google.auto.value.AutoValue;
import org.jspecify.annotations.Nullable;

/**
 * Where a node came from. Lines are one-indexed, columns zero-indexed; -1 marks an unknown
 * value.
 */
@AutoValue
public abstract class SourcePosition {

  public abstract @Nullable String getSourceName();

  public abstract int getLineno();

  public abstract int getColOffset();

  public abstract int getEndLineno();

  public abstract int getEndColOffset();

  public static SourcePosition create(
      @Nullable String sourceName, int lineno, int colOffset, int endLineno, int endColOffset) {
    return new AutoValue_SourcePosition(sourceName, lineno, colOffset, endLineno, endColOffset);
  }

  public static SourcePosition at(int lineno, int colOffset) {
    return create(null, lineno, colOffset, -1, -1);
  }

  @Override
  public final String toString() {
    String location = getLineno() + ":" + getColOffset();
    return getSourceName() == null ? location : getSourceName() + ":" + location;
  }
}
