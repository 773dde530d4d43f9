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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.SourcePosition;

/**
 * A finding of an analysis.
 *
 * @param type The type of the finding.
 * @param description The formatted message.
 * @param sourceName Name of the source, if known.
 * @param lineno One-indexed line number, or -1 if unknown.
 * @param charno Zero-indexed column, or -1 if unknown.
 * @param node Node the finding is about.
 */
public record AnalysisError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    @Nullable Node node) {

  public AnalysisError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /** Creates an error with no source information. */
  public static AnalysisError make(DiagnosticType type, String... arguments) {
    return new AnalysisError(type, type.format((Object[]) arguments), null, -1, -1, null);
  }

  /** Creates an error located at {@code n}. */
  public static AnalysisError make(Node n, DiagnosticType type, String... arguments) {
    SourcePosition position = n.getSourcePosition();
    String description = type.format((Object[]) arguments);
    if (position == null) {
      return new AnalysisError(type, description, null, -1, -1, n);
    }
    return new AnalysisError(
        type,
        description,
        position.getSourceName(),
        position.getLineno(),
        position.getColOffset(),
        n);
  }

  public CheckLevel getDefaultLevel() {
    return type.level;
  }

  /** Formats this error for a one-line report, e.g. {@code a.py:3:0: WARNING - [KEY] text}. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName).append(':');
    }
    if (lineno >= 0) {
      sb.append(lineno).append(':').append(charno).append(": ");
    } else if (sourceName != null) {
      sb.append(' ');
    }
    sb.append(level).append(" - [").append(type.key).append("] ").append(description);
    return sb.toString();
  }
}
