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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.TreeSet;

/**
 * An error manager that keeps everything reported to it sorted and free of duplicates. It prints
 * nothing; {@link BasicErrorManager} adds output.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, AnalysisError error) {
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public void generateReport() {}

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<AnalysisError> getErrors() {
    return select(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<AnalysisError> getWarnings() {
    return select(CheckLevel.WARNING);
  }

  ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<AnalysisError> select(CheckLevel level) {
    ImmutableList.Builder<AnalysisError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  /**
   * Orders errors by level (warnings first), source name, line, column and description. Unknown
   * source names and positions sort before known ones.
   *
   * <p>Note: this comparator imposes orderings that are inconsistent with {@link
   * AnalysisError#equals(Object)}.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // null is the smallest value
      if (p2 == null) {
        return p1 == null ? 0 : P1_GT_P2;
      } else if (p1 == null) {
        return P1_LT_P2;
      }

      if (p1.level != p2.level) {
        return p2.level.compareTo(p1.level);
      }

      String source1 = p1.error.sourceName();
      String source2 = p2.error.sourceName();
      if (source1 != null && source2 != null) {
        int sourceCompare = source1.compareTo(source2);
        if (sourceCompare != 0) {
          return sourceCompare;
        }
      } else if (source1 == null && source2 != null) {
        return P1_LT_P2;
      } else if (source1 != null && source2 == null) {
        return P1_GT_P2;
      }

      int lineno1 = p1.error.lineno();
      int lineno2 = p2.error.lineno();
      if (lineno1 != lineno2) {
        return Integer.compare(lineno1, lineno2);
      }

      int charno1 = p1.error.charno();
      int charno2 = p2.error.charno();
      if (charno1 != charno2) {
        return Integer.compare(charno1, charno2);
      }

      int keyCompare = p1.error.type().compareTo(p2.error.type());
      if (keyCompare != 0) {
        return keyCompare;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  /** An error paired with the level it was reported at. Only the comparator orders these. */
  static final class ErrorWithLevel {
    final AnalysisError error;
    final CheckLevel level;

    ErrorWithLevel(AnalysisError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
