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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pynalyser.analysis.SortingErrorManager.ErrorWithLevel;
import org.pynalyser.analysis.SortingErrorManager.LeveledErrorComparator;
import org.pynalyser.ast.IR;
import org.pynalyser.ast.Node;
import org.pynalyser.ast.SourcePosition;

/** Tests {@link SortingErrorManager} and {@link BasicErrorManager}. */
@RunWith(JUnit4.class)
public final class SortingErrorManagerTest {

  private final LeveledErrorComparator comparator = new LeveledErrorComparator();

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo {0}");

  private static final DiagnosticType JOO_TYPE = DiagnosticType.warning("TEST_JOO", "Joo");

  private static AnalysisError make(
      String sourceName, int lineno, int charno, DiagnosticType type) {
    Node n = IR.pass();
    n.setSourcePosition(SourcePosition.create(sourceName, lineno, charno, -1, -1));
    return AnalysisError.make(n, type, "x");
  }

  @Test
  public void testOrderingBothNull() {
    assertThat(comparator.compare(null, null)).isEqualTo(0);
  }

  @Test
  public void testOrderingSourceName() {
    assertSmaller(error(make(null, -1, -1, FOO_TYPE)), error(make("a", -1, -1, FOO_TYPE)));
    assertSmaller(error(make("a", -1, -1, FOO_TYPE)), error(make("b", -1, -1, FOO_TYPE)));
  }

  @Test
  public void testOrderingLineno() {
    assertSmaller(error(make(null, -1, -1, FOO_TYPE)), error(make(null, 2, -1, FOO_TYPE)));
    assertSmaller(error(make(null, 8, -1, FOO_TYPE)), error(make(null, 56, -1, FOO_TYPE)));
  }

  @Test
  public void testOrderingCheckLevel() {
    AnalysisError e1 = make(null, -1, -1, FOO_TYPE);
    AnalysisError e2 = make(null, -1, -1, FOO_TYPE);

    assertSmaller(warning(e1), error(e2));
  }

  @Test
  public void testOrderingCharno() {
    AnalysisError e1 = make(null, 5, -1, FOO_TYPE);
    AnalysisError e2 = make(null, 5, 2, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
    // CheckLevel preempts charno comparison
    assertSmaller(warning(e2), error(e1));
  }

  @Test
  public void testOrderingType() {
    assertSmaller(error(make(null, -1, -1, FOO_TYPE)), error(make(null, -1, -1, JOO_TYPE)));
  }

  @Test
  public void testDeduplicatedErrors() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, make(null, -1, -1, FOO_TYPE));
    manager.report(CheckLevel.ERROR, make(null, -1, -1, FOO_TYPE));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getErrors()).hasSize(1);
  }

  @Test
  public void testSameTextDifferentTypeKept() {
    DiagnosticType barType = DiagnosticType.error("TEST_BAR", "Foo {0}");
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, make("a", 1, 0, FOO_TYPE));
    manager.report(CheckLevel.ERROR, make("a", 1, 0, barType));

    assertThat(manager.getErrorCount()).isEqualTo(2);
    assertThat(manager.getErrors().get(0).type()).isEqualTo(barType);
    assertThat(manager.getErrors().get(1).type()).isEqualTo(FOO_TYPE);
  }

  @Test
  public void testErrorsAndWarningsSeparated() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.WARNING, make("a", 1, 0, JOO_TYPE));
    manager.report(CheckLevel.ERROR, make("a", 2, 0, FOO_TYPE));
    manager.report(CheckLevel.OFF, make("a", 3, 0, FOO_TYPE));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.getErrors().get(0).lineno()).isEqualTo(2);
    assertThat(manager.getWarnings().get(0).lineno()).isEqualTo(1);
  }

  @Test
  public void testReportPrintsSortedThenSummary() {
    List<String> printed = new ArrayList<>();
    BasicErrorManager manager =
        new BasicErrorManager() {
          @Override
          public void println(CheckLevel level, AnalysisError error) {
            printed.add(error.format(level));
          }

          @Override
          protected void printSummary() {
            printed.add(getErrorCount() + "/" + getWarningCount());
          }
        };
    manager.report(CheckLevel.WARNING, make("b.py", 4, 2, JOO_TYPE));
    manager.report(CheckLevel.ERROR, make("a.py", 9, 0, FOO_TYPE));

    manager.generateReport();

    assertThat(printed)
        .containsExactly(
            "b.py:4:2: WARNING - [TEST_JOO] Joo", "a.py:9:0: ERROR - [TEST_FOO] Foo x", "1/1")
        .inOrder();
  }

  private ErrorWithLevel error(AnalysisError e) {
    return new ErrorWithLevel(e, CheckLevel.ERROR);
  }

  private ErrorWithLevel warning(AnalysisError e) {
    return new ErrorWithLevel(e, CheckLevel.WARNING);
  }

  private void assertSmaller(ErrorWithLevel p1, ErrorWithLevel p2) {
    assertThat(comparator.compare(p1, p2)).isLessThan(0);
    assertThat(comparator.compare(p2, p1)).isGreaterThan(0);
  }
}
