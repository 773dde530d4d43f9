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

import java.io.Serializable;

/** Options for an {@link Analyzer} run. */
public class AnalyzerOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Level at which a rebinding of an already bound name is reported. */
  private CheckLevel redefinitionLevel = CheckLevel.OFF;

  public CheckLevel getRedefinitionLevel() {
    return redefinitionLevel;
  }

  public void setRedefinitionLevel(CheckLevel redefinitionLevel) {
    this.redefinitionLevel = redefinitionLevel;
  }
}
