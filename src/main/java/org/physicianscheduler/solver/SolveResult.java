// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.physicianscheduler.solver;

import org.physicianscheduler.model.Variable;

/** Status, values and statistics of one solve. */
public final class SolveResult {
  /**
   * Creates a result. {@code values} must be non null if and only if the status has a solution.
   */
  public SolveResult(SolveStatus status, ValueLookup values, SolverStatistics statistics) {
    if (status.hasSolution() != (values != null)) {
      throw new IllegalArgumentException(
          "Status " + status + (values == null ? " requires" : " forbids") + " solution values");
    }
    this.status = status;
    this.values = values;
    this.statistics = statistics;
  }

  public SolveStatus getStatus() {
    return status;
  }

  public boolean hasSolution() {
    return status.hasSolution();
  }

  /**
   * Returns the solution values.
   *
   * @throws IllegalStateException if the status is INFEASIBLE or UNKNOWN
   */
  public ValueLookup getValues() {
    if (!status.hasSolution()) {
      throw new IllegalStateException("No solution values for status " + status);
    }
    return values;
  }

  /** Shortcut for getValues().valueOf(var). */
  public long value(Variable var) {
    return getValues().valueOf(var);
  }

  public SolverStatistics getStatistics() {
    return statistics;
  }

  private final SolveStatus status;
  private final ValueLookup values;
  private final SolverStatistics statistics;
}
