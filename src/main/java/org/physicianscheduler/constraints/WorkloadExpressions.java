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

package org.physicianscheduler.constraints;

import org.physicianscheduler.domain.AssignmentGrid;
import org.physicianscheduler.model.LinearExpression;
import org.physicianscheduler.model.LinearExpressionBuilder;

/**
 * Workload aggregates of a physician as linear expressions over the grid. They are rebuilt on each
 * call, never cached.
 */
public final class WorkloadExpressions {
  /**
   * Returns the sum over days of the night shift assignments of physician p, the constant 0 if the
   * day has no night shift.
   */
  public static LinearExpression nightShiftCount(AssignmentGrid grid, int p) {
    grid.checkPhysician(p);
    LinearExpressionBuilder nights = LinearExpression.newBuilder();
    if (!grid.hasNightShift()) {
      return nights.build();
    }
    for (int d = 0; d < grid.numDays(); ++d) {
      nights.add(grid.get(p, d, grid.nightShift()));
    }
    return nights.build();
  }

  /** Returns the sum over all days and shifts of the assignments of physician p. */
  public static LinearExpression totalShiftCount(AssignmentGrid grid, int p) {
    grid.checkPhysician(p);
    LinearExpressionBuilder shiftsWorked = LinearExpression.newBuilder();
    for (int d = 0; d < grid.numDays(); ++d) {
      for (int s = 0; s < grid.numShifts(); ++s) {
        shiftsWorked.add(grid.get(p, d, s));
      }
    }
    return shiftsWorked.build();
  }

  private WorkloadExpressions() {}
}
