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

package org.physicianscheduler.report;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.physicianscheduler.domain.AssignmentGrid;
import org.physicianscheduler.domain.Day;
import org.physicianscheduler.domain.Physician;
import org.physicianscheduler.domain.Shift;
import org.physicianscheduler.domain.ShiftRole;
import org.physicianscheduler.solver.SolveResult;
import org.physicianscheduler.solver.ValueLookup;

/** Reads the assignment variables of a solve back into a {@link ScheduleReport}. */
public final class ScheduleDecoder {
  private static final Logger logger = Logger.getLogger(ScheduleDecoder.class.getName());

  /**
   * Decodes the result. Without solution (INFEASIBLE, UNKNOWN) the values are not read and the
   * report only carries the status and the statistics.
   */
  public static ScheduleReport decode(SolveResult result, AssignmentGrid grid) {
    if (!result.hasSolution()) {
      logger.info("No solution found, status " + result.getStatus());
      return ScheduleReport.noSolution(result.getStatus(), result.getStatistics());
    }
    final ValueLookup values = result.getValues();

    List<DayRoster> days = new ArrayList<>();
    for (Day day : grid.getDays()) {
      List<ShiftRoster> shifts = new ArrayList<>();
      for (Shift shift : grid.getShifts()) {
        List<Physician> onDuty = new ArrayList<>();
        for (Physician physician : grid.getPhysicians()) {
          if (values.isTrue(grid.get(physician, day, shift))) {
            onDuty.add(physician);
          }
        }
        shifts.add(new ShiftRoster(shift, onDuty));
      }
      days.add(new DayRoster(day, shifts));
    }

    List<PhysicianWorkload> workloads = new ArrayList<>();
    for (Physician physician : grid.getPhysicians()) {
      int nights = 0;
      int total = 0;
      for (Day day : grid.getDays()) {
        for (Shift shift : grid.getShifts()) {
          if (values.isTrue(grid.get(physician, day, shift))) {
            total++;
            if (shift.getRole() == ShiftRole.NIGHT) {
              nights++;
            }
          }
        }
      }
      workloads.add(new PhysicianWorkload(physician, nights, total));
    }
    return new ScheduleReport(result.getStatus(), days, workloads, result.getStatistics());
  }

  private ScheduleDecoder() {}
}
