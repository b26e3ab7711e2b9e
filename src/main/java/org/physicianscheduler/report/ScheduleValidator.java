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
import org.physicianscheduler.config.NightFairnessScope;
import org.physicianscheduler.config.RestBoundary;
import org.physicianscheduler.config.RosterConfig;
import org.physicianscheduler.domain.ShiftRole;

/**
 * Checks a decoded schedule against the policies of a configuration, independently of the model
 * that produced it.
 */
public final class ScheduleValidator {
  /**
   * Returns a description of every violated policy, empty if the schedule satisfies all of them.
   *
   * @throws IllegalStateException if the report holds no schedule
   */
  public static List<String> validate(ScheduleReport report, RosterConfig config) {
    if (!report.hasSolution()) {
      throw new IllegalStateException("No schedule to validate, status " + report.getStatus());
    }
    final int numPhysicians = config.getNumPhysicians();
    final int numDays = config.getNumDays();
    final int numShifts = config.getNumShifts();
    final boolean hasNight = numShifts >= ShiftRole.MIN_SHIFTS_WITH_NIGHT;
    final int night = ShiftRole.NIGHT_SHIFT_INDEX;
    final int morning = 0;
    List<String> violations = new ArrayList<>();

    for (int d = 0; d < numDays; ++d) {
      for (int s = 0; s < numShifts; ++s) {
        final int onDuty = report.getAssigned(d, s).size();
        int required = config.getMinBaselineCoverage();
        if (config.getPeakShifts().contains(s)) {
          required = Math.max(required, config.getMinPeakCoverage());
        }
        if (onDuty < required) {
          violations.add(
              String.format("day %d shift %d: %d on duty, %d required", d, s, onDuty, required));
        }
      }
    }

    for (int p = 0; p < numPhysicians; ++p) {
      for (int d = 0; d < numDays; ++d) {
        int worked = 0;
        for (int s = 0; s < numShifts; ++s) {
          if (report.isAssigned(p, d, s)) {
            worked++;
          }
        }
        if (worked > 1) {
          violations.add(String.format("physician %d works %d shifts on day %d", p, worked, d));
        }
      }
    }

    if (numDays > 1 && hasNight) {
      for (int p = 0; p < numPhysicians; ++p) {
        for (int d = 0; d < numDays; ++d) {
          if (d == numDays - 1 && config.getRestBoundary() == RestBoundary.REFERENCE) {
            continue;
          }
          final int next = (d + 1) % numDays;
          if (report.isAssigned(p, d, night) && report.isAssigned(p, next, morning)) {
            violations.add(
                String.format(
                    "physician %d works the night of day %d and the morning of day %d",
                    p, d, next));
          }
        }
      }
    }

    int expectedNights = -1;
    for (PhysicianWorkload workload : report.getWorkloads()) {
      if (config.getNightFairnessScope() == NightFairnessScope.NIGHT_ELIGIBLE
          && !workload.getPhysician().isNightShiftEligible()) {
        continue;
      }
      if (expectedNights < 0) {
        expectedNights = workload.getNightShifts();
      } else if (workload.getNightShifts() != expectedNights) {
        violations.add(
            String.format(
                "physician %d works %d nights, expected %d",
                workload.getPhysician().getId(), workload.getNightShifts(), expectedNights));
      }
    }

    for (int p : config.getSeniorPhysicians()) {
      for (int d = 0; d < numDays && hasNight; ++d) {
        if (report.isAssigned(p, d, night)) {
          violations.add(String.format("senior physician %d works the night of day %d", p, d));
        }
      }
    }

    if (config.hasWeekend()) {
      for (int p = 0; p < numPhysicians; ++p) {
        for (int s = 0; s < numShifts; ++s) {
          if (report.isAssigned(p, config.getSaturday(), s)
              != report.isAssigned(p, config.getSunday(), s)) {
            violations.add(
                String.format("physician %d shift %d differs between weekend days", p, s));
          }
        }
      }
    }
    return violations;
  }

  private ScheduleValidator() {}
}
