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

import java.util.Locale;
import org.physicianscheduler.domain.Physician;
import org.physicianscheduler.solver.SolverStatistics;

/** Renders a {@link ScheduleReport} as text. Days, shifts and physicians are shown 1-indexed. */
public final class ReportFormatter {
  /** Returns the schedule, or "No solution found.", followed by the statistics block. */
  public static String format(ScheduleReport report) {
    StringBuilder out = new StringBuilder();
    out.append(formatSchedule(report));
    out.append('\n');
    out.append(formatStatistics(report));
    return out.toString();
  }

  public static String formatSchedule(ScheduleReport report) {
    StringBuilder out = new StringBuilder();
    if (!report.hasSolution()) {
      out.append("No solution found.\n");
      return out.toString();
    }
    out.append("Solution found:\n");
    for (DayRoster day : report.getDays()) {
      out.append(day.getDay().getLabel()).append(":\n");
      for (ShiftRoster shift : day.getShifts()) {
        out.append("  ").append(shift.getShift().getLabel()).append(":");
        for (Physician physician : shift.getPhysicians()) {
          out.append(' ').append(physician.getLabel());
        }
        out.append('\n');
      }
      out.append('\n');
    }
    return out.toString();
  }

  public static String formatStatistics(ScheduleReport report) {
    final SolverStatistics stats = report.getStatistics();
    StringBuilder out = new StringBuilder();
    out.append("Statistics\n");
    out.append("  - Status    : ").append(report.getStatus()).append('\n');
    out.append("  - Conflicts : ").append(stats.getNumConflicts()).append('\n');
    out.append("  - Branches  : ").append(stats.getNumBranches()).append('\n');
    out.append(String.format(Locale.ROOT, "  - Wall time : %f s\n", stats.getWallTime()));
    return out.toString();
  }

  /** Returns one line per physician with its night and total shift counts. */
  public static String formatWorkloads(ScheduleReport report) {
    StringBuilder out = new StringBuilder();
    out.append("Workload\n");
    for (PhysicianWorkload workload : report.getWorkloads()) {
      out.append(
          String.format(
              Locale.ROOT,
              "  %-4s: nights %d, total %d\n",
              workload.getPhysician().getLabel(),
              workload.getNightShifts(),
              workload.getTotalShifts()));
    }
    return out.toString();
  }

  private ReportFormatter() {}
}
