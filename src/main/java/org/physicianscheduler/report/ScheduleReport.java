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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.physicianscheduler.solver.SolveStatus;
import org.physicianscheduler.solver.SolverStatistics;

/**
 * The decoded outcome of a scheduling run: day by day rosters and physician workloads when a
 * solution was found, and the solver statistics in every case.
 */
public final class ScheduleReport {
  ScheduleReport(
      SolveStatus status,
      List<DayRoster> days,
      List<PhysicianWorkload> workloads,
      SolverStatistics statistics) {
    this.status = status;
    this.days = Collections.unmodifiableList(new ArrayList<>(days));
    this.workloads = Collections.unmodifiableList(new ArrayList<>(workloads));
    this.statistics = statistics;
  }

  /** Returns the report of a run without solution. */
  static ScheduleReport noSolution(SolveStatus status, SolverStatistics statistics) {
    return new ScheduleReport(
        status, Collections.<DayRoster>emptyList(), Collections.<PhysicianWorkload>emptyList(),
        statistics);
  }

  public SolveStatus getStatus() {
    return status;
  }

  /** Returns true if the report holds a schedule. */
  public boolean hasSolution() {
    return status.hasSolution();
  }

  /** Returns the day rosters in ascending day order, empty without solution. */
  public List<DayRoster> getDays() {
    return days;
  }

  /** Returns the workload of each physician in ascending id order, empty without solution. */
  public List<PhysicianWorkload> getWorkloads() {
    return workloads;
  }

  public SolverStatistics getStatistics() {
    return statistics;
  }

  /** Returns the ids of the physicians working shift s on day d. */
  public List<Integer> getAssigned(int d, int s) {
    checkSolution();
    return days.get(d).getShift(s).getPhysicianIds();
  }

  /** Returns true if physician p works shift s on day d. */
  public boolean isAssigned(int p, int d, int s) {
    return getAssigned(d, s).contains(p);
  }

  private void checkSolution() {
    if (!hasSolution()) {
      throw new IllegalStateException("No schedule for status " + status);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScheduleReport)) {
      return false;
    }
    ScheduleReport other = (ScheduleReport) o;
    return status == other.status
        && days.equals(other.days)
        && workloads.equals(other.workloads)
        && statistics.equals(other.statistics);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, days, workloads, statistics);
  }

  @Override
  public String toString() {
    return ReportFormatter.format(this);
  }

  private final SolveStatus status;
  private final List<DayRoster> days;
  private final List<PhysicianWorkload> workloads;
  private final SolverStatistics statistics;
}
