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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.physicianscheduler.domain.AssignmentGrid;
import org.physicianscheduler.solver.SolveResult;
import org.physicianscheduler.solver.SolveStatus;
import org.physicianscheduler.solver.ValueLookup;

/** Tests the decoding of solver values into rosters. */
public final class ScheduleDecoderTest {
  @Test
  public void testScheduleDecoder_rosters() {
    final AssignmentGrid grid = ReportFixtures.grid();
    final ScheduleReport report =
        ScheduleDecoder.decode(ReportFixtures.result(grid, ReportFixtures.sampleSchedule()), grid);

    assertThat(report.hasSolution()).isTrue();
    assertThat(report.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
    assertThat(report.getDays()).hasSize(2);
    assertThat(report.getDays().get(0).getShifts()).hasSize(3);
    assertThat(report.getAssigned(0, 0)).containsExactly(0);
    assertThat(report.getAssigned(0, 2)).containsExactly(1);
    assertThat(report.getAssigned(1, 0)).containsExactly(0, 2).inOrder();
    assertThat(report.getAssigned(1, 1)).isEmpty();
    assertThat(report.isAssigned(2, 0, 1)).isTrue();
    assertThat(report.isAssigned(2, 1, 1)).isFalse();
    assertThat(report.getStatistics()).isEqualTo(ReportFixtures.STATISTICS);
  }

  @Test
  public void testScheduleDecoder_workloads() {
    final AssignmentGrid grid = ReportFixtures.grid();
    final ScheduleReport report =
        ScheduleDecoder.decode(ReportFixtures.result(grid, ReportFixtures.sampleSchedule()), grid);

    assertThat(report.getWorkloads())
        .containsExactly(
            new PhysicianWorkload(grid.getPhysician(0), 0, 2),
            new PhysicianWorkload(grid.getPhysician(1), 2, 2),
            new PhysicianWorkload(grid.getPhysician(2), 0, 2))
        .inOrder();
  }

  @Test
  public void testScheduleDecoder_deterministic() {
    final AssignmentGrid grid = ReportFixtures.grid();
    final SolveResult result = ReportFixtures.result(grid, ReportFixtures.sampleSchedule());
    final ScheduleReport first = ScheduleDecoder.decode(result, grid);
    final ScheduleReport second = ScheduleDecoder.decode(result, grid);

    assertThat(second).isEqualTo(first);
    assertThat(second.hashCode()).isEqualTo(first.hashCode());
    assertThat(ReportFormatter.format(second)).isEqualTo(ReportFormatter.format(first));
  }

  @Test
  public void testScheduleDecoder_readsOnlyGridVariables() {
    final AssignmentGrid grid = ReportFixtures.grid();
    final int gridSize = grid.getModel().numVariables();
    grid.getModel().newIntVar(0, 10, "auxiliary");
    final ValueLookup lookup =
        var -> {
          if (var.getIndex() >= gridSize) {
            throw new AssertionError("Decoder read " + var);
          }
          return var.getIndex() % 2;
        };
    final ScheduleReport report =
        ScheduleDecoder.decode(
            new SolveResult(SolveStatus.FEASIBLE, lookup, ReportFixtures.STATISTICS), grid);
    assertThat(report.getStatus()).isEqualTo(SolveStatus.FEASIBLE);
    assertThat(report.getDays()).hasSize(2);
  }

  @Test
  public void testScheduleDecoder_noSolution() {
    final AssignmentGrid grid = ReportFixtures.grid();
    for (SolveStatus status : new SolveStatus[] {SolveStatus.INFEASIBLE, SolveStatus.UNKNOWN}) {
      final ScheduleReport report =
          ScheduleDecoder.decode(new SolveResult(status, null, ReportFixtures.STATISTICS), grid);
      assertThat(report.hasSolution()).isFalse();
      assertThat(report.getStatus()).isEqualTo(status);
      assertThat(report.getDays()).isEmpty();
      assertThat(report.getWorkloads()).isEmpty();
      assertThat(report.getStatistics()).isEqualTo(ReportFixtures.STATISTICS);
      assertThrows(IllegalStateException.class, () -> report.getAssigned(0, 0));
    }
  }
}
