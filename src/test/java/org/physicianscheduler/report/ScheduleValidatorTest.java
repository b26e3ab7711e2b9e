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

import java.util.List;
import org.junit.jupiter.api.Test;
import org.physicianscheduler.config.NightFairnessScope;
import org.physicianscheduler.config.RestBoundary;
import org.physicianscheduler.config.RosterConfig;
import org.physicianscheduler.domain.AssignmentGrid;
import org.physicianscheduler.solver.SolveResult;
import org.physicianscheduler.solver.SolveStatus;

/** Tests the policy re-check of decoded schedules. */
public final class ScheduleValidatorTest {
  /** P3 is senior; the night equality only binds P1 and P2. */
  private static RosterConfig.Builder seniorConfig() {
    return RosterConfig.newBuilder()
        .setNumPhysicians(3)
        .setNumDays(2)
        .setSeniorPhysicians(2)
        .clearPeakShifts()
        .setNightFairnessScope(NightFairnessScope.NIGHT_ELIGIBLE);
  }

  /** Day 1: P2 morning, P3 day, P1 night. Day 2: P3 morning, P1 day, P2 night. */
  private static final int[][][] VALID_SCHEDULE = {
    {{1}, {2}, {0}},
    {{2}, {0}, {1}},
  };

  private static List<String> validate(RosterConfig config, int[][][] schedule) {
    final AssignmentGrid grid = ReportFixtures.grid(config);
    final ScheduleReport report =
        ScheduleDecoder.decode(ReportFixtures.result(grid, schedule), grid);
    return ScheduleValidator.validate(report, config);
  }

  @Test
  public void testScheduleValidator_validSchedule() {
    assertThat(validate(seniorConfig().build(), VALID_SCHEDULE)).isEmpty();
  }

  @Test
  public void testScheduleValidator_coverageAndNights() {
    final List<String> violations =
        validate(ReportFixtures.config(), ReportFixtures.sampleSchedule());
    assertThat(violations)
        .containsExactly(
            "day 1 shift 1: 0 on duty, 1 required", "physician 1 works 2 nights, expected 0");
  }

  @Test
  public void testScheduleValidator_oneShiftPerDay() {
    final int[][][] doubleShift = {
      {{1}, {2}, {0}},
      {{2}, {0, 2}, {1}},
    };
    assertThat(validate(seniorConfig().build(), doubleShift))
        .containsExactly("physician 2 works 2 shifts on day 1");
  }

  @Test
  public void testScheduleValidator_restBoundary() {
    assertThat(
            validate(
                seniorConfig().setRestBoundary(RestBoundary.WRAP_AROUND).build(), VALID_SCHEDULE))
        .containsExactly("physician 1 works the night of day 1 and the morning of day 0");

    final int[][][] noRest = {
      {{1}, {2}, {0}},
      {{0, 2}, {}, {1}},
    };
    assertThat(validate(seniorConfig().build(), noRest))
        .contains("physician 0 works the night of day 0 and the morning of day 1");
  }

  @Test
  public void testScheduleValidator_seniorityAndWeekend() {
    final List<String> seniority =
        validate(
            seniorConfig().setSeniorPhysicians(1).build(), ReportFixtures.sampleSchedule());
    assertThat(seniority).contains("senior physician 1 works the night of day 0");
    assertThat(seniority).contains("senior physician 1 works the night of day 1");

    final List<String> weekend =
        validate(seniorConfig().setWeekendDays(0, 1).build(), VALID_SCHEDULE);
    assertThat(weekend).hasSize(6);
    for (String violation : weekend) {
      assertThat(violation).contains("differs between weekend days");
    }
  }

  @Test
  public void testScheduleValidator_nightIsShiftTwoWithFourShifts() {
    final RosterConfig config =
        RosterConfig.newBuilder()
            .setNumPhysicians(4)
            .setNumDays(2)
            .setNumShifts(4)
            .setSeniorPhysicians(2, 3)
            .clearPeakShifts()
            .setNightFairnessScope(NightFairnessScope.NIGHT_ELIGIBLE)
            .build();
    // Senior physician 3 always takes the late day shift 3.
    final int[][][] lateShiftSenior = {
      {{1}, {2}, {0}, {3}},
      {{2}, {0}, {1}, {3}},
    };
    assertThat(validate(config, lateShiftSenior)).isEmpty();

    final int[][][] seniorOnNight = {
      {{1}, {2}, {0}, {3}},
      {{2}, {0}, {3}, {1}},
    };
    assertThat(validate(config, seniorOnNight))
        .containsExactly(
            "physician 1 works 0 nights, expected 1",
            "senior physician 3 works the night of day 1");
  }

  @Test
  public void testScheduleValidator_requiresSchedule() {
    final AssignmentGrid grid = ReportFixtures.grid();
    final ScheduleReport report =
        ScheduleDecoder.decode(
            new SolveResult(SolveStatus.UNKNOWN, null, ReportFixtures.STATISTICS), grid);
    assertThrows(
        IllegalStateException.class,
        () -> ScheduleValidator.validate(report, ReportFixtures.config()));
  }
}
