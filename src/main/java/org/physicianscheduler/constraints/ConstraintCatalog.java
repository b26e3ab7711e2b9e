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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import org.physicianscheduler.config.NightFairnessEncoding;
import org.physicianscheduler.config.NightFairnessScope;
import org.physicianscheduler.config.RestBoundary;
import org.physicianscheduler.config.RosterConfig;
import org.physicianscheduler.config.RosterConfigurationException;
import org.physicianscheduler.domain.AssignmentGrid;
import org.physicianscheduler.domain.Day;
import org.physicianscheduler.domain.Physician;
import org.physicianscheduler.model.LinearConstraint;
import org.physicianscheduler.model.LinearExpression;
import org.physicianscheduler.model.LinearExpressionBuilder;
import org.physicianscheduler.model.ScheduleModel;

/**
 * The scheduling policies, one static method per policy family.
 *
 * <p>Each method posts its constraints to the model owning the grid and returns them. Parameters
 * are checked against the grid bounds before anything is posted, so a rejected call leaves the
 * model untouched. Constraint names start with the family prefix ({@link #COVERAGE}, ...).
 */
public final class ConstraintCatalog {
  private static final Logger logger = Logger.getLogger(ConstraintCatalog.class.getName());

  public static final String COVERAGE = "coverage";
  public static final String PEAK_COVERAGE = "peak_coverage";
  public static final String ONE_SHIFT_PER_DAY = "one_shift";
  public static final String REST = "rest";
  public static final String EQUAL_NIGHTS = "equal_nights";
  public static final String SENIORITY = "no_night";
  public static final String WEEKEND = "weekend";

  /**
   * Every shift of every day has at least {@code minBaseline} physicians, and every peak shift at
   * least {@code minPeak} physicians.
   */
  public static List<LinearConstraint> addShiftCoverage(
      AssignmentGrid grid, Collection<Integer> peakShifts, int minPeak, int minBaseline) {
    for (int s : peakShifts) {
      grid.checkShift(s);
    }
    checkNonNegative("minimum peak coverage", minPeak);
    checkNonNegative("minimum baseline coverage", minBaseline);

    final ScheduleModel model = grid.getModel();
    List<LinearConstraint> posted = new ArrayList<>();
    for (int d = 0; d < grid.numDays(); ++d) {
      for (int s = 0; s < grid.numShifts(); ++s) {
        posted.add(
            model
                .addGreaterOrEqual(onDuty(grid, d, s), minBaseline)
                .withName(COVERAGE + "_d" + d + "_s" + s));
      }
      for (int s : peakShifts) {
        posted.add(
            model
                .addGreaterOrEqual(onDuty(grid, d, s), minPeak)
                .withName(PEAK_COVERAGE + "_d" + d + "_s" + s));
      }
    }
    logger.fine("Posted " + posted.size() + " coverage constraints");
    return posted;
  }

  /** A physician works at most one shift per day, possibly none. */
  public static List<LinearConstraint> addOneShiftPerDay(AssignmentGrid grid) {
    final ScheduleModel model = grid.getModel();
    List<LinearConstraint> posted = new ArrayList<>();
    for (int p = 0; p < grid.numPhysicians(); ++p) {
      for (int d = 0; d < grid.numDays(); ++d) {
        LinearExpressionBuilder work = LinearExpression.newBuilder();
        for (int s = 0; s < grid.numShifts(); ++s) {
          work.add(grid.get(p, d, s));
        }
        posted.add(
            model
                .addLessOrEqual(work.build(), 1)
                .withName(ONE_SHIFT_PER_DAY + "_p" + p + "_d" + d));
      }
    }
    logger.fine("Posted " + posted.size() + " one-shift-per-day constraints");
    return posted;
  }

  /**
   * A physician working the night shift of day d does not work the morning shift of the next day.
   *
   * <p>The successor of d is {@code (d + 1) % numDays}, but with {@link RestBoundary#REFERENCE}
   * only days before the last one are checked, so the pair (last day, day 0) is left free. {@link
   * RestBoundary#WRAP_AROUND} checks that pair too. Nothing is posted for a one day horizon or a
   * day without night shift.
   */
  public static List<LinearConstraint> addInterDayRest(
      AssignmentGrid grid, RestBoundary boundary) {
    final ScheduleModel model = grid.getModel();
    final int numDays = grid.numDays();
    List<LinearConstraint> posted = new ArrayList<>();
    if (numDays < 2 || !grid.hasNightShift()) {
      return posted;
    }
    final int night = grid.nightShift();
    final int morning = grid.morningShift();
    for (int p = 0; p < grid.numPhysicians(); ++p) {
      for (int d = 0; d < numDays; ++d) {
        if (d < grid.lastDay() || boundary == RestBoundary.WRAP_AROUND) {
          final int next = (d + 1) % numDays;
          LinearExpression nightThenMorning =
              LinearExpression.newBuilder()
                  .add(grid.get(p, d, night))
                  .add(grid.get(p, next, morning))
                  .build();
          posted.add(
              model.addLessOrEqual(nightThenMorning, 1).withName(REST + "_p" + p + "_d" + d));
        }
      }
    }
    logger.fine("Posted " + posted.size() + " rest constraints (" + boundary + ")");
    return posted;
  }

  /** Every physician works the same number of night shifts. */
  public static List<LinearConstraint> addEqualNightShifts(AssignmentGrid grid) {
    return addEqualNightShifts(grid, grid.getPhysicians());
  }

  /**
   * For every pair p1 < p2 of the given physicians, {@code nights(p1) == nights(p2)}. This posts
   * n * (n - 1) / 2 equalities.
   */
  public static List<LinearConstraint> addEqualNightShifts(
      AssignmentGrid grid, List<Physician> physicians) {
    final LinearExpression[] nights = nightCounts(grid, physicians);
    final ScheduleModel model = grid.getModel();
    List<LinearConstraint> posted = new ArrayList<>();
    if (!grid.hasNightShift()) {
      return posted;
    }
    for (int i = 0; i < nights.length; ++i) {
      for (int j = i + 1; j < nights.length; ++j) {
        posted.add(
            model
                .addEquality(nights[i], nights[j])
                .withName(EQUAL_NIGHTS + "_p" + physicians.get(i).getId() + "_p"
                    + physicians.get(j).getId()));
      }
    }
    logger.fine("Posted " + posted.size() + " pairwise night fairness constraints");
    return posted;
  }

  /**
   * Same schedules as {@link #addEqualNightShifts(AssignmentGrid, List)}, with n - 1 equalities
   * between consecutive physicians.
   */
  public static List<LinearConstraint> addEqualNightShiftsChained(
      AssignmentGrid grid, List<Physician> physicians) {
    final LinearExpression[] nights = nightCounts(grid, physicians);
    final ScheduleModel model = grid.getModel();
    List<LinearConstraint> posted = new ArrayList<>();
    if (!grid.hasNightShift()) {
      return posted;
    }
    for (int i = 0; i + 1 < nights.length; ++i) {
      posted.add(
          model
              .addEquality(nights[i], nights[i + 1])
              .withName(EQUAL_NIGHTS + "_p" + physicians.get(i).getId() + "_p"
                  + physicians.get(i + 1).getId()));
    }
    logger.fine("Posted " + posted.size() + " chained night fairness constraints");
    return posted;
  }

  /** Physicians who are not night shift eligible never work the night shift. */
  public static List<LinearConstraint> addSeniorityExclusion(AssignmentGrid grid) {
    final ScheduleModel model = grid.getModel();
    List<LinearConstraint> posted = new ArrayList<>();
    if (!grid.hasNightShift()) {
      return posted;
    }
    for (int d = 0; d < grid.numDays(); ++d) {
      for (Physician physician : grid.getPhysicians()) {
        if (!physician.isNightShiftEligible()) {
          final int p = physician.getId();
          posted.add(
              model
                  .addEquality(grid.get(p, d, grid.nightShift()), 0)
                  .withName(SENIORITY + "_p" + p + "_d" + d));
        }
      }
    }
    logger.fine("Posted " + posted.size() + " seniority constraints");
    return posted;
  }

  /** Mirrors the assignments of every weekend pair declared by the grid's days. */
  public static List<LinearConstraint> addWeekendMirroring(AssignmentGrid grid) {
    List<LinearConstraint> posted = new ArrayList<>();
    for (Day day : grid.getDays()) {
      if (day.getWeekendPartner().isPresent() && day.getId() < day.getWeekendPartner().getAsInt()) {
        posted.addAll(addWeekendMirroring(grid, day.getId(), day.getWeekendPartner().getAsInt()));
      }
    }
    return posted;
  }

  /** Each physician works the same shifts on {@code saturday} and {@code sunday}. */
  public static List<LinearConstraint> addWeekendMirroring(
      AssignmentGrid grid, int saturday, int sunday) {
    grid.checkDay(saturday);
    grid.checkDay(sunday);
    if (saturday == sunday) {
      throw new RosterConfigurationException(
          "Weekend days must be distinct, got " + saturday + " twice");
    }
    final ScheduleModel model = grid.getModel();
    List<LinearConstraint> posted = new ArrayList<>();
    for (int p = 0; p < grid.numPhysicians(); ++p) {
      for (int s = 0; s < grid.numShifts(); ++s) {
        posted.add(
            model
                .addEquality(
                    LinearExpression.of(grid.get(p, saturday, s)),
                    LinearExpression.of(grid.get(p, sunday, s)))
                .withName(WEEKEND + "_p" + p + "_s" + s));
      }
    }
    logger.fine("Posted " + posted.size() + " weekend constraints");
    return posted;
  }

  /** Posts every policy family as configured. Returns the number of constraints posted. */
  public static int applyAll(AssignmentGrid grid, RosterConfig config) {
    int count = 0;
    count +=
        addShiftCoverage(
                grid,
                config.getPeakShifts(),
                config.getMinPeakCoverage(),
                config.getMinBaselineCoverage())
            .size();
    count += addOneShiftPerDay(grid).size();
    count += addInterDayRest(grid, config.getRestBoundary()).size();

    List<Physician> fairnessGroup = new ArrayList<>();
    for (Physician physician : grid.getPhysicians()) {
      if (config.getNightFairnessScope() == NightFairnessScope.ALL_PHYSICIANS
          || physician.isNightShiftEligible()) {
        fairnessGroup.add(physician);
      }
    }
    if (config.getNightFairnessEncoding() == NightFairnessEncoding.CHAINED) {
      count += addEqualNightShiftsChained(grid, fairnessGroup).size();
    } else {
      count += addEqualNightShifts(grid, fairnessGroup).size();
    }

    count += addSeniorityExclusion(grid).size();
    count += addWeekendMirroring(grid).size();
    logger.fine("Posted " + count + " policy constraints");
    return count;
  }

  private static LinearExpression onDuty(AssignmentGrid grid, int d, int s) {
    LinearExpressionBuilder onDuty = LinearExpression.newBuilder();
    for (int p = 0; p < grid.numPhysicians(); ++p) {
      onDuty.add(grid.get(p, d, s));
    }
    return onDuty.build();
  }

  private static LinearExpression[] nightCounts(AssignmentGrid grid, List<Physician> physicians) {
    for (Physician physician : physicians) {
      grid.checkPhysician(physician.getId());
    }
    LinearExpression[] nights = new LinearExpression[physicians.size()];
    for (int i = 0; i < physicians.size(); ++i) {
      nights[i] = WorkloadExpressions.nightShiftCount(grid, physicians.get(i).getId());
    }
    return nights;
  }

  private static void checkNonNegative(String what, int value) {
    if (value < 0) {
      throw new RosterConfigurationException(what + " must not be negative, got " + value);
    }
  }

  private ConstraintCatalog() {}
}
