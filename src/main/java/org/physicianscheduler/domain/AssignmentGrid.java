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

package org.physicianscheduler.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.ToIntFunction;
import java.util.logging.Logger;
import org.physicianscheduler.config.RosterConfig;
import org.physicianscheduler.config.RosterConfigurationException;
import org.physicianscheduler.model.ScheduleModel;
import org.physicianscheduler.model.Variable;

/**
 * The assignment variables of one scheduling run.
 *
 * <p>{@code get(p, d, s)} is the Boolean variable telling whether physician {@code p} works shift
 * {@code s} on day {@code d}. There is exactly one variable per (physician, day, shift) triple,
 * named {@code shift_p<p>_d<d>_s<s>}, stored in a dense array indexed by the three ids.
 */
public final class AssignmentGrid {
  private static final Logger logger = Logger.getLogger(AssignmentGrid.class.getName());

  private AssignmentGrid(
      ScheduleModel model,
      List<Physician> physicians,
      List<Day> days,
      List<Shift> shifts,
      Variable[][][] assignments) {
    this.model = model;
    this.physicians = physicians;
    this.days = days;
    this.shifts = shifts;
    this.assignments = assignments;
  }

  /**
   * Creates one Boolean variable per (physician, day, shift) in {@code model}.
   *
   * @throws RosterConfigurationException if a list is empty or its ids are not 0..n-1 in order
   */
  public static AssignmentGrid build(
      List<Physician> physicians, List<Day> days, List<Shift> shifts, ScheduleModel model) {
    checkIds("physicians", physicians.size(), physicians, Physician::getId);
    checkIds("days", days.size(), days, Day::getId);
    checkIds("shifts", shifts.size(), shifts, Shift::getId);

    Variable[][][] assignments = new Variable[physicians.size()][days.size()][shifts.size()];
    for (int p = 0; p < physicians.size(); ++p) {
      for (int d = 0; d < days.size(); ++d) {
        for (int s = 0; s < shifts.size(); ++s) {
          assignments[p][d][s] = model.newBoolVar("shift_p" + p + "_d" + d + "_s" + s);
        }
      }
    }
    logger.fine(
        "Created " + physicians.size() * days.size() * shifts.size() + " assignment variables");
    return new AssignmentGrid(
        model,
        Collections.unmodifiableList(new ArrayList<>(physicians)),
        Collections.unmodifiableList(new ArrayList<>(days)),
        Collections.unmodifiableList(new ArrayList<>(shifts)),
        assignments);
  }

  /** Derives physicians, days and shifts from {@code config} and builds the grid. */
  public static AssignmentGrid build(RosterConfig config, ScheduleModel model) {
    List<Physician> physicians = new ArrayList<>();
    for (int p = 0; p < config.getNumPhysicians(); ++p) {
      physicians.add(new Physician(p, config.isNightShiftEligible(p)));
    }
    List<Day> days = new ArrayList<>();
    for (int d = 0; d < config.getNumDays(); ++d) {
      int partner = -1;
      if (config.hasWeekend()) {
        if (d == config.getSaturday()) {
          partner = config.getSunday();
        } else if (d == config.getSunday()) {
          partner = config.getSaturday();
        }
      }
      days.add(new Day(d, partner));
    }
    List<Shift> shifts = new ArrayList<>();
    for (int s = 0; s < config.getNumShifts(); ++s) {
      shifts.add(
          new Shift(
              s,
              ShiftRole.forIndex(s, config.getNumShifts()),
              config.getPeakShifts().contains(s)));
    }
    return build(physicians, days, shifts, model);
  }

  /** Returns the assignment variable of physician p, day d, shift s. */
  public Variable get(int p, int d, int s) {
    checkPhysician(p);
    checkDay(d);
    checkShift(s);
    return assignments[p][d][s];
  }

  public Variable get(Physician physician, Day day, Shift shift) {
    return get(physician.getId(), day.getId(), shift.getId());
  }

  public ScheduleModel getModel() {
    return model;
  }

  public List<Physician> getPhysicians() {
    return physicians;
  }

  public List<Day> getDays() {
    return days;
  }

  public List<Shift> getShifts() {
    return shifts;
  }

  public Physician getPhysician(int p) {
    checkPhysician(p);
    return physicians.get(p);
  }

  public Day getDay(int d) {
    checkDay(d);
    return days.get(d);
  }

  public Shift getShift(int s) {
    checkShift(s);
    return shifts.get(s);
  }

  public int numPhysicians() {
    return physicians.size();
  }

  public int numDays() {
    return days.size();
  }

  public int numShifts() {
    return shifts.size();
  }

  /** Returns true if the day has a night shift, i.e. at least three shifts. */
  public boolean hasNightShift() {
    return shifts.size() >= ShiftRole.MIN_SHIFTS_WITH_NIGHT;
  }

  /**
   * The night shift is shift 2, whatever the number of shifts after it.
   *
   * @throws IllegalStateException if the day has no night shift
   */
  public int nightShift() {
    if (!hasNightShift()) {
      throw new IllegalStateException("A day of " + shifts.size() + " shifts has no night shift");
    }
    return ShiftRole.NIGHT_SHIFT_INDEX;
  }

  /** The morning shift is always the first shift of the day. */
  public int morningShift() {
    return 0;
  }

  public int lastDay() {
    return days.size() - 1;
  }

  public void checkPhysician(int p) {
    checkIndex("physician", p, physicians.size());
  }

  public void checkDay(int d) {
    checkIndex("day", d, days.size());
  }

  public void checkShift(int s) {
    checkIndex("shift", s, shifts.size());
  }

  private static void checkIndex(String what, int index, int count) {
    if (index < 0 || index >= count) {
      throw new RosterConfigurationException(
          what + " index " + index + " is outside the grid bounds [0, " + count + ")");
    }
  }

  private static <T> void checkIds(
      String what, int count, List<T> items, ToIntFunction<T> ids) {
    if (count <= 0) {
      throw new RosterConfigurationException("The grid needs at least one entry in " + what);
    }
    for (int i = 0; i < count; ++i) {
      if (ids.applyAsInt(items.get(i)) != i) {
        throw new RosterConfigurationException(
            what + " must have ids 0.." + (count - 1) + " in order, found "
                + ids.applyAsInt(items.get(i)) + " at position " + i);
      }
    }
  }

  private final ScheduleModel model;
  private final List<Physician> physicians;
  private final List<Day> days;
  private final List<Shift> shifts;
  private final Variable[][][] assignments;
}
