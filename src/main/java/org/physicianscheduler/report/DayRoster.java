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
import org.physicianscheduler.domain.Day;

/** The rosters of every shift of one day, in ascending shift order. */
public final class DayRoster {
  public DayRoster(Day day, List<ShiftRoster> shifts) {
    this.day = day;
    this.shifts = Collections.unmodifiableList(new ArrayList<>(shifts));
  }

  public Day getDay() {
    return day;
  }

  public List<ShiftRoster> getShifts() {
    return shifts;
  }

  public ShiftRoster getShift(int s) {
    return shifts.get(s);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DayRoster)) {
      return false;
    }
    DayRoster other = (DayRoster) o;
    return day.equals(other.day) && shifts.equals(other.shifts);
  }

  @Override
  public int hashCode() {
    return 31 * day.hashCode() + shifts.hashCode();
  }

  @Override
  public String toString() {
    return day.getLabel() + " " + shifts;
  }

  private final Day day;
  private final List<ShiftRoster> shifts;
}
