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
import org.physicianscheduler.domain.Physician;
import org.physicianscheduler.domain.Shift;

/** The physicians working one shift of one day, in ascending id order. */
public final class ShiftRoster {
  public ShiftRoster(Shift shift, List<Physician> physicians) {
    this.shift = shift;
    this.physicians = Collections.unmodifiableList(new ArrayList<>(physicians));
  }

  public Shift getShift() {
    return shift;
  }

  public List<Physician> getPhysicians() {
    return physicians;
  }

  /** Returns the ids of the assigned physicians. */
  public List<Integer> getPhysicianIds() {
    List<Integer> ids = new ArrayList<>();
    for (Physician physician : physicians) {
      ids.add(physician.getId());
    }
    return ids;
  }

  public int size() {
    return physicians.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ShiftRoster)) {
      return false;
    }
    ShiftRoster other = (ShiftRoster) o;
    return shift.equals(other.shift) && physicians.equals(other.physicians);
  }

  @Override
  public int hashCode() {
    return 31 * shift.hashCode() + physicians.hashCode();
  }

  @Override
  public String toString() {
    return shift.getLabel() + ": " + physicians;
  }

  private final Shift shift;
  private final List<Physician> physicians;
}
