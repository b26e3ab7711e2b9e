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

import org.physicianscheduler.domain.Physician;

/** Night and total shift counts of one physician in a solved schedule. */
public final class PhysicianWorkload {
  public PhysicianWorkload(Physician physician, int nightShifts, int totalShifts) {
    this.physician = physician;
    this.nightShifts = nightShifts;
    this.totalShifts = totalShifts;
  }

  public Physician getPhysician() {
    return physician;
  }

  public int getNightShifts() {
    return nightShifts;
  }

  public int getTotalShifts() {
    return totalShifts;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PhysicianWorkload)) {
      return false;
    }
    PhysicianWorkload other = (PhysicianWorkload) o;
    return physician.equals(other.physician)
        && nightShifts == other.nightShifts
        && totalShifts == other.totalShifts;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * physician.hashCode() + nightShifts) + totalShifts;
  }

  @Override
  public String toString() {
    return physician.getLabel() + "{nights=" + nightShifts + ", total=" + totalShifts + "}";
  }

  private final Physician physician;
  private final int nightShifts;
  private final int totalShifts;
}
