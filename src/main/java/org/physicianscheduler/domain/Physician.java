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

/** A physician of the roster. Immutable. */
public final class Physician {
  public Physician(int id, boolean nightShiftEligible) {
    this.id = id;
    this.nightShiftEligible = nightShiftEligible;
  }

  public int getId() {
    return id;
  }

  /** Returns false for senior physicians, who never work nights. */
  public boolean isNightShiftEligible() {
    return nightShiftEligible;
  }

  /** Returns the 1-indexed display label, e.g. {@code P3} for id 2. */
  public String getLabel() {
    return "P" + (id + 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Physician)) {
      return false;
    }
    Physician other = (Physician) o;
    return id == other.id && nightShiftEligible == other.nightShiftEligible;
  }

  @Override
  public int hashCode() {
    return 31 * id + (nightShiftEligible ? 1 : 0);
  }

  @Override
  public String toString() {
    return nightShiftEligible ? getLabel() : getLabel() + "(senior)";
  }

  private final int id;
  private final boolean nightShiftEligible;
}
