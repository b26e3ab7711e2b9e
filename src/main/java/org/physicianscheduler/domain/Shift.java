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

/** A shift slot within a day. */
public final class Shift {
  public Shift(int id, ShiftRole role, boolean peak) {
    this.id = id;
    this.role = role;
    this.peak = peak;
  }

  public int getId() {
    return id;
  }

  public ShiftRole getRole() {
    return role;
  }

  /** Returns true if the shift requires the elevated peak coverage. */
  public boolean isPeak() {
    return peak;
  }

  public String getLabel() {
    return "Shift " + (id + 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Shift)) {
      return false;
    }
    Shift other = (Shift) o;
    return id == other.id && role == other.role && peak == other.peak;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * id + role.hashCode()) + (peak ? 1 : 0);
  }

  @Override
  public String toString() {
    return getLabel() + "(" + role + (peak ? ", peak)" : ")");
  }

  private final int id;
  private final ShiftRole role;
  private final boolean peak;
}
