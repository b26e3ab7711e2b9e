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

import java.util.OptionalInt;

/** A day of the scheduling horizon. */
public final class Day {
  /** Creates a day without weekend partner. */
  public Day(int id) {
    this(id, -1);
  }

  /** Creates a day whose assignments mirror those of {@code weekendPartner}. */
  public Day(int id, int weekendPartner) {
    this.id = id;
    this.weekendPartner = weekendPartner;
  }

  public int getId() {
    return id;
  }

  /** Returns the day this one forms a weekend pair with, if any. */
  public OptionalInt getWeekendPartner() {
    return weekendPartner < 0 ? OptionalInt.empty() : OptionalInt.of(weekendPartner);
  }

  public String getLabel() {
    return "Day " + (id + 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Day)) {
      return false;
    }
    Day other = (Day) o;
    return id == other.id && weekendPartner == other.weekendPartner;
  }

  @Override
  public int hashCode() {
    return 31 * id + weekendPartner;
  }

  @Override
  public String toString() {
    return getLabel();
  }

  private final int id;
  private final int weekendPartner;
}
