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

/** Semantic role of a shift within a day. */
public enum ShiftRole {
  MORNING,
  DAY,
  NIGHT;

  /** Index of the night shift in a day that has one. */
  public static final int NIGHT_SHIFT_INDEX = 2;

  /** Days with fewer shifts have no night shift. */
  public static final int MIN_SHIFTS_WITH_NIGHT = NIGHT_SHIFT_INDEX + 1;

  /**
   * Returns the role of shift {@code index} in a day of {@code numShifts} shifts. Shift 0 is the
   * morning and shift 2 the night; any further shift is a day shift.
   */
  public static ShiftRole forIndex(int index, int numShifts) {
    if (index == 0) {
      return MORNING;
    }
    if (index == NIGHT_SHIFT_INDEX && numShifts >= MIN_SHIFTS_WITH_NIGHT) {
      return NIGHT;
    }
    return DAY;
  }
}
