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

package org.physicianscheduler.model;

/** An integer variable of a {@link ScheduleModel}. Boolean variables have the domain [0, 1]. */
public final class Variable {
  Variable(
      ScheduleModel model,
      int index,
      long lowerBound,
      long upperBound,
      boolean isBoolean,
      String name) {
    this.model = model;
    this.index = index;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.isBoolean = isBoolean;
    this.name = name;
  }

  /** Returns the index of the variable in its model. */
  public int getIndex() {
    return index;
  }

  public long getLowerBound() {
    return lowerBound;
  }

  public long getUpperBound() {
    return upperBound;
  }

  /** Returns true if the variable was created by {@link ScheduleModel#newBoolVar}. */
  public boolean isBoolean() {
    return isBoolean;
  }

  public String getName() {
    return name;
  }

  ScheduleModel getModel() {
    return model;
  }

  /** Returns a short string describing the variable, e.g. {@code x(0..10)}. */
  public String getShortString() {
    final String displayName = name.isEmpty() ? "var_" + index : name;
    return displayName + "(" + lowerBound + ".." + upperBound + ")";
  }

  @Override
  public String toString() {
    return getShortString();
  }

  private final ScheduleModel model;
  private final int index;
  private final long lowerBound;
  private final long upperBound;
  private final boolean isBoolean;
  private final String name;
}
