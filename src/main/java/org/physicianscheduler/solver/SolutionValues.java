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

package org.physicianscheduler.solver;

import java.util.Arrays;
import org.physicianscheduler.model.Variable;

/** A solution stored as one value per variable index. */
public final class SolutionValues implements ValueLookup {
  public SolutionValues(long[] values) {
    this.values = values.clone();
  }

  @Override
  public long valueOf(Variable var) {
    final int index = var.getIndex();
    if (index < 0 || index >= values.length) {
      throw new IllegalArgumentException(
          "No value for " + var + ", the solution has " + values.length + " variables");
    }
    return values[index];
  }

  /** Returns the value of the variable with the given index. */
  public long valueOfIndex(int index) {
    return values[index];
  }

  public int size() {
    return values.length;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SolutionValues && Arrays.equals(values, ((SolutionValues) o).values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  private final long[] values;
}
