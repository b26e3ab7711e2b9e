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

import org.physicianscheduler.model.Variable;

/** Value of each model variable in a solution. */
public interface ValueLookup {
  long valueOf(Variable var);

  /** Returns true if the variable is 1 in the solution. */
  default boolean isTrue(Variable var) {
    return valueOf(var) == 1;
  }
}
