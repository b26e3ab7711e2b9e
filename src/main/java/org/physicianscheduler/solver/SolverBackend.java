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

import org.physicianscheduler.model.ScheduleModel;

/**
 * Boundary to a constraint solving engine.
 *
 * <p>Implementations translate a {@link ScheduleModel} into their engine, run it, and translate the
 * outcome back. They hold no scheduling logic, so any engine accepting linear and product
 * constraints can be plugged in.
 */
public interface SolverBackend {
  /**
   * Solves the model. Blocks until the engine returns, the time limit is reached or the solve is
   * cancelled.
   *
   * @throws SolverFaultException if the engine fails
   */
  SolveResult solve(ScheduleModel model, SolveOptions options);

  /** Solves the model with default options. */
  default SolveResult solve(ScheduleModel model) {
    return solve(model, SolveOptions.getDefaultInstance());
  }

  /** Returns a short name of the engine, for logs. */
  String getName();
}
