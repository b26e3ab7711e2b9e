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

/**
 * Thrown when the solving engine itself fails, e.g. on an invalid model or an internal error. A
 * fault is never reported as an infeasible model.
 */
public class SolverFaultException extends RuntimeException {
  public SolverFaultException(String msg) {
    super(msg);
  }

  public SolverFaultException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
