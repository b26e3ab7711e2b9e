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

import java.util.Locale;
import java.util.Objects;

/** Search statistics reported by the engine. */
public final class SolverStatistics {
  public SolverStatistics(
      long numConflicts,
      long numBranches,
      double wallTime,
      double objectiveValue,
      double bestObjectiveBound) {
    this.numConflicts = numConflicts;
    this.numBranches = numBranches;
    this.wallTime = wallTime;
    this.objectiveValue = objectiveValue;
    this.bestObjectiveBound = bestObjectiveBound;
  }

  /** Statistics of a solve that never reached the engine. */
  public static SolverStatistics empty() {
    return new SolverStatistics(0, 0, 0.0, Double.NaN, Double.NaN);
  }

  /** Returns the number of conflicts created during search. */
  public long getNumConflicts() {
    return numConflicts;
  }

  /** Returns the number of branches explored during search. */
  public long getNumBranches() {
    return numBranches;
  }

  /** Returns the wall time of the search, in seconds. */
  public double getWallTime() {
    return wallTime;
  }

  /** Returns the objective value of the best solution found, NaN if none. */
  public double getObjectiveValue() {
    return objectiveValue;
  }

  /** Returns the best lower bound of the objective proven by the engine, NaN if unknown. */
  public double getBestObjectiveBound() {
    return bestObjectiveBound;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SolverStatistics)) {
      return false;
    }
    SolverStatistics other = (SolverStatistics) o;
    return numConflicts == other.numConflicts
        && numBranches == other.numBranches
        && Double.compare(wallTime, other.wallTime) == 0
        && Double.compare(objectiveValue, other.objectiveValue) == 0
        && Double.compare(bestObjectiveBound, other.bestObjectiveBound) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(numConflicts, numBranches, wallTime, objectiveValue, bestObjectiveBound);
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "conflicts: %d, branches: %d, wall time: %f s, objective: %f, bound: %f",
        numConflicts, numBranches, wallTime, objectiveValue, bestObjectiveBound);
  }

  private final long numConflicts;
  private final long numBranches;
  private final double wallTime;
  private final double objectiveValue;
  private final double bestObjectiveBound;
}
