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

package org.physicianscheduler.objective;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import org.physicianscheduler.constraints.WorkloadExpressions;
import org.physicianscheduler.domain.AssignmentGrid;
import org.physicianscheduler.model.LinearExpression;
import org.physicianscheduler.model.LinearExpressionBuilder;
import org.physicianscheduler.model.ScheduleModel;
import org.physicianscheduler.model.Variable;

/**
 * Minimizes the sum over all pairs p1 < p2 of {@code (total(p1) - total(p2))^2}, where {@code
 * total(p)} is the number of shifts physician p works.
 *
 * <p>The square is linearized with two auxiliary integer variables per pair: {@code diff ==
 * total(p1) - total(p2)} and {@code square == diff * diff}. The objective is the sum of the
 * squares, so the optimum is the one of the quadratic target, not of a sum of absolute
 * differences.
 */
public final class FairnessObjective {
  private static final Logger logger = Logger.getLogger(FairnessObjective.class.getName());

  /** The auxiliary variables of one physician pair. */
  public static final class PairTerm {
    PairTerm(int first, int second, Variable difference, Variable square) {
      this.first = first;
      this.second = second;
      this.difference = difference;
      this.square = square;
    }

    public int getFirst() {
      return first;
    }

    public int getSecond() {
      return second;
    }

    public Variable getDifference() {
      return difference;
    }

    public Variable getSquare() {
      return square;
    }

    private final int first;
    private final int second;
    private final Variable difference;
    private final Variable square;
  }

  private FairnessObjective(List<PairTerm> terms, LinearExpression objective) {
    this.terms = terms;
    this.objective = objective;
  }

  /** Posts the auxiliary variables and constraints, and sets the model objective. */
  public static FairnessObjective minimizeSquaredWorkloadDifferences(AssignmentGrid grid) {
    final ScheduleModel model = grid.getModel();
    final int numPhysicians = grid.numPhysicians();
    final long maxShifts = (long) grid.numDays() * grid.numShifts();

    LinearExpression[] totals = new LinearExpression[numPhysicians];
    for (int p = 0; p < numPhysicians; ++p) {
      totals[p] = WorkloadExpressions.totalShiftCount(grid, p);
    }

    List<PairTerm> terms = new ArrayList<>();
    LinearExpressionBuilder sumOfSquares = LinearExpression.newBuilder();
    for (int p1 = 0; p1 < numPhysicians; ++p1) {
      for (int p2 = p1 + 1; p2 < numPhysicians; ++p2) {
        Variable diff = model.newIntVar(-maxShifts, maxShifts, "diff_p" + p1 + "_p" + p2);
        model
            .addEquality(LinearExpression.of(diff), totals[p1].minus(totals[p2]))
            .withName("fairness_diff_p" + p1 + "_p" + p2);
        Variable square = model.newIntVar(0, maxShifts * maxShifts, "sq_p" + p1 + "_p" + p2);
        model.addMultiplicationEquality(square, diff, diff);
        sumOfSquares.add(square);
        terms.add(new PairTerm(p1, p2, diff, square));
      }
    }
    final LinearExpression objective = sumOfSquares.build();
    model.minimize(objective);
    logger.fine("Fairness objective over " + terms.size() + " physician pairs");
    return new FairnessObjective(Collections.unmodifiableList(terms), objective);
  }

  /** Returns the value of the objective for the given total shift counts, indexed by physician. */
  public static long sumOfSquaredDifferences(long[] totals) {
    long sum = 0;
    for (int p1 = 0; p1 < totals.length; ++p1) {
      for (int p2 = p1 + 1; p2 < totals.length; ++p2) {
        final long diff = totals[p1] - totals[p2];
        sum += diff * diff;
      }
    }
    return sum;
  }

  public List<PairTerm> getTerms() {
    return terms;
  }

  /** Returns the minimized expression, the sum of the square variables. */
  public LinearExpression getObjective() {
    return objective;
  }

  private final List<PairTerm> terms;
  private final LinearExpression objective;
}
