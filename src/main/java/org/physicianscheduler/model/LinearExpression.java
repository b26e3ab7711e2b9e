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

import java.util.Arrays;
import java.util.function.IntToLongFunction;

/**
 * A weighted count of variables of one {@link ScheduleModel}, such as the physicians on duty in a
 * shift or the night shifts of one physician. Terms are sorted by variable index and never carry a
 * zero weight, so two expressions over the same terms are equal.
 */
public final class LinearExpression {
  private static final LinearExpression EMPTY = new LinearExpression(null, new int[0], new long[0]);

  LinearExpression(ScheduleModel model, int[] indices, long[] weights) {
    this.model = model;
    this.indices = indices;
    this.weights = weights;
  }

  /** Returns a builder with no term. */
  public static LinearExpressionBuilder newBuilder() {
    return new LinearExpressionBuilder();
  }

  /** Returns the expression 0. */
  public static LinearExpression empty() {
    return EMPTY;
  }

  /** Returns {@code var} with weight one. */
  public static LinearExpression of(Variable var) {
    return new LinearExpression(var.getModel(), new int[] {var.getIndex()}, new long[] {1});
  }

  /** Returns the number of variables in {@code vars} that take the value one. */
  public static LinearExpression sumOf(Iterable<Variable> vars) {
    LinearExpressionBuilder count = newBuilder();
    for (Variable var : vars) {
      count.add(var);
    }
    return count.build();
  }

  /** Returns {@code this - other}. */
  public LinearExpression minus(LinearExpression other) {
    return newBuilder().add(this).subtract(other).build();
  }

  public int numTerms() {
    return indices.length;
  }

  /** Returns the model index of the variable of the given term. */
  public int getVariableIndex(int term) {
    return indices[term];
  }

  public long getWeight(int term) {
    return weights[term];
  }

  /** Returns the model the variables belong to, null for the expression 0. */
  ScheduleModel getModel() {
    return model;
  }

  /** Evaluates the expression given the value of each variable index. */
  public long evaluate(IntToLongFunction valueOfIndex) {
    long total = 0;
    for (int term = 0; term < indices.length; ++term) {
      total += weights[term] * valueOfIndex.applyAsLong(indices[term]);
    }
    return total;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LinearExpression)) {
      return false;
    }
    LinearExpression other = (LinearExpression) o;
    return Arrays.equals(indices, other.indices) && Arrays.equals(weights, other.weights);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(indices) + Arrays.hashCode(weights);
  }

  /** Returns e.g. {@code 2 * var_0 - var_3}, or {@code 0} without terms. */
  @Override
  public String toString() {
    if (indices.length == 0) {
      return "0";
    }
    StringBuilder text = new StringBuilder();
    for (int term = 0; term < indices.length; ++term) {
      final long weight = weights[term];
      if (term > 0) {
        text.append(weight < 0 ? " - " : " + ");
      } else if (weight < 0) {
        text.append('-');
      }
      if (Math.abs(weight) != 1) {
        text.append(Math.abs(weight)).append(" * ");
      }
      text.append("var_").append(indices[term]);
    }
    return text.toString();
  }

  private final ScheduleModel model;
  private final int[] indices;
  private final long[] weights;
}
