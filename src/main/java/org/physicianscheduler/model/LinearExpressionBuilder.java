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

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Accumulates variables into a {@link LinearExpression}. A variable added twice gets weight two;
 * terms that cancel out are dropped. All variables must come from the same model.
 */
public final class LinearExpressionBuilder {
  LinearExpressionBuilder() {
    this.weights = new TreeMap<>();
    this.model = null;
  }

  /** Adds {@code var} with weight one. */
  public LinearExpressionBuilder add(Variable var) {
    accumulate(var.getModel(), var.getIndex(), 1);
    return this;
  }

  /** Adds every term of {@code expr}. */
  public LinearExpressionBuilder add(LinearExpression expr) {
    return combine(expr, 1);
  }

  /** Subtracts every term of {@code expr}. */
  public LinearExpressionBuilder subtract(LinearExpression expr) {
    return combine(expr, -1);
  }

  public LinearExpression build() {
    if (weights.isEmpty()) {
      return LinearExpression.empty();
    }
    final int[] indices = new int[weights.size()];
    final long[] terms = new long[weights.size()];
    int term = 0;
    for (Map.Entry<Integer, Long> entry : weights.entrySet()) {
      indices[term] = entry.getKey();
      terms[term] = entry.getValue();
      term++;
    }
    return new LinearExpression(model, indices, terms);
  }

  private LinearExpressionBuilder combine(LinearExpression expr, long sign) {
    for (int term = 0; term < expr.numTerms(); ++term) {
      accumulate(expr.getModel(), expr.getVariableIndex(term), sign * expr.getWeight(term));
    }
    return this;
  }

  private void accumulate(ScheduleModel owner, int index, long weight) {
    if (model == null) {
      model = owner;
    } else if (model != owner) {
      throw new ScheduleModel.ForeignVariable(
          "LinearExpressionBuilder", "variable index " + index + " belongs to another model");
    }
    final long merged = weights.getOrDefault(index, 0L) + weight;
    if (merged == 0) {
      weights.remove(index);
    } else {
      weights.put(index, merged);
    }
  }

  private final SortedMap<Integer, Long> weights;
  private ScheduleModel model;
}
