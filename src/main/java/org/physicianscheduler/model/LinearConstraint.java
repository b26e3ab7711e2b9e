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

import java.util.function.IntToLongFunction;

/**
 * One policy row {@code lb <= expr <= ub}, posted through {@link ScheduleModel}. The name carries
 * the policy family prefix so that rows can be counted per family.
 */
public final class LinearConstraint {
  LinearConstraint(int index, LinearExpression expression, long lowerBound, long upperBound) {
    this.index = index;
    this.expression = expression;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.name = "";
  }

  /** Returns the index of the constraint in the model. */
  public int getIndex() {
    return index;
  }

  public LinearExpression getExpression() {
    return expression;
  }

  public long getLowerBound() {
    return lowerBound;
  }

  public long getUpperBound() {
    return upperBound;
  }

  public String getName() {
    return name;
  }

  /** Names the constraint. Returns this for chaining. */
  public LinearConstraint withName(String name) {
    this.name = name;
    return this;
  }

  /** Returns true if the constraint holds for the given variable values. */
  public boolean isSatisfiedBy(IntToLongFunction valueOfIndex) {
    final long value = expression.evaluate(valueOfIndex);
    return value >= lowerBound && value <= upperBound;
  }

  @Override
  public String toString() {
    final String body = expression.toString();
    if (lowerBound == upperBound) {
      return body + " == " + lowerBound;
    }
    if (lowerBound == Long.MIN_VALUE) {
      return body + " <= " + upperBound;
    }
    if (upperBound == Long.MAX_VALUE) {
      return body + " >= " + lowerBound;
    }
    return lowerBound + " <= " + body + " <= " + upperBound;
  }

  private final int index;
  private final LinearExpression expression;
  private final long lowerBound;
  private final long upperBound;
  private String name;
}
