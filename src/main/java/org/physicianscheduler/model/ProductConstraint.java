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

/** The non linear constraint {@code target == left * right}. */
public final class ProductConstraint {
  ProductConstraint(int index, Variable target, Variable left, Variable right) {
    this.index = index;
    this.target = target;
    this.left = left;
    this.right = right;
  }

  public int getIndex() {
    return index;
  }

  public Variable getTarget() {
    return target;
  }

  public Variable getLeft() {
    return left;
  }

  public Variable getRight() {
    return right;
  }

  /** Returns true if the constraint holds for the given variable values. */
  public boolean isSatisfiedBy(IntToLongFunction valueOfIndex) {
    return valueOfIndex.applyAsLong(target.getIndex())
        == valueOfIndex.applyAsLong(left.getIndex()) * valueOfIndex.applyAsLong(right.getIndex());
  }

  @Override
  public String toString() {
    return "var_" + target.getIndex() + " == var_" + left.getIndex() + " * var_"
        + right.getIndex();
  }

  private final int index;
  private final Variable target;
  private final Variable left;
  private final Variable right;
}
