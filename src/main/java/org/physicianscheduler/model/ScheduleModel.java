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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The constraint model of one scheduling run: the assignment and auxiliary variables, the policy
 * rows {@code lb <= expr <= ub}, the squaring products of the fairness objective, and the
 * expression to minimize.
 *
 * <p>Nothing here depends on a solving engine; a {@code SolverBackend} translates the model. Every
 * variable remembers the model that created it, and using it with another model throws {@link
 * ForeignVariable}. Not thread-safe: each run builds its own model.
 */
public final class ScheduleModel {
  static class ScheduleModelException extends RuntimeException {
    public ScheduleModelException(String methodName, String msg) {
      super(methodName + ": " + msg);
    }
  }

  /** Exception thrown when an index does not name a variable of this model. */
  public static class UnknownVariable extends ScheduleModelException {
    public UnknownVariable(String methodName, int index, int numVariables) {
      super(methodName, "variable index " + index + " is outside [0, " + numVariables + ")");
    }
  }

  /** Exception thrown when a variable created by another model is used. */
  public static class ForeignVariable extends ScheduleModelException {
    public ForeignVariable(String methodName, String msg) {
      super(methodName, msg);
    }
  }

  public ScheduleModel() {
    variables = new ArrayList<>();
    linearConstraints = new ArrayList<>();
    productConstraints = new ArrayList<>();
    objective = null;
  }

  /** Creates an integer variable with domain [lb, ub]. */
  public Variable newIntVar(long lb, long ub, String name) {
    Variable var = new Variable(this, variables.size(), lb, ub, false, name);
    variables.add(var);
    return var;
  }

  /** Creates a 0-1 variable, such as one assignment of the roster grid. */
  public Variable newBoolVar(String name) {
    Variable var = new Variable(this, variables.size(), 0, 1, true, name);
    variables.add(var);
    return var;
  }

  /**
   * Adds {@code lb <= expr <= ub}. {@code Long.MIN_VALUE} and {@code Long.MAX_VALUE} leave a side
   * open.
   */
  public LinearConstraint addLinearConstraint(LinearExpression expr, long lb, long ub) {
    checkOwned("addLinearConstraint", expr);
    LinearConstraint ct = new LinearConstraint(linearConstraints.size(), expr, lb, ub);
    linearConstraints.add(ct);
    return ct;
  }

  public LinearConstraint addEquality(LinearExpression expr, long value) {
    return addLinearConstraint(expr, value, value);
  }

  /** Fixes {@code var} to {@code value}. */
  public LinearConstraint addEquality(Variable var, long value) {
    checkOwned("addEquality", var);
    return addLinearConstraint(LinearExpression.of(var), value, value);
  }

  /** Adds {@code left == right} as {@code left - right == 0}. */
  public LinearConstraint addEquality(LinearExpression left, LinearExpression right) {
    checkOwned("addEquality", left);
    checkOwned("addEquality", right);
    return addLinearConstraint(left.minus(right), 0, 0);
  }

  public LinearConstraint addLessOrEqual(LinearExpression expr, long value) {
    return addLinearConstraint(expr, Long.MIN_VALUE, value);
  }

  public LinearConstraint addGreaterOrEqual(LinearExpression expr, long value) {
    return addLinearConstraint(expr, value, Long.MAX_VALUE);
  }

  /** Adds {@code target == left * right}. */
  public ProductConstraint addMultiplicationEquality(
      Variable target, Variable left, Variable right) {
    checkOwned("addMultiplicationEquality", target);
    checkOwned("addMultiplicationEquality", left);
    checkOwned("addMultiplicationEquality", right);
    ProductConstraint ct = new ProductConstraint(productConstraints.size(), target, left, right);
    productConstraints.add(ct);
    return ct;
  }

  /** Replaces the objective by the minimization of {@code expr}. */
  public void minimize(LinearExpression expr) {
    checkOwned("minimize", expr);
    objective = expr;
  }

  public void clearObjective() {
    objective = null;
  }

  public boolean hasObjective() {
    return objective != null;
  }

  public Optional<LinearExpression> getObjective() {
    return Optional.ofNullable(objective);
  }

  public int numVariables() {
    return variables.size();
  }

  public Variable getVariable(int index) {
    if (index < 0 || index >= variables.size()) {
      throw new UnknownVariable("getVariable", index, variables.size());
    }
    return variables.get(index);
  }

  public List<Variable> getVariables() {
    return Collections.unmodifiableList(variables);
  }

  public List<LinearConstraint> getLinearConstraints() {
    return Collections.unmodifiableList(linearConstraints);
  }

  public List<ProductConstraint> getProductConstraints() {
    return Collections.unmodifiableList(productConstraints);
  }

  /** Returns how many linear constraints carry a name starting with {@code namePrefix}. */
  public int countLinearConstraints(String namePrefix) {
    int count = 0;
    for (LinearConstraint ct : linearConstraints) {
      if (ct.getName().startsWith(namePrefix)) {
        count++;
      }
    }
    return count;
  }

  /** Returns a one line summary of the model size. */
  public String modelStats() {
    int numBooleans = 0;
    for (Variable var : variables) {
      if (var.isBoolean()) {
        numBooleans++;
      }
    }
    return String.format(
        Locale.ROOT,
        "#variables: %d (%d booleans), #linear: %d, #product: %d, objective: %s",
        variables.size(),
        numBooleans,
        linearConstraints.size(),
        productConstraints.size(),
        objective == null ? "none" : "minimize");
  }

  private void checkOwned(String methodName, Variable var) {
    if (var.getModel() != this) {
      throw new ForeignVariable(
          methodName, "variable " + var.getShortString() + " belongs to another model");
    }
  }

  private void checkOwned(String methodName, LinearExpression expr) {
    if (expr.numTerms() > 0 && expr.getModel() != this) {
      throw new ForeignVariable(methodName, "expression " + expr + " belongs to another model");
    }
  }

  private final List<Variable> variables;
  private final List<LinearConstraint> linearConstraints;
  private final List<ProductConstraint> productConstraints;
  private LinearExpression objective;
}
