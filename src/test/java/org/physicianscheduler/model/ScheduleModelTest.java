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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

/** Tests the solver independent schedule model. */
public final class ScheduleModelTest {
  @Test
  public void testScheduleModel_newVariables() {
    final ScheduleModel model = new ScheduleModel();
    final Variable x = model.newBoolVar("x");
    final Variable y = model.newIntVar(-3, 7, "y");

    assertThat(model.numVariables()).isEqualTo(2);
    assertThat(x.getIndex()).isEqualTo(0);
    assertThat(x.isBoolean()).isTrue();
    assertThat(y.getIndex()).isEqualTo(1);
    assertThat(y.isBoolean()).isFalse();
    assertThat(y.getShortString()).isEqualTo("y(-3..7)");
    assertThat(model.getVariable(1)).isSameInstanceAs(y);
    assertThat(model.getVariables()).containsExactly(x, y).inOrder();
  }

  @Test
  public void testScheduleModel_linearConstraints() {
    final ScheduleModel model = new ScheduleModel();
    final Variable x = model.newBoolVar("x");
    final Variable y = model.newBoolVar("y");

    final LinearConstraint eq =
        model.addEquality(LinearExpression.of(x), LinearExpression.of(y)).withName("same");
    assertThat(eq.getName()).isEqualTo("same");
    assertThat(eq.getLowerBound()).isEqualTo(0);
    assertThat(eq.getUpperBound()).isEqualTo(0);
    assertThat(eq.getExpression().toString()).isEqualTo("var_0 - var_1");

    final LinearConstraint le =
        model.addLessOrEqual(LinearExpression.sumOf(Arrays.asList(x, y)), 1);
    assertThat(le.getLowerBound()).isEqualTo(Long.MIN_VALUE);
    assertThat(le.getUpperBound()).isEqualTo(1);
    assertThat(le.toString()).isEqualTo("var_0 + var_1 <= 1");

    final LinearConstraint ge = model.addGreaterOrEqual(LinearExpression.of(x), 1).withName("x_on");
    assertThat(ge.getUpperBound()).isEqualTo(Long.MAX_VALUE);

    assertThat(model.getLinearConstraints()).containsExactly(eq, le, ge).inOrder();
    assertThat(ge.getIndex()).isEqualTo(2);
    assertThat(model.countLinearConstraints("x_")).isEqualTo(1);
    assertThat(model.countLinearConstraints("")).isEqualTo(3);

    assertThat(le.isSatisfiedBy(index -> 1)).isFalse();
    assertThat(le.isSatisfiedBy(index -> index)).isTrue();
  }

  @Test
  public void testScheduleModel_multiplicationEquality() {
    final ScheduleModel model = new ScheduleModel();
    final Variable diff = model.newIntVar(-4, 4, "diff");
    final Variable square = model.newIntVar(0, 16, "square");
    final ProductConstraint ct = model.addMultiplicationEquality(square, diff, diff);

    assertThat(model.getProductConstraints()).containsExactly(ct);
    assertThat(ct.getTarget()).isSameInstanceAs(square);
    assertThat(ct.getLeft()).isSameInstanceAs(diff);
    assertThat(ct.toString()).isEqualTo("var_1 == var_0 * var_0");
    assertThat(ct.isSatisfiedBy(index -> index == 0 ? -3 : 9)).isTrue();
    assertThat(ct.isSatisfiedBy(index -> index == 0 ? -3 : -9)).isFalse();
  }

  @Test
  public void testScheduleModel_objective() {
    final ScheduleModel model = new ScheduleModel();
    final Variable x = model.newIntVar(0, 10, "x");
    assertThat(model.hasObjective()).isFalse();
    assertThat(model.getObjective().isPresent()).isFalse();

    model.minimize(LinearExpression.newBuilder().add(x).add(x).build());
    assertThat(model.hasObjective()).isTrue();
    assertThat(model.getObjective().get().getWeight(0)).isEqualTo(2);
    assertThat(model.modelStats())
        .isEqualTo("#variables: 1 (0 booleans), #linear: 0, #product: 0, objective: minimize");

    model.clearObjective();
    assertThat(model.hasObjective()).isFalse();
  }

  @Test
  public void testScheduleModel_rejectsVariablesOfAnotherModel() {
    final ScheduleModel other = new ScheduleModel();
    other.newBoolVar("a");
    other.newBoolVar("b");
    final Variable outOfRange = other.newBoolVar("c");

    final ScheduleModel model = new ScheduleModel();
    final Variable x = model.newBoolVar("x");
    model.newBoolVar("y");
    // Index 0 also names a variable of this model.
    final Variable sameIndex = other.getVariable(0);

    assertThrows(
        ScheduleModel.ForeignVariable.class,
        () -> model.addEquality(LinearExpression.of(sameIndex), 0));
    assertThrows(
        ScheduleModel.ForeignVariable.class,
        () -> model.addEquality(LinearExpression.of(x), LinearExpression.of(sameIndex)));
    assertThrows(
        ScheduleModel.ForeignVariable.class,
        () -> model.addGreaterOrEqual(LinearExpression.of(outOfRange), 1));
    assertThrows(
        ScheduleModel.ForeignVariable.class,
        () -> model.addMultiplicationEquality(x, sameIndex, sameIndex));
    assertThrows(
        ScheduleModel.ForeignVariable.class, () -> model.minimize(LinearExpression.of(sameIndex)));
    assertThrows(
        ScheduleModel.ForeignVariable.class,
        () -> LinearExpression.newBuilder().add(x).add(sameIndex));
    assertThrows(ScheduleModel.UnknownVariable.class, () -> model.getVariable(2));
    assertThat(model.getLinearConstraints()).isEmpty();
    assertThat(model.getProductConstraints()).isEmpty();
    assertThat(model.hasObjective()).isFalse();
  }

  @Test
  public void testScheduleModel_emptyExpressionNeedsNoOwner() {
    final ScheduleModel model = new ScheduleModel();
    final LinearConstraint ct = model.addGreaterOrEqual(LinearExpression.empty(), 0);
    assertThat(ct.isSatisfiedBy(index -> 0)).isTrue();
    assertThat(ct.toString()).isEqualTo("0 >= 0");
  }
}
