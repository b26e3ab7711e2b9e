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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.physicianscheduler.model.LinearExpression;
import org.physicianscheduler.model.LinearExpressionBuilder;
import org.physicianscheduler.model.ScheduleModel;
import org.physicianscheduler.model.Variable;

/** Tests the CP-SAT backend on small models. */
public final class CpSatSolverBackendTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  /**
   * Market split: 5 rows over 40 binary variables with weights in [0, 99], each row summing to half
   * its total weight. Such instances almost never have a solution and a branching search needs far
   * longer than any test to refute them.
   */
  private static ScheduleModel marketSplit() {
    final Random random = new Random(20240601L);
    final ScheduleModel model = new ScheduleModel();
    List<Variable> picks = new ArrayList<>();
    for (int i = 0; i < 40; ++i) {
      picks.add(model.newBoolVar("pick_" + i));
    }
    for (int row = 0; row < 5; ++row) {
      LinearExpressionBuilder weighted = LinearExpression.newBuilder();
      long total = 0;
      for (Variable pick : picks) {
        final int weight = random.nextInt(100);
        for (int k = 0; k < weight; ++k) {
          weighted.add(pick);
        }
        total += weight;
      }
      model.addEquality(weighted.build(), total / 2);
    }
    return model;
  }

  @Test
  public void testCpSatSolverBackend_optimal() {
    final ScheduleModel model = new ScheduleModel();
    final Variable x = model.newBoolVar("x");
    final Variable y = model.newBoolVar("y");
    model.addEquality(LinearExpression.sumOf(Arrays.asList(x, y)), 1);
    model.minimize(LinearExpression.of(x));

    final SolveResult result = new CpSatSolverBackend().solve(model);
    assertThat(result.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
    assertThat(result.hasSolution()).isTrue();
    assertThat(result.value(x)).isEqualTo(0);
    assertThat(result.value(y)).isEqualTo(1);
    assertThat(result.getValues().isTrue(y)).isTrue();
    assertThat(result.getStatistics().getObjectiveValue()).isWithin(1e-6).of(0.0);
    assertThat(result.getStatistics().getWallTime()).isAtLeast(0.0);
  }

  @Test
  public void testCpSatSolverBackend_infeasible() {
    final ScheduleModel model = new ScheduleModel();
    final Variable x = model.newBoolVar("x");
    model.addGreaterOrEqual(LinearExpression.of(x), 2);

    final SolveResult result = new CpSatSolverBackend().solve(model);
    assertThat(result.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
    assertThat(result.hasSolution()).isFalse();
    assertThat(result.getStatistics()).isNotNull();
    assertThrows(IllegalStateException.class, result::getValues);
    assertThrows(IllegalStateException.class, () -> result.value(x));
  }

  @Test
  public void testCpSatSolverBackend_invalidModelIsAFault() {
    final ScheduleModel model = new ScheduleModel();
    final Variable x = model.newIntVar(0, -1, "empty");
    model.addEquality(x, 0);

    final SolverFaultException fault =
        assertThrows(SolverFaultException.class, () -> new CpSatSolverBackend().solve(model));
    assertThat(fault).hasMessageThat().contains("Invalid model");
  }

  @Test
  public void testCpSatSolverBackend_multiplicationEquality() {
    final ScheduleModel model = new ScheduleModel();
    final Variable diff = model.newIntVar(-3, 3, "diff");
    final Variable square = model.newIntVar(0, 9, "square");
    model.addMultiplicationEquality(square, diff, diff);
    model.addEquality(diff, -3);

    final SolveResult result = new CpSatSolverBackend().solve(model);
    assertThat(result.hasSolution()).isTrue();
    assertThat(result.value(square)).isEqualTo(9);
  }

  @Test
  public void testCpSatSolverBackend_minimizesSquares() {
    final ScheduleModel model = new ScheduleModel();
    final Variable a = model.newIntVar(0, 10, "a");
    final Variable b = model.newIntVar(0, 10, "b");
    final Variable diff = model.newIntVar(-10, 10, "diff");
    final Variable square = model.newIntVar(0, 100, "square");
    model.addEquality(LinearExpression.sumOf(Arrays.asList(a, b)), 7);
    model.addEquality(
        LinearExpression.of(diff), LinearExpression.of(a).minus(LinearExpression.of(b)));
    model.addMultiplicationEquality(square, diff, diff);
    model.minimize(LinearExpression.of(square));

    final SolveResult result =
        new CpSatSolverBackend()
            .solve(
                model,
                SolveOptions.newBuilder()
                    .setTimeLimit(Duration.ofSeconds(10))
                    .setNumWorkers(1)
                    .setLogSearchProgress(true)
                    .build());
    assertThat(result.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
    assertThat(result.value(square)).isEqualTo(1);
    assertThat(result.getStatistics().getBestObjectiveBound()).isWithin(1e-6).of(1.0);
  }

  @Test
  public void testCpSatSolverBackend_cancelledBeforeSolve() {
    final ScheduleModel model = new ScheduleModel();
    model.newBoolVar("x");
    final CancellationToken token = new CancellationToken();
    token.cancel();

    final SolveResult result =
        new CpSatSolverBackend()
            .solve(model, SolveOptions.newBuilder().setCancellationToken(token).build());
    assertThat(result.getStatus()).isEqualTo(SolveStatus.UNKNOWN);
    assertThat(result.hasSolution()).isFalse();
    assertThat(result.getStatistics().getNumConflicts()).isEqualTo(0);
    assertThat(result.getStatistics().getNumBranches()).isEqualTo(0);
  }

  @Test
  public void testCpSatSolverBackend_cancelDuringSearch() throws Exception {
    final ScheduleModel model = marketSplit();
    final CancellationToken token = new CancellationToken();
    final SolveOptions options =
        SolveOptions.newBuilder()
            .setTimeLimit(Duration.ofSeconds(120))
            .setCancellationToken(token)
            .build();

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<SolveResult> running =
          executor.submit(() -> new CpSatSolverBackend().solve(model, options));
      Thread.sleep(500);
      assertThat(running.isDone()).isFalse();

      final long cancelledAt = System.nanoTime();
      token.cancel();
      final SolveResult result = running.get(20, TimeUnit.SECONDS);
      assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - cancelledAt)).isLessThan(20);
      assertThat(result.getStatus()).isAnyOf(SolveStatus.UNKNOWN, SolveStatus.FEASIBLE);
      assertThat(result.getStatistics().getWallTime()).isLessThan(60.0);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testCpSatSolverBackend_cancelWhileStarting() throws Exception {
    // The cancel races with the translation of the model and the setup of the engine.
    final ScheduleModel model = marketSplit();
    final CancellationToken token = new CancellationToken();
    final SolveOptions options =
        SolveOptions.newBuilder()
            .setTimeLimit(Duration.ofSeconds(120))
            .setCancellationToken(token)
            .build();

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<SolveResult> running =
          executor.submit(() -> new CpSatSolverBackend().solve(model, options));
      token.cancel();
      final SolveResult result = running.get(20, TimeUnit.SECONDS);
      assertThat(result.getStatus()).isAnyOf(SolveStatus.UNKNOWN, SolveStatus.FEASIBLE);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testCpSatSolverBackend_tinyTimeLimit() {
    final SolveResult result =
        new CpSatSolverBackend()
            .solve(
                marketSplit(),
                SolveOptions.newBuilder().setTimeLimit(Duration.ofMillis(1)).build());
    assertThat(result.getStatus()).isAnyOf(SolveStatus.UNKNOWN, SolveStatus.FEASIBLE);
    assertThat(result.getStatistics().getWallTime()).isLessThan(10.0);
  }

  @Test
  public void testCpSatSolverBackend_translate() {
    final ScheduleModel model = new ScheduleModel();
    final Variable x = model.newBoolVar("x");
    final Variable y = model.newIntVar(-2, 5, "y");
    final Variable z = model.newIntVar(0, 25, "z");
    model.addLessOrEqual(LinearExpression.sumOf(Arrays.asList(x, y)), 3);
    model.addMultiplicationEquality(z, y, y);
    model.minimize(LinearExpression.of(z));

    final CpModel cpModel = new CpModel();
    final IntVar[] vars = CpSatSolverBackend.translate(model, cpModel);
    assertThat(vars).hasLength(3);
    assertThat(vars[0].getName()).isEqualTo("x");
    assertThat(vars[1].getDomain().min()).isEqualTo(-2);
    assertThat(vars[1].getDomain().max()).isEqualTo(5);
    assertThat(cpModel.model().getConstraintsCount()).isEqualTo(2);
    assertThat(cpModel.model().hasObjective()).isTrue();
  }

  @Test
  public void testCpSatSolverBackend_name() {
    assertThat(new CpSatSolverBackend().getName()).isEqualTo("CP-SAT");
  }

  @Test
  public void testSolveResult_valuesMatchStatus() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new SolveResult(SolveStatus.OPTIMAL, null, SolverStatistics.empty()));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new SolveResult(
                SolveStatus.INFEASIBLE,
                new SolutionValues(new long[] {1}),
                SolverStatistics.empty()));
  }

  @Test
  public void testSolutionValues_rejectsUnknownVariable() {
    final ScheduleModel model = new ScheduleModel();
    model.newBoolVar("x");
    final Variable y = model.newBoolVar("y");
    final SolutionValues values = new SolutionValues(new long[] {1});
    assertThat(values.size()).isEqualTo(1);
    assertThat(values.valueOf(model.getVariable(0))).isEqualTo(1);
    assertThrows(IllegalArgumentException.class, () -> values.valueOf(y));
  }

  @Test
  public void testSolverStatistics_toStringIgnoresDefaultLocale() {
    final Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.GERMANY);
    try {
      assertThat(new SolverStatistics(12, 34, 0.5, 6.0, 6.25).toString())
          .isEqualTo(
              "conflicts: 12, branches: 34, wall time: 0.500000 s, objective: 6.000000,"
                  + " bound: 6.250000");
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  public void testSolveOptions() {
    final SolveOptions defaults = SolveOptions.getDefaultInstance();
    assertThat(defaults.getTimeLimit().isPresent()).isFalse();
    assertThat(defaults.getNumWorkers()).isEqualTo(0);
    assertThat(defaults.getLogSearchProgress()).isFalse();
    assertThat(defaults.getCancellationToken().isCancelled()).isFalse();

    assertThrows(
        IllegalArgumentException.class,
        () -> SolveOptions.newBuilder().setTimeLimit(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> SolveOptions.newBuilder().setNumWorkers(-1));
    assertThat(
            SolveOptions.newBuilder()
                .setTimeLimit(Duration.ofMillis(1500))
                .build()
                .getTimeLimit()
                .get())
        .isEqualTo(Duration.ofMillis(1500));
  }
}
