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

import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverSolutionCallback;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.SatParameters;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.physicianscheduler.model.LinearConstraint;
import org.physicianscheduler.model.LinearExpression;
import org.physicianscheduler.model.ProductConstraint;
import org.physicianscheduler.model.ScheduleModel;
import org.physicianscheduler.model.Variable;

/** Solves a {@link ScheduleModel} with the OR-Tools CP-SAT solver. */
public final class CpSatSolverBackend implements SolverBackend {
  private static final Logger logger = Logger.getLogger(CpSatSolverBackend.class.getName());

  private static boolean nativeLoaded = false;

  private static synchronized void ensureNativeLoaded() {
    if (!nativeLoaded) {
      Loader.loadNativeLibraries();
      nativeLoaded = true;
    }
  }

  /**
   * Stops the search once the token is cancelled. The engine calls the log sink from the first
   * lines of a solve, after it can be stopped, so a cancellation that lands before {@link
   * CpSolver#stopSearch()} has any effect is still seen there.
   */
  private static final class SearchMonitor extends CpSolverSolutionCallback {
    SearchMonitor(CancellationToken token, CpSolver solver, boolean forwardLog) {
      this.token = token;
      this.solver = solver;
      this.forwardLog = forwardLog;
    }

    @Override
    public void onSolutionCallback() {
      solutionCount++;
      if (token.isCancelled()) {
        stopSearch();
      }
    }

    void onLogLine(String line) {
      if (forwardLog) {
        logger.fine(line);
      }
      if (token.isCancelled() && !stopRequested) {
        stopRequested = true;
        logger.info("Stopping CP-SAT, the solve was cancelled");
        solver.stopSearch();
      }
    }

    int getSolutionCount() {
      return solutionCount;
    }

    private final CancellationToken token;
    private final CpSolver solver;
    private final boolean forwardLog;
    private int solutionCount;
    private volatile boolean stopRequested;
  }

  @Override
  public String getName() {
    return "CP-SAT";
  }

  @Override
  public SolveResult solve(ScheduleModel model, SolveOptions options) {
    final CancellationToken token = options.getCancellationToken();
    if (token.isCancelled()) {
      logger.info("Solve cancelled before it started");
      return new SolveResult(SolveStatus.UNKNOWN, null, SolverStatistics.empty());
    }
    ensureNativeLoaded();

    final CpModel cpModel = new CpModel();
    final IntVar[] vars = translate(model, cpModel);
    logger.fine("Translated model, " + model.modelStats());

    final CpSolver solver = new CpSolver();
    final SearchMonitor monitor =
        new SearchMonitor(token, solver, options.getLogSearchProgress());
    configure(solver, options, monitor);

    final Runnable stopSearch = solver::stopSearch;
    token.addListener(stopSearch);
    final CpSolverStatus cpStatus;
    try {
      if (token.isCancelled()) {
        logger.info("Solve cancelled while the model was translated");
        return new SolveResult(SolveStatus.UNKNOWN, null, SolverStatistics.empty());
      }
      cpStatus = solver.solve(cpModel, monitor);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "CP-SAT failed", e);
      throw new SolverFaultException("CP-SAT failed: " + e.getMessage(), e);
    } finally {
      token.removeListener(stopSearch);
    }

    final SolveStatus status = toSolveStatus(cpStatus, solver);
    final SolverStatistics statistics =
        new SolverStatistics(
            solver.numConflicts(),
            solver.numBranches(),
            solver.wallTime(),
            status.hasSolution() ? solver.objectiveValue() : Double.NaN,
            status.hasSolution() ? solver.bestObjectiveBound() : Double.NaN);
    logger.info(
        "CP-SAT status: " + status + " after " + monitor.getSolutionCount() + " solutions, "
            + statistics);

    if (!status.hasSolution()) {
      return new SolveResult(status, null, statistics);
    }
    long[] values = new long[vars.length];
    for (int i = 0; i < vars.length; ++i) {
      values[i] = solver.value(vars[i]);
    }
    return new SolveResult(status, new SolutionValues(values), statistics);
  }

  /** Creates one CP-SAT variable per model variable, then the constraints and the objective. */
  static IntVar[] translate(ScheduleModel model, CpModel cpModel) {
    final IntVar[] vars = new IntVar[model.numVariables()];
    for (Variable var : model.getVariables()) {
      if (var.isBoolean()) {
        vars[var.getIndex()] = cpModel.newBoolVar(var.getName());
      } else {
        vars[var.getIndex()] =
            cpModel.newIntVar(var.getLowerBound(), var.getUpperBound(), var.getName());
      }
    }
    for (LinearConstraint ct : model.getLinearConstraints()) {
      cpModel.addLinearConstraint(
          toLinearExpr(ct.getExpression(), vars), ct.getLowerBound(), ct.getUpperBound());
    }
    for (ProductConstraint ct : model.getProductConstraints()) {
      cpModel.addMultiplicationEquality(
          vars[ct.getTarget().getIndex()],
          vars[ct.getLeft().getIndex()],
          vars[ct.getRight().getIndex()]);
    }
    model.getObjective().ifPresent(objective -> cpModel.minimize(toLinearExpr(objective, vars)));
    return vars;
  }

  private static LinearExpr toLinearExpr(LinearExpression e, IntVar[] vars) {
    LinearExprBuilder builder = LinearExpr.newBuilder();
    for (int term = 0; term < e.numTerms(); ++term) {
      builder.addTerm(vars[e.getVariableIndex(term)], e.getWeight(term));
    }
    return builder.build();
  }

  private static void configure(CpSolver solver, SolveOptions options, SearchMonitor monitor) {
    final SatParameters.Builder parameters = solver.getParameters();
    if (options.getTimeLimit().isPresent()) {
      final Duration limit = options.getTimeLimit().get();
      parameters.setMaxTimeInSeconds(limit.toMillis() / 1000.0);
    }
    if (options.getNumWorkers() > 0) {
      parameters.setNumWorkers(options.getNumWorkers());
    }
    // The log sink also watches for cancellation, so it is always installed.
    parameters.setLogSearchProgress(true).setLogToStdout(false);
    solver.setLogCallback(monitor::onLogLine);
  }

  private static SolveStatus toSolveStatus(CpSolverStatus cpStatus, CpSolver solver) {
    switch (cpStatus) {
      case OPTIMAL:
        return SolveStatus.OPTIMAL;
      case FEASIBLE:
        return SolveStatus.FEASIBLE;
      case INFEASIBLE:
        return SolveStatus.INFEASIBLE;
      case UNKNOWN:
        return SolveStatus.UNKNOWN;
      case MODEL_INVALID:
        logger.warning("CP-SAT rejected the model: " + solver.getSolutionInfo());
        throw new SolverFaultException("Invalid model: " + solver.getSolutionInfo());
      default:
        throw new SolverFaultException("Unexpected CP-SAT status " + cpStatus);
    }
  }
}
