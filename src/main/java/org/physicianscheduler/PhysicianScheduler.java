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

package org.physicianscheduler;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.physicianscheduler.config.RosterConfig;
import org.physicianscheduler.constraints.ConstraintCatalog;
import org.physicianscheduler.domain.AssignmentGrid;
import org.physicianscheduler.model.ScheduleModel;
import org.physicianscheduler.objective.FairnessObjective;
import org.physicianscheduler.report.ScheduleDecoder;
import org.physicianscheduler.report.ScheduleReport;
import org.physicianscheduler.report.ScheduleValidator;
import org.physicianscheduler.solver.SolveOptions;
import org.physicianscheduler.solver.SolveResult;
import org.physicianscheduler.solver.SolverBackend;

/**
 * Builds, solves and decodes the weekly physician roster.
 *
 * <p>Each call to {@link #run} creates its own model and grid, so one scheduler may serve
 * concurrent runs as long as its backend does.
 */
public final class PhysicianScheduler {
  private static final Logger logger = Logger.getLogger(PhysicianScheduler.class.getName());

  public PhysicianScheduler(RosterConfig config, SolverBackend backend) {
    this.config = config;
    this.backend = backend;
  }

  /** Runs with default solve options. */
  public ScheduleReport run() {
    return run(SolveOptions.getDefaultInstance());
  }

  public ScheduleReport run(SolveOptions options) {
    logger.info("Scheduling " + config);
    final ScheduleModel model = new ScheduleModel();
    final AssignmentGrid grid = AssignmentGrid.build(config, model);
    ConstraintCatalog.applyAll(grid, config);
    FairnessObjective.minimizeSquaredWorkloadDifferences(grid);
    logger.info(backend.getName() + " model: " + model.modelStats());

    final SolveResult result = backend.solve(model, options);
    final ScheduleReport report = ScheduleDecoder.decode(result, grid);
    if (report.hasSolution() && logger.isLoggable(Level.FINE)) {
      final List<String> violations = ScheduleValidator.validate(report, config);
      logger.fine("Schedule re-check: " + (violations.isEmpty() ? "ok" : violations));
    }
    return report;
  }

  public RosterConfig getConfig() {
    return config;
  }

  private final RosterConfig config;
  private final SolverBackend backend;
}
