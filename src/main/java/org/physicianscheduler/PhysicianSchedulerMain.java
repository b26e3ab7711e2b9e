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

import org.physicianscheduler.config.RosterConfig;
import org.physicianscheduler.report.ReportFormatter;
import org.physicianscheduler.report.ScheduleReport;
import org.physicianscheduler.solver.CpSatSolverBackend;

/**
 * Solves the roster described by a classpath properties resource and prints it.
 *
 * <p>Usage: {@code PhysicianSchedulerMain [resource]}, where resource defaults to {@value
 * #DEFAULT_RESOURCE}.
 */
public final class PhysicianSchedulerMain {
  public static final String DEFAULT_RESOURCE = "physician-scheduler.properties";

  public static void main(String[] args) {
    String resource = DEFAULT_RESOURCE;
    if (args.length > 0) {
      resource = args[0];
    }
    final RosterConfig config = RosterConfig.load(resource);
    final ScheduleReport report = new PhysicianScheduler(config, new CpSatSolverBackend()).run();
    System.out.print(ReportFormatter.format(report));
    if (report.hasSolution()) {
      System.out.println();
      System.out.print(ReportFormatter.formatWorkloads(report));
    }
  }

  private PhysicianSchedulerMain() {}
}
