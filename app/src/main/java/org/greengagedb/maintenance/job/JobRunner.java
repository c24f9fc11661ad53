/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.greengagedb.maintenance.job;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.notify.MessageHandle;
import org.greengagedb.maintenance.report.RunReporter;

import java.util.Objects;

/**
 * Executes one run of a job and reports it.
 *
 * <p>The message handle lives only in the local scope of {@link #run(MaintenanceJob)}, so
 * concurrent runs never edit each other's message.
 */
@Slf4j
@ApplicationScoped
public class JobRunner {
    private final RunReporter reporter;

    @Inject
    public JobRunner(RunReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    /**
     * Run the job: announce, execute, report.
     *
     * @return Completed run
     * @throws MaintenanceJobException If sending, executing or reporting fails; no retry is attempted
     */
    public MaintenanceRun run(MaintenanceJob job) {
        MessageHandle handle = null;
        try {
            log.info("Starting {}", job.getName());
            handle = reporter.started(job);
            MaintenanceRun run = job.execute();
            reporter.completed(handle, job, run);
            log.info("{} completed: {} tables in {} ms",
                    job.getName(), run.tablesProcessed(), run.totalElapsed().toMillis());
            return run;
        } catch (Exception e) {
            try {
                reporter.failed(handle, job, e);
            } finally {
                log.error("Error during {} execution: {}", job.getName(), e.getMessage(), e);
            }
            throw new MaintenanceJobException(job.getName(), e);
        }
    }
}
