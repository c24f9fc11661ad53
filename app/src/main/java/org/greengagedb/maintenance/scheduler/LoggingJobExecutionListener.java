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
package org.greengagedb.maintenance.scheduler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.job.MaintenanceJobException;
import org.greengagedb.maintenance.metrics.MaintenanceMetrics;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.TimeWindow;

import java.time.Duration;
import java.time.LocalTime;

/**
 * Default listener: logs every outcome and records it in the maintenance metrics.
 */
@Slf4j
@ApplicationScoped
public class LoggingJobExecutionListener implements JobExecutionListener {
    private final MaintenanceMetrics metrics;

    @Inject
    public LoggingJobExecutionListener(MaintenanceMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onVetoed(String jobId, LocalTime now, TimeWindow window) {
        log.info("Skipping {} job: current time {} is outside allowed interval {}", jobId, now, window);
        metrics.recordVetoed(jobId);
    }

    @Override
    public void onCompleted(String jobId, MaintenanceRun run) {
        log.info("Job {} executed successfully", jobId);
        metrics.recordCompleted(jobId, run);
    }

    @Override
    public void onFailed(String jobId, MaintenanceJobException error) {
        log.error("Job {} failed: {}", jobId, error.getCause() != null ? error.getCause().getMessage() : error.getMessage());
        metrics.recordFailed(jobId);
    }

    @Override
    public void onMisfire(String jobId, Duration lateness) {
        log.warn("Trigger for {} misfired: started {} ms late", jobId, lateness.toMillis());
        metrics.recordMisfire(jobId);
    }
}
