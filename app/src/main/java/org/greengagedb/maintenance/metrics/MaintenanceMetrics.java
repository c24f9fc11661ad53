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
package org.greengagedb.maintenance.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.common.Constants;
import org.greengagedb.maintenance.common.MetricNameBuilder;
import org.greengagedb.maintenance.model.CleanupStat;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.VacuumStat;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics about maintenance runs
 */
@Slf4j
@ApplicationScoped
public class MaintenanceMetrics {

    private static final String NAME_RUNS = MetricNameBuilder.build(Constants.SUBSYSTEM_MAINTENANCE, "runs_total");
    private static final String NAME_RUN_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_MAINTENANCE, "run_duration_seconds");
    private static final String NAME_TABLES_PROCESSED = MetricNameBuilder.build(Constants.SUBSYSTEM_MAINTENANCE, "tables_processed_total");
    private static final String NAME_MISFIRES = MetricNameBuilder.build(Constants.SUBSYSTEM_MAINTENANCE, "misfires_total");
    private static final String NAME_ROWS_DELETED = MetricNameBuilder.build(Constants.SUBSYSTEM_CLEANUP, "rows_deleted_total");
    private static final String NAME_LAST_BYTES_FREED = MetricNameBuilder.build(Constants.SUBSYSTEM_VACUUM, "last_run_bytes_freed");

    private final AtomicLong lastBytesFreed = new AtomicLong();
    private final MeterRegistry registry;

    private Counter rowsDeletedCounter;

    @Inject
    public MaintenanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        rowsDeletedCounter = Counter.builder(NAME_ROWS_DELETED)
                .description("Total number of rows deleted by cleanup runs")
                .register(registry);
        Gauge.builder(NAME_LAST_BYTES_FREED, lastBytesFreed::get)
                .description("Bytes freed by the last completed vacuum run (negative if tables grew)")
                .register(registry);
        log.info("Maintenance metrics initialized");
    }

    public void recordCompleted(String jobId, MaintenanceRun run) {
        incrementRuns(jobId, Constants.OUTCOME_COMPLETED);
        Timer.builder(NAME_RUN_DURATION)
                .tag(Constants.TAG_JOB, jobId)
                .description("Duration of completed maintenance runs")
                .register(registry)
                .record(run.totalElapsed());
        Counter.builder(NAME_TABLES_PROCESSED)
                .tag(Constants.TAG_JOB, jobId)
                .description("Number of tables processed by completed runs")
                .register(registry)
                .increment(run.tablesProcessed());

        run.statsOf(CleanupStat.class).forEach(stat -> rowsDeletedCounter.increment(stat.totalDeleted()));
        if (!run.statsOf(VacuumStat.class).isEmpty()) {
            lastBytesFreed.set(run.statsOf(VacuumStat.class).stream().mapToLong(VacuumStat::freed).sum());
        }
    }

    public void recordFailed(String jobId) {
        incrementRuns(jobId, Constants.OUTCOME_FAILED);
    }

    public void recordVetoed(String jobId) {
        incrementRuns(jobId, Constants.OUTCOME_VETOED);
    }

    /**
     * Counted apart from the runs counter, which also records the late firing by its outcome.
     */
    public void recordMisfire(String jobId) {
        Counter.builder(NAME_MISFIRES)
                .tag(Constants.TAG_JOB, jobId)
                .description("Number of firings that started later than the misfire threshold")
                .register(registry)
                .increment();
    }

    private void incrementRuns(String jobId, String outcome) {
        Counter.builder(NAME_RUNS)
                .tag(Constants.TAG_JOB, jobId)
                .tag(Constants.TAG_OUTCOME, outcome)
                .description("Number of maintenance job firings by outcome")
                .register(registry)
                .increment();
    }
}
