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
import org.greengagedb.maintenance.cleanup.BatchCleanupEngine;
import org.greengagedb.maintenance.common.SqlIdentifiers;
import org.greengagedb.maintenance.config.MaintenanceConfig;
import org.greengagedb.maintenance.model.CleanupPolicy;
import org.greengagedb.maintenance.model.CleanupStat;
import org.greengagedb.maintenance.model.JobDescriptor;
import org.greengagedb.maintenance.model.JobKind;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.TimeWindow;
import org.greengagedb.maintenance.window.WindowGate;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Deletes rows older than the retention period from the cleanup table, time-boxed to the
 * maintenance window.
 */
@Slf4j
@ApplicationScoped
public class CleanupJob implements MaintenanceJob {
    private final BatchCleanupEngine engine;
    private final MaintenanceConfig.Cleanup config;
    private final Clock clock;

    @Inject
    public CleanupJob(BatchCleanupEngine engine, MaintenanceConfig config, Clock clock) {
        this(engine, config.cleanup(), clock);
    }

    CleanupJob(BatchCleanupEngine engine, MaintenanceConfig.Cleanup config, Clock clock) {
        this.engine = engine;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "cleanup";
    }

    @Override
    public JobKind getKind() {
        return JobKind.CLEANUP;
    }

    @Override
    public JobDescriptor describe() {
        TimeWindow window = window();
        policy();
        return new JobDescriptor(getName(), config.schedule(), config.enabled(), getKind(), Optional.of(window));
    }

    @Override
    public MaintenanceRun execute() throws SQLException {
        Instant startedAt = clock.instant();
        CleanupPolicy policy = policy();
        log.info("Starting cleanup of {} (older than {} months)", policy.table(), policy.retentionMonths());

        CleanupStat stat = engine.run(policy, new WindowGate(window(), clock));

        Duration elapsed = Duration.between(startedAt, clock.instant());
        log.info("Cleanup completed: deleted {}, rows before {}, after {}, stopped: {}, duration {}",
                stat.totalDeleted(), stat.rowsBefore(), stat.rowsAfter(), stat.stopReason(), elapsed);
        return new MaintenanceRun(getKind(), startedAt, 1, elapsed, List.of(stat));
    }

    @Override
    public String getStartedDetail() {
        return "older than " + config.retentionMonths() + " months";
    }

    @Override
    public Optional<String> getHashtag() {
        return config.hashtag();
    }

    TimeWindow window() {
        return TimeWindow.parse(config.startTime(), config.endTime());
    }

    CleanupPolicy policy() {
        try {
            CleanupPolicy policy = new CleanupPolicy(
                    config.table(),
                    config.timestampColumn(),
                    config.retentionMonths(),
                    config.batchSize(),
                    config.referenceColumn(),
                    config.deleteReferenced());
            SqlIdentifiers.quote(policy.table());
            SqlIdentifiers.quote(policy.timestampColumn());
            policy.referenceColumn().ifPresent(SqlIdentifiers::quote);
            return policy;
        } catch (IllegalArgumentException e) {
            throw new InvalidJobConfigurationException("Invalid cleanup policy: " + e.getMessage(), e);
        }
    }
}
