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
import org.greengagedb.maintenance.config.MaintenanceConfig;
import org.greengagedb.maintenance.db.ReindexResult;
import org.greengagedb.maintenance.db.StoreGateway;
import org.greengagedb.maintenance.model.JobDescriptor;
import org.greengagedb.maintenance.model.JobKind;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.ReindexStat;
import org.greengagedb.maintenance.model.TableStat;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the indexes of the configured tables with {@code REINDEX TABLE}.
 */
@Slf4j
@ApplicationScoped
public class ReindexJob implements MaintenanceJob {
    private final StoreGateway storeGateway;
    private final MaintenanceConfig.Reindex config;
    private final Clock clock;

    @Inject
    public ReindexJob(StoreGateway storeGateway, MaintenanceConfig config, Clock clock) {
        this(storeGateway, config.reindex(), clock);
    }

    ReindexJob(StoreGateway storeGateway, MaintenanceConfig.Reindex config, Clock clock) {
        this.storeGateway = storeGateway;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "reindex";
    }

    @Override
    public JobKind getKind() {
        return JobKind.REINDEX;
    }

    @Override
    public JobDescriptor describe() {
        return new JobDescriptor(getName(), config.schedule(), config.enabled(), getKind(), Optional.empty());
    }

    @Override
    public MaintenanceRun execute() throws SQLException {
        Instant startedAt = clock.instant();
        List<String> tables = configuredTables();
        if (tables.isEmpty()) {
            log.info("No tables configured for reindexing");
            return MaintenanceRun.empty(getKind(), startedAt, elapsedSince(startedAt));
        }

        List<TableStat> stats = new ArrayList<>(tables.size());
        for (String table : tables) {
            log.info("REINDEX for table {}", table);
            ReindexResult result = storeGateway.reindexTable(table);
            stats.add(new ReindexStat(table, result.duration()));
        }
        return new MaintenanceRun(getKind(), startedAt, tables.size(), elapsedSince(startedAt), stats);
    }

    @Override
    public Optional<String> getHashtag() {
        return config.hashtag();
    }

    private List<String> configuredTables() {
        return config.tables().orElse(List.of()).stream()
                .filter(table -> table != null && !table.isBlank())
                .map(String::trim)
                .toList();
    }

    private Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, clock.instant());
    }
}
