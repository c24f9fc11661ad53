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
package org.greengagedb.maintenance.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one completed maintenance job execution.
 *
 * <p>Owned by the job that produced it and discarded once reported.
 *
 * @param kind            Job kind
 * @param startedAt       When the job body started
 * @param tablesProcessed Size of the table list the run worked on
 * @param totalElapsed    Wall-clock time of the job body
 * @param stats           Per-table (or, for cleanup, single aggregate) results in processing order
 */
public record MaintenanceRun(JobKind kind,
                             Instant startedAt,
                             int tablesProcessed,
                             Duration totalElapsed,
                             List<TableStat> stats) {

    public MaintenanceRun {
        stats = List.copyOf(stats);
    }

    public static MaintenanceRun empty(JobKind kind, Instant startedAt, Duration elapsed) {
        return new MaintenanceRun(kind, startedAt, 0, elapsed, List.of());
    }

    public boolean isEmpty() {
        return tablesProcessed == 0;
    }

    /**
     * Results of the given type, in processing order.
     */
    public <T extends TableStat> List<T> statsOf(Class<T> type) {
        return stats.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }
}
