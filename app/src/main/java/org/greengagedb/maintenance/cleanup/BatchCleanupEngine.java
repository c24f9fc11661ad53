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
package org.greengagedb.maintenance.cleanup;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.db.StoreGateway;
import org.greengagedb.maintenance.model.CleanupPolicy;
import org.greengagedb.maintenance.model.CleanupStat;
import org.greengagedb.maintenance.model.CleanupStopReason;
import org.greengagedb.maintenance.window.WindowGate;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Deletes expired rows in bounded batches until the table is drained or the window closes.
 *
 * <p>The engine keeps no state between runs. A backlog larger than one window is worked off
 * over several scheduled runs because each batch removes the oldest eligible rows first.
 *
 * <p>The window check always precedes the delete call, so no batch is started once the
 * window has closed. A batch already running when the window closes is allowed to finish.
 */
@Slf4j
@ApplicationScoped
public class BatchCleanupEngine {
    private final StoreGateway storeGateway;

    @Inject
    public BatchCleanupEngine(StoreGateway storeGateway) {
        this.storeGateway = Objects.requireNonNull(storeGateway, "storeGateway");
    }

    /**
     * Run the deletion loop.
     *
     * @param policy What to delete and the batch size
     * @param gate   Window checked before every batch
     * @return Aggregate counts for the run
     * @throws SQLException If any count or delete statement fails; the run is aborted
     */
    public CleanupStat run(CleanupPolicy policy, WindowGate gate) throws SQLException {
        long rowsBefore = storeGateway.rowCount(policy);
        log.info("Cleanup of {} started: {} rows, retention {} months, batch size {}",
                policy.table(), rowsBefore, policy.retentionMonths(), policy.batchSize());

        long totalDeleted = 0;
        int batches = 0;
        CleanupStopReason stopReason;
        while (true) {
            if (!gate.isOpen()) {
                log.info("Stopping cleanup: current time {} is outside allowed interval {}",
                        gate.now(), gate.getWindow());
                stopReason = CleanupStopReason.WINDOW_CLOSED;
                break;
            }

            int deleted = storeGateway.deleteOldestBatch(policy);
            if (deleted < 0) {
                throw new IllegalStateException("Negative batch result from store: " + deleted);
            }
            totalDeleted += deleted;
            batches++;
            log.info("Deleted {} rows in batch {} (total {})", deleted, batches, totalDeleted);

            if (deleted == 0) {
                stopReason = CleanupStopReason.DRAINED;
                break;
            }
        }

        long rowsAfter = storeGateway.rowCount(policy);
        return new CleanupStat(rowsBefore, rowsAfter, totalDeleted, batches, stopReason);
    }
}
