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

import org.greengagedb.maintenance.config.MaintenanceConfig;
import org.greengagedb.maintenance.db.ReindexResult;
import org.greengagedb.maintenance.db.StoreGateway;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.ReindexStat;
import org.greengagedb.maintenance.window.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReindexJobTest {

    @Mock
    private StoreGateway storeGateway;

    @Mock
    private MaintenanceConfig.Reindex config;

    private ReindexJob job;

    @BeforeEach
    void setUp() {
        job = new ReindexJob(storeGateway, config, MutableClock.at("2024-06-02T04:00:00Z"));
    }

    @Test
    void testExecute_NoTablesConfigured_ReturnsEmptyRun() throws SQLException {
        // Setup
        when(config.tables()).thenReturn(Optional.empty());

        // Execute
        MaintenanceRun run = job.execute();

        // Verify
        assertTrue(run.isEmpty());
        verifyNoInteractions(storeGateway);
    }

    @Test
    void testExecute_ReindexesInConfiguredOrder() throws SQLException {
        // Setup
        when(config.tables()).thenReturn(Optional.of(List.of(" waypoint", "", "track ")));
        when(storeGateway.reindexTable(anyString())).thenReturn(new ReindexResult(Duration.ofMillis(1500)));

        // Execute
        MaintenanceRun run = job.execute();

        // Verify
        assertEquals(2, run.tablesProcessed());
        assertEquals(List.of("waypoint", "track"),
                run.statsOf(ReindexStat.class).stream().map(ReindexStat::table).toList());
        InOrder order = inOrder(storeGateway);
        order.verify(storeGateway).reindexTable("waypoint");
        order.verify(storeGateway).reindexTable("track");
    }

    @Test
    void testExecute_SecondTableFails_ThirdNotAttempted() throws SQLException {
        // Setup
        when(config.tables()).thenReturn(Optional.of(List.of("a", "b", "c")));
        when(storeGateway.reindexTable("a")).thenReturn(new ReindexResult(Duration.ofSeconds(1)));
        when(storeGateway.reindexTable("b")).thenThrow(new SQLException("deadlock detected"));

        // Execute & Verify
        SQLException e = assertThrows(SQLException.class, () -> job.execute());
        assertEquals("deadlock detected", e.getMessage());
        verify(storeGateway, never()).reindexTable("c");
    }
}
