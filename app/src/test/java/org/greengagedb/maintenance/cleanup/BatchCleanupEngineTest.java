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

import org.greengagedb.maintenance.db.StoreGateway;
import org.greengagedb.maintenance.model.CleanupPolicy;
import org.greengagedb.maintenance.model.CleanupStat;
import org.greengagedb.maintenance.model.CleanupStopReason;
import org.greengagedb.maintenance.model.TimeWindow;
import org.greengagedb.maintenance.window.MutableClock;
import org.greengagedb.maintenance.window.WindowGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchCleanupEngineTest {

    private final CleanupPolicy policy =
            new CleanupPolicy("waypoint", "created_at", 24, 100_000, Optional.empty(), false);
    private final TimeWindow window = TimeWindow.parse("01:00", "05:00");

    @Mock
    private StoreGateway storeGateway;

    private BatchCleanupEngine engine;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        engine = new BatchCleanupEngine(storeGateway);
        clock = MutableClock.at("2024-06-01T01:00:00Z");
    }

    @Test
    void testRun_DrainsUntilEmptyBatch() throws SQLException {
        // Setup
        when(storeGateway.rowCount(policy)).thenReturn(1_000_000L, 762_459L);
        when(storeGateway.deleteOldestBatch(policy)).thenReturn(100_000, 100_000, 37_541, 0);

        // Execute
        CleanupStat stat = engine.run(policy, new WindowGate(window, clock));

        // Verify
        assertEquals(237_541L, stat.totalDeleted());
        assertEquals(4, stat.batches());
        assertEquals(CleanupStopReason.DRAINED, stat.stopReason());
        assertEquals(1_000_000L, stat.rowsBefore());
        assertEquals(762_459L, stat.rowsAfter());
        verify(storeGateway, times(4)).deleteOldestBatch(policy);
    }

    @Test
    void testRun_StopsWhenWindowCloses() throws SQLException {
        // Setup - each batch takes 30 minutes, starting at 03:30
        clock = MutableClock.at("2024-06-01T03:30:00Z");
        when(storeGateway.rowCount(policy)).thenReturn(500_000L, 200_000L);
        when(storeGateway.deleteOldestBatch(policy)).thenAnswer(invocation -> {
            clock.advance(Duration.ofMinutes(30));
            return 100_000;
        });

        // Execute
        CleanupStat stat = engine.run(policy, new WindowGate(window, clock));

        // Verify - batches at 03:30, 04:00 and 04:30; the check at 05:00 stops the loop
        verify(storeGateway, times(3)).deleteOldestBatch(policy);
        assertEquals(300_000L, stat.totalDeleted());
        assertEquals(3, stat.batches());
        assertEquals(CleanupStopReason.WINDOW_CLOSED, stat.stopReason());
    }

    @Test
    void testRun_WindowAlreadyClosed_DeletesNothing() throws SQLException {
        // Setup
        clock = MutableClock.at("2024-06-01T05:00:00Z");
        when(storeGateway.rowCount(policy)).thenReturn(10L);

        // Execute
        CleanupStat stat = engine.run(policy, new WindowGate(window, clock));

        // Verify
        verify(storeGateway, never()).deleteOldestBatch(any());
        assertEquals(0L, stat.totalDeleted());
        assertEquals(0, stat.batches());
        assertEquals(10L, stat.rowsAfter());
        assertEquals(CleanupStopReason.WINDOW_CLOSED, stat.stopReason());
    }

    @Test
    void testRun_NegativeBatchResult_ThrowsException() throws SQLException {
        // Setup
        when(storeGateway.rowCount(policy)).thenReturn(10L);
        when(storeGateway.deleteOldestBatch(policy)).thenReturn(-1);

        // Execute & Verify
        assertThrows(IllegalStateException.class, () -> engine.run(policy, new WindowGate(window, clock)));
    }

    @Test
    void testRun_DeleteFails_PropagatesAndSkipsFinalCount() throws SQLException {
        // Setup
        when(storeGateway.rowCount(policy)).thenReturn(10L);
        when(storeGateway.deleteOldestBatch(policy)).thenThrow(new SQLException("lock timeout"));

        // Execute & Verify
        assertThrows(SQLException.class, () -> engine.run(policy, new WindowGate(window, clock)));
        verify(storeGateway, times(1)).rowCount(policy);
    }
}
