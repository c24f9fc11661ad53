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
package org.greengagedb.maintenance.health;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.greengagedb.maintenance.db.DatabaseService;
import org.greengagedb.maintenance.scheduler.MaintenanceScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatabaseHealthCheckTest {

    @Mock
    private DatabaseService databaseService;

    @Mock
    private MaintenanceScheduler scheduler;

    private DatabaseHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        healthCheck = new DatabaseHealthCheck(databaseService, scheduler);
        when(scheduler.getScheduledJobs()).thenReturn(Set.of("vacuum", "cleanup"));
    }

    @Test
    void testCall_DatabaseUp() {
        // Setup
        when(databaseService.testConnection()).thenReturn(true);

        // Execute
        HealthCheckResponse response = healthCheck.call();

        // Verify
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals(2L, response.getData().get().get("scheduledJobs"));
    }

    @Test
    void testCall_DatabaseDown() {
        // Setup
        when(databaseService.testConnection()).thenReturn(false);

        // Execute
        HealthCheckResponse response = healthCheck.call();

        // Verify
        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals(false, response.getData().get().get("accessible"));
    }
}
