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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;
import org.greengagedb.maintenance.db.DatabaseService;
import org.greengagedb.maintenance.scheduler.MaintenanceScheduler;

/**
 * Liveness check reporting store connectivity and the number of scheduled jobs.
 * A down database does not stop the scheduler; jobs simply fail until it is back.
 */
@Liveness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {
    private final DatabaseService databaseService;
    private final MaintenanceScheduler scheduler;

    @Inject
    public DatabaseHealthCheck(DatabaseService databaseService, MaintenanceScheduler scheduler) {
        this.databaseService = databaseService;
        this.scheduler = scheduler;
    }

    @Override
    public HealthCheckResponse call() {
        boolean connected = databaseService.testConnection();

        return HealthCheckResponse.named("maintenance-database")
                .status(connected)
                .withData("accessible", connected)
                .withData("scheduledJobs", scheduler.getScheduledJobs().size())
                .build();
    }
}
