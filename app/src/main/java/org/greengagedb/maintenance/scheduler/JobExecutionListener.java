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

import org.greengagedb.maintenance.job.MaintenanceJobException;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.TimeWindow;

import java.time.Duration;
import java.time.LocalTime;

/**
 * Callbacks for the outcome of every job firing, invoked by {@link MaintenanceScheduler}.
 *
 * <p>Callbacks run on scheduler or worker threads and may be invoked concurrently.
 */
public interface JobExecutionListener {

    /**
     * A firing was skipped because the current time is outside the job's window.
     */
    void onVetoed(String jobId, LocalTime now, TimeWindow window);

    void onCompleted(String jobId, MaintenanceRun run);

    /**
     * A run failed. Nothing is retried; the job waits for its next firing.
     */
    void onFailed(String jobId, MaintenanceJobException error);

    /**
     * A firing started later than the misfire threshold. The run itself still executes.
     */
    void onMisfire(String jobId, Duration lateness);
}
