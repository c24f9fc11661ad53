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

import org.greengagedb.maintenance.model.JobDescriptor;
import org.greengagedb.maintenance.model.JobKind;
import org.greengagedb.maintenance.model.MaintenanceRun;

import java.sql.SQLException;
import java.util.Optional;

/**
 * A scheduled maintenance operation.
 *
 * <p>Implementations run their store calls sequentially and in list order: compaction and
 * reindex take exclusive locks, so running tables in parallel only adds lock contention.
 *
 * <p>Implementations must not keep per-run state in fields; the same instance may be
 * executing on two workers if schedules overlap.
 */
public interface MaintenanceJob {

    /**
     * @return Job identity, used for the trigger, logs and metrics
     */
    String getName();

    JobKind getKind();

    /**
     * Build the scheduling view of this job from configuration.
     *
     * @return Job descriptor
     * @throws InvalidJobConfigurationException If the configuration cannot be used
     */
    JobDescriptor describe();

    /**
     * Run the job body.
     *
     * <p>Any exception aborts the remainder of the run; no partial result is produced.
     *
     * @return Completed run
     * @throws SQLException If a store operation fails
     */
    MaintenanceRun execute() throws SQLException;

    /**
     * @return Short text appended to the "started" message, empty by default
     */
    default String getStartedDetail() {
        return "";
    }

    /**
     * @return Hashtag appended to every message of this job, without the leading {@code #}
     */
    default Optional<String> getHashtag() {
        return Optional.empty();
    }
}
