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

import java.util.Objects;
import java.util.Optional;

/**
 * Scheduling view of a maintenance job, built once from configuration.
 *
 * @param id             Unique job identity used for the trigger
 * @param cronExpression Quartz-style cron expression
 * @param enabled        Whether the job should be scheduled at all
 * @param kind           Job kind
 * @param window         Maintenance window vetoing firings outside of it (cleanup only)
 */
public record JobDescriptor(String id,
                            String cronExpression,
                            boolean enabled,
                            JobKind kind,
                            Optional<TimeWindow> window) {

    public JobDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        window = window == null ? Optional.empty() : window;
    }
}
