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
package org.greengagedb.maintenance.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * Per-job maintenance configuration.
 *
 * <p>Schedules are Quartz-style cron expressions. Time-of-day values are kept as strings
 * and parsed when the job is scheduled, so a malformed value disables only the affected job.
 */
@ConfigMapping(prefix = "app.maintenance")
public interface MaintenanceConfig {

    Vacuum vacuum();

    Reindex reindex();

    Cleanup cleanup();

    interface Vacuum {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("0 0 3 ? * SUN")
        String schedule();

        /**
         * View listing bloated tables in a {@code tablename} column.
         */
        @WithDefault("bloat_monitor")
        String bloatView();

        Optional<String> hashtag();
    }

    interface Reindex {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("0 0 4 ? * SUN")
        String schedule();

        /**
         * Tables to reindex, in order. Nothing is reindexed when unset.
         */
        Optional<List<String>> tables();

        Optional<String> hashtag();
    }

    interface Cleanup {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("0 0 1 * * ?")
        String schedule();

        @WithDefault("waypoint")
        String table();

        @WithDefault("created_at")
        String timestampColumn();

        /**
         * Rows with a non-null value in this column are kept unless {@link #deleteReferenced()} is set.
         */
        Optional<String> referenceColumn();

        @WithDefault("false")
        boolean deleteReferenced();

        @WithDefault("24")
        int retentionMonths();

        @WithDefault("100000")
        int batchSize();

        @WithDefault("01:00")
        String startTime();

        @WithDefault("05:00")
        String endTime();

        Optional<String> hashtag();
    }
}
