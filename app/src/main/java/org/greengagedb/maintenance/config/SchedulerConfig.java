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

import java.time.Duration;

/**
 * Configuration for the maintenance worker pool and trigger handling.
 */
@ConfigMapping(prefix = "app.scheduler")
public interface SchedulerConfig {

    /**
     * Maximum number of maintenance runs executing at the same time.
     *
     * @return Worker pool size (default: 10)
     */
    @WithDefault("10")
    int maxConcurrency();

    /**
     * How long {@code stop()} waits for in-flight runs before giving up.
     *
     * @return Shutdown wait (default: 5 minutes)
     */
    @WithDefault("5m")
    Duration shutdownTimeout();

    /**
     * A firing that starts later than this after its scheduled time is reported as a misfire.
     *
     * @return Misfire threshold (default: 60 seconds)
     */
    @WithDefault("60s")
    Duration misfireThreshold();
}
