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
package org.greengagedb.maintenance.common;

import lombok.experimental.UtilityClass;

/**
 * Global constants for Greengage maintenance
 */
@UtilityClass
public final class Constants {
    public static final String NAMESPACE = "greengage";
    public static final String SUBSYSTEM_MAINTENANCE = "maintenance";
    public static final String SUBSYSTEM_CLEANUP = "cleanup";
    public static final String SUBSYSTEM_VACUUM = "vacuum";
    public static final String TAG_JOB = "job";
    public static final String TAG_OUTCOME = "outcome";
    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_VETOED = "vetoed";
}
