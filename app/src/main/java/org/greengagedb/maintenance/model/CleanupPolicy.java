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
 * What the cleanup job deletes and how much per batch.
 *
 * @param table            Table to clean up
 * @param timestampColumn  Column holding the row age
 * @param retentionMonths  Rows older than this many months are eligible
 * @param batchSize        Maximum rows deleted per statement
 * @param referenceColumn  Optional column protecting rows where it is non-null
 * @param deleteReferenced Whether rows protected by {@code referenceColumn} are deleted anyway
 */
public record CleanupPolicy(String table,
                            String timestampColumn,
                            int retentionMonths,
                            int batchSize,
                            Optional<String> referenceColumn,
                            boolean deleteReferenced) {

    public CleanupPolicy {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(timestampColumn, "timestampColumn");
        referenceColumn = referenceColumn == null ? Optional.empty() : referenceColumn;
        if (retentionMonths <= 0) {
            throw new IllegalArgumentException("retentionMonths must be positive: " + retentionMonths);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
    }

    /**
     * @return Column to filter on, or empty when referenced rows are deleted as well
     */
    public Optional<String> protectingColumn() {
        return deleteReferenced ? Optional.empty() : referenceColumn;
    }
}
