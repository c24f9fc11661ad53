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
package org.greengagedb.maintenance.db;

import org.greengagedb.maintenance.model.CleanupPolicy;

import java.sql.SQLException;
import java.util.List;

/**
 * Blocking maintenance primitives executed against the database.
 *
 * <p>Every call is a blocking I/O boundary. In-flight calls are never cancelled: callers
 * observe time limits only between calls.
 */
public interface StoreGateway {

    /**
     * @return Tables reported by the bloat-monitoring view, in view order
     */
    List<String> listBloatedTables() throws SQLException;

    /**
     * Rewrite a table to reclaim space. Takes an exclusive lock on the table.
     */
    CompactionResult compactTable(String table) throws SQLException;

    /**
     * Rebuild all indexes of a table.
     */
    ReindexResult reindexTable(String table) throws SQLException;

    /**
     * @return Total relation size in bytes, including indexes and TOAST
     */
    long tableSize(String table) throws SQLException;

    /**
     * @return Current number of rows in the cleanup table
     */
    long rowCount(CleanupPolicy policy) throws SQLException;

    /**
     * Delete at most {@code policy.batchSize()} of the oldest rows past the retention period.
     *
     * @return Rows deleted, {@code 0} once nothing eligible is left
     */
    int deleteOldestBatch(CleanupPolicy policy) throws SQLException;
}
