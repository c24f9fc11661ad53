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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.config.MaintenanceConfig;
import org.greengagedb.maintenance.model.CleanupPolicy;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.greengagedb.maintenance.common.SqlIdentifiers.quote;

/**
 * PostgreSQL implementation of the maintenance primitives.
 *
 * <p>Each call borrows its own pooled connection. The datasource runs without JTA, so
 * statements execute in autocommit mode, which {@code VACUUM FULL} requires.
 */
@Slf4j
@ApplicationScoped
public class JdbcStoreGateway implements StoreGateway {
    private static final String TABLE_SIZE_SQL = "SELECT pg_total_relation_size(?::regclass)";

    private final DatabaseService databaseService;
    private final String bloatView;

    @Inject
    public JdbcStoreGateway(DatabaseService databaseService, MaintenanceConfig config) {
        this(databaseService, config.vacuum().bloatView());
    }

    JdbcStoreGateway(DatabaseService databaseService, String bloatView) {
        this.databaseService = Objects.requireNonNull(databaseService, "databaseService");
        this.bloatView = quote(bloatView);
    }

    @Override
    public List<String> listBloatedTables() throws SQLException {
        String sql = "SELECT tablename FROM " + bloatView;
        try (Connection conn = databaseService.getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            List<String> tables = new ArrayList<>();
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
            log.info("Found {} bloated tables", tables.size());
            return tables;
        }
    }

    @Override
    public CompactionResult compactTable(String table) throws SQLException {
        String quoted = quote(table);
        try (Connection conn = databaseService.getPooledConnection()) {
            long start = System.nanoTime();
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("VACUUM FULL " + quoted);
            }
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            long sizeAfter = tableSize(conn, quoted);
            log.info("VACUUM FULL completed for table {} in {} ms, size after: {} bytes",
                    table, duration.toMillis(), sizeAfter);
            return new CompactionResult(duration, sizeAfter);
        }
    }

    @Override
    public ReindexResult reindexTable(String table) throws SQLException {
        String quoted = quote(table);
        try (Connection conn = databaseService.getPooledConnection();
             Statement stmt = conn.createStatement()) {
            long start = System.nanoTime();
            stmt.execute("REINDEX TABLE " + quoted);
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            log.info("REINDEX completed for table {} in {} ms", table, duration.toMillis());
            return new ReindexResult(duration);
        }
    }

    @Override
    public long tableSize(String table) throws SQLException {
        String quoted = quote(table);
        try (Connection conn = databaseService.getPooledConnection()) {
            return tableSize(conn, quoted);
        }
    }

    @Override
    public long rowCount(CleanupPolicy policy) throws SQLException {
        String sql = "SELECT count(*) FROM " + quote(policy.table());
        try (Connection conn = databaseService.getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    @Override
    public int deleteOldestBatch(CleanupPolicy policy) throws SQLException {
        String sql = buildDeleteBatchSql(policy);
        try (Connection conn = databaseService.getPooledConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, policy.retentionMonths());
            stmt.setInt(2, policy.batchSize());
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} rows from {}", deleted, policy.table());
            return deleted;
        }
    }

    /**
     * Build the batch delete statement. Parameters: retention months, batch size.
     */
    static String buildDeleteBatchSql(CleanupPolicy policy) {
        String table = quote(policy.table());
        String timestamp = quote(policy.timestampColumn());
        String protectedRows = policy.protectingColumn()
                .map(column -> "\n      AND " + quote(column) + " IS NULL")
                .orElse("");
        return """
                DELETE FROM %1$s
                WHERE ctid IN (
                    SELECT ctid
                    FROM %1$s
                    WHERE %2$s < now() - make_interval(months => ?)%3$s
                    ORDER BY %2$s
                    LIMIT ?)""".formatted(table, timestamp, protectedRows);
    }

    private long tableSize(Connection conn, String quotedTable) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(TABLE_SIZE_SQL)) {
            stmt.setString(1, quotedTable);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }
}
