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
package org.greengagedb.maintenance.report;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.greengagedb.maintenance.job.MaintenanceJob;
import org.greengagedb.maintenance.model.CleanupStat;
import org.greengagedb.maintenance.model.CleanupStopReason;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.ReindexStat;
import org.greengagedb.maintenance.model.VacuumStat;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Renders run status messages as Telegram HTML.
 *
 * <p>Formatting only reads the run; the same input always yields the same text.
 */
@ApplicationScoped
public class ReportFormatter {
    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};
    private static final int MIN_TABLE_COLUMN_WIDTH = 12;

    private final Locale locale;

    @Inject
    public ReportFormatter(@ConfigProperty(name = "app.report.locale", defaultValue = "en-US") String locale) {
        this(Locale.forLanguageTag(locale));
    }

    public ReportFormatter(Locale locale) {
        this.locale = locale;
    }

    public String formatStarted(MaintenanceJob job) {
        String title = switch (job.getKind()) {
            case VACUUM -> "⚒️ <b>Starting database maintenance";
            case REINDEX -> "🛠️ <b>Starting REINDEX of database tables";
            case CLEANUP -> "🧹 <b>Starting cleanup";
        };
        StringBuilder message = new StringBuilder(title);
        if (!job.getStartedDetail().isBlank()) {
            message.append(" (").append(escape(job.getStartedDetail())).append(')');
        }
        message.append("</b>");
        appendHashtag(message, job);
        return message.toString();
    }

    public String formatCompleted(MaintenanceJob job, MaintenanceRun run) {
        if (run.isEmpty()) {
            return formatNothingToDo(job);
        }
        StringBuilder message = new StringBuilder();
        message.append(switch (run.kind()) {
            case VACUUM -> "📊 <b>Maintenance Report</b>";
            case REINDEX -> "📊 <b>REINDEX Completed</b>";
            case CLEANUP -> "🧹 <b>Cleanup Completed</b>";
        }).append("\n\n");

        message.append("📈 <b>Summary</b>\n");
        message.append("• Tables: <code>").append(run.tablesProcessed())
                .append("</code>, time: <code>").append(formatSeconds(run.totalElapsed()))
                .append("</code> sec\n");

        switch (run.kind()) {
            case VACUUM -> appendVacuumDetails(message, run.statsOf(VacuumStat.class));
            case REINDEX -> appendReindexDetails(message, run.statsOf(ReindexStat.class));
            case CLEANUP -> appendCleanupDetails(message, run.statsOf(CleanupStat.class));
        }
        appendHashtag(message, job);
        return message.toString();
    }

    public String formatFailed(MaintenanceJob job, Throwable error) {
        String title = switch (job.getKind()) {
            case VACUUM -> "❌ <b>Maintenance error:</b>";
            case REINDEX -> "❌ <b>REINDEX error:</b>";
            case CLEANUP -> "❌ <b>Cleanup error:</b>";
        };
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        StringBuilder message = new StringBuilder(title)
                .append("\n<code>").append(escape(detail)).append("</code>");
        appendHashtag(message, job);
        return message.toString();
    }

    private String formatNothingToDo(MaintenanceJob job) {
        StringBuilder message = new StringBuilder(switch (job.getKind()) {
            case VACUUM -> "🟢 <b>No tables require maintenance</b>";
            case REINDEX -> "🟢 <b>No tables require reindexing</b>";
            case CLEANUP -> "🟢 <b>Nothing to clean up</b>";
        });
        appendHashtag(message, job);
        return message.toString();
    }

    private void appendVacuumDetails(StringBuilder message, List<VacuumStat> stats) {
        long totalFreed = stats.stream().mapToLong(VacuumStat::freed).sum();
        message.append("• Space freed: <code>").append(formatSize(totalFreed)).append("</code>\n\n");

        int width = tableColumnWidth(stats.stream().map(VacuumStat::table).toList());
        String row = "%s %10s %10s %10s\n";
        message.append("📋 <b>Table Details</b>\n\n<pre>\n");
        appendHeader(message, row, tableCell("Table", width), "Before", "After", "Freed");
        for (VacuumStat stat : stats) {
            message.append(row.formatted(tableCell(stat.table(), width),
                    formatSize(stat.sizeBefore()), formatSize(stat.sizeAfter()), formatSize(stat.freed())));
        }
        message.append("</pre>");
    }

    private void appendReindexDetails(StringBuilder message, List<ReindexStat> stats) {
        int width = tableColumnWidth(stats.stream().map(ReindexStat::table).toList());
        String row = "%s %12s\n";
        message.append("\n📋 <b>Table Details</b>\n\n<pre>\n");
        appendHeader(message, row, tableCell("Table", width), "Time");
        for (ReindexStat stat : stats) {
            message.append(row.formatted(tableCell(stat.table(), width), formatSeconds(stat.duration()) + " sec"));
        }
        message.append("</pre>");
    }

    private void appendCleanupDetails(StringBuilder message, List<CleanupStat> stats) {
        String row = "%14s %14s %14s\n";
        for (CleanupStat stat : stats) {
            message.append("• Batches: <code>").append(formatCount(stat.batches()))
                    .append("</code>, stopped: ").append(describe(stat.stopReason())).append("\n\n");
            message.append("<pre>\n");
            appendHeader(message, row, "Rows before", "After", "Deleted");
            message.append(row.formatted(formatCount(stat.rowsBefore()),
                    formatCount(stat.rowsAfter()), formatCount(stat.totalDeleted())));
            message.append("</pre>");
        }
    }

    private void appendHeader(StringBuilder message, String row, Object... columns) {
        String header = row.formatted(columns);
        message.append(header);
        message.append("-".repeat(header.length() - 1)).append('\n');
    }

    private void appendHashtag(StringBuilder message, MaintenanceJob job) {
        job.getHashtag()
                .filter(tag -> !tag.isBlank())
                .ifPresent(tag -> message.append("\n\n#").append(escape(tag.strip())));
    }

    private static String describe(CleanupStopReason reason) {
        return switch (reason) {
            case DRAINED -> "no more eligible rows";
            case WINDOW_CLOSED -> "maintenance window closed";
        };
    }

    /**
     * Left-align a table name in a column of {@code width} characters. Padding is computed on
     * the raw name so escaped entities keep the rendered column aligned.
     */
    private static String tableCell(String table, int width) {
        return escape(table) + " ".repeat(Math.max(0, width - table.length()));
    }

    private static int tableColumnWidth(List<String> tables) {
        return Math.max(MIN_TABLE_COLUMN_WIDTH, tables.stream().mapToInt(String::length).max().orElse(0));
    }

    /**
     * Format a byte count in human units, dividing by 1024 while the magnitude is at least 1024.
     * Negative values keep their sign.
     *
     * @param bytes Byte count
     * @return Size such as {@code 512.00KB}
     */
    public static String formatSize(long bytes) {
        double size = bytes;
        int order = 0;
        while (Math.abs(size) >= 1024 && order < SIZE_UNITS.length - 1) {
            order++;
            size /= 1024;
        }
        return String.format(Locale.ROOT, "%.2f%s", size, SIZE_UNITS[order]);
    }

    public static String formatSeconds(Duration duration) {
        return String.format(Locale.ROOT, "%.2f", duration.toNanos() / 1_000_000_000.0);
    }

    /**
     * Format a row count with the grouping separators of the configured locale.
     */
    public String formatCount(long count) {
        return NumberFormat.getIntegerInstance(locale).format(count);
    }

    static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
