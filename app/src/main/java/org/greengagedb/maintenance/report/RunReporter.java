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
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.job.MaintenanceJob;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.notify.MessageHandle;
import org.greengagedb.maintenance.notify.NotificationException;
import org.greengagedb.maintenance.notify.Notifier;

import java.util.Objects;

/**
 * Reports the progress of a run through the {@link Notifier}: one message when the run
 * starts, edited in place with the report or the error.
 */
@Slf4j
@ApplicationScoped
public class RunReporter {
    private final Notifier notifier;
    private final ReportFormatter formatter;

    @Inject
    public RunReporter(Notifier notifier, ReportFormatter formatter) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    /**
     * Announce that a run has started.
     *
     * @return Handle the caller must pass to {@link #completed} or {@link #failed}
     * @throws NotificationException If the message cannot be sent
     */
    public MessageHandle started(MaintenanceJob job) {
        MessageHandle handle = notifier.send(formatter.formatStarted(job));
        log.debug("Run of {} announced as message {}", job.getName(), handle);
        return handle;
    }

    /**
     * Replace the start message with the run report.
     *
     * @throws NotificationException If the message cannot be edited
     */
    public void completed(MessageHandle handle, MaintenanceJob job, MaintenanceRun run) {
        notifier.edit(handle, formatter.formatCompleted(job, run));
    }

    /**
     * Replace the start message with an error summary.
     *
     * <p>Without a handle (the start message was never sent) the error is only logged.
     * A failure to edit, of any kind, is attached to {@code error} as suppressed and never replaces it.
     *
     * @param handle Handle of the start message, or {@code null} if there is none
     */
    public void failed(MessageHandle handle, MaintenanceJob job, Throwable error) {
        if (handle == null) {
            log.warn("No message to edit for failed run of {}, error is only logged", job.getName());
            return;
        }
        try {
            notifier.edit(handle, formatter.formatFailed(job, error));
        } catch (RuntimeException e) {
            log.error("Could not report failure of {}: {}", job.getName(), e.getMessage());
            error.addSuppressed(e);
        }
    }
}
