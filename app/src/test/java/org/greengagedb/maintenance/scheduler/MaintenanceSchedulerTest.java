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
package org.greengagedb.maintenance.scheduler;

import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.greengagedb.maintenance.config.SchedulerConfig;
import org.greengagedb.maintenance.job.FakeJob;
import org.greengagedb.maintenance.job.InvalidJobConfigurationException;
import org.greengagedb.maintenance.job.JobRunner;
import org.greengagedb.maintenance.job.MaintenanceJob;
import org.greengagedb.maintenance.job.MaintenanceJobException;
import org.greengagedb.maintenance.model.JobKind;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.TimeWindow;
import org.greengagedb.maintenance.notify.LogNotifier;
import org.greengagedb.maintenance.notify.MessageHandle;
import org.greengagedb.maintenance.notify.Notifier;
import org.greengagedb.maintenance.report.ReportFormatter;
import org.greengagedb.maintenance.report.RunReporter;
import org.greengagedb.maintenance.window.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

    private static final TimeWindow WINDOW = TimeWindow.parse("01:00", "05:00");

    @Mock
    private JobExecutionListener listener;

    @Mock
    private SchedulerConfig config;

    @Mock
    private Notifier notifier;

    private final JobRunner runner =
            new JobRunner(new RunReporter(new LogNotifier(), new ReportFormatter(Locale.US)));
    private final MutableClock clock = MutableClock.at("2024-06-01T02:00:00Z");
    private RecordingTrigger trigger;
    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        lenient().when(config.maxConcurrency()).thenReturn(2);
        lenient().when(config.shutdownTimeout()).thenReturn(Duration.ofSeconds(5));
        trigger = new RecordingTrigger();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    private MaintenanceScheduler scheduler(MaintenanceJob... jobs) {
        scheduler = new MaintenanceScheduler(List.of(jobs), trigger, runner, listener, config, clock);
        return scheduler;
    }

    private static FakeJob cleanupJob() {
        return new FakeJob("cleanup", JobKind.CLEANUP, Optional.of(WINDOW))
                .body(() -> MaintenanceRun.empty(JobKind.CLEANUP, Instant.EPOCH, Duration.ZERO));
    }

    private static FakeJob vacuumJob() {
        return new FakeJob(JobKind.VACUUM)
                .body(() -> MaintenanceRun.empty(JobKind.VACUUM, Instant.EPOCH, Duration.ZERO));
    }

    @Test
    void testStart_OnlyWindowedJobGetsVeto() {
        // Setup
        scheduler(vacuumJob(), new FakeJob(JobKind.REINDEX), cleanupJob());

        // Execute
        scheduler.start();

        // Verify
        assertEquals(Set.of("vacuum", "reindex", "cleanup"), scheduler.getScheduledJobs());
        assertTrue(trigger.get("vacuum").veto().isEmpty());
        assertTrue(trigger.get("reindex").veto().isEmpty());
        assertTrue(trigger.get("cleanup").veto().isPresent());
        assertEquals(Optional.of(RunState.SCHEDULED), scheduler.getState("cleanup"));
    }

    @Test
    void testStart_DisabledAndInvalidJobsSkipped() {
        // Setup
        FakeJob invalid = new FakeJob(JobKind.CLEANUP)
                .failDescribe(new InvalidJobConfigurationException("Invalid window start time '25:00'"));
        scheduler(vacuumJob().disabled(), invalid, new FakeJob(JobKind.REINDEX));

        // Execute
        scheduler.start();

        // Verify
        assertEquals(Set.of("reindex"), trigger.ids());
        assertTrue(scheduler.getState("vacuum").isEmpty());
        assertTrue(scheduler.getState("cleanup").isEmpty());
    }

    @Test
    void testStart_RejectedCronOnlyAffectsThatJob() {
        // Setup
        trigger = new RecordingTrigger("vacuum");
        scheduler(vacuumJob(), cleanupJob());

        // Execute
        scheduler.start();

        // Verify
        assertEquals(Set.of("cleanup"), scheduler.getScheduledJobs());
    }

    @Test
    void testStart_Twice_ThrowsException() {
        scheduler(vacuumJob());
        scheduler.start();

        assertThrows(IllegalStateException.class, () -> scheduler.start());
    }

    @Test
    void testFire_OutsideWindow_Vetoed() {
        // Setup
        clock.set(Instant.parse("2024-06-01T05:00:00Z"));
        scheduler(cleanupJob());
        scheduler.start();

        // Execute
        boolean fired = trigger.fire("cleanup");

        // Verify
        assertFalse(fired);
        assertEquals(Optional.of(RunState.VETOED), scheduler.getState("cleanup"));
        verify(listener).onVetoed("cleanup", LocalTime.of(5, 0), WINDOW);
        verify(listener, never()).onCompleted(anyString(), any());
    }

    @Test
    void testFire_InsideWindow_RunsJob() {
        // Setup
        scheduler(cleanupJob());
        scheduler.start();

        // Execute
        boolean fired = trigger.fire("cleanup");
        scheduler.stop();

        // Verify
        assertTrue(fired);
        verify(listener).onCompleted(eq("cleanup"), any(MaintenanceRun.class));
        verify(listener, never()).onVetoed(anyString(), any(), any());
        assertEquals(Optional.of(RunState.COMPLETED), scheduler.getState("cleanup"));
        assertEquals(List.of("cleanup"), trigger.unregistered());
    }

    @Test
    void testFire_JobFails_ReportedToListener() {
        // Setup
        FakeJob failing = new FakeJob(JobKind.REINDEX).body(() -> {
            throw new SQLException("deadlock detected");
        });
        scheduler(failing);
        scheduler.start();

        // Execute
        trigger.fire("reindex");
        scheduler.stop();

        // Verify
        ArgumentCaptor<MaintenanceJobException> error = ArgumentCaptor.forClass(MaintenanceJobException.class);
        verify(listener).onFailed(eq("reindex"), error.capture());
        assertEquals("deadlock detected", error.getValue().getCause().getMessage());
        assertEquals(Optional.of(RunState.FAILED), scheduler.getState("reindex"));
    }

    @Test
    void testFire_JobFailsAndReportTimesOut_StateIsFailed() {
        // Setup
        when(notifier.send(anyString())).thenReturn(new MessageHandle("11"));
        doThrow(new TimeoutException("edit timed out")).when(notifier).edit(any(), anyString());
        JobRunner telegramRunner = new JobRunner(new RunReporter(notifier, new ReportFormatter(Locale.US)));
        FakeJob failing = new FakeJob("cleanup", JobKind.CLEANUP, Optional.of(WINDOW)).body(() -> {
            throw new SQLException("deadlock detected");
        });
        scheduler = new MaintenanceScheduler(List.of(failing), trigger, telegramRunner, listener, config, clock);
        scheduler.start();

        // Execute
        trigger.fire("cleanup");
        scheduler.stop();

        // Verify
        ArgumentCaptor<MaintenanceJobException> error = ArgumentCaptor.forClass(MaintenanceJobException.class);
        verify(listener).onFailed(eq("cleanup"), error.capture());
        assertEquals("deadlock detected", error.getValue().getCause().getMessage());
        assertEquals(Optional.of(RunState.FAILED), scheduler.getState("cleanup"));
    }

    @Test
    void testMisfire_ForwardedToListener() {
        // Setup
        scheduler(vacuumJob());
        scheduler.start();

        // Execute
        trigger.get("vacuum").onMisfire().accept(Duration.ofMinutes(3));

        // Verify
        verify(listener).onMisfire("vacuum", Duration.ofMinutes(3));
    }

    @Test
    void testSubmit_AfterStop_Ignored() {
        // Setup
        FakeJob job = vacuumJob();
        scheduler(job);
        scheduler.start();
        scheduler.stop();

        // Execute
        scheduler.submit(job);

        // Verify
        verifyNoInteractions(listener);
    }
}
