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

import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.ScheduledExecution;
import io.quarkus.scheduler.Scheduler;
import org.greengagedb.maintenance.config.SchedulerConfig;
import org.greengagedb.maintenance.job.InvalidJobConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings({"unchecked", "rawtypes"})
class QuarkusPeriodicTriggerTest {

    @Mock
    private Scheduler scheduler;

    @Mock
    private SchedulerConfig config;

    @Mock
    private ScheduledExecution execution;

    private Scheduler.JobDefinition definition;
    private QuarkusPeriodicTrigger trigger;

    @BeforeEach
    void setUp() {
        definition = mock(Scheduler.JobDefinition.class, RETURNS_SELF);
        lenient().doReturn(definition).when(scheduler).newJob(anyString());
        lenient().when(config.misfireThreshold()).thenReturn(Duration.ofSeconds(60));
        trigger = new QuarkusPeriodicTrigger(scheduler, config);
    }

    @Test
    void testRegister_SetsCronAndVeto() {
        // Setup
        AtomicBoolean vetoed = new AtomicBoolean(true);
        TriggerRegistration registration = new TriggerRegistration(
                "cleanup", "0 0 1 * * ?", Optional.of(vetoed::get), () -> { }, null);

        // Execute
        trigger.register(registration);

        // Verify
        verify(scheduler).newJob("cleanup");
        verify(definition).setCron("0 0 1 * * ?");
        ArgumentCaptor<Scheduled.SkipPredicate> skip = ArgumentCaptor.forClass(Scheduled.SkipPredicate.class);
        verify(definition).setSkipPredicate(skip.capture());
        verify(definition).schedule();
        assertTrue(skip.getValue().test(execution));
        vetoed.set(false);
        assertFalse(skip.getValue().test(execution));
    }

    @Test
    void testRegister_SchedulerRejects_ThrowsConfigurationException() {
        // Setup
        when(definition.schedule()).thenThrow(new IllegalStateException("Invalid cron expression"));
        TriggerRegistration registration = new TriggerRegistration(
                "vacuum", "not a cron", Optional.empty(), () -> { }, null);

        // Execute & Verify
        InvalidJobConfigurationException e =
                assertThrows(InvalidJobConfigurationException.class, () -> trigger.register(registration));
        assertTrue(e.getMessage().contains("not a cron"));
    }

    @Test
    void testFire_OnTime_NoMisfire() {
        // Setup
        AtomicInteger fired = new AtomicInteger();
        List<Duration> misfires = new ArrayList<>();
        Consumer<ScheduledExecution> task = registerAndCaptureTask(fired, misfires);
        when(execution.getScheduledFireTime()).thenReturn(Instant.parse("2024-06-02T03:00:00Z"));
        when(execution.getFireTime()).thenReturn(Instant.parse("2024-06-02T03:00:01Z"));

        // Execute
        task.accept(execution);

        // Verify
        assertEquals(1, fired.get());
        assertTrue(misfires.isEmpty());
    }

    @Test
    void testFire_Late_ReportsMisfireAndStillRuns() {
        // Setup
        AtomicInteger fired = new AtomicInteger();
        List<Duration> misfires = new ArrayList<>();
        Consumer<ScheduledExecution> task = registerAndCaptureTask(fired, misfires);
        when(execution.getScheduledFireTime()).thenReturn(Instant.parse("2024-06-02T03:00:00Z"));
        when(execution.getFireTime()).thenReturn(Instant.parse("2024-06-02T03:05:00Z"));

        // Execute
        task.accept(execution);

        // Verify
        assertEquals(1, fired.get());
        assertEquals(List.of(Duration.ofMinutes(5)), misfires);
    }

    @Test
    void testUnregister_DelegatesToScheduler() {
        trigger.unregister("vacuum");

        verify(scheduler).unscheduleJob("vacuum");
    }

    private Consumer<ScheduledExecution> registerAndCaptureTask(AtomicInteger fired, List<Duration> misfires) {
        trigger.register(new TriggerRegistration(
                "vacuum", "0 0 3 ? * SUN", Optional.empty(), fired::incrementAndGet, misfires::add));
        ArgumentCaptor<Consumer> task = ArgumentCaptor.forClass(Consumer.class);
        verify(definition).setTask(task.capture());
        return task.getValue();
    }
}
