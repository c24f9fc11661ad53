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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.config.SchedulerConfig;
import org.greengagedb.maintenance.job.InvalidJobConfigurationException;
import org.greengagedb.maintenance.job.JobRunner;
import org.greengagedb.maintenance.job.MaintenanceJob;
import org.greengagedb.maintenance.job.MaintenanceJobException;
import org.greengagedb.maintenance.model.JobDescriptor;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.window.WindowGate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Registers maintenance jobs on the periodic trigger and runs their firings on a bounded
 * worker pool.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>{@link #start()}: create the worker pool, register every enabled and valid job</li>
 *   <li>Firing: evaluate the window veto (jobs with a window only), then submit the run</li>
 *   <li>{@link #stop()}: unregister triggers, let in-flight runs finish</li>
 * </ol>
 *
 * <p>Outcomes are routed to the {@link JobExecutionListener}. A job with an unusable
 * configuration is logged and left out; the other jobs are scheduled normally.
 */
@Slf4j
@ApplicationScoped
public class MaintenanceScheduler {
    private final List<MaintenanceJob> jobs;
    private final PeriodicTrigger trigger;
    private final JobRunner runner;
    private final JobExecutionListener listener;
    private final SchedulerConfig config;
    private final Clock clock;

    private final Map<String, RunState> states = new ConcurrentHashMap<>();
    private final Set<String> registered = ConcurrentHashMap.newKeySet();
    private volatile ExecutorService workers;

    @Inject
    public MaintenanceScheduler(Instance<MaintenanceJob> jobs,
                                PeriodicTrigger trigger,
                                JobRunner runner,
                                JobExecutionListener listener,
                                SchedulerConfig config,
                                Clock clock) {
        this(jobs.stream().toList(), trigger, runner, listener, config, clock);
    }

    MaintenanceScheduler(List<MaintenanceJob> jobs,
                         PeriodicTrigger trigger,
                         JobRunner runner,
                         JobExecutionListener listener,
                         SchedulerConfig config,
                         Clock clock) {
        this.jobs = List.copyOf(jobs);
        this.trigger = trigger;
        this.runner = runner;
        this.listener = listener;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Create the worker pool and register all enabled jobs.
     *
     * @throws IllegalStateException If the scheduler is already running
     */
    public synchronized void start() {
        if (workers != null) {
            throw new IllegalStateException("Maintenance scheduler is already running");
        }
        workers = Executors.newFixedThreadPool(config.maxConcurrency(), new WorkerThreadFactory());
        for (MaintenanceJob job : jobs) {
            schedule(job);
        }
        log.info("Maintenance scheduler started: {} of {} jobs scheduled, max concurrency {}",
                registered.size(), jobs.size(), config.maxConcurrency());
    }

    /**
     * Unregister all triggers and wait for in-flight runs to finish.
     *
     * <p>Running store calls are never interrupted; if they outlast
     * {@code app.scheduler.shutdown-timeout} a warning is logged and they keep running.
     */
    public synchronized void stop() {
        registered.forEach(trigger::unregister);
        registered.clear();

        ExecutorService pool = workers;
        if (pool == null) {
            return;
        }
        workers = null;
        pool.shutdown();
        Duration timeout = config.shutdownTimeout();
        try {
            if (!pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Maintenance runs still in progress after {}, not waiting any longer", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for maintenance runs to finish");
        }
        log.info("Maintenance scheduler stopped");
    }

    /**
     * @return State of the latest firing of a job, empty if the job is not scheduled
     */
    public Optional<RunState> getState(String jobId) {
        return Optional.ofNullable(states.get(jobId));
    }

    /**
     * @return Identities of the jobs currently registered on the trigger
     */
    public Set<String> getScheduledJobs() {
        return Set.copyOf(registered);
    }

    private void schedule(MaintenanceJob job) {
        JobDescriptor descriptor;
        try {
            descriptor = job.describe();
        } catch (InvalidJobConfigurationException e) {
            log.error("Job {} is not scheduled, invalid configuration: {}", job.getName(), e.getMessage());
            return;
        }
        if (!descriptor.enabled()) {
            log.info("{} job is disabled", descriptor.id());
            return;
        }

        String jobId = descriptor.id();
        Optional<BooleanSupplier> veto = descriptor.window()
                .map(window -> vetoOutsideWindow(jobId, new WindowGate(window, clock)));
        TriggerRegistration registration = new TriggerRegistration(
                jobId,
                descriptor.cronExpression(),
                veto,
                () -> submit(job),
                lateness -> listener.onMisfire(jobId, lateness));
        try {
            trigger.register(registration);
        } catch (InvalidJobConfigurationException e) {
            log.error("Job {} is not scheduled: {}", jobId, e.getMessage());
            return;
        }
        registered.add(jobId);
        states.put(jobId, RunState.SCHEDULED);
        log.info("{} job scheduled: {}{}", jobId, descriptor.cronExpression(),
                descriptor.window().map(window -> ", window " + window + " UTC").orElse(""));
    }

    private BooleanSupplier vetoOutsideWindow(String jobId, WindowGate gate) {
        return () -> {
            if (gate.isOpen()) {
                return false;
            }
            states.put(jobId, RunState.VETOED);
            listener.onVetoed(jobId, gate.now(), gate.getWindow());
            return true;
        };
    }

    void submit(MaintenanceJob job) {
        ExecutorService pool = workers;
        if (pool == null) {
            log.warn("Maintenance scheduler is stopped, ignoring firing of {}", job.getName());
            return;
        }
        try {
            pool.execute(() -> execute(job));
        } catch (RejectedExecutionException e) {
            log.warn("Maintenance scheduler is shutting down, ignoring firing of {}", job.getName());
        }
    }

    private void execute(MaintenanceJob job) {
        String jobId = job.getName();
        states.put(jobId, RunState.EXECUTING);
        try {
            MaintenanceRun run = runner.run(job);
            states.put(jobId, RunState.COMPLETED);
            listener.onCompleted(jobId, run);
        } catch (MaintenanceJobException e) {
            states.put(jobId, RunState.FAILED);
            listener.onFailed(jobId, e);
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "maintenance-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
