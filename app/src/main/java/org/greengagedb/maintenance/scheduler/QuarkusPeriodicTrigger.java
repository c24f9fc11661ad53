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

import io.quarkus.scheduler.ScheduledExecution;
import io.quarkus.scheduler.Scheduler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.config.SchedulerConfig;
import org.greengagedb.maintenance.job.InvalidJobConfigurationException;

import java.time.Duration;

/**
 * {@link PeriodicTrigger} backed by programmatic Quarkus scheduler jobs.
 *
 * <p>The veto becomes the job's skip predicate. A firing whose actual fire time lags the
 * scheduled one by more than {@code app.scheduler.misfire-threshold} is reported as a misfire
 * and still executed.
 */
@Slf4j
@ApplicationScoped
public class QuarkusPeriodicTrigger implements PeriodicTrigger {
    private final Scheduler scheduler;
    private final SchedulerConfig config;

    @Inject
    public QuarkusPeriodicTrigger(Scheduler scheduler, SchedulerConfig config) {
        this.scheduler = scheduler;
        this.config = config;
    }

    @Override
    public void register(TriggerRegistration registration) {
        try {
            scheduler.newJob(registration.id())
                    .setCron(registration.cron())
                    .setSkipPredicate(execution -> registration.isVetoed())
                    .setTask(execution -> fire(registration, execution))
                    .schedule();
        } catch (RuntimeException e) {
            throw new InvalidJobConfigurationException(
                    "Cannot schedule '%s' with cron '%s': %s".formatted(registration.id(), registration.cron(), e.getMessage()), e);
        }
        log.debug("Registered trigger {} with cron {}", registration.id(), registration.cron());
    }

    @Override
    public void unregister(String id) {
        if (scheduler.unscheduleJob(id) != null) {
            log.debug("Unregistered trigger {}", id);
        }
    }

    private void fire(TriggerRegistration registration, ScheduledExecution execution) {
        Duration lateness = Duration.between(execution.getScheduledFireTime(), execution.getFireTime());
        if (lateness.compareTo(config.misfireThreshold()) > 0) {
            registration.onMisfire().accept(lateness);
        }
        registration.onFire().run();
    }
}
