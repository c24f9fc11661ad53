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
package org.greengagedb.maintenance.bootstrap;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.config.SchedulerConfig;
import org.greengagedb.maintenance.config.TelegramConfig;
import org.greengagedb.maintenance.db.DatabaseService;
import org.greengagedb.maintenance.scheduler.MaintenanceScheduler;

/**
 * Application lifecycle bean that starts the maintenance scheduler on startup
 * and stops it on shutdown.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Startup: print banner, log configuration, register jobs</li>
 *   <li>Runtime: jobs fire on their cron schedules</li>
 *   <li>Shutdown: unregister triggers, wait for in-flight runs</li>
 * </ol>
 */
@Slf4j
@ApplicationScoped
public class MaintenanceApp {
    private final DatabaseService databaseService;
    private final MaintenanceScheduler scheduler;
    private final SchedulerConfig schedulerConfig;
    private final TelegramConfig telegramConfig;
    private final Banners banner;

    @Inject
    public MaintenanceApp(DatabaseService databaseService,
                          MaintenanceScheduler scheduler,
                          SchedulerConfig schedulerConfig,
                          TelegramConfig telegramConfig,
                          Banners banner) {
        this.databaseService = databaseService;
        this.scheduler = scheduler;
        this.schedulerConfig = schedulerConfig;
        this.telegramConfig = telegramConfig;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();
        logConfiguration();
        if (!databaseService.testConnection()) {
            log.warn("Database is not reachable on startup, jobs will fail until it is back");
        }
        scheduler.start();
        banner.printFooter(scheduler.getScheduledJobs());
    }

    void onShutdown(@Observes ShutdownEvent event) {
        banner.printShutdown();
        scheduler.stop();
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Max concurrency:        {}", schedulerConfig.maxConcurrency());
        log.info("  Misfire threshold:      {}", schedulerConfig.misfireThreshold());
        log.info("  Telegram reports:       {}", telegramConfig.enabled() ? "enabled" : "disabled");
        log.info("  Database URL:           {}", maskSensitiveInfo(databaseService.getUrl()));
    }

    /**
     * Mask the password in a connection string.
     *
     * @param url Database connection URL
     * @return Masked URL
     */
    static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("password=[^&\\s]+", "password=***")
                .replaceAll(":[^:/@]+@", ":***@");
    }
}
