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
package org.greengagedb.maintenance.notify;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.maintenance.config.TelegramConfig;

/**
 * Selects the notifier used for run reports.
 */
@Slf4j
@ApplicationScoped
public class NotifierProducer {

    @Produces
    @ApplicationScoped
    Notifier notifier(TelegramConfig config, Instance<TelegramNotifier> telegramNotifier) {
        if (!config.enabled()) {
            log.info("Telegram notifications disabled, run reports are written to the log");
            return new LogNotifier();
        }
        if (config.botToken().isEmpty() || config.chatId().isEmpty()) {
            throw new IllegalStateException(
                    "app.telegram.enabled is set but app.telegram.bot-token or app.telegram.chat-id is missing");
        }
        log.info("Run reports are sent to Telegram chat {}", config.chatId().get());
        return telegramNotifier.get();
    }
}
