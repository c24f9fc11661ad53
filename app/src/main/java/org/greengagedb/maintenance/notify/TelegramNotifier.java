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
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.greengagedb.maintenance.config.TelegramConfig;

import java.time.temporal.ChronoUnit;

/**
 * Sends run reports to a Telegram chat using HTML formatting.
 *
 * <p>Message handles carry the Telegram message id; the chat is fixed by configuration.
 */
@Slf4j
@ApplicationScoped
@Typed(TelegramNotifier.class)
public class TelegramNotifier implements Notifier {
    static final String PARSE_MODE = "HTML";

    private final TelegramBotClient client;
    private final TelegramConfig config;

    @Inject
    public TelegramNotifier(@RestClient TelegramBotClient client, TelegramConfig config) {
        this.client = client;
        this.config = config;
    }

    @Override
    @Timeout(value = 10, unit = ChronoUnit.SECONDS)
    public MessageHandle send(String text) {
        TelegramBotClient.TelegramResponse response;
        try {
            response = client.sendMessage(botToken(), new TelegramBotClient.SendMessageRequest(
                    chatId(), text, PARSE_MODE, config.disableNotification()));
        } catch (RuntimeException e) {
            log.error("Error sending message to Telegram: {}", e.getMessage());
            throw new NotificationException("Error sending message to Telegram", e);
        }
        if (response == null || !response.ok() || response.result() == null) {
            String description = response == null ? "empty response" : response.description();
            log.error("Telegram rejected message: {}", description);
            throw new NotificationException("Telegram rejected message: " + description);
        }
        log.debug("Message {} sent to Telegram", response.result().messageId());
        return new MessageHandle(String.valueOf(response.result().messageId()));
    }

    @Override
    @Timeout(value = 10, unit = ChronoUnit.SECONDS)
    public void edit(MessageHandle handle, String text) {
        long messageId = parseMessageId(handle);
        TelegramBotClient.TelegramResponse response;
        try {
            response = client.editMessageText(botToken(), new TelegramBotClient.EditMessageRequest(
                    chatId(), messageId, text, PARSE_MODE));
        } catch (RuntimeException e) {
            log.error("Error editing Telegram message {}: {}", messageId, e.getMessage());
            throw new NotificationException("Error editing Telegram message " + messageId, e);
        }
        if (response == null || !response.ok()) {
            String description = response == null ? "empty response" : response.description();
            log.error("Telegram rejected edit of message {}: {}", messageId, description);
            throw new NotificationException("Telegram rejected edit of message " + messageId + ": " + description);
        }
        log.debug("Message {} edited in Telegram", messageId);
    }

    private long parseMessageId(MessageHandle handle) {
        try {
            return Long.parseLong(handle.value());
        } catch (NumberFormatException e) {
            throw new NotificationException("Not a Telegram message handle: " + handle, e);
        }
    }

    private String botToken() {
        return config.botToken()
                .orElseThrow(() -> new NotificationException("app.telegram.bot-token is not configured"));
    }

    private String chatId() {
        return config.chatId()
                .orElseThrow(() -> new NotificationException("app.telegram.chat-id is not configured"));
    }
}
