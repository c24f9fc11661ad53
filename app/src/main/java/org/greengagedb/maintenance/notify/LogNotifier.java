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

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Notifier that writes messages to the application log. Used when Telegram is disabled.
 */
@Slf4j
public class LogNotifier implements Notifier {
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public MessageHandle send(String text) {
        MessageHandle handle = new MessageHandle("log-" + sequence.incrementAndGet());
        log.info("[{}] {}", handle, text);
        return handle;
    }

    @Override
    public void edit(MessageHandle handle, String text) {
        log.info("[{}] (edited) {}", handle, text);
    }
}
