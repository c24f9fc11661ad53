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

/**
 * Operator-facing channel for run status messages.
 *
 * <p>Each run sends one message when it starts and edits it in place with the result.
 * Both calls block until the channel has accepted the message.
 */
public interface Notifier {

    /**
     * Send a new message.
     *
     * @param text Formatted message
     * @return Handle of the sent message
     * @throws NotificationException If the channel rejects the message
     */
    MessageHandle send(String text);

    /**
     * Replace the text of a previously sent message.
     *
     * @param handle Handle returned by {@link #send(String)}
     * @param text   New formatted message
     * @throws NotificationException If the channel rejects the edit
     */
    void edit(MessageHandle handle, String text);
}
