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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Telegram Bot API endpoints used for run reports.
 */
@RegisterRestClient(configKey = "telegram")
@Path("/bot{token}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface TelegramBotClient {

    @POST
    @Path("/sendMessage")
    TelegramResponse sendMessage(@PathParam("token") String token, SendMessageRequest request);

    @POST
    @Path("/editMessageText")
    TelegramResponse editMessageText(@PathParam("token") String token, EditMessageRequest request);

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SendMessageRequest(@JsonProperty("chat_id") String chatId,
                              @JsonProperty("text") String text,
                              @JsonProperty("parse_mode") String parseMode,
                              @JsonProperty("disable_notification") boolean disableNotification) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EditMessageRequest(@JsonProperty("chat_id") String chatId,
                              @JsonProperty("message_id") long messageId,
                              @JsonProperty("text") String text,
                              @JsonProperty("parse_mode") String parseMode) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TelegramResponse(@JsonProperty("ok") boolean ok,
                            @JsonProperty("result") Message result,
                            @JsonProperty("description") String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(@JsonProperty("message_id") long messageId) {
    }
}
