package me.golemcore.pilot.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pilot.domain.model.Message;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * User-visible conversation. Both operations must return without external
 * latency; the tool loop calls {@link #updateLast} once per turn.
 */
public interface ConversationStorePort {

    /**
     * Appends a message to the conversation.
     */
    void push(String conversationId, Message message);

    /**
     * Replaces the most recent message with {@code updater.apply(last)}. Does
     * nothing when the conversation is empty. Applying an identity updater
     * leaves the conversation unchanged.
     */
    void updateLast(String conversationId, UnaryOperator<Message> updater);

    List<Message> getMessages(String conversationId);
}
