package me.golemcore.pilot.adapter.outbound.store;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.Message;
import me.golemcore.pilot.port.outbound.ConversationStorePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Keeps conversations in memory. Each conversation's list is guarded by its own
 * monitor so observers reading {@link #getMessages(String)} never see a
 * half-applied update.
 */
@Component
@Slf4j
public class InMemoryConversationStore implements ConversationStorePort {

    private final Map<String, List<Message>> conversations = new ConcurrentHashMap<>();

    @Override
    public void push(String conversationId, Message message) {
        List<Message> messages = conversations.computeIfAbsent(conversationId, id -> new ArrayList<>());
        synchronized (messages) {
            messages.add(message);
        }
    }

    @Override
    public void updateLast(String conversationId, UnaryOperator<Message> updater) {
        List<Message> messages = conversations.get(conversationId);
        if (messages == null) {
            log.debug("updateLast on unknown conversation {}", conversationId);
            return;
        }
        synchronized (messages) {
            if (messages.isEmpty()) {
                return;
            }
            int last = messages.size() - 1;
            Message updated = updater.apply(messages.get(last));
            if (updated != null) {
                messages.set(last, updated);
            }
        }
    }

    @Override
    public List<Message> getMessages(String conversationId) {
        List<Message> messages = conversations.get(conversationId);
        if (messages == null) {
            return List.of();
        }
        synchronized (messages) {
            return List.copyOf(messages);
        }
    }
}
