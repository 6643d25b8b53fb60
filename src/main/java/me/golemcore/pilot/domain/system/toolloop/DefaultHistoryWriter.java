package me.golemcore.pilot.domain.system.toolloop;

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

import me.golemcore.pilot.domain.model.ActionCall;
import me.golemcore.pilot.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendUserMessage(List<Message> transcript, String content) {
        transcript.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_USER)
                .content(content)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendAssistantToolCalls(List<Message> transcript, String text, List<ActionCall> calls) {
        List<Message.ToolCall> toolCalls = new ArrayList<>(calls.size());
        for (ActionCall call : calls) {
            toolCalls.add(Message.ToolCall.builder()
                    .id(call.id())
                    .name(call.name())
                    .arguments(call.args())
                    .build());
        }
        transcript.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(text != null && !text.isBlank() ? text : null)
                .toolCalls(toolCalls)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(List<Message> transcript, ToolExecutionOutcome outcome) {
        transcript.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(List<Message> transcript, String finalText) {
        transcript.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
