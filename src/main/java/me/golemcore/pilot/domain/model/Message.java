package me.golemcore.pilot.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single message in a run transcript or in the user-visible conversation.
 *
 * <p>
 * Transcript messages carry {@code toolCalls} / {@code toolCallId} so they can
 * be replayed to the model. The live assistant message in the conversation
 * store additionally carries the rendered action call timeline
 * ({@code toolExecutions}) and the task board snapshot ({@code tasks}).
 */
@Data
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // user, assistant, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private List<ActionCallView> toolExecutions;
    private List<Task> tasks;

    private Map<String, Object> metadata;
    private Instant timestamp;

    public static Message user(String content) {
        return Message.builder()
                .role(ROLE_USER)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public static Message assistant(String content) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and JSON arguments.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
