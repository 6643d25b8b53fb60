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

import java.util.Map;

/**
 * One event of a model response stream. Which fields are set depends on
 * {@link #type()}.
 */
public record LlmEvent(
        LlmEventType type,
        String text,
        String callId,
        String toolName,
        Map<String, Object> arguments,
        String finishReason,
        LlmUsage usage) {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_LENGTH = "length";
    public static final String FINISH_TOOL_CALLS = "tool_calls";
    public static final String FINISH_CONTENT_FILTER = "content_filter";

    public static LlmEvent textDelta(String text) {
        return new LlmEvent(LlmEventType.TEXT_DELTA, text, null, null, null, null, null);
    }

    public static LlmEvent callStreaming(String callId, String toolName) {
        return new LlmEvent(LlmEventType.CALL_STREAMING, null, callId, toolName, null, null, null);
    }

    public static LlmEvent callEmitted(String callId, String toolName, Map<String, Object> arguments) {
        return new LlmEvent(LlmEventType.CALL_EMITTED, null, callId, toolName, arguments, null, null);
    }

    public static LlmEvent finish(String finishReason, LlmUsage usage) {
        return new LlmEvent(LlmEventType.FINISH, null, null, null, null, finishReason, usage);
    }
}
