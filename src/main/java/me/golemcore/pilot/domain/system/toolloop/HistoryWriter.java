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

import java.util.List;

/**
 * Appends model turns and action results to the transcript replayed to the
 * model on the next turn.
 */
public interface HistoryWriter {

    void appendUserMessage(List<Message> transcript, String content);

    void appendAssistantToolCalls(List<Message> transcript, String text, List<ActionCall> calls);

    void appendToolResult(List<Message> transcript, ToolExecutionOutcome outcome);

    void appendFinalAssistantAnswer(List<Message> transcript, String finalText);
}
