package me.golemcore.pilot.tools;

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
import me.golemcore.pilot.domain.component.ToolComponent;
import me.golemcore.pilot.domain.model.Task;
import me.golemcore.pilot.domain.model.TaskStatus;
import me.golemcore.pilot.domain.model.ToolDefinition;
import me.golemcore.pilot.domain.model.ToolFailureKind;
import me.golemcore.pilot.domain.model.ToolResult;
import me.golemcore.pilot.domain.service.TaskBoard;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Exposes the run's {@link TaskBoard} to the model as the {@code update_tasks}
 * action.
 *
 * <p>
 * One instance is created per run and added to that run's registry, so each
 * run (and each retry) starts with an empty board.
 */
@Slf4j
public class TaskBoardTool implements ToolComponent {

    public static final String TOOL_NAME = "update_tasks";

    // JSON Schema constants
    private static final String SCHEMA_TYPE = "type";
    private static final String SCHEMA_OBJECT = "object";
    private static final String SCHEMA_STRING = "string";
    private static final String SCHEMA_PROPERTIES = "properties";
    private static final String SCHEMA_DESCRIPTION = "description";
    private static final String SCHEMA_REQUIRED = "required";

    // Parameter names
    private static final String PARAM_TASKS = "tasks";
    private static final String PARAM_REQUEST_APPROVAL = "requestApproval";
    private static final String PARAM_ID = "id";
    private static final String PARAM_TITLE = "title";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String PARAM_STATUS = "status";

    private final TaskBoard taskBoard;

    public TaskBoardTool(TaskBoard taskBoard) {
        this.taskBoard = taskBoard;
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> taskProperties = new LinkedHashMap<>();
        taskProperties.put(PARAM_ID, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION, "Stable task id"));
        taskProperties.put(PARAM_TITLE, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION, "Short title"));
        taskProperties.put(PARAM_DESCRIPTION, Map.of(SCHEMA_TYPE, SCHEMA_STRING));
        taskProperties.put(PARAM_STATUS, Map.of(
                SCHEMA_TYPE, SCHEMA_STRING,
                "enum", List.of("pending", "in_progress", "completed", "cancelled"),
                SCHEMA_DESCRIPTION, "Only one task may be in_progress at a time"));

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_TASKS, Map.of(
                SCHEMA_TYPE, "array",
                SCHEMA_DESCRIPTION, "Tasks to create or update, merged by id",
                "items", Map.of(
                        SCHEMA_TYPE, SCHEMA_OBJECT,
                        SCHEMA_PROPERTIES, taskProperties,
                        SCHEMA_REQUIRED, List.of(PARAM_ID))));
        properties.put(PARAM_REQUEST_APPROVAL, Map.of(
                SCHEMA_TYPE, "boolean",
                SCHEMA_DESCRIPTION, "Ask the user to approve the task list before continuing"));

        return ToolDefinition.object(TOOL_NAME,
                "Create or update the task list for the current objective. Unspecified fields keep their "
                        + "previous values. Keep exactly one task in_progress while working.",
                properties, List.of(PARAM_TASKS));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object rawTasks = parameters.get(PARAM_TASKS);
        if (!(rawTasks instanceof List<?> items)) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Missing required parameter: tasks"));
        }
        List<Task> updates = new ArrayList<>();
        try {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    updates.add(toTask(map));
                }
            }
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage()));
        }

        boolean requestApproval = Boolean.TRUE.equals(parameters.get(PARAM_REQUEST_APPROVAL));
        TaskBoard.UpsertResult result = taskBoard.upsert(updates, requestApproval);
        log.debug("[TaskBoard] Upserted {} task(s), {} created, {} total", updates.size(), result.created(),
                result.count());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("created", result.created());
        data.put("count", result.count());
        data.put("requiresApproval", result.requiresApproval());
        data.put(PARAM_TASKS, taskBoard.snapshot());

        String output = String.format("Task board updated: %d created, %d total%s", result.created(),
                result.count(), result.requiresApproval() ? " (awaiting approval)" : "");
        return CompletableFuture.completedFuture(ToolResult.success(output, data));
    }

    private static Task toTask(Map<?, ?> map) {
        Object status = map.get(PARAM_STATUS);
        return Task.builder()
                .id(asString(map.get(PARAM_ID)))
                .title(asString(map.get(PARAM_TITLE)))
                .description(asString(map.get(PARAM_DESCRIPTION)))
                .status(status != null ? TaskStatus.fromWire(status.toString()) : null)
                .build();
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
