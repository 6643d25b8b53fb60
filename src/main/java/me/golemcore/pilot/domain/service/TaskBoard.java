package me.golemcore.pilot.domain.service;

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
import me.golemcore.pilot.domain.model.Task;
import me.golemcore.pilot.domain.model.TaskStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run task list maintained by the model through the task board action.
 *
 * <p>
 * Updates merge by id: fields left null in an update keep their current value.
 * After every update at most one task is {@code in_progress}; scanning in board
 * order, every later {@code in_progress} entry is demoted to {@code pending}.
 * A board is owned by one run and is not shared across threads.
 */
@Slf4j
public class TaskBoard {

    private final Map<String, Task> tasks = new LinkedHashMap<>();

    public UpsertResult upsert(List<Task> updates, boolean requestApproval) {
        int created = 0;
        if (updates != null) {
            for (Task update : updates) {
                if (update == null || update.getId() == null || update.getId().isBlank()) {
                    continue;
                }
                Task existing = tasks.get(update.getId());
                if (existing == null) {
                    tasks.put(update.getId(), newTask(update));
                    created++;
                } else {
                    tasks.put(update.getId(), merge(existing, update));
                }
            }
        }
        int demoted = enforceSingleInProgress();
        if (demoted > 0) {
            log.debug("[TaskBoard] Demoted {} extra in_progress task(s) to pending", demoted);
        }
        return new UpsertResult(created, tasks.size(), requestApproval);
    }

    /**
     * Returns copies of the current tasks in board order.
     */
    public List<Task> snapshot() {
        List<Task> copy = new ArrayList<>(tasks.size());
        for (Task task : tasks.values()) {
            copy.add(task.toBuilder().build());
        }
        return copy;
    }

    public Stats stats() {
        int pending = 0;
        int inProgress = 0;
        int completed = 0;
        int cancelled = 0;
        for (Task task : tasks.values()) {
            switch (task.getStatus()) {
            case PENDING -> pending++;
            case IN_PROGRESS -> inProgress++;
            case COMPLETED -> completed++;
            case CANCELLED -> cancelled++;
            }
        }
        return new Stats(tasks.size(), pending, inProgress, completed, cancelled);
    }

    private static Task newTask(Task update) {
        return Task.builder()
                .id(update.getId())
                .title(update.getTitle() != null ? update.getTitle() : update.getId())
                .description(update.getDescription())
                .status(update.getStatus() != null ? update.getStatus() : TaskStatus.PENDING)
                .build();
    }

    private static Task merge(Task existing, Task update) {
        return existing.toBuilder()
                .title(update.getTitle() != null ? update.getTitle() : existing.getTitle())
                .description(update.getDescription() != null ? update.getDescription() : existing.getDescription())
                .status(update.getStatus() != null ? update.getStatus() : existing.getStatus())
                .build();
    }

    private int enforceSingleInProgress() {
        boolean seen = false;
        int demoted = 0;
        for (Map.Entry<String, Task> entry : tasks.entrySet()) {
            if (entry.getValue().getStatus() != TaskStatus.IN_PROGRESS) {
                continue;
            }
            if (!seen) {
                seen = true;
                continue;
            }
            entry.setValue(entry.getValue().toBuilder().status(TaskStatus.PENDING).build());
            demoted++;
        }
        return demoted;
    }

    /**
     * @param created
     *            tasks added by this update
     * @param count
     *            tasks on the board after the update
     * @param requiresApproval
     *            echo of the approval request flag
     */
    public record UpsertResult(int created, int count, boolean requiresApproval) {
    }

    public record Stats(int total, int pending, int inProgress, int completed, int cancelled) {
    }
}
