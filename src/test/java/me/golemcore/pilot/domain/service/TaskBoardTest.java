package me.golemcore.pilot.domain.service;

import me.golemcore.pilot.domain.model.Task;
import me.golemcore.pilot.domain.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskBoardTest {

    private TaskBoard board;

    @BeforeEach
    void setUp() {
        board = new TaskBoard();
    }

    private static Task task(String id, String title, TaskStatus status) {
        return Task.builder().id(id).title(title).status(status).build();
    }

    // ==================== upsert ====================

    @Test
    void shouldCreateTasksWithDefaults() {
        TaskBoard.UpsertResult result = board.upsert(List.of(Task.builder().id("a").build()), false);

        assertEquals(1, result.created());
        assertEquals(1, result.count());
        assertFalse(result.requiresApproval());
        Task created = board.snapshot().get(0);
        assertEquals("a", created.getTitle());
        assertEquals(TaskStatus.PENDING, created.getStatus());
        assertNull(created.getDescription());
    }

    @Test
    void shouldMergeByIdKeepingUnspecifiedFields() {
        board.upsert(List.of(Task.builder().id("a").title("Open site").description("home page")
                .status(TaskStatus.PENDING).build()), false);

        TaskBoard.UpsertResult result = board.upsert(List.of(Task.builder().id("a")
                .status(TaskStatus.COMPLETED).build()), false);

        assertEquals(0, result.created());
        Task merged = board.snapshot().get(0);
        assertEquals("Open site", merged.getTitle());
        assertEquals("home page", merged.getDescription());
        assertEquals(TaskStatus.COMPLETED, merged.getStatus());
    }

    @Test
    void shouldIgnoreUpdatesWithoutId() {
        List<Task> updates = new ArrayList<>();
        updates.add(Task.builder().title("no id").build());
        updates.add(null);
        updates.add(Task.builder().id(" ").build());

        TaskBoard.UpsertResult result = board.upsert(updates, true);

        assertEquals(0, result.created());
        assertEquals(0, result.count());
        assertTrue(result.requiresApproval());
    }

    @Test
    void shouldKeepOnlyFirstInProgressTask() {
        board.upsert(List.of(
                task("a", "A", TaskStatus.IN_PROGRESS),
                task("b", "B", TaskStatus.IN_PROGRESS),
                task("c", "C", TaskStatus.IN_PROGRESS)), false);

        List<Task> snapshot = board.snapshot();
        assertEquals(TaskStatus.IN_PROGRESS, snapshot.get(0).getStatus());
        assertEquals(TaskStatus.PENDING, snapshot.get(1).getStatus());
        assertEquals(TaskStatus.PENDING, snapshot.get(2).getStatus());
    }

    @Test
    void shouldDemoteLaterTaskInBoardOrder() {
        board.upsert(List.of(task("a", "A", TaskStatus.PENDING), task("b", "B", TaskStatus.IN_PROGRESS)), false);

        board.upsert(List.of(task("a", null, TaskStatus.IN_PROGRESS)), false);

        List<Task> snapshot = board.snapshot();
        assertEquals(TaskStatus.IN_PROGRESS, snapshot.get(0).getStatus());
        assertEquals(TaskStatus.PENDING, snapshot.get(1).getStatus());
    }

    // ==================== snapshot & stats ====================

    @Test
    void shouldReturnDetachedSnapshot() {
        board.upsert(List.of(task("a", "A", TaskStatus.PENDING)), false);

        board.snapshot().get(0).setStatus(TaskStatus.CANCELLED);

        assertEquals(TaskStatus.PENDING, board.snapshot().get(0).getStatus());
    }

    @Test
    void shouldCountTasksByStatus() {
        board.upsert(List.of(
                task("a", "A", TaskStatus.COMPLETED),
                task("b", "B", TaskStatus.IN_PROGRESS),
                task("c", "C", TaskStatus.PENDING),
                task("d", "D", TaskStatus.CANCELLED),
                task("e", "E", TaskStatus.COMPLETED)), false);

        TaskBoard.Stats stats = board.stats();

        assertEquals(5, stats.total());
        assertEquals(1, stats.pending());
        assertEquals(1, stats.inProgress());
        assertEquals(2, stats.completed());
        assertEquals(1, stats.cancelled());
    }
}
