package me.golemcore.pilot.tools;

import me.golemcore.pilot.domain.model.Task;
import me.golemcore.pilot.domain.model.TaskStatus;
import me.golemcore.pilot.domain.model.ToolFailureKind;
import me.golemcore.pilot.domain.model.ToolResult;
import me.golemcore.pilot.domain.service.TaskBoard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskBoardToolTest {

    private TaskBoard board;
    private TaskBoardTool tool;

    @BeforeEach
    void setUp() {
        board = new TaskBoard();
        tool = new TaskBoardTool(board);
    }

    @Test
    void shouldExposeDefinition() {
        assertEquals("update_tasks", tool.getDefinition().getName());
        assertEquals("update_tasks", tool.getToolName());
    }

    @Test
    void shouldUpsertTasks() {
        ToolResult result = tool.execute(Map.of("tasks", List.of(
                Map.of("id", "1", "title", "Open site", "status", "in_progress"),
                Map.of("id", "2", "title", "Search")))).join();

        assertTrue(result.isSuccess());
        assertEquals("Task board updated: 2 created, 2 total", result.getOutput());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(2, data.get("created"));
        assertEquals(false, data.get("requiresApproval"));

        List<Task> snapshot = board.snapshot();
        assertEquals(TaskStatus.IN_PROGRESS, snapshot.get(0).getStatus());
        assertEquals(TaskStatus.PENDING, snapshot.get(1).getStatus());
    }

    @Test
    void shouldEchoApprovalRequest() {
        ToolResult result = tool.execute(Map.of(
                "tasks", List.of(Map.of("id", "1")),
                "requestApproval", true)).join();

        assertTrue(result.isSuccess());
        assertEquals("Task board updated: 1 created, 1 total (awaiting approval)", result.getOutput());
    }

    @Test
    void shouldAcceptHyphenatedStatus() {
        tool.execute(Map.of("tasks", List.of(Map.of("id", "1", "status", "in-progress")))).join();

        assertEquals(TaskStatus.IN_PROGRESS, board.snapshot().get(0).getStatus());
    }

    @Test
    void shouldFailWhenTasksMissing() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
    }

    @Test
    void shouldFailOnUnknownStatusWithoutTouchingBoard() {
        ToolResult result = tool.execute(Map.of("tasks", List.of(
                Map.of("id", "1"),
                Map.of("id", "2", "status", "someday")))).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        assertEquals("Unknown task status: someday", result.getError());
        assertTrue(board.snapshot().isEmpty());
    }
}
