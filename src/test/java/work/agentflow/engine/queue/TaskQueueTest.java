package work.agentflow.engine.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.engine.shared.WorkflowConfigException;

class TaskQueueTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-04T08:09:10Z"), ZoneOffset.UTC);

    @TempDir
    Path root;

    private TaskQueue queue() {
        return new TaskQueue(root.resolve("inbox"), CLOCK);
    }

    @Test
    void enqueuedTasksArePendingInNameOrder() throws IOException {
        var queue = queue();
        queue.enqueue("b-task", "second");
        var first = queue.enqueue("a-task", "first");
        Files.writeString(root.resolve("inbox/ignored.txt"), "x");

        assertEquals(List.of(first, queue.inbox().resolve("b-task.task")), queue.pending());
        assertEquals("first", Files.readString(first));
        assertFalse(Files.exists(root.resolve("inbox/a-task.task.tmp")));
    }

    @Test
    void completeAndFailArchiveUnderTimestampedDirectories() {
        var queue = queue();
        var done = queue.complete(queue.enqueue("done", "ok"));
        var broken = queue.fail(queue.enqueue("broken", "bad"));

        assertEquals(root.resolve("processed/20260504T080910/done.task").toAbsolutePath().normalize(), done);
        assertEquals(root.resolve("failed/20260504T080910/broken.task").toAbsolutePath().normalize(), broken);
        assertTrue(Files.exists(done));
        assertTrue(queue.pending().isEmpty());
    }

    @Test
    void rejectsUnsafeNamesAndForeignTasks() throws IOException {
        var queue = queue();
        assertThrows(WorkflowConfigException.class, () -> queue.enqueue("../escape", "x"));
        assertThrows(WorkflowConfigException.class, () -> queue.enqueue(".hidden", "x"));
        var outside = Files.writeString(root.resolve("outside.task"), "x");
        assertThrows(WorkflowConfigException.class, () -> queue.complete(outside));
    }

    @Test
    void missingInboxHasNoPendingTasks() {
        assertTrue(queue().pending().isEmpty());
    }
}
