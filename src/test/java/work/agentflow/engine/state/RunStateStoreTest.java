package work.agentflow.engine.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.engine.shared.AtomicFiles;
import work.agentflow.engine.shared.StateCorruptedException;
import work.agentflow.engine.shared.WorkflowConfigException;

class RunStateStoreTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path root;

    private RunStateStore store() {
        return new RunStateStore(root, 3);
    }

    private static RunState newState(String runId) {
        return RunState.create(runId, "demo", "flows/demo.yaml", "sha256:abc", Map.of("ticket", "T-1"), NOW);
    }

    @Test
    void savesAndLoadsStepResults() {
        var store = store();
        var state = store.create(newState("run-1"));
        state.putStep("build", StepResult.running(NOW).withStatus(StepStatus.COMPLETED).withExitCode(0), NOW);
        state.status(RunStatus.COMPLETED, NOW);
        store.save(state);

        var loaded = store.load("run-1");
        assertEquals(RunStatus.COMPLETED, loaded.status());
        assertEquals(StepStatus.COMPLETED, loaded.step("build").status());
        assertEquals("T-1", loaded.context().get("ticket"));
        assertTrue(Files.isDirectory(store.logsDir("run-1")));
    }

    @Test
    void refusesDuplicateRunAndUnsafeRunIds() {
        var store = store();
        store.create(newState("run-1"));
        assertThrows(WorkflowConfigException.class, () -> store.create(newState("run-1")));
        assertThrows(WorkflowConfigException.class, () -> store.runDir("../escape"));
        assertThrows(WorkflowConfigException.class, () -> store.load("missing"));
    }

    @Test
    void corruptedDocumentIsReported() throws IOException {
        var store = store();
        store.create(newState("run-1"));
        Files.writeString(store.stateFile("run-1"), "{\"schema_version\": 1, \"run_id\": ");
        assertThrows(StateCorruptedException.class, () -> store.load("run-1"));

        Files.writeString(store.stateFile("run-1"), "{\"schema_version\": 99, \"run_id\": \"run-1\"}");
        var ex = assertThrows(StateCorruptedException.class, () -> store.load("run-1"));
        assertTrue(ex.getMessage().contains("schema_version"));
    }

    @Test
    void repairRestoresNewestValidBackup() throws IOException {
        var store = store();
        var state = store.create(newState("run-1"));
        state.currentStep("first");
        store.save(state);
        store.backup("run-1");
        state.currentStep("second");
        store.save(state);
        store.backup("run-1");
        assertTrue(Files.exists(store.runDir("run-1").resolve(RunStateStore.BACKUP_PREFIX + 2)));

        Files.writeString(store.runDir("run-1").resolve(RunStateStore.BACKUP_PREFIX + 1), "garbage");
        Files.writeString(store.stateFile("run-1"), "also garbage");

        var repaired = store.repair("run-1");
        assertEquals("first", repaired.currentStep());
        assertEquals("first", store.load("run-1").currentStep());
    }

    @Test
    void repairWithoutBackupsFails() throws IOException {
        var store = store();
        store.create(newState("run-1"));
        Files.writeString(store.stateFile("run-1"), "x");
        assertThrows(StateCorruptedException.class, () -> store.repair("run-1"));
    }

    @Test
    void failedCommitKeepsPreviousState() {
        var store = store();
        var state = store.create(newState("run-1"));
        state.currentStep("committed");
        store.save(state);

        store.commitHook(temp -> {
            throw new IOException("disk full");
        });
        state.currentStep("lost");
        assertThrows(IllegalStateException.class, () -> store.save(state));

        store.commitHook(null);
        assertEquals("committed", store.load("run-1").currentStep());
    }

    @Test
    void leftoverTempFileIsDiscardedOnLoad() throws IOException {
        var store = store();
        store.create(newState("run-1"));
        var temp = AtomicFiles.tempFor(store.stateFile("run-1"));
        Files.writeString(temp, "partial");

        var loaded = store.load("run-1");
        assertNull(loaded.currentStep());
        assertFalse(Files.exists(temp));
    }

    @Test
    void cancelMarkerLifecycle() {
        var store = store();
        store.create(newState("run-1"));
        assertFalse(store.cancelRequested("run-1"));
        store.requestCancel("run-1");
        assertTrue(store.cancelRequested("run-1"));
        store.clearCancel("run-1");
        assertFalse(store.cancelRequested("run-1"));
        assertThrows(WorkflowConfigException.class, () -> store.requestCancel("nope"));
    }

    @Test
    void newRunIdsAreTimestampedAndUnique() {
        var first = RunStateStore.newRunId(NOW);
        var second = RunStateStore.newRunId(NOW);
        assertTrue(first.startsWith("20260301T100000Z-"));
        assertFalse(first.equals(second));
    }
}
