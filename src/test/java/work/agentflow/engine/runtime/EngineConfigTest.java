package work.agentflow.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.engine.shared.WorkflowConfigException;

class EngineConfigTest {
    @TempDir
    Path workspace;

    @Test
    void defaultsWhenNoConfigFile() {
        var config = EngineConfig.load(workspace, null);
        assertEquals(EngineConfig.defaults(), config);
        assertEquals(".agentflow/runs", config.stateDir());
        assertEquals(Duration.ofSeconds(300), config.defaultTimeout());
    }

    @Test
    void readsEngineTableFromWorkspace() throws IOException {
        Files.createDirectories(workspace.resolve(".agentflow"));
        Files.writeString(workspace.resolve(EngineConfig.DEFAULT_CONFIG_FILE), """
            [engine]
            state_dir = "var/runs"
            default_timeout = "2m"
            kill_grace = 1500
            text_limit_bytes = 1024
            state_backups = 0
            wait_poll_interval = "250ms"
            """);
        var config = EngineConfig.load(workspace, null);
        assertEquals("var/runs", config.stateDir());
        assertEquals(Duration.ofMinutes(2), config.defaultTimeout());
        assertEquals(Duration.ofMillis(1500), config.killGrace());
        assertEquals(1024, config.textLimitBytes());
        assertEquals(0, config.stateBackups());
        assertEquals(Duration.ofMillis(250), config.waitPollInterval());
    }

    @Test
    void explicitFileMustExist() {
        assertThrows(WorkflowConfigException.class, () -> EngineConfig.load(workspace, workspace.resolve("nope.toml")));
    }

    @Test
    void malformedTomlIsAConfigurationError() throws IOException {
        var file = workspace.resolve("bad.toml");
        Files.writeString(file, "[engine\nstate_dir = ");
        assertThrows(WorkflowConfigException.class, () -> EngineConfig.load(workspace, file));
    }

    @Test
    void wrongValueTypeIsAConfigurationError() throws IOException {
        var file = workspace.resolve("typed.toml");
        Files.writeString(file, "[engine]\nmax_lines = \"many\"\n");
        assertThrows(WorkflowConfigException.class, () -> EngineConfig.load(workspace, file));
    }

    @Test
    void inconsistentLimitsAreRejected() {
        assertThrows(WorkflowConfigException.class, () -> EngineConfig.builder().textLimitBytes(2048).bufferLimitBytes(1024).build());
    }
}
