package work.agentflow.engine.cli;

import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.agentflow.engine.api.LogLevel;
import work.agentflow.engine.api.WorkflowRunner;
import work.agentflow.engine.runtime.CancellationToken;
import work.agentflow.engine.runtime.EngineConfig;

/**
 * Options shared by every subcommand.
 */
final class EngineOptions {
    @CommandLine.Option(
        names = {"-w", "--workspace"},
        description = "Workspace root all workflow paths are resolved against.",
        defaultValue = "."
    )
    private String workspace;

    @CommandLine.Option(
        names = "--config",
        description = "Engine config TOML file (default: <workspace>/.agentflow/config.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevel;

    Path workspace() {
        return Paths.get(workspace).toAbsolutePath().normalize();
    }

    EngineConfig engineConfig() {
        var explicit = config == null ? null : Paths.get(config).toAbsolutePath().normalize();
        return EngineConfig.load(workspace(), explicit);
    }

    void applyLogLevel() {
        var level = LogLevel.from(logLevel);
        if (LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
            root.setLevel(Level.convertAnSLF4JLevel(level.toSlf4j()));
        }
    }

    WorkflowRunner runner(CancellationToken token) {
        applyLogLevel();
        return WorkflowRunner.builder()
            .workspace(workspace())
            .config(engineConfig())
            .cancellationToken(token)
            .build();
    }
}
