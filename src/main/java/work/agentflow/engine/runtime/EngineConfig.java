package work.agentflow.engine.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlTable;
import work.agentflow.engine.shared.DurationParser;
import work.agentflow.engine.shared.WorkflowConfigException;

/**
 * Engine-wide limits and locations, optionally read from the {@code [engine]} table of a TOML file.
 */
public record EngineConfig(
    String stateDir,
    Duration defaultTimeout,
    Duration killGrace,
    int textLimitBytes,
    int bufferLimitBytes,
    int maxLines,
    long contentInjectionLimitBytes,
    int stateBackups,
    Duration lockStaleAfter,
    int maxStepExecutions,
    Duration waitPollInterval
) {
    public static final String DEFAULT_CONFIG_FILE = ".agentflow/config.toml";

    public EngineConfig {
        Objects.requireNonNull(stateDir, "stateDir");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(killGrace, "killGrace");
        Objects.requireNonNull(lockStaleAfter, "lockStaleAfter");
        Objects.requireNonNull(waitPollInterval, "waitPollInterval");
        if (textLimitBytes <= 0 || bufferLimitBytes < textLimitBytes) {
            throw new WorkflowConfigException("buffer_limit_bytes must be >= text_limit_bytes > 0");
        }
        if (maxLines <= 0 || maxStepExecutions <= 0 || stateBackups < 0 || contentInjectionLimitBytes < 0) {
            throw new WorkflowConfigException("Engine limits must be positive");
        }
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@code explicit} when given, else {@code <workspace>/.agentflow/config.toml} when present,
     * else the defaults.
     */
    public static EngineConfig load(Path workspace, Path explicit) {
        var file = explicit != null ? explicit : workspace.resolve(DEFAULT_CONFIG_FILE);
        if (explicit == null && !Files.isRegularFile(file)) {
            return defaults();
        }
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException ex) {
            throw new WorkflowConfigException("Unable to read engine config " + file, ex);
        }
        var parsed = Toml.parse(text);
        if (parsed.hasErrors()) {
            var problems = parsed.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new WorkflowConfigException("Invalid engine config " + file + ": " + problems);
        }
        var table = parsed.getTable("engine");
        if (table == null) {
            return defaults();
        }
        try {
            return fromTable(table);
        } catch (TomlInvalidTypeException ex) {
            throw new WorkflowConfigException("Invalid engine config " + file + ": " + ex.getMessage(), ex);
        }
    }

    static EngineConfig fromTable(TomlTable table) {
        var builder = builder();
        if (table.contains("state_dir")) builder.stateDir(table.getString("state_dir"));
        if (table.contains("default_timeout")) builder.defaultTimeout(duration(table, "default_timeout"));
        if (table.contains("kill_grace")) builder.killGrace(duration(table, "kill_grace"));
        if (table.contains("text_limit_bytes")) builder.textLimitBytes(intValue(table, "text_limit_bytes"));
        if (table.contains("buffer_limit_bytes")) builder.bufferLimitBytes(intValue(table, "buffer_limit_bytes"));
        if (table.contains("max_lines")) builder.maxLines(intValue(table, "max_lines"));
        if (table.contains("content_injection_limit_bytes")) builder.contentInjectionLimitBytes(table.getLong("content_injection_limit_bytes"));
        if (table.contains("state_backups")) builder.stateBackups(intValue(table, "state_backups"));
        if (table.contains("lock_stale_after")) builder.lockStaleAfter(duration(table, "lock_stale_after"));
        if (table.contains("max_step_executions")) builder.maxStepExecutions(intValue(table, "max_step_executions"));
        if (table.contains("wait_poll_interval")) builder.waitPollInterval(duration(table, "wait_poll_interval"));
        return builder.build();
    }

    private static Duration duration(TomlTable table, String key) {
        var raw = table.get(key);
        if (raw instanceof Long millis) {
            return DurationParser.parse(String.valueOf(millis)).orElseThrow();
        }
        return DurationParser.parse(table.getString(key))
            .orElseThrow(() -> new WorkflowConfigException("Engine config key '" + key + "' must not be empty"));
    }

    private static int intValue(TomlTable table, String key) {
        var value = table.getLong(key);
        if (value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new WorkflowConfigException("Engine config key '" + key + "' is out of range");
        }
        return value.intValue();
    }

    public static final class Builder {
        private String stateDir = ".agentflow/runs";
        private Duration defaultTimeout = Duration.ofSeconds(300);
        private Duration killGrace = Duration.ofSeconds(10);
        private int textLimitBytes = 8 * 1024;
        private int bufferLimitBytes = 1024 * 1024;
        private int maxLines = 10_000;
        private long contentInjectionLimitBytes = 256 * 1024;
        private int stateBackups = 3;
        private Duration lockStaleAfter = Duration.ofHours(1);
        private int maxStepExecutions = 10_000;
        private Duration waitPollInterval = Duration.ofMillis(500);

        public Builder stateDir(String stateDir) {
            this.stateDir = stateDir;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder killGrace(Duration killGrace) {
            this.killGrace = killGrace;
            return this;
        }

        public Builder textLimitBytes(int textLimitBytes) {
            this.textLimitBytes = textLimitBytes;
            return this;
        }

        public Builder bufferLimitBytes(int bufferLimitBytes) {
            this.bufferLimitBytes = bufferLimitBytes;
            return this;
        }

        public Builder maxLines(int maxLines) {
            this.maxLines = maxLines;
            return this;
        }

        public Builder contentInjectionLimitBytes(long contentInjectionLimitBytes) {
            this.contentInjectionLimitBytes = contentInjectionLimitBytes;
            return this;
        }

        public Builder stateBackups(int stateBackups) {
            this.stateBackups = stateBackups;
            return this;
        }

        public Builder lockStaleAfter(Duration lockStaleAfter) {
            this.lockStaleAfter = lockStaleAfter;
            return this;
        }

        public Builder maxStepExecutions(int maxStepExecutions) {
            this.maxStepExecutions = maxStepExecutions;
            return this;
        }

        public Builder waitPollInterval(Duration waitPollInterval) {
            this.waitPollInterval = waitPollInterval;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(
                stateDir,
                defaultTimeout,
                killGrace,
                textLimitBytes,
                bufferLimitBytes,
                maxLines,
                contentInjectionLimitBytes,
                stateBackups,
                lockStaleAfter,
                maxStepExecutions,
                waitPollInterval
            );
        }
    }
}
