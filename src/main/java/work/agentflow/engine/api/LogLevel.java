package work.agentflow.engine.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.event.Level;

/**
 * Log thresholds accepted by {@code --log-level}, mapped onto SLF4J levels.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level slf4j;

    LogLevel(Level slf4j) {
        this.slf4j = slf4j;
    }

    public Level toSlf4j() {
        return slf4j;
    }

    /**
     * Parses a threshold name case-insensitively; {@code warning} is accepted for {@link #WARN}.
     * Blank input selects {@link #INFO}.
     */
    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        for (var level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        var accepted = Arrays.stream(values()).map(level -> level.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining("|"));
        throw new IllegalArgumentException("Unsupported log level '" + value + "' (expected " + accepted + ")");
    }
}
