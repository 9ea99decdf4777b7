package work.agentflow.engine.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Run lifecycle: {@code running -> completed|failed|cancelled|error}.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    ERROR;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus from(String value) {
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
