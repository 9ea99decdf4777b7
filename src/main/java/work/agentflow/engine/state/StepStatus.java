package work.agentflow.engine.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Step lifecycle: {@code pending -> running -> completed|failed|skipped|timeout|cancelled}.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED,
    TIMEOUT,
    CANCELLED;

    public boolean isSuccess() {
        return this == COMPLETED || this == SKIPPED;
    }

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepStatus from(String value) {
        return StepStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
