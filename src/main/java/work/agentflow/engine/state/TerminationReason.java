package work.agentflow.engine.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Why a {@code while} loop stopped. Recorded exactly once per loop execution.
 */
public enum TerminationReason {
    CONDITION_FALSE,
    MAX_ITERATIONS,
    TIMEOUT,
    EXPLICIT_BREAK,
    CANCELLED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TerminationReason from(String value) {
        return TerminationReason.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
