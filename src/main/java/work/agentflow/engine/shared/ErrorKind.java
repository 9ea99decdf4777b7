package work.agentflow.engine.shared;

import java.util.Locale;

/**
 * Failure taxonomy recorded on step results. Only timeouts and execution errors may be retried.
 */
public enum ErrorKind {
    CONFIGURATION(false),
    PATH_SAFETY(false),
    MISSING_DEPENDENCY(false),
    MISSING_VARIABLE(false),
    OUTPUT_PARSE(false),
    TIMEOUT(true),
    EXECUTION(true),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
