package work.agentflow.engine.shared;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception carrying an {@link ErrorKind} plus structured details (which variable, which glob, ...).
 */
public class EngineException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, Object> details;

    public EngineException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public EngineException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    public EngineException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }
}
