package work.agentflow.engine.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.agentflow.engine.shared.EngineException;
import work.agentflow.engine.shared.ErrorKind;

/**
 * Structured error detail persisted on a step result.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorInfo(String kind, String message, Map<String, Object> details) {
    public ErrorInfo {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ErrorInfo of(ErrorKind kind, String message) {
        return new ErrorInfo(kind.code(), message, Map.of());
    }

    public static ErrorInfo from(EngineException ex) {
        return new ErrorInfo(ex.kind().code(), ex.getMessage(), ex.details());
    }
}
