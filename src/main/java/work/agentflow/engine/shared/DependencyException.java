package work.agentflow.engine.shared;

import java.util.Map;

public final class DependencyException extends EngineException {
    public DependencyException(String pattern, String resolvedPattern) {
        super(
            ErrorKind.MISSING_DEPENDENCY,
            "Required dependency '" + resolvedPattern + "' matched no files",
            Map.of("pattern", pattern, "resolved", resolvedPattern)
        );
    }
}
