package work.agentflow.engine.shared;

import java.util.Map;

public final class OutputParseException extends EngineException {
    public OutputParseException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorKind.OUTPUT_PARSE, message, details, cause);
    }
}
