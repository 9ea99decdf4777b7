package work.agentflow.engine.shared;

import java.util.Map;

/**
 * Raised for invalid workflow documents, engine configuration, and unusable run state.
 */
public class WorkflowConfigException extends EngineException {
    public WorkflowConfigException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public WorkflowConfigException(String message, Map<String, Object> details) {
        super(ErrorKind.CONFIGURATION, message, details);
    }

    public WorkflowConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, Map.of(), cause);
    }
}
