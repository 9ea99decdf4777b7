package work.agentflow.engine.shared;

import java.util.Map;

/**
 * A run executed more steps than allowed, typically a goto cycle without an exit.
 */
public final class RunawayException extends EngineException {
    public RunawayException(int limit) {
        super(ErrorKind.CONFIGURATION, "Run exceeded " + limit + " step executions", Map.of("max_step_executions", limit));
    }
}
