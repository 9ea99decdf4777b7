package work.agentflow.engine.exec;

import java.util.List;
import java.util.Map;

/**
 * Fully substituted argv plus the optional stdin prompt and injection summary of a step.
 */
public record PreparedCommand(List<String> argv, String stdin, Map<String, Object> injection) {
    public PreparedCommand {
        argv = List.copyOf(argv);
    }
}
