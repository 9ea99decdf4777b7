package work.agentflow.engine.shared;

import java.nio.file.Path;
import java.util.Map;

/**
 * The persisted run state is not valid JSON or misses required fields. Never partially loaded.
 */
public final class StateCorruptedException extends WorkflowConfigException {
    public StateCorruptedException(Path file, String reason) {
        super("Run state " + file + " is unusable: " + reason, Map.of("file", file.toString(), "reason", reason));
    }
}
