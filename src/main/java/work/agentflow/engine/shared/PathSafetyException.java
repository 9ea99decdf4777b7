package work.agentflow.engine.shared;

import java.util.Map;

public final class PathSafetyException extends EngineException {
    public PathSafetyException(String path, String reason) {
        super(ErrorKind.PATH_SAFETY, "Unsafe path '" + path + "': " + reason, Map.of("path", path, "reason", reason));
    }
}
