package work.agentflow.engine.shared;

import java.util.Map;

public final class RunLockedException extends EngineException {
    public RunLockedException(String runId, long ownerPid) {
        super(ErrorKind.CONFIGURATION, "Run " + runId + " is locked by live process " + ownerPid, Map.of("run_id", runId, "pid", ownerPid));
    }
}
