package work.agentflow.engine.flow;

import work.agentflow.engine.state.RunStatus;

/**
 * Final status of a run plus the process exit code a CLI reports for it.
 */
public record RunOutcome(String runId, RunStatus status, int exitCode, String message) {
    public static final int EXIT_COMPLETED = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_HALTED = 2;
    public static final int EXIT_TIMEOUT = 124;
    public static final int EXIT_CANCELLED = 130;

    public boolean isSuccess() {
        return status == RunStatus.COMPLETED;
    }
}
