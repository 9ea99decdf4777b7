package work.agentflow.engine.exec;

/**
 * Spawns external processes. Tests substitute a scripted implementation.
 */
public interface ProcessRunner {
    int TIMEOUT_EXIT_CODE = 124;

    /**
     * Runs the process to completion or timeout.
     *
     * @throws work.agentflow.engine.shared.EngineException when the process cannot be started
     * @throws InterruptedException when the calling thread is interrupted; the process is killed first
     */
    ProcessOutcome run(ProcessRequest request) throws InterruptedException;
}
