package work.agentflow.engine.exec;

import work.agentflow.engine.output.RawOutput;

/**
 * Result of a finished (or killed) process. A timed-out process reports exit code 124.
 */
public record ProcessOutcome(int exitCode, boolean timedOut, RawOutput stdout, String stderr, long durationMs) {
    public ProcessOutcome {
        stdout = stdout == null ? RawOutput.empty() : stdout;
        stderr = stderr == null ? "" : stderr;
    }
}
