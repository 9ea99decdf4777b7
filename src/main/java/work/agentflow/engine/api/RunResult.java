package work.agentflow.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import work.agentflow.engine.flow.RunOutcome;
import work.agentflow.engine.state.RunStatus;

/**
 * Outcome of a {@link WorkflowRunner} call, usable by the CLI and embedding apps.
 */
public record RunResult(String runId, RunStatus status, int exitCode, String message, Path stateFile, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    static RunResult from(RunOutcome outcome, Path stateFile, Instant startedAt, Instant finishedAt) {
        return new RunResult(outcome.runId(), outcome.status(), outcome.exitCode(), outcome.message(), stateFile, startedAt, finishedAt);
    }

    public boolean isSuccess() {
        return status == RunStatus.COMPLETED;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("run_id", runId);
        serializable.put("status", status.key());
        serializable.put("exit_code", exitCode);
        if (message != null) {
            serializable.put("message", message);
        }
        serializable.put("state_file", stateFile.toString());
        serializable.put("started_at", startedAt.toString());
        serializable.put("finished_at", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }
}
