package work.agentflow.engine.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted outcome of one step attempt sequence. Created as {@code running} at step start and
 * replaced by a finalized copy on completion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepResult(
    @JsonProperty("status") StepStatus status,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("output") String output,
    @JsonProperty("lines") List<String> lines,
    @JsonProperty("json") Object json,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("parse_error") boolean parseError,
    @JsonProperty("spill_path") String spillPath,
    @JsonProperty("total_bytes") Long totalBytes,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("attempts") int attempts,
    @JsonProperty("started_at") String startedAt,
    @JsonProperty("finished_at") String finishedAt,
    @JsonProperty("injection") Map<String, Object> injection,
    @JsonProperty("error") ErrorInfo error
) {
    public static StepResult running(Instant startedAt) {
        return new StepResult(StepStatus.RUNNING, null, null, null, null, false, false, null, null, 0L, 0, startedAt.toString(), null, null, null);
    }

    public static StepResult skipped(Instant at) {
        return new StepResult(StepStatus.SKIPPED, 0, null, null, null, false, false, null, null, 0L, 0, at.toString(), at.toString(), null, null);
    }

    public static StepResult failure(StepStatus status, ErrorInfo error, Instant startedAt, Instant finishedAt) {
        return new StepResult(status, null, null, null, null, false, false, null, null, millisBetween(startedAt, finishedAt), 0, startedAt.toString(), finishedAt.toString(), null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status != null && status.isSuccess() && (exitCode == null || exitCode == 0);
    }

    public StepResult withStatus(StepStatus newStatus) {
        return new StepResult(newStatus, exitCode, output, lines, json, truncated, parseError, spillPath, totalBytes, durationMs, attempts, startedAt, finishedAt, injection, error);
    }

    public StepResult withExitCode(Integer code) {
        return new StepResult(status, code, output, lines, json, truncated, parseError, spillPath, totalBytes, durationMs, attempts, startedAt, finishedAt, injection, error);
    }

    public StepResult withJson(Object value) {
        return new StepResult(status, exitCode, output, lines, value, truncated, parseError, spillPath, totalBytes, durationMs, attempts, startedAt, finishedAt, injection, error);
    }

    public StepResult withAttempts(int count) {
        return new StepResult(status, exitCode, output, lines, json, truncated, parseError, spillPath, totalBytes, durationMs, count, startedAt, finishedAt, injection, error);
    }

    public StepResult withInjection(Map<String, Object> summary) {
        return new StepResult(status, exitCode, output, lines, json, truncated, parseError, spillPath, totalBytes, durationMs, attempts, startedAt, finishedAt, summary, error);
    }

    public StepResult withError(ErrorInfo info) {
        return new StepResult(status, exitCode, output, lines, json, truncated, parseError, spillPath, totalBytes, durationMs, attempts, startedAt, finishedAt, injection, info);
    }

    public StepResult finishedAt(Instant start, Instant end) {
        return new StepResult(status, exitCode, output, lines, json, truncated, parseError, spillPath, totalBytes, millisBetween(start, end), attempts, start.toString(), end.toString(), injection, error);
    }

    private static long millisBetween(Instant start, Instant end) {
        return Math.max(0L, end.toEpochMilli() - start.toEpochMilli());
    }
}
