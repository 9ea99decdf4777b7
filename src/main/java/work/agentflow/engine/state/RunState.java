package work.agentflow.engine.state;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned, resumable progress document of one run. Mutated only by the control-flow engine and
 * persisted through {@link RunStateStore} after every step attempt. Methods synchronize on the
 * instance so parallel loop iterations and the store never observe a half-applied update.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class RunState {
    public static final int SCHEMA_VERSION = 1;

    @JsonProperty("schema_version")
    private final int schemaVersion;
    @JsonProperty("run_id")
    private final String runId;
    @JsonProperty("workflow_name")
    private final String workflowName;
    @JsonProperty("workflow_path")
    private final String workflowPath;
    @JsonProperty("workflow_checksum")
    private final String workflowChecksum;
    @JsonProperty("status")
    private RunStatus status;
    @JsonProperty("started_at")
    private final String startedAt;
    @JsonProperty("updated_at")
    private String updatedAt;
    @JsonProperty("current_step")
    private String currentStep;
    @JsonProperty("initial_context")
    private final Map<String, Object> initialContext;
    @JsonProperty("context")
    private final Map<String, Object> context;
    @JsonProperty("steps")
    private final Map<String, StepResult> steps;
    @JsonProperty("loops")
    private final Map<String, LoopState> loops;
    @JsonProperty("error")
    private String error;

    @JsonCreator
    RunState(
        @JsonProperty("schema_version") int schemaVersion,
        @JsonProperty("run_id") String runId,
        @JsonProperty("workflow_name") String workflowName,
        @JsonProperty("workflow_path") String workflowPath,
        @JsonProperty("workflow_checksum") String workflowChecksum,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("current_step") String currentStep,
        @JsonProperty("initial_context") Map<String, Object> initialContext,
        @JsonProperty("context") Map<String, Object> context,
        @JsonProperty("steps") Map<String, StepResult> steps,
        @JsonProperty("loops") Map<String, LoopState> loops,
        @JsonProperty("error") String error
    ) {
        this.schemaVersion = schemaVersion;
        this.runId = runId;
        this.workflowName = workflowName;
        this.workflowPath = workflowPath;
        this.workflowChecksum = workflowChecksum;
        this.status = status;
        this.startedAt = startedAt;
        this.updatedAt = updatedAt;
        this.currentStep = currentStep;
        this.initialContext = initialContext == null ? new LinkedHashMap<>() : new LinkedHashMap<>(initialContext);
        this.context = context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context);
        this.steps = steps == null ? new LinkedHashMap<>() : new LinkedHashMap<>(steps);
        this.loops = loops == null ? new LinkedHashMap<>() : new LinkedHashMap<>(loops);
        this.error = error;
    }

    public static RunState create(String runId, String workflowName, String workflowPath, String checksum, Map<String, Object> initialContext, Instant now) {
        Objects.requireNonNull(runId, "runId");
        return new RunState(
            SCHEMA_VERSION,
            runId,
            workflowName,
            workflowPath,
            checksum,
            RunStatus.RUNNING,
            now.toString(),
            now.toString(),
            null,
            initialContext,
            initialContext,
            null,
            null,
            null
        );
    }

    public int schemaVersion() {
        return schemaVersion;
    }

    public String runId() {
        return runId;
    }

    public String workflowName() {
        return workflowName;
    }

    public String workflowPath() {
        return workflowPath;
    }

    public String workflowChecksum() {
        return workflowChecksum;
    }

    public String startedAt() {
        return startedAt;
    }

    public synchronized String updatedAt() {
        return updatedAt;
    }

    public synchronized RunStatus status() {
        return status;
    }

    public synchronized void status(RunStatus newStatus, Instant at) {
        status = newStatus;
        updatedAt = at.toString();
    }

    public synchronized String currentStep() {
        return currentStep;
    }

    public synchronized void currentStep(String name) {
        currentStep = name;
    }

    public synchronized String error() {
        return error;
    }

    public synchronized void error(String message) {
        error = message;
    }

    public synchronized Map<String, Object> initialContext() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(initialContext));
    }

    public synchronized Map<String, Object> context() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public synchronized StepResult step(String name) {
        return steps.get(name);
    }

    public synchronized Map<String, StepResult> steps() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(steps));
    }

    public synchronized void putStep(String name, StepResult result, Instant at) {
        steps.put(name, result);
        updatedAt = at.toString();
    }

    public synchronized LoopState loop(String key) {
        return loops.get(key);
    }

    public synchronized void putLoop(String key, LoopState loop) {
        loops.put(key, loop);
    }

    public synchronized void recordIteration(String key, IterationRecord iteration) {
        var loop = loops.get(key);
        if (loop == null) {
            throw new IllegalStateException("Unknown loop " + key);
        }
        loop.record(iteration);
    }

    public synchronized void terminateLoop(String key, TerminationReason reason) {
        loops.get(key).terminate(reason);
    }

    public synchronized void loopSummary(String key, Map<String, Object> summary) {
        loops.get(key).summary(summary);
    }
}
