package work.agentflow.engine.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One loop iteration with its own isolated step-result map.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IterationRecord(
    @JsonProperty("index") int index,
    @JsonProperty("item") Object item,
    @JsonProperty("status") StepStatus status,
    @JsonProperty("steps") Map<String, StepResult> steps,
    @JsonProperty("duration_ms") long durationMs
) {
    public IterationRecord {
        steps = steps == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(steps));
    }
}
