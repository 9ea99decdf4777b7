package work.agentflow.engine.state;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Iteration records of one for_each/while execution. Parallel iterations publish into the same
 * instance, so every accessor is synchronized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class LoopState {
    @JsonProperty("kind")
    private final String kind;
    @JsonProperty("items")
    private List<Object> items;
    @JsonProperty("iterations")
    private final List<IterationRecord> iterations;
    @JsonProperty("termination_reason")
    private TerminationReason terminationReason;
    @JsonProperty("summary")
    private Map<String, Object> summary;

    @JsonCreator
    LoopState(
        @JsonProperty("kind") String kind,
        @JsonProperty("items") List<Object> items,
        @JsonProperty("iterations") List<IterationRecord> iterations,
        @JsonProperty("termination_reason") TerminationReason terminationReason,
        @JsonProperty("summary") Map<String, Object> summary
    ) {
        this.kind = kind;
        this.items = items == null ? null : new ArrayList<>(items);
        this.iterations = iterations == null ? new ArrayList<>() : new ArrayList<>(iterations);
        this.terminationReason = terminationReason;
        this.summary = summary == null ? null : new LinkedHashMap<>(summary);
    }

    public static LoopState forEach(List<Object> items) {
        return new LoopState("for_each", items, null, null, null);
    }

    public static LoopState whileLoop() {
        return new LoopState("while", null, null, null, null);
    }

    public synchronized String kind() {
        return kind;
    }

    public synchronized List<Object> items() {
        return items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    synchronized void record(IterationRecord iteration) {
        for (var i = 0; i < iterations.size(); i++) {
            if (iterations.get(i).index() == iteration.index()) {
                iterations.set(i, iteration);
                return;
            }
        }
        iterations.add(iteration);
        iterations.sort((a, b) -> Integer.compare(a.index(), b.index()));
    }

    public synchronized Optional<IterationRecord> iteration(int index) {
        return iterations.stream().filter(it -> it.index() == index).findFirst();
    }

    public synchronized List<IterationRecord> iterations() {
        return List.copyOf(iterations);
    }

    public synchronized TerminationReason terminationReason() {
        return terminationReason;
    }

    /**
     * Records why the loop stopped; a second call is a programming error.
     */
    synchronized void terminate(TerminationReason reason) {
        if (terminationReason != null) {
            throw new IllegalStateException("termination reason already recorded: " + terminationReason.key());
        }
        terminationReason = reason;
    }

    public synchronized Map<String, Object> summary() {
        return summary == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(summary));
    }

    synchronized void summary(Map<String, Object> values) {
        summary = new LinkedHashMap<>(values);
    }
}
