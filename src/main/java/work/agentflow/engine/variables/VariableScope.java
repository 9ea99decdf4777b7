package work.agentflow.engine.variables;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.agentflow.engine.state.StepResult;

/**
 * Immutable snapshot of the namespaces a reference can name: loop scope, step results, context and
 * run. Loop bodies layer their own iteration results over the enclosing ones.
 */
public final class VariableScope {
    public static final String LOOP = "loop";
    public static final String STEPS = "steps";
    public static final String CONTEXT = "context";
    public static final String RUN = "run";

    private final Map<String, Object> run;
    private final Map<String, Object> context;
    private final Map<String, StepResult> steps;
    private final Map<String, Object> loop;

    private VariableScope(Map<String, Object> run, Map<String, Object> context, Map<String, StepResult> steps, Map<String, Object> loop) {
        this.run = run;
        this.context = context;
        this.steps = steps;
        this.loop = loop;
    }

    public static VariableScope of(Map<String, Object> run, Map<String, Object> context, Map<String, StepResult> steps) {
        return new VariableScope(
            copy(run),
            copy(context),
            Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNullElse(steps, Map.of()))),
            Map.of()
        );
    }

    public static boolean isReservedNamespace(String name) {
        return LOOP.equals(name) || STEPS.equals(name) || CONTEXT.equals(name) || RUN.equals(name);
    }

    /**
     * Enters a loop iteration: binds {@code alias} to the item (when not null) and replaces {@code loop.*}.
     */
    public VariableScope withLoop(String alias, Object item, Map<String, Object> loopVars) {
        var merged = new LinkedHashMap<>(loop);
        if (alias != null) {
            merged.put(alias, item);
        }
        merged.put(LOOP, Collections.unmodifiableMap(new LinkedHashMap<>(loopVars)));
        return new VariableScope(run, context, steps, Collections.unmodifiableMap(merged));
    }

    /**
     * Layers iteration-local results over the visible step results.
     */
    public VariableScope withSteps(Map<String, StepResult> local) {
        if (local == null || local.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(steps);
        merged.putAll(local);
        return new VariableScope(run, context, Collections.unmodifiableMap(merged), loop);
    }

    public StepResult stepResult(String name) {
        return steps.get(name);
    }

    public Map<String, Object> run() {
        return run;
    }

    public Map<String, Object> context() {
        return context;
    }

    public Map<String, Object> loop() {
        return loop;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
