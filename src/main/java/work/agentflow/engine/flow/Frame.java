package work.agentflow.engine.flow;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.runtime.RunContext;
import work.agentflow.engine.state.IterationRecord;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.variables.VariableScope;

/**
 * Where a step list runs: the top level of the run, or one loop iteration with its own isolated
 * result map. Iteration frames are confined to the thread executing them.
 */
final class Frame {
    private final Frame parent;
    private final String prefix;
    private final String loopKey;
    private final int index;
    private final Object item;
    private final String alias;
    private final Map<String, Object> loopVars;
    private final Map<String, StepResult> local = new LinkedHashMap<>();
    private final Instant started;
    private volatile boolean abandoned;

    private Frame(Frame parent, String prefix, String loopKey, int index, Object item, String alias, Map<String, Object> loopVars, Instant started) {
        this.parent = parent;
        this.prefix = prefix;
        this.loopKey = loopKey;
        this.index = index;
        this.item = item;
        this.alias = alias;
        this.loopVars = loopVars;
        this.started = started;
    }

    static Frame top() {
        return new Frame(null, "", null, -1, null, null, Map.of(), null);
    }

    Frame iteration(String loopKey, int index, String alias, Object item, Map<String, Object> loopVars, Instant now) {
        return new Frame(this, loopKey + "/" + index + "/", loopKey, index, item, alias, loopVars, now);
    }

    boolean isTop() {
        return parent == null;
    }

    String key(Step step) {
        return prefix + step.name();
    }

    int index() {
        return index;
    }

    Object item() {
        return item;
    }

    VariableScope scope(RunContext ctx) {
        if (isTop()) {
            return ctx.baseScope();
        }
        return parent.scope(ctx).withLoop(alias, item, loopVars).withSteps(local);
    }

    Map<String, StepResult> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(local));
    }

    /** Stops this iteration from publishing anything further. */
    void abandon() {
        abandoned = true;
    }

    boolean abandoned() {
        return abandoned || (parent != null && parent.abandoned());
    }

    /**
     * Stores a step result and persists the run state.
     */
    void record(RunContext ctx, Step step, StepResult result) {
        if (isTop()) {
            ctx.state().putStep(step.name(), result, ctx.now());
            ctx.persist();
            return;
        }
        local.put(step.name(), result);
        publish(ctx, StepStatus.RUNNING);
    }

    IterationRecord publish(RunContext ctx, StepStatus status) {
        var elapsed = Duration.between(started, ctx.now()).toMillis();
        var record = new IterationRecord(index, item, status, local, Math.max(0L, elapsed));
        if (!abandoned()) {
            ctx.state().recordIteration(loopKey, record);
            ctx.persist();
        }
        return record;
    }
}
