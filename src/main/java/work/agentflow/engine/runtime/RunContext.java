package work.agentflow.engine.runtime;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.condition.ConditionEvaluator;
import work.agentflow.engine.deps.GlobMatcher;
import work.agentflow.engine.exec.StepExecutor;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.Workflow;
import work.agentflow.engine.shared.RunawayException;
import work.agentflow.engine.shared.WorkspacePaths;
import work.agentflow.engine.state.RunState;
import work.agentflow.engine.state.RunStateStore;
import work.agentflow.engine.variables.VariableResolver;
import work.agentflow.engine.variables.VariableScope;

/**
 * Everything one run needs, created at {@code run()}/{@code resume()} entry and passed down explicitly.
 */
public final class RunContext {
    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final Workflow workflow;
    private final EngineConfig config;
    private final WorkspacePaths workspace;
    private final RunStateStore store;
    private final RunState state;
    private final StepExecutor executor;
    private final ConditionEvaluator conditions;
    private final GlobMatcher globs;
    private final CancellationToken cancellationToken;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AtomicInteger executions = new AtomicInteger();
    private final AtomicBoolean resuming;

    public RunContext(
        Workflow workflow,
        EngineConfig config,
        WorkspacePaths workspace,
        RunStateStore store,
        RunState state,
        StepExecutor executor,
        ConditionEvaluator conditions,
        GlobMatcher globs,
        CancellationToken cancellationToken,
        Clock clock,
        Sleeper sleeper,
        boolean resuming
    ) {
        this.workflow = Objects.requireNonNull(workflow, "workflow");
        this.config = Objects.requireNonNull(config, "config");
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.store = Objects.requireNonNull(store, "store");
        this.state = Objects.requireNonNull(state, "state");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.globs = Objects.requireNonNull(globs, "globs");
        this.cancellationToken = cancellationToken == null ? new CancellationToken() : cancellationToken;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.resuming = new AtomicBoolean(resuming);
    }

    public Workflow workflow() {
        return workflow;
    }

    public EngineConfig config() {
        return config;
    }

    public WorkspacePaths workspace() {
        return workspace;
    }

    public RunState state() {
        return state;
    }

    public StepExecutor executor() {
        return executor;
    }

    public ConditionEvaluator conditions() {
        return conditions;
    }

    public GlobMatcher globs() {
        return globs;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public Clock clock() {
        return clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public Path logsDir() {
        return store.logsDir(state.runId());
    }

    /** True while a resumed run has not finished its first top-level step yet. */
    public boolean resuming() {
        return resuming.get();
    }

    public void resumeFinished() {
        resuming.set(false);
    }

    public void persist() {
        store.save(state);
    }

    public void backup() {
        store.backup(state.runId());
    }

    /**
     * Polls the token and the run's {@code CANCEL} sentinel.
     */
    public boolean cancelRequested() {
        if (cancellationToken.isCancelled()) {
            return true;
        }
        if (store.cancelRequested(state.runId())) {
            log.info("Cancellation requested for run {}", state.runId());
            cancellationToken.cancel();
            return true;
        }
        return false;
    }

    /**
     * Sleeps in slices of at most {@code wait_poll_interval} so cancellation is noticed.
     *
     * @return false when the pause ended because the run was cancelled
     */
    public boolean pause(Duration duration) {
        var remaining = duration;
        while (!remaining.isZero() && !remaining.isNegative()) {
            if (cancelRequested()) {
                return false;
            }
            var slice = remaining.compareTo(config.waitPollInterval()) < 0 ? remaining : config.waitPollInterval();
            try {
                sleeper.sleep(slice);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                cancellationToken.cancel();
                return false;
            }
            remaining = remaining.minus(slice);
        }
        return !cancelRequested();
    }

    public void countExecution() {
        if (executions.incrementAndGet() > config.maxStepExecutions()) {
            throw new RunawayException(config.maxStepExecutions());
        }
    }

    public VariableScope baseScope() {
        var run = new LinkedHashMap<String, Object>();
        run.put("id", state.runId());
        run.put("timestamp_utc", state.startedAt());
        run.put("workflow", workflow.name());
        run.put("workspace", workspace.root().toString());
        return VariableScope.of(run, state.context(), state.steps());
    }

    public VariableResolver resolver(VariableScope scope, Step step) {
        return new VariableResolver(scope, step.allowMissing());
    }

    public Map<String, Object> initialContext() {
        return state.initialContext();
    }
}
