package work.agentflow.engine.api;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.condition.ConditionEvaluator;
import work.agentflow.engine.deps.DependencyResolver;
import work.agentflow.engine.deps.GlobMatcher;
import work.agentflow.engine.deps.PromptComposer;
import work.agentflow.engine.exec.CommandBuilder;
import work.agentflow.engine.exec.DefaultProcessRunner;
import work.agentflow.engine.exec.ProcessRunner;
import work.agentflow.engine.exec.SecretsPolicy;
import work.agentflow.engine.exec.StepExecutor;
import work.agentflow.engine.flow.RunOutcome;
import work.agentflow.engine.flow.WorkflowEngine;
import work.agentflow.engine.model.Workflow;
import work.agentflow.engine.runtime.CancellationToken;
import work.agentflow.engine.runtime.EngineConfig;
import work.agentflow.engine.runtime.RunContext;
import work.agentflow.engine.runtime.Sleeper;
import work.agentflow.engine.runtime.WorkflowLoader;
import work.agentflow.engine.shared.WorkflowConfigException;
import work.agentflow.engine.shared.WorkspacePaths;
import work.agentflow.engine.state.RunState;
import work.agentflow.engine.state.RunStateStore;
import work.agentflow.engine.state.RunStatus;

/**
 * Public entry point for embedding the engine: {@code run(workflow, context)} and
 * {@code resume(runId)}. Every call builds its own run-scoped collaborators.
 */
public final class WorkflowRunner {
    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final Path workspace;
    private final EngineConfig config;
    private final ProcessRunner processRunner;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, String> environment;
    private final CancellationToken cancellationToken;

    private WorkflowRunner(Builder builder) {
        this.workspace = Objects.requireNonNull(builder.workspace, "workspace").toAbsolutePath().normalize();
        this.config = builder.config == null ? EngineConfig.load(workspace, null) : builder.config;
        this.processRunner = builder.processRunner == null ? new DefaultProcessRunner() : builder.processRunner;
        this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
        this.sleeper = builder.sleeper == null ? Sleeper.SYSTEM : builder.sleeper;
        this.environment = builder.environment == null ? System.getenv() : Map.copyOf(builder.environment);
        this.cancellationToken = builder.cancellationToken == null ? new CancellationToken() : builder.cancellationToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RunStateStore store() {
        return new RunStateStore(workspace.resolve(config.stateDir()), config.stateBackups());
    }

    public RunResult run(Path workflowFile, Map<String, Object> initialContext) {
        return run(WorkflowLoader.load(workflowFile), initialContext);
    }

    /**
     * Starts a new run. The workflow's own context is overlaid with {@code initialContext}.
     */
    public RunResult run(Workflow workflow, Map<String, Object> initialContext) {
        var store = store();
        var started = clock.instant();
        var context = new LinkedHashMap<String, Object>(workflow.context());
        if (initialContext != null) {
            context.putAll(initialContext);
        }
        var source = workflow.source() == null ? null : workflow.source().toAbsolutePath().toString();
        var state = RunState.create(RunStateStore.newRunId(started), workflow.name(), source, workflow.checksum(), context, started);
        store.create(state);
        log.info("Created run {} in {}", state.runId(), store.runDir(state.runId()));
        try (var lock = store.lock(state.runId(), config.lockStaleAfter())) {
            return execute(workflow, store, state, false, started);
        }
    }

    /**
     * Resumes a run with the workflow file recorded in its state.
     */
    public RunResult resume(String runId) {
        return resume(runId, false);
    }

    public RunResult resume(String runId, boolean force) {
        var state = store().load(runId);
        if (state.workflowPath() == null) {
            throw new WorkflowConfigException("Run " + runId + " does not record a workflow file; resume it with an explicit workflow");
        }
        return resume(WorkflowLoader.load(Path.of(state.workflowPath())), runId, force);
    }

    /**
     * Continues a stopped run from its recorded current step. Completed runs are returned as they are;
     * a workflow whose checksum changed since the run started is refused unless {@code force} is set.
     */
    public RunResult resume(Workflow workflow, String runId, boolean force) {
        var store = store();
        var started = clock.instant();
        try (var lock = store.lock(runId, config.lockStaleAfter())) {
            var state = store.load(runId);
            if (state.status() == RunStatus.COMPLETED) {
                log.info("Run {} already completed; nothing to resume", runId);
                var outcome = new RunOutcome(runId, RunStatus.COMPLETED, RunOutcome.EXIT_COMPLETED, null);
                return RunResult.from(outcome, store.stateFile(runId), started, clock.instant());
            }
            if (!Objects.equals(workflow.checksum(), state.workflowChecksum())) {
                if (!force) {
                    throw new WorkflowConfigException("Workflow changed since run " + runId + " started (checksum mismatch); use --force to resume anyway");
                }
                log.warn("Resuming run {} with a modified workflow", runId);
            }
            store.clearCancel(runId);
            state.status(RunStatus.RUNNING, started);
            state.error(null);
            store.save(state);
            return execute(workflow, store, state, true, started);
        }
    }

    /**
     * Asks a running run to stop by writing its {@code CANCEL} marker.
     */
    public void cancel(String runId) {
        store().requestCancel(runId);
        log.info("Cancellation requested for run {}", runId);
    }

    private RunResult execute(Workflow workflow, RunStateStore store, RunState state, boolean resuming, Instant started) {
        var paths = new WorkspacePaths(workspace);
        var secrets = new SecretsPolicy(workflow, environment);
        var globs = new GlobMatcher(paths);
        var commands = new CommandBuilder(workflow, paths, new DependencyResolver(globs), new PromptComposer(paths, config.contentInjectionLimitBytes()));
        var executor = new StepExecutor(config, paths, processRunner, sleeper, commands, secrets, clock);
        var conditions = new ConditionEvaluator(paths, secrets.parentEnvironment());
        var ctx = new RunContext(workflow, config, paths, store, state, executor, conditions, globs, cancellationToken, clock, sleeper, resuming);
        var outcome = new WorkflowEngine(ctx).execute();
        return RunResult.from(outcome, store.stateFile(state.runId()), started, clock.instant());
    }

    public static final class Builder {
        private Path workspace;
        private EngineConfig config;
        private ProcessRunner processRunner;
        private Clock clock;
        private Sleeper sleeper;
        private Map<String, String> environment;
        private CancellationToken cancellationToken;

        public Builder workspace(Path workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder processRunner(ProcessRunner processRunner) {
            this.processRunner = processRunner;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public WorkflowRunner build() {
            return new WorkflowRunner(this);
        }
    }
}
