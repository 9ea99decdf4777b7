package work.agentflow.engine.exec;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.output.CapturedOutput;
import work.agentflow.engine.output.OutputProcessor;
import work.agentflow.engine.runtime.CancellationToken;
import work.agentflow.engine.runtime.EngineConfig;
import work.agentflow.engine.runtime.Sleeper;
import work.agentflow.engine.shared.DurationParser;
import work.agentflow.engine.shared.EngineException;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.shared.OutputParseException;
import work.agentflow.engine.shared.WorkspacePaths;
import work.agentflow.engine.state.ErrorInfo;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.variables.VariableResolver;

/**
 * Runs command and provider steps: builds argv, spawns the process with the step's environment and
 * timeout, retries retryable outcomes and normalises stdout. Failures never escape as exceptions; they
 * are recorded on the returned {@link StepResult}.
 */
public final class StepExecutor {
    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);
    private static final int STDERR_EXCERPT = 2000;
    /** Provider shim exit code for input it refuses to process. */
    private static final int PROVIDER_INVALID_INPUT = 2;

    private final EngineConfig config;
    private final WorkspacePaths workspace;
    private final ProcessRunner runner;
    private final Sleeper sleeper;
    private final CommandBuilder commands;
    private final SecretsPolicy secrets;
    private final SecretMasker masker;
    private final OutputProcessor outputs;
    private final Clock clock;

    public StepExecutor(
        EngineConfig config,
        WorkspacePaths workspace,
        ProcessRunner runner,
        Sleeper sleeper,
        CommandBuilder commands,
        SecretsPolicy secrets,
        Clock clock
    ) {
        this.config = config;
        this.workspace = workspace;
        this.runner = runner;
        this.sleeper = sleeper;
        this.commands = commands;
        this.secrets = secrets;
        this.masker = secrets.masker();
        this.outputs = new OutputProcessor(config.textLimitBytes(), config.bufferLimitBytes(), config.maxLines());
        this.clock = clock;
    }

    public SecretMasker masker() {
        return masker;
    }

    /**
     * @param stepKey  unique key of this execution (includes loop iteration path), used for log files
     * @param logsDir  directory receiving spilled stdout
     */
    public StepResult execute(Step step, VariableResolver resolver, String stepKey, Path logsDir, CancellationToken token) {
        var started = clock.instant();
        PreparedCommand command;
        Map<String, String> environment;
        Path outputTarget;
        try {
            command = commands.build(step, resolver);
            environment = secrets.environment(step, resolveEnvironment(step, resolver));
            outputTarget = step.output().outputFile() == null
                ? null
                : workspace.resolve(resolver.resolve(step.output().outputFile(), "output_file"));
        } catch (EngineException ex) {
            log.warn("Step {} failed before execution: {}", stepKey, masker.mask(ex.getMessage()));
            return StepResult.failure(StepStatus.FAILED, maskedError(ex), started, clock.instant());
        }
        var display = String.join(" ", masker.mask(command.argv()));
        log.debug("Step {} argv: {}", stepKey, display);
        var timeout = step.timeout() != null ? step.timeout() : config.defaultTimeout();
        var policy = step.retry();
        var spillTarget = logsDir.resolve(stepKey + ".stdout");
        var request = new ProcessRequest(
            command.argv(),
            workspace.root(),
            environment,
            command.stdin(),
            timeout,
            config.killGrace(),
            spillTarget,
            config.bufferLimitBytes()
        );
        for (var attempt = 1; ; attempt++) {
            log.info("Step {} attempt {}/{}", stepKey, attempt, policy.maxAttempts());
            ProcessOutcome outcome;
            try {
                outcome = runner.run(request);
            } catch (EngineException ex) {
                log.warn("Step {} could not start: {}", stepKey, masker.mask(ex.getMessage()));
                return StepResult.failure(StepStatus.FAILED, maskedError(ex), started, clock.instant()).withAttempts(attempt).withInjection(command.injection());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return cancelled(started, attempt);
            }
            if (!outcome.timedOut() && outcome.exitCode() == 0) {
                return completed(step, stepKey, outcome, outputTarget, spillTarget, command, attempt, started);
            }
            var timedOut = isTimeout(step, outcome);
            var retryable = timedOut ? policy.retryOnTimeout() : policy.isRetryableExit(outcome.exitCode());
            if (retryable && attempt < policy.maxAttempts() && !token.isCancelled()) {
                var delay = policy.delayBefore(attempt + 1);
                log.warn("Step {} attempt {} {} (exit {}); retrying in {}", stepKey, attempt, timedOut ? "timed out" : "failed", outcome.exitCode(), DurationParser.format(delay));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return cancelled(started, attempt);
                }
                continue;
            }
            return failed(step, stepKey, outcome, spillTarget, command, display, attempt, started);
        }
    }

    private Map<String, String> resolveEnvironment(Step step, VariableResolver resolver) {
        var resolved = new LinkedHashMap<String, String>();
        for (var entry : step.env().entrySet()) {
            resolved.put(entry.getKey(), resolver.resolve(entry.getValue(), "env"));
        }
        return resolved;
    }

    private StepResult completed(Step step, String stepKey, ProcessOutcome outcome, Path outputTarget, Path spillTarget, PreparedCommand command, int attempt, Instant started) {
        CapturedOutput captured;
        try {
            captured = outputs.process(outcome.stdout(), step.output(), spillTarget);
            if (outputTarget != null) {
                OutputProcessor.writeFull(outcome.stdout(), outputTarget);
            }
        } catch (OutputParseException ex) {
            log.warn("Step {} output rejected: {}", stepKey, ex.getMessage());
            return StepResult.failure(StepStatus.FAILED, maskedError(ex), started, clock.instant())
                .withExitCode(0)
                .withAttempts(attempt)
                .withInjection(command.injection());
        } catch (IOException ex) {
            var error = new ErrorInfo(ErrorKind.EXECUTION.code(), "Unable to write output_file: " + ex.getMessage(), Map.of("path", workspace.relativize(outputTarget)));
            return StepResult.failure(StepStatus.FAILED, error, started, clock.instant()).withExitCode(0).withAttempts(attempt);
        }
        var finished = clock.instant();
        log.info("Step {} completed in {} ms", stepKey, finished.toEpochMilli() - started.toEpochMilli());
        return result(StepStatus.COMPLETED, 0, captured, attempt, command, null).finishedAt(started, finished);
    }

    private StepResult failed(Step step, String stepKey, ProcessOutcome outcome, Path spillTarget, PreparedCommand command, String display, int attempt, Instant started) {
        var timedOut = isTimeout(step, outcome);
        var details = new LinkedHashMap<String, Object>();
        details.put("exit_code", outcome.exitCode());
        details.put("command", display);
        var stderr = masker.mask(tail(outcome.stderr()));
        if (!stderr.isBlank()) {
            details.put("stderr", stderr);
        }
        String message;
        if (timedOut) {
            message = outcome.timedOut() ? "Process timed out after " + outcome.durationMs() + " ms" : "Provider reported a timeout";
        } else if (step.action() instanceof StepAction.Provider && outcome.exitCode() == PROVIDER_INVALID_INPUT) {
            message = "Provider rejected its input (exit " + PROVIDER_INVALID_INPUT + ")";
        } else {
            message = "Process exited with code " + outcome.exitCode();
        }
        var error = new ErrorInfo((timedOut ? ErrorKind.TIMEOUT : ErrorKind.EXECUTION).code(), message, details);
        var captured = outputs.text(outcome.stdout(), spillTarget);
        var finished = clock.instant();
        log.warn("Step {} failed after {} attempt(s): {}", stepKey, attempt, message);
        return result(timedOut ? StepStatus.TIMEOUT : StepStatus.FAILED, outcome.exitCode(), captured, attempt, command, error).finishedAt(started, finished);
    }

    private StepResult cancelled(Instant started, int attempt) {
        return StepResult.failure(StepStatus.CANCELLED, ErrorInfo.of(ErrorKind.CANCELLED, "Step interrupted"), started, clock.instant()).withAttempts(attempt);
    }

    private static StepResult result(StepStatus status, int exitCode, CapturedOutput captured, int attempts, PreparedCommand command, ErrorInfo error) {
        return new StepResult(
            status,
            exitCode,
            captured.text(),
            captured.lines(),
            captured.json(),
            captured.truncated(),
            captured.parseError(),
            captured.spillPath(),
            captured.totalBytes(),
            0L,
            attempts,
            null,
            null,
            command.injection(),
            error
        );
    }

    private static boolean isTimeout(Step step, ProcessOutcome outcome) {
        return outcome.timedOut() || (step.action() instanceof StepAction.Provider && outcome.exitCode() == ProcessRunner.TIMEOUT_EXIT_CODE);
    }

    public ErrorInfo maskedError(EngineException ex) {
        return new ErrorInfo(ex.kind().code(), masker.mask(ex.getMessage()), masker.maskDetails(ex.details()));
    }

    private static String tail(String text) {
        return text.length() <= STDERR_EXCERPT ? text : text.substring(text.length() - STDERR_EXCERPT);
    }
}
