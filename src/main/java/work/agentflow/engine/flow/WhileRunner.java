package work.agentflow.engine.flow;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.runtime.RunContext;
import work.agentflow.engine.shared.EngineException;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.state.ErrorInfo;
import work.agentflow.engine.state.LoopState;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.state.TerminationReason;
import work.agentflow.engine.variables.VariableResolver;

/**
 * Runs {@code while} steps. The condition is checked before every iteration against the results of
 * the previous iteration's body; the loop always ends with exactly one termination reason.
 */
final class WhileRunner {
    private static final Logger log = LoggerFactory.getLogger(WhileRunner.class);

    private final RunContext ctx;
    private final SequenceRunner sequence;

    WhileRunner(RunContext ctx, SequenceRunner sequence) {
        this.ctx = ctx;
        this.sequence = sequence;
    }

    StepResult run(Step step, StepAction.While loop, Frame frame, VariableResolver resolver) {
        var started = ctx.now();
        var loopKey = frame.key(step);
        ctx.state().putLoop(loopKey, LoopState.whileLoop());
        ctx.persist();

        TerminationReason reason = null;
        ErrorInfo error = null;
        var iterations = 0;
        var completed = 0;
        var failed = 0;
        Map<String, StepResult> previous = Map.of();
        while (reason == null) {
            if (ctx.cancelRequested()) {
                reason = TerminationReason.CANCELLED;
                break;
            }
            if (iterations >= loop.maxIterations()) {
                reason = TerminationReason.MAX_ITERATIONS;
                break;
            }
            var now = ctx.now();
            if (loop.maxDuration() != null && Duration.between(started, now).compareTo(loop.maxDuration()) >= 0) {
                reason = TerminationReason.TIMEOUT;
                break;
            }
            var loopVars = LoopSupport.loopVars(iterations, null, started, now);
            loopVars.put("max_iterations", loop.maxIterations());
            var scope = frame.scope(ctx).withLoop(null, null, loopVars).withSteps(previous);
            try {
                if (!ctx.conditions().evaluate(loop.condition(), resolver.withScope(scope), "condition")) {
                    reason = TerminationReason.CONDITION_FALSE;
                    break;
                }
            } catch (EngineException ex) {
                log.warn("Loop {} condition failed: {}", loopKey, ex.getMessage());
                error = ctx.executor().maskedError(ex);
                reason = TerminationReason.EXPLICIT_BREAK;
                break;
            }

            var result = sequence.runIteration(loop.body(), frame.iteration(loopKey, iterations, null, null, loopVars, now));
            iterations++;
            previous = result.record().steps();
            if (result.record().status() == StepStatus.COMPLETED) {
                completed++;
            } else {
                failed++;
            }
            var outcome = result.outcome();
            if (outcome.kind() == SequenceOutcome.Kind.CANCELLED) {
                reason = TerminationReason.CANCELLED;
            } else if (outcome.isSignal(FlowSignal.BREAK)) {
                reason = TerminationReason.EXPLICIT_BREAK;
            } else if (outcome.kind() == SequenceOutcome.Kind.HALTED || outcome.kind() == SequenceOutcome.Kind.ERROR) {
                reason = TerminationReason.EXPLICIT_BREAK;
                var message = outcome.message() != null ? outcome.message() : "Iteration " + (iterations - 1) + " failed";
                error = new ErrorInfo(ErrorKind.EXECUTION.code(), message, null);
            } else if (iterations < loop.maxIterations() && !loop.delay().isZero() && !ctx.pause(loop.delay())) {
                reason = TerminationReason.CANCELLED;
            }
        }

        var finished = ctx.now();
        ctx.state().terminateLoop(loopKey, reason);
        var summary = new LinkedHashMap<String, Object>();
        summary.put("iterations", iterations);
        summary.put("completed", completed);
        summary.put("failed", failed);
        summary.put("termination_reason", reason.key());
        summary.put("duration_ms", Math.max(0L, finished.toEpochMilli() - started.toEpochMilli()));
        ctx.state().loopSummary(loopKey, summary);
        log.info("Loop {} stopped after {} iteration(s): {}", loopKey, iterations, reason.key());

        StepStatus status;
        if (reason == TerminationReason.CANCELLED) {
            status = StepStatus.CANCELLED;
        } else if (error != null) {
            status = StepStatus.FAILED;
        } else {
            status = StepStatus.COMPLETED;
        }
        if (status == StepStatus.CANCELLED) {
            error = ErrorInfo.of(ErrorKind.CANCELLED, "Loop cancelled");
        }
        return LoopSupport.loopResult(status, summary, error, started, finished);
    }
}
