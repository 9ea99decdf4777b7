package work.agentflow.engine.flow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.model.Step;
import work.agentflow.engine.model.StepAction;
import work.agentflow.engine.model.StepList;
import work.agentflow.engine.model.Transition;
import work.agentflow.engine.runtime.RunContext;
import work.agentflow.engine.shared.EngineException;
import work.agentflow.engine.shared.RunawayException;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;

/**
 * Runs one step list: {@code when} gating, dispatch on the step kind, result recording and routing
 * through {@code on} transitions. Used for the top level and for every loop iteration.
 */
final class SequenceRunner {
    private static final Logger log = LoggerFactory.getLogger(SequenceRunner.class);

    private final RunContext ctx;
    private final ForEachRunner forEach;
    private final WhileRunner whileLoop;
    private final WaitForRunner waitFor;

    SequenceRunner(RunContext ctx) {
        this.ctx = ctx;
        this.forEach = new ForEachRunner(ctx, this);
        this.whileLoop = new WhileRunner(ctx, this);
        this.waitFor = new WaitForRunner(ctx);
    }

    SequenceOutcome run(StepList steps, Frame frame, int start) {
        var index = start;
        var failed = false;
        while (index < steps.size()) {
            var step = steps.get(index);
            if (ctx.cancelRequested()) {
                return SequenceOutcome.cancelled(step.name());
            }
            var result = reusableResult(step, frame);
            if (result == null) {
                if (frame.isTop()) {
                    ctx.backup();
                    ctx.state().currentStep(step.name());
                }
                result = runStep(step, frame);
                if (result.status() == StepStatus.SKIPPED) {
                    finishTopLevel(frame);
                    index++;
                    continue;
                }
            }
            finishTopLevel(frame);
            if (result.status() == StepStatus.CANCELLED) {
                return SequenceOutcome.cancelled(step.name());
            }
            var success = result.isSuccess();
            var transition = success ? step.on().forSuccess() : step.on().forFailure();
            if (transition.isEmpty()) {
                if (!success) {
                    if (ctx.workflow().strictFlow()) {
                        log.error("Step {} failed with status {} and no failure transition; halting", frame.key(step), result.status().key());
                        return SequenceOutcome.halted(step.name(), result);
                    }
                    log.warn("Step {} failed; continuing with the next step", frame.key(step));
                    failed = true;
                }
                index++;
                continue;
            }
            var target = transition.get();
            switch (target.type()) {
                case GOTO -> index = steps.indexOf(target.target()).orElseThrow();
                case START -> index = 0;
                case END -> {
                    return SequenceOutcome.end(step.name(), failed || !success);
                }
                case ERROR -> {
                    var message = target.message() != null ? target.message() : "Step '" + step.name() + "' routed to " + Transition.ERROR;
                    return SequenceOutcome.error(step.name(), result, message);
                }
                case LOOP_BREAK -> {
                    return SequenceOutcome.signal(FlowSignal.BREAK, step.name(), failed || !success);
                }
                case LOOP_CONTINUE -> {
                    return SequenceOutcome.signal(FlowSignal.CONTINUE, step.name(), failed || !success);
                }
            }
            log.debug("Step {} routed to {}", frame.key(step), target.type() == Transition.Type.GOTO ? target.target() : Transition.START);
        }
        return SequenceOutcome.completed(failed);
    }

    /**
     * Runs a loop body in its own frame and publishes the final iteration record.
     */
    IterationResult runIteration(StepList body, Frame frame) {
        var outcome = run(body, frame, 0);
        var record = frame.publish(ctx, classify(outcome));
        return new IterationResult(record, outcome);
    }

    /**
     * An iteration fails when it halted, hit {@code _error}, let a failure fall through, or left the
     * body through a failure transition. A failure routed by {@code goto} that then finishes the body
     * normally counts as completed.
     */
    static StepStatus classify(SequenceOutcome outcome) {
        return switch (outcome.kind()) {
            case CANCELLED -> StepStatus.CANCELLED;
            case HALTED, ERROR -> StepStatus.FAILED;
            case COMPLETED, END, SIGNAL -> outcome.failed() ? StepStatus.FAILED : StepStatus.COMPLETED;
        };
    }

    private StepResult reusableResult(Step step, Frame frame) {
        if (!frame.isTop() || !ctx.resuming()) {
            return null;
        }
        var previous = ctx.state().step(step.name());
        if (previous != null && previous.status() == StepStatus.COMPLETED) {
            log.info("Step {} already completed; reusing its result", step.name());
            return previous;
        }
        return null;
    }

    private void finishTopLevel(Frame frame) {
        if (frame.isTop()) {
            ctx.resumeFinished();
        }
    }

    private StepResult runStep(Step step, Frame frame) {
        if (step.when() != null) {
            boolean proceed;
            try {
                proceed = ctx.conditions().evaluate(step.when(), ctx.resolver(frame.scope(ctx), step), "when");
            } catch (EngineException ex) {
                log.warn("Step {} condition failed: {}", frame.key(step), ctx.executor().masker().mask(ex.getMessage()));
                var now = ctx.now();
                var failure = StepResult.failure(StepStatus.FAILED, ctx.executor().maskedError(ex), now, now);
                frame.record(ctx, step, failure);
                return failure;
            }
            if (!proceed) {
                log.info("Step {} skipped: condition is false", frame.key(step));
                var skipped = StepResult.skipped(ctx.now());
                frame.record(ctx, step, skipped);
                return skipped;
            }
        }
        ctx.countExecution();
        return execute(step, frame);
    }

    private StepResult execute(Step step, Frame frame) {
        var started = ctx.now();
        frame.record(ctx, step, StepResult.running(started));
        StepResult result;
        try {
            var resolver = ctx.resolver(frame.scope(ctx), step);
            var action = step.action();
            if (action instanceof StepAction.ForEach loop) {
                result = forEach.run(step, loop, frame, resolver);
            } else if (action instanceof StepAction.While loop) {
                result = whileLoop.run(step, loop, frame, resolver);
            } else if (action instanceof StepAction.WaitFor wait) {
                result = waitFor.run(step, wait, frame, resolver);
            } else {
                result = ctx.executor().execute(step, resolver, frame.key(step), ctx.logsDir(), ctx.cancellationToken());
            }
        } catch (RunawayException ex) {
            throw ex;
        } catch (EngineException ex) {
            log.warn("Step {} failed: {}", frame.key(step), ctx.executor().masker().mask(ex.getMessage()));
            result = StepResult.failure(StepStatus.FAILED, ctx.executor().maskedError(ex), started, ctx.now());
        }
        frame.record(ctx, step, result);
        log.info("Step {} finished: {}", frame.key(step), result.status().key());
        return result;
    }
}
