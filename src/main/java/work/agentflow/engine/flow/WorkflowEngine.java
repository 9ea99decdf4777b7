package work.agentflow.engine.flow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.engine.runtime.RunContext;
import work.agentflow.engine.state.RunStatus;
import work.agentflow.engine.state.StepStatus;

/**
 * Top-level driver of one run. Top-level steps run sequentially on the calling thread; the state is
 * persisted after every step attempt and once more with the final status.
 */
public final class WorkflowEngine {
    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final RunContext ctx;

    public WorkflowEngine(RunContext ctx) {
        this.ctx = ctx;
    }

    public RunOutcome execute() {
        var state = ctx.state();
        var steps = ctx.workflow().steps();
        var start = 0;
        if (ctx.resuming() && state.currentStep() != null) {
            start = steps.indexOf(state.currentStep()).orElse(0);
            log.info("Resuming run {} at step {}", state.runId(), steps.isEmpty() ? "-" : steps.get(start).name());
        } else {
            log.info("Starting run {} of workflow {}", state.runId(), ctx.workflow().name());
        }
        RunOutcome outcome;
        try {
            outcome = toOutcome(new SequenceRunner(ctx).run(steps, Frame.top(), start));
        } catch (RuntimeException ex) {
            log.error("Run {} aborted: {}", state.runId(), ctx.executor().masker().mask(String.valueOf(ex.getMessage())), ex);
            outcome = new RunOutcome(state.runId(), RunStatus.ERROR, RunOutcome.EXIT_ERROR, ctx.executor().masker().mask(String.valueOf(ex.getMessage())));
        }
        state.status(outcome.status(), ctx.now());
        state.error(outcome.message());
        try {
            ctx.persist();
        } catch (RuntimeException ex) {
            log.error("Could not persist final state of run {}", state.runId(), ex);
        }
        log.info("Run {} finished with status {} (exit {})", state.runId(), outcome.status().key(), outcome.exitCode());
        return outcome;
    }

    private RunOutcome toOutcome(SequenceOutcome outcome) {
        var runId = ctx.state().runId();
        return switch (outcome.kind()) {
            case COMPLETED, END -> new RunOutcome(runId, RunStatus.COMPLETED, RunOutcome.EXIT_COMPLETED, null);
            case CANCELLED -> new RunOutcome(runId, RunStatus.CANCELLED, RunOutcome.EXIT_CANCELLED, outcome.message());
            case ERROR -> new RunOutcome(runId, RunStatus.FAILED, RunOutcome.EXIT_ERROR, outcome.message());
            case HALTED -> {
                var timedOut = outcome.result() != null && outcome.result().status() == StepStatus.TIMEOUT;
                yield new RunOutcome(runId, RunStatus.FAILED, timedOut ? RunOutcome.EXIT_TIMEOUT : RunOutcome.EXIT_HALTED, outcome.message());
            }
            case SIGNAL -> throw new IllegalStateException("Loop signal " + outcome.signal() + " escaped the top level at step " + outcome.step());
        };
    }
}
