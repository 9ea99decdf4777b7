package work.agentflow.engine.flow;

import work.agentflow.engine.state.StepResult;

/**
 * How a step list stopped running.
 *
 * @param step    the step that decided the outcome, {@code null} when the list simply ran out
 * @param failed  true when a failure was not handled by a transition that reached the end normally
 */
public record SequenceOutcome(Kind kind, FlowSignal signal, String step, StepResult result, String message, boolean failed) {

    public enum Kind {
        /** Ran past the last step. */
        COMPLETED,
        /** {@code _end} or {@code end: true}. */
        END,
        /** {@code _error} or {@code error: msg}. */
        ERROR,
        /** Strict flow stopped on a failure without a transition. */
        HALTED,
        CANCELLED,
        /** Loop control: see {@link #signal()}. */
        SIGNAL
    }

    static SequenceOutcome completed(boolean failed) {
        return new SequenceOutcome(Kind.COMPLETED, null, null, null, null, failed);
    }

    static SequenceOutcome end(String step, boolean failed) {
        return new SequenceOutcome(Kind.END, null, step, null, null, failed);
    }

    static SequenceOutcome error(String step, StepResult result, String message) {
        return new SequenceOutcome(Kind.ERROR, null, step, result, message, true);
    }

    static SequenceOutcome halted(String step, StepResult result) {
        return new SequenceOutcome(Kind.HALTED, null, step, result, "Step '" + step + "' failed and defines no failure transition", true);
    }

    static SequenceOutcome cancelled(String step) {
        return new SequenceOutcome(Kind.CANCELLED, null, step, null, "Run cancelled", false);
    }

    static SequenceOutcome signal(FlowSignal signal, String step, boolean failed) {
        return new SequenceOutcome(Kind.SIGNAL, signal, step, null, null, failed);
    }

    public boolean isSignal(FlowSignal expected) {
        return kind == Kind.SIGNAL && signal == expected;
    }
}
