package work.agentflow.engine.model;

import java.util.Optional;

/**
 * The {@code on} block of a step. Any entry may be absent.
 */
public record Transitions(Transition success, Transition failure, Transition always) {
    private static final Transitions NONE = new Transitions(null, null, null);

    public static Transitions none() {
        return NONE;
    }

    public boolean isEmpty() {
        return success == null && failure == null && always == null;
    }

    public Optional<Transition> forSuccess() {
        return Optional.ofNullable(success != null ? success : always);
    }

    public Optional<Transition> forFailure() {
        return Optional.ofNullable(failure != null ? failure : always);
    }
}
