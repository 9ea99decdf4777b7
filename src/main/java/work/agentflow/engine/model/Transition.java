package work.agentflow.engine.model;

import java.util.Objects;

/**
 * Target of an {@code on.success|failure|always} entry. Reserved goto targets are normalised into
 * their own {@link Type} at load time.
 */
public record Transition(Type type, String target, String message) {
    public static final String START = "_start";
    public static final String END = "_end";
    public static final String ERROR = "_error";
    public static final String LOOP_BREAK = "_loop_break";
    public static final String LOOP_CONTINUE = "_loop_continue";

    public Transition {
        Objects.requireNonNull(type, "type");
        if (type == Type.GOTO && (target == null || target.isBlank())) {
            throw new IllegalArgumentException("goto requires a target");
        }
    }

    public static Transition goTo(String target) {
        return switch (target) {
            case START -> new Transition(Type.START, null, null);
            case END -> end();
            case ERROR -> error(null);
            case LOOP_BREAK -> new Transition(Type.LOOP_BREAK, null, null);
            case LOOP_CONTINUE -> new Transition(Type.LOOP_CONTINUE, null, null);
            default -> new Transition(Type.GOTO, target, null);
        };
    }

    public static Transition end() {
        return new Transition(Type.END, null, null);
    }

    public static Transition error(String message) {
        return new Transition(Type.ERROR, null, message);
    }

    public static boolean isReserved(String target) {
        return target != null && target.startsWith("_");
    }

    public enum Type {
        GOTO,
        START,
        END,
        ERROR,
        LOOP_BREAK,
        LOOP_CONTINUE
    }
}
