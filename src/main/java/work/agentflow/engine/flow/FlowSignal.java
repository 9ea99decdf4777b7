package work.agentflow.engine.flow;

/**
 * Loop-control signals raised by {@code _loop_continue} and {@code _loop_break} targets.
 */
public enum FlowSignal {
    CONTINUE,
    BREAK
}
