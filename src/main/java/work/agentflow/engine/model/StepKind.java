package work.agentflow.engine.model;

import java.util.Locale;

public enum StepKind {
    COMMAND,
    PROVIDER,
    FOR_EACH,
    WHILE,
    WAIT_FOR;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
