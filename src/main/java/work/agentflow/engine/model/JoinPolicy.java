package work.agentflow.engine.model;

import java.util.Locale;

/**
 * When a parallel for_each is considered done.
 */
public enum JoinPolicy {
    ALL,
    ANY,
    MAJORITY;

    public static JoinPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return JoinPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported join policy: " + value);
        }
    }

    /**
     * Returns true once enough iterations succeeded for the loop to stop waiting.
     */
    public boolean satisfied(int succeeded, int total) {
        return switch (this) {
            case ALL -> succeeded == total;
            case ANY -> succeeded >= 1;
            case MAJORITY -> succeeded * 2 > total;
        };
    }
}
