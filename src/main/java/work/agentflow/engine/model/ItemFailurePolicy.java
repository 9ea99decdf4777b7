package work.agentflow.engine.model;

import java.util.Locale;

/**
 * What a for_each does after an iteration fails: {@code STOP} skips the remaining items and fails the
 * loop, {@code CONTINUE} runs every item and fails the loop if any failed, {@code IGNORE} runs every
 * item and always succeeds.
 */
public enum ItemFailurePolicy {
    STOP,
    CONTINUE,
    IGNORE;

    public static ItemFailurePolicy from(String value) {
        if (value == null || value.isBlank()) {
            return STOP;
        }
        try {
            return ItemFailurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported on_item_failure policy: " + value);
        }
    }
}
