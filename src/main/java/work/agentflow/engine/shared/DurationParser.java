package work.agentflow.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Small helper to parse user-friendly durations (e.g. {@code 500ms}, {@code 30s}, {@code 2m}, {@code 5h}).
 * Bare numbers are milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        try {
            long value = Long.parseLong(trimmed.trim());
            if (value < 0) {
                throw new WorkflowConfigException("Duration must not be negative: " + raw);
            }
            return Optional.of(Duration.ofMillis(value * multiplier));
        } catch (NumberFormatException ex) {
            throw new WorkflowConfigException("Invalid duration: " + raw, ex);
        }
    }

    /** Renders a duration in the largest unit that divides it exactly, e.g. {@code 90s}, {@code 2m}. */
    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 3_600_000L == 0 && millis > 0) {
            return millis / 3_600_000L + "h";
        }
        if (millis % 60_000L == 0 && millis > 0) {
            return millis / 60_000L + "m";
        }
        if (millis % 1_000L == 0 && millis > 0) {
            return millis / 1_000L + "s";
        }
        return millis + "ms";
    }
}
