package work.agentflow.engine.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Bounded retry of retryable outcomes (timeouts and a declared set of exit codes).
 */
public record RetryPolicy(int maxAttempts, Backoff backoff, Duration delay, Set<Integer> retryOnExitCodes, boolean retryOnTimeout) {
    /** Provider shim contract: 1 is a retryable error, 124 a retryable timeout. */
    public static final Set<Integer> DEFAULT_RETRYABLE_EXIT_CODES = Set.of(1, 124);
    private static final Duration MAX_DELAY = Duration.ofMinutes(5);
    private static final RetryPolicy NONE = new RetryPolicy(1, Backoff.FIXED, Duration.ZERO, DEFAULT_RETRYABLE_EXIT_CODES, true);

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        backoff = backoff == null ? Backoff.FIXED : backoff;
        delay = delay == null ? Duration.ZERO : delay;
        retryOnExitCodes = retryOnExitCodes == null ? DEFAULT_RETRYABLE_EXIT_CODES : Set.copyOf(retryOnExitCodes);
    }

    public static RetryPolicy none() {
        return NONE;
    }

    public boolean isRetryableExit(int exitCode) {
        return exitCode != 0 && retryOnExitCodes.contains(exitCode);
    }

    /**
     * Delay before attempt number {@code nextAttempt} (2 for the first retry).
     */
    public Duration delayBefore(int nextAttempt) {
        if (backoff == Backoff.FIXED || nextAttempt <= 2) {
            return delay;
        }
        var factor = 1L << Math.min(20, nextAttempt - 2);
        var millis = delay.toMillis() * factor;
        return millis > MAX_DELAY.toMillis() || millis < 0 ? MAX_DELAY : Duration.ofMillis(millis);
    }

    public enum Backoff {
        FIXED,
        EXPONENTIAL;

        public static Backoff from(String value) {
            if (value == null || value.isBlank()) {
                return FIXED;
            }
            try {
                return Backoff.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported backoff: " + value);
            }
        }
    }
}
