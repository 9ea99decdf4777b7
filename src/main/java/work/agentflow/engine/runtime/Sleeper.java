package work.agentflow.engine.runtime;

import java.time.Duration;

/**
 * Blocking pause used for retry backoff, while-loop delays and wait_for polling.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
